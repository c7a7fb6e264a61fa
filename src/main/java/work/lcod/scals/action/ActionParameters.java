package work.lcod.scals.action;

import java.util.List;
import java.util.Objects;
import work.lcod.scals.document.DocumentAction;
import work.lcod.scals.state.JsonValue;

/**
 * Typed parameter bags, one per built-in kind, plus {@link Custom} for everything else.
 */
public sealed interface ActionParameters
    permits ActionParameters.Dismiss, ActionParameters.SetState, ActionParameters.ToggleState,
        ActionParameters.ShowAlert, ActionParameters.Navigate, ActionParameters.OpenUrl, ActionParameters.Sequence,
        ActionParameters.AppendToArray, ActionParameters.RemoveFromArray, ActionParameters.ToggleInArray,
        ActionParameters.SetArrayItem, ActionParameters.ClearArray, ActionParameters.Custom {

    record Dismiss() implements ActionParameters {}

    record SetState(String path, ParameterValue value) implements ActionParameters {
        public SetState {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(value, "value");
        }
    }

    record ToggleState(String path) implements ActionParameters {
        public ToggleState {
            Objects.requireNonNull(path, "path");
        }
    }

    /**
     * @param message plain text, or a template interpolated when the alert is shown
     */
    record ShowAlert(String title, String message, boolean messageIsTemplate, List<AlertButton> buttons)
        implements ActionParameters {
        public ShowAlert {
            buttons = buttons == null ? List.of() : List.copyOf(buttons);
        }
    }

    record AlertButton(String label, AlertButtonStyle style, String action) {}

    enum AlertButtonStyle {
        DEFAULT, CANCEL, DESTRUCTIVE;

        public static AlertButtonStyle from(String value) {
            if ("cancel".equals(value)) return CANCEL;
            if ("destructive".equals(value)) return DESTRUCTIVE;
            return DEFAULT;
        }
    }

    record Navigate(String destination, Presentation presentation) implements ActionParameters {}

    record OpenUrl(String url) implements ActionParameters {
        public OpenUrl {
            Objects.requireNonNull(url, "url");
        }
    }

    enum Presentation {
        PUSH, PRESENT, FULL_SCREEN;

        public static Presentation from(String value) {
            if ("present".equals(value)) return PRESENT;
            if ("fullScreen".equals(value)) return FULL_SCREEN;
            return PUSH;
        }
    }

    /** Steps stay unresolved; each one is resolved right before it runs. */
    record Sequence(List<DocumentAction> steps) implements ActionParameters {
        public Sequence {
            steps = List.copyOf(steps);
        }
    }

    record AppendToArray(String path, ParameterValue value) implements ActionParameters {}

    /** Removes by {@code index} when set, otherwise every element equal to {@code value}. */
    record RemoveFromArray(String path, Integer index, ParameterValue value) implements ActionParameters {}

    record ToggleInArray(String path, ParameterValue value) implements ActionParameters {}

    record SetArrayItem(String path, int index, ParameterValue value) implements ActionParameters {}

    record ClearArray(String path) implements ActionParameters {}

    record Custom(JsonValue.ObjectValue raw) implements ActionParameters {
        public JsonValue get(String key) {
            return raw.get(key);
        }
    }
}
