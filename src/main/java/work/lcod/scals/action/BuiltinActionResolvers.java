package work.lcod.scals.action;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import work.lcod.scals.document.DocumentAction;
import work.lcod.scals.state.JsonValue;
import work.lcod.scals.state.JsonValues;

/**
 * Parameter resolution for the built-in action kinds.
 */
public final class BuiltinActionResolvers {
    private BuiltinActionResolvers() {}

    public static ActionResolver register(ActionResolver resolver) {
        resolver.register("dismiss", action -> new ActionDefinition(ActionKind.DISMISS, new ActionParameters.Dismiss()));
        resolver.register("setState", BuiltinActionResolvers::setState);
        resolver.register("toggleState", BuiltinActionResolvers::toggleState);
        resolver.register("showAlert", BuiltinActionResolvers::showAlert);
        resolver.register("navigate", BuiltinActionResolvers::navigate);
        resolver.register("openURL", action ->
            new ActionDefinition(ActionKind.OPEN_URL, new ActionParameters.OpenUrl(requireString(action, "url"))));
        resolver.register("sequence", BuiltinActionResolvers::sequence);
        resolver.register("appendToArray", BuiltinActionResolvers::appendToArray);
        resolver.register("removeFromArray", BuiltinActionResolvers::removeFromArray);
        resolver.register("toggleInArray", BuiltinActionResolvers::toggleInArray);
        resolver.register("setArrayItem", BuiltinActionResolvers::setArrayItem);
        resolver.register("clearArray", BuiltinActionResolvers::clearArray);
        return resolver;
    }

    private static ActionDefinition setState(DocumentAction action) {
        return new ActionDefinition(ActionKind.SET_STATE,
            new ActionParameters.SetState(requireString(action, "path"), requireValue(action)));
    }

    private static ActionDefinition toggleState(DocumentAction action) {
        return new ActionDefinition(ActionKind.TOGGLE_STATE, new ActionParameters.ToggleState(requireString(action, "path")));
    }

    private static ActionDefinition showAlert(DocumentAction action) {
        var title = action.parameter("title").asString().orElse("Alert");
        String message = null;
        boolean template = false;
        var rawMessage = action.parameter("message");
        if (rawMessage instanceof JsonValue.StringValue text) {
            message = text.value();
        } else if (rawMessage instanceof JsonValue.ObjectValue object) {
            var templateText = object.get("template").asString().orElse(null);
            if ("binding".equals(object.get("type").asString().orElse(null)) && templateText != null) {
                message = templateText;
                template = true;
            } else {
                message = JsonValues.toJsonString(object);
            }
        }
        var buttons = new ArrayList<ActionParameters.AlertButton>();
        for (var item : action.parameter("buttons").asArray().orElse(List.of())) {
            if (!(item instanceof JsonValue.ObjectValue button)) {
                continue;
            }
            var label = button.get("label").asString().orElse(null);
            if (label == null) {
                continue;
            }
            buttons.add(new ActionParameters.AlertButton(
                label,
                ActionParameters.AlertButtonStyle.from(button.get("style").asString().orElse(null)),
                button.get("action").asString().orElse(null)
            ));
        }
        return new ActionDefinition(ActionKind.SHOW_ALERT, new ActionParameters.ShowAlert(title, message, template, buttons));
    }

    private static ActionDefinition navigate(DocumentAction action) {
        var presentation = ActionParameters.Presentation.from(action.parameter("presentation").asString().orElse(null));
        return new ActionDefinition(ActionKind.NAVIGATE,
            new ActionParameters.Navigate(requireString(action, "destination"), presentation));
    }

    private static ActionDefinition sequence(DocumentAction action) {
        var raw = action.parameter("steps");
        if (!(raw instanceof JsonValue.ArrayValue array)) {
            throw new ActionResolutionException(action.type(), "'steps' must be an array");
        }
        var steps = new ArrayList<DocumentAction>();
        for (int i = 0; i < array.size(); i++) {
            if (!(array.get(i) instanceof JsonValue.ObjectValue step) || step.get("type").asString().isEmpty()) {
                throw new ActionResolutionException(action.type(), "step " + i + " has no 'type'");
            }
            var parameters = new LinkedHashMap<>(step.fields());
            parameters.remove("type");
            steps.add(new DocumentAction(step.get("type").asString().get(), JsonValue.object(parameters)));
        }
        return new ActionDefinition(ActionKind.SEQUENCE, new ActionParameters.Sequence(steps));
    }

    private static ActionDefinition appendToArray(DocumentAction action) {
        return new ActionDefinition(ActionKind.APPEND_TO_ARRAY,
            new ActionParameters.AppendToArray(requireString(action, "path"), requireValue(action)));
    }

    private static ActionDefinition removeFromArray(DocumentAction action) {
        var path = requireString(action, "path");
        var index = action.parameter("index").asLong();
        if (index.isPresent()) {
            return new ActionDefinition(ActionKind.REMOVE_FROM_ARRAY,
                new ActionParameters.RemoveFromArray(path, toIndex(action, index.get()), null));
        }
        return new ActionDefinition(ActionKind.REMOVE_FROM_ARRAY,
            new ActionParameters.RemoveFromArray(path, null, requireValue(action)));
    }

    private static ActionDefinition toggleInArray(DocumentAction action) {
        return new ActionDefinition(ActionKind.TOGGLE_IN_ARRAY,
            new ActionParameters.ToggleInArray(requireString(action, "path"), requireValue(action)));
    }

    private static ActionDefinition setArrayItem(DocumentAction action) {
        var index = action.parameter("index").asLong()
            .orElseThrow(() -> new ActionResolutionException(action.type(), "integer parameter 'index' is required"));
        return new ActionDefinition(ActionKind.SET_ARRAY_ITEM,
            new ActionParameters.SetArrayItem(requireString(action, "path"), toIndex(action, index), requireValue(action)));
    }

    private static ActionDefinition clearArray(DocumentAction action) {
        return new ActionDefinition(ActionKind.CLEAR_ARRAY, new ActionParameters.ClearArray(requireString(action, "path")));
    }

    private static int toIndex(DocumentAction action, long index) {
        if (index < Integer.MIN_VALUE || index > Integer.MAX_VALUE) {
            throw new ActionResolutionException(action.type(), "index out of range: " + index);
        }
        return (int) index;
    }

    private static String requireString(DocumentAction action, String key) {
        return action.parameter(key).asString()
            .orElseThrow(() -> new ActionResolutionException(action.type(), "string parameter '" + key + "' is required"));
    }

    private static ParameterValue requireValue(DocumentAction action) {
        if (!action.parameters().fields().containsKey("value")) {
            throw new ActionResolutionException(action.type(), "parameter 'value' is required");
        }
        return ParameterValue.from(action.parameter("value"));
    }
}
