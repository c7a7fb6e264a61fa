package work.lcod.scals.action;

import java.util.List;
import java.util.function.Consumer;

/**
 * Alert ready for presentation. {@code onButtonTap} receives the tapped button's action id, or
 * {@code null} for buttons without one.
 */
public record AlertConfiguration(
    String title,
    String message,
    List<ActionParameters.AlertButton> buttons,
    Consumer<String> onButtonTap
) {
    public AlertConfiguration {
        buttons = List.copyOf(buttons);
    }
}
