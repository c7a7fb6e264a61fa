package work.lcod.scals.action;

/**
 * Platform effects requested by the built-in actions. Supplied by the embedding application.
 */
public interface ActionPresenter {
    void dismiss();

    void presentAlert(AlertConfiguration alert);

    void navigate(String destination, ActionParameters.Presentation presentation);

    /** Hands {@code url} to the platform, for example the browser or another app. */
    void openUrl(String url);
}
