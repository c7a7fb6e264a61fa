package work.lcod.scals.ir;

public record ImageSource(Type type, String value) {
    public enum Type { SF_SYMBOL, ASSET, URL, STATE_PATH, ACTIVITY_INDICATOR }

    public static final ImageSource ACTIVITY_INDICATOR = new ImageSource(Type.ACTIVITY_INDICATOR, null);

    public static ImageSource sfSymbol(String name) {
        return new ImageSource(Type.SF_SYMBOL, name);
    }

    public static ImageSource asset(String name) {
        return new ImageSource(Type.ASSET, name);
    }

    public static ImageSource url(String url) {
        return new ImageSource(Type.URL, url);
    }

    public static ImageSource statePath(String path) {
        return new ImageSource(Type.STATE_PATH, path);
    }
}
