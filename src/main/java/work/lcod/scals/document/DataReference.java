package work.lcod.scals.document;

/**
 * Content source for a component: a static value, a state binding (path or template), or a
 * binding into the enclosing view's local state. Also used for document-level data sources.
 */
public record DataReference(Type type, String value, String path, String template) {
    public enum Type { STATIC, BINDING, LOCAL_BINDING }

    public static DataReference staticValue(String value) {
        return new DataReference(Type.STATIC, value, null, null);
    }

    public static DataReference binding(String path) {
        return new DataReference(Type.BINDING, null, path, null);
    }

    public static DataReference template(String template) {
        return new DataReference(Type.BINDING, null, null, template);
    }
}
