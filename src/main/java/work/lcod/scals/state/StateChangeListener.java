package work.lcod.scals.state;

@FunctionalInterface
public interface StateChangeListener {
    void onChange(String path, JsonValue oldValue, JsonValue newValue);
}
