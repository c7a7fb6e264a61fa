package work.lcod.scals.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.scals.state.JsonValue;

/**
 * Immutable decoded document.
 */
public record DocumentDefinition(
    String id,
    DocumentVersion version,
    Map<String, JsonValue> state,
    Map<String, Style> styles,
    Map<String, DataReference> dataSources,
    Map<String, DocumentAction> actions,
    RootComponent root
) {
    public DocumentDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(root, "root");
        version = version == null ? DocumentVersion.CURRENT : version;
        state = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
        styles = styles == null ? Map.of() : Map.copyOf(styles);
        dataSources = dataSources == null ? Map.of() : Map.copyOf(dataSources);
        actions = actions == null ? Map.of() : Map.copyOf(actions);
    }
}
