package work.lcod.scals.resolution;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.scals.state.JsonValue;

/**
 * Where a node sits and which names it sees: loop variables bound by enclosing repeaters and the
 * local state declared by enclosing layouts. Saved on each view node so the node can be
 * re-resolved on its own.
 *
 * @param structuralId id used when the document gives the node none, e.g. {@code root.0.2}
 * @param documentPath readable location for error reports, e.g. {@code root.children[0].template}
 */
record ResolutionScope(
    String structuralId,
    String documentPath,
    Map<String, JsonValue> variables,
    JsonValue.ObjectValue localState
) {
    ResolutionScope {
        variables = Map.copyOf(variables);
    }

    static ResolutionScope root() {
        return new ResolutionScope("root", "root", Map.of(), JsonValue.ObjectValue.EMPTY);
    }

    ResolutionScope child(String idSegment, String pathSegment) {
        return new ResolutionScope(structuralId + "." + idSegment, documentPath + pathSegment, variables, localState);
    }

    /** Inner bindings shadow outer ones of the same name. */
    ResolutionScope withVariables(Map<String, JsonValue> bindings) {
        var merged = new LinkedHashMap<>(variables);
        merged.putAll(bindings);
        return new ResolutionScope(structuralId, documentPath, merged, localState);
    }

    ResolutionScope withLocalState(Map<String, JsonValue> declared) {
        if (declared.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<>(localState.fields());
        merged.putAll(declared);
        return new ResolutionScope(structuralId, documentPath, variables, JsonValue.object(merged));
    }
}
