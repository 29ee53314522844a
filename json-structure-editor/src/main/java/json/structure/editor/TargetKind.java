package json.structure.editor;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/// The kinds a node can be converted to by [JsonEditor#convertType(json.structure.tree.JsonValue, TargetKind)].
public enum TargetKind {
    STRING, NUMBER, BOOLEAN, NULL, OBJECT, ARRAY;

    /// {@return the external name, e.g. `boolean`}
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// {@return the kind with the given external name}
    /// @throws TreeShapeException if no kind has that name
    public static TargetKind fromId(String id) {
        for (final var k : values()) {
            if (k.id().equals(id)) {
                return k;
            }
        }
        throw new TreeShapeException("Unknown target type '" + id + "', expected one of: "
                + Arrays.stream(values()).map(TargetKind::id).collect(Collectors.joining(", ")));
    }
}
