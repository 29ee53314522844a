package json.structure.editor;

import java.util.Arrays;
import java.util.stream.Collectors;

/// Whole-array transforms offered by [JsonEditor#arrayTransform(json.structure.tree.JsonValue, ArrayTransform)].
public enum ArrayTransform {
    /// Drop `null` elements only; `false`, `0` and `""` survive.
    FILTER_NULLS("filter-nulls"),
    /// Drop every falsy element: `null`, `false`, `0` and `""`.
    FILTER_FALSY("filter-falsy"),
    /// Stable ascending sort.
    SORT_ASC("sort-asc"),
    /// Stable descending sort.
    SORT_DESC("sort-desc"),
    /// Keep the first occurrence of each canonical text.
    UNIQUE("unique"),
    /// Concatenate one level of nested arrays.
    FLATTEN1("flatten1"),
    /// Parse numeric-looking strings to numbers.
    MAP_NUMBER("map-number"),
    /// Stringify every element.
    MAP_STRING("map-string");

    private final String id;

    ArrayTransform(String id) {
        this.id = id;
    }

    /// {@return the external name, e.g. `filter-nulls`}
    public String id() {
        return id;
    }

    /// {@return the transform with the given external name}
    /// @throws TreeShapeException if no transform has that name
    public static ArrayTransform fromId(String id) {
        for (final var t : values()) {
            if (t.id.equals(id)) {
                return t;
            }
        }
        throw new TreeShapeException("Unknown array transform '" + id + "', expected one of: "
                + Arrays.stream(values()).map(ArrayTransform::id).collect(Collectors.joining(", ")));
    }
}
