package json.structure.tree;

import java.util.List;

/// A JSON array: an ordered, dense, zero-indexed list of values.
///
/// The element list is copied on construction and is unmodifiable.
///
/// @param elements the elements, none of which may be `null`
public record JsonArray(List<JsonValue> elements) implements JsonValue {

    public JsonArray {
        // List.copyOf rejects null elements
        elements = List.copyOf(elements);
    }

    /// {@return the `JsonArray` created from the given list of `JsonValue`s}
    /// @throws NullPointerException if `src` is `null` or contains `null`
    public static JsonArray of(List<? extends JsonValue> src) {
        return new JsonArray(List.copyOf(src));
    }

    /// {@return the `JsonArray` holding the given values}
    public static JsonArray of(JsonValue... values) {
        return new JsonArray(List.of(values));
    }

    @Override
    public Kind kind() {
        return Kind.ARRAY;
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(elements.get(i));
        }
        return sb.append(']').toString();
    }
}
