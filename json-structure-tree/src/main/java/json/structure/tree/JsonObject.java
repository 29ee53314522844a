package json.structure.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A JSON object: an insertion-ordered map of unique member names to values.
///
/// Member order is preserved exactly as supplied and is part of the value's
/// identity for display and editing purposes. Equality follows the map
/// contract, so two objects with the same members in a different order are
/// `equals` but render differently.
///
/// @param members the members, copied on construction and unmodifiable
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {

    public JsonObject {
        final var copy = new LinkedHashMap<String, JsonValue>();
        members.forEach((k, v) -> copy.put(
                Objects.requireNonNull(k, "member name must not be null"),
                Objects.requireNonNull(v, "member value must not be null")));
        members = Collections.unmodifiableMap(copy);
    }

    /// {@return the `JsonObject` created from the given map} The members occur
    /// in the iteration order of `map`.
    /// @throws NullPointerException if `map`, a key or a value is `null`
    public static JsonObject of(Map<String, ? extends JsonValue> map) {
        return new JsonObject(Collections.unmodifiableMap(map));
    }

    /// {@return an empty `JsonObject`}
    public static JsonObject empty() {
        return new JsonObject(Map.of());
    }

    @Override
    public Kind kind() {
        return Kind.OBJECT;
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder("{");
        var first = true;
        for (final var entry : members.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            sb.append(Json.quote(entry.getKey())).append(':').append(entry.getValue());
        }
        return sb.append('}').toString();
    }
}
