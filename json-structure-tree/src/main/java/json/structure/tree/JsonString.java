package json.structure.tree;

import java.util.Objects;

/// A JSON string.
///
/// `toString()` returns the quoted and escaped JSON text, while [#string()]
/// returns the raw value.
///
/// @param string the unescaped value
public record JsonString(String string) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(string, "string must not be null");
    }

    /// {@return a `JsonString` holding the given value}
    public static JsonString of(String value) {
        return new JsonString(value);
    }

    @Override
    public Kind kind() {
        return Kind.STRING;
    }

    @Override
    public String toString() {
        return Json.quote(string);
    }
}
