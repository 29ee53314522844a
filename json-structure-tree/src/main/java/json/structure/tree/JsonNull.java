package json.structure.tree;

/// The JSON `null` literal.
public record JsonNull() implements JsonValue {

    private static final JsonNull INSTANCE = new JsonNull();

    /// {@return the `JsonNull` value}
    public static JsonNull of() {
        return INSTANCE;
    }

    @Override
    public Kind kind() {
        return Kind.NULL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
