package json.structure.tree;

/// The JSON `true` and `false` literals.
///
/// @param bool the boolean value
public record JsonBoolean(boolean bool) implements JsonValue {

    public static final JsonBoolean TRUE = new JsonBoolean(true);
    public static final JsonBoolean FALSE = new JsonBoolean(false);

    /// {@return the shared instance for the given boolean}
    public static JsonBoolean of(boolean bool) {
        return bool ? TRUE : FALSE;
    }

    @Override
    public Kind kind() {
        return Kind.BOOLEAN;
    }

    @Override
    public String toString() {
        return Boolean.toString(bool);
    }
}
