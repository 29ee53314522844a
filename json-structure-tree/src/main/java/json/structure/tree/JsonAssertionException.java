package json.structure.tree;

/// Thrown when a [JsonValue] is accessed as a variant it is not, for example
/// calling `members()` on a `JsonArray`.
public final class JsonAssertionException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// Creates a new exception with the given message.
    /// @param message the error message
    public JsonAssertionException(String message) {
        super(message);
    }

    /// Creates a new exception with the given message and cause.
    /// @param message the error message
    /// @param cause the underlying cause
    public JsonAssertionException(String message, Throwable cause) {
        super(message, cause);
    }

    static JsonAssertionException typeError(JsonValue actual, String expected) {
        return new JsonAssertionException(
                "%s is not a %s.".formatted(actual.getClass().getSimpleName(), expected));
    }
}
