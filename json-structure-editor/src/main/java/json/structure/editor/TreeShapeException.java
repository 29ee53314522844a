package json.structure.editor;

/// Exception thrown when an edit is asked to operate on a value of the wrong
/// shape, such as an array transform applied to an object.
public final class TreeShapeException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// Creates a new TreeShapeException with the given message.
    /// @param message the error message
    public TreeShapeException(String message) {
        super(message);
    }

    /// Creates a new TreeShapeException with the given message and cause.
    /// @param message the error message
    /// @param cause the underlying cause
    public TreeShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
