package json.structure.codegen;

/// Thrown when a class cannot be rendered in a target language.
///
/// Emitters catch this per class and substitute a diagnostic comment, so it
/// only escapes to callers that render a single class directly.
public final class CodegenException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public CodegenException(String message) {
        super(message);
    }

    public CodegenException(String message, Throwable cause) {
        super(message, cause);
    }
}
