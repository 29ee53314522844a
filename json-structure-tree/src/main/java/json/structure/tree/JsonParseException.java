package json.structure.tree;

/// Exception thrown when text does not conform to the strict JSON grammar.
///
/// Carries the location of the offending character as a 1-based line and
/// column, computed by counting `\n` up to the 0-based character offset.
public class JsonParseException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String reason;
    private final int line;
    private final int column;
    private final int offset;

    /// Creates a new parse exception with location information.
    /// @param reason what was wrong, without location
    /// @param line the 1-based line
    /// @param column the 1-based column
    /// @param offset the 0-based character offset
    public JsonParseException(String reason, int line, int column, int offset) {
        super(formatMessage(reason, line, column));
        this.reason = reason;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    /// {@return the error description without the location suffix}
    public String reason() {
        return reason;
    }

    /// {@return the 1-based line of the error}
    public int line() {
        return line;
    }

    /// {@return the 1-based column of the error}
    public int column() {
        return column;
    }

    /// {@return the 0-based character offset of the error}
    public int offset() {
        return offset;
    }

    private static String formatMessage(String reason, int line, int column) {
        return reason + " at line " + line + ", column " + column;
    }
}
