package json.structure.recovery;

import java.util.Locale;
import java.util.Objects;

/// A syntax defect found in raw JSON text.
///
/// @param line 1-based line of the defect
/// @param column 1-based column of the defect
/// @param message human-readable description
/// @param category whether the defect can be repaired mechanically
/// @param offset 0-based character offset of the defect
public record SyntaxErrorRecord(int line, int column, String message, Category category, int offset) {

    /// Whether a defect is within the bounded set the engine repairs itself.
    public enum Category {
        /// Missing or trailing comma, unquoted key, or single-quoted string.
        SIMPLE,
        /// Anything else: bracket imbalance, unterminated strings, stray tokens.
        COMPLEX
    }

    public SyntaxErrorRecord {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(category, "category must not be null");
    }

    /// {@return `true` if this defect can be repaired by [SyntaxRecovery#repairSimple(String)]}
    public boolean isSimple() {
        return category == Category.SIMPLE;
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column + ": " + message + " (" + category.name().toLowerCase(Locale.ROOT) + ")";
    }
}
