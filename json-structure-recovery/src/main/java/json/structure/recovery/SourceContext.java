package json.structure.recovery;

import java.util.ArrayList;
import java.util.List;

/// Line lookups for showing a defect in its surrounding text.
public final class SourceContext {

    /// One numbered line of source.
    /// @param lineNumber 1-based line number
    /// @param text the line without its terminator
    /// @param isError whether this is the line being reported
    public record ContextLine(int lineNumber, String text, boolean isError) {
    }

    private SourceContext() {
    }

    /// {@return the text of a 1-based line, or an empty string if out of range}
    public static String lineText(String text, int line) {
        final var lines = text.split("\n", -1);
        return line >= 1 && line <= lines.length ? lines[line - 1] : "";
    }

    /// {@return up to `context` lines either side of `line`, with `line` flagged}
    public static List<ContextLine> surrounding(String text, int line, int context) {
        final var lines = text.split("\n", -1);
        final var start = Math.max(1, line - context);
        final var end = Math.min(lines.length, line + context);
        final var result = new ArrayList<ContextLine>();
        for (int i = start; i <= end; i++) {
            result.add(new ContextLine(i, lines[i - 1], i == line));
        }
        return result;
    }
}
