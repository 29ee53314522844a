package json.structure.recovery;

import json.structure.tree.Json;
import json.structure.tree.JsonParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Front door for parsing text pasted or uploaded by a user.
///
/// The input is normalised so that line and column numbers are stable: a
/// leading byte-order mark is dropped and `\r\n` becomes `\n`. Comments are
/// detected and reported but not stripped, so commented input still fails
/// the strict parse with positioned errors.
public final class JsonSafe {

    private static final Logger LOG = Logger.getLogger(JsonSafe.class.getName());

    private static final int PREVIEW_LENGTH = 80;

    private JsonSafe() {
    }

    /// Normalises and strictly parses `input`.
    /// @return [SafeParseResult.Ok] with the tree, or [SafeParseResult.Err] with
    ///         the parse failure and the classified defects
    public static SafeParseResult parse(String input) {
        final var normalized = normalize(input);
        final var comments = detectComments(normalized);
        try {
            final var value = Json.parse(normalized);
            return new SafeParseResult.Ok(value, normalized, comments);
        } catch (JsonParseException e) {
            LOG.fine(() -> "Safe parse failed: " + e.getMessage());
            return new SafeParseResult.Err(e, SyntaxRecovery.classify(normalized), normalized, comments);
        }
    }

    /// {@return `input` without a leading BOM and with `\r\n` line endings replaced by `\n`}
    public static String normalize(String input) {
        final var withoutBom = input.startsWith("\uFEFF") ? input.substring(1) : input;
        return withoutBom.replace("\r\n", "\n");
    }

    /// {@return comments outside double-quoted strings, in text order}
    public static List<CommentMatch> detectComments(String text) {
        final var found = new ArrayList<CommentMatch>();
        final var n = text.length();
        var line = 1;
        var inString = false;
        var i = 0;
        while (i < n) {
            final var c = text.charAt(i);
            if (inString) {
                if (c == '\\' && i + 1 < n && text.charAt(i + 1) != '\n') {
                    i += 2;
                    continue;
                }
                if (c == '"' || c == '\n') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '/' && i + 1 < n && (text.charAt(i + 1) == '/' || text.charAt(i + 1) == '*')) {
                final var single = text.charAt(i + 1) == '/';
                final int end;
                if (single) {
                    final var eol = text.indexOf('\n', i);
                    end = eol < 0 ? n : eol;
                } else {
                    final var close = text.indexOf("*/", i + 2);
                    end = close < 0 ? n : close + 2;
                }
                final var body = text.substring(i, end);
                found.add(new CommentMatch(line,
                        single ? CommentMatch.Kind.SINGLE : CommentMatch.Kind.MULTI,
                        body.substring(0, Math.min(PREVIEW_LENGTH, body.length())).replace('\n', ' ')));
                line += (int) body.chars().filter(ch -> ch == '\n').count();
                i = end;
                continue;
            }
            if (c == '\n') {
                line++;
            }
            i++;
        }
        return found;
    }
}
