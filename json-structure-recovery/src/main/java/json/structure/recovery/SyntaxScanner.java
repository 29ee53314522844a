package json.structure.recovery;

import json.structure.tree.Json;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Tolerant single-pass scanner over raw JSON text.
///
/// Lexing never stops at the first problem: every malformed construct is
/// recorded as a [Defect] and scanning resumes at the next character. The
/// token stream is then walked with a bracket stack that tracks what each
/// open container expects next. Simple defects carry the [Edit] that
/// repairs them.
final class SyntaxScanner {

    private static final Logger LOG = Logger.getLogger(SyntaxScanner.class.getName());

    private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");

    enum TokenType { LBRACE, RBRACE, LBRACKET, RBRACKET, COLON, COMMA, STRING, SQ_STRING, NUMBER, LITERAL, WORD }

    record Token(TokenType type, int start, int end, boolean wellFormed) {
        boolean startsValue() {
            return switch (type) {
                case LBRACE, LBRACKET, STRING, SQ_STRING, NUMBER, LITERAL, WORD -> true;
                case RBRACE, RBRACKET, COLON, COMMA -> false;
            };
        }

        boolean closes() {
            return type == TokenType.RBRACE || type == TokenType.RBRACKET;
        }
    }

    /// Replace `[start, end)` with `replacement`; an insertion has `start == end`.
    record Edit(int start, int end, String replacement) {
    }

    /// A located defect. `fixKind`, `edit` and `fixDescription` are null for complex defects.
    record Defect(SyntaxErrorRecord error, FixKind fixKind, Edit edit, String fixDescription) {
    }

    private enum State { VALUE, VALUE_OR_END, KEY, KEY_OR_END, COLON, COMMA_OR_END, DONE }

    /// An open container, or the document itself when `opener` is null.
    private static final class Frame {
        final TokenType opener;
        final int openOffset;
        State state;
        int lastComma = -1;
        int valueEnd = -1;
        boolean valueWasContainer;
        final Set<String> keys = new HashSet<>();

        Frame(TokenType opener, int openOffset, State state) {
            this.opener = opener;
            this.openOffset = openOffset;
            this.state = state;
        }

        char closer() {
            return opener == TokenType.LBRACE ? '}' : ']';
        }

        char openChar() {
            return opener == TokenType.LBRACE ? '{' : '[';
        }
    }

    private final String text;
    private final int[] lineStarts;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Defect> defects = new ArrayList<>();
    private final Deque<Frame> stack = new ArrayDeque<>();

    private SyntaxScanner(String text) {
        this.text = text;
        this.lineStarts = computeLineStarts(text);
    }

    /// Scans `text` and returns every defect found, ordered by offset.
    static List<Defect> scan(String text) {
        final var scanner = new SyntaxScanner(text);
        scanner.lex();
        scanner.walk();
        scanner.defects.sort(Comparator.comparingInt(d -> d.error().offset()));
        LOG.finer(() -> "Scanned " + scanner.tokens.size() + " tokens, " + scanner.defects.size() + " defects");
        return scanner.defects;
    }

    // ========== Lexing ==========

    private void lex() {
        final var n = text.length();
        var i = 0;
        while (i < n) {
            final var c = text.charAt(i);
            switch (c) {
                case ' ', '\t', '\n', '\r' -> i++;
                case '{' -> i = punct(TokenType.LBRACE, i);
                case '}' -> i = punct(TokenType.RBRACE, i);
                case '[' -> i = punct(TokenType.LBRACKET, i);
                case ']' -> i = punct(TokenType.RBRACKET, i);
                case ':' -> i = punct(TokenType.COLON, i);
                case ',' -> i = punct(TokenType.COMMA, i);
                case '"' -> i = lexString(i, '"');
                case '\'' -> i = lexString(i, '\'');
                case '/' -> i = lexComment(i);
                default -> {
                    if (c == '-' || isDigit(c)) {
                        i = lexNumber(i);
                    } else if (isWordStart(c)) {
                        i = lexWord(i);
                    } else {
                        complex(i, "Unexpected character '" + c + "'");
                        i++;
                    }
                }
            }
        }
    }

    private int punct(TokenType type, int at) {
        tokens.add(new Token(type, at, at + 1, true));
        return at + 1;
    }

    private int lexString(int start, char quote) {
        final var type = quote == '"' ? TokenType.STRING : TokenType.SQ_STRING;
        final var n = text.length();
        var ok = true;
        var i = start + 1;
        while (i < n) {
            final var c = text.charAt(i);
            if (c == quote) {
                tokens.add(new Token(type, start, i + 1, ok));
                return i + 1;
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\') {
                if (i + 1 >= n) {
                    break;
                }
                final var e = text.charAt(i + 1);
                if ((quote == '\'' && e == '\'') || "\"\\/bfnrt".indexOf(e) >= 0) {
                    i += 2;
                    continue;
                }
                if (e == 'u' && i + 5 < n && isHex4(i + 2)) {
                    i += 6;
                    continue;
                }
                complex(i, "Invalid escape sequence '\\" + e + "'");
                ok = false;
                i += 2;
                continue;
            }
            if (c < 0x20) {
                complex(i, "Unescaped control character in string");
                ok = false;
            }
            i++;
        }
        complex(start, "Unterminated string");
        tokens.add(new Token(type, start, i, false));
        return i;
    }

    private int lexNumber(int start) {
        var i = start + 1;
        while (i < text.length() && "0123456789.eE+-".indexOf(text.charAt(i)) >= 0) {
            i++;
        }
        final var literal = text.substring(start, i);
        var ok = NUMBER.matcher(literal).matches();
        if (!ok) {
            complex(start, "Invalid number '" + literal + "'");
        } else if (!Double.isFinite(Double.parseDouble(literal))) {
            complex(start, "Number out of range");
            ok = false;
        }
        tokens.add(new Token(TokenType.NUMBER, start, i, ok));
        return i;
    }

    private int lexWord(int start) {
        var i = start + 1;
        while (i < text.length() && isWordPart(text.charAt(i))) {
            i++;
        }
        final var word = text.substring(start, i);
        final var type = switch (word) {
            case "true", "false", "null" -> TokenType.LITERAL;
            default -> TokenType.WORD;
        };
        tokens.add(new Token(type, start, i, true));
        return i;
    }

    private int lexComment(int start) {
        final var n = text.length();
        if (start + 1 < n && text.charAt(start + 1) == '/') {
            complex(start, "Comments are not allowed in JSON");
            final var eol = text.indexOf('\n', start);
            return eol < 0 ? n : eol;
        }
        if (start + 1 < n && text.charAt(start + 1) == '*') {
            complex(start, "Comments are not allowed in JSON");
            final var close = text.indexOf("*/", start + 2);
            return close < 0 ? n : close + 2;
        }
        complex(start, "Unexpected character '/'");
        return start + 1;
    }

    // ========== Structure ==========

    private void walk() {
        final var document = new Frame(null, 0, State.VALUE);
        stack.push(document);
        var i = 0;
        while (i < tokens.size()) {
            if (handle(stack.peek(), tokens.get(i), i)) {
                i++;
            }
        }
        while (stack.size() > 1) {
            final var open = stack.pop();
            complex(open.openOffset, "Unclosed bracket '" + open.openChar() + "' - missing closing '" + open.closer() + "'");
        }
        if (document.state == State.VALUE) {
            complex(text.length(), "Unexpected end of input, expected a value");
        }
    }

    /// Returns false when the token must be handled again in the frame's new state.
    private boolean handle(Frame frame, Token tok, int index) {
        return switch (frame.state) {
            case VALUE, VALUE_OR_END -> expectValue(frame, tok);
            case KEY, KEY_OR_END -> expectKey(frame, tok, index);
            case COLON -> {
                frame.state = State.VALUE;
                if (tok.type() == TokenType.COLON) {
                    yield true;
                }
                complex(tok.start(), "Expected ':' after property name");
                yield false;
            }
            case COMMA_OR_END -> expectCommaOrEnd(frame, tok, index);
            case DONE -> {
                if (tok.closes()) {
                    complex(tok.start(), "Unexpected closing bracket '" + charAt(tok) + "' without matching opening bracket");
                } else {
                    complex(tok.start(), "Unexpected content after the JSON value");
                }
                // one report is enough; the rest of the input is not inspected
                tokens.subList(index + 1, tokens.size()).clear();
                yield true;
            }
        };
    }

    private boolean expectValue(Frame frame, Token tok) {
        if (tok.startsValue()) {
            beginValue(frame, tok);
            return true;
        }
        if (tok.closes()) {
            if (frame.opener == null) {
                complex(tok.start(), "Unexpected closing bracket '" + charAt(tok) + "' without matching opening bracket");
                return true;
            }
            if (matches(frame, tok)) {
                if (frame.opener == TokenType.LBRACKET && frame.state == State.VALUE) {
                    trailingComma(frame.lastComma);
                } else if (frame.opener == TokenType.LBRACE) {
                    complex(tok.start(), "Expected a value before '" + charAt(tok) + "'");
                }
            }
            close(frame, tok);
            return true;
        }
        complex(tok.start(), "Unexpected '" + charAt(tok) + "', expected a value");
        return true;
    }

    private void beginValue(Frame frame, Token tok) {
        switch (tok.type()) {
            case LBRACE, LBRACKET -> {
                frame.state = frame.opener == null ? State.DONE : State.COMMA_OR_END;
                stack.push(new Frame(tok.type(), tok.start(),
                        tok.type() == TokenType.LBRACE ? State.KEY_OR_END : State.VALUE_OR_END));
                return;
            }
            case SQ_STRING -> singleQuoted(tok);
            case WORD -> complex(tok.start(), "Unexpected token '" + slice(tok) + "', expected a value");
            default -> {
            }
        }
        frame.valueEnd = tok.end();
        frame.valueWasContainer = false;
        frame.state = frame.opener == null ? State.DONE : State.COMMA_OR_END;
    }

    private boolean expectKey(Frame frame, Token tok, int index) {
        switch (tok.type()) {
            case STRING -> {
                if (tok.wellFormed()) {
                    addKey(frame, tok, Json.parse(slice(tok)).string());
                }
                frame.state = State.COLON;
            }
            case SQ_STRING -> {
                singleQuoted(tok);
                if (tok.wellFormed()) {
                    addKey(frame, tok, Json.parse(toDoubleQuoted(tok)).string());
                }
                frame.state = State.COLON;
            }
            case WORD, LITERAL -> {
                if (nextIsColon(index)) {
                    final var name = slice(tok);
                    simple(tok.start(), "Property name '" + name + "' must be double-quoted", FixKind.UNQUOTED_KEY,
                            new Edit(tok.start(), tok.end(), "\"" + name + "\""),
                            "Added quotes around key \"" + name + "\"");
                    addKey(frame, tok, name);
                    frame.state = State.COLON;
                } else {
                    complex(tok.start(), "Expected a double-quoted property name");
                }
            }
            case RBRACE, RBRACKET -> {
                if (frame.state == State.KEY && matches(frame, tok)) {
                    trailingComma(frame.lastComma);
                }
                close(frame, tok);
            }
            default -> complex(tok.start(), "Expected a double-quoted property name");
        }
        return true;
    }

    private boolean expectCommaOrEnd(Frame frame, Token tok, int index) {
        if (tok.type() == TokenType.COMMA) {
            frame.lastComma = tok.start();
            frame.state = frame.opener == TokenType.LBRACE ? State.KEY : State.VALUE;
            return true;
        }
        if (tok.closes()) {
            close(frame, tok);
            return true;
        }
        if (frame.opener == TokenType.LBRACKET && tok.startsValue()) {
            missingComma(frame, "Missing comma between array elements");
            frame.state = State.VALUE;
            return false;
        }
        if (frame.opener == TokenType.LBRACE && startsKey(tok, index)) {
            missingComma(frame, "Missing comma after property value");
            frame.state = State.KEY;
            return false;
        }
        complex(tok.start(), frame.opener == TokenType.LBRACE
                ? "Expected ',' or '}' after property value"
                : "Expected ',' or ']' after array element");
        return true;
    }

    private void close(Frame frame, Token tok) {
        if (!matches(frame, tok)) {
            complex(tok.start(), "Mismatched brackets: expected '" + frame.closer() + "' but found '" + charAt(tok) + "'");
        }
        stack.pop();
        final var parent = stack.peek();
        parent.valueEnd = tok.end();
        parent.valueWasContainer = true;
    }

    // ========== Defects ==========

    private void trailingComma(int commaOffset) {
        simple(commaOffset, "Trailing comma before closing bracket", FixKind.TRAILING_COMMA,
                new Edit(commaOffset, commaOffset + 1, ""), "Removed trailing comma");
    }

    private void missingComma(Frame frame, String message) {
        simple(frame.valueEnd, message, FixKind.MISSING_COMMA,
                new Edit(frame.valueEnd, frame.valueEnd, ","),
                frame.valueWasContainer ? "Added missing comma after closing bracket" : "Added missing comma after value");
    }

    private void singleQuoted(Token tok) {
        if (!tok.wellFormed()) {
            return;
        }
        simple(tok.start(), "String must use double quotes", FixKind.SINGLE_QUOTES,
                new Edit(tok.start(), tok.end(), toDoubleQuoted(tok)),
                "Converted single quotes to double quotes");
    }

    private void addKey(Frame frame, Token tok, String name) {
        if (!frame.keys.add(name)) {
            complex(tok.start(), "Duplicate property name \"" + name + "\"");
        }
    }

    private void simple(int offset, String message, FixKind kind, Edit edit, String description) {
        defects.add(new Defect(record(offset, message, SyntaxErrorRecord.Category.SIMPLE), kind, edit, description));
    }

    private void complex(int offset, String message) {
        defects.add(new Defect(record(offset, message, SyntaxErrorRecord.Category.COMPLEX), null, null, null));
    }

    private SyntaxErrorRecord record(int offset, String message, SyntaxErrorRecord.Category category) {
        final var pos = position(lineStarts, offset);
        return new SyntaxErrorRecord(pos[0], pos[1], message, category, offset);
    }

    // ========== Helpers ==========

    /// Rewrites a well-formed single-quoted token as a double-quoted JSON string.
    private String toDoubleQuoted(Token tok) {
        final var sb = new StringBuilder(tok.end() - tok.start() + 2).append('"');
        for (int i = tok.start() + 1; i < tok.end() - 1; i++) {
            final var c = text.charAt(i);
            if (c == '\\') {
                final var e = text.charAt(i + 1);
                if (e == '\'') {
                    sb.append('\'');
                } else {
                    sb.append(c).append(e);
                }
                i++;
            } else if (c == '"') {
                sb.append("\\\"");
            } else {
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private boolean startsKey(Token tok, int index) {
        return switch (tok.type()) {
            case STRING, SQ_STRING, WORD, LITERAL -> nextIsColon(index);
            default -> false;
        };
    }

    private boolean nextIsColon(int index) {
        return index + 1 < tokens.size() && tokens.get(index + 1).type() == TokenType.COLON;
    }

    private static boolean matches(Frame frame, Token tok) {
        return (frame.opener == TokenType.LBRACE && tok.type() == TokenType.RBRACE)
                || (frame.opener == TokenType.LBRACKET && tok.type() == TokenType.RBRACKET);
    }

    private String slice(Token tok) {
        return text.substring(tok.start(), tok.end());
    }

    private char charAt(Token tok) {
        return text.charAt(tok.start());
    }

    private boolean isHex4(int from) {
        for (int i = from; i < from + 4; i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isWordPart(char c) {
        return isWordStart(c) || isDigit(c);
    }

    private static int[] computeLineStarts(String text) {
        final var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int[] position(int[] lineStarts, int offset) {
        var idx = Arrays.binarySearch(lineStarts, offset);
        if (idx < 0) {
            idx = -idx - 2;
        }
        return new int[]{idx + 1, offset - lineStarts[idx] + 1};
    }
}
