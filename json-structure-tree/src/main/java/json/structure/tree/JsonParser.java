package json.structure.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;

/// Strict RFC 8259 recursive descent parser.
///
/// Accepts exactly one value surrounded by optional whitespace. Duplicate
/// member names, comments, single quotes, unquoted names, trailing commas and
/// non-finite numbers are all rejected with a [JsonParseException], as is
/// nesting deeper than 1000 containers.
final class JsonParser {

    private static final int MAX_DEPTH = 1_000;

    private final char[] doc;
    private int offset;
    private int depth;

    JsonParser(char[] doc) {
        this.doc = doc;
    }

    JsonValue parseRoot() {
        skipWhitespace();
        final var root = parseValue();
        skipWhitespace();
        if (offset < doc.length) {
            throw failure("Unexpected content after the JSON value");
        }
        return root;
    }

    private JsonValue parseValue() {
        if (offset >= doc.length) {
            throw failure("Unexpected end of input, expected a value");
        }
        final char c = doc[offset];
        switch (c) {
            case '{':
                return parseObject();
            case '[':
                return parseArray();
            case '"':
                return JsonString.of(parseString());
            case 't':
                expectLiteral("true");
                return JsonBoolean.TRUE;
            case 'f':
                expectLiteral("false");
                return JsonBoolean.FALSE;
            case 'n':
                expectLiteral("null");
                return JsonNull.of();
            default:
                if (c == '-' || (c >= '0' && c <= '9')) {
                    return parseNumber();
                }
                throw failure("Unexpected character '" + c + "', expected a value");
        }
    }

    private JsonObject parseObject() {
        enter();
        offset++; // '{'
        final var members = new LinkedHashMap<String, JsonValue>();
        skipWhitespace();
        if (peek() == '}') {
            offset++;
            depth--;
            return JsonObject.of(members);
        }
        while (true) {
            skipWhitespace();
            if (peek() != '"') {
                throw failure("Expected a double-quoted property name");
            }
            final int keyOffset = offset;
            final String key = parseString();
            skipWhitespace();
            if (peek() != ':') {
                throw failure("Expected ':' after property name");
            }
            offset++;
            skipWhitespace();
            final var value = parseValue();
            if (members.put(key, value) != null) {
                throw failureAt("Duplicate property name \"" + key + "\"", keyOffset);
            }
            skipWhitespace();
            final char c = peek();
            if (c == ',') {
                offset++;
                skipWhitespace();
                if (peek() == '}') {
                    throw failure("Trailing comma before '}'");
                }
            } else if (c == '}') {
                offset++;
                depth--;
                return JsonObject.of(members);
            } else {
                throw failure("Expected ',' or '}' after property value");
            }
        }
    }

    private JsonArray parseArray() {
        enter();
        offset++; // '['
        final var elements = new ArrayList<JsonValue>();
        skipWhitespace();
        if (peek() == ']') {
            offset++;
            depth--;
            return JsonArray.of(elements);
        }
        while (true) {
            skipWhitespace();
            elements.add(parseValue());
            skipWhitespace();
            final char c = peek();
            if (c == ',') {
                offset++;
                skipWhitespace();
                if (peek() == ']') {
                    throw failure("Trailing comma before ']'");
                }
            } else if (c == ']') {
                offset++;
                depth--;
                return JsonArray.of(elements);
            } else {
                throw failure("Expected ',' or ']' after array element");
            }
        }
    }

    private String parseString() {
        final int start = offset;
        offset++; // opening quote
        final var sb = new StringBuilder();
        while (offset < doc.length) {
            final char c = doc[offset++];
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\') {
                if (offset >= doc.length) {
                    break;
                }
                final char esc = doc[offset++];
                switch (esc) {
                    case '"': sb.append('"'); break;
                    case '\\': sb.append('\\'); break;
                    case '/': sb.append('/'); break;
                    case 'b': sb.append('\b'); break;
                    case 'f': sb.append('\f'); break;
                    case 'n': sb.append('\n'); break;
                    case 'r': sb.append('\r'); break;
                    case 't': sb.append('\t'); break;
                    case 'u': sb.append(parseUnicodeEscape()); break;
                    default:
                        throw failureAt("Invalid escape sequence '\\" + esc + "'", offset - 2);
                }
            } else if (c < 0x20) {
                throw failureAt("Unescaped control character in string", offset - 1);
            } else {
                sb.append(c);
            }
        }
        throw failureAt("Unterminated string", start);
    }

    private char parseUnicodeEscape() {
        if (offset + 4 > doc.length) {
            throw failure("Incomplete unicode escape");
        }
        int cp = 0;
        for (int i = 0; i < 4; i++) {
            final int digit = Character.digit(doc[offset + i], 16);
            if (digit < 0) {
                throw failureAt("Invalid unicode escape", offset + i);
            }
            cp = (cp << 4) | digit;
        }
        offset += 4;
        return (char) cp;
    }

    private JsonNumber parseNumber() {
        final int start = offset;
        if (peek() == '-') {
            offset++;
        }
        if (peek() == '0') {
            offset++;
            if (isDigit(peek())) {
                throw failure("Leading zeros are not allowed");
            }
        } else if (isDigit(peek())) {
            while (isDigit(peek())) {
                offset++;
            }
        } else {
            throw failure("Expected a digit");
        }
        if (peek() == '.') {
            offset++;
            if (!isDigit(peek())) {
                throw failure("Expected a digit after the decimal point");
            }
            while (isDigit(peek())) {
                offset++;
            }
        }
        if (peek() == 'e' || peek() == 'E') {
            offset++;
            if (peek() == '+' || peek() == '-') {
                offset++;
            }
            if (!isDigit(peek())) {
                throw failure("Expected a digit in the exponent");
            }
            while (isDigit(peek())) {
                offset++;
            }
        }
        final double value = Double.parseDouble(new String(doc, start, offset - start));
        if (!Double.isFinite(value)) {
            throw failureAt("Number out of range", start);
        }
        return JsonNumber.of(value);
    }

    private void expectLiteral(String literal) {
        for (int i = 0; i < literal.length(); i++) {
            if (offset + i >= doc.length || doc[offset + i] != literal.charAt(i)) {
                throw failure("Unexpected token, expected '" + literal + "'");
            }
        }
        offset += literal.length();
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw failure("Nesting depth exceeds " + MAX_DEPTH);
        }
    }

    private void skipWhitespace() {
        while (offset < doc.length) {
            final char c = doc[offset];
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
                offset++;
            } else {
                return;
            }
        }
    }

    /// {@return the current character, or NUL at end of input}
    private char peek() {
        return offset < doc.length ? doc[offset] : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private JsonParseException failure(String reason) {
        if (offset >= doc.length) {
            return failureAt(reason.startsWith("Unexpected end") ? reason : reason + " (end of input)", doc.length);
        }
        return failureAt(reason, offset);
    }

    private JsonParseException failureAt(String reason, int at) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < at && i < doc.length; i++) {
            if (doc[i] == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new JsonParseException(reason, line, at - lineStart + 1, at);
    }
}
