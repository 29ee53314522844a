package json.structure.tree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// This class provides static methods for producing and rendering a [JsonValue].
///
/// [#parse(String)] produces a `JsonValue` by parsing data adhering to the
/// JSON syntax defined in RFC 8259.
///
/// [#toDisplayString(JsonValue, int)] is a formatter that produces a
/// representation of the JSON value suitable for display.
///
/// [#fromUntyped(Object)] and [#toUntyped(JsonValue)] convert between a
/// `JsonValue` and plain Java maps, lists and scalars. Adapters that read
/// foreign formats (XML, CSV, ...) build their trees through `fromUntyped`.
///
/// ## Example Usage
/// ```java
/// JsonValue json = Json.parse("{\"name\":\"John\",\"age\":30}");
/// Map<String, Object> data = (Map<String, Object>) Json.toUntyped(json);
/// JsonValue fromJava = Json.fromUntyped(Map.of("active", true, "score", 95));
/// ```
public final class Json {

    /// Parses and creates a `JsonValue` from the given JSON document.
    ///
    /// `JsonObject`s preserve the order of their members as declared in the
    /// document. A document containing an object with duplicate names is
    /// rejected.
    ///
    /// @param in the input JSON document. Non-null.
    /// @return the parsed `JsonValue`
    /// @throws JsonParseException if the input does not conform to the JSON
    ///         grammar, with the line and column of the first offending character
    /// @throws NullPointerException if `in` is `null`
    public static JsonValue parse(String in) {
        Objects.requireNonNull(in);
        return new JsonParser(in.toCharArray()).parseRoot();
    }

    /// Parses and creates a `JsonValue` from the given JSON document.
    ///
    /// @param in the input JSON document as `char[]`. Non-null.
    /// @return the parsed `JsonValue`
    /// @throws JsonParseException if the input does not conform to the JSON grammar
    /// @throws NullPointerException if `in` is `null`
    public static JsonValue parse(char[] in) {
        Objects.requireNonNull(in);
        return new JsonParser(Arrays.copyOf(in, in.length)).parseRoot();
    }

    /// {@return a `JsonValue` created from the given `src` object}
    ///
    /// | Untyped Object | JsonValue |
    /// |----------------|-----------|
    /// | `Map<String, Object>` | `JsonObject` |
    /// | `List<Object>` | `JsonArray` |
    /// | `String` | `JsonString` |
    /// | `Boolean` | `JsonBoolean` |
    /// | `Number` | `JsonNumber` |
    /// | `null` | `JsonNull` |
    ///
    /// If `src` is already a `JsonValue` it is returned as is.
    ///
    /// @param src the data to produce the `JsonValue` from. May be null.
    /// @throws IllegalArgumentException if `src` cannot be converted
    public static JsonValue fromUntyped(Object src) {
        if (src == null) {
            return JsonNull.of();
        } else if (src instanceof JsonValue jv) {
            return jv;
        } else if (src instanceof Map<?, ?> map) {
            final var members = new LinkedHashMap<String, JsonValue>();
            for (final var entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                            "The key '%s' is not a String".formatted(entry.getKey()));
                }
                members.put(key, fromUntyped(entry.getValue()));
            }
            return JsonObject.of(members);
        } else if (src instanceof List<?> list) {
            final var elements = new ArrayList<JsonValue>(list.size());
            for (final Object o : list) {
                elements.add(fromUntyped(o));
            }
            return JsonArray.of(elements);
        } else if (src instanceof String str) {
            return JsonString.of(str);
        } else if (src instanceof Boolean bool) {
            return JsonBoolean.of(bool);
        } else if (src instanceof BigDecimal || src instanceof BigInteger
                || src instanceof Double || src instanceof Float
                || src instanceof Long || src instanceof Integer
                || src instanceof Short || src instanceof Byte) {
            return JsonNumber.of(((Number) src).doubleValue());
        }
        throw new IllegalArgumentException(src.getClass().getSimpleName() + " is not a recognized type");
    }

    /// {@return an `Object` created from the given `JsonValue`}
    ///
    /// Objects become unmodifiable insertion-ordered `Map`s, arrays unmodifiable
    /// `List`s, integral numbers `Long` and other numbers `Double`. `JsonNull`
    /// becomes `null`.
    ///
    /// @param src the `JsonValue` to convert. Non-null.
    public static Object toUntyped(JsonValue src) {
        Objects.requireNonNull(src);
        return switch (src.kind()) {
            case OBJECT -> {
                final var map = new LinkedHashMap<String, Object>();
                src.members().forEach((k, v) -> map.put(k, toUntyped(v)));
                yield Collections.unmodifiableMap(map);
            }
            case ARRAY -> {
                // not List.copyOf: elements may be null
                final var list = new ArrayList<Object>(src.elements().size());
                src.elements().forEach(v -> list.add(toUntyped(v)));
                yield Collections.unmodifiableList(list);
            }
            case STRING -> src.string();
            case BOOLEAN -> src.bool();
            case NUMBER -> {
                final var number = (JsonNumber) src;
                yield number.isIntegral() && Math.abs(number.value()) <= Long.MAX_VALUE
                        ? (Object) number.toLong() : (Object) number.value();
            }
            case NULL -> null;
        };
    }

    /// {@return the String representation of the given `JsonValue` that conforms
    /// to the JSON syntax, indented for display}
    ///
    /// ```java
    /// System.out.println(Json.toDisplayString(Json.parse("{\"a\":[1,2]}"), 2));
    /// // {
    /// //   "a": [
    /// //     1,
    /// //     2
    /// //   ]
    /// // }
    /// ```
    ///
    /// @param value the value to render. Non-null.
    /// @param indent the number of spaces per level. Zero or positive.
    /// @throws IllegalArgumentException if `indent` is negative
    public static String toDisplayString(JsonValue value, int indent) {
        Objects.requireNonNull(value);
        if (indent < 0) {
            throw new IllegalArgumentException("indent is negative");
        }
        final var sb = new StringBuilder();
        appendDisplay(sb, value, 0, indent);
        return sb.toString();
    }

    private static void appendDisplay(StringBuilder sb, JsonValue value, int col, int indent) {
        if (value instanceof JsonObject jo && !jo.members().isEmpty()) {
            sb.append("{\n");
            final var it = jo.members().entrySet().iterator();
            while (it.hasNext()) {
                final var entry = it.next();
                sb.append(" ".repeat(col + indent)).append(quote(entry.getKey())).append(": ");
                appendDisplay(sb, entry.getValue(), col + indent, indent);
                sb.append(it.hasNext() ? ",\n" : "\n");
            }
            sb.append(" ".repeat(col)).append('}');
        } else if (value instanceof JsonArray ja && !ja.elements().isEmpty()) {
            sb.append("[\n");
            final var elements = ja.elements();
            for (int i = 0; i < elements.size(); i++) {
                sb.append(" ".repeat(col + indent));
                appendDisplay(sb, elements.get(i), col + indent, indent);
                sb.append(i < elements.size() - 1 ? ",\n" : "\n");
            }
            sb.append(" ".repeat(col)).append(']');
        } else {
            sb.append(value);
        }
    }

    /// {@return `s` as a double-quoted JSON string literal}
    public static String quote(String s) {
        final var sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\b': sb.append("\\b"); break;
                case '\f': sb.append("\\f"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }

    // no instantiation is allowed for this class
    private Json() {}
}
