package json.structure.schema;

import java.util.ArrayList;
import java.util.Locale;

/// Turns JSON keys into identifiers.
///
/// Characters outside `[A-Za-z0-9_]` become `_`, the result is split on `_`
/// and rejoined in camelCase. Parts written entirely in capitals (`ID`,
/// `URL`) are treated as words and lower-cased. A result starting with a
/// digit gets a `_` prefix.
///
/// | key           | field name   | class name   |
/// |---------------|--------------|--------------|
/// | `first_name`  | `firstName`  | `FirstName`  |
/// | `user-ID`     | `userId`     | `UserId`     |
/// | `2fa`         | `_2fa`       | `_2fa`       |
/// | `$$`          | `field`      | fallback     |
public final class Names {

    private Names() {
    }

    /// {@return the camelCase field name for a key, or `field` if nothing usable remains}
    public static String fieldName(String key) {
        final var joined = camel(key);
        return joined.isEmpty() ? "field" : joined;
    }

    /// {@return the PascalCase class name for a key, or `fallback` if nothing usable remains}
    public static String className(String key, String fallback) {
        final var joined = camel(key);
        return joined.isEmpty() ? fallback : capitalize(joined);
    }

    /// {@return the class name for elements of an array stored under `key`}
    /// The key is singularised first (`addresses` gives `Address`); when that
    /// leaves nothing the name is the key's class name plus `Item`.
    public static String elementClassName(String key) {
        final var singular = className(singular(key), "");
        return singular.isEmpty() ? className(key, "Field") + "Item" : singular;
    }

    /// Strips an English plural suffix: `ies` becomes `y`, `es` is dropped
    /// after `s`, `x`, `z`, `ch` or `sh`, and a final `s` is dropped unless
    /// the word ends in `ss`, `us` or `is`.
    public static String singular(String word) {
        final var lower = word.toLowerCase(Locale.ROOT);
        final var n = word.length();
        if (lower.endsWith("ies") && n > 3) {
            return word.substring(0, n - 3) + (Character.isUpperCase(word.charAt(n - 1)) ? "Y" : "y");
        }
        if (lower.endsWith("es")) {
            final var base = lower.substring(0, n - 2);
            if (base.endsWith("s") || base.endsWith("x") || base.endsWith("z")
                    || base.endsWith("ch") || base.endsWith("sh")) {
                return word.substring(0, n - 2);
            }
        }
        if (lower.endsWith("s") && !lower.endsWith("ss") && !lower.endsWith("us") && !lower.endsWith("is")) {
            return word.substring(0, n - 1);
        }
        return word;
    }

    /// {@return `s` with its first character upper-cased}
    public static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    /// {@return `s` with its first character lower-cased}
    public static String decapitalize(String s) {
        return s.isEmpty() ? s : Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }

    private static String camel(String key) {
        final var cleaned = key.replaceAll("[^A-Za-z0-9_]", "_");
        final var parts = new ArrayList<String>();
        for (final var part : cleaned.split("_")) {
            if (!part.isEmpty()) {
                parts.add(part.equals(part.toUpperCase(Locale.ROOT)) ? part.toLowerCase(Locale.ROOT) : part);
            }
        }
        if (parts.isEmpty()) {
            return "";
        }
        final var sb = new StringBuilder(decapitalize(parts.get(0)));
        for (int i = 1; i < parts.size(); i++) {
            sb.append(capitalize(parts.get(i)));
        }
        final var joined = sb.toString();
        return Character.isDigit(joined.charAt(0)) ? "_" + joined : joined;
    }
}
