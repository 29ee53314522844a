package json.structure.tree;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The interface that represents a JSON value in a structure tree.
///
/// Instances of `JsonValue` are immutable and thread safe. Every edit of a
/// tree produces a new root; nodes are never mutated after construction, so
/// a value can be shared freely between callers and threads.
///
/// The set of variants is closed. Consumers dispatch on [#kind()] with an
/// exhaustive `switch` so that adding a variant is a compile error at every
/// call site rather than a silent fall-through:
///
/// ```java
/// String describe(JsonValue v) {
///     return switch (v.kind()) {
///         case NULL -> "null";
///         case BOOLEAN -> "flag " + v.bool();
///         case NUMBER -> "number " + v.toDouble();
///         case STRING -> "text " + v.string();
///         case ARRAY -> v.elements().size() + " elements";
///         case OBJECT -> v.members().size() + " members";
///     };
/// }
/// ```
///
/// A `JsonValue` can be produced by [Json#parse(String)].
public sealed interface JsonValue
        permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

    /// The closed set of JSON value variants.
    enum Kind {
        NULL, BOOLEAN, NUMBER, STRING, ARRAY, OBJECT;

        /// {@return the lower-case JSON type name, e.g. `object`}
        public String jsonName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /// {@return the variant of this value}
    Kind kind();

    /// {@return the compact String representation of this `JsonValue` that
    /// conforms to the JSON syntax} For a representation suitable for display,
    /// use [Json#toDisplayString(JsonValue, int)].
    @Override
    String toString();

    /// {@return `true` if this value is an array or an object}
    default boolean isContainer() {
        return kind() == Kind.ARRAY || kind() == Kind.OBJECT;
    }

    /// {@return the `boolean` value represented by a `JsonBoolean`}
    default boolean bool() {
        throw JsonAssertionException.typeError(this, "JsonBoolean");
    }

    /// {@return this `JsonValue` as a `long`}
    default long toLong() {
        throw JsonAssertionException.typeError(this, "JsonNumber");
    }

    /// {@return this `JsonValue` as a `double`}
    default double toDouble() {
        throw JsonAssertionException.typeError(this, "JsonNumber");
    }

    /// {@return the `String` value represented by a `JsonString`}
    default String string() {
        throw JsonAssertionException.typeError(this, "JsonString");
    }

    /// {@return the elements of a `JsonArray`}
    default List<JsonValue> elements() {
        throw JsonAssertionException.typeError(this, "JsonArray");
    }

    /// {@return the members of a `JsonObject`}
    default Map<String, JsonValue> members() {
        throw JsonAssertionException.typeError(this, "JsonObject");
    }

    /// {@return the `JsonValue` associated with the given member name of a `JsonObject`}
    ///
    /// @param name the member name
    /// @throws NullPointerException if the member name is `null`
    /// @throws JsonAssertionException if this is not a `JsonObject` or
    ///         there is no association with the member name
    default JsonValue get(String name) {
        Objects.requireNonNull(name);
        final var value = members().get(name);
        if (value == null) {
            throw new JsonAssertionException(
                    "JsonObject member \"%s\" does not exist.".formatted(name));
        }
        return value;
    }

    /// {@return an `Optional` containing the member value, or empty when there is no
    /// association} Throws [JsonAssertionException] if this is not a `JsonObject`.
    default Optional<JsonValue> getOrAbsent(String name) {
        Objects.requireNonNull(name);
        return Optional.ofNullable(members().get(name));
    }

    /// {@return the `JsonValue` at the given index of a `JsonArray`}
    ///
    /// @throws JsonAssertionException if this is not a `JsonArray`
    ///         or the given index is outside the bounds
    default JsonValue element(int index) {
        final List<JsonValue> elements = elements();
        if (index < 0 || index >= elements.size()) {
            throw new JsonAssertionException(
                    "JsonArray index %d out of bounds for length %d.".formatted(index, elements.size()));
        }
        return elements.get(index);
    }
}
