package json.structure.tree;

import java.util.List;
import java.util.Objects;

/// Structural statistics of a JSON tree: how many values of each kind it
/// holds, how deeply it nests and which keys its root object declares.
///
/// The root counts as depth 1, so a scalar document has depth 1 and
/// `{"a":[1]}` has depth 3.
///
/// @param rootKind the kind of the root value
/// @param strings number of string values
/// @param numbers number of number values
/// @param booleans number of boolean values
/// @param nulls number of null values
/// @param objects number of objects, the root included
/// @param arrays number of arrays, the root included
/// @param maxDepth the deepest nesting level reached
/// @param rootKeys member names of the root object, empty otherwise
public record JsonStatistics(
        JsonValue.Kind rootKind,
        int strings,
        int numbers,
        int booleans,
        int nulls,
        int objects,
        int arrays,
        int maxDepth,
        List<String> rootKeys
) {

    public JsonStatistics {
        Objects.requireNonNull(rootKind, "rootKind must not be null");
        rootKeys = List.copyOf(rootKeys);
    }

    /// {@return the statistics of the given tree}
    public static JsonStatistics of(JsonValue root) {
        Objects.requireNonNull(root, "root must not be null");
        final var counter = new Counter();
        counter.visit(root, 1);
        final List<String> keys = root instanceof JsonObject obj ? List.copyOf(obj.members().keySet()) : List.of();
        return new JsonStatistics(root.kind(), counter.strings, counter.numbers, counter.booleans,
                counter.nulls, counter.objects, counter.arrays, counter.maxDepth, keys);
    }

    /// {@return the total number of values in the tree}
    public int totalValues() {
        return strings + numbers + booleans + nulls + objects + arrays;
    }

    private static final class Counter {
        int strings;
        int numbers;
        int booleans;
        int nulls;
        int objects;
        int arrays;
        int maxDepth;

        void visit(JsonValue value, int depth) {
            maxDepth = Math.max(maxDepth, depth);
            switch (value.kind()) {
                case NULL -> nulls++;
                case BOOLEAN -> booleans++;
                case NUMBER -> numbers++;
                case STRING -> strings++;
                case ARRAY -> {
                    arrays++;
                    value.elements().forEach(v -> visit(v, depth + 1));
                }
                case OBJECT -> {
                    objects++;
                    value.members().values().forEach(v -> visit(v, depth + 1));
                }
            }
        }
    }
}
