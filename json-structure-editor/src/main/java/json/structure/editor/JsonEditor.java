package json.structure.editor;

import json.structure.tree.Json;
import json.structure.tree.JsonArray;
import json.structure.tree.JsonBoolean;
import json.structure.tree.JsonNull;
import json.structure.tree.JsonNumber;
import json.structure.tree.JsonObject;
import json.structure.tree.JsonParseException;
import json.structure.tree.JsonString;
import json.structure.tree.JsonValue;
import json.structure.tree.TreePath;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Path-addressed structural edits over an immutable JSON tree.
///
/// Every operation takes a root and returns a new root. The input is never
/// modified: containers on the path to the edited node are copied and all
/// other subtrees are shared with the input. When a path does not resolve,
/// or its parent has the wrong kind for the operation, the input root is
/// returned as-is.
///
/// ```java
/// final var root = Json.parse("""
///     {"user": {"name": "Ada", "tags": ["a", null, "a"]}}
///     """);
/// final var renamed = JsonEditor.renameKey(root, TreePath.of("user", "name"), "fullName");
/// final var tags = JsonEditor.get(renamed, TreePath.of("user", "tags")).orElseThrow();
/// final var cleaned = JsonEditor.arrayTransform(tags, ArrayTransform.FILTER_NULLS);
/// ```
public final class JsonEditor {

    private static final Logger LOG = Logger.getLogger(JsonEditor.class.getName());

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");

    private JsonEditor() {
    }

    // ========== Path access ==========

    /// Resolves a path against a root.
    /// @param root the tree to read
    /// @param path segments from the root
    /// @return the addressed node, or empty if any segment does not resolve
    public static Optional<JsonValue> get(JsonValue root, TreePath path) {
        JsonValue current = root;
        for (final var segment : path.segments()) {
            final var next = step(current, segment);
            if (next == null) {
                return Optional.empty();
            }
            current = next;
        }
        return Optional.of(current);
    }

    /// Replaces the node at a path. An empty path replaces the whole tree.
    /// Unresolvable paths leave the tree unchanged; use
    /// [#insertChild(JsonValue, TreePath)] to add members.
    public static JsonValue set(JsonValue root, TreePath path, JsonValue value) {
        LOG.fine(() -> "set " + path);
        if (path.isRoot()) {
            return value;
        }
        return updateAt(root, path.segments(), 0, existing -> value);
    }

    /// Deletes the member or element a path addresses. Array removal shifts
    /// later indices down by one. The root itself cannot be removed.
    public static JsonValue remove(JsonValue root, TreePath path) {
        LOG.fine(() -> "remove " + path);
        if (path.isRoot()) {
            return root;
        }
        final var last = path.last();
        return updateAt(root, path.parent().segments(), 0, parent -> {
            if (last instanceof TreePath.Key key && parent instanceof JsonObject obj) {
                if (!obj.members().containsKey(key.name())) {
                    return parent;
                }
                final var members = new LinkedHashMap<>(obj.members());
                members.remove(key.name());
                return JsonObject.of(members);
            }
            if (last instanceof TreePath.Index index && parent instanceof JsonArray arr) {
                if (!inRange(arr, index.index())) {
                    return parent;
                }
                final var elements = new ArrayList<>(arr.elements());
                elements.remove(index.index());
                return JsonArray.of(elements);
            }
            return parent;
        });
    }

    /// Inserts a copy of the addressed node immediately after it. In an
    /// array the copy lands at the next index. In an object the copy is
    /// stored under `key_copy`, or `key_copy2`, `key_copy3` and so on when
    /// that name is taken, directly after the original member.
    public static JsonValue duplicateAdjacent(JsonValue root, TreePath path) {
        LOG.fine(() -> "duplicateAdjacent " + path);
        if (path.isRoot()) {
            return root;
        }
        final var last = path.last();
        return updateAt(root, path.parent().segments(), 0, parent -> {
            if (last instanceof TreePath.Key key && parent instanceof JsonObject obj) {
                final var original = obj.members().get(key.name());
                if (original == null) {
                    return parent;
                }
                final var base = key.name() + "_copy";
                var copyKey = base;
                var n = 2;
                while (obj.members().containsKey(copyKey)) {
                    copyKey = base + n++;
                }
                final var members = new LinkedHashMap<String, JsonValue>();
                for (final var entry : obj.members().entrySet()) {
                    members.put(entry.getKey(), entry.getValue());
                    if (entry.getKey().equals(key.name())) {
                        // values are immutable, so the copy may share the original's subtree
                        members.put(copyKey, original);
                    }
                }
                return JsonObject.of(members);
            }
            if (last instanceof TreePath.Index index && parent instanceof JsonArray arr) {
                if (!inRange(arr, index.index())) {
                    return parent;
                }
                final var elements = new ArrayList<>(arr.elements());
                elements.add(index.index() + 1, elements.get(index.index()));
                return JsonArray.of(elements);
            }
            return parent;
        });
    }

    /// Renames the object member a path addresses, keeping its position.
    /// A name that collides with another member gets `_1`, `_2` and so on
    /// appended. An empty or unchanged name is a no-op, as is a path whose
    /// parent is not an object.
    public static JsonValue renameKey(JsonValue root, TreePath path, String newKey) {
        LOG.fine(() -> "renameKey " + path + " -> " + newKey);
        if (path.isRoot() || newKey == null || newKey.isEmpty()
                || !(path.last() instanceof TreePath.Key key) || key.name().equals(newKey)) {
            return root;
        }
        final var oldKey = key.name();
        return updateAt(root, path.parent().segments(), 0, parent -> {
            if (!(parent instanceof JsonObject obj) || !obj.members().containsKey(oldKey)) {
                return parent;
            }
            var candidate = newKey;
            var n = 1;
            while (obj.members().containsKey(candidate) && !candidate.equals(oldKey)) {
                candidate = newKey + "_" + n++;
            }
            if (candidate.equals(oldKey)) {
                return parent;
            }
            final var finalKey = candidate;
            LOG.finer(() -> "Renamed key '" + oldKey + "' to '" + finalKey + "'");
            final var members = new LinkedHashMap<String, JsonValue>();
            obj.members().forEach((k, v) -> members.put(k.equals(oldKey) ? finalKey : k, v));
            return JsonObject.of(members);
        });
    }

    /// Adds an empty child to the container at a path: `""` is appended to
    /// an array, and an object gains `newKeyN` mapped to `""` where N is
    /// one more than its current member count, bumped until unused.
    /// Scalars and unresolved paths are left unchanged.
    public static JsonValue insertChild(JsonValue root, TreePath path) {
        LOG.fine(() -> "insertChild " + path);
        return updateAt(root, path.segments(), 0, target -> {
            if (target instanceof JsonArray arr) {
                final var elements = new ArrayList<>(arr.elements());
                elements.add(JsonString.of(""));
                return JsonArray.of(elements);
            }
            if (target instanceof JsonObject obj) {
                var n = obj.members().size() + 1;
                while (obj.members().containsKey("newKey" + n)) {
                    n++;
                }
                final var members = new LinkedHashMap<>(obj.members());
                members.put("newKey" + n, JsonString.of(""));
                return JsonObject.of(members);
            }
            return target;
        });
    }

    // ========== Value rewrites ==========

    /// Converts a value to another kind.
    ///
    /// | target  | rule |
    /// |---------|------|
    /// | string  | strings unchanged, containers as compact JSON, scalars as their text |
    /// | number  | numbers unchanged, `true`/`false` to 1/0, numeric strings parsed, anything else 0 |
    /// | boolean | truthiness: `null`, `false`, 0 and `""` are false |
    /// | null    | `null` |
    /// | object  | `{}` |
    /// | array   | `[]` |
    public static JsonValue convertType(JsonValue value, TargetKind target) {
        return switch (target) {
            case STRING -> value instanceof JsonString ? value : JsonString.of(textOf(value));
            case NUMBER -> toNumber(value);
            case BOOLEAN -> JsonBoolean.of(isTruthy(value));
            case NULL -> JsonNull.of();
            case OBJECT -> JsonObject.empty();
            case ARRAY -> JsonArray.of(List.of());
        };
    }

    /// Converts a value using an external kind name such as `boolean`.
    /// @throws TreeShapeException if the name is unknown
    public static JsonValue convertType(JsonValue value, String targetId) {
        return convertType(value, TargetKind.fromId(targetId));
    }

    /// Converts the node at a path in place.
    public static JsonValue convertType(JsonValue root, TreePath path, TargetKind target) {
        LOG.fine(() -> "convertType " + path + " -> " + target.id());
        return updateAt(root, path.segments(), 0, node -> convertType(node, target));
    }

    /// Applies a whole-array transform.
    /// @throws TreeShapeException if the value is not an array
    public static JsonValue arrayTransform(JsonValue value, ArrayTransform mode) {
        if (!(value instanceof JsonArray arr)) {
            throw new TreeShapeException("Array transform '" + mode.id() + "' requires an array, got "
                    + value.kind().jsonName());
        }
        LOG.fine(() -> "arrayTransform " + mode.id() + " over " + arr.elements().size() + " elements");
        final var items = arr.elements();
        final var out = new ArrayList<JsonValue>(items.size());
        switch (mode) {
            case FILTER_NULLS -> items.stream().filter(v -> !(v instanceof JsonNull)).forEach(out::add);
            case FILTER_FALSY -> items.stream().filter(JsonEditor::isTruthy).forEach(out::add);
            case SORT_ASC -> out.addAll(stableSort(items, JsonEditor::compareForSort));
            case SORT_DESC -> out.addAll(stableSort(items, (a, b) -> compareForSort(b, a)));
            case UNIQUE -> {
                final var seen = new HashSet<String>();
                for (final var item : items) {
                    final var key = item.isContainer() ? item.toString() : textOf(item);
                    if (seen.add(key)) {
                        out.add(item);
                    }
                }
            }
            case FLATTEN1 -> {
                for (final var item : items) {
                    if (item instanceof JsonArray inner) {
                        out.addAll(inner.elements());
                    } else {
                        out.add(item);
                    }
                }
            }
            case MAP_NUMBER -> {
                for (final var item : items) {
                    if (item instanceof JsonString s) {
                        final var parsed = parseNumeric(s.string());
                        out.add(parsed.isPresent() ? JsonNumber.of(parsed.getAsDouble()) : item);
                    } else {
                        out.add(item);
                    }
                }
            }
            case MAP_STRING -> items.forEach(item -> out.add(
                    item instanceof JsonString ? item : JsonString.of(textOf(item))));
        }
        return JsonArray.of(out);
    }

    /// Applies a transform using its external name such as `sort-asc`.
    /// @throws TreeShapeException if the name is unknown or the value is not an array
    public static JsonValue arrayTransform(JsonValue value, String modeId) {
        return arrayTransform(value, ArrayTransform.fromId(modeId));
    }

    /// Applies a transform to the array at a path.
    /// @throws TreeShapeException if the addressed node is not an array
    public static JsonValue arrayTransform(JsonValue root, TreePath path, ArrayTransform mode) {
        return updateAt(root, path.segments(), 0, node -> arrayTransform(node, mode));
    }

    /// Sorts one level of a container: array elements by their text,
    /// object members by key. Scalars are returned unchanged.
    public static JsonValue sortValue(JsonValue value) {
        if (value instanceof JsonArray arr) {
            return JsonArray.of(stableSort(arr.elements(), Comparator.comparing(JsonEditor::textOf)));
        }
        if (value instanceof JsonObject obj) {
            final var members = new LinkedHashMap<String, JsonValue>();
            obj.members().keySet().stream().sorted().forEach(k -> members.put(k, obj.members().get(k)));
            return JsonObject.of(members);
        }
        return value;
    }

    /// Sorts one level of the container at a path.
    public static JsonValue sortValue(JsonValue root, TreePath path) {
        LOG.fine(() -> "sortValue " + path);
        return updateAt(root, path.segments(), 0, JsonEditor::sortValue);
    }

    // ========== Reordering ==========

    /// Moves the element at `srcIndex` to `dstIndex`: it is taken out of the
    /// array and reinserted at the destination's original index, so moving
    /// 1 to 3 in `[0,1,2,3]` gives `[0,2,3,1]`. Out-of-range indices, equal
    /// indices and non-arrays leave the value unchanged.
    public static JsonValue reorderArray(JsonValue parent, int srcIndex, int dstIndex) {
        if (!(parent instanceof JsonArray arr) || srcIndex == dstIndex
                || !inRange(arr, srcIndex) || !inRange(arr, dstIndex)) {
            return parent;
        }
        final var elements = new ArrayList<>(arr.elements());
        final var moved = elements.remove(srcIndex);
        elements.add(dstIndex, moved);
        return JsonArray.of(elements);
    }

    /// Reorders the array at a path.
    public static JsonValue reorderArray(JsonValue root, TreePath path, int srcIndex, int dstIndex) {
        LOG.fine(() -> "reorderArray " + path + " " + srcIndex + " -> " + dstIndex);
        return updateAt(root, path.segments(), 0, node -> reorderArray(node, srcIndex, dstIndex));
    }

    /// Moves member `srcKey` to the position `dstKey` held before the move.
    /// Missing keys, equal keys and non-objects leave the value unchanged.
    public static JsonValue reorderObject(JsonValue parent, String srcKey, String dstKey) {
        if (!(parent instanceof JsonObject obj) || srcKey.equals(dstKey)) {
            return parent;
        }
        final var keys = new ArrayList<>(obj.members().keySet());
        final var srcPos = keys.indexOf(srcKey);
        final var dstPos = keys.indexOf(dstKey);
        if (srcPos < 0 || dstPos < 0) {
            return parent;
        }
        keys.remove(srcPos);
        keys.add(dstPos, srcKey);
        final var members = new LinkedHashMap<String, JsonValue>();
        keys.forEach(k -> members.put(k, obj.members().get(k)));
        return JsonObject.of(members);
    }

    /// Reorders the object at a path.
    public static JsonValue reorderObject(JsonValue root, TreePath path, String srcKey, String dstKey) {
        LOG.fine(() -> "reorderObject " + path + " " + srcKey + " -> " + dstKey);
        return updateAt(root, path.segments(), 0, node -> reorderObject(node, srcKey, dstKey));
    }

    // ========== Text helpers ==========

    /// Interprets text typed into a value editor: text starting with `{` or
    /// `[` is parsed as JSON (kept as a string when it does not parse),
    /// `null`/`true`/`false` become literals, numeric text becomes a number
    /// and anything else is kept verbatim as a string.
    public static JsonValue parseEditedValue(String text) {
        final var trimmed = text.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            try {
                return Json.parse(trimmed);
            } catch (JsonParseException e) {
                LOG.fine(() -> "Edited text is not valid JSON, keeping it as a string: " + e.getMessage());
                return JsonString.of(text);
            }
        }
        if ("null".equals(trimmed)) {
            return JsonNull.of();
        }
        if ("true".equals(trimmed) || "false".equals(trimmed)) {
            return JsonBoolean.of(Boolean.parseBoolean(trimmed));
        }
        final var number = parseNumeric(trimmed);
        return number.isPresent() ? JsonNumber.of(number.getAsDouble()) : JsonString.of(text);
    }

    /// {@return the plain text of a value}: a string's characters unquoted,
    /// a number or literal as written, and a container as compact JSON.
    public static String textOf(JsonValue value) {
        return value instanceof JsonString s ? s.string() : value.toString();
    }

    /// {@return whether a value counts as true when filtering or converting to boolean}
    public static boolean isTruthy(JsonValue value) {
        return switch (value.kind()) {
            case NULL -> false;
            case BOOLEAN -> value.bool();
            case NUMBER -> value.toDouble() != 0;
            case STRING -> !value.string().isEmpty();
            case ARRAY, OBJECT -> true;
        };
    }

    // ========== Internals ==========

    private static JsonValue step(JsonValue node, TreePath.Segment segment) {
        if (segment instanceof TreePath.Key key && node instanceof JsonObject obj) {
            return obj.members().get(key.name());
        }
        if (segment instanceof TreePath.Index index && node instanceof JsonArray arr) {
            return inRange(arr, index.index()) ? arr.elements().get(index.index()) : null;
        }
        return null;
    }

    /// Copy-on-write rewrite of the node at `segments[depth..]`. Returns the
    /// same instance when nothing below changed so untouched ancestors are
    /// not copied.
    private static JsonValue updateAt(JsonValue node, List<TreePath.Segment> segments, int depth,
                                      UnaryOperator<JsonValue> edit) {
        if (depth == segments.size()) {
            return edit.apply(node);
        }
        final var child = step(node, segments.get(depth));
        if (child == null) {
            LOG.finer(() -> "Path segment " + segments.get(depth) + " does not resolve, leaving tree unchanged");
            return node;
        }
        final var updated = updateAt(child, segments, depth + 1, edit);
        if (updated == child) {
            return node;
        }
        if (node instanceof JsonObject obj) {
            final var members = new LinkedHashMap<>(obj.members());
            members.put(((TreePath.Key) segments.get(depth)).name(), updated);
            return JsonObject.of(members);
        }
        final var elements = new ArrayList<>(node.elements());
        elements.set(((TreePath.Index) segments.get(depth)).index(), updated);
        return JsonArray.of(elements);
    }

    private static boolean inRange(JsonArray arr, int index) {
        return index >= 0 && index < arr.elements().size();
    }

    private static JsonValue toNumber(JsonValue value) {
        return switch (value.kind()) {
            case NUMBER -> value;
            case BOOLEAN -> JsonNumber.of(value.bool() ? 1 : 0);
            case STRING -> JsonNumber.of(parseNumeric(value.string()).orElse(0));
            case NULL, ARRAY, OBJECT -> JsonNumber.of(0);
        };
    }

    /// Numeric text: optional sign, decimal digits with optional fraction and
    /// exponent, or a hexadecimal integer. Surrounding whitespace is ignored;
    /// blank text is not numeric.
    static OptionalDouble parseNumeric(String text) {
        final var t = text.trim();
        if (t.isEmpty()) {
            return OptionalDouble.empty();
        }
        final double d;
        if (DECIMAL.matcher(t).matches()) {
            d = Double.parseDouble(t);
        } else if (HEX.matcher(t).matches()) {
            d = new BigInteger(t.substring(2), 16).doubleValue();
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    }

    /// Numbers compare numerically when both sides are numbers; everything
    /// else compares by text.
    private static int compareForSort(JsonValue a, JsonValue b) {
        if (a instanceof JsonNumber x && b instanceof JsonNumber y) {
            return Double.compare(x.toDouble(), y.toDouble());
        }
        return textOf(a).compareTo(textOf(b));
    }

    /// Merge sort that tolerates the mixed-kind comparator, which is not
    /// transitive across numbers and numeric strings.
    private static List<JsonValue> stableSort(List<JsonValue> items, Comparator<JsonValue> cmp) {
        if (items.size() < 2) {
            return new ArrayList<>(items);
        }
        final var mid = items.size() / 2;
        final var left = stableSort(items.subList(0, mid), cmp);
        final var right = stableSort(items.subList(mid, items.size()), cmp);
        final var merged = new ArrayList<JsonValue>(items.size());
        var i = 0;
        var j = 0;
        while (i < left.size() && j < right.size()) {
            if (cmp.compare(right.get(j), left.get(i)) < 0) {
                merged.add(right.get(j++));
            } else {
                merged.add(left.get(i++));
            }
        }
        while (i < left.size()) {
            merged.add(left.get(i++));
        }
        while (j < right.size()) {
            merged.add(right.get(j++));
        }
        return merged;
    }
}
