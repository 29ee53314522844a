package json.structure.editor;

import json.structure.tree.Json;
import json.structure.tree.JsonBoolean;
import json.structure.tree.JsonNull;
import json.structure.tree.JsonNumber;
import json.structure.tree.JsonString;
import json.structure.tree.JsonValue;
import json.structure.tree.TreePath;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

/// Unit tests for path-addressed edits.
class JsonEditorTest extends EditorLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonEditorTest.class.getName());

    private static List<String> keys(JsonValue value) {
        return new ArrayList<>(value.members().keySet());
    }

    // ========== get / set ==========

    @Test
    void get_resolvesNestedPath() {
        LOG.info(() -> "TEST: get_resolvesNestedPath");
        final var root = Json.parse("""
            {"a": {"b": [10, 20]}}
            """);

        assertThat(JsonEditor.get(root, TreePath.of("a", "b", 1))).contains(JsonNumber.of(20));
        assertThat(JsonEditor.get(root, TreePath.root())).contains(root);
    }

    @Test
    void get_unresolvedPathIsEmpty() {
        LOG.info(() -> "TEST: get_unresolvedPathIsEmpty");
        final var root = Json.parse("""
            {"a": {"b": [10, 20]}}
            """);

        assertThat(JsonEditor.get(root, TreePath.of("a", "x"))).isEmpty();
        assertThat(JsonEditor.get(root, TreePath.of("a", "b", 5))).isEmpty();
        assertThat(JsonEditor.get(root, TreePath.of("a", "b", "k"))).isEmpty();
        assertThat(JsonEditor.get(root, TreePath.of("a", 0))).isEmpty();
    }

    @Test
    void set_replacesNodeAndLeavesInputUntouched() {
        LOG.info(() -> "TEST: set_replacesNodeAndLeavesInputUntouched");
        final var root = Json.parse("""
            {"a": {"b": 1}, "c": [1]}
            """);
        final var before = root.toString();

        final var result = JsonEditor.set(root, TreePath.of("a", "b"), JsonString.of("x"));

        assertThat(result.toString()).isEqualTo("{\"a\":{\"b\":\"x\"},\"c\":[1]}");
        assertThat(root.toString()).isEqualTo(before);
        assertThat(result.get("c")).isSameAs(root.get("c"));
        assertThat(result.get("a")).isNotSameAs(root.get("a"));
    }

    @Test
    void set_rootPathReplacesWholeTree() {
        LOG.info(() -> "TEST: set_rootPathReplacesWholeTree");
        final var root = Json.parse("[1, 2]");

        assertThat(JsonEditor.set(root, TreePath.root(), JsonNull.of())).isEqualTo(JsonNull.of());
    }

    @Test
    void set_unresolvedPathIsNoOp() {
        LOG.info(() -> "TEST: set_unresolvedPathIsNoOp");
        final var root = Json.parse("""
            {"a": [1]}
            """);

        assertThat(JsonEditor.set(root, TreePath.of("a", 3), JsonNumber.of(9))).isSameAs(root);
        assertThat(JsonEditor.set(root, TreePath.of("missing", "deeper"), JsonNumber.of(9))).isSameAs(root);
    }

    // ========== remove ==========

    @Test
    void remove_arrayElementShiftsLaterIndices() {
        LOG.info(() -> "TEST: remove_arrayElementShiftsLaterIndices");
        final var root = Json.parse("[1, 2, 3]");

        final var result = JsonEditor.remove(root, TreePath.of(1));

        assertThat(result.toString()).isEqualTo("[1,3]");
        assertThat(JsonEditor.get(result, TreePath.of(1))).contains(JsonNumber.of(3));
    }

    @Test
    void remove_objectMemberKeepsOrderOfOthers() {
        LOG.info(() -> "TEST: remove_objectMemberKeepsOrderOfOthers");
        final var root = Json.parse("""
            {"z": 1, "a": 2, "m": 3}
            """);

        final var result = JsonEditor.remove(root, TreePath.of("a"));

        assertThat(keys(result)).containsExactly("z", "m");
    }

    @Test
    void remove_missingTargetsAndRootAreNoOps() {
        LOG.info(() -> "TEST: remove_missingTargetsAndRootAreNoOps");
        final var root = Json.parse("""
            {"a": [1]}
            """);

        assertThat(JsonEditor.remove(root, TreePath.root())).isSameAs(root);
        assertThat(JsonEditor.remove(root, TreePath.of("b"))).isSameAs(root);
        assertThat(JsonEditor.remove(root, TreePath.of("a", 1))).isSameAs(root);
    }

    // ========== duplicateAdjacent ==========

    @Test
    void duplicateAdjacent_arrayElementLandsAtNextIndex() {
        LOG.info(() -> "TEST: duplicateAdjacent_arrayElementLandsAtNextIndex");
        final var root = Json.parse("""
            {"a": [1, {"x": 1}, 3]}
            """);

        final var result = JsonEditor.duplicateAdjacent(root, TreePath.of("a", 1));

        assertThat(result.get("a").toString()).isEqualTo("[1,{\"x\":1},{\"x\":1},3]");
    }

    @Test
    void duplicateAdjacent_objectMemberUsesCopySuffixes() {
        LOG.info(() -> "TEST: duplicateAdjacent_objectMemberUsesCopySuffixes");
        final var root = Json.parse("""
            {"name": "a", "other": 1}
            """);

        final var once = JsonEditor.duplicateAdjacent(root, TreePath.of("name"));
        assertThat(keys(once)).containsExactly("name", "name_copy", "other");
        assertThat(once.get("name_copy")).isEqualTo(JsonString.of("a"));

        final var twice = JsonEditor.duplicateAdjacent(once, TreePath.of("name"));
        assertThat(keys(twice)).containsExactly("name", "name_copy2", "name_copy", "other");
    }

    // ========== renameKey ==========

    @Test
    void renameKey_keepsPosition() {
        LOG.info(() -> "TEST: renameKey_keepsPosition");
        final var root = Json.parse("""
            {"a": 1, "b": 2, "c": 3}
            """);

        final var result = JsonEditor.renameKey(root, TreePath.of("b"), "z");

        assertThat(keys(result)).containsExactly("a", "z", "c");
        assertThat(result.get("z")).isEqualTo(JsonNumber.of(2));
    }

    @Test
    void renameKey_collisionGetsNumericSuffix() {
        LOG.info(() -> "TEST: renameKey_collisionGetsNumericSuffix");
        final var root = Json.parse("""
            {"a": 1, "b": 2}
            """);

        final var result = JsonEditor.renameKey(root, TreePath.of("a"), "b");
        assertThat(keys(result)).containsExactly("b_1", "b");
        assertThat(result.get("b_1")).isEqualTo(JsonNumber.of(1));

        final var crowded = Json.parse("""
            {"a": 1, "b": 2, "b_1": 3}
            """);
        assertThat(keys(JsonEditor.renameKey(crowded, TreePath.of("a"), "b")))
            .containsExactly("b_2", "b", "b_1");
    }

    @Test
    void renameKey_noOps() {
        LOG.info(() -> "TEST: renameKey_noOps");
        final var root = Json.parse("""
            {"a": 1, "list": [1, 2]}
            """);

        assertThat(JsonEditor.renameKey(root, TreePath.of("a"), "")).isSameAs(root);
        assertThat(JsonEditor.renameKey(root, TreePath.of("a"), "a")).isSameAs(root);
        assertThat(JsonEditor.renameKey(root, TreePath.of("missing"), "x")).isSameAs(root);
        assertThat(JsonEditor.renameKey(root, TreePath.of("list", 0), "x")).isSameAs(root);
    }

    // ========== insertChild ==========

    @Test
    void insertChild_appendsEmptyStringOrNewKey() {
        LOG.info(() -> "TEST: insertChild_appendsEmptyStringOrNewKey");
        final var root = Json.parse("""
            {"list": [1], "obj": {"a": 1}, "taken": {"newKey2": 1}}
            """);

        final var withElement = JsonEditor.insertChild(root, TreePath.of("list"));
        assertThat(withElement.get("list").toString()).isEqualTo("[1,\"\"]");

        final var withMember = JsonEditor.insertChild(root, TreePath.of("obj"));
        assertThat(keys(withMember.get("obj"))).containsExactly("a", "newKey2");

        final var bumped = JsonEditor.insertChild(root, TreePath.of("taken"));
        assertThat(keys(bumped.get("taken"))).containsExactly("newKey2", "newKey3");

        assertThat(JsonEditor.insertChild(root, TreePath.of("list", 0))).isSameAs(root);
    }

    // ========== convertType ==========

    @Test
    void convertType_toNumber() {
        LOG.info(() -> "TEST: convertType_toNumber");

        assertThat(JsonEditor.convertType(JsonString.of("42"), TargetKind.NUMBER)).isEqualTo(JsonNumber.of(42));
        assertThat(JsonEditor.convertType(JsonString.of(" 2.5 "), TargetKind.NUMBER)).isEqualTo(JsonNumber.of(2.5));
        assertThat(JsonEditor.convertType(JsonString.of("abc"), TargetKind.NUMBER)).isEqualTo(JsonNumber.of(0));
        assertThat(JsonEditor.convertType(JsonBoolean.TRUE, TargetKind.NUMBER)).isEqualTo(JsonNumber.of(1));
        assertThat(JsonEditor.convertType(JsonNull.of(), TargetKind.NUMBER)).isEqualTo(JsonNumber.of(0));
        assertThat(JsonEditor.convertType(Json.parse("[1]"), TargetKind.NUMBER)).isEqualTo(JsonNumber.of(0));
    }

    @Test
    void convertType_toStringAndBoolean() {
        LOG.info(() -> "TEST: convertType_toStringAndBoolean");

        assertThat(JsonEditor.convertType(Json.parse("{\"a\":1}"), TargetKind.STRING))
            .isEqualTo(JsonString.of("{\"a\":1}"));
        assertThat(JsonEditor.convertType(JsonNumber.of(1.5), TargetKind.STRING)).isEqualTo(JsonString.of("1.5"));
        assertThat(JsonEditor.convertType(JsonNull.of(), TargetKind.STRING)).isEqualTo(JsonString.of("null"));

        assertThat(JsonEditor.convertType(JsonNumber.of(0), TargetKind.BOOLEAN)).isEqualTo(JsonBoolean.FALSE);
        assertThat(JsonEditor.convertType(JsonString.of(""), TargetKind.BOOLEAN)).isEqualTo(JsonBoolean.FALSE);
        assertThat(JsonEditor.convertType(JsonString.of("x"), TargetKind.BOOLEAN)).isEqualTo(JsonBoolean.TRUE);
        assertThat(JsonEditor.convertType(Json.parse("[]"), TargetKind.BOOLEAN)).isEqualTo(JsonBoolean.TRUE);
    }

    @Test
    void convertType_toContainersAndNull() {
        LOG.info(() -> "TEST: convertType_toContainersAndNull");

        assertThat(JsonEditor.convertType(JsonString.of("x"), "null")).isEqualTo(JsonNull.of());
        assertThat(JsonEditor.convertType(JsonNumber.of(3), "object").toString()).isEqualTo("{}");
        assertThat(JsonEditor.convertType(JsonNumber.of(3), "array").toString()).isEqualTo("[]");
        assertThatThrownBy(() -> JsonEditor.convertType(JsonNull.of(), "date"))
            .isInstanceOf(TreeShapeException.class)
            .hasMessageContaining("date");
    }

    @Test
    void convertType_atPath() {
        LOG.info(() -> "TEST: convertType_atPath");
        final var root = Json.parse("""
            {"user": {"age": "37"}}
            """);

        final var result = JsonEditor.convertType(root, TreePath.of("user", "age"), TargetKind.NUMBER);

        assertThat(result.toString()).isEqualTo("{\"user\":{\"age\":37}}");
    }

    // ========== reorder ==========

    @Test
    void reorderArray_movesToDestinationIndex() {
        LOG.info(() -> "TEST: reorderArray_movesToDestinationIndex");
        final var array = Json.parse("[0, 1, 2, 3]");

        assertThat(JsonEditor.reorderArray(array, 1, 3).toString()).isEqualTo("[0,2,3,1]");
        assertThat(JsonEditor.reorderArray(array, 3, 0).toString()).isEqualTo("[3,0,1,2]");
        assertThat(JsonEditor.reorderArray(array, 2, 2)).isSameAs(array);
        assertThat(JsonEditor.reorderArray(array, 0, 4)).isSameAs(array);
        assertThat(JsonEditor.reorderArray(array, -1, 2)).isSameAs(array);
    }

    @Test
    void reorderArray_atPath() {
        LOG.info(() -> "TEST: reorderArray_atPath");
        final var root = Json.parse("""
            {"steps": ["a", "b", "c"]}
            """);

        final var result = JsonEditor.reorderArray(root, TreePath.of("steps"), 0, 2);

        assertThat(result.toString()).isEqualTo("{\"steps\":[\"b\",\"c\",\"a\"]}");
    }

    @Test
    void reorderObject_movesToDestinationPosition() {
        LOG.info(() -> "TEST: reorderObject_movesToDestinationPosition");
        final var obj = Json.parse("""
            {"a": 1, "b": 2, "c": 3, "d": 4}
            """);

        assertThat(keys(JsonEditor.reorderObject(obj, "b", "d"))).containsExactly("a", "c", "d", "b");
        assertThat(keys(JsonEditor.reorderObject(obj, "d", "a"))).containsExactly("d", "a", "b", "c");
        assertThat(JsonEditor.reorderObject(obj, "a", "zz")).isSameAs(obj);
        assertThat(JsonEditor.reorderObject(obj, "a", "a")).isSameAs(obj);
        assertThat(JsonEditor.reorderObject(Json.parse("[1]"), "a", "b").toString()).isEqualTo("[1]");
    }

    // ========== sortValue / parseEditedValue ==========

    @Test
    void sortValue_sortsOneLevel() {
        LOG.info(() -> "TEST: sortValue_sortsOneLevel");

        assertThat(JsonEditor.sortValue(Json.parse("[\"b\", \"a\", 10, 9]")).toString())
            .isEqualTo("[10,9,\"a\",\"b\"]");
        assertThat(keys(JsonEditor.sortValue(Json.parse("{\"b\": {\"z\": 1, \"y\": 2}, \"a\": 1}"))))
            .containsExactly("a", "b");
        assertThat(JsonEditor.sortValue(JsonNumber.of(1))).isEqualTo(JsonNumber.of(1));
    }

    @Test
    void parseEditedValue_coercesTypedText() {
        LOG.info(() -> "TEST: parseEditedValue_coercesTypedText");

        assertThat(JsonEditor.parseEditedValue(" 42 ")).isEqualTo(JsonNumber.of(42));
        assertThat(JsonEditor.parseEditedValue("true")).isEqualTo(JsonBoolean.TRUE);
        assertThat(JsonEditor.parseEditedValue("null")).isEqualTo(JsonNull.of());
        assertThat(JsonEditor.parseEditedValue("{\"a\": [1]}").toString()).isEqualTo("{\"a\":[1]}");
        assertThat(JsonEditor.parseEditedValue("{oops")).isEqualTo(JsonString.of("{oops"));
        assertThat(JsonEditor.parseEditedValue("hello")).isEqualTo(JsonString.of("hello"));
        assertThat(JsonEditor.parseEditedValue("")).isEqualTo(JsonString.of(""));
    }

    @Test
    void textOf_rendersPlainText() {
        LOG.info(() -> "TEST: textOf_rendersPlainText");

        assertThat(JsonEditor.textOf(JsonString.of("a\"b"))).isEqualTo("a\"b");
        assertThat(JsonEditor.textOf(JsonNumber.of(7))).isEqualTo("7");
        assertThat(JsonEditor.textOf(Json.parse("[1, \"x\"]"))).isEqualTo("[1,\"x\"]");
    }
}
