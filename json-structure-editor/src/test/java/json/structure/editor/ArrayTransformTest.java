package json.structure.editor;

import json.structure.tree.Json;
import org.junit.jupiter.api.Test;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

/// Tests for the whole-array transforms.
class ArrayTransformTest extends EditorLoggingConfig {

    private static final Logger LOG = Logger.getLogger(ArrayTransformTest.class.getName());

    private static String apply(String json, String mode) {
        return JsonEditor.arrayTransform(Json.parse(json), mode).toString();
    }

    @Test
    void filterNulls_keepsOtherFalsyValues() {
        LOG.info(() -> "TEST: filterNulls_keepsOtherFalsyValues");
        assertThat(apply("[null, false, 0, \"\", 1]", "filter-nulls")).isEqualTo("[false,0,\"\",1]");
    }

    @Test
    void filterFalsy_dropsNullFalseZeroAndEmpty() {
        LOG.info(() -> "TEST: filterFalsy_dropsNullFalseZeroAndEmpty");
        assertThat(apply("[null, false, 0, \"\", 1, \"a\", [], {}]", "filter-falsy")).isEqualTo("[1,\"a\",[],{}]");
    }

    @Test
    void sort_numbersNumericallyAndTextLexically() {
        LOG.info(() -> "TEST: sort_numbersNumericallyAndTextLexically");
        assertThat(apply("[10, 9, 100]", "sort-asc")).isEqualTo("[9,10,100]");
        assertThat(apply("[\"b\", \"a\", \"c\"]", "sort-asc")).isEqualTo("[\"a\",\"b\",\"c\"]");
        assertThat(apply("[1, 3, 2]", "sort-desc")).isEqualTo("[3,2,1]");
    }

    @Test
    void sort_isStableForEqualKeys() {
        LOG.info(() -> "TEST: sort_isStableForEqualKeys");
        assertThat(apply("[1, \"1\", 0]", "sort-asc")).isEqualTo("[0,1,\"1\"]");
        assertThat(apply("[\"1\", 1, 2]", "sort-desc")).isEqualTo("[2,\"1\",1]");
    }

    @Test
    void sort_mixedKindsDoNotFail() {
        LOG.info(() -> "TEST: sort_mixedKindsDoNotFail");
        final var mixed = new StringBuilder("[");
        for (int i = 0; i < 64; i++) {
            mixed.append(i % 3 == 0 ? "\"" + (i * 7 % 13) + "\"" : String.valueOf(i * 11 % 17)).append(',');
        }
        mixed.append("null]");
        assertThatCode(() -> apply(mixed.toString(), "sort-asc")).doesNotThrowAnyException();
    }

    @Test
    void unique_keepsFirstOccurrenceByText() {
        LOG.info(() -> "TEST: unique_keepsFirstOccurrenceByText");
        assertThat(apply("[1, \"1\", {\"a\": 1}, {\"a\": 1}, 2, 1]", "unique")).isEqualTo("[1,{\"a\":1},2]");
    }

    @Test
    void flatten1_concatenatesOneLevel() {
        LOG.info(() -> "TEST: flatten1_concatenatesOneLevel");
        assertThat(apply("[[1, 2], [3, [4]], 5, []]", "flatten1")).isEqualTo("[1,2,3,[4],5]");
    }

    @Test
    void mapNumber_parsesNumericStringsOnly() {
        LOG.info(() -> "TEST: mapNumber_parsesNumericStringsOnly");
        assertThat(apply("[\"1\", \"2.5\", \"x\", \"\", 3, true]", "map-number"))
            .isEqualTo("[1,2.5,\"x\",\"\",3,true]");
    }

    @Test
    void mapString_stringifiesEverything() {
        LOG.info(() -> "TEST: mapString_stringifiesEverything");
        assertThat(apply("[1, null, true, {\"a\": 1}, \"s\"]", "map-string"))
            .isEqualTo("[\"1\",\"null\",\"true\",\"{\\\"a\\\":1}\",\"s\"]");
    }

    @Test
    void nonArrayIsRejected() {
        LOG.info(() -> "TEST: nonArrayIsRejected");
        assertThatThrownBy(() -> JsonEditor.arrayTransform(Json.parse("{}"), ArrayTransform.UNIQUE))
            .isInstanceOf(TreeShapeException.class)
            .hasMessageContaining("requires an array")
            .hasMessageContaining("object");
    }

    @Test
    void unknownModeIsRejected() {
        LOG.info(() -> "TEST: unknownModeIsRejected");
        assertThatThrownBy(() -> ArrayTransform.fromId("shuffle"))
            .isInstanceOf(TreeShapeException.class)
            .hasMessageContaining("shuffle")
            .hasMessageContaining("filter-nulls");
        assertThat(ArrayTransform.fromId("flatten1")).isEqualTo(ArrayTransform.FLATTEN1);
    }
}
