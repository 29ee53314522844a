package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.FieldDescriptor;
import json.structure.schema.ScalarKind;
import json.structure.schema.Shape;
import json.structure.tree.Json;
import json.structure.tree.JsonObject;
import json.structure.tree.JsonString;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

/// A class that cannot be rendered is replaced by one comment while its
/// siblings and its declaring class are still generated.
class FailureIsolationTest extends CodegenLoggingConfig {

    private static final Logger LOG = Logger.getLogger(FailureIsolationTest.class.getName());

    private static final String FAILURE = "Could not generate class Broken: Unresolved class reference 'Missing'";

    /// `Root` has a good nested class and a broken one whose field points at
    /// a class that is not in the tree.
    private static ClassSchema schemaWithBrokenSibling() {
        final var good = new ClassSchema("Good",
            List.of(new FieldDescriptor("x", "x", Shape.scalar(ScalarKind.INTEGER), false)), List.of());
        final var broken = new ClassSchema("Broken",
            List.of(new FieldDescriptor("y", "y", new Shape.ClassRef("Missing"), false)), List.of());
        return new ClassSchema("Root", List.of(
            new FieldDescriptor("label", "label", Shape.scalar(ScalarKind.STRING), false),
            new FieldDescriptor("good", "good", new Shape.ClassRef("Good"), false),
            new FieldDescriptor("broken", "broken", new Shape.ClassRef("Broken"), false)),
            List.of(good, broken));
    }

    @ParameterizedTest
    @EnumSource(value = TargetLanguage.class, mode = EnumSource.Mode.EXCLUDE, names = "JSON_SCHEMA")
    void brokenClassBecomesOneComment(TargetLanguage language) {
        LOG.info(() -> "TEST: brokenClassBecomesOneComment " + language.id());

        final var out = JsonStructureGenerator.emit(schemaWithBrokenSibling(), language);

        final var comment = (language == TargetLanguage.PYTHON || language == TargetLanguage.RUBY ? "# " : "// ")
            + FAILURE;
        assertThat(out).contains(comment);
        assertThat(Pattern.compile("Could not generate").matcher(out).results().count()).isEqualTo(1);
        assertThat(out).contains("Good");
        assertThat(out).contains("label");
    }

    @Test
    void jsonSchemaRecordsFailureInDefinition() {
        LOG.info(() -> "TEST: jsonSchemaRecordsFailureInDefinition");

        final var out = JsonStructureGenerator.emit(schemaWithBrokenSibling(), TargetLanguage.JSON_SCHEMA);
        final var definitions = (JsonObject) Json.parse(out).get("definitions");

        assertThat(definitions.get("Broken")).isEqualTo(JsonObject.of(Map.of("$comment", JsonString.of(FAILURE))));
        assertThat(definitions.get("Good").get("type")).isEqualTo(JsonString.of("object"));
    }

    @Test
    void javaKeepsShellOfFailedClass() {
        LOG.info(() -> "TEST: javaKeepsShellOfFailedClass");
        final var leaf = new ClassSchema("Leaf",
            List.of(new FieldDescriptor("v", "v", Shape.scalar(ScalarKind.BOOLEAN), false)), List.of());
        final var root = new ClassSchema("Root",
            List.of(new FieldDescriptor("leaf", "leaf", new Shape.ClassRef("Leaf"), false),
                new FieldDescriptor("gone", "gone", new Shape.ListOf(new Shape.ClassRef("Gone")), false)),
            List.of(leaf));

        final var out = JsonStructureGenerator.emit(root, TargetLanguage.JAVA);

        assertThat(out).contains("""
            public class Root {
                // Could not generate class Root: Unresolved class reference 'Gone'

                public static class Leaf {
                    private boolean v;
            """);
        assertThat(out).contains("public boolean isV()");
    }

    @Test
    void failedRootKeepsNestedClassesInFlatLanguages() {
        LOG.info(() -> "TEST: failedRootKeepsNestedClassesInFlatLanguages");
        final var leaf = new ClassSchema("Leaf",
            List.of(new FieldDescriptor("v", "v", Shape.scalar(ScalarKind.STRING), false)), List.of());
        final var root = new ClassSchema("Root",
            List.of(new FieldDescriptor("gone", "gone", new Shape.ClassRef("Gone"), false)), List.of(leaf));

        final var out = JsonStructureGenerator.emit(root, TargetLanguage.TYPESCRIPT);

        assertThat(out).isEqualTo("""
            // Generated from JSON sample by json-structure

            export interface Leaf {
              v: string;
            }

            // Could not generate class Root: Unresolved class reference 'Gone'
            """);
    }
}
