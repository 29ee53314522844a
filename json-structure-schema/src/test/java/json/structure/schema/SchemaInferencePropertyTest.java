package json.structure.schema;

import json.structure.tree.JsonArray;
import json.structure.tree.JsonBoolean;
import json.structure.tree.JsonNull;
import json.structure.tree.JsonNumber;
import json.structure.tree.JsonObject;
import json.structure.tree.JsonString;
import json.structure.tree.JsonValue;
import net.jqwik.api.*;

import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;

/// Structural guarantees of inference over arbitrary samples.
class SchemaInferencePropertyTest extends SchemaLoggingConfig {

    @Provide
    Arbitrary<JsonValue> samples() {
        return jsonValues(4);
    }

    private static Arbitrary<JsonValue> jsonValues(int depth) {
        final Arbitrary<JsonValue> scalars = Arbitraries.oneOf(
            Arbitraries.just((JsonValue) JsonNull.of()),
            Arbitraries.of(true, false).map(b -> (JsonValue) JsonBoolean.of(b)),
            Arbitraries.integers().between(-50, 50).map(i -> (JsonValue) JsonNumber.of((long) i)),
            Arbitraries.strings().alpha().ofMaxLength(4).map(s -> (JsonValue) JsonString.of(s))
        );
        if (depth == 0) {
            return scalars;
        }
        final Arbitrary<JsonValue> arrays = jsonValues(depth - 1).list().ofMaxSize(3)
            .map(list -> (JsonValue) JsonArray.of(list));
        final Arbitrary<JsonValue> objects = Arbitraries.maps(
                Arbitraries.of("id", "name", "item", "items", "Item", "a-b", "a_b", "2x", "$"),
                jsonValues(depth - 1))
            .ofMaxSize(4)
            .map(map -> (JsonValue) JsonObject.of(map));
        return Arbitraries.oneOf(scalars, arrays, objects);
    }

    @Property(tries = 300)
    void classNamesAreUniqueAndEveryReferenceResolves(@ForAll("samples") JsonValue sample) {
        final var schema = SchemaInference.infer(sample, "Root");
        final var classes = schema.allClasses();
        final var names = new HashSet<String>();
        classes.forEach(c -> names.add(c.name()));

        assertThat(names).hasSize(classes.size());
        assertThat(classes.get(classes.size() - 1)).isSameAs(schema);
        for (final var cls : classes) {
            for (final var field : cls.fields()) {
                if (field.shape().innermost() instanceof Shape.ClassRef ref) {
                    assertThat(names).contains(ref.name());
                    assertThat(field.nullable()).isFalse();
                }
            }
        }
    }

    @Property(tries = 300)
    void nestedClassesPrecedeTheirDeclarers(@ForAll("samples") JsonValue sample) {
        final var classes = SchemaInference.infer(sample, "Root").allClasses();

        for (int i = 0; i < classes.size(); i++) {
            for (final var child : classes.get(i).nestedClasses()) {
                assertThat(classes.indexOf(child)).isLessThan(i);
            }
        }
    }

    @Property(tries = 200)
    void generatedFieldNamesAreUniqueIdentifiers(@ForAll("samples") JsonValue sample) {
        for (final var cls : SchemaInference.infer(sample, "Root").allClasses()) {
            final var fieldNames = cls.fields().stream().map(FieldDescriptor::generatedName).toList();
            assertThat(new HashSet<>(fieldNames)).hasSize(fieldNames.size());
            assertThat(fieldNames).allMatch(n -> n.matches("[A-Za-z_][A-Za-z0-9_]*"));
        }
    }
}
