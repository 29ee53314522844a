package json.structure.schema;

import json.structure.tree.JsonArray;
import json.structure.tree.JsonBoolean;
import json.structure.tree.JsonNull;
import json.structure.tree.JsonNumber;
import json.structure.tree.JsonObject;
import json.structure.tree.JsonString;
import json.structure.tree.JsonValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Infers a [ClassSchema] tree from one sample value.
///
/// Inference looks at a single sample: a `null` becomes an `ANY` field
/// marked nullable, a nested object becomes a [Shape.ClassRef] to a new
/// class, and an array takes its element shape from its first element only.
/// Class names are unique across the whole tree; a repeated name gets a
/// numeric suffix (`Address`, `Address2`). An object identical to one already
/// described, member order included, reuses that class instead of adding
/// another, so the reused class is declared only where it was first seen.
///
/// An instance tracks the names and classes of one inference and must not be shared.
/// Most callers only need [#infer(JsonValue, String)].
public final class SchemaInference {

    private static final Logger LOG = Logger.getLogger(SchemaInference.class.getName());

    private final Set<String> usedClassNames = new HashSet<>();
    private final Map<String, String> classNamesBySample = new HashMap<>();

    /// The result of analysing one field value.
    ///
    /// @param field the descriptor for the field
    /// @param nestedClass the class the value introduced, if it contained an object
    public record FieldAnalysis(FieldDescriptor field, Optional<ClassSchema> nestedClass) {
        public FieldAnalysis {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(nestedClass, "nestedClass must not be null");
        }
    }

    /// Creates an inference with no class names in use.
    public SchemaInference() {
    }

    /// Infers the class tree for a sample.
    ///
    /// An object root becomes the root class. An array root is described by
    /// its first element. Any other root yields a class with no fields.
    ///
    /// @param sample the sample document
    /// @param rootClassName the requested root class name, sanitised with `Root` as fallback
    /// @return the root class
    public static ClassSchema infer(JsonValue sample, String rootClassName) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(rootClassName, "rootClassName must not be null");
        final var inference = new SchemaInference();
        final var name = inference.claim(Names.className(rootClassName, "Root"));
        final var schema = inference.buildClass(rootObject(sample), name);
        LOG.fine(() -> "Inferred " + schema.allClasses().size() + " classes for root " + name);
        return schema;
    }

    private static JsonObject rootObject(JsonValue sample) {
        if (sample instanceof JsonObject obj) {
            return obj;
        }
        if (sample instanceof JsonArray array && !array.elements().isEmpty()
                && array.elements().get(0) instanceof JsonObject first) {
            return first;
        }
        return JsonObject.empty();
    }

    /// Builds a class from an object, one field per member in key order.
    ///
    /// The name is used as given; callers that did not obtain it from this
    /// instance should expect it to be registered as used.
    public ClassSchema buildClass(JsonObject object, String className) {
        usedClassNames.add(className);
        final var fields = new ArrayList<FieldDescriptor>();
        final var nested = new ArrayList<ClassSchema>();
        final var fieldNames = new HashSet<String>();
        for (final var entry : object.members().entrySet()) {
            final var analysis = analyze(entry.getValue(), entry.getKey());
            var field = analysis.field();
            if (!fieldNames.add(field.generatedName())) {
                final var base = field.generatedName();
                var n = 2;
                while (!fieldNames.add(base + n)) {
                    n++;
                }
                field = new FieldDescriptor(field.sourceKey(), base + n, field.shape(), field.nullable());
            }
            fields.add(field);
            analysis.nestedClass().ifPresent(nested::add);
        }
        classNamesBySample.putIfAbsent(object.toString(), className);
        return new ClassSchema(className, fields, nested);
    }

    /// Describes the field a value would produce under `key`.
    public FieldAnalysis analyze(JsonValue value, String key) {
        final var fieldName = Names.fieldName(key);
        if (value instanceof JsonNull) {
            return scalar(key, fieldName, ScalarKind.ANY, true);
        }
        if (value instanceof JsonString) {
            return scalar(key, fieldName, ScalarKind.STRING, false);
        }
        if (value instanceof JsonBoolean) {
            return scalar(key, fieldName, ScalarKind.BOOLEAN, false);
        }
        if (value instanceof JsonNumber number) {
            return scalar(key, fieldName, number.isIntegral() ? ScalarKind.INTEGER : ScalarKind.DOUBLE, false);
        }
        if (value instanceof JsonObject obj) {
            final var nested = classFor(obj, Names.className(key, "Field"));
            return new FieldAnalysis(
                    new FieldDescriptor(key, fieldName, nested.ref(), false),
                    nested.created());
        }
        final var array = (JsonArray) value;
        final var nested = new ArrayList<ClassSchema>(1);
        final var shape = listShape(array, key, nested);
        return new FieldAnalysis(new FieldDescriptor(key, fieldName, shape, false),
                nested.stream().findFirst());
    }

    private Shape listShape(JsonArray array, String key, List<ClassSchema> nested) {
        if (array.elements().isEmpty()) {
            return new Shape.ListOf(Shape.scalar(ScalarKind.ANY));
        }
        final var first = array.elements().get(0);
        if (first instanceof JsonArray inner) {
            return new Shape.ListOf(listShape(inner, key, nested));
        }
        if (first instanceof JsonObject obj) {
            final var element = classFor(obj, Names.elementClassName(key));
            element.created().ifPresent(nested::add);
            return new Shape.ListOf(element.ref());
        }
        return new Shape.ListOf(analyze(first, key).field().shape());
    }

    /// A class reference and the class it introduced, empty when an existing class was reused.
    private record NestedClass(Shape.ClassRef ref, Optional<ClassSchema> created) {
    }

    private NestedClass classFor(JsonObject object, String baseName) {
        final var existing = classNamesBySample.get(object.toString());
        if (existing != null) {
            LOG.finer(() -> "Reusing class " + existing + " for an identical " + baseName + " sample");
            return new NestedClass(new Shape.ClassRef(existing), Optional.empty());
        }
        final var built = buildClass(object, claim(baseName));
        return new NestedClass(new Shape.ClassRef(built.name()), Optional.of(built));
    }

    private static FieldAnalysis scalar(String key, String fieldName, ScalarKind kind, boolean nullable) {
        return new FieldAnalysis(new FieldDescriptor(key, fieldName, Shape.scalar(kind), nullable), Optional.empty());
    }

    /// Reserves a class name, adding the smallest suffix from 2 that makes it unique.
    String claim(String base) {
        if (usedClassNames.add(base)) {
            return base;
        }
        var n = 2;
        while (!usedClassNames.add(base + n)) {
            n++;
        }
        final var claimed = base + n;
        LOG.finer(() -> "Class name " + base + " already used, using " + claimed);
        return claimed;
    }
}
