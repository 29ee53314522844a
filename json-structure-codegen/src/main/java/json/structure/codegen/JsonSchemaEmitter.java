package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.ScalarKind;
import json.structure.schema.Shape;
import json.structure.tree.Json;
import json.structure.tree.JsonArray;
import json.structure.tree.JsonObject;
import json.structure.tree.JsonString;
import json.structure.tree.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// A draft-07 JSON Schema document. The root class is described inline and
/// every other class becomes an entry under `definitions`, referenced with
/// `$ref`. Every field is required, because every field was present in the
/// sample.
///
/// A class that fails is kept as a definition holding only a `$comment`.
final class JsonSchemaEmitter implements ClassEmitter {

    private static final Logger LOG = Logger.getLogger(JsonSchemaEmitter.class.getName());

    static final String DRAFT_07 = "http://json-schema.org/draft-07/schema#";

    @Override
    public TargetLanguage language() {
        return TargetLanguage.JSON_SCHEMA;
    }

    @Override
    public String emit(ClassSchema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        final var scope = EmitScope.of(schema);
        final var document = new LinkedHashMap<String, JsonValue>();
        document.put("$schema", JsonString.of(DRAFT_07));
        document.put("title", JsonString.of(schema.name()));
        document.put("description", JsonString.of(AbstractClassEmitter.GENERATED_BY));
        document.putAll(isolated(schema, scope).members());

        final var definitions = new LinkedHashMap<String, JsonValue>();
        for (final var cls : schema.allClasses()) {
            if (cls != schema) {
                definitions.put(cls.name(), isolated(cls, scope));
            }
        }
        if (!definitions.isEmpty()) {
            document.put("definitions", JsonObject.of(definitions));
        }
        LOG.fine(() -> "json_schema: emitted " + (definitions.size() + 1) + " classes for " + schema.name());
        return Json.toDisplayString(JsonObject.of(document), 2) + "\n";
    }

    private JsonObject isolated(ClassSchema cls, EmitScope scope) {
        try {
            return classSchema(cls, scope);
        } catch (RuntimeException e) {
            final var reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            LOG.warning(() -> "json_schema: could not generate class " + cls.name() + ": " + reason);
            return JsonObject.of(Map.of("$comment",
                    JsonString.of("Could not generate class " + cls.name() + ": " + reason)));
        }
    }

    private static JsonObject classSchema(ClassSchema cls, EmitScope scope) {
        final var properties = new LinkedHashMap<String, JsonValue>();
        for (final var field : cls.fields()) {
            properties.put(field.sourceKey(), shapeSchema(field.shape(), scope));
        }
        final var out = new LinkedHashMap<String, JsonValue>();
        out.put("type", JsonString.of("object"));
        out.put("properties", JsonObject.of(properties));
        out.put("required", JsonArray.of(cls.fields().stream().map(f -> JsonString.of(f.sourceKey())).toList()));
        return JsonObject.of(out);
    }

    private static JsonValue shapeSchema(Shape shape, EmitScope scope) {
        if (shape instanceof Shape.Scalar scalar) {
            return scalar.kind() == ScalarKind.ANY
                    ? JsonObject.empty()
                    : JsonObject.of(Map.of("type", JsonString.of(typeName(scalar.kind()))));
        }
        if (shape instanceof Shape.ListOf list) {
            final var out = new LinkedHashMap<String, JsonValue>();
            out.put("type", JsonString.of("array"));
            out.put("items", shapeSchema(list.element(), scope));
            return JsonObject.of(out);
        }
        if (shape instanceof Shape.ClassRef ref) {
            return JsonObject.of(Map.of("$ref", JsonString.of("#/definitions/" + scope.requireClass(ref.name()))));
        }
        throw new CodegenException("Unsupported shape " + shape);
    }

    private static String typeName(ScalarKind kind) {
        return switch (kind) {
            case STRING -> "string";
            case INTEGER -> "integer";
            case DOUBLE -> "number";
            case BOOLEAN -> "boolean";
            case ANY -> throw new CodegenException("ANY has no JSON Schema type");
        };
    }
}
