package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.Names;
import json.structure.schema.ScalarKind;

/// Classes with auto-properties mapped to their JSON keys by
/// `[JsonPropertyName]` from `System.Text.Json`.
final class CSharpEmitter extends AbstractClassEmitter {

    @Override
    public TargetLanguage language() {
        return TargetLanguage.CSHARP;
    }

    @Override
    protected String preamble(ClassSchema root) {
        return "using System.Collections.Generic;\n"
                + "using System.Text.Json.Serialization;\n";
    }

    @Override
    protected String renderClass(ClassSchema cls, EmitScope scope) {
        final var sb = new StringBuilder();
        sb.append("public class ").append(cls.name()).append('\n');
        sb.append("{\n");
        var first = true;
        for (final var field : cls.fields()) {
            if (!first) {
                sb.append('\n');
            }
            first = false;
            sb.append("    [JsonPropertyName(").append(quoted(field.sourceKey())).append(")]\n");
            sb.append("    public ").append(fieldType(field, scope)).append(' ')
              .append(propertyName(field.generatedName(), cls.name())).append(" { get; set; }\n");
        }
        return sb.append("}\n").toString();
    }

    /// Member names may not repeat their enclosing type's name.
    private static String propertyName(String generatedName, String className) {
        final var name = Names.capitalize(generatedName);
        return name.equals(className) ? name + "Value" : name;
    }

    @Override
    protected String scalarType(ScalarKind kind) {
        return switch (kind) {
            case STRING -> "string";
            case INTEGER -> "long";
            case DOUBLE -> "double";
            case BOOLEAN -> "bool";
            case ANY -> "object";
        };
    }

    @Override
    protected String listType(String elementType) {
        return "List<" + elementType + ">";
    }

    @Override
    protected String nullableType(String type) {
        return type + "?";
    }
}
