package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.ScalarKind;
import json.structure.schema.Shape;

import java.util.Set;

/// Immutable classes with `final` fields, a constructor of `required` named
/// parameters, a `fromJson` factory and a `toJson` method.
final class DartEmitter extends AbstractClassEmitter {

    private static final Set<String> RESERVED = Set.of(
            "assert", "break", "case", "catch", "class", "const", "continue", "default", "do", "else", "enum",
            "extends", "false", "final", "finally", "for", "if", "in", "is", "new", "null", "rethrow",
            "return", "super", "switch", "this", "throw", "true", "try", "var", "void", "while", "with");

    @Override
    public TargetLanguage language() {
        return TargetLanguage.DART;
    }

    @Override
    protected Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    protected String renderClass(ClassSchema cls, EmitScope scope) {
        final var name = cls.name();
        final var sb = new StringBuilder();
        sb.append("class ").append(name).append(" {\n");
        for (final var field : cls.fields()) {
            sb.append("  final ").append(fieldType(field, scope)).append(' ')
              .append(identifier(field.generatedName())).append(";\n");
        }
        if (!cls.fields().isEmpty()) {
            sb.append('\n');
            sb.append("  ").append(name).append("({\n");
            for (final var field : cls.fields()) {
                sb.append("    required this.").append(identifier(field.generatedName())).append(",\n");
            }
            sb.append("  });\n\n");
        } else {
            sb.append("  ").append(name).append("();\n\n");
        }

        sb.append("  factory ").append(name).append(".fromJson(Map<String, dynamic> json) {\n");
        sb.append("    return ").append(name).append('(');
        if (!cls.fields().isEmpty()) {
            sb.append('\n');
            for (final var field : cls.fields()) {
                final var raw = "json[" + singleQuoted(field.sourceKey()) + "]";
                sb.append("      ").append(identifier(field.generatedName())).append(": ")
                  .append(fromJson(field.shape(), raw, 0)).append(",\n");
            }
            sb.append("    ");
        }
        sb.append(");\n");
        sb.append("  }\n\n");

        sb.append("  Map<String, dynamic> toJson() => {\n");
        for (final var field : cls.fields()) {
            sb.append("        ").append(singleQuoted(field.sourceKey())).append(": ")
              .append(toJson(field.shape(), identifier(field.generatedName()), 0)).append(",\n");
        }
        sb.append("      };\n");
        return sb.append("}\n").toString();
    }

    private static String fromJson(Shape shape, String expr, int depth) {
        if (shape instanceof Shape.Scalar scalar) {
            return switch (scalar.kind()) {
                case STRING -> expr + " as String";
                case INTEGER -> expr + " as int";
                case DOUBLE -> "(" + expr + " as num).toDouble()";
                case BOOLEAN -> expr + " as bool";
                case ANY -> expr;
            };
        }
        if (shape instanceof Shape.ClassRef ref) {
            return ref.name() + ".fromJson(" + expr + " as Map<String, dynamic>)";
        }
        final var element = ((Shape.ListOf) shape).element();
        final var param = "e" + depth;
        return "(" + expr + " as List<dynamic>).map((" + param + ") => "
                + fromJson(element, param, depth + 1) + ").toList()";
    }

    private static String toJson(Shape shape, String expr, int depth) {
        if (shape instanceof Shape.ClassRef) {
            return expr + ".toJson()";
        }
        if (shape instanceof Shape.ListOf list && list.innermost() instanceof Shape.ClassRef) {
            final var param = "e" + depth;
            return expr + ".map((" + param + ") => " + toJson(list.element(), param, depth + 1) + ").toList()";
        }
        return expr;
    }

    private static String singleQuoted(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'").replace("$", "\\$") + "'";
    }

    @Override
    protected String scalarType(ScalarKind kind) {
        return switch (kind) {
            case STRING -> "String";
            case INTEGER -> "int";
            case DOUBLE -> "double";
            case BOOLEAN -> "bool";
            case ANY -> "dynamic";
        };
    }

    @Override
    protected String listType(String elementType) {
        return "List<" + elementType + ">";
    }
}
