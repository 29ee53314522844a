package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.Names;
import json.structure.schema.ScalarKind;
import json.structure.schema.Shape;

import java.util.ArrayList;
import java.util.Objects;
import java.util.Set;

/// A single public class holding every nested class as a `public static`
/// member. Each class gets private fields, a no-argument and an all-arguments
/// constructor, JavaBean accessors, `equals`, `hashCode` and `toString`.
///
/// Nested classes are isolated one by one: when a class body fails, its
/// declaration keeps its name and holds the failure comment, so the classes
/// nested inside it are still written.
final class JavaEmitter extends AbstractClassEmitter {

    private static final String INDENT = "    ";

    private static final Set<String> RESERVED = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "record", "yield");

    @Override
    public TargetLanguage language() {
        return TargetLanguage.JAVA;
    }

    @Override
    public String emit(ClassSchema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        final var scope = EmitScope.of(schema);
        final var sb = new StringBuilder(4096);
        sb.append("// ").append(GENERATED_BY).append('\n');
        if (anyField(schema, f -> f.shape() instanceof Shape.ListOf)) {
            sb.append("import java.util.List;\n");
        }
        sb.append("import java.util.Objects;\n\n");
        appendClass(sb, schema, scope, "", true);
        return sb.toString();
    }

    private void appendClass(StringBuilder sb, ClassSchema cls, EmitScope scope, String indent, boolean top) {
        sb.append(indent).append(top ? "public class " : "public static class ").append(cls.name()).append(" {\n");
        final var inner = indent + INDENT;
        sb.append(isolated(cls, inner, () -> renderMembers(cls, scope, inner)));
        for (final var child : cls.nestedClasses()) {
            sb.append('\n');
            appendClass(sb, child, scope, inner, false);
        }
        sb.append(indent).append("}\n");
    }

    @Override
    protected String renderClass(ClassSchema cls, EmitScope scope) {
        return renderMembers(cls, scope, INDENT);
    }

    private String renderMembers(ClassSchema cls, EmitScope scope, String in) {
        final var name = cls.name();
        final var members = new ArrayList<Member>();
        for (final var field : cls.fields()) {
            members.add(new Member(identifier(field.generatedName()), fieldType(field, scope)));
        }
        final var in2 = in + INDENT;
        final var in3 = in2 + INDENT;
        final var sb = new StringBuilder();

        for (final var m : members) {
            sb.append(in).append("private ").append(m.type()).append(' ').append(m.name()).append(";\n");
        }
        if (!members.isEmpty()) {
            sb.append('\n');
        }

        sb.append(in).append("public ").append(name).append("() {\n");
        sb.append(in).append("}\n");
        if (!members.isEmpty()) {
            sb.append('\n');
            sb.append(in).append("public ").append(name).append('(')
              .append(String.join(", ", members.stream().map(m -> m.type() + " " + m.name()).toList()))
              .append(") {\n");
            for (final var m : members) {
                sb.append(in2).append("this.").append(m.name()).append(" = ").append(m.name()).append(";\n");
            }
            sb.append(in).append("}\n");
        }

        for (final var m : members) {
            final var suffix = Names.capitalize(m.name());
            final var getter = ("boolean".equals(m.type()) ? "is" : "get") + suffix;
            sb.append('\n');
            sb.append(in).append("public ").append(m.type()).append(' ').append(getter).append("() {\n");
            sb.append(in2).append("return ").append(m.name()).append(";\n");
            sb.append(in).append("}\n\n");
            sb.append(in).append("public void set").append(suffix).append('(').append(m.type()).append(' ')
              .append(m.name()).append(") {\n");
            sb.append(in2).append("this.").append(m.name()).append(" = ").append(m.name()).append(";\n");
            sb.append(in).append("}\n");
        }

        sb.append('\n');
        sb.append(in).append("@Override\n");
        sb.append(in).append("public boolean equals(Object o) {\n");
        sb.append(in2).append("if (this == o) {\n");
        sb.append(in3).append("return true;\n");
        sb.append(in2).append("}\n");
        sb.append(in2).append("if (o == null || getClass() != o.getClass()) {\n");
        sb.append(in3).append("return false;\n");
        sb.append(in2).append("}\n");
        if (members.isEmpty()) {
            sb.append(in2).append("return true;\n");
        } else {
            sb.append(in2).append(name).append(" that = (").append(name).append(") o;\n");
            sb.append(in2).append("return ")
              .append(String.join("\n" + in3 + "&& ", members.stream().map(JavaEmitter::equalityTerm).toList()))
              .append(";\n");
        }
        sb.append(in).append("}\n\n");

        sb.append(in).append("@Override\n");
        sb.append(in).append("public int hashCode() {\n");
        sb.append(in2).append("return Objects.hash(")
          .append(String.join(", ", members.stream().map(Member::name).toList())).append(");\n");
        sb.append(in).append("}\n\n");

        sb.append(in).append("@Override\n");
        sb.append(in).append("public String toString() {\n");
        sb.append(in2).append("return \"").append(name).append("{\"");
        for (int i = 0; i < members.size(); i++) {
            final var m = members.get(i);
            sb.append("\n").append(in3).append("+ \"").append(i == 0 ? "" : ", ").append(m.name()).append('=');
            if ("String".equals(m.type())) {
                sb.append("'\" + ").append(m.name()).append(" + '\\''");
            } else {
                sb.append("\" + ").append(m.name());
            }
        }
        sb.append("\n").append(in3).append("+ '}';\n");
        sb.append(in).append("}\n");
        return sb.toString();
    }

    private static String equalityTerm(Member m) {
        return switch (m.type()) {
            case "long", "boolean" -> "this." + m.name() + " == that." + m.name();
            case "double" -> "Double.compare(this." + m.name() + ", that." + m.name() + ") == 0";
            default -> "Objects.equals(this." + m.name() + ", that." + m.name() + ")";
        };
    }

    @Override
    protected Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    protected String scalarType(ScalarKind kind) {
        return switch (kind) {
            case STRING -> "String";
            case INTEGER -> "long";
            case DOUBLE -> "double";
            case BOOLEAN -> "boolean";
            case ANY -> "Object";
        };
    }

    @Override
    protected String elementType(Shape shape, EmitScope scope) {
        if (shape instanceof Shape.Scalar scalar) {
            return switch (scalar.kind()) {
                case INTEGER -> "Long";
                case DOUBLE -> "Double";
                case BOOLEAN -> "Boolean";
                default -> scalarType(scalar.kind());
            };
        }
        return typeOf(shape, scope);
    }

    @Override
    protected String listType(String elementType) {
        return "List<" + elementType + ">";
    }

    private record Member(String name, String type) {
    }
}
