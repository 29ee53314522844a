package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.FieldDescriptor;
import json.structure.schema.ScalarKind;
import json.structure.schema.Shape;

import java.util.Set;

/// Plain classes with YARD attribute docs, `attr_accessor` and an
/// `initialize(hash)` that builds nested classes from their hashes.
final class RubyEmitter extends AbstractClassEmitter {

    private static final Set<String> RESERVED = Set.of(
            "alias", "and", "begin", "break", "case", "class", "def", "defined", "do", "else", "elsif", "end",
            "ensure", "false", "for", "if", "in", "module", "next", "nil", "not", "or", "redo", "rescue",
            "retry", "return", "self", "super", "then", "true", "undef", "unless", "until", "when", "while",
            "yield", "hash");

    @Override
    public TargetLanguage language() {
        return TargetLanguage.RUBY;
    }

    @Override
    protected String commentPrefix() {
        return "#";
    }

    @Override
    protected Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    protected String renderClass(ClassSchema cls, EmitScope scope) {
        final var sb = new StringBuilder();
        sb.append("class ").append(cls.name()).append('\n');
        for (final var field : cls.fields()) {
            sb.append("  # @!attribute [rw] ").append(attribute(field)).append('\n');
            sb.append("  #   @return [").append(fieldType(field, scope)).append("]\n");
        }
        if (!cls.fields().isEmpty()) {
            sb.append("  attr_accessor ")
              .append(String.join(", ", cls.fields().stream().map(f -> ":" + attribute(f)).toList()))
              .append("\n\n");
        }
        sb.append("  def initialize(hash = {})\n");
        for (final var field : cls.fields()) {
            final var raw = "hash[" + singleQuoted(field.sourceKey()) + "]";
            sb.append("    @").append(attribute(field)).append(" = ").append(reader(field.shape(), raw)).append('\n');
        }
        sb.append("  end\n");
        return sb.append("end\n").toString();
    }

    private String attribute(FieldDescriptor field) {
        return identifier(snakeCase(field.generatedName()));
    }

    private static String reader(Shape shape, String raw) {
        if (shape instanceof Shape.ClassRef ref) {
            return raw + " && " + ref.name() + ".new(" + raw + ")";
        }
        if (shape instanceof Shape.ListOf list && list.element() instanceof Shape.ClassRef ref) {
            return "(" + raw + " || []).map { |item| " + ref.name() + ".new(item) }";
        }
        return raw;
    }

    private static String singleQuoted(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    protected String scalarType(ScalarKind kind) {
        return switch (kind) {
            case STRING -> "String";
            case INTEGER -> "Integer";
            case DOUBLE -> "Float";
            case BOOLEAN -> "Boolean";
            case ANY -> "Object";
        };
    }

    @Override
    protected String listType(String elementType) {
        return "Array<" + elementType + ">";
    }

    @Override
    protected String nullableType(String type) {
        return type + ", nil";
    }
}
