package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.ScalarKind;
import json.structure.schema.Shape;

import java.util.ArrayList;
import java.util.Set;

/// `@dataclass` classes with snake_case fields and `typing` annotations.
final class PythonEmitter extends AbstractClassEmitter {

    private static final Set<String> RESERVED = Set.of(
            "and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del", "elif",
            "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is", "lambda",
            "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    @Override
    public TargetLanguage language() {
        return TargetLanguage.PYTHON;
    }

    @Override
    protected String commentPrefix() {
        return "#";
    }

    @Override
    protected String preamble(ClassSchema root) {
        final var typing = new ArrayList<String>();
        if (anyField(root, f -> usesScalar(f.shape(), ScalarKind.ANY))) {
            typing.add("Any");
        }
        if (anyField(root, f -> f.shape() instanceof Shape.ListOf)) {
            typing.add("List");
        }
        if (anyField(root, f -> f.nullable())) {
            typing.add("Optional");
        }
        final var sb = new StringBuilder("from dataclasses import dataclass\n");
        if (!typing.isEmpty()) {
            sb.append("from typing import ").append(String.join(", ", typing)).append('\n');
        }
        return sb.toString();
    }

    @Override
    protected String classSeparator() {
        return "\n\n";
    }

    @Override
    protected Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    protected String renderClass(ClassSchema cls, EmitScope scope) {
        final var sb = new StringBuilder();
        sb.append("@dataclass\n");
        sb.append("class ").append(cls.name()).append(":\n");
        if (cls.fields().isEmpty()) {
            sb.append("    pass\n");
        }
        for (final var field : cls.fields()) {
            sb.append("    ").append(identifier(snakeCase(field.generatedName()))).append(": ")
              .append(fieldType(field, scope)).append('\n');
        }
        return sb.toString();
    }

    @Override
    protected String scalarType(ScalarKind kind) {
        return switch (kind) {
            case STRING -> "str";
            case INTEGER -> "int";
            case DOUBLE -> "float";
            case BOOLEAN -> "bool";
            case ANY -> "Any";
        };
    }

    @Override
    protected String listType(String elementType) {
        return "List[" + elementType + "]";
    }

    @Override
    protected String nullableType(String type) {
        return "Optional[" + type + "]";
    }
}
