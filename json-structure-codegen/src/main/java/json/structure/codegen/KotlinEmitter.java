package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.ScalarKind;

import java.util.Set;

/// `data class` declarations; the compiler derives equality, hashing and
/// `toString` from the primary constructor. A class with no fields is a plain
/// `class` since data classes need at least one property.
final class KotlinEmitter extends AbstractClassEmitter {

    private static final Set<String> RESERVED = Set.of(
            "as", "break", "class", "continue", "do", "else", "false", "for", "fun", "if", "in",
            "interface", "is", "null", "object", "package", "return", "super", "this", "throw", "true",
            "try", "typealias", "typeof", "val", "var", "when", "while");

    @Override
    public TargetLanguage language() {
        return TargetLanguage.KOTLIN;
    }

    @Override
    protected Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    protected String identifier(String name) {
        return reservedWords().contains(name) ? "`" + name + "`" : name;
    }

    @Override
    protected String renderClass(ClassSchema cls, EmitScope scope) {
        if (cls.fields().isEmpty()) {
            return "class " + cls.name() + "\n";
        }
        final var params = cls.fields().stream()
                .map(f -> "    val " + identifier(f.generatedName()) + ": " + fieldType(f, scope))
                .toList();
        return "data class " + cls.name() + "(\n" + String.join(",\n", params) + "\n)\n";
    }

    @Override
    protected String scalarType(ScalarKind kind) {
        return switch (kind) {
            case STRING -> "String";
            case INTEGER -> "Long";
            case DOUBLE -> "Double";
            case BOOLEAN -> "Boolean";
            case ANY -> "Any";
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
