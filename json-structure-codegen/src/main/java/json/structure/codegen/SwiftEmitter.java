package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.ScalarKind;

import java.util.Set;

/// `Codable` structs with `let` properties. A `CodingKeys` enum is added when
/// any property name differs from its JSON key.
final class SwiftEmitter extends AbstractClassEmitter {

    private static final Set<String> RESERVED = Set.of(
            "associatedtype", "class", "deinit", "enum", "extension", "fileprivate", "func", "import", "init",
            "inout", "internal", "let", "open", "operator", "private", "protocol", "public", "static",
            "struct", "subscript", "typealias", "var", "break", "case", "continue", "default", "defer", "do",
            "else", "fallthrough", "for", "guard", "if", "in", "repeat", "return", "switch", "where", "while",
            "as", "catch", "false", "is", "nil", "rethrows", "super", "self", "throw", "throws", "true", "try");

    @Override
    public TargetLanguage language() {
        return TargetLanguage.SWIFT;
    }

    @Override
    protected String preamble(ClassSchema root) {
        return "import Foundation\n";
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
        final var sb = new StringBuilder();
        sb.append("struct ").append(cls.name()).append(": Codable {\n");
        for (final var field : cls.fields()) {
            sb.append("    let ").append(identifier(field.generatedName())).append(": ")
              .append(fieldType(field, scope)).append('\n');
        }
        final var renamed = cls.fields().stream().anyMatch(f -> !f.generatedName().equals(f.sourceKey()));
        if (renamed) {
            sb.append('\n');
            sb.append("    enum CodingKeys: String, CodingKey {\n");
            for (final var field : cls.fields()) {
                sb.append("        case ").append(identifier(field.generatedName()));
                if (!field.generatedName().equals(field.sourceKey())) {
                    sb.append(" = ").append(quoted(field.sourceKey()));
                }
                sb.append('\n');
            }
            sb.append("    }\n");
        }
        return sb.append("}\n").toString();
    }

    @Override
    protected String scalarType(ScalarKind kind) {
        return switch (kind) {
            case STRING -> "String";
            case INTEGER -> "Int";
            case DOUBLE -> "Double";
            case BOOLEAN -> "Bool";
            case ANY -> "Any";
        };
    }

    @Override
    protected String listType(String elementType) {
        return "[" + elementType + "]";
    }

    @Override
    protected String nullableType(String type) {
        return type + "?";
    }
}
