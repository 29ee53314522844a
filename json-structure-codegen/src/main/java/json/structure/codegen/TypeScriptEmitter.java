package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.ScalarKind;

/// One `export interface` per class.
final class TypeScriptEmitter extends AbstractClassEmitter {

    @Override
    public TargetLanguage language() {
        return TargetLanguage.TYPESCRIPT;
    }

    @Override
    protected String renderClass(ClassSchema cls, EmitScope scope) {
        final var sb = new StringBuilder();
        sb.append("export interface ").append(cls.name()).append(" {\n");
        for (final var field : cls.fields()) {
            sb.append("  ").append(field.generatedName()).append(": ")
              .append(fieldType(field, scope)).append(";\n");
        }
        return sb.append("}\n").toString();
    }

    @Override
    protected String scalarType(ScalarKind kind) {
        return switch (kind) {
            case STRING -> "string";
            case INTEGER, DOUBLE -> "number";
            case BOOLEAN -> "boolean";
            case ANY -> "any";
        };
    }

    @Override
    protected String listType(String elementType) {
        return elementType + "[]";
    }
}
