package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.Names;
import json.structure.schema.ScalarKind;

import java.util.ArrayList;

/// Structs in package `main` with exported fields and `json` tags, aligned
/// the way `gofmt` aligns them.
final class GoEmitter extends AbstractClassEmitter {

    @Override
    public TargetLanguage language() {
        return TargetLanguage.GO;
    }

    @Override
    protected String preamble(ClassSchema root) {
        return "\npackage main\n";
    }

    @Override
    protected String renderClass(ClassSchema cls, EmitScope scope) {
        final var names = new ArrayList<String>();
        final var types = new ArrayList<String>();
        for (final var field : cls.fields()) {
            names.add(exported(field.generatedName()));
            types.add(fieldType(field, scope));
        }
        final var nameWidth = names.stream().mapToInt(String::length).max().orElse(0);
        final var typeWidth = types.stream().mapToInt(String::length).max().orElse(0);

        final var sb = new StringBuilder();
        sb.append("type ").append(cls.name()).append(" struct {\n");
        for (int i = 0; i < names.size(); i++) {
            sb.append('\t').append(pad(names.get(i), nameWidth)).append(' ')
              .append(pad(types.get(i), typeWidth)).append(" `json:")
              .append(quoted(cls.fields().get(i).sourceKey())).append("`\n");
        }
        return sb.append("}\n").toString();
    }

    private static String exported(String generatedName) {
        final var name = Names.capitalize(generatedName);
        return name.startsWith("_") ? "X" + name : name;
    }

    private static String pad(String s, int width) {
        return s + " ".repeat(width - s.length());
    }

    @Override
    protected String scalarType(ScalarKind kind) {
        return switch (kind) {
            case STRING -> "string";
            case INTEGER -> "int64";
            case DOUBLE -> "float64";
            case BOOLEAN -> "bool";
            case ANY -> "interface{}";
        };
    }

    @Override
    protected String listType(String elementType) {
        return "[]" + elementType;
    }
}
