package json.structure.codegen;

import json.structure.schema.ClassSchema;
import json.structure.schema.FieldDescriptor;
import json.structure.schema.ScalarKind;
import json.structure.schema.Shape;
import json.structure.tree.Json;

import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Shared layout for emitters that write one top-level declaration per class.
///
/// Output is the generated-by comment, the [#preamble(ClassSchema)], then
/// every class in [ClassSchema#allClasses()] order so a type is declared
/// before the first class that uses it. Subclasses supply the type table and
/// the body of a single class.
abstract class AbstractClassEmitter implements ClassEmitter {

    static final String GENERATED_BY = "Generated from JSON sample by json-structure";

    private static final Logger LOG = Logger.getLogger(AbstractClassEmitter.class.getName());

    @Override
    public String emit(ClassSchema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        final var scope = EmitScope.of(schema);
        final var sb = new StringBuilder(1024);
        sb.append(commentPrefix()).append(' ').append(GENERATED_BY).append('\n');
        sb.append(preamble(schema));
        for (final var cls : schema.allClasses()) {
            sb.append(classSeparator());
            sb.append(isolated(cls, "", () -> renderClass(cls, scope)));
        }
        LOG.fine(() -> language().id() + ": emitted " + schema.allClasses().size() + " classes for " + schema.name());
        return sb.toString();
    }

    /// {@return lines between the generated-by comment and the first class, such as imports}
    protected String preamble(ClassSchema root) {
        return "";
    }

    /// {@return the text placed before each class}
    protected String classSeparator() {
        return "\n";
    }

    /// {@return the line comment marker}
    protected String commentPrefix() {
        return "//";
    }

    /// Renders one class, ending with a newline.
    /// @throws CodegenException if the class has a shape this language cannot express
    protected abstract String renderClass(ClassSchema cls, EmitScope scope);

    protected abstract String scalarType(ScalarKind kind);

    protected abstract String listType(String elementType);

    /// {@return the type used for a field whose sample value was `null`}
    protected String nullableType(String type) {
        return type;
    }

    /// {@return words that cannot be used as member names}
    protected Set<String> reservedWords() {
        return Set.of();
    }

    /// {@return `name` made safe to use as a member name}
    protected String identifier(String name) {
        return reservedWords().contains(name) ? name + "_" : name;
    }

    /// Runs `render`, replacing any failure with a comment for that class alone.
    protected final String isolated(ClassSchema cls, String indent, Supplier<String> render) {
        try {
            return render.get();
        } catch (RuntimeException e) {
            final var reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            LOG.warning(() -> language().id() + ": could not generate class " + cls.name() + ": " + reason);
            return indent + failureComment(cls.name(), reason) + "\n";
        }
    }

    protected String failureComment(String className, String reason) {
        return commentPrefix() + " Could not generate class " + className + ": " + reason;
    }

    protected final String typeOf(Shape shape, EmitScope scope) {
        if (shape instanceof Shape.Scalar scalar) {
            return scalarType(scalar.kind());
        }
        if (shape instanceof Shape.ListOf list) {
            return listType(elementType(list.element(), scope));
        }
        if (shape instanceof Shape.ClassRef ref) {
            return scope.requireClass(ref.name());
        }
        throw new CodegenException("Unsupported shape " + shape);
    }

    /// {@return the spelling of `shape` as a collection element}
    protected String elementType(Shape shape, EmitScope scope) {
        return typeOf(shape, scope);
    }

    protected final String fieldType(FieldDescriptor field, EmitScope scope) {
        final var type = typeOf(field.shape(), scope);
        return field.nullable() ? nullableType(type) : type;
    }

    /// {@return `true` if any field of any class under `root` matches}
    static boolean anyField(ClassSchema root, Predicate<FieldDescriptor> test) {
        return root.allClasses().stream().flatMap(c -> c.fields().stream()).anyMatch(test);
    }

    static boolean usesScalar(Shape shape, ScalarKind kind) {
        return shape.innermost() instanceof Shape.Scalar scalar && scalar.kind() == kind;
    }

    /// {@return `firstName` as `first_name`}
    static String snakeCase(String camel) {
        final var sb = new StringBuilder(camel.length() + 4);
        for (int i = 0; i < camel.length(); i++) {
            final char c = camel.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && camel.charAt(i - 1) != '_') {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /// {@return `s` as a double-quoted literal using JSON escapes, which C-family languages also accept}
    static String quoted(String s) {
        return Json.quote(s);
    }
}
