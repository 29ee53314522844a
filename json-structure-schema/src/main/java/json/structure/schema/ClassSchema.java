package json.structure.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// An inferred class: its fields in sample order, and the classes its fields
/// introduced. Every [Shape.ClassRef] reachable from this schema names exactly
/// one class in [#allClasses()].
///
/// @param name the class name
/// @param fields fields in the order their keys appeared
/// @param nestedClasses classes introduced by this class's fields, in first-encountered order
public record ClassSchema(String name, List<FieldDescriptor> fields, List<ClassSchema> nestedClasses) {

    public ClassSchema {
        Objects.requireNonNull(name, "name must not be null");
        fields = List.copyOf(fields);
        nestedClasses = List.copyOf(nestedClasses);
    }

    /// {@return this class and every class below it, children before the class that declares them}
    public List<ClassSchema> allClasses() {
        final var out = new ArrayList<ClassSchema>();
        collect(this, out);
        return out;
    }

    private static void collect(ClassSchema schema, List<ClassSchema> out) {
        schema.nestedClasses.forEach(child -> collect(child, out));
        out.add(schema);
    }

    /// {@return the class with the given name, searching this class and all below it}
    public Optional<ClassSchema> find(String className) {
        return allClasses().stream().filter(c -> c.name.equals(className)).findFirst();
    }

    /// {@return the nesting depth of this class tree; a class with no nested classes has depth 1}
    public int depth() {
        return 1 + nestedClasses.stream().mapToInt(ClassSchema::depth).max().orElse(0);
    }
}
