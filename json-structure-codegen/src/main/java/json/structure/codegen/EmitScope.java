package json.structure.codegen;

import json.structure.schema.ClassSchema;

import java.util.Set;
import java.util.stream.Collectors;

/// The class names one emit pass may reference.
record EmitScope(Set<String> classNames) {

    EmitScope {
        classNames = Set.copyOf(classNames);
    }

    static EmitScope of(ClassSchema root) {
        return new EmitScope(root.allClasses().stream().map(ClassSchema::name).collect(Collectors.toSet()));
    }

    /// @throws CodegenException if no class in the schema has this name
    String requireClass(String name) {
        if (!classNames.contains(name)) {
            throw new CodegenException("Unresolved class reference '" + name + "'");
        }
        return name;
    }
}
