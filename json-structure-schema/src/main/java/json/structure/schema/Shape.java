package json.structure.schema;

import java.util.Objects;

/// The inferred type of a field.
///
/// Consumers dispatch with an `instanceof` chain over the three variants.
public sealed interface Shape permits Shape.Scalar, Shape.ListOf, Shape.ClassRef {

    /// A scalar of the given kind.
    record Scalar(ScalarKind kind) implements Shape {
        public Scalar {
            Objects.requireNonNull(kind, "kind must not be null");
        }
    }

    /// A list whose elements all have `element`'s shape.
    record ListOf(Shape element) implements Shape {
        public ListOf {
            Objects.requireNonNull(element, "element must not be null");
        }
    }

    /// A reference to a class in the enclosing [ClassSchema] tree.
    record ClassRef(String name) implements Shape {
        public ClassRef {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// {@return a scalar shape}
    static Shape scalar(ScalarKind kind) {
        return new Scalar(kind);
    }

    /// {@return the number of list wrappers around the innermost shape}
    default int listDepth() {
        return this instanceof ListOf list ? 1 + list.element().listDepth() : 0;
    }

    /// {@return the shape with every list wrapper removed}
    default Shape innermost() {
        return this instanceof ListOf list ? list.element().innermost() : this;
    }
}
