package json.structure.schema;

/// Scalar types inferred from sample values.
public enum ScalarKind {
    STRING,
    /// A number with no fractional component.
    INTEGER,
    /// A number with a fractional component.
    DOUBLE,
    BOOLEAN,
    /// Unknown from the sample: a `null` or an element of an empty array.
    ANY
}
