package json.structure.codegen;

import json.structure.schema.ClassSchema;

/// Renders an inferred class tree as source text in one target language.
///
/// Implementations hold no mutable state. A class that cannot be rendered is
/// replaced by a comment naming it, and the remaining classes are still
/// emitted.
public interface ClassEmitter {

    /// {@return the language this emitter writes}
    TargetLanguage language();

    /// {@return the complete source text for `schema` and every class below it}
    String emit(ClassSchema schema);
}
