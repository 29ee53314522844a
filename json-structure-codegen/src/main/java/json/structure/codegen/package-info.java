/// Class generation from inferred JSON structure.
///
/// [json.structure.codegen.JsonStructureGenerator] parses a sample, infers a
/// [json.structure.schema.ClassSchema] and renders it with the
/// [json.structure.codegen.ClassEmitter] of a
/// [json.structure.codegen.TargetLanguage]. Each class is rendered on its
/// own; one that fails is replaced by a comment naming it.
/// [json.structure.codegen.ClassGenCli] exposes the same on the command line.
package json.structure.codegen;
