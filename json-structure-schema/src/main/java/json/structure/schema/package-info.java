/// Class schema inference from a single JSON sample.
///
/// [json.structure.schema.SchemaInference] walks a sample tree and produces a
/// [json.structure.schema.ClassSchema] per object it meets. Field and class
/// identifiers come from [json.structure.schema.Names].
package json.structure.schema;
