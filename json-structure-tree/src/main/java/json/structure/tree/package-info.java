/// The immutable JSON value tree shared by the editor, recovery, schema
/// inference and code generation modules.
///
/// [json.structure.tree.JsonValue] is a closed set of record variants,
/// [json.structure.tree.TreePath] addresses nodes, and
/// [json.structure.tree.Json] parses and renders documents.
package json.structure.tree;
