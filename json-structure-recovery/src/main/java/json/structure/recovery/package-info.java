/// Syntax recovery for JSON text that fails strict parsing.
///
/// [json.structure.recovery.SyntaxRecovery] classifies defects as simple or
/// complex and repairs the simple ones in a single pass.
/// [json.structure.recovery.JsonSafe] is the entry point for user-supplied
/// text: it normalises line endings, reports comments, and returns either a
/// parsed tree or positioned errors.
package json.structure.recovery;
