package json.structure.recovery;

/// A `//` or `/* */` comment found outside strings.
///
/// @param line 1-based line where the comment starts
/// @param kind line or block comment
/// @param preview at most the first 80 characters, newlines flattened to spaces
public record CommentMatch(int line, Kind kind, String preview) {

    /// Comment syntax.
    public enum Kind { SINGLE, MULTI }
}
