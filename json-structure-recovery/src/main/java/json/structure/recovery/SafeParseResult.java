package json.structure.recovery;

import json.structure.tree.JsonParseException;
import json.structure.tree.JsonValue;

import java.util.List;

/// Outcome of [JsonSafe#parse(String)].
public sealed interface SafeParseResult permits SafeParseResult.Ok, SafeParseResult.Err {

    /// {@return the input after BOM removal and line-ending normalisation}
    String normalized();

    /// {@return comments detected in the normalised text}
    List<CommentMatch> comments();

    /// {@return `true` if any comment was detected}
    default boolean hasComments() {
        return !comments().isEmpty();
    }

    /// The text parsed.
    record Ok(JsonValue value, String normalized, List<CommentMatch> comments) implements SafeParseResult {
        public Ok {
            comments = List.copyOf(comments);
        }
    }

    /// The text did not parse. `errors` is never empty.
    record Err(JsonParseException error, List<SyntaxErrorRecord> errors, String normalized,
               List<CommentMatch> comments) implements SafeParseResult {
        public Err {
            errors = List.copyOf(errors);
            comments = List.copyOf(comments);
        }
    }
}
