package json.structure.recovery;

import java.util.Objects;

/// One textual edit applied by the repair pass.
///
/// @param kind what was repaired
/// @param line 1-based line of the edit in the input text
/// @param description what the edit did, e.g. `Removed trailing comma`
public record FixChange(FixKind kind, int line, String description) {

    public FixChange {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }
}
