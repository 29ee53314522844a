package json.structure.recovery;

import json.structure.tree.JsonValue;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Outcome of a single repair pass.
///
/// @param fixedText the repaired text, or the input when nothing was repaired
/// @param changes the edits applied, in text order
/// @param remaining defects found when re-validating `fixedText`; when the
///                  input had a complex defect this is the input's full classification
/// @param value the tree parsed from `fixedText`, present exactly when `remaining` is empty
public record RepairResult(String fixedText, List<FixChange> changes, List<SyntaxErrorRecord> remaining,
                           Optional<JsonValue> value) {

    public RepairResult {
        Objects.requireNonNull(fixedText, "fixedText must not be null");
        Objects.requireNonNull(value, "value must not be null");
        changes = List.copyOf(changes);
        remaining = List.copyOf(remaining);
        if (remaining.isEmpty() != value.isPresent()) {
            throw new IllegalArgumentException("value must be present exactly when no defects remain");
        }
    }

    /// {@return `true` if at least one edit was applied}
    public boolean wasFixed() {
        return !changes.isEmpty();
    }

    /// {@return `true` if the repaired text is valid JSON}
    public boolean isValid() {
        return remaining.isEmpty();
    }
}
