package json.structure.recovery;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

/// Renders a list of [FixChange]s as a one-line summary such as
/// `Fixed: 2 trailing commas, 1 missing comma`.
public final class FixSummary {

    private FixSummary() {
    }

    /// {@return a human-readable summary of the changes, or `No fixes applied`}
    public static String of(List<FixChange> changes) {
        if (changes.isEmpty()) {
            return "No fixes applied";
        }
        final var counts = new EnumMap<FixKind, Integer>(FixKind.class);
        changes.forEach(c -> counts.merge(c.kind(), 1, Integer::sum));

        final var parts = new ArrayList<String>();
        counts.forEach((kind, count) -> parts.add(count + " " + kind.label() + (count > 1 ? "s" : "")));
        return "Fixed: " + String.join(", ", parts);
    }
}
