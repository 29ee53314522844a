package json.structure.recovery;

import json.structure.tree.Json;
import json.structure.tree.JsonParseException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Locates syntax defects in raw JSON text and repairs the simple ones.
///
/// [#classify(String)] reports every defect with its line, column and
/// [SyntaxErrorRecord.Category]. [#repairSimple(String)] applies one edit per
/// defect in a single pass, but only when every defect is simple; callers can
/// use [#isAutoFixable(List)] to decide whether to offer an automatic fix or
/// escalate.
///
/// ```java
/// final var result = SyntaxRecovery.repairSimple("{'name': 'Ada', age: 37,}");
/// result.fixedText();                  // {"name": "Ada", "age": 37}
/// FixSummary.of(result.changes());     // Fixed: 1 trailing comma, 2 single quote conversions, 1 unquoted key
/// ```
public final class SyntaxRecovery {

    private static final Logger LOG = Logger.getLogger(SyntaxRecovery.class.getName());

    private SyntaxRecovery() {
    }

    /// Validates raw text.
    /// @param text the text to check
    /// @return defects ordered by offset, one per line and column with the
    ///         messages of defects sharing a position joined by `; `; empty
    ///         exactly when the text is valid JSON
    public static List<SyntaxErrorRecord> classify(String text) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            Json.parse(text);
            return List.of();
        } catch (JsonParseException e) {
            return defects(text, e);
        }
    }

    /// {@return `true` if there is at least one defect and all of them are simple}
    public static boolean isAutoFixable(List<SyntaxErrorRecord> errors) {
        return !errors.isEmpty() && errors.stream().allMatch(SyntaxErrorRecord::isSimple);
    }

    /// Repairs simple defects in one pass and re-validates the result.
    ///
    /// Valid input is returned as-is with no changes. Input with any complex
    /// defect is also returned as-is, with `remaining` holding its full
    /// classification. Otherwise each simple defect gets exactly one edit and
    /// whatever [#classify(String)] reports for the edited text is returned as
    /// `remaining`; the pass is never repeated. The parsed tree is attached
    /// whenever the returned text is valid.
    public static RepairResult repairSimple(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final List<SyntaxErrorRecord> errors;
        try {
            return new RepairResult(text, List.of(), List.of(), Optional.of(Json.parse(text)));
        } catch (JsonParseException e) {
            errors = defects(text, e);
        }
        final var defects = SyntaxScanner.scan(text);
        final var simple = defects.stream().allMatch(d -> d.error().isSimple());
        if (!simple || defects.isEmpty()) {
            LOG.fine(() -> "Not repairing: " + errors.size() + " defects include complex ones");
            return new RepairResult(text, List.of(), errors, Optional.empty());
        }

        final var edits = defects.stream()
                .map(SyntaxScanner.Defect::edit)
                .sorted(Comparator.comparingInt(SyntaxScanner.Edit::start)
                        .thenComparingInt(SyntaxScanner.Edit::end)
                        .reversed())
                .toList();
        final var fixed = new StringBuilder(text);
        for (final var edit : edits) {
            fixed.replace(edit.start(), edit.end(), edit.replacement());
        }

        final var changes = new ArrayList<FixChange>();
        for (final var d : defects) {
            changes.add(new FixChange(d.fixKind(), d.error().line(), d.fixDescription()));
        }
        final var fixedText = fixed.toString();
        try {
            final var value = Json.parse(fixedText);
            LOG.fine(() -> "Applied " + changes.size() + " fixes, text is now valid");
            return new RepairResult(fixedText, changes, List.of(), Optional.of(value));
        } catch (JsonParseException e) {
            final var remaining = defects(fixedText, e);
            LOG.fine(() -> "Applied " + changes.size() + " fixes, " + remaining.size() + " defects remain");
            return new RepairResult(fixedText, changes, remaining, Optional.empty());
        }
    }

    private static List<SyntaxErrorRecord> defects(String text, JsonParseException e) {
        LOG.fine(() -> "Strict parse failed, scanning for defects: " + e.getMessage());
        final var errors = report(SyntaxScanner.scan(text));
        if (errors.isEmpty()) {
            return List.of(new SyntaxErrorRecord(e.line(), e.column(), e.reason(),
                    SyntaxErrorRecord.Category.COMPLEX, e.offset()));
        }
        return errors;
    }

    /// Collapses defects found at the same line and column into one record
    /// whose message lists each of them; the record is complex if any of them is.
    private static List<SyntaxErrorRecord> report(List<SyntaxScanner.Defect> defects) {
        final var byPosition = new LinkedHashMap<Long, SyntaxErrorRecord>();
        for (final var d : defects) {
            final var e = d.error();
            byPosition.merge(((long) e.line() << 32) | e.column(), e, SyntaxRecovery::combine);
        }
        return List.copyOf(byPosition.values());
    }

    private static SyntaxErrorRecord combine(SyntaxErrorRecord first, SyntaxErrorRecord next) {
        final var category = first.isSimple() && next.isSimple()
                ? SyntaxErrorRecord.Category.SIMPLE
                : SyntaxErrorRecord.Category.COMPLEX;
        return new SyntaxErrorRecord(first.line(), first.column(), first.message() + "; " + next.message(),
                category, first.offset());
    }
}
