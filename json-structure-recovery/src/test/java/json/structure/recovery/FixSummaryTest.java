package json.structure.recovery;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

class FixSummaryTest extends RecoveryLoggingConfig {

    private static final Logger LOG = Logger.getLogger(FixSummaryTest.class.getName());

    @Test
    void emptyListHasNoFixes() {
        LOG.info(() -> "TEST: emptyListHasNoFixes");
        assertThat(FixSummary.of(List.of())).isEqualTo("No fixes applied");
    }

    @Test
    void countsArePluralisedAndInFixedOrder() {
        LOG.info(() -> "TEST: countsArePluralisedAndInFixedOrder");
        final var changes = List.of(
            new FixChange(FixKind.MISSING_COMMA, 3, "Added missing comma after value"),
            new FixChange(FixKind.TRAILING_COMMA, 5, "Removed trailing comma"),
            new FixChange(FixKind.TRAILING_COMMA, 9, "Removed trailing comma"));

        assertThat(FixSummary.of(changes)).isEqualTo("Fixed: 2 trailing commas, 1 missing comma");
    }

    @Test
    void singularLabels() {
        LOG.info(() -> "TEST: singularLabels");
        final var changes = List.of(
            new FixChange(FixKind.UNQUOTED_KEY, 1, "Added quotes around key \"a\""),
            new FixChange(FixKind.SINGLE_QUOTES, 1, "Converted single quotes to double quotes"));

        assertThat(FixSummary.of(changes)).isEqualTo("Fixed: 1 single quote conversion, 1 unquoted key");
    }
}
