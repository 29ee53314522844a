package json.structure.tree;

import org.junit.jupiter.api.Test;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

/// Tests for structure statistics.
class JsonStatisticsTest extends TreeLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonStatisticsTest.class.getName());

    @Test
    void countsEveryKindAndDepth() {
        LOG.info(() -> "TEST: countsEveryKindAndDepth");

        final var stats = JsonStatistics.of(Json.parse("""
            {"name": "x", "tags": ["a", "b"], "meta": {"ok": true, "n": null, "v": 1.5}}
            """));

        assertThat(stats.rootKind()).isEqualTo(JsonValue.Kind.OBJECT);
        assertThat(stats.strings()).isEqualTo(3);
        assertThat(stats.numbers()).isEqualTo(1);
        assertThat(stats.booleans()).isEqualTo(1);
        assertThat(stats.nulls()).isEqualTo(1);
        assertThat(stats.objects()).isEqualTo(2);
        assertThat(stats.arrays()).isEqualTo(1);
        assertThat(stats.maxDepth()).isEqualTo(3);
        assertThat(stats.rootKeys()).containsExactly("name", "tags", "meta");
        assertThat(stats.totalValues()).isEqualTo(9);
    }

    @Test
    void scalarRootHasDepthOne() {
        LOG.info(() -> "TEST: scalarRootHasDepthOne");

        final var stats = JsonStatistics.of(Json.parse("42"));

        assertThat(stats.maxDepth()).isEqualTo(1);
        assertThat(stats.rootKeys()).isEmpty();
    }
}
