package json.structure.tree;

import org.junit.jupiter.api.Test;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

/// Tests for path construction and rendering.
class TreePathTest extends TreeLoggingConfig {

    private static final Logger LOG = Logger.getLogger(TreePathTest.class.getName());

    @Test
    void buildsMixedSegments() {
        LOG.info(() -> "TEST: buildsMixedSegments");

        final var path = TreePath.of("orders", 0, "total");

        assertThat(path.size()).isEqualTo(3);
        assertThat(path.segments()).containsExactly(
                new TreePath.Key("orders"), new TreePath.Index(0), new TreePath.Key("total"));
        assertThat(path.parent()).isEqualTo(TreePath.root().child("orders").child(0));
        assertThat(path.last()).isEqualTo(new TreePath.Key("total"));
        assertThat(path.toString()).isEqualTo("/orders/0/total");
    }

    @Test
    void rootHasNoLastSegment() {
        LOG.info(() -> "TEST: rootHasNoLastSegment");

        assertThat(TreePath.root().isRoot()).isTrue();
        assertThat(TreePath.root().parent()).isSameAs(TreePath.root());
        assertThat(TreePath.root().toString()).isEqualTo("/");
        assertThatThrownBy(() -> TreePath.root().last()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void escapesPointerCharactersInKeys() {
        LOG.info(() -> "TEST: escapesPointerCharactersInKeys");

        assertThat(TreePath.of("a/b", "c~d").toString()).isEqualTo("/a~1b/c~0d");
    }

    @Test
    void rejectsUnsupportedSegmentTypes() {
        LOG.info(() -> "TEST: rejectsUnsupportedSegmentTypes");

        assertThatThrownBy(() -> TreePath.of("a", 1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Long");
    }
}
