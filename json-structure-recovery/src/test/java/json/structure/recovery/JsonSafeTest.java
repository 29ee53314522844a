package json.structure.recovery;

import json.structure.tree.JsonNumber;
import org.junit.jupiter.api.Test;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

class JsonSafeTest extends RecoveryLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonSafeTest.class.getName());

    @Test
    void stripsBomAndNormalisesLineEndings() {
        LOG.info(() -> "TEST: stripsBomAndNormalisesLineEndings");

        final var result = JsonSafe.parse("\uFEFF{\r\n  \"a\": 1\r\n}");

        assertThat(result).isInstanceOf(SafeParseResult.Ok.class);
        final var ok = (SafeParseResult.Ok) result;
        assertThat(ok.normalized()).isEqualTo("{\n  \"a\": 1\n}");
        assertThat(ok.value().get("a")).isEqualTo(JsonNumber.of(1));
        assertThat(ok.hasComments()).isFalse();
    }

    @Test
    void reportsCommentsOutsideStrings() {
        LOG.info(() -> "TEST: reportsCommentsOutsideStrings");
        final var text = "{\n  // first\n  \"url\": \"http://x\", /* block\n comment */\n  \"b\": 2\n}";

        final var result = JsonSafe.parse(text);

        assertThat(result.comments()).containsExactly(
            new CommentMatch(2, CommentMatch.Kind.SINGLE, "// first"),
            new CommentMatch(3, CommentMatch.Kind.MULTI, "/* block  comment */"));
        assertThat(result).isInstanceOf(SafeParseResult.Err.class);
        final var err = (SafeParseResult.Err) result;
        assertThat(err.errors()).isNotEmpty();
        assertThat(err.errors().get(0).message()).isEqualTo("Comments are not allowed in JSON");
        assertThat(err.errors().get(0).line()).isEqualTo(2);
        assertThat(err.errors().get(0).column()).isEqualTo(3);
    }

    @Test
    void failureCarriesClassifiedErrors() {
        LOG.info(() -> "TEST: failureCarriesClassifiedErrors");

        final var result = JsonSafe.parse("{\"a\": 1,}");

        assertThat(result).isInstanceOf(SafeParseResult.Err.class);
        final var err = (SafeParseResult.Err) result;
        assertThat(err.error().line()).isEqualTo(1);
        assertThat(err.errors()).hasSize(1);
        assertThat(err.errors().get(0).isSimple()).isTrue();
        assertThat(SyntaxRecovery.isAutoFixable(err.errors())).isTrue();
    }

    @Test
    void previewIsTruncated() {
        LOG.info(() -> "TEST: previewIsTruncated");
        final var longComment = "// " + "x".repeat(200);

        final var comments = JsonSafe.detectComments(longComment);

        assertThat(comments).hasSize(1);
        assertThat(comments.get(0).preview()).hasSize(80);
    }
}
