package tech.yump.logs.sanitize;

import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedactionEngineTest {

    private final RedactionEngine engine = new RedactionEngine();

    @Test
    @DisplayName("sanitize: long password line keeps a 24-char prefix followed by the marker and the line hash")
    void sanitize_longPasswordLine_isRedactedWithPrefixAndHash() {
        String line = "2024-01-01 password=abc123";

        String result = engine.sanitize(line);

        assertThat(result).isEqualTo("2024-01-01 password=abc1 [REDACTED] "
                + "288f282a7d43dd882dac028bc1439e795b9fbb1d412b8914ec9f2ee223aa9956");
    }

    @Test
    @DisplayName("sanitize: sensitive line shorter than the prefix is kept in full before the marker")
    void sanitize_shortSecretLine_keepsWholeLine() {
        String result = engine.sanitize("secret=x");

        assertThat(result).isEqualTo("secret=x [REDACTED] "
                + "c6730aea3d8fc38d93abf1d59e33a1809a791a429ec7e121fdb62858cb748da0");
    }

    @Test
    @DisplayName("sanitize: non-sensitive lines, empty lines and a trailing newline are preserved")
    void sanitize_preservesLineStructure() {
        String content = "INFO started\n\nDEBUG ready\n";

        assertThat(engine.sanitize(content)).isEqualTo(content);
    }

    @Test
    @DisplayName("sanitize: only the sensitive line of a multi-line file changes, order is kept")
    void sanitize_multiLine_onlySensitiveLineChanges() {
        String content = "first line\napi_token=abcdef\nlast line";

        String result = engine.sanitize(content);

        assertThat(result.split("\n", -1)).containsExactly(
                "first line",
                "api_token=abcdef [REDACTED] 57c95b08da3ad30865431c8911cd834ba123f604a72800192309f06fdb17fbfa",
                "last line");
    }

    @ParameterizedTest
    @ValueSource(strings = {"PASSWORD=1", "the Token expired", "keyboard layout changed", "monkey business", "Top SECRET"})
    @DisplayName("isSensitive: keywords match as case-insensitive substrings, including inside other words")
    void isSensitive_substringMatches(String line) {
        assertThat(engine.isSensitive(line)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "INFO user logged in", "pass=1", "tok en"})
    @DisplayName("isSensitive: lines without a keyword are not sensitive")
    void isSensitive_noKeyword(String line) {
        assertThat(engine.isSensitive(line)).isFalse();
    }

    @Test
    @DisplayName("sanitize: second pass leaves redacted lines alone when their prefix has no keyword")
    void sanitize_isIdempotentWhenPrefixIsClean() {
        String content = "user=bob action=login and then the password=hunter2 was used\nplain line";
        String once = engine.sanitize(content);

        assertThat(once.split("\n")[0]).startsWith("user=bob action=login an [REDACTED] ");
        assertThat(engine.sanitize(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("sanitize: second pass re-redacts a line whose kept prefix still contains a keyword")
    void sanitize_secondPassReRedactsKeywordInPrefix() {
        String once = engine.sanitize("2024-01-01 password=abc123");

        String twice = engine.sanitize(once);

        assertThat(twice).isEqualTo("2024-01-01 password=abc1 [REDACTED] " + DigestUtils.sha256Hex(once));
        assertThat(twice).isNotEqualTo(once);
    }

    @Test
    @DisplayName("decide: prefix is counted in code points, never splitting a surrogate pair")
    void decide_prefixCountsCodePoints() {
        String line = "🔑".repeat(30) + " key";

        RedactionDecision decision = engine.decide(line);

        assertThat(decision.sensitive()).isTrue();
        assertThat(decision.replacement()).startsWith("🔑".repeat(24) + " [REDACTED] ");
        assertThat(decision.replacement()).endsWith(DigestUtils.sha256Hex(line));
    }

    @Test
    @DisplayName("decide: non-sensitive line is kept as is")
    void decide_keepsNonSensitive() {
        RedactionDecision decision = engine.decide("all good");

        assertThat(decision.sensitive()).isFalse();
        assertThat(decision.replacement()).isEqualTo("all good");
    }

    @Test
    @DisplayName("sanitize: null content is rejected")
    void sanitize_null_throws() {
        assertThatThrownBy(() -> engine.sanitize(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
