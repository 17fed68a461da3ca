package io.buildeval.core.evaluation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EscapingUtilities")
class EscapingUtilitiesTest {

    @Test
    @DisplayName("escapes every special character as lower-case hex")
    void escapes() {
        assertThat(EscapingUtilities.escape("a;b")).isEqualTo("a%3bb");
        assertThat(EscapingUtilities.escape("$(x)")).isEqualTo("%24%28x%29");
        assertThat(EscapingUtilities.escape("50%")).isEqualTo("50%25");
        assertThat(EscapingUtilities.escape("plain")).isSameAs("plain");
    }

    @Test
    @DisplayName("unescapes valid sequences in either case and leaves broken ones")
    void unescapes() {
        assertThat(EscapingUtilities.unescape("a%3Bb%3bc")).isEqualTo("a;b;c");
        assertThat(EscapingUtilities.unescape("100%")).isEqualTo("100%");
        assertThat(EscapingUtilities.unescape("%zz%4")).isEqualTo("%zz%4");
        assertThat(EscapingUtilities.unescape(null)).isNull();
    }

    @Test
    @DisplayName("unescape reverses escape")
    void reverses() {
        String raw = "@(i);%(m)*?'x'";
        assertThat(EscapingUtilities.unescape(EscapingUtilities.escape(raw))).isEqualTo(raw);
    }

    @Test
    @DisplayName("detects wildcards")
    void wildcards() {
        assertThat(EscapingUtilities.containsWildcards("src/**/*.cs")).isTrue();
        assertThat(EscapingUtilities.containsWildcards("a?.txt")).isTrue();
        assertThat(EscapingUtilities.containsWildcards("src%2a.cs")).isFalse();
    }
}
