package com.example.labelverifier.service.matching;

import com.example.labelverifier.model.FieldCheckResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GovernmentWarningMatcherTest {

    private final GovernmentWarningMatcher matcher = new GovernmentWarningMatcher();

    @Test
    void findsHeadingInAnyCase() {
        FieldCheckResult result = matcher.check("GOVERNMENT\nWARNING: (1) According to the Surgeon General", null);

        assertThat(result.field()).isEqualTo("Government Warning");
        assertThat(result.matched()).isTrue();
        assertThat(result.message()).isEqualTo("Government warning found on label");
    }

    @Test
    void partiallyFindsWarningFromTwoKeyPhrases() {
        FieldCheckResult result = matcher.check("GOVERNM3NT WARN1NG women should not drink when Pregnant ... impairs DRIVING", null);

        assertThat(result.matched()).isTrue();
        assertThat(result.message()).isEqualTo("Government warning partially found");
    }

    @Test
    void failsWithSingleKeyPhrase() {
        FieldCheckResult result = matcher.check("women should not drink when pregnant", null);

        assertThat(result.matched()).isFalse();
        assertThat(result.message()).isEqualTo("Government warning not found on label");
    }

    @Test
    void matchesMultiWordPhrasesAcrossLineBreaks() {
        assertThat(matcher.check("ability to operate\n... operating\nmachinery and may cause health\nproblems", null)
                .message()).isEqualTo("Government warning partially found");
    }

    @Test
    void ignoresExpectedValue() {
        assertThat(matcher.check("nothing relevant", "government warning").matched()).isFalse();
    }

    @Test
    void failsForEmptyText() {
        assertThat(matcher.check(null, null).matched()).isFalse();
    }
}
