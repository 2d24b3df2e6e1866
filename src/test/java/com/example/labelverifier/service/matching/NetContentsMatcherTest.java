package com.example.labelverifier.service.matching;

import com.example.labelverifier.model.FieldCheckResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NetContentsMatcherTest {

    private final NetContentsMatcher matcher = new NetContentsMatcher();

    @Test
    void passesWhenNotProvided() {
        FieldCheckResult result = matcher.check("no volume printed", null);

        assertThat(result.field()).isEqualTo("Net Contents");
        assertThat(result.matched()).isTrue();
        assertThat(result.message()).isEqualTo("Net contents not required");
    }

    @Test
    void matchesSameFormatting() {
        FieldCheckResult result = matcher.check("Bottled by X. 750 mL", "750 ml");

        assertThat(result.matched()).isTrue();
        assertThat(result.message()).isEqualTo("Net contents matches: 750 ml");
    }

    @Test
    void matchesVolumePrintedWithNonBreakingSpace() {
        FieldCheckResult result = matcher.check("Whiskey 750\u00A0mL", "750 ml");

        assertThat(result.matched()).isTrue();
        assertThat(result.message()).isEqualTo("Net contents matches: 750 ml");
    }

    @Test
    void checksWhitespaceOnlyValueAgainstLabel() {
        assertThat(matcher.check("Old Barrel Whiskey", " ").message())
                .isEqualTo("Net contents not found on label (expected  )");
        // normalizes to "", which every candidate contains
        assertThat(matcher.check("750 mL", " ").matched()).isTrue();
    }

    @Test
    void matchesIgnoringCase() {
        assertThat(matcher.check("750ML", "750 mL").matched()).isTrue();
    }

    @Test
    void doesNotMatchWhenFormOmitsSpaceBetweenNumberAndUnit() {
        // label candidates are always "<number> <unit>", and neither string contains the other
        FieldCheckResult result = matcher.check("750 mL", "750mL");

        assertThat(result.matched()).isFalse();
        assertThat(result.message()).isEqualTo("Net contents mismatch: found 750 ml, expected 750mL");
    }

    @Test
    void matchesWhenOneValueContainsTheOther() {
        assertThat(matcher.check("12 fl oz", "12 fl oz (355 ml)").matched()).isTrue();
    }

    @Test
    void acceptsShorterVolumeContainedInLongerOne() {
        // known weakness of containment matching: "5 ml" is part of "25 ml"
        assertThat(matcher.check("25 ml sample", "5 ml").matched()).isTrue();
    }

    @Test
    void failsWhenLabelHasNoVolume() {
        FieldCheckResult result = matcher.check("Old Barrel Whiskey", "750 ml");

        assertThat(result.matched()).isFalse();
        assertThat(result.message()).isEqualTo("Net contents not found on label (expected 750 ml)");
    }

    @Test
    void reportsFirstCandidateOnMismatch() {
        FieldCheckResult result = matcher.check("375 ml / 12.7 fl oz", "1 l");

        assertThat(result.matched()).isFalse();
        assertThat(result.message()).isEqualTo("Net contents mismatch: found 375 ml, expected 1 l");
    }
}
