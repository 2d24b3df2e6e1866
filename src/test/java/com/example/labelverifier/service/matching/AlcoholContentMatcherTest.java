package com.example.labelverifier.service.matching;

import com.example.labelverifier.model.FieldCheckResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlcoholContentMatcherTest {

    private final AlcoholContentMatcher matcher = new AlcoholContentMatcher();

    @Test
    void matchesExactPercentage() {
        FieldCheckResult result = matcher.check("Whiskey 40% ALC/VOL", "40%");

        assertThat(result.field()).isEqualTo("Alcohol Content");
        assertThat(result.matched()).isTrue();
        assertThat(result.message()).isEqualTo("Alcohol content matches: 40.0%");
    }

    @Test
    void acceptsDifferenceUpToHalfAPercent() {
        assertThat(matcher.check("40.5% ALC/VOL", "40").matched()).isTrue();
        assertThat(matcher.check("39.5 % ALC/VOL", "40").matched()).isTrue();
    }

    @Test
    void rejectsDifferenceAboveHalfAPercent() {
        FieldCheckResult result = matcher.check("40.6% ALC/VOL", "40");

        assertThat(result.matched()).isFalse();
        assertThat(result.message()).isEqualTo("Alcohol content mismatch: found 40.6%, expected 40.0%");
    }

    @Test
    void reportsFirstCandidateWhenNothingMatches() {
        FieldCheckResult result = matcher.check("Contains 5% juice, 12% ABV", "40");

        assertThat(result.message()).isEqualTo("Alcohol content mismatch: found 5.0%, expected 40.0%");
    }

    @Test
    void matchesAnyCandidateNotOnlyTheFirst() {
        FieldCheckResult result = matcher.check("Contains 5% juice, 13.5% ABV", "13.5 %");

        assertThat(result.matched()).isTrue();
        assertThat(result.message()).isEqualTo("Alcohol content matches: 13.5%");
    }

    @Test
    void failsWhenLabelHasNoPercentage() {
        FieldCheckResult result = matcher.check("Old Barrel Whiskey", "45");

        assertThat(result.matched()).isFalse();
        assertThat(result.message()).isEqualTo("Alcohol content not found on label (expected 45.0%)");
    }

    @Test
    void reportsUnparsableFormValueWithoutThrowing() {
        FieldCheckResult result = matcher.check("40% ALC/VOL", "forty");

        assertThat(result.matched()).isFalse();
        assertThat(result.message()).isEqualTo("Invalid alcohol content: forty");
    }

    @Test
    void stripsNonBreakingSpaceFromFormValue() {
        FieldCheckResult result = matcher.check("Whiskey 40\u00A0% ALC/VOL", "40\u00A0%");

        assertThat(result.matched()).isTrue();
        assertThat(result.message()).isEqualTo("Alcohol content matches: 40.0%");
    }

    @Test
    void acceptsExponentNotationInFormValue() {
        assertThat(matcher.check("40% ALC/VOL", "4e1").message()).isEqualTo("Alcohol content matches: 40.0%");
    }

    @Test
    void treatsWhitespaceOnlyFormValueAsInvalid() {
        FieldCheckResult result = matcher.check("40% ALC/VOL", " ");

        assertThat(result.matched()).isFalse();
        assertThat(result.message()).isEqualTo("Invalid alcohol content:  ");
    }

    @Test
    void failsWhenValueMissingFromForm() {
        assertThat(matcher.check("40% ALC/VOL", null).message()).isEqualTo("Alcohol content not provided");
        assertThat(matcher.check("40% ALC/VOL", "").matched()).isFalse();
    }

    @Test
    void ignoresOutOfRangeLabelValues() {
        assertThat(matcher.check("145% pure", "45").message())
                .isEqualTo("Alcohol content not found on label (expected 45.0%)");
    }
}
