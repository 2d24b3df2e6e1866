package com.example.labelverifier.config;

import com.example.labelverifier.service.matching.MatchingRules;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerificationPropertiesTest {

    @Test
    void defaultsMatchBuiltInRules() {
        VerificationProperties properties = new VerificationProperties();

        assertThat(properties.toMatchingRules()).isEqualTo(MatchingRules.defaults());
        assertThat(properties.getOcr().isPreprocess()).isFalse();
        assertThat(properties.getCors().getAllowedOrigins()).containsExactly("*");
    }

    @Test
    void carriesOverriddenThresholds() {
        VerificationProperties properties = new VerificationProperties();
        properties.setMinTextLength(25);
        properties.setAlcoholTolerance(0.3);
        properties.setWarningPhraseThreshold(3);

        MatchingRules rules = properties.toMatchingRules();

        assertThat(rules.minimumTextLength()).isEqualTo(25);
        assertThat(rules.alcoholTolerance()).isEqualTo(0.3);
        assertThat(rules.warningPhraseThreshold()).isEqualTo(3);
        assertThat(rules.previewLength()).isEqualTo(200);
    }

    @Test
    void rejectsInvalidRatio() {
        VerificationProperties properties = new VerificationProperties();
        properties.setTokenMatchRatio(1.5);

        assertThatThrownBy(properties::toMatchingRules)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Token match ratio");
    }
}
