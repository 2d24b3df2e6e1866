package com.example.labelverifier.config;

import com.example.labelverifier.service.matching.MatchingRules;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "verifier")
public class VerificationProperties {

    @Min(0)
    private int minTextLength = MatchingRules.DEFAULT_MINIMUM_TEXT_LENGTH;

    @Min(1)
    private int previewLength = MatchingRules.DEFAULT_PREVIEW_LENGTH;

    @DecimalMin("0.0")
    private double alcoholTolerance = MatchingRules.DEFAULT_ALCOHOL_TOLERANCE;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double tokenMatchRatio = MatchingRules.DEFAULT_TOKEN_MATCH_RATIO;

    @Min(1)
    private int warningPhraseThreshold = MatchingRules.DEFAULT_WARNING_PHRASE_THRESHOLD;

    @Valid
    private final Ocr ocr = new Ocr();

    @Valid
    private final Cors cors = new Cors();

    public MatchingRules toMatchingRules() {
        return new MatchingRules(minTextLength, previewLength, alcoholTolerance, tokenMatchRatio, warningPhraseThreshold);
    }

    public int getMinTextLength() {
        return minTextLength;
    }

    public void setMinTextLength(int minTextLength) {
        this.minTextLength = minTextLength;
    }

    public int getPreviewLength() {
        return previewLength;
    }

    public void setPreviewLength(int previewLength) {
        this.previewLength = previewLength;
    }

    public double getAlcoholTolerance() {
        return alcoholTolerance;
    }

    public void setAlcoholTolerance(double alcoholTolerance) {
        this.alcoholTolerance = alcoholTolerance;
    }

    public double getTokenMatchRatio() {
        return tokenMatchRatio;
    }

    public void setTokenMatchRatio(double tokenMatchRatio) {
        this.tokenMatchRatio = tokenMatchRatio;
    }

    public int getWarningPhraseThreshold() {
        return warningPhraseThreshold;
    }

    public void setWarningPhraseThreshold(int warningPhraseThreshold) {
        this.warningPhraseThreshold = warningPhraseThreshold;
    }

    public Ocr getOcr() {
        return ocr;
    }

    public Cors getCors() {
        return cors;
    }

    public static class Ocr {

        /**
         * Convert to grayscale, upscale and stretch contrast before running OCR.
         */
        private boolean preprocess;

        public boolean isPreprocess() {
            return preprocess;
        }

        public void setPreprocess(boolean preprocess) {
            this.preprocess = preprocess;
        }
    }

    public static class Cors {

        @NotEmpty
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}
