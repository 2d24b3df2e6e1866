package com.example.labelverifier.service.matching;

/**
 * Thresholds shared by the field matchers and the verifier.
 *
 * @param minimumTextLength      shortest trimmed OCR text accepted for verification
 * @param previewLength          number of OCR characters echoed back in the result
 * @param alcoholTolerance       absolute ABV difference still considered a match
 * @param tokenMatchRatio        share of words of a multi-word value that must be present
 * @param warningPhraseThreshold key warning phrases needed when the heading is unreadable
 */
public record MatchingRules(
        int minimumTextLength,
        int previewLength,
        double alcoholTolerance,
        double tokenMatchRatio,
        int warningPhraseThreshold) {

    public static final int DEFAULT_MINIMUM_TEXT_LENGTH = 10;
    public static final int DEFAULT_PREVIEW_LENGTH = 200;
    public static final double DEFAULT_ALCOHOL_TOLERANCE = 0.5;
    public static final double DEFAULT_TOKEN_MATCH_RATIO = 0.7;
    public static final int DEFAULT_WARNING_PHRASE_THRESHOLD = 2;

    public MatchingRules {
        if (minimumTextLength < 0) {
            throw new IllegalArgumentException("Minimum text length must not be negative");
        }
        if (previewLength <= 0) {
            throw new IllegalArgumentException("Preview length must be positive");
        }
        if (alcoholTolerance < 0) {
            throw new IllegalArgumentException("Alcohol tolerance must not be negative");
        }
        if (tokenMatchRatio <= 0 || tokenMatchRatio > 1) {
            throw new IllegalArgumentException("Token match ratio must be within (0, 1]");
        }
        if (warningPhraseThreshold <= 0) {
            throw new IllegalArgumentException("Warning phrase threshold must be positive");
        }
    }

    public static MatchingRules defaults() {
        return new MatchingRules(
                DEFAULT_MINIMUM_TEXT_LENGTH,
                DEFAULT_PREVIEW_LENGTH,
                DEFAULT_ALCOHOL_TOLERANCE,
                DEFAULT_TOKEN_MATCH_RATIO,
                DEFAULT_WARNING_PHRASE_THRESHOLD);
    }
}
