package com.example.labelverifier.service.matching;

import com.example.labelverifier.model.FieldCheckResult;
import com.example.labelverifier.util.TextNormalizer;

import java.util.List;

/**
 * Looks for the mandatory health warning. The heading is enough on its own; when
 * OCR mangles it, enough of the warning's key phrases count as a partial find.
 * The form carries no value for this check, so the expected value is ignored.
 */
public class GovernmentWarningMatcher implements FieldMatcher {

    public static final String FIELD = "Government Warning";

    static final String HEADING = "government warning";
    static final List<String> KEY_PHRASES = List.of(
            "pregnant",
            "driving",
            "operating machinery",
            "health problems");

    private final int phraseThreshold;

    public GovernmentWarningMatcher() {
        this(MatchingRules.DEFAULT_WARNING_PHRASE_THRESHOLD);
    }

    public GovernmentWarningMatcher(int phraseThreshold) {
        this.phraseThreshold = phraseThreshold;
    }

    @Override
    public FieldCheckResult check(String labelText, String expectedValue) {
        String text = TextNormalizer.normalize(labelText);
        if (text.contains(HEADING)) {
            return FieldCheckResult.matched(FIELD, "Government warning found on label");
        }

        long found = KEY_PHRASES.stream().filter(text::contains).count();
        if (found >= phraseThreshold) {
            return FieldCheckResult.matched(FIELD, "Government warning partially found");
        }
        return FieldCheckResult.failed(FIELD, "Government warning not found on label");
    }
}
