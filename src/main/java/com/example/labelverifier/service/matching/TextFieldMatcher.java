package com.example.labelverifier.service.matching;

import com.example.labelverifier.model.ExpectedFields;
import com.example.labelverifier.model.FieldCheckResult;
import com.example.labelverifier.util.TextNormalizer;

/**
 * Free-text field check used for the brand name and the product class. The whole
 * value must appear on the label, or, for multi-word values, enough of its words
 * must appear somewhere in the text to tolerate a word lost by OCR.
 */
public class TextFieldMatcher implements FieldMatcher {

    private final String fieldName;
    private final double tokenMatchRatio;

    public TextFieldMatcher(String fieldName) {
        this(fieldName, MatchingRules.DEFAULT_TOKEN_MATCH_RATIO);
    }

    public TextFieldMatcher(String fieldName, double tokenMatchRatio) {
        this.fieldName = fieldName;
        this.tokenMatchRatio = tokenMatchRatio;
    }

    @Override
    public FieldCheckResult check(String labelText, String expectedValue) {
        if (!ExpectedFields.isProvided(expectedValue)) {
            return FieldCheckResult.failed(fieldName, fieldName + " not provided in form");
        }

        String label = TextNormalizer.normalize(labelText);
        String expected = TextNormalizer.normalize(expectedValue);
        if (label.contains(expected)) {
            return FieldCheckResult.matched(fieldName, fieldName + " found on label");
        }

        String[] tokens = expected.split(" ");
        if (tokens.length > 1) {
            int found = 0;
            for (String token : tokens) {
                if (label.contains(token)) {
                    found++;
                }
            }
            if (found >= tokens.length * tokenMatchRatio) {
                return FieldCheckResult.matched(fieldName, fieldName + " partially matched");
            }
        }
        return FieldCheckResult.failed(fieldName, fieldName + " not found on label");
    }
}
