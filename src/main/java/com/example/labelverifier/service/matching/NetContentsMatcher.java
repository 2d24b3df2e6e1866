package com.example.labelverifier.service.matching;

import com.example.labelverifier.model.ExpectedFields;
import com.example.labelverifier.model.FieldCheckResult;
import com.example.labelverifier.util.QuantityExtractor;
import com.example.labelverifier.util.TextNormalizer;

import java.util.List;

/**
 * Checks the printed fill volume. The field is optional: an absent value passes.
 * A candidate matches when either normalized string contains the other, which
 * also lets {@code "5 ml"} match a printed {@code "25 ml"}.
 */
public class NetContentsMatcher implements FieldMatcher {

    public static final String FIELD = "Net Contents";

    @Override
    public FieldCheckResult check(String labelText, String expectedValue) {
        if (!ExpectedFields.isProvided(expectedValue)) {
            return FieldCheckResult.matched(FIELD, "Net contents not required");
        }

        List<String> labelVolumes = QuantityExtractor.extractVolumes(labelText);
        if (labelVolumes.isEmpty()) {
            return FieldCheckResult.failed(FIELD,
                    "Net contents not found on label (expected " + expectedValue + ")");
        }

        String expected = TextNormalizer.normalize(expectedValue);
        for (String labelVolume : labelVolumes) {
            String candidate = TextNormalizer.normalize(labelVolume);
            if (candidate.contains(expected) || expected.contains(candidate)) {
                return FieldCheckResult.matched(FIELD, "Net contents matches: " + labelVolume);
            }
        }
        return FieldCheckResult.failed(FIELD, "Net contents mismatch: found "
                + labelVolumes.get(0) + ", expected " + expectedValue);
    }
}
