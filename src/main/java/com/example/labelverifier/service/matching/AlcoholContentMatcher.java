package com.example.labelverifier.service.matching;

import com.example.labelverifier.model.ExpectedFields;
import com.example.labelverifier.model.FieldCheckResult;
import com.example.labelverifier.util.QuantityExtractor;

import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Compares the submitted ABV with every percentage printed on the label, allowing
 * a small absolute tolerance for misread decimals.
 */
public class AlcoholContentMatcher implements FieldMatcher {

    public static final String FIELD = "Alcohol Content";

    private static final Pattern PERCENT_AND_WHITESPACE = Pattern.compile("[%\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    private final double tolerance;

    public AlcoholContentMatcher() {
        this(MatchingRules.DEFAULT_ALCOHOL_TOLERANCE);
    }

    public AlcoholContentMatcher(double tolerance) {
        this.tolerance = tolerance;
    }

    @Override
    public FieldCheckResult check(String labelText, String expectedValue) {
        if (!ExpectedFields.isProvided(expectedValue)) {
            return FieldCheckResult.failed(FIELD, "Alcohol content not provided");
        }

        OptionalDouble parsed = QuantityExtractor.parseDecimal(
                PERCENT_AND_WHITESPACE.matcher(expectedValue).replaceAll(""));
        if (parsed.isEmpty()) {
            return FieldCheckResult.failed(FIELD, "Invalid alcohol content: " + expectedValue);
        }
        double expected = parsed.getAsDouble();

        List<Double> labelPercentages = QuantityExtractor.extractPercentages(labelText);
        if (labelPercentages.isEmpty()) {
            return FieldCheckResult.failed(FIELD,
                    "Alcohol content not found on label (expected " + expected + "%)");
        }

        for (Double labelValue : labelPercentages) {
            if (Math.abs(labelValue - expected) <= tolerance) {
                return FieldCheckResult.matched(FIELD, "Alcohol content matches: " + labelValue + "%");
            }
        }
        return FieldCheckResult.failed(FIELD, "Alcohol content mismatch: found "
                + labelPercentages.get(0) + "%, expected " + expected + "%");
    }
}
