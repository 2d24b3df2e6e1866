package com.example.labelverifier.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls numeric quantities printed on a label out of OCR text. Matching is
 * case-insensitive; candidates are returned in the order they appear.
 */
public final class QuantityExtractor {

    // \\s covers Unicode spaces such as U+00A0; digits stay ASCII so every match parses.
    private static final Pattern PERCENTAGE_PATTERN = Pattern.compile(
            "([0-9]+\\.?[0-9]*)\\s*%", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DECIMAL_PATTERN = Pattern.compile(
            "[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    // Priority order matters: a magnitude can be reported once per matching unit.
    private static final List<Pattern> VOLUME_PATTERNS = List.of(
            Pattern.compile("([0-9]+\\.?[0-9]*)\\s*(ml)", Pattern.UNICODE_CHARACTER_CLASS),
            Pattern.compile("([0-9]+\\.?[0-9]*)\\s*(fl\\s*oz|oz)", Pattern.UNICODE_CHARACTER_CLASS),
            Pattern.compile("([0-9]+\\.?[0-9]*)\\s*(l)", Pattern.UNICODE_CHARACTER_CLASS)
    );

    private static final double MIN_PERCENTAGE = 0.0;
    private static final double MAX_PERCENTAGE = 100.0;

    private QuantityExtractor() {
    }

    /**
     * Finds every {@code <number>%} value in the text. Values outside 0..100 are
     * treated as OCR noise and dropped.
     */
    public static List<Double> extractPercentages(String text) {
        List<Double> percentages = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return percentages;
        }
        Matcher matcher = PERCENTAGE_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            OptionalDouble value = parseDecimal(matcher.group(1));
            if (value.isPresent() && value.getAsDouble() >= MIN_PERCENTAGE && value.getAsDouble() <= MAX_PERCENTAGE) {
                percentages.add(value.getAsDouble());
            }
        }
        return percentages;
    }

    /**
     * Finds volume statements such as {@code 750 mL} or {@code 12 fl oz}, formatted
     * as {@code "<magnitude> <unit>"} with the unit as printed (lower cased).
     */
    public static List<String> extractVolumes(String text) {
        List<String> volumes = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return volumes;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (Pattern pattern : VOLUME_PATTERNS) {
            Matcher matcher = pattern.matcher(lowered);
            while (matcher.find()) {
                volumes.add((matcher.group(1) + " " + matcher.group(2)).trim());
            }
        }
        return volumes;
    }

    /**
     * Parses a decimal number, optionally with an exponent. Anything else (blank
     * input, {@code NaN}, {@code Infinity}, stray letters) yields an empty result.
     */
    public static OptionalDouble parseDecimal(String value) {
        if (value == null || !DECIMAL_PATTERN.matcher(value).matches()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(value));
    }
}
