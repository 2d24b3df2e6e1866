package com.example.labelverifier.service;

import com.example.labelverifier.model.ExpectedFields;
import com.example.labelverifier.model.FieldCheckResult;
import com.example.labelverifier.model.VerificationResult;
import com.example.labelverifier.service.matching.AlcoholContentMatcher;
import com.example.labelverifier.service.matching.FieldMatcher;
import com.example.labelverifier.service.matching.GovernmentWarningMatcher;
import com.example.labelverifier.service.matching.MatchingRules;
import com.example.labelverifier.service.matching.NetContentsMatcher;
import com.example.labelverifier.service.matching.TextFieldMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs every field check against the OCR text of one label and aggregates the
 * verdicts. Instances hold only immutable configuration and can be shared
 * between concurrent requests.
 */
public class LabelVerifier {

    private static final Logger log = LoggerFactory.getLogger(LabelVerifier.class);

    static final String BRAND_NAME = "Brand Name";
    static final String PRODUCT_CLASS = "Product Class/Type";
    private static final String TRUNCATION_MARKER = "...";

    private final MatchingRules rules;
    private final FieldMatcher brandNameMatcher;
    private final FieldMatcher productClassMatcher;
    private final FieldMatcher alcoholContentMatcher;
    private final FieldMatcher netContentsMatcher;
    private final FieldMatcher governmentWarningMatcher;

    public LabelVerifier() {
        this(MatchingRules.defaults());
    }

    public LabelVerifier(MatchingRules rules) {
        this.rules = rules;
        this.brandNameMatcher = new TextFieldMatcher(BRAND_NAME, rules.tokenMatchRatio());
        this.productClassMatcher = new TextFieldMatcher(PRODUCT_CLASS, rules.tokenMatchRatio());
        this.alcoholContentMatcher = new AlcoholContentMatcher(rules.alcoholTolerance());
        this.netContentsMatcher = new NetContentsMatcher();
        this.governmentWarningMatcher = new GovernmentWarningMatcher(rules.warningPhraseThreshold());
    }

    /**
     * Verifies the label text against the submitted fields.
     *
     * @throws UnreadableLabelException when the trimmed text is shorter than the configured minimum
     */
    public VerificationResult verify(String rawText, ExpectedFields expected) {
        Objects.requireNonNull(expected, "expected");
        String text = rawText == null ? "" : rawText;
        int readableLength = text.trim().length();
        if (readableLength < rules.minimumTextLength()) {
            throw new UnreadableLabelException(readableLength);
        }

        List<FieldCheckResult> checks = new ArrayList<>(5);
        checks.add(brandNameMatcher.check(text, expected.brandName()));
        checks.add(productClassMatcher.check(text, expected.productClass()));
        checks.add(alcoholContentMatcher.check(text, expected.alcoholContent()));
        if (expected.hasNetContents()) {
            checks.add(netContentsMatcher.check(text, expected.netContents()));
        }
        checks.add(governmentWarningMatcher.check(text, null));

        boolean overallMatch = checks.stream().allMatch(FieldCheckResult::matched);
        if (log.isDebugEnabled()) {
            checks.forEach(check -> log.debug("{} -> {} ({})", check.field(), check.matched(), check.message()));
        }
        return new VerificationResult(overallMatch, preview(text), checks);
    }

    String preview(String rawText) {
        if (rawText.length() <= rules.previewLength()) {
            return rawText;
        }
        return rawText.substring(0, rules.previewLength()) + TRUNCATION_MARKER;
    }
}
