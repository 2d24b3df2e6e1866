package com.example.labelverifier.service.matching;

import com.example.labelverifier.model.FieldCheckResult;

/**
 * Compares one expected form value against the OCR text of a label.
 * Implementations never throw for missing or malformed input; those cases are
 * reported as a failed {@link FieldCheckResult}.
 */
public interface FieldMatcher {

    /**
     * @param labelText     raw OCR text of the label
     * @param expectedValue value submitted with the form, possibly {@code null}
     * @return verdict for the field together with a human readable message
     */
    FieldCheckResult check(String labelText, String expectedValue);
}
