package com.example.labelverifier.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Verification outcome for one label image")
public record VerificationResult(
        @JsonProperty("overall_match")
        @Schema(description = "True when every check that ran matched") boolean overallMatch,
        @JsonProperty("extracted_text_preview")
        @Schema(description = "Beginning of the OCR text, suffixed with ... when truncated") String extractedTextPreview,
        @Schema(description = "Per-field results in evaluation order") List<FieldCheckResult> checks) {

    public VerificationResult {
        checks = List.copyOf(checks);
    }
}
