package com.example.labelverifier.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of comparing a single form field with the label text")
public record FieldCheckResult(
        @Schema(description = "Display name of the checked field", example = "Brand Name") String field,
        @Schema(description = "Whether the label satisfied the check") boolean matched,
        @Schema(description = "Human readable explanation", example = "Brand Name found on label") String message) {

    public static FieldCheckResult matched(String field, String message) {
        return new FieldCheckResult(field, true, message);
    }

    public static FieldCheckResult failed(String field, String message) {
        return new FieldCheckResult(field, false, message);
    }
}
