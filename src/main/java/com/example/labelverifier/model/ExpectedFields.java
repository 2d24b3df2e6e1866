package com.example.labelverifier.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Regulatory values submitted with the label form. Any of them may be absent
 * ({@code null} or empty); only net contents is optional for a passing
 * verification. Whitespace-only values count as submitted.
 */
@Schema(description = "Values the label is expected to carry")
public record ExpectedFields(
        @Schema(description = "Brand name", example = "Old Barrel") String brandName,
        @Schema(description = "Product class or type", example = "Whiskey") String productClass,
        @Schema(description = "Alcohol by volume, with or without a percent sign", example = "40%") String alcoholContent,
        @Schema(description = "Net contents of the container", example = "750 ml") String netContents) {

    public boolean hasNetContents() {
        return isProvided(netContents);
    }

    public static boolean isProvided(String value) {
        return value != null && !value.isEmpty();
    }
}
