package com.example.labelverifier.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Error payload returned when a request cannot be verified")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        @Schema(description = "Time the error was produced") Instant timestamp,
        @Schema(description = "HTTP status code", example = "400") int status,
        @Schema(description = "Message suitable for the end user",
                example = "Could not read text from image. Please try a clearer image.") String error,
        @Schema(description = "Underlying cause when available") String details,
        @Schema(description = "Request path", example = "/api/verify") String path) {
}
