package com.example.labelverifier.model;

import io.swagger.v3.oas.annotations.media.Schema;

public record HealthResponse(@Schema(description = "Service state", example = "healthy") String status) {

    public static HealthResponse healthy() {
        return new HealthResponse("healthy");
    }
}
