package com.fleet.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "telemetry")
@Data
@Validated
public class TelemetryProperties {

    @Valid
    private Window window = new Window();

    @Valid
    private Simulator simulator = new Simulator();

    @Data
    public static class Window {
        @Min(1)
        @Max(50)
        private int defaultSize = 5;
    }

    @Data
    public static class Simulator {
        private boolean enabled = false;

        @NotBlank
        private String apiBase = "http://localhost:8000";

        @NotBlank
        private String assetId = "aircraft-C130-017";

        @Positive
        private int intervalSeconds = 10;

        @Min(1)
        @Max(50)
        private int window = 5;

        @Positive
        private int timeoutMs = 3000;
    }
}
