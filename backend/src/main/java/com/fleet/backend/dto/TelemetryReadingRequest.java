package com.fleet.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryReadingRequest {

    @NotBlank
    @Schema(example = "aircraft-C130-017")
    private String assetId;

    @NotNull
    private Double temperatureC;

    @NotNull
    private Double vibrationRms;

    @NotNull
    private Double pressurePsi;
}
