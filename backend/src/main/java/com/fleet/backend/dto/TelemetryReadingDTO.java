package com.fleet.backend.dto;

import com.fleet.backend.model.TelemetryReading;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryReadingDTO {

    private Long id;
    private String assetId;
    private double temperatureC;
    private double vibrationRms;
    private double pressurePsi;
    private Instant recordedAt;

    public static TelemetryReadingDTO from(TelemetryReading reading) {
        return TelemetryReadingDTO.builder()
                .id(reading.getId())
                .assetId(reading.getAssetId())
                .temperatureC(reading.getTemperatureC())
                .vibrationRms(reading.getVibrationRms())
                .pressurePsi(reading.getPressurePsi())
                .recordedAt(reading.getRecordedAt())
                .build();
    }
}
