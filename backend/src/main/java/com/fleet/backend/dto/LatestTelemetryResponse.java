package com.fleet.backend.dto;

import com.fleet.backend.service.risk.RiskAssessment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Latest readings for an asset plus the risk computed over exactly those readings.
 * {@code risk} is null when the asset has no history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LatestTelemetryResponse {

    private String assetId;
    private int windowRequested;
    private int windowUsed;
    private int count;
    private List<TelemetryReadingDTO> readings;
    private RiskAssessment risk;
}
