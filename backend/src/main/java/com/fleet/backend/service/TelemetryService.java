package com.fleet.backend.service;

import com.fleet.backend.dto.LatestTelemetryResponse;
import com.fleet.backend.dto.TelemetryIngestResponse;
import com.fleet.backend.dto.TelemetryReadingDTO;
import com.fleet.backend.dto.TelemetryReadingRequest;
import com.fleet.backend.model.TelemetryReading;
import com.fleet.backend.service.risk.RiskAssessment;
import com.fleet.backend.service.risk.RiskEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TelemetryService {

    private final ReadingStore readingStore;
    private final RiskEvaluator riskEvaluator;
    private final TelemetryMetrics telemetryMetrics;

    public TelemetryIngestResponse ingest(TelemetryReadingRequest request) {
        ReadingStore.StoredReading stored = readingStore.append(
                request.getAssetId(),
                request.getTemperatureC(),
                request.getVibrationRms(),
                request.getPressurePsi());
        telemetryMetrics.recordReadingIngested();
        log.debug("Stored reading id={} asset={} at {}", stored.id(), request.getAssetId(), stored.recordedAt());
        return new TelemetryIngestResponse(stored.id(), stored.recordedAt());
    }

    /**
     * Fetches up to {@code limit} readings and evaluates risk over the readings actually returned.
     */
    public LatestTelemetryResponse latest(String assetId, int limit) {
        List<TelemetryReading> readings = readingStore.fetchLatest(assetId, limit);
        RiskAssessment risk = riskEvaluator.evaluate(readings).orElse(null);
        telemetryMetrics.recordRiskEvaluation(risk == null ? null : risk.riskLevel());

        List<TelemetryReadingDTO> dtos = readings.stream()
                .map(TelemetryReadingDTO::from)
                .toList();
        return LatestTelemetryResponse.builder()
                .assetId(assetId)
                .windowRequested(limit)
                .windowUsed(dtos.size())
                .count(dtos.size())
                .readings(dtos)
                .risk(risk)
                .build();
    }
}
