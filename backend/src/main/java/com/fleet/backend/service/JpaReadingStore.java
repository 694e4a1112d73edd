package com.fleet.backend.service;

import com.fleet.backend.exception.StoreUnavailableException;
import com.fleet.backend.model.TelemetryReading;
import com.fleet.backend.repository.TelemetryReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;

/**
 * {@link ReadingStore} backed by the {@code asset_telemetry} table. Each call runs in its own
 * repository transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaReadingStore implements ReadingStore {

    private final TelemetryReadingRepository telemetryReadingRepository;
    private final TelemetryMetrics telemetryMetrics;

    @Override
    public StoredReading append(String assetId, double temperatureC, double vibrationRms, double pressurePsi) {
        TelemetryReading reading = TelemetryReading.builder()
                .assetId(assetId)
                .temperatureC(temperatureC)
                .vibrationRms(vibrationRms)
                .pressurePsi(pressurePsi)
                .build();
        try {
            TelemetryReading saved = telemetryReadingRepository.save(reading);
            return new StoredReading(saved.getId(), saved.getRecordedAt());
        } catch (DataAccessException | TransactionException e) {
            telemetryMetrics.recordStoreFailure("append");
            log.error("Failed to store reading for asset {}", assetId, e);
            throw new StoreUnavailableException("db_insert_failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<TelemetryReading> fetchLatest(String assetId, int limit) {
        ReadingStore.checkWindow(limit);
        try {
            return telemetryReadingRepository.findByAssetIdOrderByRecordedAtDescIdDesc(
                    assetId, PageRequest.of(0, limit));
        } catch (DataAccessException | TransactionException e) {
            telemetryMetrics.recordStoreFailure("fetch");
            log.error("Failed to read latest {} readings for asset {}", limit, assetId, e);
            throw new StoreUnavailableException("db_read_failed: " + e.getMessage(), e);
        }
    }
}
