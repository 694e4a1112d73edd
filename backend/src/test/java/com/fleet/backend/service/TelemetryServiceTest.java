package com.fleet.backend.service;

import com.fleet.backend.dto.LatestTelemetryResponse;
import com.fleet.backend.dto.TelemetryIngestResponse;
import com.fleet.backend.dto.TelemetryReadingRequest;
import com.fleet.backend.exception.StoreUnavailableException;
import com.fleet.backend.model.TelemetryReading;
import com.fleet.backend.service.risk.RiskEvaluator;
import com.fleet.backend.service.risk.RiskLevel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TelemetryServiceTest {

    private ReadingStore readingStore;
    private SimpleMeterRegistry meterRegistry;
    private TelemetryService telemetryService;

    @BeforeEach
    void setUp() {
        readingStore = mock(ReadingStore.class);
        meterRegistry = new SimpleMeterRegistry();
        TelemetryMetrics metrics = new TelemetryMetrics(meterRegistry);
        metrics.init();
        telemetryService = new TelemetryService(readingStore, new RiskEvaluator(), metrics);
    }

    @Test
    void ingestReturnsIdAndTimestampFromStore() {
        Instant recordedAt = Instant.parse("2024-05-01T10:15:30Z");
        when(readingStore.append("aircraft-C130-017", 88.0, 2.0, 50.0))
                .thenReturn(new ReadingStore.StoredReading(5L, recordedAt));

        TelemetryIngestResponse response = telemetryService.ingest(TelemetryReadingRequest.builder()
                .assetId("aircraft-C130-017")
                .temperatureC(88.0)
                .vibrationRms(2.0)
                .pressurePsi(50.0)
                .build());

        assertThat(response.id()).isEqualTo(5L);
        assertThat(response.recordedAt()).isEqualTo(recordedAt);
        assertThat(meterRegistry.get("telemetry_readings_ingested_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void ingestPropagatesStoreFailure() {
        when(readingStore.append("a-1", 1.0, 1.0, 1.0))
                .thenThrow(new StoreUnavailableException("db_insert_failed: timeout"));

        assertThatThrownBy(() -> telemetryService.ingest(TelemetryReadingRequest.builder()
                .assetId("a-1")
                .temperatureC(1.0)
                .vibrationRms(1.0)
                .pressurePsi(1.0)
                .build()))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(meterRegistry.find("telemetry_readings_ingested_total").counter().count()).isZero();
    }

    @Test
    void windowUsedReflectsReadingsActuallyReturned() {
        when(readingStore.fetchLatest("a-1", 5)).thenReturn(List.of(
                reading(2L, 100, 4.0, 65),
                reading(1L, 100, 4.0, 65)));

        LatestTelemetryResponse response = telemetryService.latest("a-1", 5);

        assertThat(response.getAssetId()).isEqualTo("a-1");
        assertThat(response.getWindowRequested()).isEqualTo(5);
        assertThat(response.getWindowUsed()).isEqualTo(2);
        assertThat(response.getCount()).isEqualTo(2);
        assertThat(response.getReadings()).extracting("id").containsExactly(2L, 1L);
        assertThat(response.getRisk()).isNotNull();
        assertThat(response.getRisk().windowUsed()).isEqualTo(2);
        assertThat(response.getRisk().riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(meterRegistry.get("telemetry_risk_evaluations_total").tag("level", "HIGH").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void assetWithoutHistoryHasNullRisk() {
        when(readingStore.fetchLatest("ghost", 5)).thenReturn(List.of());

        LatestTelemetryResponse response = telemetryService.latest("ghost", 5);

        assertThat(response.getWindowUsed()).isZero();
        assertThat(response.getCount()).isZero();
        assertThat(response.getReadings()).isEmpty();
        assertThat(response.getRisk()).isNull();
        assertThat(meterRegistry.get("telemetry_risk_evaluations_total").tag("level", "NONE").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void fetchFailureIsNotTurnedIntoAnEmptyWindow() {
        when(readingStore.fetchLatest("a-1", 5)).thenThrow(new StoreUnavailableException("db_read_failed: down"));

        assertThatThrownBy(() -> telemetryService.latest("a-1", 5))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("db_read_failed");
    }

    private static TelemetryReading reading(Long id, double temp, double vib, double pressure) {
        return TelemetryReading.builder()
                .id(id)
                .assetId("a-1")
                .temperatureC(temp)
                .vibrationRms(vib)
                .pressurePsi(pressure)
                .recordedAt(Instant.parse("2024-05-01T10:00:00Z").plusSeconds(id))
                .build();
    }
}
