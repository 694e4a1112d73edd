package com.fleet.backend.service;

import com.fleet.backend.service.risk.RiskLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TelemetryMetrics {

    static final String NO_ASSESSMENT = "NONE";

    private final MeterRegistry meterRegistry;

    private Counter readingsIngestedCounter;

    @PostConstruct
    void init() {
        readingsIngestedCounter = Counter.builder("telemetry_readings_ingested_total").register(meterRegistry);
    }

    public void recordReadingIngested() {
        if (readingsIngestedCounter != null) {
            readingsIngestedCounter.increment();
        }
    }

    public void recordStoreFailure(String operation) {
        Counter.builder("telemetry_store_failures_total")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    public void recordRiskEvaluation(RiskLevel level) {
        Counter.builder("telemetry_risk_evaluations_total")
                .tag("level", level == null ? NO_ASSESSMENT : level.name())
                .register(meterRegistry)
                .increment();
    }
}
