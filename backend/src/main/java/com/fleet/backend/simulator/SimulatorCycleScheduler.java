package com.fleet.backend.simulator;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "telemetry.simulator.enabled", havingValue = "true")
public class SimulatorCycleScheduler {

    private final TelemetrySimulator telemetrySimulator;

    @Scheduled(fixedDelayString = "${telemetry.simulator.interval-seconds:10}000",
            initialDelayString = "${telemetry.simulator.interval-seconds:10}000")
    public void runCycle() {
        telemetrySimulator.runCycle();
    }
}
