package com.fleet.backend.service.risk;

import com.fleet.backend.model.TelemetryReading;
import com.fleet.backend.util.RoundingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Reduces a window of readings to a risk assessment.
 * <p>
 * Each metric's unweighted mean falls into a band worth 0, 1 or 2 points; the points are summed
 * into a 0..6 total. Band thresholds are exclusive and compare against the unrounded mean.
 */
@Slf4j
@Component
public class RiskEvaluator {

    public static final int MAX_POINTS = 6;

    static final double TEMP_HIGH_C = 95.0;
    static final double TEMP_ELEVATED_C = 85.0;
    static final double VIBRATION_HIGH_RMS = 3.5;
    static final double VIBRATION_ELEVATED_RMS = 2.5;
    static final double PRESSURE_CRITICAL_LOW_PSI = 30.0;
    static final double PRESSURE_CRITICAL_HIGH_PSI = 60.0;
    static final double PRESSURE_WARN_LOW_PSI = 35.0;
    static final double PRESSURE_WARN_HIGH_PSI = 55.0;

    /**
     * @return empty when {@code readings} is null or empty; an asset without history has no assessment
     */
    public Optional<RiskAssessment> evaluate(List<TelemetryReading> readings) {
        if (readings == null || readings.isEmpty()) {
            return Optional.empty();
        }

        int n = readings.size();
        double avgTemp = mean(readings, TelemetryReading::getTemperatureC);
        double avgVib = mean(readings, TelemetryReading::getVibrationRms);
        double avgPressure = mean(readings, TelemetryReading::getPressurePsi);

        int riskPoints = temperaturePoints(avgTemp) + vibrationPoints(avgVib) + pressurePoints(avgPressure);
        RiskLevel level = RiskLevel.fromPoints(riskPoints);
        double riskScore = RoundingUtils.round2((double) riskPoints / MAX_POINTS);

        log.debug("Risk over {} readings: avgTemp={} avgVib={} avgPressure={} -> points={} level={}",
                n, avgTemp, avgVib, avgPressure, riskPoints, level);

        return Optional.of(new RiskAssessment(
                riskScore,
                riskPoints,
                level,
                n,
                new MetricAverages(
                        RoundingUtils.round2(avgTemp),
                        RoundingUtils.round2(avgVib),
                        RoundingUtils.round2(avgPressure))
        ));
    }

    // summed in sorted order so the result does not depend on the order of the window
    private static double mean(List<TelemetryReading> readings, ToDoubleFunction<TelemetryReading> metric) {
        double[] values = readings.stream().mapToDouble(metric).sorted().toArray();
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    static int temperaturePoints(double avgTempC) {
        if (avgTempC > TEMP_HIGH_C) {
            return 2;
        }
        if (avgTempC > TEMP_ELEVATED_C) {
            return 1;
        }
        return 0;
    }

    static int vibrationPoints(double avgVibrationRms) {
        if (avgVibrationRms > VIBRATION_HIGH_RMS) {
            return 2;
        }
        if (avgVibrationRms > VIBRATION_ELEVATED_RMS) {
            return 1;
        }
        return 0;
    }

    // both low and high pressure are risky
    static int pressurePoints(double avgPressurePsi) {
        if (avgPressurePsi < PRESSURE_CRITICAL_LOW_PSI || avgPressurePsi > PRESSURE_CRITICAL_HIGH_PSI) {
            return 2;
        }
        if (avgPressurePsi < PRESSURE_WARN_LOW_PSI || avgPressurePsi > PRESSURE_WARN_HIGH_PSI) {
            return 1;
        }
        return 0;
    }
}
