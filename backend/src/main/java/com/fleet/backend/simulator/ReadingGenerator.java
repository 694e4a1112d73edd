package com.fleet.backend.simulator;

import com.fleet.backend.util.RoundingUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random readings spread across all risk bands.
 */
@Component
public class ReadingGenerator {

    static final double TEMP_MIN_C = 70.0;
    static final double TEMP_MAX_C = 150.0;
    static final double VIBRATION_MIN_RMS = 1.0;
    static final double VIBRATION_MAX_RMS = 5.0;
    static final double PRESSURE_MIN_PSI = 20.0;
    static final double PRESSURE_MAX_PSI = 70.0;

    public Map<String, Object> next(String assetId) {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("asset_id", assetId);
        payload.put("temperature_c", RoundingUtils.round(uniform(rnd, TEMP_MIN_C, TEMP_MAX_C), 1));
        payload.put("vibration_rms", RoundingUtils.round(uniform(rnd, VIBRATION_MIN_RMS, VIBRATION_MAX_RMS), 2));
        payload.put("pressure_psi", RoundingUtils.round(uniform(rnd, PRESSURE_MIN_PSI, PRESSURE_MAX_PSI), 1));
        return payload;
    }

    private static double uniform(ThreadLocalRandom rnd, double min, double max) {
        return min + (max - min) * rnd.nextDouble();
    }
}
