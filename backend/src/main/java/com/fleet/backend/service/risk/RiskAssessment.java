package com.fleet.backend.service.risk;

/**
 * Risk derived from a window of readings. Computed on read, never stored.
 *
 * @param riskScore  {@code riskPoints / 6} rounded to two decimals
 * @param riskPoints sum of the per-metric band points, 0..6
 * @param riskLevel  level for {@code riskPoints}
 * @param windowUsed number of readings the averages were taken over
 * @param averages   per-metric means rounded to two decimals
 */
public record RiskAssessment(
        double riskScore,
        int riskPoints,
        RiskLevel riskLevel,
        int windowUsed,
        MetricAverages averages
) {
}
