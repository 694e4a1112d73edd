package com.fleet.backend.service.risk;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Partition of the 0..6 point range: up to 2 is LOW, 3-4 MEDIUM, 5 and above HIGH.
     */
    public static RiskLevel fromPoints(int riskPoints) {
        if (riskPoints <= 2) {
            return LOW;
        }
        if (riskPoints <= 4) {
            return MEDIUM;
        }
        return HIGH;
    }
}
