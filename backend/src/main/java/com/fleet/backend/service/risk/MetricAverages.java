package com.fleet.backend.service.risk;

public record MetricAverages(double temperatureC, double vibrationRms, double pressurePsi) {
}
