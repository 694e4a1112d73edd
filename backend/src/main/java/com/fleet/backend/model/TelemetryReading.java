package com.fleet.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * One sensor reading for an asset. Rows are append-only; {@code id} and
 * {@code recordedAt} are assigned by the store on insert.
 */
@Entity
@Table(name = "asset_telemetry")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryReading {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Column(name = "temperature_c", nullable = false)
    private double temperatureC;

    @Column(name = "vibration_rms", nullable = false)
    private double vibrationRms;

    @Column(name = "pressure_psi", nullable = false)
    private double pressurePsi;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @PrePersist
    public void prePersist() {
        // column precision is microseconds
        if (recordedAt == null) {
            recordedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        }
    }
}
