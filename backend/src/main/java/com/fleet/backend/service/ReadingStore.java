package com.fleet.backend.service;

import com.fleet.backend.exception.InvalidWindowException;
import com.fleet.backend.exception.StoreUnavailableException;
import com.fleet.backend.model.TelemetryReading;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of telemetry readings.
 */
public interface ReadingStore {

    int MIN_WINDOW = 1;
    int MAX_WINDOW = 50;

    /**
     * Stores one reading. The store assigns the id and the timestamp.
     *
     * @throws StoreUnavailableException if the reading could not be written
     */
    StoredReading append(String assetId, double temperatureC, double vibrationRms, double pressurePsi);

    /**
     * Returns at most {@code limit} readings for the asset, newest first. Readings sharing a
     * timestamp are ordered by id descending. An asset without readings yields an empty list.
     *
     * @throws InvalidWindowException    if {@code limit} is outside [{@value #MIN_WINDOW}, {@value #MAX_WINDOW}]
     * @throws StoreUnavailableException if the store could not be read
     */
    List<TelemetryReading> fetchLatest(String assetId, int limit);

    static void checkWindow(int limit) {
        if (limit < MIN_WINDOW || limit > MAX_WINDOW) {
            throw new InvalidWindowException(limit, MIN_WINDOW, MAX_WINDOW);
        }
    }

    record StoredReading(Long id, Instant recordedAt) {
    }
}
