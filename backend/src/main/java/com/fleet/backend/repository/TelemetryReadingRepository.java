package com.fleet.backend.repository;

import com.fleet.backend.model.TelemetryReading;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TelemetryReadingRepository extends JpaRepository<TelemetryReading, Long> {

    /**
     * Most recent readings first; rows sharing a timestamp come back newest insert first.
     */
    List<TelemetryReading> findByAssetIdOrderByRecordedAtDescIdDesc(String assetId, Pageable pageable);
}
