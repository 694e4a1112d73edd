package com.fleet.backend.service;

import com.fleet.backend.dto.HealthResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * API + database connectivity probe. Never throws: an unreachable database is reported as degraded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthService {

    private final JdbcTemplate jdbcTemplate;

    public HealthResponse check() {
        String ts = Instant.now().toString();
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return HealthResponse.ok(ts);
        } catch (DataAccessException e) {
            log.warn("Health check could not reach the database: {}", e.getMessage());
            return HealthResponse.degraded(ts, e.getMessage());
        }
    }
}
