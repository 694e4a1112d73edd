package com.fleet.backend.service;

import com.fleet.backend.dto.HealthResponse;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthServiceTest {

    @Test
    void reportsOkWhenDatabaseAnswers() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenReturn(1);

        HealthResponse health = new HealthService(jdbcTemplate).check();

        assertThat(health.status()).isEqualTo("ok");
        assertThat(health.db()).isEqualTo("ok");
        assertThat(health.ts()).isNotBlank();
        assertThat(health.error()).isNull();
    }

    @Test
    void reportsDegradedInsteadOfFailing() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new CannotGetJdbcConnectionException("Connection refused"));

        HealthResponse health = new HealthService(jdbcTemplate).check();

        assertThat(health.status()).isEqualTo("degraded");
        assertThat(health.db()).isEqualTo("unreachable");
        assertThat(health.error()).contains("Connection refused");
    }
}
