package com.fleet.backend.db;

import com.fleet.backend.model.TelemetryReading;
import com.fleet.backend.repository.TelemetryReadingRepository;
import com.fleet.backend.service.ReadingStore;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
class FlywayMigrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("fleetdb")
            .withUsername("fleetuser")
            .withPassword("fleetpass");

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.driver-class-name", postgres::getDriverClassName);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "validate");
        registry.add("spring.flyway.enabled", () -> "true");
    }

    @Autowired
    private Flyway flyway;

    @Autowired
    private ReadingStore readingStore;

    @Autowired
    private TelemetryReadingRepository telemetryReadingRepository;

    @Test
    void migrationsApplyAndStoreRoundTripsOnPostgres() {
        assertThat(flyway.info().applied()).isNotEmpty();

        telemetryReadingRepository.deleteAll();
        ReadingStore.StoredReading first = readingStore.append("aircraft-C130-017", 90.0, 1.0, 45.0);
        ReadingStore.StoredReading second = readingStore.append("aircraft-C130-017", 92.0, 1.0, 45.0);

        assertThat(readingStore.fetchLatest("aircraft-C130-017", 5))
                .extracting(TelemetryReading::getId)
                .containsExactly(second.id(), first.id());
        assertThat(readingStore.fetchLatest("unknown-asset", 5)).isEmpty();

        String longAssetId = "asset-".repeat(100);
        ReadingStore.StoredReading longId = readingStore.append(longAssetId, 80.0, 1.0, 45.0);
        assertThat(readingStore.fetchLatest(longAssetId, 1))
                .extracting(TelemetryReading::getId)
                .containsExactly(longId.id());
    }
}
