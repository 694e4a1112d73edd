package com.fleet.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Refuses to start the telemetry API without a complete datasource, naming
 * the missing settings.
 */
@Component
@Slf4j
public class DatabaseConfigValidator implements ApplicationRunner {

    @Value("${spring.datasource.url:}")
    private String dbUrl;

    @Value("${spring.datasource.username:}")
    private String dbUser;

    @Value("${spring.datasource.password:}")
    private String dbPassword;

    @Override
    public void run(ApplicationArguments args) {
        List<String> missing = missingSettings();
        if (!missing.isEmpty()) {
            String message = "Telemetry store is not configured, missing " + String.join(", ", missing)
                    + " (set DB_HOST/DB_PORT/DB_NAME/DB_USER/DB_PASSWORD)";
            log.error(message);
            throw new IllegalStateException(message);
        }
        log.info("Telemetry store configured at {} as {}", withoutQuery(dbUrl), dbUser);
    }

    List<String> missingSettings() {
        List<String> missing = new ArrayList<>();
        if (isBlank(dbUrl)) {
            missing.add("spring.datasource.url");
        }
        if (isBlank(dbUser)) {
            missing.add("spring.datasource.username");
        }
        if (isBlank(dbPassword)) {
            missing.add("spring.datasource.password");
        }
        return missing;
    }

    static String withoutQuery(String url) {
        int idx = url.indexOf('?');
        return idx < 0 ? url : url.substring(0, idx);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
