package com.fleet.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fleetTelemetryOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Fleet Telemetry API")
                        .description("Sensor reading ingestion and windowed risk assessment for fleet assets")
                        .version("1.0"));
    }
}
