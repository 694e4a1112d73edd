package com.fleet.backend.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
@ConditionalOnProperty(name = "telemetry.simulator.enabled", havingValue = "true")
public class SimulatorHttpConfig {

    @Bean
    public RestTemplate simulatorRestTemplate(TelemetryProperties telemetryProperties) {
        int timeoutMs = telemetryProperties.getSimulator().getTimeoutMs();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }
}
