package com.fleet.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final TelemetryProperties telemetryProperties;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String address = environment.getProperty("server.address");
        String contextPath = environment.getProperty("server.servlet.context-path", "");
        String host = (address == null || address.isBlank() || "0.0.0.0".equals(address)) ? "localhost" : address;
        String baseUrl = String.format("http://%s:%d%s", host, port, contextPath);
        log.info("Fleet telemetry API started on port {} (base URL: {}, default window: {}, simulator: {})",
                port, baseUrl, telemetryProperties.getWindow().getDefaultSize(),
                telemetryProperties.getSimulator().isEnabled() ? "enabled" : "disabled");
    }
}
