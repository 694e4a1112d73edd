package com.fleet.backend.simulator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleet.backend.config.TelemetryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * Plays a field device: posts a random reading for one asset, then reads back the
 * latest window and its risk. Failures are logged and end the cycle early.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "telemetry.simulator.enabled", havingValue = "true")
public class TelemetrySimulator {

    private final RestTemplate restTemplate;
    private final ReadingGenerator readingGenerator;
    private final TelemetryProperties.Simulator settings;

    public TelemetrySimulator(@Qualifier("simulatorRestTemplate") RestTemplate restTemplate,
                              ReadingGenerator readingGenerator,
                              TelemetryProperties telemetryProperties) {
        this.restTemplate = restTemplate;
        this.readingGenerator = readingGenerator;
        this.settings = telemetryProperties.getSimulator();
        log.info("[simulator] starting. api={} asset_id={} interval={}s window={}",
                settings.getApiBase(), settings.getAssetId(), settings.getIntervalSeconds(), settings.getWindow());
    }

    /**
     * @return true when both the post and the read-back succeeded
     */
    public boolean runCycle() {
        Map<String, Object> payload = readingGenerator.next(settings.getAssetId());
        if (!postReading(payload)) {
            return false;
        }
        return readLatest();
    }

    private boolean postReading(Map<String, Object> payload) {
        URI uri = UriComponentsBuilder.fromHttpUrl(settings.getApiBase())
                .path("/telemetry")
                .build()
                .toUri();
        try {
            ResponseEntity<JsonNode> response = restTemplate.postForEntity(uri, payload, JsonNode.class);
            if (!response.getStatusCode().isSameCodeAs(HttpStatus.CREATED)) {
                log.warn("[simulator] POST /telemetry -> {} {}", response.getStatusCode().value(), response.getBody());
                return false;
            }
            JsonNode body = response.getBody();
            log.info("[simulator] POST /telemetry -> id={} ts={} temp={} vib={} psi={}",
                    text(body, "id"), text(body, "recorded_at"),
                    payload.get("temperature_c"), payload.get("vibration_rms"), payload.get("pressure_psi"));
            return true;
        } catch (RestClientResponseException e) {
            log.warn("[simulator] POST /telemetry -> {} {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            return false;
        } catch (RestClientException e) {
            log.warn("[simulator] POST /telemetry failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean readLatest() {
        URI uri = UriComponentsBuilder.fromHttpUrl(settings.getApiBase())
                .path("/telemetry/latest")
                .queryParam("asset_id", settings.getAssetId())
                .queryParam("limit", settings.getWindow())
                .encode()
                .build()
                .toUri();
        try {
            ResponseEntity<JsonNode> response = restTemplate.getForEntity(uri, JsonNode.class);
            if (!response.getStatusCode().isSameCodeAs(HttpStatus.OK)) {
                log.warn("[simulator] GET /telemetry/latest -> {} {}", response.getStatusCode().value(), response.getBody());
                return false;
            }
            JsonNode body = response.getBody();
            JsonNode readings = body == null ? null : body.path("readings");
            JsonNode latest = (readings != null && readings.isArray() && readings.size() > 0) ? readings.get(0) : null;
            JsonNode risk = body == null ? null : body.get("risk");
            log.info("[simulator] GET /telemetry/latest -> latest_id={} window_used={} latest_ts={} temp={} vib={} psi={} risk={} level={}",
                    text(latest, "id"), text(body, "window_used"), text(latest, "recorded_at"),
                    text(latest, "temperature_c"), text(latest, "vibration_rms"), text(latest, "pressure_psi"),
                    text(risk, "risk_score"), text(risk, "risk_level"));
            return true;
        } catch (RestClientResponseException e) {
            log.warn("[simulator] GET /telemetry/latest -> {} {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            return false;
        } catch (RestClientException e) {
            log.warn("[simulator] GET /telemetry/latest failed: {}", e.getMessage());
            return false;
        }
    }

    private static String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        return (value == null || value.isNull()) ? null : value.asText();
    }
}
