package com.fleet.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(String status, String db, String ts, String error) {

    public static HealthResponse ok(String ts) {
        return new HealthResponse("ok", "ok", ts, null);
    }

    public static HealthResponse degraded(String ts, String error) {
        return new HealthResponse("degraded", "unreachable", ts, error);
    }
}
