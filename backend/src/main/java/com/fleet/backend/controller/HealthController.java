package com.fleet.backend.controller;

import com.fleet.backend.dto.HealthResponse;
import com.fleet.backend.service.HealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final HealthService healthService;

    @GetMapping("/health")
    @Operation(summary = "API and database connectivity")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(healthService.check());
    }
}
