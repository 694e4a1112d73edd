package com.fleet.backend.controller;

import com.fleet.backend.dto.ApiError;
import com.fleet.backend.dto.LatestTelemetryResponse;
import com.fleet.backend.dto.TelemetryIngestResponse;
import com.fleet.backend.dto.TelemetryReadingRequest;
import com.fleet.backend.service.ReadingStore;
import com.fleet.backend.service.TelemetryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/telemetry")
@RequiredArgsConstructor
@Tag(name = "Telemetry")
public class TelemetryController {

    private final TelemetryService telemetryService;

    @PostMapping
    @Operation(summary = "Store one telemetry reading")
    @ApiResponse(responseCode = "201", content = @Content(schema = @Schema(implementation = TelemetryIngestResponse.class)))
    @ApiResponse(responseCode = "503", content = @Content(schema = @Schema(implementation = ApiError.class)))
    public ResponseEntity<TelemetryIngestResponse> create(@Valid @RequestBody TelemetryReadingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(telemetryService.ingest(request));
    }

    @GetMapping("/latest")
    @Operation(summary = "Latest readings for an asset with the risk computed over them")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = LatestTelemetryResponse.class)))
    @ApiResponse(responseCode = "503", content = @Content(schema = @Schema(implementation = ApiError.class)))
    public ResponseEntity<LatestTelemetryResponse> latest(
            @RequestParam("asset_id") @NotBlank String assetId,
            @RequestParam(name = "limit", defaultValue = "${telemetry.window.default-size:5}")
            @Min(ReadingStore.MIN_WINDOW) @Max(ReadingStore.MAX_WINDOW) int limit) {
        return ResponseEntity.ok(telemetryService.latest(assetId, limit));
    }
}
