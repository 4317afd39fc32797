package com.wifi.propagation.controller;

import com.wifi.propagation.dto.HeatmapRequest;
import com.wifi.propagation.dto.HeatmapResponse;
import com.wifi.propagation.dto.MaterialInfo;
import com.wifi.propagation.model.Band;
import com.wifi.propagation.service.HeatmapService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for signal propagation predictions.
 *
 * HTTP Status Code Mapping:
 * - 200 OK: heatmap computed
 * - 400 Bad Request: validation errors and malformed requests
 * - 503 Service Unavailable: computation timed out
 * - 500 Internal Server Error: unexpected errors
 *
 * Errors are rendered by {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/propagation")
@Validated
@RequiredArgsConstructor
@Tag(name = "Signal Propagation", description = "APIs for predicted WiFi coverage heatmaps")
public class PropagationController {

    private final HeatmapService heatmapService;

    @PostMapping(value = "/heatmap", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Compute heatmap",
        description = "Predict the strongest received signal over a floor plan region")
    public ResponseEntity<HeatmapResponse> computeHeatmap(@Valid @RequestBody HeatmapRequest request) {
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .body(heatmapService.computeHeatmap(request));
    }

    @GetMapping(value = "/materials", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List materials", description = "Known wall and floor materials with their loss on a band")
    public ResponseEntity<List<MaterialInfo>> listMaterials(
            @RequestParam(name = "band", defaultValue = "5") String band) {
        return ResponseEntity.ok(heatmapService.listMaterials(Band.fromCode(band)));
    }
}
