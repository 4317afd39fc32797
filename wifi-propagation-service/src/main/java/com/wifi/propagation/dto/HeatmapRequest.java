package com.wifi.propagation.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wifi.propagation.model.Band;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a signal heatmap over a floor plan region.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeatmapRequest {

    @NotNull(message = "South-west latitude is required")
    @JsonProperty("swLat")
    private Double swLat;

    @NotNull(message = "South-west longitude is required")
    @JsonProperty("swLng")
    private Double swLng;

    @NotNull(message = "North-east latitude is required")
    @JsonProperty("neLat")
    private Double neLat;

    @NotNull(message = "North-east longitude is required")
    @JsonProperty("neLng")
    private Double neLng;

    /**
     * Radio band: 2.4, 5 or 6
     */
    @NotNull(message = "Band is required")
    @JsonProperty("band")
    private Band band;

    /**
     * Floor the heatmap is rendered for, 0 when omitted
     */
    @JsonProperty("activeFloor")
    private Integer activeFloor;

    /**
     * Cell edge length in meters
     */
    @NotNull(message = "Grid resolution is required")
    @Positive(message = "Grid resolution must be positive")
    @JsonProperty("gridResolutionMeters")
    private Double gridResolutionMeters;

    @NotNull(message = "Access points are required")
    @Valid
    @JsonProperty("accessPoints")
    private List<AccessPointRequest> accessPoints;

    /**
     * Walls grouped by floor index
     */
    @Valid
    @JsonProperty("wallsByFloor")
    private Map<Integer, List<WallRequest>> wallsByFloor;

    @Valid
    @JsonProperty("buildings")
    private List<BuildingRequest> buildings;

    /**
     * Simulated TX power per AP MAC address
     */
    @JsonProperty("txPowerOverrides")
    private Map<String, Double> txPowerOverrides;

    /**
     * Simulated antenna mode per AP MAC address
     */
    @JsonProperty("antennaModeOverrides")
    private Map<String, String> antennaModeOverrides;
}
