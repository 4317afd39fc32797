package com.wifi.propagation.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Building footprint with the slab material of each floor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BuildingRequest {

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
     * Floor index to slab material; the slab of floor n separates it from floor n - 1
     */
    @JsonProperty("floorMaterials")
    private Map<Integer, String> floorMaterials;
}
