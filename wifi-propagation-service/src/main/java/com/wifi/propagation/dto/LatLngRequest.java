package com.wifi.propagation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A wall vertex.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LatLngRequest {

    @NotNull(message = "Latitude is required")
    @JsonProperty("lat")
    private Double lat;

    @NotNull(message = "Longitude is required")
    @JsonProperty("lng")
    private Double lng;
}
