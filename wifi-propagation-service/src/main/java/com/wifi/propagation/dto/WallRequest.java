package com.wifi.propagation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A wall polyline. {@code materials} optionally assigns one material per segment.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WallRequest {

    @NotNull(message = "Wall points are required")
    @Valid
    @JsonProperty("points")
    private List<LatLngRequest> points;

    @JsonProperty("material")
    private String material;

    @JsonProperty("materials")
    private List<String> materials;
}
