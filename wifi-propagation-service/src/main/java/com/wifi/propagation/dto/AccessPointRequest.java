package com.wifi.propagation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wifi.propagation.model.MountType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An access point placed on the floor plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessPointRequest {

    /**
     * MAC address in XX:XX:XX:XX:XX:XX format, used to match simulation overrides
     */
    @Pattern(
        regexp = "([0-9A-Fa-f]{2}[:-]){5}([0-9A-Fa-f]{2})",
        message = "Invalid MAC address format"
    )
    @JsonProperty("macAddress")
    private String macAddress;

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be at least -90")
    @DecimalMax(value = "90.0", message = "Latitude must be at most 90")
    @JsonProperty("latitude")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be at least -180")
    @DecimalMax(value = "180.0", message = "Longitude must be at most 180")
    @JsonProperty("longitude")
    private Double longitude;

    /**
     * Floor index, 0 when omitted
     */
    @JsonProperty("floor")
    private Integer floor;

    /**
     * Radio transmit power in dBm
     */
    @NotNull(message = "TX power is required")
    @DecimalMin(value = "-10.0", message = "TX power must be at least -10 dBm")
    @DecimalMax(value = "40.0", message = "TX power must be at most 40 dBm")
    @JsonProperty("txPowerDbm")
    private Double txPowerDbm;

    /**
     * Peak antenna gain in dBi, 0 when omitted
     */
    @JsonProperty("antennaGainDbi")
    private Double antennaGainDbi;

    @JsonProperty("model")
    private String model;

    /**
     * Antenna mode such as OMNI on models with switchable antennas
     */
    @JsonProperty("antennaMode")
    private String antennaMode;

    /**
     * ceiling, wall or desktop; the model's factory mount when omitted
     */
    @JsonProperty("mountType")
    private MountType mountType;

    @Min(value = 0, message = "Orientation must be at least 0 degrees")
    @Max(value = 359, message = "Orientation must be at most 359 degrees")
    @JsonProperty("orientationDeg")
    private Integer orientationDeg;
}
