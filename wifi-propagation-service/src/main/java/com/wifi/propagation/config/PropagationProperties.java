package com.wifi.propagation.config;

import java.util.HashMap;
import java.util.Map;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the propagation service.
 * Maps to the 'propagation' section in application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "propagation")
public class PropagationProperties {

    /**
     * Vertical distance between two consecutive floors in meters.
     */
    private double floorHeightMeters = 3.0;

    private Computation computation = new Computation();
    private AntennaPatterns antennaPatterns = new AntennaPatterns();
    private Materials materials = new Materials();
    private MountTypes mountTypes = new MountTypes();
    private Validation validation = new Validation();

    @Data
    public static class Computation {
        private int workers = 4;
        private int queueCapacity = 1000;
        private long timeoutSeconds = 30;
    }

    @Data
    public static class AntennaPatterns {
        private String location = "classpath:antenna-patterns.json";
    }

    @Data
    public static class Materials {
        /**
         * Extra or replacement material losses keyed by material id.
         */
        private Map<String, MaterialLoss> overrides = new HashMap<>();
    }

    /**
     * Loss through one layer of a material, per band, in dB. Missing bands keep the built-in value.
     */
    @Data
    public static class MaterialLoss {
        private Double band24;
        private Double band5;
        private Double band6;
    }

    @Data
    public static class MountTypes {
        /**
         * Default mount per device model, e.g. {@code U6-IW: wall}.
         */
        private Map<String, String> overrides = new HashMap<>();
    }

    @Data
    public static class Validation {
        private int maxAccessPoints = 250;
    }
}
