package com.wifi.propagation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the WiFi Propagation Service.
 *
 * <p>Predicts indoor WiFi coverage: given access point placements, wall polylines and building
 * floor materials, the service computes a grid of expected received signal strength per band and
 * floor.
 *
 * <p><strong>Key Responsibilities:</strong>
 *
 * <ul>
 *   <li>Serves heatmap requests at {@code /api/propagation/heatmap}
 *   <li>Loads measured antenna patterns and material losses at start-up
 *   <li>Computes grids in parallel row bands on a bounded worker pool
 * </ul>
 */
@SpringBootApplication
public class WifiPropagationServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(WifiPropagationServiceApplication.class, args);
  }
}
