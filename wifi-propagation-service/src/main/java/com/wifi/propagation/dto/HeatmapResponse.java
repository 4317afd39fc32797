package com.wifi.propagation.dto;

import com.wifi.propagation.model.Band;
import com.wifi.propagation.model.HeatmapGrid;

/**
 * Computed heatmap. {@code data} holds {@code width * height} signal values in dBm, row-major,
 * starting at the south-west corner.
 */
public record HeatmapResponse(
    int width,
    int height,
    double swLat,
    double swLng,
    double neLat,
    double neLng,
    Band band,
    int activeFloor,
    int accessPointCount,
    long computationTimeMs,
    float[] data) {

  /** Creates a response from a computed grid. */
  public static HeatmapResponse from(
      HeatmapGrid grid, Band band, int activeFloor, int accessPointCount, long computationTimeMs) {
    return new HeatmapResponse(
        grid.width(),
        grid.height(),
        grid.bounds().swLat(),
        grid.bounds().swLng(),
        grid.bounds().neLat(),
        grid.bounds().neLng(),
        band,
        activeFloor,
        accessPointCount,
        computationTimeMs,
        grid.data());
  }
}
