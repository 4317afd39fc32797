package com.wifi.propagation.model;

/**
 * Computed signal grid. {@code data} is row-major; row 0 is the southern edge of {@code bounds}
 * and column 0 the western edge. Values are in dBm.
 */
public record HeatmapGrid(int width, int height, BoundingBox bounds, float[] data) {

  public HeatmapGrid {
    if (width < 1 || height < 1) {
      throw new IllegalArgumentException("Grid dimensions must be positive");
    }
    if (data == null || data.length != width * height) {
      throw new IllegalArgumentException("Grid data length must equal width * height");
    }
  }

  public float valueAt(int x, int y) {
    return data[y * width + x];
  }
}
