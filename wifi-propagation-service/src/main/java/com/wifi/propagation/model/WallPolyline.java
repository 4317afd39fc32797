package com.wifi.propagation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A wall drawn as a polyline on one floor.
 *
 * @param floor floor index the wall belongs to
 * @param points ordered vertices
 * @param material default material of every segment
 * @param segmentMaterials optional per-segment materials, one per segment; null entries fall back
 *     to {@code material}
 */
public record WallPolyline(
    int floor, List<GeoPoint> points, String material, List<String> segmentMaterials) {

  public WallPolyline {
    points = points == null ? List.of() : List.copyOf(points);
    segmentMaterials =
        segmentMaterials == null
            ? null
            : Collections.unmodifiableList(new ArrayList<>(segmentMaterials));
  }

  public int segmentCount() {
    return Math.max(0, points.size() - 1);
  }

  /**
   * Material of segment {@code index}, honouring per-segment overrides.
   *
   * @param index segment index, 0 based
   * @return the segment material
   */
  public String materialOf(int index) {
    if (segmentMaterials != null
        && index < segmentMaterials.size()
        && segmentMaterials.get(index) != null) {
      return segmentMaterials.get(index);
    }
    return material;
  }
}
