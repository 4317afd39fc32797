package com.wifi.propagation.algorithm.attenuation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.wifi.propagation.model.GeoPoint;
import com.wifi.propagation.model.WallPolyline;
import com.wifi.propagation.model.WallSegment;

/**
 * Wall segments of one request, grouped by floor. Built once before the grid loop and never
 * modified afterwards, so row workers can read it concurrently.
 */
public final class WallSegmentIndex {

  private static final WallSegmentIndex EMPTY = new WallSegmentIndex(Map.of());

  private final Map<Integer, List<WallSegment>> segmentsByFloor;

  private WallSegmentIndex(Map<Integer, List<WallSegment>> segmentsByFloor) {
    this.segmentsByFloor = segmentsByFloor;
  }

  public static WallSegmentIndex empty() {
    return EMPTY;
  }

  /**
   * Decomposes every polyline into its segments.
   *
   * @param wallsByFloor polylines keyed by floor index, may be null
   * @return the immutable index
   */
  public static WallSegmentIndex fromWalls(Map<Integer, List<WallPolyline>> wallsByFloor) {
    if (wallsByFloor == null || wallsByFloor.isEmpty()) {
      return EMPTY;
    }
    Map<Integer, List<WallSegment>> index = new HashMap<>();
    wallsByFloor.forEach(
        (floor, walls) -> index.put(floor, Collections.unmodifiableList(toSegments(walls))));
    return new WallSegmentIndex(Collections.unmodifiableMap(index));
  }

  /** Segments on a floor, empty when the floor has no walls. */
  public List<WallSegment> segmentsOnFloor(int floor) {
    return segmentsByFloor.getOrDefault(floor, List.of());
  }

  public boolean hasFloor(int floor) {
    return segmentsByFloor.containsKey(floor);
  }

  public int segmentCount() {
    return segmentsByFloor.values().stream().mapToInt(List::size).sum();
  }

  private static List<WallSegment> toSegments(List<WallPolyline> walls) {
    List<WallSegment> segments = new ArrayList<>();
    if (walls == null) {
      return segments;
    }
    for (WallPolyline wall : walls) {
      List<GeoPoint> points = wall.points();
      for (int i = 0; i < wall.segmentCount(); i++) {
        GeoPoint start = points.get(i);
        GeoPoint end = points.get(i + 1);
        segments.add(
            new WallSegment(start.lat(), start.lng(), end.lat(), end.lng(), wall.materialOf(i)));
      }
    }
    return segments;
  }
}
