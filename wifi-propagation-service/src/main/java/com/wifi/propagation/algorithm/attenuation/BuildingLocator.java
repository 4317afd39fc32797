package com.wifi.propagation.algorithm.attenuation;

import java.util.List;
import java.util.Optional;

import com.wifi.propagation.model.BuildingFloorInfo;

/** Finds the building a location belongs to. */
public final class BuildingLocator {

  private BuildingLocator() {
    // Utility class
  }

  /**
   * Picks the smallest building whose bounds contain the location, so a large footprint never
   * shadows a smaller, more specific building drawn inside it.
   *
   * @param buildings candidate buildings, may be null
   * @return the most specific building, or empty when the location is outdoors
   */
  public static Optional<BuildingFloorInfo> findSmallestContaining(
      List<BuildingFloorInfo> buildings, double lat, double lng) {
    if (buildings == null) {
      return Optional.empty();
    }
    BuildingFloorInfo best = null;
    double bestArea = Double.MAX_VALUE;
    for (BuildingFloorInfo building : buildings) {
      if (building.contains(lat, lng)) {
        double area = building.area();
        if (area < bestArea) {
          bestArea = area;
          best = building;
        }
      }
    }
    return Optional.ofNullable(best);
  }
}
