package com.wifi.propagation.model;

import java.util.Map;

/**
 * Footprint of a building and the slab material of each of its floors. The material for floor
 * {@code n} is the slab separating floor {@code n} from floor {@code n - 1}.
 *
 * @param bounds building bounding box
 * @param floorMaterials floor index to slab material id
 */
public record BuildingFloorInfo(BoundingBox bounds, Map<Integer, String> floorMaterials) {

  public BuildingFloorInfo {
    floorMaterials = floorMaterials == null ? Map.of() : Map.copyOf(floorMaterials);
  }

  public boolean contains(double lat, double lng) {
    return bounds.contains(lat, lng);
  }

  public double area() {
    return bounds.areaDeg2();
  }

  public String materialForFloor(int floor, String defaultMaterial) {
    return floorMaterials.getOrDefault(floor, defaultMaterial);
  }
}
