package com.wifi.propagation.algorithm.attenuation;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.wifi.propagation.model.Band;
import com.wifi.propagation.model.BuildingFloorInfo;
import com.wifi.propagation.provider.MaterialAttenuationProvider;

/**
 * Slab attenuation for signals crossing floors.
 *
 * <p>The slab between floor N and N+1 belongs to floor N+1, so each crossing uses the upper
 * floor's material. Materials come from the building around the observation point, falling back
 * to the building around the AP.
 */
@Component
public class FloorLossCalculator {

  /** Slab material assumed when a floor has no explicit entry or no building data exists. */
  public static final String DEFAULT_FLOOR_MATERIAL = "floor_wood";

  private final MaterialAttenuationProvider materialProvider;

  public FloorLossCalculator(MaterialAttenuationProvider materialProvider) {
    this.materialProvider = materialProvider;
  }

  /**
   * @param apLat AP latitude
   * @param apLng AP longitude
   * @param apFloor AP floor
   * @param pointLat observation latitude
   * @param pointLng observation longitude
   * @param activeFloor observation floor
   * @param band radio band
   * @param buildings known buildings, null or empty when the request has none
   * @return slab loss in dB, 0 on the same floor or when both ends are outdoors
   */
  public double floorLossDb(
      double apLat, double apLng, int apFloor,
      double pointLat, double pointLng, int activeFloor,
      Band band,
      List<BuildingFloorInfo> buildings) {
    if (apFloor == activeFloor) {
      return 0.0;
    }

    if (buildings == null || buildings.isEmpty()) {
      return Math.abs(apFloor - activeFloor)
          * materialProvider.attenuationDb(DEFAULT_FLOOR_MATERIAL, band);
    }

    Optional<BuildingFloorInfo> building =
        BuildingLocator.findSmallestContaining(buildings, pointLat, pointLng)
            .or(() -> BuildingLocator.findSmallestContaining(buildings, apLat, apLng));

    if (building.isEmpty()) {
      return 0.0;
    }

    BuildingFloorInfo selected = building.get();
    int minFloor = Math.min(apFloor, activeFloor);
    int maxFloor = Math.max(apFloor, activeFloor);
    double totalLoss = 0.0;
    for (int floor = minFloor + 1; floor <= maxFloor; floor++) {
      String material = selected.materialForFloor(floor, DEFAULT_FLOOR_MATERIAL);
      totalLoss += materialProvider.attenuationDb(material, band);
    }
    return totalLoss;
  }
}
