package com.wifi.propagation.algorithm;

import java.util.List;

import com.wifi.propagation.algorithm.attenuation.WallSegmentIndex;
import com.wifi.propagation.model.Band;
import com.wifi.propagation.model.BuildingFloorInfo;

/**
 * Request-wide inputs shared by every cell of one heatmap. Immutable, safe to share between row
 * workers.
 *
 * @param band radio band
 * @param frequencyMhz center frequency of the band
 * @param activeFloor floor the heatmap is drawn for
 * @param segmentIndex walls of the request grouped by floor
 * @param buildings buildings of the request, may be empty
 */
public record PropagationContext(
    Band band,
    double frequencyMhz,
    int activeFloor,
    WallSegmentIndex segmentIndex,
    List<BuildingFloorInfo> buildings) {

  public PropagationContext {
    segmentIndex = segmentIndex == null ? WallSegmentIndex.empty() : segmentIndex;
    buildings = buildings == null ? List.of() : List.copyOf(buildings);
  }
}
