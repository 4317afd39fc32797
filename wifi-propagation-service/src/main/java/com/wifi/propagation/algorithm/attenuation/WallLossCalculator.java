package com.wifi.propagation.algorithm.attenuation;

import java.util.List;

import org.springframework.stereotype.Component;

import com.wifi.propagation.algorithm.util.GeoCalculator;
import com.wifi.propagation.model.Band;
import com.wifi.propagation.model.WallSegment;
import com.wifi.propagation.provider.MaterialAttenuationProvider;

/** Ray-casts the straight line from an AP to a point against wall segments. */
@Component
public class WallLossCalculator {

  private final MaterialAttenuationProvider materialProvider;

  public WallLossCalculator(MaterialAttenuationProvider materialProvider) {
    this.materialProvider = materialProvider;
  }

  /**
   * Sums the attenuation of every segment the AP-to-point line properly crosses.
   *
   * @return loss in dB, 0 when nothing is crossed
   */
  public double wallLossDb(
      double apLat, double apLng,
      double pointLat, double pointLng,
      Band band,
      List<WallSegment> segments) {
    double totalLoss = 0.0;
    for (WallSegment wall : segments) {
      if (GeoCalculator.segmentsIntersect(
          apLat, apLng, pointLat, pointLng,
          wall.lat1(), wall.lng1(), wall.lat2(), wall.lng2())) {
        totalLoss += materialProvider.attenuationDb(wall.material(), band);
      }
    }
    return totalLoss;
  }

  /**
   * Wall loss for a path between floors. Walls on the observation floor always count; when the AP
   * sits on another floor, the signal also crosses the walls around it on its own floor.
   */
  public double pathWallLossDb(
      double apLat, double apLng, int apFloor,
      double pointLat, double pointLng, int activeFloor,
      Band band,
      WallSegmentIndex segmentIndex) {
    double loss = 0.0;
    if (segmentIndex.hasFloor(activeFloor)) {
      loss += wallLossDb(apLat, apLng, pointLat, pointLng, band,
          segmentIndex.segmentsOnFloor(activeFloor));
    }
    if (apFloor != activeFloor && segmentIndex.hasFloor(apFloor)) {
      loss += wallLossDb(apLat, apLng, pointLat, pointLng, band,
          segmentIndex.segmentsOnFloor(apFloor));
    }
    return loss;
  }
}
