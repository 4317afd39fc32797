package com.wifi.propagation.algorithm;

import java.util.List;

import org.springframework.stereotype.Component;

import com.wifi.propagation.algorithm.antenna.AntennaOrientationResolver;
import com.wifi.propagation.algorithm.attenuation.FloorLossCalculator;
import com.wifi.propagation.algorithm.attenuation.WallLossCalculator;
import com.wifi.propagation.algorithm.util.GeoCalculator;
import com.wifi.propagation.config.PropagationProperties;
import com.wifi.propagation.model.Band;
import com.wifi.propagation.model.PropagationAccessPoint;

/**
 * Received signal strength of one access point at one observation point.
 *
 * <p>MATHEMATICAL MODEL:
 *
 * <pre>
 * d2d     = haversine(AP, point), at least 0.1 m
 * dv      = |apFloor - activeFloor| * floorHeight
 * d3d     = max(0.1, sqrt(d2d^2 + dv^2))
 * PL(d3d) = 10 * n * log10(d3d) + 20 * log10(fMHz) - 27.55        (n = 2.8, indoor)
 * signal  = txPower + antennaGainDbi + G(az, el) - PL - wallLoss - floorLoss
 * </pre>
 *
 * The path-loss formula is the free-space loss in MHz/meters with the distance exponent raised
 * from 2.0 to the ITU-R P.1238 indoor value of 2.8. {@code G} is the pattern gain relative to
 * peak from {@link AntennaOrientationResolver}.
 *
 * <p>Elevation is measured from straight down: 90 degrees is the horizon, used for any point on
 * the AP's own floor.
 */
@Component
public class SignalStrengthModel {

  /** Indoor path-loss exponent (ITU-R P.1238, residential/office). */
  public static final double INDOOR_PATH_LOSS_EXPONENT = 2.8;

  /** Free-space path-loss constant for distances in meters and frequencies in MHz. */
  private static final double FSPL_CONSTANT_DB = 27.55;

  /** Distances are floored here to keep log10 finite directly under an AP. */
  static final double MIN_DISTANCE_METERS = 0.1;

  private static final int HORIZON_ELEVATION_DEG = 90;
  private static final int MAX_ELEVATION_DEG = 358;

  private final AntennaOrientationResolver orientationResolver;
  private final WallLossCalculator wallLossCalculator;
  private final FloorLossCalculator floorLossCalculator;
  private final double floorHeightMeters;

  public SignalStrengthModel(
      AntennaOrientationResolver orientationResolver,
      WallLossCalculator wallLossCalculator,
      FloorLossCalculator floorLossCalculator,
      PropagationProperties properties) {
    this.orientationResolver = orientationResolver;
    this.wallLossCalculator = wallLossCalculator;
    this.floorLossCalculator = floorLossCalculator;
    this.floorHeightMeters = properties.getFloorHeightMeters();
  }

  /**
   * Resolves the point-independent parts of an AP for a band.
   */
  public PreparedAccessPoint prepare(PropagationAccessPoint ap, Band band) {
    return new PreparedAccessPoint(ap, orientationResolver.elevationOffset(ap, band));
  }

  public List<PreparedAccessPoint> prepareAll(List<PropagationAccessPoint> aps, Band band) {
    return aps.stream().map(ap -> prepare(ap, band)).toList();
  }

  /**
   * Signal of a single AP at a point, resolving the AP's mount offset on the fly.
   */
  public float signalDbm(
      PropagationAccessPoint ap, double pointLat, double pointLng, PropagationContext context) {
    return signalDbm(prepare(ap, context.band()), pointLat, pointLng, context);
  }

  /**
   * Signal of a prepared AP at a point on {@code context.activeFloor()}.
   *
   * @return received signal in dBm
   */
  public float signalDbm(
      PreparedAccessPoint prepared, double pointLat, double pointLng, PropagationContext context) {
    PropagationAccessPoint ap = prepared.accessPoint();
    int activeFloor = context.activeFloor();
    Band band = context.band();

    double distance2d =
        Math.max(
            MIN_DISTANCE_METERS,
            GeoCalculator.haversineDistanceMeters(
                ap.latitude(), ap.longitude(), pointLat, pointLng));

    int floorSeparation = Math.abs(ap.floor() - activeFloor);
    double verticalDistance = floorSeparation * floorHeightMeters;
    double distance3d =
        Math.max(
            MIN_DISTANCE_METERS,
            Math.sqrt(distance2d * distance2d + verticalDistance * verticalDistance));

    double pathLoss = pathLossDb(distance3d, context.frequencyMhz());

    int azimuthDeg = azimuthDeg(ap, pointLat, pointLng);
    int elevationDeg =
        AntennaOrientationResolver.applyElevationOffset(
            rawElevationDeg(floorSeparation, distance2d, verticalDistance),
            prepared.elevationOffsetDeg());
    double antennaGain =
        orientationResolver.antennaGainDb(ap, band, azimuthDeg, elevationDeg);

    double wallLoss =
        wallLossCalculator.pathWallLossDb(
            ap.latitude(), ap.longitude(), ap.floor(),
            pointLat, pointLng, activeFloor,
            band, context.segmentIndex());

    double floorLoss =
        floorLossCalculator.floorLossDb(
            ap.latitude(), ap.longitude(), ap.floor(),
            pointLat, pointLng, activeFloor,
            band, context.buildings());

    double signal =
        ap.txPowerDbm() + ap.antennaGainDbi() + antennaGain - pathLoss - wallLoss - floorLoss;
    return (float) signal;
  }

  /**
   * Indoor log-distance path loss.
   *
   * @param distance3dMeters straight-line distance, already floored
   * @param frequencyMhz carrier frequency
   * @return loss in dB
   */
  public static double pathLossDb(double distance3dMeters, double frequencyMhz) {
    return 10 * INDOOR_PATH_LOSS_EXPONENT * Math.log10(distance3dMeters)
        + 20 * Math.log10(frequencyMhz)
        - FSPL_CONSTANT_DB;
  }

  /** Bearing to the point relative to the AP's facing direction, truncated to whole degrees. */
  static int azimuthDeg(PropagationAccessPoint ap, double pointLat, double pointLng) {
    double bearing =
        GeoCalculator.bearingDegrees(ap.latitude(), ap.longitude(), pointLat, pointLng);
    double relative = (bearing - ap.orientationDeg()) % 360;
    if (relative < 0) {
      relative += 360;
    }
    return (int) relative;
  }

  static int rawElevationDeg(int floorSeparation, double distance2d, double verticalDistance) {
    if (floorSeparation == 0) {
      return HORIZON_ELEVATION_DEG;
    }
    int elevation = (int) Math.toDegrees(Math.atan2(distance2d, verticalDistance));
    return Math.max(0, Math.min(MAX_ELEVATION_DEG, elevation));
  }
}
