package com.wifi.propagation.model;

/**
 * An access point placed on a floor plan, as seen by the propagation engine.
 *
 * @param macAddress optional identifier used to match simulation overrides
 * @param latitude AP latitude in degrees
 * @param longitude AP longitude in degrees
 * @param floor floor index the AP is installed on
 * @param txPowerDbm radio transmit power
 * @param antennaGainDbi peak antenna gain
 * @param model device model, keys the antenna pattern
 * @param antennaMode optional antenna mode, e.g. "OMNI" on switchable models
 * @param mountType physical mounting
 * @param orientationDeg forward-facing azimuth of the AP, 0-359
 */
public record PropagationAccessPoint(
    String macAddress,
    double latitude,
    double longitude,
    int floor,
    double txPowerDbm,
    double antennaGainDbi,
    String model,
    String antennaMode,
    MountType mountType,
    int orientationDeg) {

  public PropagationAccessPoint {
    if (mountType == null) {
      mountType = MountType.CEILING;
    }
  }

  public PropagationAccessPoint withTxPowerDbm(double txPowerDbm) {
    return new PropagationAccessPoint(
        macAddress, latitude, longitude, floor, txPowerDbm, antennaGainDbi, model, antennaMode,
        mountType, orientationDeg);
  }

  public PropagationAccessPoint withAntennaMode(String antennaMode) {
    return new PropagationAccessPoint(
        macAddress, latitude, longitude, floor, txPowerDbm, antennaGainDbi, model, antennaMode,
        mountType, orientationDeg);
  }
}
