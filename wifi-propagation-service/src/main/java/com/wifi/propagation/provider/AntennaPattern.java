package com.wifi.propagation.provider;

import java.util.Arrays;

import com.wifi.propagation.model.Band;

/**
 * Measured radiation pattern of one antenna variant on one band. Both cuts hold gain samples in dB,
 * normalized to 0 dB at peak, spaced evenly over 360 degrees starting at 0.
 *
 * @param model device model
 * @param band radio band the pattern was measured on
 * @param variant antenna variant such as "OMNI", or null for the base pattern
 * @param azimuth horizontal cut
 * @param elevation vertical cut; 0 is straight down, 90 the horizon for a ceiling mount
 */
public record AntennaPattern(
    String model, Band band, String variant, float[] azimuth, float[] elevation) {

  public AntennaPattern {
    if (azimuth == null || azimuth.length == 0 || elevation == null || elevation.length == 0) {
      throw new IllegalArgumentException(
          "Antenna pattern " + model + "/" + band + " needs azimuth and elevation samples");
    }
    azimuth = Arrays.copyOf(azimuth, azimuth.length);
    elevation = Arrays.copyOf(elevation, elevation.length);
  }

  public float azimuthGainDb(int angleDeg) {
    return sample(azimuth, angleDeg);
  }

  public float elevationGainDb(int angleDeg) {
    return sample(elevation, angleDeg);
  }

  public boolean isVariant() {
    return variant != null;
  }

  private static float sample(float[] cut, int angleDeg) {
    int normalized = Math.floorMod(angleDeg, 360);
    int index = (int) Math.round(normalized * cut.length / 360.0) % cut.length;
    return cut[index];
  }
}
