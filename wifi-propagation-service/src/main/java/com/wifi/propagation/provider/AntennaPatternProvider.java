package com.wifi.propagation.provider;

import com.wifi.propagation.model.Band;

/**
 * Source of antenna radiation patterns keyed by device model, band and antenna mode.
 *
 * <p>Implementations never fail on unknown combinations: they substitute the closest pattern they
 * have and flag the substitution, or report 0 dB gain when nothing is known about a model.
 */
public interface AntennaPatternProvider {

  /**
   * Horizontal gain relative to peak.
   *
   * @param model device model
   * @param band radio band
   * @param angleDeg azimuth in degrees
   * @param antennaMode antenna mode, may be null
   * @return gain in dB, 0 at peak
   */
  float azimuthGainDb(String model, Band band, int angleDeg, String antennaMode);

  /**
   * Vertical gain relative to peak.
   *
   * @param model device model
   * @param band radio band
   * @param angleDeg elevation in degrees, 0 straight down and 90 the horizon
   * @param antennaMode antenna mode, may be null
   * @return gain in dB, 0 at peak
   */
  float elevationGainDb(String model, Band band, int angleDeg, String antennaMode);

  /** Whether the model ships a switchable omni antenna variant on any band. */
  boolean hasOmniVariant(String model);

  /**
   * Resolves the pattern used for a model, band and mode, reporting whether a substitute was used.
   */
  PatternResolution resolvePattern(String model, Band band, String antennaMode);
}
