package com.wifi.propagation.algorithm.antenna;

import org.springframework.stereotype.Component;

import com.wifi.propagation.model.Band;
import com.wifi.propagation.model.MountType;
import com.wifi.propagation.model.PropagationAccessPoint;
import com.wifi.propagation.provider.AntennaPatternProvider;
import com.wifi.propagation.provider.MountTypeResolver;
import com.wifi.propagation.provider.PatternResolution;

/**
 * Turns the geometric angles between an AP and a point into antenna pattern gain, taking into
 * account how the pattern was measured and how the AP is actually mounted.
 *
 * <p>Patterns are measured in one of two orientations. Directional patterns, including the
 * directional mode of switchable models, are measured flat (ceiling). True omni variants are
 * measured in the model's default mount, which is a wall mount for outdoor units. When the omni
 * variant has no data for the requested band the provider substitutes the directional base
 * pattern, which is then ceiling-native as well.
 *
 * <p>The difference between the actual mount and the pattern's native mount rotates the elevation
 * cut. A wall mount additionally turns the azimuth plane vertical, so horizontal directionality is
 * read from the elevation cut and vertical directionality from the azimuth cut.
 */
@Component
public class AntennaOrientationResolver {

  static final String OMNI_MODE = "OMNI";

  /** Elevation lookups wrap on this modulus so a rotated angle stays inside [0, 358]. */
  private static final int ELEVATION_MODULUS = 359;

  private final AntennaPatternProvider patternProvider;
  private final MountTypeResolver mountTypeResolver;

  public AntennaOrientationResolver(
      AntennaPatternProvider patternProvider, MountTypeResolver mountTypeResolver) {
    this.patternProvider = patternProvider;
    this.mountTypeResolver = mountTypeResolver;
  }

  /**
   * Mount orientation the pattern data for this model, band and mode was measured in.
   *
   * @param model device model
   * @param band radio band
   * @param antennaMode requested antenna mode, may be null
   * @return the pattern's native mount
   */
  public MountType nativeMount(String model, Band band, String antennaMode) {
    if (!patternProvider.hasOmniVariant(model)) {
      return mountTypeResolver.defaultMountType(model);
    }

    if (isOmni(antennaMode)) {
      PatternResolution omni = patternProvider.resolvePattern(model, band, OMNI_MODE);
      if (!omni.isPresent() || omni.fallback()) {
        return MountType.CEILING;
      }
      return mountTypeResolver.defaultMountType(model);
    }

    return MountType.CEILING;
  }

  /**
   * Rotation to apply to elevation angles for this AP: actual mount offset minus the pattern's
   * native mount offset.
   */
  public int elevationOffset(PropagationAccessPoint ap, Band band) {
    MountType patternMount = nativeMount(ap.model(), band, ap.antennaMode());
    return ap.mountType().getElevationOffsetDeg() - patternMount.getElevationOffsetDeg();
  }

  /**
   * Applies a mount offset to a raw elevation angle.
   *
   * @param rawElevationDeg elevation before correction
   * @param offsetDeg mount offset
   * @return corrected elevation in [0, 358]
   */
  public static int applyElevationOffset(int rawElevationDeg, int offsetDeg) {
    return ((rawElevationDeg + offsetDeg) % ELEVATION_MODULUS + ELEVATION_MODULUS)
        % ELEVATION_MODULUS;
  }

  /**
   * Combined azimuth and elevation gain by pattern multiplication. Both cuts are normalized to
   * 0 dB at peak, so the product in linear terms is a sum in dB.
   *
   * @param ap the access point
   * @param band radio band
   * @param azimuthDeg azimuth relative to the AP's facing direction
   * @param elevationDeg elevation already corrected by {@link #elevationOffset}
   * @return gain in dB relative to peak
   */
  public double antennaGainDb(
      PropagationAccessPoint ap, Band band, int azimuthDeg, int elevationDeg) {
    float azGain;
    float elGain;
    if (ap.mountType() == MountType.WALL) {
      azGain = patternProvider.elevationGainDb(ap.model(), band, azimuthDeg, ap.antennaMode());
      elGain = patternProvider.azimuthGainDb(ap.model(), band, elevationDeg, ap.antennaMode());
    } else {
      azGain = patternProvider.azimuthGainDb(ap.model(), band, azimuthDeg, ap.antennaMode());
      elGain = patternProvider.elevationGainDb(ap.model(), band, elevationDeg, ap.antennaMode());
    }
    return azGain + elGain;
  }

  static boolean isOmni(String antennaMode) {
    return antennaMode != null && OMNI_MODE.equalsIgnoreCase(antennaMode.trim());
  }
}
