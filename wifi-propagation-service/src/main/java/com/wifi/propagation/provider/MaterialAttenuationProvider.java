package com.wifi.propagation.provider;

import java.util.Set;

import com.wifi.propagation.model.Band;

/** Material penetration losses and band center frequencies. */
public interface MaterialAttenuationProvider {

  /**
   * Loss through one layer of a material. Unknown materials resolve to a generic interior wall.
   *
   * @param materialId material identifier, e.g. "drywall" or "floor_concrete"
   * @param band radio band
   * @return attenuation in dB, never negative
   */
  double attenuationDb(String materialId, Band band);

  /** Center frequency of the band in MHz. */
  double centerFrequencyMhz(Band band);

  /** Material ids with a dedicated loss entry. */
  default Set<String> knownMaterialIds() {
    return Set.of();
  }
}
