package com.wifi.propagation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Radio bands a heatmap can be computed for. */
public enum Band {
  BAND_2_4_GHZ("2.4"),
  BAND_5_GHZ("5"),
  BAND_6_GHZ("6");

  private final String code;

  Band(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  /**
   * Resolves a band from its wire code. Accepts "2.4", "5", "6" with an optional "GHz" suffix, as
   * well as the enum constant name.
   *
   * @param value band code
   * @return the matching band
   * @throws IllegalArgumentException if the value names no known band
   */
  @JsonCreator
  public static Band fromCode(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Band is required");
    }
    String normalized = value.trim().toLowerCase().replace("ghz", "").trim();
    for (Band band : values()) {
      if (band.code.equals(normalized) || band.name().equalsIgnoreCase(value.trim())) {
        return band;
      }
    }
    throw new IllegalArgumentException("Unknown band: " + value);
  }
}
