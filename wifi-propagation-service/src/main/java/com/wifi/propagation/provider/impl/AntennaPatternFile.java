package com.wifi.propagation.provider.impl;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wifi.propagation.model.Band;

/**
 * On-disk layout of the antenna pattern catalog.
 *
 * <pre>
 * { "patterns": [ { "model": "U6-Pro", "band": "5", "variant": null,
 *                   "azimuth": [...], "elevation": [...] } ] }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AntennaPatternFile(@JsonProperty("patterns") List<Entry> patterns) {

  /** One measured pattern; gain samples are spaced evenly over 360 degrees. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Entry(
      @JsonProperty("model") String model,
      @JsonProperty("band") Band band,
      @JsonProperty("variant") String variant,
      @JsonProperty("azimuth") float[] azimuth,
      @JsonProperty("elevation") float[] elevation) {}
}
