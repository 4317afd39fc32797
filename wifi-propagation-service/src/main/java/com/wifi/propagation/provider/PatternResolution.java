package com.wifi.propagation.provider;

import java.util.Optional;

/**
 * Result of looking up a pattern for a model, band and antenna mode.
 *
 * @param pattern the pattern that will be used for gain lookups, empty when nothing is known about
 *     the model
 * @param fallback true when the requested variant or band was unavailable and another pattern was
 *     substituted
 */
public record PatternResolution(Optional<AntennaPattern> pattern, boolean fallback) {

  public static PatternResolution exact(AntennaPattern pattern) {
    return new PatternResolution(Optional.of(pattern), false);
  }

  public static PatternResolution fallbackTo(AntennaPattern pattern) {
    return new PatternResolution(Optional.of(pattern), true);
  }

  public static PatternResolution none() {
    return new PatternResolution(Optional.empty(), true);
  }

  public boolean isPresent() {
    return pattern.isPresent();
  }
}
