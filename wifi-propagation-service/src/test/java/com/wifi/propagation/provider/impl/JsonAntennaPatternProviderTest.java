package com.wifi.propagation.provider.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wifi.propagation.config.PropagationProperties;
import com.wifi.propagation.model.Band;
import com.wifi.propagation.provider.PatternResolution;

class JsonAntennaPatternProviderTest {

  private JsonAntennaPatternProvider provider;

  private static JsonAntennaPatternProvider providerFor(String location) {
    PropagationProperties properties = new PropagationProperties();
    properties.getAntennaPatterns().setLocation(location);
    return new JsonAntennaPatternProvider(new ObjectMapper(), new DefaultResourceLoader(), properties);
  }

  @BeforeEach
  void setUp() {
    provider = providerFor("classpath:test-antenna-patterns.json");
    provider.loadCatalog();
  }

  @Nested
  @DisplayName("Loading")
  class LoadingTests {

    @Test
    @DisplayName("counts patterns and models")
    void countsPatternsAndModels() {
      assertThat(provider.patternCount()).isEqualTo(7);
      assertThat(provider.modelCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("a missing catalog leaves every AP flat")
    void missingCatalogIsFlat() {
      JsonAntennaPatternProvider empty = providerFor("classpath:no-such-patterns.json");
      empty.loadCatalog();

      assertThat(empty.patternCount()).isZero();
      assertThat(empty.azimuthGainDb("Switchable-AP", Band.BAND_5_GHZ, 180, null)).isZero();
    }

    @Test
    @DisplayName("malformed JSON is reported")
    void malformedJsonIsReported() {
      assertThatThrownBy(
              () -> provider.load(new ByteArrayInputStream("{\"patterns\": [".getBytes(StandardCharsets.UTF_8))))
          .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("reloading replaces the catalog")
    void reloadReplacesCatalog() throws IOException {
      String json =
          "{\"patterns\":[{\"model\":\"Other\",\"band\":\"6\",\"azimuth\":[-1],\"elevation\":[-2]}]}";
      provider.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

      assertThat(provider.modelCount()).isEqualTo(1);
      assertThat(provider.cachedResolutionCount()).isZero();
      assertThat(provider.resolvePattern("Switchable-AP", Band.BAND_5_GHZ, null).isPresent()).isFalse();
      assertThat(provider.elevationGainDb("other", Band.BAND_6_GHZ, 10, null)).isEqualTo(-2f);
    }
  }

  @Nested
  @DisplayName("Resolution")
  class ResolutionTests {

    @Test
    @DisplayName("a variant measured on the band is an exact match")
    void variantOnBandIsExact() {
      PatternResolution resolution = provider.resolvePattern("Switchable-AP", Band.BAND_5_GHZ, "omni");

      assertThat(resolution.fallback()).isFalse();
      assertThat(resolution.pattern()).hasValueSatisfying(p -> assertThat(p.variant()).isEqualTo("OMNI"));
      assertThat(provider.azimuthGainDb("Switchable-AP", Band.BAND_5_GHZ, 0, "OMNI")).isEqualTo(-2f);
    }

    @Test
    @DisplayName("a variant missing on the band falls back to the base pattern")
    void missingVariantFallsBackToBase() {
      PatternResolution resolution = provider.resolvePattern("Switchable-AP", Band.BAND_6_GHZ, "OMNI");

      assertThat(resolution.fallback()).isTrue();
      assertThat(resolution.pattern())
          .hasValueSatisfying(p -> {
            assertThat(p.isVariant()).isFalse();
            assertThat(p.band()).isEqualTo(Band.BAND_6_GHZ);
          });
    }

    @Test
    @DisplayName("the base pattern is exact when no mode is requested")
    void baseIsExactWithoutMode() {
      assertThat(provider.resolvePattern("Switchable-AP", Band.BAND_5_GHZ, null).fallback()).isFalse();
      assertThat(provider.azimuthGainDb("Switchable-AP", Band.BAND_5_GHZ, 180, null)).isEqualTo(-8f);
    }

    @Test
    @DisplayName("a mode the model has no variant for selects the base pattern")
    void unknownModeSelectsBase() {
      PatternResolution resolution = provider.resolvePattern("Switchable-AP", Band.BAND_2_4_GHZ, "INTERNAL");

      assertThat(resolution.fallback()).isFalse();
      assertThat(resolution.pattern()).hasValueSatisfying(p -> assertThat(p.isVariant()).isFalse());
    }

    @Test
    @DisplayName("a band the model was never measured on uses the nearest band")
    void missingBandUsesNearestBand() {
      PatternResolution resolution = provider.resolvePattern("Flat-AP", Band.BAND_6_GHZ, null);

      assertThat(resolution.fallback()).isTrue();
      assertThat(resolution.pattern()).hasValueSatisfying(p -> assertThat(p.band()).isEqualTo(Band.BAND_5_GHZ));
    }

    @Test
    @DisplayName("unknown models resolve to nothing and radiate with 0 dB")
    void unknownModelIsEmpty() {
      PatternResolution resolution = provider.resolvePattern("Mystery-AP", Band.BAND_5_GHZ, null);

      assertThat(resolution.isPresent()).isFalse();
      assertThat(provider.azimuthGainDb("Mystery-AP", Band.BAND_5_GHZ, 90, null)).isZero();
      assertThat(provider.elevationGainDb(null, Band.BAND_5_GHZ, 90, null)).isZero();
    }

    @Test
    @DisplayName("unknown models and modes do not grow the resolution cache")
    void unknownLookupsKeepCacheBounded() {
      provider.resolvePattern("Switchable-AP", Band.BAND_5_GHZ, null);
      provider.resolvePattern("Switchable-AP", Band.BAND_5_GHZ, "OMNI");
      int cached = provider.cachedResolutionCount();

      for (int i = 0; i < 10_000; i++) {
        provider.azimuthGainDb("model-" + i, Band.BAND_5_GHZ, 0, "mode-" + i);
        provider.azimuthGainDb("Switchable-AP", Band.BAND_5_GHZ, 0, "mode-" + i);
      }

      assertThat(cached).isEqualTo(2);
      assertThat(provider.cachedResolutionCount()).isEqualTo(cached);
    }

    @Test
    @DisplayName("model names match regardless of case")
    void modelMatchIgnoresCase() {
      assertThat(provider.hasOmniVariant("switchable-ap")).isTrue();
      assertThat(provider.hasOmniVariant("FLAT-AP")).isFalse();
      assertThat(provider.elevationGainDb("SWITCHABLE-AP", Band.BAND_2_4_GHZ, 180, null)).isEqualTo(-10f);
    }
  }
}
