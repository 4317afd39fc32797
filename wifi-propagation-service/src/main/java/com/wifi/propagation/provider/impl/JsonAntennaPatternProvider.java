package com.wifi.propagation.provider.impl;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wifi.propagation.config.PropagationProperties;
import com.wifi.propagation.model.Band;
import com.wifi.propagation.provider.AntennaPattern;
import com.wifi.propagation.provider.AntennaPatternProvider;
import com.wifi.propagation.provider.PatternResolution;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * Antenna pattern provider backed by a JSON catalog loaded once at start-up.
 *
 * <p>Resolution order for {@code (model, band, mode)}:
 *
 * <ol>
 *   <li>the {@code mode} variant measured on {@code band};
 *   <li>the base pattern on {@code band}, flagged as a fallback when the model has the requested
 *       variant on other bands;
 *   <li>the base pattern of the nearest band the model was measured on, flagged as a fallback;
 *   <li>nothing: gain lookups return 0 dB.
 * </ol>
 *
 * A mode the model has no variant for at all (for example "INTERNAL" on a directional-only model)
 * simply selects the base pattern.
 */
@Component
@Slf4j
public class JsonAntennaPatternProvider implements AntennaPatternProvider {

    static final String OMNI_VARIANT = "OMNI";

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String location;

    private volatile Catalog catalog = Catalog.EMPTY;

    public JsonAntennaPatternProvider(
            ObjectMapper objectMapper, ResourceLoader resourceLoader, PropagationProperties properties) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.location = properties.getAntennaPatterns().getLocation();
    }

    /**
     * Loads the configured catalog. A missing catalog is not fatal: every AP then radiates with a
     * flat 0 dB pattern.
     */
    @PostConstruct
    public void loadCatalog() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Antenna pattern catalog not found at {} - all APs use a flat pattern", location);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read antenna pattern catalog " + location, e);
        }
    }

    /**
     * Replaces the catalog with the patterns read from {@code in}.
     *
     * @param in JSON catalog
     * @throws IOException if the catalog cannot be parsed
     */
    void load(InputStream in) throws IOException {
        AntennaPatternFile file = objectMapper.readValue(in, AntennaPatternFile.class);
        List<AntennaPatternFile.Entry> entries = file.patterns() == null ? List.of() : file.patterns();

        Map<String, ModelPatterns> loaded = new HashMap<>();
        for (AntennaPatternFile.Entry entry : entries) {
            if (entry.model() == null || entry.band() == null) {
                log.warn("Skipping antenna pattern without model or band: {}", entry.model());
                continue;
            }
            String variant = normalizeVariant(entry.variant());
            AntennaPattern pattern =
                new AntennaPattern(entry.model(), entry.band(), variant, entry.azimuth(), entry.elevation());
            loaded.computeIfAbsent(modelKey(entry.model()), key -> new ModelPatterns()).add(pattern);
        }

        catalog = new Catalog(Map.copyOf(loaded));

        log.info("Loaded {} antenna patterns for {} models from {}",
            entries.size(), loaded.size(), location);
        loaded.forEach((model, patterns) ->
            log.debug("Antenna patterns for {}: bands={} variants={}",
                model, patterns.base.keySet(), patterns.variants.keySet()));
    }

    @Override
    public float azimuthGainDb(String model, Band band, int angleDeg, String antennaMode) {
        return resolvePattern(model, band, antennaMode).pattern()
            .map(pattern -> pattern.azimuthGainDb(angleDeg))
            .orElse(0f);
    }

    @Override
    public float elevationGainDb(String model, Band band, int angleDeg, String antennaMode) {
        return resolvePattern(model, band, antennaMode).pattern()
            .map(pattern -> pattern.elevationGainDb(angleDeg))
            .orElse(0f);
    }

    @Override
    public boolean hasOmniVariant(String model) {
        ModelPatterns patterns = catalog.models().get(modelKey(model));
        return patterns != null && patterns.variants.containsKey(OMNI_VARIANT);
    }

    /**
     * Resolves a pattern. Only lookups for catalog models are cached, and modes the model has no
     * variant for are cached under the plain base key, so the cache is bounded by the catalog.
     */
    @Override
    public PatternResolution resolvePattern(String model, Band band, String antennaMode) {
        Catalog current = catalog;
        ModelPatterns patterns = current.models().get(modelKey(model));
        if (patterns == null) {
            return PatternResolution.none();
        }
        String variant = normalizeVariant(antennaMode);
        if (variant != null && !patterns.variants.containsKey(variant)) {
            variant = null;
        }
        LookupKey key = new LookupKey(modelKey(model), band, variant);
        return current.resolutions().computeIfAbsent(key, k -> resolve(patterns, k));
    }

    public int patternCount() {
        return catalog.models().values().stream().mapToInt(ModelPatterns::size).sum();
    }

    public int modelCount() {
        return catalog.models().size();
    }

    int cachedResolutionCount() {
        return catalog.resolutions().size();
    }

    private static PatternResolution resolve(ModelPatterns patterns, LookupKey key) {
        Map<Band, AntennaPattern> variantBands =
            key.variant() == null ? null : patterns.variants.get(key.variant());

        if (variantBands != null) {
            AntennaPattern exact = variantBands.get(key.band());
            if (exact != null) {
                return PatternResolution.exact(exact);
            }
            return nearest(patterns.base, key.band())
                .or(() -> nearest(variantBands, key.band()))
                .map(PatternResolution::fallbackTo)
                .orElse(PatternResolution.none());
        }

        AntennaPattern base = patterns.base.get(key.band());
        if (base != null) {
            return PatternResolution.exact(base);
        }
        return nearest(patterns.base, key.band())
            .map(PatternResolution::fallbackTo)
            .orElse(PatternResolution.none());
    }

    private static Optional<AntennaPattern> nearest(Map<Band, AntennaPattern> byBand, Band band) {
        if (byBand.containsKey(band)) {
            return Optional.of(byBand.get(band));
        }
        return byBand.entrySet().stream()
            .min(Comparator.comparingInt(entry -> Math.abs(entry.getKey().ordinal() - band.ordinal())))
            .map(Map.Entry::getValue);
    }

    private static String modelKey(String model) {
        return model == null ? "" : model.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeVariant(String variant) {
        if (variant == null || variant.isBlank()) {
            return null;
        }
        return variant.trim().toUpperCase(Locale.ROOT);
    }

    private record LookupKey(String model, Band band, String variant) {}

    /** Loaded models together with the resolutions computed from them; replaced as a whole. */
    private record Catalog(Map<String, ModelPatterns> models, Map<LookupKey, PatternResolution> resolutions) {

        static final Catalog EMPTY = new Catalog(Map.of());

        Catalog(Map<String, ModelPatterns> models) {
            this(models, new ConcurrentHashMap<>());
        }
    }

    /** Patterns of one model: base patterns by band and variant patterns by variant and band. */
    private static final class ModelPatterns {
        private final Map<Band, AntennaPattern> base = new EnumMap<>(Band.class);
        private final Map<String, Map<Band, AntennaPattern>> variants = new HashMap<>();

        void add(AntennaPattern pattern) {
            if (pattern.isVariant()) {
                variants.computeIfAbsent(pattern.variant(), v -> new EnumMap<>(Band.class))
                    .put(pattern.band(), pattern);
            } else {
                base.put(pattern.band(), pattern);
            }
        }

        int size() {
            return base.size() + variants.values().stream().mapToInt(Map::size).sum();
        }
    }
}
