package com.wifi.propagation.provider.impl;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import com.wifi.propagation.config.PropagationProperties;
import com.wifi.propagation.model.Band;
import com.wifi.propagation.provider.MaterialAttenuationProvider;

import lombok.extern.slf4j.Slf4j;

/**
 * Built-in material loss table, optionally amended through {@code propagation.materials.overrides}.
 *
 * <p>Losses are typical single-layer penetration values in dB for 2.4, 5 and 6 GHz. Ids are matched
 * case-insensitively; an unknown id is treated as {@value #FALLBACK_MATERIAL}.
 */
@Component
@Slf4j
public class DefaultMaterialAttenuationProvider implements MaterialAttenuationProvider {

    static final String FALLBACK_MATERIAL = "drywall";

    private static final Map<Band, Double> CENTER_FREQUENCIES_MHZ = new EnumMap<>(Map.of(
        Band.BAND_2_4_GHZ, 2437.0,
        Band.BAND_5_GHZ, 5500.0,
        Band.BAND_6_GHZ, 6525.0));

    private final Map<String, double[]> losses;

    public DefaultMaterialAttenuationProvider(PropagationProperties properties) {
        Map<String, double[]> table = builtInTable();
        properties.getMaterials().getOverrides().forEach((id, loss) -> applyOverride(table, id, loss));
        this.losses = Collections.unmodifiableMap(table);
        log.info("Material attenuation table ready with {} materials ({} overridden)",
            losses.size(), properties.getMaterials().getOverrides().size());
    }

    @Override
    public double attenuationDb(String materialId, Band band) {
        double[] perBand = materialId == null ? null : losses.get(normalize(materialId));
        if (perBand == null) {
            perBand = losses.get(FALLBACK_MATERIAL);
        }
        return perBand[band.ordinal()];
    }

    @Override
    public double centerFrequencyMhz(Band band) {
        return CENTER_FREQUENCIES_MHZ.get(band);
    }

    @Override
    public Set<String> knownMaterialIds() {
        return losses.keySet();
    }

    private static Map<String, double[]> builtInTable() {
        // {2.4 GHz, 5 GHz, 6 GHz}
        Map<String, double[]> table = new TreeMap<>();
        table.put("drywall", new double[] {3, 4, 5});
        table.put("wood", new double[] {4, 6, 7});
        table.put("glass", new double[] {2, 3, 4});
        table.put("low_e_glass", new double[] {20, 26, 30});
        table.put("brick", new double[] {8, 12, 14});
        table.put("cinder_block", new double[] {10, 14, 17});
        table.put("concrete", new double[] {12, 18, 22});
        table.put("stone", new double[] {12, 17, 20});
        table.put("metal", new double[] {25, 30, 32});
        table.put("elevator_shaft", new double[] {30, 35, 38});
        table.put("floor_wood", new double[] {10, 14, 16});
        table.put("floor_concrete", new double[] {18, 25, 29});
        return table;
    }

    private static void applyOverride(
            Map<String, double[]> table, String id, PropagationProperties.MaterialLoss loss) {
        if (loss == null) {
            return;
        }
        String key = normalize(id);
        double[] base = table.getOrDefault(key, table.get(FALLBACK_MATERIAL)).clone();
        if (loss.getBand24() != null) {
            base[Band.BAND_2_4_GHZ.ordinal()] = nonNegative(id, loss.getBand24());
        }
        if (loss.getBand5() != null) {
            base[Band.BAND_5_GHZ.ordinal()] = nonNegative(id, loss.getBand5());
        }
        if (loss.getBand6() != null) {
            base[Band.BAND_6_GHZ.ordinal()] = nonNegative(id, loss.getBand6());
        }
        table.put(key, base);
        log.debug("Material {} loss set to {} dB", key, Arrays.toString(base));
    }

    private static double nonNegative(String id, double value) {
        if (value < 0 || !Double.isFinite(value)) {
            throw new IllegalArgumentException("Material loss for " + id + " must be a non-negative number");
        }
        return value;
    }

    private static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
