package com.wifi.propagation.provider.impl;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.wifi.propagation.config.PropagationProperties;
import com.wifi.propagation.model.MountType;
import com.wifi.propagation.provider.MountTypeResolver;

/**
 * Infers the factory mount of a device from its model name. Entries in
 * {@code propagation.mount-types.overrides} win over the naming rules.
 */
@Component
public class ModelNameMountTypeResolver implements MountTypeResolver {

    private final Map<String, MountType> overrides = new HashMap<>();

    public ModelNameMountTypeResolver(PropagationProperties properties) {
        properties.getMountTypes().getOverrides()
            .forEach((model, mount) -> overrides.put(normalize(model), MountType.fromValue(mount)));
    }

    @Override
    public MountType defaultMountType(String model) {
        if (model == null || model.isBlank()) {
            return MountType.CEILING;
        }
        String name = normalize(model);
        MountType override = overrides.get(name);
        if (override != null) {
            return override;
        }

        // in-wall plates, outdoor and mesh units hang on a wall
        if (name.contains("-iw") || name.contains("in-wall") || name.contains("outdoor")
            || name.contains("mesh") || name.endsWith("-m")) {
            return MountType.WALL;
        }
        if (name.startsWith("ux") || name.contains("express") || name.contains("desktop")
            || name.contains("flex")) {
            return MountType.DESKTOP;
        }
        return MountType.CEILING;
    }

    private static String normalize(String model) {
        return model.trim().toLowerCase(Locale.ROOT);
    }
}
