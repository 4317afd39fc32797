package com.wifi.propagation.health;

import com.wifi.propagation.provider.impl.JsonAntennaPatternProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the antenna pattern catalog. The service stays UP without patterns, because every AP
 * then radiates with a flat 0 dB pattern; a warning detail flags the degraded accuracy.
 */
@Component("antennaPatterns")
@RequiredArgsConstructor
public class AntennaPatternHealthIndicator implements HealthIndicator {

    private static final String PATTERN_COUNT_KEY = "patterns";
    private static final String MODEL_COUNT_KEY = "models";
    private static final String WARNING_KEY = "warning";

    private final JsonAntennaPatternProvider patternProvider;

    @Override
    public Health health() {
        int patterns = patternProvider.patternCount();
        Health.Builder builder = Health.up()
            .withDetail(PATTERN_COUNT_KEY, patterns)
            .withDetail(MODEL_COUNT_KEY, patternProvider.modelCount());
        if (patterns == 0) {
            builder.withDetail(WARNING_KEY, "No antenna patterns loaded, using flat 0 dB gains");
        }
        return builder.build();
    }
}
