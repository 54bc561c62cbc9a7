package com.splitttr.coedit.config;

import java.time.Duration;

/**
 * Timing knobs of a collaboration session, bound from {@code collab.*}
 * properties by {@link CollaborationBeans}.
 */
public record CollaborationConfig(
    Duration presenceInterval,
    Duration inactiveThreshold,
    Duration batchWindow
) {

    public static final Duration DEFAULT_PRESENCE_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_INACTIVE_THRESHOLD = Duration.ofMinutes(2);
    public static final Duration DEFAULT_BATCH_WINDOW = Duration.ofMillis(100);

    public CollaborationConfig {
        requirePositive("presenceInterval", presenceInterval);
        requirePositive("inactiveThreshold", inactiveThreshold);
        requirePositive("batchWindow", batchWindow);
    }

    public static CollaborationConfig defaults() {
        return new CollaborationConfig(DEFAULT_PRESENCE_INTERVAL, DEFAULT_INACTIVE_THRESHOLD, DEFAULT_BATCH_WINDOW);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
