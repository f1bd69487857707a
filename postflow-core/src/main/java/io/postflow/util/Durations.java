package io.postflow.util;

import java.time.Duration;
import java.util.Objects;

/**
 * Argument checks shared by the builders.
 */
public final class Durations {
    private Durations() {
    }

    public static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    public static int requireAtLeastOne(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
        }
        return value;
    }
}
