/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.settings;

import java.time.Duration;
import java.util.Objects;

/**
 * Burst wave: {@code sleepTime} of silence followed by {@code generateTime} of generation.
 * A zero sleep time disables bursting.
 */
public record BurstSettings(Duration sleepTime, Duration generateTime) {

    public static final Duration DEFAULT_GENERATE_TIME = Duration.ofSeconds(1);

    public BurstSettings {
        Objects.requireNonNull(sleepTime, "sleepTime");
        Objects.requireNonNull(generateTime, "generateTime");
        if (sleepTime.isNegative()) {
            throw new IllegalArgumentException("burst sleep time must be >= 0: " + sleepTime);
        }
        if (!sleepTime.isZero() && (generateTime.isNegative() || generateTime.isZero())) {
            throw new IllegalArgumentException("burst generate time must be > 0 when sleep time is set: " + generateTime);
        }
    }

    public static BurstSettings disabled() {
        return new BurstSettings(Duration.ZERO, DEFAULT_GENERATE_TIME);
    }

    public boolean enabled() {
        return !sleepTime.isZero();
    }
}
