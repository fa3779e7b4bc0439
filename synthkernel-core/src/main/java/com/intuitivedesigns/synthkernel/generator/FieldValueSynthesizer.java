/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Produces one random value per field type tag.
 *
 * <p>Value kinds: {@code int} → {@link Integer} (non-negative), {@code string} → {@link String},
 * {@code time} → {@link java.time.Instant} (now, UTC), {@code bool} → {@link Boolean},
 * {@code duration} → {@link Duration} in {@code [0s, 1000s)}.</p>
 *
 * <p>Not thread-safe: the random source is owned by this instance.</p>
 */
public final class FieldValueSynthesizer {

    static final int MAX_DURATION_SECONDS = 1000;

    private final Random random;
    private final Clock clock;

    public FieldValueSynthesizer(Random random) {
        this(random, Clock.systemUTC());
    }

    public FieldValueSynthesizer(Random random, Clock clock) {
        this.random = Objects.requireNonNull(random, "random");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws IllegalStateException if {@code typeTag} is not a known type; configuration
     *                               validation must have rejected it earlier
     */
    public Object synthesize(String typeTag) {
        FieldType type = FieldType.fromTag(typeTag)
                .orElseThrow(() -> new IllegalStateException("invalid field type reached the synthesizer: \"" + typeTag + "\""));
        return synthesize(type);
    }

    public Object synthesize(FieldType type) {
        switch (type) {
            case INT:
                return random.nextInt(Integer.MAX_VALUE);
            case STRING:
                return RandomWords.next(random);
            case TIME:
                return clock.instant();
            case BOOL:
                return random.nextBoolean();
            case DURATION:
                return Duration.ofSeconds(random.nextInt(MAX_DURATION_SECONDS));
            default:
                throw new IllegalStateException("unhandled field type " + type);
        }
    }

    String word() {
        return RandomWords.next(random);
    }
}
