/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.settings;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Validated generator configuration.
 *
 * <p>Instances normally come from {@link GeneratorSettingsParser}; the compact constructor
 * rejects combinations the engine cannot run with so programmatic callers get the same
 * guarantees.</p>
 *
 * @param recordCount record ceiling, 0 for unlimited
 * @param rate records per second, 0 for unlimited
 * @param readTime deprecated per-record delay, converted to a rate when {@code rate} is 0
 * @param burst burst wave
 * @param collections default collection first, then named collections by name
 * @param schemaSubject schema subject suffix for structured collections, null when disabled
 */
public record GeneratorSettings(
        long recordCount,
        double rate,
        Duration readTime,
        BurstSettings burst,
        List<CollectionSettings> collections,
        String schemaSubject
) {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    public GeneratorSettings {
        readTime = (readTime == null) ? Duration.ZERO : readTime;
        burst = (burst == null) ? BurstSettings.disabled() : burst;
        collections = List.copyOf(Objects.requireNonNull(collections, "collections"));
        schemaSubject = (schemaSubject == null || schemaSubject.isBlank()) ? null : schemaSubject.trim();

        if (recordCount < 0) throw new IllegalArgumentException("record count must be >= 0: " + recordCount);
        if (Double.isNaN(rate) || Double.isInfinite(rate) || rate < 0) {
            throw new IllegalArgumentException("rate must be a finite value >= 0: " + rate);
        }
        if (readTime.isNegative()) throw new IllegalArgumentException("read time must be >= 0: " + readTime);
        if (rate > 0 && !readTime.isZero()) {
            throw new IllegalArgumentException("rate and read time are mutually exclusive");
        }
        if (collections.isEmpty()) throw new IllegalArgumentException("at least one collection is required");
    }

    /**
     * Records per second the limiter enforces; 0 means unlimited.
     */
    public double effectiveRate() {
        if (rate == 0 && !readTime.isZero()) {
            return NANOS_PER_SECOND / readTime.toNanos();
        }
        return rate;
    }

    public boolean schemaEnabled() {
        return schemaSubject != null;
    }
}
