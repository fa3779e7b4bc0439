/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.pacing;

import com.intuitivedesigns.synthkernel.core.Cancellation;
import com.intuitivedesigns.synthkernel.core.PullCancelledException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Alternates between a generating window of length G and a sleeping window of length S.
 *
 * <p>The phase is derived from the monotonic clock on every call, not from transitions, so a
 * caller that stopped pulling for a while lands in the correct phase when it comes back. The
 * schedule starts inside a generating window.</p>
 *
 * <p>{@code windowEnd} is mutated only by the pulling thread; overlapping callers would need
 * external serialization.</p>
 */
public final class BurstScheduler {

    private final long sleepNanos;
    private final long generateNanos;
    private final LongSupplier nanoClock;

    private long windowEnd;

    public BurstScheduler(Duration sleepTime, Duration generateTime) {
        this(sleepTime, generateTime, System::nanoTime);
    }

    BurstScheduler(Duration sleepTime, Duration generateTime, LongSupplier nanoClock) {
        Objects.requireNonNull(sleepTime, "sleepTime");
        Objects.requireNonNull(generateTime, "generateTime");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");

        if (sleepTime.isNegative()) {
            throw new IllegalArgumentException("burst sleep time must not be negative: " + sleepTime);
        }
        this.sleepNanos = sleepTime.toNanos();
        this.generateNanos = generateTime.toNanos();
        if (sleepNanos > 0 && generateNanos <= 0) {
            throw new IllegalArgumentException("burst generate time must be positive when sleep time is set: " + generateTime);
        }

        if (sleepNanos > 0) {
            this.windowEnd = nanoClock.getAsLong() + generateNanos;
        }
    }

    public static BurstScheduler disabled() {
        return new BurstScheduler(Duration.ZERO, Duration.ZERO);
    }

    public boolean enabled() {
        return sleepNanos > 0;
    }

    /**
     * Blocks until the current time is inside a generating window.
     *
     * @throws PullCancelledException if cancelled before or while sleeping
     */
    public void await(Cancellation cancellation) throws PullCancelledException {
        cancellation.throwIfCancelled();
        if (!enabled()) return;

        long delay = delayNanos(nanoClock.getAsLong());
        if (delay > 0) {
            cancellation.sleepNanos(delay);
        }
    }

    /**
     * Time to sleep from {@code now} until the next generating window starts, 0 when already
     * inside one. Advances the window as a side effect.
     */
    long delayNanos(long now) {
        if (!enabled()) return 0L;

        // (now - windowEnd) < 0 is the overflow-safe form of now < windowEnd for nanoTime values
        if (now - windowEnd < 0) {
            return 0L;
        }

        // Catch up in whole cycles; at least one step so windowEnd ends up strictly after now.
        final long cycle = sleepNanos + generateNanos;
        final long behind = now - windowEnd;
        windowEnd += (behind / cycle + 1) * cycle;

        final long wakeAt = windowEnd - generateNanos;
        final long delay = wakeAt - now;
        return Math.max(0L, delay);
    }

    long windowEnd() {
        return windowEnd;
    }

    @Override
    public String toString() {
        return enabled()
                ? "BurstScheduler{sleep=" + Duration.ofNanos(sleepNanos) + ", generate=" + Duration.ofNanos(generateNanos) + '}'
                : "BurstScheduler{disabled}";
    }
}
