/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.pacing;

import com.intuitivedesigns.synthkernel.core.Cancellation;
import com.intuitivedesigns.synthkernel.core.PullCancelledException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Caps record production at {@code rate} records per second, one permit per refresh period.
 *
 * <p>Permits are reserved up front and the wait happens on the caller's {@link Cancellation},
 * so a shutdown releases a waiting pull immediately. A rate of 0 disables limiting.</p>
 */
public final class RecordRateLimiter {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;
    private static final String LIMITER_NAME = "generator";

    // Reservations never time out; the wait is bounded by cancellation instead.
    private static final Duration RESERVATION_TIMEOUT = Duration.ofNanos(Long.MAX_VALUE / 2);

    private final double rate;
    private final RateLimiter limiter;

    public RecordRateLimiter(double ratePerSecond) {
        if (Double.isNaN(ratePerSecond) || ratePerSecond < 0 || Double.isInfinite(ratePerSecond)) {
            throw new IllegalArgumentException("rate must be a finite value >= 0: " + ratePerSecond);
        }
        this.rate = ratePerSecond;
        this.limiter = ratePerSecond == 0 ? null : RateLimiter.of(LIMITER_NAME, configFor(ratePerSecond));
    }

    static RateLimiterConfig configFor(double ratePerSecond) {
        final long intervalNanos = Math.max(1L, Math.round(NANOS_PER_SECOND / ratePerSecond));
        return RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofNanos(intervalNanos))
                .timeoutDuration(RESERVATION_TIMEOUT)
                .build();
    }

    public static RecordRateLimiter unlimited() {
        return new RecordRateLimiter(0d);
    }

    /**
     * Limiter granting one permit per {@code delay}; zero delay means unlimited.
     */
    public static RecordRateLimiter every(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) throw new IllegalArgumentException("delay must not be negative: " + delay);
        if (delay.isZero()) return unlimited();
        return new RecordRateLimiter(NANOS_PER_SECOND / delay.toNanos());
    }

    public boolean enabled() {
        return limiter != null;
    }

    public double rate() {
        return rate;
    }

    /**
     * Blocks until a permit is available.
     *
     * @throws PullCancelledException if cancelled before or while waiting
     */
    public void acquire(Cancellation cancellation) throws PullCancelledException {
        cancellation.throwIfCancelled();
        if (!enabled()) return;

        long wait = reserveNanos();
        if (wait > 0) {
            cancellation.sleepNanos(wait);
        }
    }

    /**
     * Reserves the next permit and returns how long the caller must wait for it.
     */
    long reserveNanos() {
        if (!enabled()) return 0L;
        long wait = limiter.reservePermission();
        if (wait < 0) {
            throw new IllegalStateException("rate limiter refused a reservation at " + rate + "/s");
        }
        return wait;
    }

    Duration refreshPeriod() {
        return enabled() ? limiter.getRateLimiterConfig().getLimitRefreshPeriod() : Duration.ZERO;
    }

    @Override
    public String toString() {
        return enabled() ? "RecordRateLimiter{rate=" + rate + "/s}" : "RecordRateLimiter{unlimited}";
    }
}
