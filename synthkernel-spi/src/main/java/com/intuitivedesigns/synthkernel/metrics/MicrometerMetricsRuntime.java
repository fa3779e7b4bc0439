/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer bridge.
 *
 * <p>Backed by a composite registry that always contains an in-memory {@link SimpleMeterRegistry},
 * so counters can be read back in tests and logs without an external backend. Generic
 * {@link #gauge(String, double)} calls are mapped onto push-style state holders.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;
    private final Map<String, AtomicDouble> gaugeState = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this(Map.of());
    }

    public MicrometerMetricsRuntime(Map<String, String> commonTags) {
        this.registry = new CompositeMeterRegistry();
        this.registry.add(new SimpleMeterRegistry());

        if (commonTags != null && !commonTags.isEmpty()) {
            List<Tag> tags = new ArrayList<>(commonTags.size());
            commonTags.forEach((k, v) -> tags.add(Tag.of(k, v)));
            this.registry.config().commonTags(tags);
        }
        log.info("Metrics Runtime Initialized (Type: MICROMETER, tags={})", commonTags == null ? Map.of() : commonTags);
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void timer(String name, Duration duration) {
        if (duration != null && !duration.isNegative()) {
            registry.timer(name).record(duration);
        }
    }

    @Override
    public void gauge(String name, double value) {
        // computeIfAbsent registers the gauge exactly once
        AtomicDouble state = gaugeState.computeIfAbsent(name, key -> {
            AtomicDouble newState = new AtomicDouble(value);
            Gauge.builder(key, newState, AtomicDouble::get)
                    .register(registry);
            return newState;
        });
        state.set(value);
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics Runtime Closed.");
    }

    /**
     * Mutable double for gauge state; extends Number for Micrometer's value function.
     */
    private static final class AtomicDouble extends Number {
        private final AtomicLong bits;

        AtomicDouble(double initialValue) {
            this.bits = new AtomicLong(Double.doubleToLongBits(initialValue));
        }

        void set(double newValue) {
            bits.set(Double.doubleToLongBits(newValue));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }

        @Override public int intValue() { return (int) get(); }
        @Override public long longValue() { return (long) get(); }
        @Override public float floatValue() { return (float) get(); }
        @Override public double doubleValue() { return get(); }
    }
}
