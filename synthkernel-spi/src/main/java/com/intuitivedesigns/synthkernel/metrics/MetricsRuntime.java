/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.metrics;

import java.time.Duration;

/**
 * Vendor-agnostic metrics contract used by the generator and the host.
 * Every instrumentation method defaults to a no-op so callers never need a null check.
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     */
    Object registry();

    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER", "NOOP").
     */
    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, Duration duration) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }

    /**
     * Shared no-op instance for components built without a metrics backend (tests, embedding).
     */
    static MetricsRuntime noop() {
        return NoopHolder.INSTANCE;
    }

    final class NoopHolder {
        private static final MetricsRuntime INSTANCE = () -> NoopHolder.class;

        private NoopHolder() {}
    }
}
