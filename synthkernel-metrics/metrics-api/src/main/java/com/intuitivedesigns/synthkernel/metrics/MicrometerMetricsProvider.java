/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.metrics;

/**
 * In-process Micrometer registry, selected with {@code metrics.provider=MICROMETER}.
 */
public final class MicrometerMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "MICROMETER";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        if (s == null || !matches(s.providerId)) {
            return null;
        }
        return new MicrometerMetricsRuntime(s.commonTags);
    }
}
