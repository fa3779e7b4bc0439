/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.metrics;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NoopMetricsProviderTest {

    @Test
    void onlyAnswersToNoop() {
        NoopMetricsProvider provider = new NoopMetricsProvider();

        MetricsSettings noop = MetricsSettings.from(PipelineConfig.fromMap(Map.of("metrics.provider", "noop")));
        MetricsSettings other = MetricsSettings.from(PipelineConfig.fromMap(Map.of("metrics.provider", "MICROMETER")));

        assertSame(MetricsRuntime.noop(), provider.create(noop));
        assertNull(provider.create(other));
    }

    @Test
    void discoveredThroughServiceLoader() {
        MetricsSettings s = MetricsSettings.from(PipelineConfig.fromMap(Map.of("metrics.provider", "NOOP")));

        MetricsRuntime rt = MetricsFactory.init(s);

        assertFalse(rt.enabled());
        rt.counter("ignored");
        rt.timer("ignored", Duration.ofSeconds(1));
        rt.gauge("ignored", 1.0);
    }
}
