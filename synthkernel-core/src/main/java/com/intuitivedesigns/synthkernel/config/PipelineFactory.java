/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.config;

import com.intuitivedesigns.synthkernel.core.OutputSink;
import com.intuitivedesigns.synthkernel.core.RecordSource;
import com.intuitivedesigns.synthkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.synthkernel.spi.PipelinePlugin;
import com.intuitivedesigns.synthkernel.spi.PluginCatalog;
import com.intuitivedesigns.synthkernel.spi.SinkPlugin;
import com.intuitivedesigns.synthkernel.spi.SourcePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public final class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    // Config keys
    static final String KEY_SOURCE_TYPE = "source.type";
    static final String KEY_SINK_TYPE = "sink.type";

    // Defaults
    private static final String DEFAULT_SOURCE = "GENERATOR";
    private static final String DEFAULT_SINK = "DEVNULL";

    private static final PluginCatalog CATALOG = new PluginCatalog(resolveClassLoader());

    private PipelineFactory() {}

    // --- FACTORY METHODS ---

    public static RecordSource createSource(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_SOURCE_TYPE, DEFAULT_SOURCE), DEFAULT_SOURCE);
        final SourcePlugin plugin = CATALOG.source(id, KEY_SOURCE_TYPE);
        return createSafe(plugin, config, metrics, "Source");
    }

    public static OutputSink createSink(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_SINK_TYPE, DEFAULT_SINK), DEFAULT_SINK);
        final SinkPlugin plugin = CATALOG.sink(id, KEY_SINK_TYPE);
        return createSafe(plugin, config, metrics, "Sink");
    }

    // --- UTILITIES ---

    public static void logAvailablePlugins() {
        log.info("Plugin catalog loaded: {}", CATALOG.describe());
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : PipelineFactory.class.getClassLoader();
    }

    /**
     * Runs the plugin factory, naming the plugin in any failure.
     */
    static <T> T createSafe(PipelinePlugin<T> plugin,
                            PipelineConfig config,
                            MetricsRuntime metrics,
                            String typeName) {
        Objects.requireNonNull(plugin, "plugin");
        try {
            return plugin.create(config, metrics);
        } catch (Exception e) {
            throw new IllegalStateException("Failed creating " + typeName + " [" + plugin.id() + "]", e);
        }
    }
}
