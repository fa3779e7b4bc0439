/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.plugins;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import com.intuitivedesigns.synthkernel.core.OutputSink;
import com.intuitivedesigns.synthkernel.core.SourceRecord;
import com.intuitivedesigns.synthkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.synthkernel.spi.PluginKind;
import com.intuitivedesigns.synthkernel.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Discards every record. Used to measure raw generator throughput.
 * <p>
 * ID: DEVNULL
 */
public final class DevNullSinkPlugin implements SinkPlugin {

    public static final String ID = "DEVNULL";
    private static final Logger log = LoggerFactory.getLogger(DevNullSinkPlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public PluginKind kind() {
        return PluginKind.SINK;
    }

    @Override
    public OutputSink create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        log.warn("DEVNULL sink active: generated records are discarded");
        return new DevNullSink();
    }

    private static final class DevNullSink implements OutputSink {

        @Override
        public void write(SourceRecord record) {
            // discard; the orchestrator meters throughput
        }

        @Override
        public void close() {
            log.info("DevNull sink closed.");
        }
    }
}
