/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.spi;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import com.intuitivedesigns.synthkernel.core.OutputSink;
import com.intuitivedesigns.synthkernel.metrics.MetricsRuntime;

/**
 * SPI Definition for Pipeline Sinks (Destinations).
 */
public interface SinkPlugin extends PipelinePlugin<OutputSink> {

    @Override
    default PluginKind kind() {
        return PluginKind.SINK;
    }

    @Override
    OutputSink create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
