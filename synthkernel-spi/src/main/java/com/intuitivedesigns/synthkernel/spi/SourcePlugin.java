/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.spi;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import com.intuitivedesigns.synthkernel.core.RecordSource;
import com.intuitivedesigns.synthkernel.metrics.MetricsRuntime;

/**
 * SPI Definition for Pipeline Sources.
 */
public interface SourcePlugin extends PipelinePlugin<RecordSource> {

    @Override
    default PluginKind kind() {
        return PluginKind.SOURCE;
    }

    @Override
    RecordSource create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
