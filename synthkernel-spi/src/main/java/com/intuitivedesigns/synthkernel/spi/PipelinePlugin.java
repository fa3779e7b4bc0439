/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.spi;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import com.intuitivedesigns.synthkernel.metrics.MetricsRuntime;

/**
 * Base contract of every ServiceLoader-discovered plugin.
 *
 * @param <T> the component the plugin builds
 */
public interface PipelinePlugin<T> {

    String id();          // e.g. "GENERATOR", "DEVNULL", "LOG"

    PluginKind kind();

    T create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
