/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.plugins;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import com.intuitivedesigns.synthkernel.core.RecordSource;
import com.intuitivedesigns.synthkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.synthkernel.schema.InMemorySchemaRegistry;
import com.intuitivedesigns.synthkernel.settings.GeneratorSettings;
import com.intuitivedesigns.synthkernel.settings.GeneratorSettingsParser;
import com.intuitivedesigns.synthkernel.source.GeneratorFactory;
import com.intuitivedesigns.synthkernel.spi.PluginKind;
import com.intuitivedesigns.synthkernel.spi.SourcePlugin;

import java.util.Objects;
import java.util.Random;

/**
 * Synthetic record generator source.
 * <p>
 * ID: GENERATOR. Settings live under {@code source.generator.*}.
 */
public final class GeneratorSourcePlugin implements SourcePlugin {

    public static final String ID = "GENERATOR";

    // Config Keys
    static final String CFG_SEED = GeneratorSettingsParser.PREFIX + "seed";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public PluginKind kind() {
        return PluginKind.SOURCE;
    }

    @Override
    public RecordSource create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final GeneratorSettings settings = GeneratorSettingsParser.parse(config);
        final Random seeds = config.hasPath(CFG_SEED)
                ? new Random(config.requireLong(CFG_SEED, 0L))
                : new Random();

        return GeneratorFactory.build(settings, new InMemorySchemaRegistry(), metrics, seeds);
    }
}
