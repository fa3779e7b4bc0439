/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.spi;

/**
 * Source and sink plugins visible to one class loader, discovered once.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<SourcePlugin> sources;
    private final ServicePluginRegistry<SinkPlugin> sinks;

    public PluginCatalog(ClassLoader cl) {
        this(new ServicePluginRegistry<>(SourcePlugin.class, PluginKind.SOURCE, cl),
                new ServicePluginRegistry<>(SinkPlugin.class, PluginKind.SINK, cl));
    }

    PluginCatalog(ServicePluginRegistry<SourcePlugin> sources, ServicePluginRegistry<SinkPlugin> sinks) {
        this.sources = sources;
        this.sinks = sinks;
    }

    public SourcePlugin source(String id, String configKey) {
        return sources.require(id, configKey);
    }

    public SinkPlugin sink(String id, String configKey) {
        return sinks.require(id, configKey);
    }

    public ServicePluginRegistry<SourcePlugin> sources() {
        return sources;
    }

    public ServicePluginRegistry<SinkPlugin> sinks() {
        return sinks;
    }

    /**
     * Startup summary, e.g. {@code sources=[GENERATOR] sinks=[DEVNULL, LOG]}.
     */
    public String describe() {
        return "sources=" + sources.availableIds() + " sinks=" + sinks.availableIds();
    }
}
