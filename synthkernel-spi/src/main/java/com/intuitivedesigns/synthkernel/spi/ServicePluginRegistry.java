/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.spi;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Plugins of one kind, indexed by normalized id.
 *
 * <p>Ids are trimmed and upper-cased, so {@code source.type=generator} resolves to the
 * {@code GENERATOR} plugin. Loading fails on a blank id, on two plugins claiming the same id,
 * and on a plugin registered under the wrong kind.</p>
 *
 * @param <T> plugin contract, e.g. {@link SourcePlugin}
 */
public final class ServicePluginRegistry<T extends PipelinePlugin<?>> {

    private final PluginKind kind;
    private final SortedMap<String, T> byId;

    public ServicePluginRegistry(Class<T> contract, PluginKind kind, ClassLoader cl) {
        this(kind, ServiceLoader.load(contract, cl));
    }

    ServicePluginRegistry(PluginKind kind, Iterable<T> plugins) {
        this.kind = Objects.requireNonNull(kind, "kind");

        SortedMap<String, T> index = new TreeMap<>();
        for (T plugin : plugins) {
            String pluginClass = plugin.getClass().getName();
            String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException(kind + " plugin " + pluginClass + " has a blank id");
            }
            if (plugin.kind() != kind) {
                throw new IllegalStateException(kind + " plugin " + pluginClass + " declares kind " + plugin.kind());
            }
            T previous = index.putIfAbsent(id, plugin);
            if (previous != null) {
                throw new IllegalStateException(kind + " id '" + id + "' claimed by both "
                        + previous.getClass().getName() + " and " + pluginClass);
            }
        }
        this.byId = Collections.unmodifiableSortedMap(index);
    }

    public PluginKind kind() {
        return kind;
    }

    /**
     * @param configKey the property the id was read from, quoted in the error
     * @throws IllegalArgumentException if no plugin has that id
     */
    public T require(String id, String configKey) {
        return get(id).orElseThrow(() -> new IllegalArgumentException(
                "no " + kind + " plugin for '" + configKey + "=" + id + "', available: " + byId.keySet()));
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }

    /** Sorted ids. */
    public Set<String> availableIds() {
        return byId.keySet();
    }
}
