/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.metrics;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for Metrics Runtime.
 */
public final class MetricsSettings {

    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PIPELINE_NAME = "pipeline.name";

    private static final String DEFAULT_PROVIDER = "NONE";

    public final String providerId;
    public final Map<String, String> commonTags;

    private MetricsSettings(String providerId, Map<String, String> commonTags) {
        this.providerId = providerId;
        this.commonTags = commonTags;
    }

    public static MetricsSettings from(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));

        final Map<String, String> tags = new LinkedHashMap<>();
        final String pipelineName = normalize(config.getString(KEY_PIPELINE_NAME, null));
        if (pipelineName != null) {
            tags.put("pipeline", pipelineName);
        }
        for (String tagKey : config.keysUnder(KEY_TAG_PREFIX)) {
            final String k = normalize(tagKey);
            final String v = normalize(config.getString(KEY_TAG_PREFIX + tagKey, null));
            if (k != null && v != null) {
                tags.put(k, v);
            }
        }

        return new MetricsSettings(provider == null ? DEFAULT_PROVIDER : provider, Collections.unmodifiableMap(tags));
    }

    @Override
    public String toString() {
        return "MetricsSettings{providerId='" + providerId + "', commonTags=" + commonTags + '}';
    }

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeUpper(String s) {
        String n = normalize(s);
        return (n != null) ? n.toUpperCase(Locale.ROOT) : null;
    }
}
