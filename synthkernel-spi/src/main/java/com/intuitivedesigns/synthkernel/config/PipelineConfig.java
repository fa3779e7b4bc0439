/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flat key/value configuration.
 * The process-wide instance loads from -Dsk.config.path or ENV 'SK_CONFIG_PATH'.
 */
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    private static final String PROP_CONFIG_PATH = "sk.config.path";
    private static final String ENV_CONFIG_PATH = "SK_CONFIG_PATH";

    private static volatile PipelineConfig instance;

    private final Properties props;

    private PipelineConfig(Properties props) {
        this.props = props;
    }

    public static PipelineConfig get() {
        PipelineConfig local = instance;
        if (local == null) {
            synchronized (PipelineConfig.class) {
                local = instance;
                if (local == null) {
                    local = loadDefault();
                    instance = local;
                }
            }
        }
        return local;
    }

    public static PipelineConfig fromMap(Map<String, String> source) {
        Properties copy = new Properties();
        if (source != null) {
            source.forEach((k, v) -> {
                if (k != null && v != null) copy.setProperty(k, v);
            });
        }
        return new PipelineConfig(copy);
    }

    public static PipelineConfig load(Path path) {
        Properties loaded = new Properties();
        try (InputStream is = Files.newInputStream(path)) {
            loaded.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties from {}", loaded.size(), path);
        return new PipelineConfig(loaded);
    }

    private static PipelineConfig loadDefault() {
        // 1. Try System Property first (Passed via -Dsk.config.path)
        String path = System.getProperty(PROP_CONFIG_PATH);

        // 2. Fallback to Environment Variable
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified. Usage: -D{}=/path/to/config.properties", PROP_CONFIG_PATH);
            return new PipelineConfig(new Properties());
        }
        return load(Path.of(path.trim()));
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    /**
     * Strict variant used by validating callers: a present but malformed value is an error.
     */
    public double requireDouble(String key, double defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("\"" + key + "\" is not a number: " + val, e);
        }
    }

    public long requireLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("\"" + key + "\" is not an integer: " + val, e);
        }
    }

    public Duration requireDuration(String key, Duration defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        try {
            return Durations.parse(val);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("\"" + key + "\" cannot be parsed: " + e.getMessage(), e);
        }
    }

    /**
     * Comma separated list; blank entries are dropped.
     */
    public List<String> getList(String key, List<String> defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        List<String> out = new ArrayList<>();
        for (String part : val.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return Collections.unmodifiableList(out);
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    /**
     * Keys starting with {@code prefix}, with the prefix stripped, in sorted order.
     */
    public Set<String> keysUnder(String prefix) {
        Set<String> out = new TreeSet<>();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                out.add(name.substring(prefix.length()));
            }
        }
        return out;
    }
}
