/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Payload strategy of a collection. The strategy is resolved once, when the collection's
 * generator is built; per-record calls go straight to the chosen {@link PayloadSynthesizer}.
 */
public enum PayloadFormat {

    /** Field spec serialized to JSON bytes. */
    RAW("raw") {
        @Override
        public PayloadSynthesizer newSynthesizer(Map<String, String> fields, Path file, FieldValueSynthesizer values) {
            return new RawPayloadSynthesizer(new StructuredPayloadSynthesizer(fields, values));
        }
    },

    /** Field spec kept as a field map. */
    STRUCTURED("structured") {
        @Override
        public PayloadSynthesizer newSynthesizer(Map<String, String> fields, Path file, FieldValueSynthesizer values) {
            return new StructuredPayloadSynthesizer(fields, values);
        }
    },

    /** Contents of a file, read once. */
    FILE("file") {
        @Override
        public PayloadSynthesizer newSynthesizer(Map<String, String> fields, Path file, FieldValueSynthesizer values) {
            return FilePayloadSynthesizer.read(Objects.requireNonNull(file, "file"));
        }
    };

    private final String label;

    PayloadFormat(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean fieldDriven() {
        return this != FILE;
    }

    /**
     * Builds the synthesizer for this strategy. {@code fields} is used by RAW/STRUCTURED,
     * {@code file} by FILE; the unused argument may be null.
     */
    public abstract PayloadSynthesizer newSynthesizer(Map<String, String> fields, Path file, FieldValueSynthesizer values);

    public static PayloadFormat parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("format type is null");
        final String s = raw.trim().toLowerCase(Locale.ROOT);
        for (PayloadFormat f : values()) {
            if (f.label.equals(s)) return f;
        }
        throw new IllegalArgumentException("unknown format type \"" + raw.trim() + "\"");
    }
}
