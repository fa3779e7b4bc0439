/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import java.util.Locale;
import java.util.Optional;

/**
 * Known field type tags.
 */
public enum FieldType {
    INT("int"),
    STRING("string"),
    TIME("time"),
    BOOL("bool"),
    DURATION("duration");

    private final String tag;

    FieldType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<FieldType> fromTag(String raw) {
        if (raw == null) return Optional.empty();
        final String s = raw.trim().toLowerCase(Locale.ROOT);
        for (FieldType t : values()) {
            if (t.tag.equals(s)) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static boolean isKnown(String raw) {
        return fromTag(raw).isPresent();
    }
}
