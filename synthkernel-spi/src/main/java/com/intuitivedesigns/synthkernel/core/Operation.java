/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

import java.util.Locale;

/**
 * The kind of change a record represents.
 */
public enum Operation {
    CREATE,
    UPDATE,
    DELETE,
    SNAPSHOT;

    /**
     * Lower-case wire name ("create", "update", ...).
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Operation parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("operation is null");
        final String s = raw.trim().toUpperCase(Locale.ROOT);
        for (Operation op : values()) {
            if (op.name().equals(s)) return op;
        }
        throw new IllegalArgumentException("unknown operation \"" + raw.trim() + "\"");
    }
}
