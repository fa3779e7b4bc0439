/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.settings;

import com.intuitivedesigns.synthkernel.core.Operation;
import com.intuitivedesigns.synthkernel.generator.FieldType;
import com.intuitivedesigns.synthkernel.generator.PayloadFormat;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of one logical collection.
 *
 * @param name collection name; empty for the default collection
 * @param operations operations to pick from, never empty
 * @param format payload strategy
 * @param fields ordered field name to type tag mapping, used by RAW and STRUCTURED
 * @param filePath payload file, used by FILE
 */
public record CollectionSettings(
        String name,
        List<Operation> operations,
        PayloadFormat format,
        Map<String, String> fields,
        Path filePath
) {

    public static final String DEFAULT_COLLECTION = "";

    public CollectionSettings {
        name = (name == null) ? DEFAULT_COLLECTION : name;
        operations = List.copyOf(Objects.requireNonNull(operations, "operations"));
        Objects.requireNonNull(format, "format");
        fields = (fields == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));

        if (operations.isEmpty()) {
            throw new IllegalArgumentException("collection '" + name + "' needs at least one operation");
        }
        if (format == PayloadFormat.FILE && filePath == null) {
            throw new IllegalArgumentException("collection '" + name + "' uses the file format without a path");
        }
        if (format.fieldDriven()) {
            for (Map.Entry<String, String> e : fields.entrySet()) {
                if (e.getKey().isBlank() || !FieldType.isKnown(e.getValue())) {
                    throw new IllegalArgumentException("collection '" + name + "' has an invalid field " + e);
                }
            }
        }
    }

    public static CollectionSettings fieldDriven(String name, List<Operation> operations, PayloadFormat format, Map<String, String> fields) {
        return new CollectionSettings(name, operations, format, fields, null);
    }

    public static CollectionSettings file(String name, List<Operation> operations, Path filePath) {
        return new CollectionSettings(name, operations, PayloadFormat.FILE, Map.of(), filePath);
    }

    public boolean isDefault() {
        return name.isEmpty();
    }

    /**
     * Name for logs and error messages.
     */
    public String displayName() {
        return isDefault() ? "default collection" : "collection \"" + name + "\"";
    }
}
