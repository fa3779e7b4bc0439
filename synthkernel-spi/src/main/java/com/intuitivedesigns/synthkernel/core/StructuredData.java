/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field name to value mapping. Field order is preserved and the map is read-only.
 */
public record StructuredData(Map<String, Object> fields) implements Data {

    public StructuredData {
        fields = (fields == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    @Override
    public byte[] bytes() {
        return null;
    }
}
