/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import com.intuitivedesigns.synthkernel.core.StructuredData;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

final class StructuredPayloadSynthesizer implements PayloadSynthesizer {

    private final Map<String, String> fields;
    private final FieldValueSynthesizer values;

    StructuredPayloadSynthesizer(Map<String, String> fields, FieldValueSynthesizer values) {
        this.fields = (fields == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.values = Objects.requireNonNull(values, "values");
    }

    @Override
    public StructuredData nextPayload() {
        return new StructuredData(nextFields());
    }

    Map<String, Object> nextFields() {
        Map<String, Object> out = new LinkedHashMap<>(Math.max(4, fields.size() * 2));
        for (Map.Entry<String, String> e : fields.entrySet()) {
            out.put(e.getKey(), values.synthesize(e.getValue()));
        }
        return out;
    }
}
