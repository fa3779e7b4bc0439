/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intuitivedesigns.synthkernel.core.RawData;

/**
 * JSON encoding of a synthesized field map. Times and durations are ISO-8601 strings.
 */
final class RawPayloadSynthesizer implements PayloadSynthesizer {

    // ObjectMapper is thread-safe once configured
    static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    private final StructuredPayloadSynthesizer fields;

    RawPayloadSynthesizer(StructuredPayloadSynthesizer fields) {
        this.fields = fields;
    }

    @Override
    public RawData nextPayload() {
        try {
            return new RawData(JSON.writeValueAsBytes(fields.nextFields()));
        } catch (JsonProcessingException e) {
            // unreachable for the built-in value kinds
            throw new IllegalStateException("couldn't serialize synthesized fields", e);
        }
    }
}
