/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

import java.time.Instant;

/**
 * Well-known metadata keys stamped on generated records.
 */
public final class RecordMetadata {

    public static final String CREATED_AT = "opencdc.createdAt";
    public static final String COLLECTION = "opencdc.collection";
    public static final String PAYLOAD_SCHEMA_SUBJECT = "opencdc.payload.schema.subject";
    public static final String PAYLOAD_SCHEMA_VERSION = "opencdc.payload.schema.version";

    private RecordMetadata() {}

    /**
     * Unix epoch nanoseconds as a decimal string.
     */
    public static String formatCreatedAt(Instant instant) {
        long nanos = Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
        return Long.toString(nanos);
    }
}
