/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The envelope produced by a source on every pull.
 *
 * <p>Payload shape follows the operation: {@code create} and {@code snapshot} carry only
 * {@code after}, {@code delete} carries only {@code before}, {@code update} carries both.</p>
 *
 * @param position unique, opaque position of the record within its source
 * @param operation change type
 * @param metadata string metadata (creation time, collection, schema subject)
 * @param key record key, not necessarily unique
 * @param before state before the change, may be null
 * @param after state after the change, may be null
 */
public record SourceRecord(
        String position,
        Operation operation,
        Map<String, String> metadata,
        Data key,
        Data before,
        Data after
) {

    public SourceRecord {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(operation, "operation");
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
    }

    public String collection() {
        return metadata.get(RecordMetadata.COLLECTION);
    }

    /**
     * Creation time from metadata, or null when absent.
     */
    public Instant createdAt() {
        String raw = metadata.get(RecordMetadata.CREATED_AT);
        if (raw == null) return null;
        long nanos = Long.parseLong(raw);
        return Instant.ofEpochSecond(0L, nanos);
    }

    public SourceRecord withPosition(String newPosition) {
        return new SourceRecord(newPosition, operation, metadata, key, before, after);
    }

    public SourceRecord withMetadata(String name, String value) {
        Map<String, String> newMeta = new HashMap<>(this.metadata);
        newMeta.put(name, value);
        return new SourceRecord(position, operation, newMeta, key, before, after);
    }
}
