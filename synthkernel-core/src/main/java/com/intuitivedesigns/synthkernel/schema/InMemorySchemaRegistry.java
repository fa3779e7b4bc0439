/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.schema;

import org.apache.avro.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local registry. Versions are 1-based and never reused.
 */
public final class InMemorySchemaRegistry implements SchemaRegistry {

    private final Map<String, List<Schema>> subjects = new ConcurrentHashMap<>();

    @Override
    public int register(String subject, Schema schema) {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(schema, "schema");

        List<Schema> versions = subjects.computeIfAbsent(subject, s -> new ArrayList<>());
        synchronized (versions) {
            int existing = versions.indexOf(schema);
            if (existing >= 0) {
                return existing + 1;
            }
            versions.add(schema);
            return versions.size();
        }
    }

    Optional<Schema> find(String subject, int version) {
        List<Schema> versions = subjects.get(subject);
        if (versions == null) return Optional.empty();
        synchronized (versions) {
            if (version < 1 || version > versions.size()) return Optional.empty();
            return Optional.of(versions.get(version - 1));
        }
    }
}
