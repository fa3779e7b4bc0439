/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.schema;

import org.apache.avro.Schema;

/**
 * Minimal subject/version schema store.
 */
public interface SchemaRegistry {

    /**
     * Registers {@code schema} under {@code subject}. Registering a schema equal to an
     * already registered one returns the existing version.
     *
     * @return the version of the schema within the subject, starting at 1
     */
    int register(String subject, Schema schema);
}
