/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import com.intuitivedesigns.synthkernel.core.SourceRecord;

/**
 * Last step of record generation; receives the complete record and returns the one to emit.
 */
@FunctionalInterface
public interface RecordPostProcessor {

    SourceRecord process(SourceRecord record);

    static RecordPostProcessor identity() {
        return record -> record;
    }
}
