/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import com.intuitivedesigns.synthkernel.core.SourceRecord;

/**
 * Synthesizes records without any pacing. Single caller per instance.
 */
public interface RecordGenerator {

    SourceRecord next();
}
