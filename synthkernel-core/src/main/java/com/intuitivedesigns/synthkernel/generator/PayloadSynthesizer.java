/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import com.intuitivedesigns.synthkernel.core.Data;

/**
 * Produces the payload value for one side (before or after) of a record.
 */
public interface PayloadSynthesizer {

    Data nextPayload();
}
