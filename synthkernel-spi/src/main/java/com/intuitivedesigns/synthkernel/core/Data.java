/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

/**
 * A record payload value: either opaque bytes or a field map.
 */
public sealed interface Data permits RawData, StructuredData {

    /**
     * Byte view of the value. Structured values have no canonical byte form here and return null.
     */
    byte[] bytes();
}
