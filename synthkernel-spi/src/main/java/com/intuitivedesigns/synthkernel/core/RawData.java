/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Opaque payload bytes. The array is shared, not copied; callers must not mutate it.
 */
public record RawData(byte[] bytes) implements Data {

    public RawData {
        Objects.requireNonNull(bytes, "bytes");
    }

    public static RawData of(String text) {
        return new RawData(text.getBytes(StandardCharsets.UTF_8));
    }

    public String asString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof RawData other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RawData[" + bytes.length + " bytes]";
    }
}
