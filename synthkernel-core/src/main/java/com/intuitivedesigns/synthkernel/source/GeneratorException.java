/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.source;

/**
 * The generator engine could not be built from otherwise valid settings, e.g. an unreadable
 * payload file or a set of field definitions that does not map to a schema.
 */
public class GeneratorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GeneratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
