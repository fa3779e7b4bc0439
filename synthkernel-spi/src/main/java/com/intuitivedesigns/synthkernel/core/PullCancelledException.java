/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

/**
 * Signals that a pull was released by cancellation instead of producing a record.
 * This is the expected shutdown path, not a failure to retry.
 */
public class PullCancelledException extends Exception {

    public PullCancelledException(String message) {
        super(message);
    }

    public PullCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
