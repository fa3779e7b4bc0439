/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

/**
 * A pluggable destination for generated records.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #write(SourceRecord)} should persist or transmit the record.</li>
 * <li>Implementations may throw exceptions to indicate failures; the orchestrator logs and counts them.</li>
 * </ul>
 */
public interface OutputSink extends AutoCloseable {

    /**
     * @param record the record pulled from the source
     * @throws Exception if the target rejects the record
     */
    void write(SourceRecord record) throws Exception;

    default void flush() throws Exception {
        // no-op by default for non-batching sinks
    }

    /**
     * Identifier used in logs, e.g. "DevNullSink".
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {
        flush();
    }
}
