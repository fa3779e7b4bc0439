/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

/**
 * A pull-based source of records.
 *
 * <p>Hosts call {@link #pull(Cancellation)} repeatedly from a single thread. A pull may block
 * (pacing, exhausted quota); every such wait ends when the shared {@link Cancellation} fires.</p>
 */
public interface RecordSource extends AutoCloseable {

    void connect();

    /**
     * Produces the next record.
     *
     * @throws PullCancelledException if {@code cancellation} fired before a record was returned
     */
    SourceRecord pull(Cancellation cancellation) throws PullCancelledException;

    /**
     * Acknowledges delivery of a record. Sources without delivery tracking ignore it.
     */
    default void ack(String position) {
        // no-op by default
    }

    @Override
    default void close() {
        // no-op by default
    }
}
