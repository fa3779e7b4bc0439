/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shared shutdown signal for blocking pulls.
 *
 * <p>One instance is handed to every {@link RecordSource#pull(Cancellation)} call. Calling
 * {@link #cancel()} releases every thread parked in {@link #sleepNanos(long)} or
 * {@link #awaitCancelled()}. Thread interruption is treated as cancellation of the current
 * wait; the interrupt flag is restored before the exception is thrown.</p>
 */
public final class Cancellation {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() throws PullCancelledException {
        if (isCancelled()) throw new PullCancelledException("pull cancelled");
    }

    /**
     * Sleeps for {@code nanos} unless cancelled first.
     *
     * @throws PullCancelledException if cancellation is signalled before or during the sleep
     */
    public void sleepNanos(long nanos) throws PullCancelledException {
        throwIfCancelled();
        if (nanos <= 0) return;
        try {
            if (cancelled.await(nanos, TimeUnit.NANOSECONDS)) {
                throw new PullCancelledException("pull cancelled while waiting");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PullCancelledException("pull interrupted while waiting", e);
        }
    }

    /**
     * Blocks until cancelled, then throws. Never returns normally.
     */
    public void awaitCancelled() throws PullCancelledException {
        try {
            cancelled.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PullCancelledException("pull interrupted while blocked", e);
        }
        throw new PullCancelledException("pull cancelled while blocked");
    }
}
