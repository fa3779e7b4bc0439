/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.pacing;

import com.intuitivedesigns.synthkernel.core.Cancellation;
import com.intuitivedesigns.synthkernel.core.PullCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class BurstSchedulerTest {

    private static final long MS = TimeUnit.MILLISECONDS.toNanos(1);

    private final AtomicLong clock = new AtomicLong(0);

    private BurstScheduler scheduler(long sleepMs, long generateMs) {
        return new BurstScheduler(Duration.ofMillis(sleepMs), Duration.ofMillis(generateMs), clock::get);
    }

    @Test
    void pullsInsideFirstWindowDoNotWait() {
        BurstScheduler burst = scheduler(100, 150);

        assertEquals(0, burst.delayNanos(0));
        assertEquals(0, burst.delayNanos(50 * MS));
        assertEquals(0, burst.delayNanos(100 * MS));
        assertEquals(0, burst.delayNanos(125 * MS));
    }

    @Test
    void pullAtWindowEndWaitsForSleepPhase() {
        BurstScheduler burst = scheduler(100, 150);

        assertEquals(100 * MS, burst.delayNanos(150 * MS));
        // next generating window is [250ms, 400ms)
        assertEquals(0, burst.delayNanos(250 * MS));
        assertEquals(0, burst.delayNanos(399 * MS));
        assertEquals(100 * MS, burst.delayNanos(400 * MS));
    }

    @Test
    void delayNeverExceedsSleepTime() {
        BurstScheduler burst = scheduler(100, 150);

        for (long t = 0; t < 5_000 * MS; t += 7 * MS) {
            long delay = burst.delayNanos(t);
            assertTrue(delay >= 0 && delay <= 100 * MS, "t=" + t + " delay=" + delay);
        }
    }

    @Test
    void idleCallerCatchesUpToTheCurrentPhase() {
        // generating windows: [0,150) [250,400) [500,650) [750,900) ...
        BurstScheduler lateInWindow = scheduler(100, 150);
        assertEquals(0, lateInWindow.delayNanos(800 * MS));
        assertEquals(900 * MS, lateInWindow.windowEnd());

        BurstScheduler lateInSleep = scheduler(100, 150);
        assertEquals(50 * MS, lateInSleep.delayNanos(700 * MS));
        assertEquals(900 * MS, lateInSleep.windowEnd());
    }

    @Test
    void disabledWhenSleepIsZero() throws PullCancelledException {
        BurstScheduler burst = scheduler(0, 150);

        assertFalse(burst.enabled());
        assertEquals(0, burst.delayNanos(10_000 * MS));
        burst.await(new Cancellation());
    }

    @Test
    void rejectsInvalidDurations() {
        assertThrows(IllegalArgumentException.class, () -> scheduler(-1, 150));
        assertThrows(IllegalArgumentException.class, () -> scheduler(100, 0));
    }

    @Test
    void awaitSleepsUntilWindowOpens() throws PullCancelledException {
        BurstScheduler burst = scheduler(100, 150);
        clock.set(200 * MS);

        long t0 = System.nanoTime();
        burst.await(new Cancellation());
        long waited = System.nanoTime() - t0;

        assertTrue(waited >= 40 * MS, "waited " + waited);
        assertTrue(waited < 1_000 * MS, "waited " + waited);
    }

    @Test
    void cancellationInterruptsSleep() throws Exception {
        BurstScheduler burst = scheduler(60_000, 150);
        clock.set(150 * MS);
        Cancellation cancellation = new Cancellation();

        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            cancellation.cancel();
        });
        canceller.start();

        long t0 = System.nanoTime();
        assertThrows(PullCancelledException.class, () -> burst.await(cancellation));
        assertTrue(System.nanoTime() - t0 < 5_000 * MS);
        canceller.join();
    }

    @Test
    void alreadyCancelledFailsFast() {
        Cancellation cancellation = new Cancellation();
        cancellation.cancel();

        assertThrows(PullCancelledException.class, () -> scheduler(100, 150).await(cancellation));
    }

    @Test
    void realClockScenario() throws PullCancelledException {
        BurstScheduler burst = new BurstScheduler(Duration.ofMillis(100), Duration.ofMillis(150));
        Cancellation cancellation = new Cancellation();
        long start = System.nanoTime();

        // first pull is inside the generating window
        long t0 = System.nanoTime();
        burst.await(cancellation);
        assertTrue(System.nanoTime() - t0 < 20 * MS);

        // the pull after the window closes waits out the sleep phase
        sleepUntil(start + 160 * MS);
        t0 = System.nanoTime();
        burst.await(cancellation);
        long waited = System.nanoTime() - t0;
        assertTrue(waited >= 40 * MS && waited <= 120 * MS, "waited " + waited / MS + "ms");
    }

    private static void sleepUntil(long deadline) {
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
