/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.source;

import com.intuitivedesigns.synthkernel.core.Cancellation;
import com.intuitivedesigns.synthkernel.core.PullCancelledException;
import com.intuitivedesigns.synthkernel.core.RecordSource;
import com.intuitivedesigns.synthkernel.core.SourceRecord;
import com.intuitivedesigns.synthkernel.generator.RecordGenerator;
import com.intuitivedesigns.synthkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.synthkernel.pacing.BurstScheduler;
import com.intuitivedesigns.synthkernel.pacing.RecordRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Pull-driven synthetic record source.
 *
 * <p>Each pull checks the record ceiling, synthesizes a record, then waits for the burst
 * window and for a rate-limit token, in that order. Once the ceiling is reached every further
 * pull blocks until cancellation; it never returns a record and never signals end-of-stream.</p>
 *
 * <p>Not safe for overlapping pulls. The host pulls from a single thread.</p>
 */
public final class GeneratorSource implements RecordSource {

    private static final Logger log = LoggerFactory.getLogger(GeneratorSource.class);

    static final String METRIC_GENERATED = "generator.records.generated";
    static final String METRIC_BURST_WAIT = "generator.burst.wait.ms";
    static final String METRIC_RATE_WAIT = "generator.rate.wait.ms";

    private final RecordGenerator generator;
    private final BurstScheduler burst;
    private final RecordRateLimiter limiter;
    private final long recordCount;
    private final MetricsRuntime metrics;

    private long produced;

    public GeneratorSource(RecordGenerator generator,
                           BurstScheduler burst,
                           RecordRateLimiter limiter,
                           long recordCount,
                           MetricsRuntime metrics) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.burst = Objects.requireNonNull(burst, "burst");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        if (recordCount < 0) throw new IllegalArgumentException("recordCount must be >= 0: " + recordCount);
        this.recordCount = recordCount;
        this.metrics = (metrics == null) ? MetricsRuntime.noop() : metrics;
    }

    @Override
    public void connect() {
        log.info("GeneratorSource ready. ceiling={} burst={} limiter={}",
                recordCount == 0 ? "unlimited" : recordCount, burst, limiter);
    }

    @Override
    public SourceRecord pull(Cancellation cancellation) throws PullCancelledException {
        cancellation.throwIfCancelled();

        if (recordCount > 0 && produced >= recordCount) {
            // Quota exhausted: park the caller until shutdown.
            cancellation.awaitCancelled();
        }

        final SourceRecord record = generator.next();

        long t0 = System.nanoTime();
        burst.await(cancellation);
        long t1 = System.nanoTime();
        limiter.acquire(cancellation);
        long t2 = System.nanoTime();

        produced++;

        if (metrics.enabled()) {
            metrics.counter(METRIC_GENERATED);
            if (burst.enabled()) metrics.timer(METRIC_BURST_WAIT, Duration.ofNanos(t1 - t0));
            if (limiter.enabled()) metrics.timer(METRIC_RATE_WAIT, Duration.ofNanos(t2 - t1));
        }
        return record;
    }

    public long produced() {
        return produced;
    }

    @Override
    public void close() {
        log.info("GeneratorSource closed. produced={}", produced);
    }
}
