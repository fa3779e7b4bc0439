/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * Drives a {@link RecordSource} from a single dispatcher thread and hands every record to an
 * {@link OutputSink}.
 *
 * <p>{@link #stop()} fires the shared {@link Cancellation}, which unblocks a pull parked in a
 * burst sleep, a rate-limit wait or an exhausted quota, then joins the dispatcher and closes
 * the sink and the source.</p>
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final long JOIN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(10);
    private static final long WRITE_ERROR_LOG_INTERVAL_MS = 5_000L;

    private final RecordSource source;
    private final OutputSink sink;
    private final LongAdder meter;

    private final boolean failFastOnSourceError;
    private final long sourceErrorBackoffInitialMs;
    private final long sourceErrorBackoffMaxMs;

    private final Cancellation cancellation = new Cancellation();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread dispatcherThread;

    private final LongAdder writtenCount = new LongAdder();
    private final LongAdder writeErrorCount = new LongAdder();
    private final LongAdder sourceErrorCount = new LongAdder();
    private volatile long lastWriteErrorLogAtMs = 0L;

    public PipelineOrchestrator(RecordSource source, OutputSink sink, LongAdder meter) {
        this(source, sink, meter, false, 100L, 5_000L);
    }

    public PipelineOrchestrator(RecordSource source,
                                OutputSink sink,
                                LongAdder meter,
                                boolean failFastOnSourceError,
                                long sourceErrorBackoffInitialMs,
                                long sourceErrorBackoffMaxMs) {
        this.source = Objects.requireNonNull(source, "source");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.meter = meter;

        this.failFastOnSourceError = failFastOnSourceError;
        this.sourceErrorBackoffInitialMs = Math.max(0L, sourceErrorBackoffInitialMs);
        this.sourceErrorBackoffMaxMs = Math.max(this.sourceErrorBackoffInitialMs, sourceErrorBackoffMaxMs);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;

        log.info("Starting pipeline components...");
        source.connect();

        this.dispatcherThread = new Thread(this::runDispatcherLoop, "pipeline-dispatcher");
        this.dispatcherThread.setDaemon(true);
        this.dispatcherThread.start();

        log.info("Pipeline Started: sink={}", sink.id());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) return;

        log.info("Stop requested. Cancelling pending pull...");
        cancellation.cancel();

        Thread dt = dispatcherThread;
        if (dt != null && dt != Thread.currentThread()) {
            try {
                dt.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (dt.isAlive()) {
                log.warn("Dispatcher did not stop within {}ms, interrupting", JOIN_TIMEOUT_MS);
                dt.interrupt();
            }
        }

        safeClose(sink, "sink");
        safeClose(source, "source");

        log.info("Pipeline Stopped. written={} writeErrors={} sourceErrors={}",
                writtenCount.sum(), writeErrorCount.sum(), sourceErrorCount.sum());
    }

    public boolean isRunning() {
        return running.get();
    }

    public long written() {
        return writtenCount.sum();
    }

    private void runDispatcherLoop() {
        long backoffMs = sourceErrorBackoffInitialMs;

        try {
            while (running.get()) {
                final SourceRecord record;
                try {
                    record = source.pull(cancellation);
                    backoffMs = sourceErrorBackoffInitialMs;
                } catch (PullCancelledException e) {
                    break;
                } catch (IllegalStateException e) {
                    // broken source contract: retrying cannot help
                    sourceErrorCount.increment();
                    log.error("Source contract violated, dispatcher stopping", e);
                    break;
                } catch (RuntimeException e) {
                    handleSourceError(e, backoffMs);
                    if (failFastOnSourceError) break;
                    backoffMs = Math.min(Math.max(1L, backoffMs * 2), sourceErrorBackoffMaxMs);
                    continue;
                }

                write(record);
            }
        } catch (PullCancelledException e) {
            log.debug("Dispatcher cancelled during backoff");
        } catch (Throwable t) {
            log.error("Dispatcher crashed", t);
            running.set(false);
        }
        log.debug("Dispatcher exited");
    }

    private void write(SourceRecord record) {
        try {
            sink.write(record);
            source.ack(record.position());
            writtenCount.increment();
            if (meter != null) meter.increment();
        } catch (Exception e) {
            writeErrorCount.increment();
            final long nowMs = System.currentTimeMillis();
            if (nowMs - lastWriteErrorLogAtMs > WRITE_ERROR_LOG_INTERVAL_MS) {
                lastWriteErrorLogAtMs = nowMs;
                log.warn("Record failed position={}: {}", record.position(), e.getMessage());
            }
        }
    }

    private void handleSourceError(Exception e, long backoffMs) throws PullCancelledException {
        sourceErrorCount.increment();
        if (!failFastOnSourceError) {
            log.error("Source pull failed (retrying in {}ms)", backoffMs, e);
            cancellation.sleepNanos(TimeUnit.MILLISECONDS.toNanos(backoffMs));
        } else {
            log.error("Source pull failed (Fail-Fast)", e);
        }
    }

    private void safeClose(AutoCloseable c, String name) {
        try {
            c.close();
        } catch (Exception e) {
            log.warn("Error closing {}", name, e);
        }
    }
}
