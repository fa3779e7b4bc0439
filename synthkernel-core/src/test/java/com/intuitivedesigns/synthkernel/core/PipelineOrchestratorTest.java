/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.core;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import com.intuitivedesigns.synthkernel.settings.GeneratorSettingsParser;
import com.intuitivedesigns.synthkernel.source.GeneratorFactory;
import com.intuitivedesigns.synthkernel.source.GeneratorSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import static org.junit.jupiter.api.Assertions.*;

class PipelineOrchestratorTest {

    private static final class CollectingSink implements OutputSink {
        final List<SourceRecord> records = Collections.synchronizedList(new ArrayList<>());
        final AtomicBoolean closed = new AtomicBoolean();

        @Override
        public void write(SourceRecord record) {
            records.add(record);
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }

    private static GeneratorSource generator(Map<String, String> extra) {
        Map<String, String> props = new HashMap<>(extra);
        props.put("source.generator.format.type", "raw");
        props.put("source.generator.format.options.id", "int");
        return GeneratorFactory.build(GeneratorSettingsParser.parse(PipelineConfig.fromMap(props)));
    }

    private static void awaitCount(LongAdder meter, long expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (meter.sum() < expected && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
    }

    @Test
    void deliversExactlyTheRecordCeiling() throws InterruptedException {
        CollectingSink sink = new CollectingSink();
        LongAdder meter = new LongAdder();
        PipelineOrchestrator pipeline = new PipelineOrchestrator(
                generator(Map.of("source.generator.record.count", "25")), sink, meter);

        pipeline.start();
        awaitCount(meter, 25);
        // quota exhausted: the dispatcher is parked, nothing more arrives
        Thread.sleep(100);
        assertEquals(25, sink.records.size());
        assertTrue(pipeline.isRunning());

        long t0 = System.nanoTime();
        pipeline.stop();
        assertTrue(System.nanoTime() - t0 < TimeUnit.SECONDS.toNanos(2), "stop took too long");

        assertFalse(pipeline.isRunning());
        assertTrue(sink.closed.get());
        assertEquals(25, pipeline.written());
        assertEquals("1", sink.records.get(0).position());
        assertEquals("25", sink.records.get(24).position());
    }

    @Test
    void stopWakesABurstSleep() throws InterruptedException {
        CollectingSink sink = new CollectingSink();
        LongAdder meter = new LongAdder();
        PipelineOrchestrator pipeline = new PipelineOrchestrator(
                generator(Map.of(
                        "source.generator.burst.sleep.time", "10m",
                        "source.generator.burst.generate.time", "50ms")),
                sink, meter);

        pipeline.start();
        Thread.sleep(200);

        long t0 = System.nanoTime();
        pipeline.stop();
        assertTrue(System.nanoTime() - t0 < TimeUnit.SECONDS.toNanos(2), "stop took too long");
        assertTrue(meter.sum() > 0);
    }

    @Test
    void sinkFailuresAreCountedNotFatal() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        OutputSink flaky = record -> {
            if (calls.incrementAndGet() % 2 == 0) throw new IllegalStateException("boom");
        };
        LongAdder meter = new LongAdder();
        PipelineOrchestrator pipeline = new PipelineOrchestrator(
                generator(Map.of("source.generator.record.count", "10")), flaky, meter);

        pipeline.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (calls.get() < 10 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        pipeline.stop();

        assertEquals(10, calls.get());
        assertEquals(5, meter.sum());
    }

    @Test
    void sourceErrorsBackOffAndRetry() throws InterruptedException {
        AtomicInteger pulls = new AtomicInteger();
        RecordSource failingTwice = new RecordSource() {
            @Override
            public void connect() {
            }

            @Override
            public SourceRecord pull(Cancellation cancellation) throws PullCancelledException {
                int n = pulls.incrementAndGet();
                if (n <= 2) throw new UncheckedIOException(new IOException("transient " + n));
                if (n > 3) cancellation.awaitCancelled();
                return new SourceRecord(Integer.toString(n), Operation.CREATE, null, null, null, null);
            }
        };
        CollectingSink sink = new CollectingSink();
        LongAdder meter = new LongAdder();
        PipelineOrchestrator pipeline = new PipelineOrchestrator(failingTwice, sink, meter, false, 10L, 20L);

        pipeline.start();
        awaitCount(meter, 1);
        pipeline.stop();

        assertEquals(1, sink.records.size());
        assertEquals("3", sink.records.get(0).position());
    }

    @Test
    void failFastStopsDispatcherOnSourceError() throws InterruptedException {
        AtomicInteger pulls = new AtomicInteger();
        RecordSource broken = new RecordSource() {
            @Override
            public void connect() {
            }

            @Override
            public SourceRecord pull(Cancellation cancellation) {
                pulls.incrementAndGet();
                throw new UncheckedIOException(new IOException("broken"));
            }
        };
        PipelineOrchestrator pipeline = new PipelineOrchestrator(broken, new CollectingSink(), new LongAdder(), true, 10L, 20L);

        pipeline.start();
        Thread.sleep(100);
        pipeline.stop();

        assertEquals(1, pulls.get());
    }

    @Test
    void contractViolationStopsDispatcherEvenWithoutFailFast() throws InterruptedException {
        AtomicInteger pulls = new AtomicInteger();
        RecordSource violating = new RecordSource() {
            @Override
            public void connect() {
            }

            @Override
            public SourceRecord pull(Cancellation cancellation) {
                pulls.incrementAndGet();
                throw new IllegalStateException("unknown field type");
            }
        };
        CollectingSink sink = new CollectingSink();
        PipelineOrchestrator pipeline = new PipelineOrchestrator(violating, sink, new LongAdder(), false, 1L, 2L);

        pipeline.start();
        Thread.sleep(100);
        pipeline.stop();

        assertEquals(1, pulls.get());
        assertTrue(sink.closed.get());
    }
}
