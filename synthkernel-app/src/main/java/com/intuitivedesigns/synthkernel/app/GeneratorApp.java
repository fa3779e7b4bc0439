/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.app;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import com.intuitivedesigns.synthkernel.config.PipelineFactory;
import com.intuitivedesigns.synthkernel.core.OutputSink;
import com.intuitivedesigns.synthkernel.core.PipelineOrchestrator;
import com.intuitivedesigns.synthkernel.core.RecordSource;
import com.intuitivedesigns.synthkernel.metrics.MetricsFactory;
import com.intuitivedesigns.synthkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.synthkernel.metrics.MetricsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * Command line host: pulls from the configured source and writes to the configured sink
 * until the JVM is asked to shut down.
 *
 * <pre>
 * java -Dsk.config.path=generator.properties -jar synthkernel-app.jar
 * </pre>
 */
public final class GeneratorApp {

    private static final Logger log = LoggerFactory.getLogger(GeneratorApp.class);

    // --- Config Keys ---
    private static final String CFG_SPEEDOMETER_WINDOW_SECONDS = "synthkernel.speedometer.window.seconds";
    private static final String CFG_SPEEDOMETER_ENABLED = "synthkernel.speedometer.enabled";
    private static final String CFG_SOURCE_FAIL_FAST = "pipeline.source.fail.fast";
    private static final String CFG_BACKOFF_INITIAL_MS = "pipeline.source.backoff.initial.ms";
    private static final String CFG_BACKOFF_MAX_MS = "pipeline.source.backoff.max.ms";

    // --- Defaults ---
    private static final int DEFAULT_WINDOW_SECONDS = 10;
    private static final int MIN_WINDOW_SECONDS = 1;
    private static final int MAX_WINDOW_SECONDS = 60;
    private static final long DEFAULT_BACKOFF_INITIAL_MS = 250L;
    private static final long DEFAULT_BACKOFF_MAX_MS = 5_000L;

    private GeneratorApp() {}

    public static void main(String[] args) {
        log.info("=== Booting SynthKernel generator ===");

        final PipelineConfig config = PipelineConfig.get();
        PipelineFactory.logAvailablePlugins();

        MetricsRuntime metrics = null;
        ScheduledExecutorService speedometerScheduler = null;
        RecordSource source = null;
        OutputSink sink = null;
        PipelineOrchestrator pipeline = null;

        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            // 1. Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config));

            // 2. Tuning
            final boolean speedometerEnabled = config.getBoolean(CFG_SPEEDOMETER_ENABLED, true);
            final int windowSeconds = clampInt(
                    config.getInt(CFG_SPEEDOMETER_WINDOW_SECONDS, DEFAULT_WINDOW_SECONDS),
                    MIN_WINDOW_SECONDS,
                    MAX_WINDOW_SECONDS
            );
            final boolean failFastSource = config.getBoolean(CFG_SOURCE_FAIL_FAST, false);
            final long backoffInitialMs = config.getLong(CFG_BACKOFF_INITIAL_MS, DEFAULT_BACKOFF_INITIAL_MS);
            final long backoffMaxMs = config.getLong(CFG_BACKOFF_MAX_MS, DEFAULT_BACKOFF_MAX_MS);

            log.info("CONFIG: Speedometer={} ({}s) | FailFast={} | Metrics={}",
                    speedometerEnabled ? "ON" : "OFF", windowSeconds, failFastSource, metrics.type());

            // 3. Components (SPI)
            source = PipelineFactory.createSource(config, metrics);
            sink = PipelineFactory.createSink(config, metrics);

            final LongAdder processedCounter = new LongAdder();

            // 4. Orchestrator
            pipeline = new PipelineOrchestrator(
                    source,
                    sink,
                    processedCounter,
                    failFastSource,
                    backoffInitialMs,
                    backoffMaxMs
            );

            // 5. Speedometer
            if (speedometerEnabled) {
                speedometerScheduler = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("sk-speedometer"));
                startSpeedometer(speedometerScheduler, processedCounter, windowSeconds);
            }

            // 6. Shutdown hook
            final MetricsRuntime finalMetrics = metrics;
            final ScheduledExecutorService finalSpeedometerScheduler = speedometerScheduler;
            final PipelineOrchestrator finalPipeline = pipeline;

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (!shutdownStarted.compareAndSet(false, true)) {
                    return;
                }

                log.info("Shutdown signal received.");
                try {
                    if (finalSpeedometerScheduler != null) {
                        finalSpeedometerScheduler.shutdownNow();
                    }
                    finalPipeline.stop();
                } finally {
                    closeQuietly(finalMetrics);
                    shutdownLatch.countDown();
                }
            }, "sk-shutdown"));

            // 7. Launch
            log.info("Starting Pipeline Orchestrator...");
            pipeline.start();

            shutdownLatch.await();
        } catch (Throwable t) {
            log.error("Fatal application error", t);

            if (shutdownStarted.compareAndSet(false, true)) {
                if (speedometerScheduler != null) {
                    speedometerScheduler.shutdownNow();
                }
                if (pipeline != null) {
                    pipeline.stop();
                } else {
                    closeQuietly(source);
                    closeQuietly(sink);
                }
                closeQuietly(metrics);
                shutdownLatch.countDown();
            }

            System.exit(1);
        }
    }

    private static void startSpeedometer(ScheduledExecutorService scheduler,
                                         LongAdder processedCounter,
                                         int windowSeconds) {
        log.info("Speedometer active ({}s window)", windowSeconds);

        final long periodNs = TimeUnit.SECONDS.toNanos(windowSeconds);

        scheduler.scheduleAtFixedRate(new Runnable() {
            private long lastTimeNs = System.nanoTime();
            private long lastProcessed = 0;

            @Override
            public void run() {
                try {
                    final long nowNs = System.nanoTime();
                    final long elapsedNs = nowNs - lastTimeNs;
                    if (elapsedNs <= 0) {
                        return;
                    }

                    final double seconds = elapsedNs / 1_000_000_000.0;
                    final long processedNow = processedCounter.sum();
                    final double processedEps = (processedNow - lastProcessed) / seconds;

                    log.info(String.format(
                            Locale.US,
                            "AVG %ds | SPEED: %,.0f rps | TOTAL: %,d",
                            windowSeconds,
                            processedEps,
                            processedNow
                    ));

                    lastProcessed = processedNow;
                    lastTimeNs = nowNs;
                } catch (RuntimeException e) {
                    log.warn("Speedometer error", e);
                }
            }
        }, periodNs, periodNs, TimeUnit.NANOSECONDS);
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}", resource.getClass().getSimpleName(), e);
        }
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String name;

        private NamedDaemonThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }
}
