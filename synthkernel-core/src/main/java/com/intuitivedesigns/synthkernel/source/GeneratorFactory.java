/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.source;

import com.intuitivedesigns.synthkernel.generator.CollectionCombinator;
import com.intuitivedesigns.synthkernel.generator.CollectionRecordGenerator;
import com.intuitivedesigns.synthkernel.generator.FieldValueSynthesizer;
import com.intuitivedesigns.synthkernel.generator.PayloadFormat;
import com.intuitivedesigns.synthkernel.generator.PayloadSynthesizer;
import com.intuitivedesigns.synthkernel.generator.RecordGenerator;
import com.intuitivedesigns.synthkernel.generator.RecordPostProcessor;
import com.intuitivedesigns.synthkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.synthkernel.pacing.BurstScheduler;
import com.intuitivedesigns.synthkernel.pacing.RecordRateLimiter;
import com.intuitivedesigns.synthkernel.schema.AvroSchemaAttacher;
import com.intuitivedesigns.synthkernel.schema.InMemorySchemaRegistry;
import com.intuitivedesigns.synthkernel.schema.SchemaRegistry;
import com.intuitivedesigns.synthkernel.settings.CollectionSettings;
import com.intuitivedesigns.synthkernel.settings.GeneratorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Wires a {@link GeneratorSource} from validated settings.
 */
public final class GeneratorFactory {

    private static final Logger log = LoggerFactory.getLogger(GeneratorFactory.class);

    // Default collection first, then named collections by name.
    private static final Comparator<CollectionSettings> ORDER =
            Comparator.comparing((CollectionSettings c) -> !c.isDefault()).thenComparing(CollectionSettings::name);

    private GeneratorFactory() {}

    public static GeneratorSource build(GeneratorSettings settings) {
        return build(settings, new InMemorySchemaRegistry(), MetricsRuntime.noop());
    }

    public static GeneratorSource build(GeneratorSettings settings, SchemaRegistry registry, MetricsRuntime metrics) {
        return build(settings, registry, metrics, new Random());
    }

    /**
     * @param seeds seeds the per-collection random sources; pass a seeded instance for
     *              reproducible output
     * @throws GeneratorException if a collection cannot be built
     */
    public static GeneratorSource build(GeneratorSettings settings,
                                        SchemaRegistry registry,
                                        MetricsRuntime metrics,
                                        Random seeds) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(seeds, "seeds");

        final List<CollectionSettings> ordered = new ArrayList<>(settings.collections());
        ordered.sort(ORDER);

        final List<RecordGenerator> generators = new ArrayList<>(ordered.size());
        for (CollectionSettings collection : ordered) {
            generators.add(buildCollection(collection, settings, registry, new Random(seeds.nextLong())));
        }

        final RecordGenerator generator = CollectionCombinator.combine(generators, new Random(seeds.nextLong()));
        final BurstScheduler burst = new BurstScheduler(settings.burst().sleepTime(), settings.burst().generateTime());
        final RecordRateLimiter limiter = new RecordRateLimiter(settings.effectiveRate());

        log.info("Generator built. collections={} recordCount={} rate={}/s burst={}",
                ordered.size(), settings.recordCount(), settings.effectiveRate(), burst);

        return new GeneratorSource(generator, burst, limiter, settings.recordCount(), metrics);
    }

    private static CollectionRecordGenerator buildCollection(CollectionSettings collection,
                                                             GeneratorSettings settings,
                                                             SchemaRegistry registry,
                                                             Random random) {
        try {
            final FieldValueSynthesizer values = new FieldValueSynthesizer(random);
            final PayloadSynthesizer payloads = collection.format()
                    .newSynthesizer(collection.fields(), collection.filePath(), values);

            RecordPostProcessor postProcessor = RecordPostProcessor.identity();
            if (settings.schemaEnabled() && collection.format() == PayloadFormat.STRUCTURED) {
                postProcessor = AvroSchemaAttacher.register(registry, collection.name(), settings.schemaSubject(), collection.fields());
            }

            log.debug("Built {} format={} operations={}", collection.displayName(), collection.format().label(), collection.operations());
            return new CollectionRecordGenerator(collection.name(), collection.operations(), payloads, postProcessor, random);
        } catch (RuntimeException e) {
            throw new GeneratorException("failed to create record generator for " + collection.displayName(), e);
        }
    }
}
