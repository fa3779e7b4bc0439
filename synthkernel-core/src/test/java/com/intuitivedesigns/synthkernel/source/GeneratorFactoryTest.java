/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.source;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import com.intuitivedesigns.synthkernel.core.Cancellation;
import com.intuitivedesigns.synthkernel.core.Operation;
import com.intuitivedesigns.synthkernel.core.PullCancelledException;
import com.intuitivedesigns.synthkernel.core.RawData;
import com.intuitivedesigns.synthkernel.core.RecordMetadata;
import com.intuitivedesigns.synthkernel.core.SourceRecord;
import com.intuitivedesigns.synthkernel.core.StructuredData;
import com.intuitivedesigns.synthkernel.generator.PayloadFormat;
import com.intuitivedesigns.synthkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.synthkernel.schema.InMemorySchemaRegistry;
import com.intuitivedesigns.synthkernel.settings.CollectionSettings;
import com.intuitivedesigns.synthkernel.settings.GeneratorSettings;
import com.intuitivedesigns.synthkernel.settings.GeneratorSettingsParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorFactoryTest {

    @Test
    void singleCollectionKeepsPlainPositions() throws PullCancelledException {
        GeneratorSettings settings = GeneratorSettingsParser.parse(PipelineConfig.fromMap(Map.of(
                "source.generator.format.type", "raw",
                "source.generator.format.options.id", "int")));

        GeneratorSource source = GeneratorFactory.build(settings);
        Cancellation cancellation = new Cancellation();

        SourceRecord first = source.pull(cancellation);
        assertEquals("1", first.position());
        assertEquals(Operation.CREATE, first.operation());
        assertTrue(first.after() instanceof RawData);
        assertEquals("2", source.pull(cancellation).position());
    }

    @Test
    void multipleCollectionsFanOutWithSchema(@TempDir Path dir) throws IOException, PullCancelledException {
        Path file = dir.resolve("fixed.json");
        Files.writeString(file, "{\"fixed\":true}");

        Map<String, String> props = new HashMap<>();
        props.put("source.generator.format.type", "raw");
        props.put("source.generator.format.options.id", "int");
        props.put("source.generator.collections.users.format.type", "structured");
        props.put("source.generator.collections.users.format.options.name", "string");
        props.put("source.generator.collections.users.operations", "update");
        props.put("source.generator.collections.fixed.format.type", "file");
        props.put("source.generator.collections.fixed.format.options.path", file.toString());
        props.put("source.generator.schema.subject", "payload");
        GeneratorSettings settings = GeneratorSettingsParser.parse(PipelineConfig.fromMap(props));

        InMemorySchemaRegistry registry = new InMemorySchemaRegistry();
        GeneratorSource source = GeneratorFactory.build(settings, registry, MetricsRuntime.noop(), new Random(11));
        Cancellation cancellation = new Cancellation();

        Set<String> positions = new HashSet<>();
        Set<String> collections = new HashSet<>();
        for (int i = 0; i < 300; i++) {
            SourceRecord rec = source.pull(cancellation);
            assertTrue(positions.add(rec.position()));
            String collection = rec.collection() == null ? "" : rec.collection();
            collections.add(collection);

            // default collection is index 0, named collections follow by name
            switch (collection) {
                case "":
                    assertTrue(rec.position().startsWith("0/"));
                    assertTrue(rec.after() instanceof RawData);
                    assertNull(rec.metadata().get(RecordMetadata.PAYLOAD_SCHEMA_SUBJECT));
                    break;
                case "fixed":
                    assertTrue(rec.position().startsWith("1/"));
                    assertEquals("{\"fixed\":true}", ((RawData) rec.after()).asString());
                    assertNull(rec.metadata().get(RecordMetadata.PAYLOAD_SCHEMA_SUBJECT));
                    break;
                case "users":
                    assertTrue(rec.position().startsWith("2/"));
                    assertEquals(Operation.UPDATE, rec.operation());
                    assertTrue(rec.before() instanceof StructuredData);
                    assertEquals("users.payload", rec.metadata().get(RecordMetadata.PAYLOAD_SCHEMA_SUBJECT));
                    assertEquals("1", rec.metadata().get(RecordMetadata.PAYLOAD_SCHEMA_VERSION));
                    break;
                default:
                    fail("unexpected collection " + collection);
            }
        }
        assertEquals(Set.of("", "fixed", "users"), collections);
    }

    @Test
    void programmaticCollectionsAreOrderedDefaultFirst() throws PullCancelledException {
        GeneratorSettings settings = new GeneratorSettings(0, 0, null, null, List.of(
                CollectionSettings.fieldDriven("b", List.of(Operation.CREATE), PayloadFormat.RAW, Map.of()),
                CollectionSettings.fieldDriven("", List.of(Operation.CREATE), PayloadFormat.RAW, Map.of())),
                null);

        GeneratorSource source = GeneratorFactory.build(settings, new InMemorySchemaRegistry(), MetricsRuntime.noop(), new Random(2));
        Cancellation cancellation = new Cancellation();

        for (int i = 0; i < 50; i++) {
            SourceRecord rec = source.pull(cancellation);
            boolean isDefault = rec.collection() == null;
            assertEquals(isDefault ? "0" : "1", rec.position().substring(0, 1));
        }
    }

    @Test
    void unreadableFileFailsNamingTheCollection(@TempDir Path dir) {
        GeneratorSettings settings = new GeneratorSettings(0, 0, null, null, List.of(
                CollectionSettings.file("events", List.of(Operation.CREATE), dir.resolve("missing.json"))),
                null);

        GeneratorException e = assertThrows(GeneratorException.class, () -> GeneratorFactory.build(settings));
        assertTrue(e.getMessage().contains("\"events\""), e.getMessage());
        assertTrue(e.getCause() instanceof UncheckedIOException);
    }

    @Test
    void sameSeedSameRecords() throws PullCancelledException {
        GeneratorSettings settings = GeneratorSettingsParser.parse(PipelineConfig.fromMap(Map.of(
                "source.generator.operations", "create,update,delete",
                "source.generator.format.type", "structured",
                "source.generator.format.options.id", "int",
                "source.generator.format.options.name", "string")));

        GeneratorSource a = GeneratorFactory.build(settings, new InMemorySchemaRegistry(), MetricsRuntime.noop(), new Random(5));
        GeneratorSource b = GeneratorFactory.build(settings, new InMemorySchemaRegistry(), MetricsRuntime.noop(), new Random(5));
        Cancellation cancellation = new Cancellation();

        for (int i = 0; i < 20; i++) {
            SourceRecord ra = a.pull(cancellation);
            SourceRecord rb = b.pull(cancellation);
            assertEquals(ra.operation(), rb.operation());
            assertEquals(ra.key(), rb.key());
            assertEquals(ra.after(), rb.after());
        }
    }
}
