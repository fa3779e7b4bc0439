/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.settings;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import com.intuitivedesigns.synthkernel.core.Operation;
import com.intuitivedesigns.synthkernel.generator.PayloadFormat;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorSettingsParserTest {

    private static GeneratorSettings parse(Map<String, String> props) {
        return GeneratorSettingsParser.parse(PipelineConfig.fromMap(props));
    }

    private static Map<String, String> base() {
        Map<String, String> m = new HashMap<>();
        m.put("source.generator.format.type", "raw");
        m.put("source.generator.format.options.id", "int");
        return m;
    }

    @Test
    void defaults() {
        GeneratorSettings s = parse(base());

        assertEquals(0, s.recordCount());
        assertEquals(0.0, s.effectiveRate());
        assertFalse(s.burst().enabled());
        assertEquals(Duration.ofSeconds(1), s.burst().generateTime());
        assertFalse(s.schemaEnabled());

        CollectionSettings c = s.collections().get(0);
        assertTrue(c.isDefault());
        assertEquals(List.of(Operation.CREATE), c.operations());
        assertEquals(PayloadFormat.RAW, c.format());
        assertEquals(Map.of("id", "int"), c.fields());
    }

    @Test
    void fullConfiguration() {
        Map<String, String> m = base();
        m.put("source.generator.record.count", "100");
        m.put("source.generator.rate", "12.5");
        m.put("source.generator.burst.sleep.time", "5s");
        m.put("source.generator.burst.generate.time", "250ms");
        m.put("source.generator.operations", "create, update,DELETE");
        m.put("source.generator.schema.subject", "payload");
        m.put("source.generator.collections.users.operations", "snapshot");
        m.put("source.generator.collections.users.format.type", "structured");
        m.put("source.generator.collections.users.format.options.active", "bool");
        m.put("source.generator.collections.files.format.type", "file");
        m.put("source.generator.collections.files.format.options.path", "/tmp/payload.json");

        GeneratorSettings s = parse(m);

        assertEquals(100, s.recordCount());
        assertEquals(12.5, s.effectiveRate());
        assertEquals(new BurstSettings(Duration.ofSeconds(5), Duration.ofMillis(250)), s.burst());
        assertEquals("payload", s.schemaSubject());

        // default first, named collections sorted by name
        assertEquals(List.of("", "files", "users"), s.collections().stream().map(CollectionSettings::name).toList());
        assertEquals(List.of(Operation.CREATE, Operation.UPDATE, Operation.DELETE), s.collections().get(0).operations());
        assertEquals(Path.of("/tmp/payload.json"), s.collections().get(1).filePath());
        assertEquals(PayloadFormat.STRUCTURED, s.collections().get(2).format());
        assertEquals(List.of(Operation.SNAPSHOT), s.collections().get(2).operations());
    }

    @Test
    void namedCollectionsAloneAreEnough() {
        GeneratorSettings s = parse(Map.of(
                "source.generator.collections.a.format.type", "structured",
                "source.generator.collections.a.format.options.n", "int"));

        assertEquals(1, s.collections().size());
        assertEquals("a", s.collections().get(0).name());
    }

    @Test
    void readTimeConvertsToRate() {
        Map<String, String> m = base();
        m.put("source.generator.read.time", "50ms");

        assertEquals(20.0, parse(m).effectiveRate(), 1e-9);
    }

    @Test
    void rateAndReadTimeAreExclusive() {
        Map<String, String> m = base();
        m.put("source.generator.rate", "10");
        m.put("source.generator.read.time", "100ms");

        GeneratorConfigException e = assertThrows(GeneratorConfigException.class, () -> parse(m));
        assertEquals(1, e.problems().size());
        assertTrue(e.problems().get(0).contains("cannot specify both"));
    }

    @Test
    void everyProblemIsReported() {
        Map<String, String> m = new HashMap<>();
        m.put("source.generator.rate", "-1");
        m.put("source.generator.record.count", "-5");
        m.put("source.generator.burst.sleep.time", "1s");
        m.put("source.generator.burst.generate.time", "0");
        m.put("source.generator.format.type", "xml");
        m.put("source.generator.collections.bad.operations", "create,upsert");
        m.put("source.generator.collections.bad.format.type", "structured");
        m.put("source.generator.collections.bad.format.options.x", "float");
        m.put("source.generator.collections.nofile.format.type", "file");

        GeneratorConfigException e = assertThrows(GeneratorConfigException.class, () -> parse(m));
        List<String> problems = e.problems();

        assertTrue(has(problems, "\"rate\" should be greater or equal to 0"), problems.toString());
        assertTrue(has(problems, "\"record.count\""), problems.toString());
        assertTrue(has(problems, "\"burst.generate.time\" should be greater than 0"), problems.toString());
        assertTrue(has(problems, "default collection: failed validating format: unknown format type \"xml\""), problems.toString());
        assertTrue(has(problems, "collection \"bad\": failed parsing operation"), problems.toString());
        assertTrue(has(problems, "collection \"bad\": failed parsing fields: unknown data type in \"x\""), problems.toString());
        assertTrue(has(problems, "collection \"nofile\": failed validating format: file path not specified"), problems.toString());
        assertEquals(7, problems.size(), problems.toString());
        assertTrue(e.getMessage().contains("invalid generator configuration"));
    }

    @Test
    void noCollectionIsAnError() {
        GeneratorConfigException e = assertThrows(GeneratorConfigException.class, () -> parse(Map.of()));
        assertTrue(has(e.problems(), "at least one collection"));
    }

    @Test
    void malformedNumbersAndDurationsAreCollected() {
        Map<String, String> m = base();
        m.put("source.generator.rate", "fast");
        m.put("source.generator.burst.sleep.time", "soon");

        GeneratorConfigException e = assertThrows(GeneratorConfigException.class, () -> parse(m));
        assertEquals(2, e.problems().size(), e.problems().toString());
    }

    @Test
    void emptyOperationListIsRejected() {
        Map<String, String> m = base();
        m.put("source.generator.operations", " , ");

        GeneratorConfigException e = assertThrows(GeneratorConfigException.class, () -> parse(m));
        assertTrue(has(e.problems(), "at least one operation"));
    }

    @Test
    void fieldNamesMustFitTheSchemaWhenSubjectIsSet() {
        Map<String, String> m = new HashMap<>();
        m.put("source.generator.collections.users.format.type", "structured");
        m.put("source.generator.collections.users.format.options.user-id", "int");
        m.put("source.generator.collections.logs.format.type", "raw");
        m.put("source.generator.collections.logs.format.options.log-line", "string");

        // without a subject no schema is derived, so any name goes
        assertEquals(2, parse(m).collections().size());

        m.put("source.generator.schema.subject", "payload");
        m.put("source.generator.rate", "-1");
        GeneratorConfigException e = assertThrows(GeneratorConfigException.class, () -> parse(m));

        assertEquals(2, e.problems().size(), e.problems().toString());
        assertTrue(has(e.problems(), "failed validating collection \"users\": failed parsing fields: \"user-id\" is not a valid schema field name"));
        assertTrue(has(e.problems(), "\"rate\" should be greater or equal to 0"));
    }

    @Test
    void settingsRejectInvalidCombinationsDirectly() {
        List<CollectionSettings> one = List.of(
                CollectionSettings.fieldDriven("", List.of(Operation.CREATE), PayloadFormat.RAW, Map.of()));

        assertThrows(IllegalArgumentException.class,
                () -> new GeneratorSettings(0, 5, Duration.ofMillis(10), null, one, null));
        assertThrows(IllegalArgumentException.class,
                () -> new GeneratorSettings(0, 0, null, null, List.of(), null));
        assertThrows(IllegalArgumentException.class,
                () -> new BurstSettings(Duration.ofSeconds(1), Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> CollectionSettings.fieldDriven("x", List.of(Operation.CREATE), PayloadFormat.RAW, Map.of("a", "float")));
        assertThrows(IllegalArgumentException.class,
                () -> new CollectionSettings("x", List.of(Operation.CREATE), PayloadFormat.FILE, null, null));
    }

    private static boolean has(List<String> problems, String fragment) {
        return problems.stream().anyMatch(p -> p.contains(fragment));
    }
}
