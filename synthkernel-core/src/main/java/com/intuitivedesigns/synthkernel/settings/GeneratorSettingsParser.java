/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.settings;

import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import com.intuitivedesigns.synthkernel.core.Operation;
import com.intuitivedesigns.synthkernel.generator.FieldType;
import com.intuitivedesigns.synthkernel.generator.PayloadFormat;
import com.intuitivedesigns.synthkernel.schema.AvroSchemas;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads {@code source.generator.*} properties into {@link GeneratorSettings}.
 *
 * <p>Parsing does not stop at the first problem: every malformed or inconsistent value is
 * collected and reported together in one {@link GeneratorConfigException}.</p>
 *
 * <pre>
 * source.generator.record.count=1000
 * source.generator.rate=50
 * source.generator.burst.sleep.time=5s
 * source.generator.burst.generate.time=1s
 * source.generator.operations=create,update
 * source.generator.format.type=structured
 * source.generator.format.options.id=int
 * source.generator.collections.users.format.type=file
 * source.generator.collections.users.format.options.path=/data/user.json
 * </pre>
 */
public final class GeneratorSettingsParser {

    public static final String PREFIX = "source.generator.";

    static final String KEY_RECORD_COUNT = PREFIX + "record.count";
    static final String KEY_RATE = PREFIX + "rate";
    static final String KEY_READ_TIME = PREFIX + "read.time";
    static final String KEY_BURST_SLEEP = PREFIX + "burst.sleep.time";
    static final String KEY_BURST_GENERATE = PREFIX + "burst.generate.time";
    static final String KEY_SCHEMA_SUBJECT = PREFIX + "schema.subject";
    static final String COLLECTIONS_PREFIX = PREFIX + "collections.";

    private static final String OPERATIONS = "operations";
    private static final String FORMAT_TYPE = "format.type";
    private static final String FORMAT_OPTIONS = "format.options.";
    private static final String PATH_OPTION = "path";

    private static final List<String> DEFAULT_OPERATIONS = List.of(Operation.CREATE.label());

    private GeneratorSettingsParser() {}

    /**
     * @throws GeneratorConfigException listing every problem found
     */
    public static GeneratorSettings parse(PipelineConfig config) {
        final List<String> problems = new ArrayList<>();

        final long recordCount = readLong(config, KEY_RECORD_COUNT, 0L, problems);
        final double rate = readDouble(config, KEY_RATE, 0d, problems);
        final Duration readTime = readDuration(config, KEY_READ_TIME, Duration.ZERO, problems);
        final Duration sleepTime = readDuration(config, KEY_BURST_SLEEP, Duration.ZERO, problems);
        final Duration generateTime = readDuration(config, KEY_BURST_GENERATE, BurstSettings.DEFAULT_GENERATE_TIME, problems);
        final String schemaSubject = config.getString(KEY_SCHEMA_SUBJECT, null);
        final boolean schemaEnabled = schemaSubject != null && !schemaSubject.isBlank();

        if (recordCount < 0) {
            problems.add("\"record.count\" should be greater or equal to 0");
        }
        if (!readTime.isZero() && rate > 0) {
            problems.add("cannot specify both \"read.time\" and \"rate\", \"read.time\" is deprecated, please only specify \"rate\"");
        }
        if (readTime.isNegative()) {
            problems.add("\"read.time\" should be greater or equal to 0");
        }
        if (rate < 0 || Double.isNaN(rate) || Double.isInfinite(rate)) {
            problems.add("\"rate\" should be greater or equal to 0");
        }
        if (sleepTime.isNegative()) {
            problems.add("\"burst.sleep.time\" should be greater or equal to 0");
        }
        if (sleepTime.compareTo(Duration.ZERO) > 0 && (generateTime.isZero() || generateTime.isNegative())) {
            problems.add("\"burst.generate.time\" should be greater than 0");
        }

        final List<CollectionSettings> collections = new ArrayList<>();
        int declared = 0;

        if (!config.getString(PREFIX + FORMAT_TYPE, "").isBlank()) {
            declared++;
            parseCollection(config, PREFIX, CollectionSettings.DEFAULT_COLLECTION, schemaEnabled, collections, problems);
        }
        for (String name : collectionNames(config)) {
            declared++;
            parseCollection(config, COLLECTIONS_PREFIX + name + '.', name, schemaEnabled, collections, problems);
        }
        if (declared == 0) {
            problems.add("invalid configuration, please configure at least one collection using \"format.type\" or \"collections.*.format.type\"");
        }

        if (!problems.isEmpty()) {
            throw new GeneratorConfigException(problems);
        }

        return new GeneratorSettings(
                recordCount,
                rate,
                readTime,
                new BurstSettings(sleepTime, generateTime),
                collections,
                schemaSubject);
    }

    /**
     * Named collections in sorted order. A collection is any {@code collections.<name>.} key group.
     */
    static Set<String> collectionNames(PipelineConfig config) {
        Set<String> names = new TreeSet<>();
        for (String rest : config.keysUnder(COLLECTIONS_PREFIX)) {
            int dot = rest.indexOf('.');
            if (dot > 0) {
                names.add(rest.substring(0, dot));
            }
        }
        return names;
    }

    private static void parseCollection(PipelineConfig config,
                                        String prefix,
                                        String name,
                                        boolean schemaEnabled,
                                        List<CollectionSettings> out,
                                        List<String> problems) {
        final String label = name.isEmpty()
                ? "failed validating default collection: "
                : "failed validating collection \"" + name + "\": ";
        final int before = problems.size();

        final List<String> rawOperations = config.getList(prefix + OPERATIONS, DEFAULT_OPERATIONS);
        if (rawOperations.isEmpty()) {
            problems.add(label + "at least one operation is required");
        }
        final List<Operation> operations = new ArrayList<>();
        for (String raw : rawOperations) {
            try {
                operations.add(Operation.parse(raw));
            } catch (IllegalArgumentException e) {
                problems.add(label + "failed parsing operation: " + e.getMessage());
            }
        }

        final String rawType = config.getString(prefix + FORMAT_TYPE, "");
        PayloadFormat format = null;
        try {
            format = PayloadFormat.parse(rawType);
        } catch (IllegalArgumentException e) {
            problems.add(label + "failed validating format: " + e.getMessage());
        }

        final Map<String, String> fields = new LinkedHashMap<>();
        Path filePath = null;

        if (format == PayloadFormat.FILE) {
            final String rawPath = config.getString(prefix + FORMAT_OPTIONS + PATH_OPTION, "").trim();
            if (rawPath.isEmpty()) {
                problems.add(label + "failed validating format: file path not specified");
            } else {
                try {
                    filePath = Path.of(rawPath);
                } catch (InvalidPathException e) {
                    problems.add(label + "failed validating format: invalid file path \"" + rawPath + "\"");
                }
            }
        } else if (format != null) {
            for (String field : config.keysUnder(prefix + FORMAT_OPTIONS)) {
                if (PATH_OPTION.equals(field)) continue;
                final String type = config.getString(prefix + FORMAT_OPTIONS + field, "");
                if (field.isBlank()) {
                    problems.add(label + "failed parsing fields: got empty field name in \"" + field + "\"");
                }
                if (type.isBlank()) {
                    problems.add(label + "failed parsing fields: got empty type in \"" + field + "\"");
                } else if (!FieldType.isKnown(type)) {
                    problems.add(label + "failed parsing fields: unknown data type in \"" + field + "\"");
                }
                // structured payloads get an Avro schema when a subject is configured
                if (schemaEnabled && format == PayloadFormat.STRUCTURED && !field.isBlank()
                        && !AvroSchemas.isValidFieldName(field.trim())) {
                    problems.add(label + "failed parsing fields: \"" + field + "\" is not a valid schema field name");
                }
                fields.put(field.trim(), type.trim());
            }
        }

        if (problems.size() == before) {
            out.add(new CollectionSettings(name, operations, format, fields, filePath));
        }
    }

    private static long readLong(PipelineConfig config, String key, long def, List<String> problems) {
        try {
            return config.requireLong(key, def);
        } catch (IllegalArgumentException e) {
            problems.add(e.getMessage());
            return def;
        }
    }

    private static double readDouble(PipelineConfig config, String key, double def, List<String> problems) {
        try {
            return config.requireDouble(key, def);
        } catch (IllegalArgumentException e) {
            problems.add(e.getMessage());
            return def;
        }
    }

    private static Duration readDuration(PipelineConfig config, String key, Duration def, List<String> problems) {
        try {
            return config.requireDuration(key, def);
        } catch (IllegalArgumentException e) {
            problems.add(e.getMessage());
            return def;
        }
    }
}
