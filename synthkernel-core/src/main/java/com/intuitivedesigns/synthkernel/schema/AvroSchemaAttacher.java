/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.schema;

import com.intuitivedesigns.synthkernel.core.RecordMetadata;
import com.intuitivedesigns.synthkernel.core.SourceRecord;
import com.intuitivedesigns.synthkernel.generator.RecordPostProcessor;
import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Stamps the payload schema of a structured collection onto each of its records.
 *
 * <p>The schema is derived from the field definitions and registered once, at construction. The
 * subject is {@code <collection>.<subject>}, or just {@code <subject>} for the default
 * collection.</p>
 */
public final class AvroSchemaAttacher implements RecordPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(AvroSchemaAttacher.class);

    private final String subject;
    private final String version;
    private final Schema schema;

    private AvroSchemaAttacher(String subject, int version, Schema schema) {
        this.subject = subject;
        this.version = Integer.toString(version);
        this.schema = schema;
    }

    public static AvroSchemaAttacher register(SchemaRegistry registry,
                                              String collection,
                                              String subject,
                                              Map<String, String> fields) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(fields, "fields");

        final String fullSubject = subjectFor(collection, subject);
        final Schema schema = AvroSchemas.forFields(fullSubject, fields);
        final int version = registry.register(fullSubject, schema);

        log.info("Registered payload schema subject='{}' version={} fields={}", fullSubject, version, fields.keySet());
        return new AvroSchemaAttacher(fullSubject, version, schema);
    }

    static String subjectFor(String collection, String subject) {
        return (collection == null || collection.isEmpty()) ? subject : collection + "." + subject;
    }

    @Override
    public SourceRecord process(SourceRecord record) {
        return record
                .withMetadata(RecordMetadata.PAYLOAD_SCHEMA_SUBJECT, subject)
                .withMetadata(RecordMetadata.PAYLOAD_SCHEMA_VERSION, version);
    }

    public String subject() {
        return subject;
    }

    public Schema schema() {
        return schema;
    }
}
