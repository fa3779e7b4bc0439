/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.schema;

import com.intuitivedesigns.synthkernel.core.StructuredData;
import com.intuitivedesigns.synthkernel.generator.FieldType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Avro mapping of generated structured payloads.
 *
 * <p>{@code time} maps to a {@code timestamp-millis} long, {@code duration} to a long holding
 * nanoseconds.</p>
 */
public final class AvroSchemas {

    static final String NAMESPACE = "com.intuitivedesigns.synthkernel.generated";

    private AvroSchemas() {}

    public static Schema forFields(String recordName, Map<String, String> fields) {
        SchemaBuilder.FieldAssembler<Schema> assembler = SchemaBuilder
                .record(sanitize(recordName))
                .namespace(NAMESPACE)
                .fields();

        for (Map.Entry<String, String> e : fields.entrySet()) {
            FieldType type = FieldType.fromTag(e.getValue())
                    .orElseThrow(() -> new IllegalStateException("unknown field type " + e.getValue() + " for field " + e.getKey()));
            assembler = assembler.name(e.getKey()).type(schemaOf(type)).noDefault();
        }
        return assembler.endRecord();
    }

    /**
     * Converts a payload generated from the same field definitions to an Avro record.
     */
    static GenericRecord toGenericRecord(Schema schema, StructuredData data) {
        GenericData.Record record = new GenericData.Record(schema);
        for (Schema.Field f : schema.getFields()) {
            record.put(f.name(), toAvro(data.get(f.name())));
        }
        return record;
    }

    private static Schema schemaOf(FieldType type) {
        switch (type) {
            case INT:
                return Schema.create(Schema.Type.INT);
            case STRING:
                return Schema.create(Schema.Type.STRING);
            case BOOL:
                return Schema.create(Schema.Type.BOOLEAN);
            case TIME:
                return LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
            case DURATION:
                return Schema.create(Schema.Type.LONG);
            default:
                throw new IllegalStateException("unhandled field type " + type);
        }
    }

    private static Object toAvro(Object value) {
        if (value instanceof Instant) return ((Instant) value).toEpochMilli();
        if (value instanceof Duration) return ((Duration) value).toNanos();
        return value;
    }

    // Avro names: [A-Za-z_][A-Za-z0-9_]*
    /**
     * Whether {@code name} is a legal Avro field name: {@code [A-Za-z_][A-Za-z0-9_]*}.
     */
    public static boolean isValidFieldName(String name) {
        if (name == null || name.isEmpty()) return false;
        return sanitize(name).equals(name);
    }

    static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 1);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || (i > 0 && c >= '0' && c <= '9');
            sb.append(ok ? c : '_');
        }
        return sb.length() == 0 ? "_" : sb.toString();
    }
}
