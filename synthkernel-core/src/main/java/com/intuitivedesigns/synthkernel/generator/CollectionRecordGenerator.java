/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import com.intuitivedesigns.synthkernel.core.Data;
import com.intuitivedesigns.synthkernel.core.Operation;
import com.intuitivedesigns.synthkernel.core.RawData;
import com.intuitivedesigns.synthkernel.core.RecordMetadata;
import com.intuitivedesigns.synthkernel.core.SourceRecord;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Generates the records of one collection.
 *
 * <p>Positions are the decimal value of a per-instance counter starting at 1. Before/after
 * payloads are synthesized independently of each other.</p>
 */
public final class CollectionRecordGenerator implements RecordGenerator {

    private final String collection;
    private final List<Operation> operations;
    private final PayloadSynthesizer payloads;
    private final RecordPostProcessor postProcessor;
    private final FieldValueSynthesizer keys;
    private final Random random;
    private final Clock clock;

    private long count;

    public CollectionRecordGenerator(String collection,
                                     List<Operation> operations,
                                     PayloadSynthesizer payloads,
                                     RecordPostProcessor postProcessor,
                                     Random random) {
        this(collection, operations, payloads, postProcessor, random, Clock.systemUTC());
    }

    CollectionRecordGenerator(String collection,
                              List<Operation> operations,
                              PayloadSynthesizer payloads,
                              RecordPostProcessor postProcessor,
                              Random random,
                              Clock clock) {
        this.collection = (collection == null) ? "" : collection;
        this.operations = List.copyOf(Objects.requireNonNull(operations, "operations"));
        if (this.operations.isEmpty()) {
            throw new IllegalArgumentException("at least one operation is required");
        }
        this.payloads = Objects.requireNonNull(payloads, "payloads");
        this.postProcessor = (postProcessor == null) ? RecordPostProcessor.identity() : postProcessor;
        this.random = Objects.requireNonNull(random, "random");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.keys = new FieldValueSynthesizer(random, clock);
    }

    @Override
    public SourceRecord next() {
        count++;

        Operation op = operations.size() == 1
                ? operations.get(0)
                : operations.get(random.nextInt(operations.size()));

        Map<String, String> metadata = new HashMap<>(4);
        metadata.put(RecordMetadata.CREATED_AT, RecordMetadata.formatCreatedAt(clock.instant()));
        if (!collection.isEmpty()) {
            metadata.put(RecordMetadata.COLLECTION, collection);
        }

        Data before = null;
        Data after = null;
        switch (op) {
            case CREATE:
            case SNAPSHOT:
                after = payloads.nextPayload();
                break;
            case UPDATE:
                before = payloads.nextPayload();
                after = payloads.nextPayload();
                break;
            case DELETE:
                before = payloads.nextPayload();
                break;
            default:
                throw new IllegalStateException("unhandled operation " + op);
        }

        SourceRecord rec = new SourceRecord(
                Long.toString(count),
                op,
                metadata,
                RawData.of(keys.word()),
                before,
                after);

        return postProcessor.process(rec);
    }

    public String collection() {
        return collection;
    }

    long generatedCount() {
        return count;
    }
}
