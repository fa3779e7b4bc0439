/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import com.intuitivedesigns.synthkernel.core.SourceRecord;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Fans out across several generators, picking one uniformly at random per call.
 *
 * <p>Each delegate counts its own positions, so the combined position is
 * {@code <delegate index>/<delegate position>}. The separator keeps pairs such as (1, 12) and
 * (11, 2) apart. No counter is shared between delegates.</p>
 */
public final class CollectionCombinator implements RecordGenerator {

    static final char SEPARATOR = '/';

    private final List<RecordGenerator> generators;
    private final Random random;

    private CollectionCombinator(List<RecordGenerator> generators, Random random) {
        this.generators = generators;
        this.random = random;
    }

    /**
     * Returns the single generator unchanged, or a combinator over all of them.
     */
    public static RecordGenerator combine(List<? extends RecordGenerator> generators, Random random) {
        Objects.requireNonNull(generators, "generators");
        if (generators.isEmpty()) {
            throw new IllegalArgumentException("at least one generator is required");
        }
        if (generators.size() == 1) {
            return generators.get(0);
        }
        return new CollectionCombinator(List.copyOf(generators), Objects.requireNonNull(random, "random"));
    }

    @Override
    public SourceRecord next() {
        int i = random.nextInt(generators.size());
        SourceRecord rec = generators.get(i).next();
        return rec.withPosition(Integer.toString(i) + SEPARATOR + rec.position());
    }

    int size() {
        return generators.size();
    }
}
