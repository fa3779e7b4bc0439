/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import java.util.List;
import java.util.Random;

/**
 * Short human-readable tokens for keys and {@code string} fields. Not unique.
 */
final class RandomWords {

    private static final List<String> WORDS = List.of(
            "amber", "anchor", "apple", "arrow", "aspen", "atlas", "badger", "basil",
            "beacon", "birch", "bison", "blossom", "breeze", "brook", "cactus", "canyon",
            "cedar", "cinder", "clover", "cobalt", "comet", "coral", "crane", "crystal",
            "delta", "dune", "eagle", "ember", "falcon", "fern", "fjord", "flint",
            "garnet", "glacier", "granite", "harbor", "hazel", "heron", "indigo", "iris",
            "jasper", "juniper", "kestrel", "lagoon", "lark", "lotus", "maple", "meadow",
            "mesa", "nebula", "oak", "onyx", "orchid", "otter", "pebble", "pine",
            "quartz", "raven", "reef", "saffron", "sparrow", "summit", "tundra", "willow"
    );

    private RandomWords() {}

    static String next(Random random) {
        return WORDS.get(random.nextInt(WORDS.size()));
    }
}
