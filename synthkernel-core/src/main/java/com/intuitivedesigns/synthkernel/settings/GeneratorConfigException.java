/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.settings;

import java.util.List;

/**
 * Invalid generator configuration. Carries every problem found, not just the first one.
 */
public final class GeneratorConfigException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public GeneratorConfigException(List<String> problems) {
        super("invalid generator configuration:\n  - " + String.join("\n  - ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
