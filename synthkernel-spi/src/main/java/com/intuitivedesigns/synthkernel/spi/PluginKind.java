/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.spi;

public enum PluginKind {
    SOURCE,
    SINK
}
