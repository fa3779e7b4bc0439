/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.generator;

import com.intuitivedesigns.synthkernel.core.RawData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serves the same cached file contents on every call.
 *
 * <p>The file is read once so that disk latency never shows up in pull latency or the
 * effective rate. The whole file stays on heap for the generator's lifetime. Each payload
 * gets its own copy of the bytes, so a consumer that writes to one cannot change the next.</p>
 */
final class FilePayloadSynthesizer implements PayloadSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(FilePayloadSynthesizer.class);

    private final byte[] cached;

    private FilePayloadSynthesizer(byte[] bytes) {
        this.cached = bytes;
    }

    static FilePayloadSynthesizer read(Path path) {
        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read payload file " + path, e);
        }
        log.info("Cached payload file {} ({} bytes)", path, bytes.length);
        return new FilePayloadSynthesizer(bytes);
    }

    @Override
    public RawData nextPayload() {
        return new RawData(cached.clone());
    }
}
