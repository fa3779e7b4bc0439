/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.synthkernel.plugins;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intuitivedesigns.synthkernel.config.PipelineConfig;
import com.intuitivedesigns.synthkernel.core.Data;
import com.intuitivedesigns.synthkernel.core.OutputSink;
import com.intuitivedesigns.synthkernel.core.RawData;
import com.intuitivedesigns.synthkernel.core.SourceRecord;
import com.intuitivedesigns.synthkernel.core.StructuredData;
import com.intuitivedesigns.synthkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.synthkernel.spi.PluginKind;
import com.intuitivedesigns.synthkernel.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Logs every record as one JSON line at DEBUG.
 * <p>
 * ID: LOG
 */
public final class LogSinkPlugin implements SinkPlugin {

    public static final String ID = "LOG";

    // Config Keys
    private static final String CFG_PRETTY = "sink.log.pretty";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public PluginKind kind() {
        return PluginKind.SINK;
    }

    @Override
    public OutputSink create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        return new LogSink(config.getBoolean(CFG_PRETTY, false));
    }

    static final class LogSink implements OutputSink {

        private static final Logger log = LoggerFactory.getLogger(LogSink.class);

        private final ObjectMapper mapper;

        LogSink(boolean pretty) {
            this.mapper = new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                    .configure(SerializationFeature.INDENT_OUTPUT, pretty);
        }

        @Override
        public void write(SourceRecord record) throws JsonProcessingException {
            if (!log.isDebugEnabled()) return;
            log.debug("{}", render(record));
        }

        String render(SourceRecord record) throws JsonProcessingException {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("position", record.position());
            out.put("operation", record.operation().label());
            out.put("metadata", new TreeMap<>(record.metadata()));
            out.put("key", toJsonValue(record.key()));
            out.put("before", toJsonValue(record.before()));
            out.put("after", toJsonValue(record.after()));
            return mapper.writeValueAsString(out);
        }

        private static Object toJsonValue(Data data) {
            if (data == null) return null;
            if (data instanceof StructuredData) return ((StructuredData) data).fields();
            return ((RawData) data).asString();
        }

        @Override
        public void close() {
            log.info("Log sink closed.");
        }
    }
}
