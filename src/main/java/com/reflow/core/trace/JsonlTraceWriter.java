package com.reflow.core.trace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes trace events as JSON Lines. Map entries are key-sorted so identical runs produce
 * byte-identical files.
 */
@Component
public class JsonlTraceWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonlTraceWriter.class);

    private final ObjectMapper mapper;

    public JsonlTraceWriter(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public String toJsonLine(TraceEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Trace event " + event.seq() + " is not serializable", e);
        }
    }

    public void write(Path path, List<TraceEvent> events) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                for (TraceEvent event : events) {
                    writer.write(toJsonLine(event));
                    writer.write('\n');
                }
            }
            log.info("Wrote {} trace events to {}", events.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write trace " + path, e);
        }
    }
}
