package com.reflow.core.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * JSON persistence of the {@link MemoryBank}. A missing file loads as an empty bank.
 */
@Component
public class MemoryBankStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryBankStore.class);
    static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper;

    public MemoryBankStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    record Document(@JsonProperty("version") int version, @JsonProperty("entries") List<MemoryEntry> entries) {}

    public void load(Path path, MemoryBank bank) {
        if (!Files.exists(path)) {
            log.info("No memory bank at {}; starting empty", path);
            bank.clear();
            return;
        }
        try {
            Document document = objectMapper.readValue(path.toFile(), Document.class);
            List<MemoryEntry> entries = document.entries() == null ? List.of() : document.entries();
            bank.replaceAll(entries);
            log.info("Loaded {} memory entries from {}", entries.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read memory bank " + path, e);
        }
    }

    public void save(Path path, MemoryBank bank) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(path.toFile(), new Document(FORMAT_VERSION, bank.entries()));
            log.info("Saved {} memory entries to {}", bank.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write memory bank " + path, e);
        }
    }
}
