package com.reflow.core.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads tasks from a JSON Lines file, one task object per line. Blank lines and lines
 * starting with {@code #} are skipped.
 */
@Component
public class TaskLoader {

    private static final Logger log = LoggerFactory.getLogger(TaskLoader.class);

    private final ObjectMapper objectMapper;

    public TaskLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Task> load(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Task> tasks = read(reader, path.toString());
            log.info("Loaded {} tasks from {}", tasks.size(), path);
            return tasks;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tasks from " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException on a malformed line or a duplicate task id
     */
    public List<Task> read(Reader source, String origin) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        List<Task> tasks = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Task task;
            try {
                task = objectMapper.readValue(trimmed, Task.class);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException(origin + ":" + lineNumber + ": invalid task: "
                        + e.getOriginalMessage(), e);
            }
            if (!ids.add(task.taskId())) {
                throw new IllegalArgumentException(origin + ":" + lineNumber + ": duplicate task id " + task.taskId());
            }
            tasks.add(task);
        }
        return tasks;
    }
}
