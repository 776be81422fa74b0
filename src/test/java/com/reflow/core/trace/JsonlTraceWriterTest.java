package com.reflow.core.trace;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.core.model.StepStatus;
import com.reflow.core.model.TaskOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonlTraceWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonlTraceWriter writer = new JsonlTraceWriter(mapper);

    private static TraceEvent toolCall(long seq, Map<String, Object> params) {
        return TraceEvent.builder(TraceEventType.TOOL_CALL)
                .step(0, "fetch")
                .call("get_record", 0, params)
                .status(StepStatus.OK)
                .latencyMs(12)
                .build(seq, "B2", "t1");
    }

    @Test
    @DisplayName("every event carries the full field set, with nulls for fields that do not apply")
    void fullFieldSet() throws IOException {
        JsonNode toolCall = mapper.readTree(writer.toJsonLine(toolCall(0, Map.of("record_id", "r"))));
        JsonNode last = mapper.readTree(writer.toJsonLine(TraceEvent.builder(TraceEventType.FINAL)
                .outcome(TaskOutcome.SUCCESS, null, false, true)
                .build(1, "B2", "t1")));

        List<String> toolCallFields = fieldNames(toolCall);
        assertEquals(toolCallFields, fieldNames(last));
        assertTrue(toolCall.get("final_outcome").isNull());
        assertEquals("TOOL_CALL", toolCall.get("event_type").asText());
        assertEquals("SUCCESS", last.get("final_outcome").asText());
        assertTrue(last.get("tool").isNull());
    }

    @Test
    @DisplayName("parameter maps are written with sorted keys")
    void sortedKeys() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("zeta", 1);
        params.put("alpha", 2);

        String line = writer.toJsonLine(toolCall(0, params));

        assertTrue(line.contains("{\"alpha\":2,\"zeta\":1}"), line);
        assertFalse(line.contains("\n"));
    }

    @Test
    @DisplayName("write emits one line per event")
    void writesLines() throws IOException {
        Path file = tempDir.resolve("out/trace.jsonl");

        writer.write(file, List.of(toolCall(0, Map.of()), toolCall(1, Map.of())));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        assertEquals(1, mapper.readTree(lines.get(1)).get("seq").asLong());
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
