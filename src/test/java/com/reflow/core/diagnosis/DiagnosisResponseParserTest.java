package com.reflow.core.diagnosis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.core.model.FaultLayer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosisResponseParserTest {

    private final DiagnosisResponseParser parser = new DiagnosisResponseParser(new ObjectMapper());

    @Test
    @DisplayName("parses a plain JSON answer")
    void plainJson() {
        DiagnosisResponse response = parser.parse(
                "{\"layer\": \"transient\", \"action\": \"retry\", \"confidence\": 0.8, \"reasoning\": \"timeout\"}");

        assertEquals(FaultLayer.TRANSIENT, response.layer());
        assertEquals(DiagnosisAction.RETRY, response.action());
        assertEquals(0.8, response.confidence(), 1e-9);
        assertEquals("timeout", response.reasoning());
    }

    @Test
    @DisplayName("tolerates markdown fences and surrounding prose")
    void fencedJson() {
        String raw = """
                Here is my analysis:
                ```json
                {"layer": "Cascade", "action": "COMPENSATE", "confidence": 0.75}
                ```
                """;

        DiagnosisResponse response = parser.parse(raw);

        assertEquals(FaultLayer.CASCADE, response.layer());
        assertEquals(DiagnosisAction.COMPENSATE, response.action());
        assertEquals("", response.reasoning());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "no json here",
            "{not json}",
            "{\"layer\": \"weird\", \"action\": \"retry\", \"confidence\": 0.9}",
            "{\"layer\": \"transient\", \"action\": \"pray\", \"confidence\": 0.9}",
            "{\"layer\": \"transient\", \"action\": \"retry\"}",
            "{\"layer\": \"transient\", \"action\": \"retry\", \"confidence\": \"high\"}",
            "{\"layer\": \"transient\", \"action\": \"retry\", \"confidence\": 1.5}"
    })
    void unusableAnswersHaveZeroConfidence(String raw) {
        DiagnosisResponse response = parser.parse(raw);

        assertEquals(0.0, response.confidence());
        assertEquals(DiagnosisAction.ESCALATE, response.action());
        assertNull(response.layer());
    }
}
