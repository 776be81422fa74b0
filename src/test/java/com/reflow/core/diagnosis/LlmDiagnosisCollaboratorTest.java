package com.reflow.core.diagnosis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.core.llm.LlmService;
import com.reflow.core.model.FaultKind;
import com.reflow.core.model.FaultLayer;
import com.reflow.core.model.StepContext;
import com.reflow.core.model.StepError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LlmDiagnosisCollaboratorTest {

    private LlmService llmService;
    private LlmDiagnosisCollaborator collaborator;
    private DiagnosisRequest request;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        ObjectMapper mapper = new ObjectMapper();
        collaborator = new LlmDiagnosisCollaborator(llmService, new DiagnosisResponseParser(mapper), mapper);
        StepContext step = new StepContext("t1", 2, "charge", "process_payment",
                Map.of("order_id", "order-2", "amount", 40), 0, "abc", null);
        request = new DiagnosisRequest(step, StepError.of(FaultKind.HTTP_500),
                List.of(new DiagnosisRequest.HistoryEntry("lock", "ok", null)), 1);
    }

    @Test
    @DisplayName("sends the request payload and parses the answer")
    void parsesModelAnswer() {
        when(llmService.complete(anyString(), anyString()))
                .thenReturn("{\"layer\":\"transient\",\"action\":\"retry\",\"confidence\":0.9,\"reasoning\":\"500\"}");

        DiagnosisResponse response = collaborator.diagnose(request);

        assertEquals(FaultLayer.TRANSIENT, response.layer());
        assertEquals(DiagnosisAction.RETRY, response.action());
        verify(llmService).complete(eq(DiagnosisPrompts.SYSTEM), contains("\"error_type\":\"HTTP_500\""));
    }

    @Test
    @DisplayName("a failing model call degrades to a zero-confidence answer")
    void transportFailureDegrades() {
        when(llmService.complete(anyString(), anyString())).thenThrow(new IllegalStateException("connection refused"));

        DiagnosisResponse response = collaborator.diagnose(request);

        assertEquals(0.0, response.confidence());
        assertTrue(response.reasoning().contains("IllegalStateException"));
    }
}
