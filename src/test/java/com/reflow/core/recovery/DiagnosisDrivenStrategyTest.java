package com.reflow.core.recovery;

import com.reflow.core.budget.TokenEstimator;
import com.reflow.core.diagnosis.DiagnosisAction;
import com.reflow.core.diagnosis.DiagnosisCollaborator;
import com.reflow.core.diagnosis.DiagnosisRequest;
import com.reflow.core.diagnosis.DiagnosisResponse;
import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.FaultLayer;
import com.reflow.core.model.RecoveryAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DiagnosisDrivenStrategyTest {

    private DiagnosisCollaborator collaborator;
    private DiagnosisDrivenStrategy strategy;

    @BeforeEach
    void setUp() {
        collaborator = mock(DiagnosisCollaborator.class);
        strategy = new DiagnosisDrivenStrategy(collaborator, new TokenEstimator(), 0.7, 3, Duration.ofMillis(100));
    }

    @Test
    @DisplayName("a confident diagnosis maps to its recovery action and charges tokens")
    void confidentDiagnosisIsFollowed() {
        when(collaborator.diagnose(any())).thenReturn(
                new DiagnosisResponse(FaultLayer.CASCADE, DiagnosisAction.ROLLBACK, 0.9, "stale"));
        AtomicInteger charged = new AtomicInteger();

        RecoveryDecision decision = strategy.decide(Failures.of("Conflict", 1, 0, 0, tokens -> {
            charged.addAndGet(tokens);
            return true;
        }));

        assertEquals(RecoveryAction.ROLLBACK_THEN_RETRY, decision.action());
        assertEquals(DecisionSource.DIAGNOSIS, decision.source());
        assertEquals(0.9, decision.confidence(), 1e-9);
        assertEquals("diagnosis:cascade", decision.rationale());
        assertTrue(decision.tokensUsed() > 0);
        assertEquals(decision.tokensUsed(), charged.get());
        assertNotNull(decision.diagnosis());
    }

    @Test
    @DisplayName("confidence below the threshold escalates")
    void lowConfidenceEscalates() {
        when(collaborator.diagnose(any())).thenReturn(
                new DiagnosisResponse(FaultLayer.TRANSIENT, DiagnosisAction.RETRY, 0.69, "maybe"));

        RecoveryDecision decision = strategy.decide(Failures.of("Timeout", 1, 0, 0));

        assertEquals(RecoveryAction.ESCALATE, decision.action());
        assertEquals("low_confidence", decision.rationale());
    }

    @Test
    @DisplayName("a malformed or missing answer escalates")
    void unusableAnswerEscalates() {
        when(collaborator.diagnose(any())).thenReturn(null);

        RecoveryDecision decision = strategy.decide(Failures.of("Timeout", 1, 0, 0));

        assertEquals(RecoveryAction.ESCALATE, decision.action());
        assertEquals(0.0, decision.confidence());
    }

    @Test
    @DisplayName("no collaborator call when the token budget refuses it")
    void budgetRefusalSkipsCollaborator() {
        RecoveryDecision decision = strategy.decide(Failures.of("Timeout", 1, 0, 0, tokens -> false));

        assertEquals(RecoveryAction.ESCALATE, decision.action());
        assertEquals(DecisionSource.BUDGET, decision.source());
        verifyNoInteractions(collaborator);
    }

    @Test
    @DisplayName("the request carries no ground truth and the step's failure count")
    void requestContent() {
        when(collaborator.diagnose(any())).thenReturn(
                new DiagnosisResponse(FaultLayer.TRANSIENT, DiagnosisAction.RETRY, 0.9, "ok"));
        ArgumentCaptor<DiagnosisRequest> captor = ArgumentCaptor.forClass(DiagnosisRequest.class);

        strategy.decide(Failures.of("HTTP_500", 2, 1, 0));

        verify(collaborator).diagnose(captor.capture());
        DiagnosisRequest request = captor.getValue();
        assertEquals(2, request.retryCount());
        assertEquals("HTTP_500", request.toPromptPayload().get("error_type"));
        assertFalse(request.toPromptPayload().containsKey("injected_fault"));
    }
}
