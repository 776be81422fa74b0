package com.reflow.core.recovery;

import com.reflow.core.budget.TokenEstimator;
import com.reflow.core.diagnosis.DiagnosisCollaborator;
import com.reflow.core.diagnosis.DiagnosisRequest;
import com.reflow.core.diagnosis.DiagnosisResponse;
import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.RecoveryAction;
import com.reflow.core.model.StrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * B3: ask the diagnosis collaborator; escalate whenever its confidence is below the threshold.
 */
public class DiagnosisDrivenStrategy implements RecoveryStrategy {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisDrivenStrategy.class);

    private final DiagnosisCollaborator collaborator;
    private final TokenEstimator tokenEstimator;
    private final double confidenceThreshold;
    private final int maxRetries;
    private final Duration baseDelay;

    public DiagnosisDrivenStrategy(DiagnosisCollaborator collaborator, TokenEstimator tokenEstimator,
                                   double confidenceThreshold, int maxRetries, Duration baseDelay) {
        this.collaborator = collaborator;
        this.tokenEstimator = tokenEstimator;
        this.confidenceThreshold = confidenceThreshold;
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
    }

    @Override
    public StrategyType type() {
        return StrategyType.DIAGNOSIS;
    }

    @Override
    public RecoveryDecision decide(FailureContext failure) {
        DiagnosisRequest request = new DiagnosisRequest(failure.step(), failure.result().error(),
                failure.recentHistory(), failure.failuresAtStep());
        int tokens = tokenEstimator.estimate(request.toPromptPayload());
        if (!failure.allowance().tryConsume(tokens)) {
            return RecoveryDecision.of(RecoveryAction.ESCALATE, DecisionSource.BUDGET, "diagnosis_over_budget");
        }

        DiagnosisResponse response = collaborator.diagnose(request);
        if (response == null) {
            response = DiagnosisResponse.malformed("null response");
        }
        log.debug("Diagnosis for {} step {}: {} / {} ({})", failure.step().taskId(), failure.step().stepIndex(),
                response.layer(), response.action(), response.confidence());

        if (response.confidence() < confidenceThreshold || response.action() == null) {
            return new RecoveryDecision(RecoveryAction.ESCALATE, response.confidence(), DecisionSource.DIAGNOSIS,
                    response, tokens, "low_confidence", null);
        }
        return new RecoveryDecision(response.action().toRecoveryAction(), response.confidence(),
                DecisionSource.DIAGNOSIS, response, tokens,
                "diagnosis:" + (response.layer() != null ? response.layer().wireName() : "unknown"), null);
    }

    @Override
    public RetryBackoff newBackoff() {
        return RetryBackoff.exponential(baseDelay, maxRetries);
    }
}
