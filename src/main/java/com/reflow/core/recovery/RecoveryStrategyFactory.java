package com.reflow.core.recovery;

import com.reflow.core.budget.TokenEstimator;
import com.reflow.core.config.ReflowProperties;
import com.reflow.core.diagnosis.DiagnosisCollaborator;
import com.reflow.core.memory.MemoryBank;
import com.reflow.core.model.StrategyType;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds a {@link RecoveryPolicyEngine} for the strategy selected at run time.
 */
@Component
public class RecoveryStrategyFactory {

    private final ReflowProperties properties;
    private final DiagnosisCollaborator diagnosisCollaborator;
    private final MemoryBank memoryBank;
    private final TokenEstimator tokenEstimator;

    public RecoveryStrategyFactory(ReflowProperties properties, DiagnosisCollaborator diagnosisCollaborator,
                                   MemoryBank memoryBank, TokenEstimator tokenEstimator) {
        this.properties = properties;
        this.diagnosisCollaborator = diagnosisCollaborator;
        this.memoryBank = memoryBank;
        this.tokenEstimator = tokenEstimator;
    }

    public RecoveryStrategy create(StrategyType type) {
        ReflowProperties.Retry retry = properties.getRetry();
        Duration baseDelay = Duration.ofMillis(retry.getBaseDelayMs());
        return switch (type) {
            case NO_RECOVERY -> new NoRecoveryStrategy();
            case NAIVE_RETRY -> new NaiveRetryStrategy(retry.getMaxRetries(), Duration.ofMillis(retry.getNaiveDelayMs()));
            case RULE_BASED -> new RuleBasedStrategy(retry.getMaxRetries(), baseDelay);
            case DIAGNOSIS -> diagnosisStrategy(baseDelay);
            case MEMORY_AUGMENTED -> new MemoryAugmentedStrategy(memoryBank, diagnosisStrategy(baseDelay),
                    properties.getMemory().getConfidenceThreshold());
        };
    }

    public RecoveryPolicyEngine engineFor(StrategyType type) {
        return new RecoveryPolicyEngine(create(type), properties.getRetry().getMaxAttemptsPerStep());
    }

    private DiagnosisDrivenStrategy diagnosisStrategy(Duration baseDelay) {
        return new DiagnosisDrivenStrategy(diagnosisCollaborator, tokenEstimator,
                properties.getDiagnosis().getConfidenceThreshold(), properties.getRetry().getMaxRetries(), baseDelay);
    }
}
