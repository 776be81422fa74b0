package com.reflow.core.recovery;

import com.reflow.core.memory.FaultSignature;
import com.reflow.core.memory.MemoryBank;
import com.reflow.core.memory.MemoryMatch;
import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.RecoveryAction;
import com.reflow.core.model.StrategyType;

/**
 * B4: consult the memory bank first and bypass diagnosis on a confident match; otherwise
 * fall back to diagnosis. Outcomes are written back to the bank.
 */
public class MemoryAugmentedStrategy implements RecoveryStrategy {

    private final MemoryBank memoryBank;
    private final DiagnosisDrivenStrategy fallback;
    private final double confidenceThreshold;

    public MemoryAugmentedStrategy(MemoryBank memoryBank, DiagnosisDrivenStrategy fallback, double confidenceThreshold) {
        this.memoryBank = memoryBank;
        this.fallback = fallback;
        this.confidenceThreshold = confidenceThreshold;
    }

    @Override
    public StrategyType type() {
        return StrategyType.MEMORY_AUGMENTED;
    }

    @Override
    public RecoveryDecision decide(FailureContext failure) {
        MemoryMatch match = memoryBank.query(failure.signature());
        if (match.found() && match.confidence() >= confidenceThreshold) {
            return new RecoveryDecision(match.action(), match.confidence(), DecisionSource.MEMORY,
                    null, 0, "memory_hit", match.matchedKey());
        }
        return fallback.decide(failure);
    }

    @Override
    public RetryBackoff newBackoff() {
        return fallback.newBackoff();
    }

    @Override
    public void onOutcome(FaultSignature signature, RecoveryAction action, boolean success) {
        memoryBank.upsert(signature, action, success);
    }
}
