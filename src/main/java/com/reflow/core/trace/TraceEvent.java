package com.reflow.core.trace;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.reflow.core.budget.BudgetSnapshot;
import com.reflow.core.diagnosis.DiagnosisResponse;
import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.InjectedFault;
import com.reflow.core.model.RecoveryAction;
import com.reflow.core.model.StepStatus;
import com.reflow.core.model.TaskOutcome;

import java.util.Map;

/**
 * One line of the trace. Every event type and every strategy shares this exact field set;
 * fields that do not apply are null.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record TraceEvent(
        @JsonProperty("seq") long seq,
        @JsonProperty("strategy") String strategy,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("event_type") TraceEventType eventType,
        @JsonProperty("step_index") Integer stepIndex,
        @JsonProperty("step_name") String stepName,
        @JsonProperty("tool") String tool,
        @JsonProperty("attempt") Integer attempt,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("status") StepStatus status,
        @JsonProperty("latency_ms") Long latencyMs,
        @JsonProperty("error_kind") String errorKind,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("injected_fault") InjectedFault injectedFault,
        @JsonProperty("pre_state_hash") String preStateHash,
        @JsonProperty("state_hash") String stateHash,
        @JsonProperty("recovery_action") RecoveryAction recoveryAction,
        @JsonProperty("decision_source") DecisionSource decisionSource,
        @JsonProperty("decision_confidence") Double decisionConfidence,
        @JsonProperty("decision_rationale") String decisionRationale,
        @JsonProperty("diagnosis") DiagnosisResponse diagnosis,
        @JsonProperty("memory_key") String memoryKey,
        @JsonProperty("budget") BudgetSnapshot budget,
        @JsonProperty("saga_depth") int sagaDepth,
        @JsonProperty("critical") boolean critical,
        @JsonProperty("final_outcome") TaskOutcome finalOutcome,
        @JsonProperty("final_reason") String finalReason,
        @JsonProperty("compensation_required") Boolean compensationRequired,
        @JsonProperty("consistent") Boolean consistent
) {

    public static Builder builder(TraceEventType eventType) {
        return new Builder(eventType);
    }

    /**
     * Fluent assembly; sequence number and strategy are stamped by the recorder.
     */
    public static final class Builder {

        private final TraceEventType eventType;
        private Integer stepIndex;
        private String stepName;
        private String tool;
        private Integer attempt;
        private Map<String, Object> params;
        private StepStatus status;
        private Long latencyMs;
        private String errorKind;
        private String errorMessage;
        private InjectedFault injectedFault;
        private String preStateHash;
        private String stateHash;
        private RecoveryAction recoveryAction;
        private DecisionSource decisionSource;
        private Double decisionConfidence;
        private String decisionRationale;
        private DiagnosisResponse diagnosis;
        private String memoryKey;
        private BudgetSnapshot budget;
        private int sagaDepth;
        private boolean critical;
        private TaskOutcome finalOutcome;
        private String finalReason;
        private Boolean compensationRequired;
        private Boolean consistent;

        private Builder(TraceEventType eventType) {
            this.eventType = eventType;
        }

        public Builder step(int stepIndex, String stepName) {
            this.stepIndex = stepIndex;
            this.stepName = stepName;
            return this;
        }

        public Builder call(String tool, int attempt, Map<String, Object> params) {
            this.tool = tool;
            this.attempt = attempt;
            this.params = params;
            return this;
        }

        public Builder status(StepStatus status) {
            this.status = status;
            return this;
        }

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder error(String errorKind, String errorMessage) {
            this.errorKind = errorKind;
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder injectedFault(InjectedFault injectedFault) {
            this.injectedFault = injectedFault;
            return this;
        }

        public Builder hashes(String preStateHash, String stateHash) {
            this.preStateHash = preStateHash;
            this.stateHash = stateHash;
            return this;
        }

        public Builder decision(RecoveryAction action, DecisionSource source, Double confidence, String rationale) {
            this.recoveryAction = action;
            this.decisionSource = source;
            this.decisionConfidence = confidence;
            this.decisionRationale = rationale;
            return this;
        }

        public Builder diagnosis(DiagnosisResponse diagnosis) {
            this.diagnosis = diagnosis;
            return this;
        }

        public Builder memoryKey(String memoryKey) {
            this.memoryKey = memoryKey;
            return this;
        }

        public Builder budget(BudgetSnapshot budget) {
            this.budget = budget;
            return this;
        }

        public Builder sagaDepth(int sagaDepth) {
            this.sagaDepth = sagaDepth;
            return this;
        }

        public Builder critical(boolean critical) {
            this.critical = critical;
            return this;
        }

        public Builder outcome(TaskOutcome outcome, String reason, boolean compensationRequired, boolean consistent) {
            this.finalOutcome = outcome;
            this.finalReason = reason;
            this.compensationRequired = compensationRequired;
            this.consistent = consistent;
            return this;
        }

        public TraceEvent build(long seq, String strategy, String taskId) {
            return new TraceEvent(seq, strategy, taskId, eventType, stepIndex, stepName, tool, attempt,
                    params, status, latencyMs, errorKind, errorMessage, injectedFault, preStateHash, stateHash,
                    recoveryAction, decisionSource, decisionConfidence, decisionRationale, diagnosis, memoryKey,
                    budget, sagaDepth, critical, finalOutcome, finalReason, compensationRequired, consistent);
        }
    }
}
