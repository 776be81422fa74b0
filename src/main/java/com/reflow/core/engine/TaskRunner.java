package com.reflow.core.engine;

import com.reflow.core.budget.BudgetGuard;
import com.reflow.core.budget.BudgetLimits;
import com.reflow.core.budget.LoopGuard;
import com.reflow.core.budget.TaskClock;
import com.reflow.core.budget.TokenEstimator;
import com.reflow.core.checkpoint.CheckpointManager;
import com.reflow.core.checkpoint.CheckpointToken;
import com.reflow.core.config.ReflowProperties;
import com.reflow.core.diagnosis.DiagnosisRequest;
import com.reflow.core.events.EventBus;
import com.reflow.core.events.RecoveryEvent;
import com.reflow.core.fault.FaultInjector;
import com.reflow.core.logging.MdcContext;
import com.reflow.core.memory.FaultSignature;
import com.reflow.core.metrics.RecoveryMetrics;
import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.InjectedFault;
import com.reflow.core.model.RecoveryAction;
import com.reflow.core.model.StepContext;
import com.reflow.core.model.StepDefinition;
import com.reflow.core.model.StepResult;
import com.reflow.core.model.StepStatus;
import com.reflow.core.model.StrategyType;
import com.reflow.core.model.Task;
import com.reflow.core.model.TaskOutcome;
import com.reflow.core.model.TaskResult;
import com.reflow.core.oracle.ConsistencyChecker;
import com.reflow.core.oracle.ConsistencyReport;
import com.reflow.core.oracle.SuccessOracle;
import com.reflow.core.recovery.FailureContext;
import com.reflow.core.recovery.RecoveryDecision;
import com.reflow.core.recovery.RecoveryPolicyEngine;
import com.reflow.core.recovery.RetryBackoff;
import com.reflow.core.saga.CompensationResult;
import com.reflow.core.saga.SagaFrame;
import com.reflow.core.saga.SagaManager;
import com.reflow.core.saga.SagaRollbackResult;
import com.reflow.core.tools.ToolExecutor;
import com.reflow.core.tools.ToolRegistry;
import com.reflow.core.tools.ToolSpec;
import com.reflow.core.trace.TraceEvent;
import com.reflow.core.trace.TraceEventType;
import com.reflow.core.trace.TraceSink;
import com.reflow.core.world.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Drives one task from its first step to a terminal outcome.
 * <p>
 * Per step: admit budget, inject, call, trace. On an error the failure is handed to the
 * {@link RecoveryPolicyEngine} and its decision executed through the checkpoint and Saga
 * managers. Domain failures never escape as exceptions; only broken programming invariants do.
 * <p>
 * Thread-safe: all per-task state lives in an {@link Execution}, so independent tasks may run
 * concurrently on one runner.
 */
@Service
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    static final String TICKET_TOOL = "create_ticket";

    private final ToolRegistry toolRegistry;
    private final ToolExecutor toolExecutor;
    private final TokenEstimator tokenEstimator;
    private final SuccessOracle successOracle;
    private final ConsistencyChecker consistencyChecker;
    private final EventBus eventBus;
    private final RecoveryMetrics metrics;
    private final ReflowProperties properties;

    public TaskRunner(ToolRegistry toolRegistry, ToolExecutor toolExecutor, TokenEstimator tokenEstimator,
                      SuccessOracle successOracle, ConsistencyChecker consistencyChecker,
                      EventBus eventBus, RecoveryMetrics metrics, ReflowProperties properties) {
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.tokenEstimator = tokenEstimator;
        this.successOracle = successOracle;
        this.consistencyChecker = consistencyChecker;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Runs one task on a fresh deep copy of its initial world.
     *
     * @param task     the task
     * @param engine   policy engine wrapping the run's strategy
     * @param injector fault injector seeded for the run
     * @param clock    time source of this task; a virtual clock makes the trace reproducible
     * @param sink     destination of this task's trace events
     */
    public TaskResult run(Task task, RecoveryPolicyEngine engine, FaultInjector injector,
                          TaskClock clock, TraceSink sink) {
        StrategyType strategy = engine.strategy().type();
        MdcContext.setTask(task.taskId(), strategy.code());
        try {
            log.info("Starting task {} with {} ({} steps)", task.taskId(), strategy.code(), task.steps().size());
            eventBus.publish(RecoveryEvent.of("task.started", task.taskId(), null,
                    Map.of("strategy", strategy.code(), "steps", task.steps().size())));
            TaskResult result = new Execution(task, engine, injector, clock, sink).execute();
            log.info("Task {} finished: {} ({})", task.taskId(), result.outcome(), result.reason());
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /** Learnable decision awaiting its outcome. */
    private record PendingFeedback(int stepIndex, FaultSignature signature, RecoveryAction action) {}

    /**
     * Mutable state of one task run.
     */
    private final class Execution {

        private final Task task;
        private final RecoveryPolicyEngine engine;
        private final FaultInjector injector;
        private final TaskClock clock;
        private final String strategyCode;
        private final TraceRecorder trace;

        private final WorldState world;
        private final CheckpointManager checkpoints = new CheckpointManager();
        private final SagaManager saga = new SagaManager();
        private final BudgetGuard budget;
        private final LoopGuard loopGuard;

        private final int[] attempts;
        private final int[] failures;
        private final int[] retries;
        private final int[] rollbacks;
        private final Map<Integer, RetryBackoff> backoffs = new HashMap<>();
        private final List<DiagnosisRequest.HistoryEntry> history = new ArrayList<>();
        private final List<PendingFeedback> feedback = new ArrayList<>();

        private int totalAttempts;
        private int stepsCompleted;
        private int compensationsRun;
        private int diagnosisCalls;
        private int memoryHits;

        Execution(Task task, RecoveryPolicyEngine engine, FaultInjector injector, TaskClock clock, TraceSink sink) {
            this.task = task;
            this.engine = engine;
            this.injector = injector;
            this.clock = clock;
            this.strategyCode = engine.strategy().type().code();
            this.trace = new TraceRecorder(sink, strategyCode, task.taskId());
            this.world = task.initialWorldState().deepCopy();
            this.budget = new BudgetGuard(BudgetLimits.from(properties.getBudget()), clock);
            this.loopGuard = new LoopGuard(properties.getGuard().getWindow());
            int steps = task.steps().size();
            this.attempts = new int[steps];
            this.failures = new int[steps];
            this.retries = new int[steps];
            this.rollbacks = new int[steps];
        }

        TaskResult execute() {
            try {
                int stepIndex = 0;
                while (stepIndex < task.steps().size()) {
                    Optional<TaskResult> terminal = attemptStep(stepIndex);
                    if (terminal.isPresent()) {
                        return terminal.get();
                    }
                    if (stepsCompleted > stepIndex) {
                        stepIndex++;
                    }
                }
                saga.discard();
                boolean met = successOracle.evaluate(task.successCondition(), world);
                return finish(met ? TaskOutcome.SUCCESS : TaskOutcome.FAILED,
                        met ? "success_condition_met" : "success_condition_failed");
            } finally {
                checkpoints.clear();
            }
        }

        /**
         * One attempt of one step. Returns a result when the task terminated; otherwise the
         * caller either advances (the step completed) or repeats the step.
         */
        private Optional<TaskResult> attemptStep(int stepIndex) {
            StepDefinition step = task.steps().get(stepIndex);
            ToolSpec spec = toolRegistry.require(step.toolName());
            MdcContext.setStep(stepIndex);
            int attempt = attempts[stepIndex];

            if (spec.irreversible() && saga.hasIrreversible(stepIndex, spec.name(), step.params())) {
                log.info("Irreversible {} at step {} already applied; not re-invoking", spec.name(), stepIndex);
                trace.emit(TraceEvent.builder(TraceEventType.TOOL_CALL)
                        .step(stepIndex, step.stepName())
                        .call(spec.name(), attempt, step.params())
                        .status(StepStatus.OK)
                        .latencyMs(0)
                        .hashes(world.hash(), world.hash())
                        .decision(null, null, null, "deduplicated")
                        .budget(budget.snapshot())
                        .sagaDepth(saga.depth()));
                completeStep(stepIndex);
                return Optional.empty();
            }

            int tokens = tokenEstimator.estimate(step.params());
            Optional<String> refusal = budget.refusal(tokens, 1);
            if (refusal.isPresent()) {
                RecoveryDecision forced = RecoveryDecision.of(RecoveryAction.ESCALATE, DecisionSource.BUDGET,
                        "budget_exhausted:" + refusal.get());
                return Optional.of(escalate(stepIndex, forced, null, null, "budget_exhausted:" + refusal.get()));
            }
            budget.admit(tokens, 1);

            String preHash = world.hash();
            StepContext context = new StepContext(task.taskId(), stepIndex, step.stepName(), spec.name(),
                    step.params(), attempt, preHash, budget.snapshot());
            CheckpointToken preStep = checkpoints.snapshot(world, "pre-step-" + stepIndex + "-" + attempt);

            InjectedFault fault = injector.inject(task, stepIndex, attempt, rollbacks[stepIndex]).orElse(null);
            long latency = fault != null
                    ? injector.faultLatencyMs(task.taskId(), fault, attempt)
                    : injector.callLatencyMs(task.taskId(), stepIndex, attempt, spec.name());
            StepResult result = toolExecutor.execute(spec, world, step.params(), fault, latency);
            clock.pause(Duration.ofMillis(latency));
            attempts[stepIndex]++;
            totalAttempts++;
            String postHash = world.hash();
            remember(step.stepName(), result);
            if (spec.irreversible() && result.effectApplied()) {
                saga.recordIrreversible(stepIndex, spec.name(), step.params());
            }

            if (result.isOk()) {
                trace.emit(toolCall(context, result, postHash));
                if (spec.compensable()) {
                    saga.push(new SagaFrame(stepIndex, spec.name(), spec.compensatingTool(),
                            spec.compensationArgs().derive(step.params(), result.output())));
                }
                checkpoints.release(preStep);
                completeStep(stepIndex);
                return Optional.empty();
            }

            return handleFailure(context, result, postHash, preStep);
        }

        private Optional<TaskResult> handleFailure(StepContext context, StepResult result, String postHash,
                                                   CheckpointToken preStep) {
            int stepIndex = context.stepIndex();
            failures[stepIndex]++;
            loopGuard.recordFailure(stepIndex, postHash);
            FaultSignature signature = FaultSignature.from(context, result);
            log.info("Step {} ({}) failed on attempt {}: {} - {}", stepIndex, context.toolName(),
                    context.attempt(), result.errorKind(), result.errorMessage());
            eventBus.publish(RecoveryEvent.of("step.failed", task.taskId(), stepIndex,
                    Map.of("tool", context.toolName(), "error_kind", result.errorKind(),
                            "attempt", context.attempt())));

            RecoveryDecision decision = budget.exhaustionReason()
                    .map(reason -> RecoveryDecision.of(RecoveryAction.ESCALATE, DecisionSource.BUDGET,
                            "budget_exhausted:" + reason))
                    .orElseGet(() -> engine.decide(new FailureContext(context, result, signature, postHash,
                            failures[stepIndex], retries[stepIndex], rollbacks[stepIndex], history,
                            tokens -> budget.admit(tokens, 0)), loopGuard));
            noteDecision(stepIndex, signature, decision);

            trace.emit(toolCall(context, result, postHash)
                    .decision(decision.action(), decision.source(), decision.confidence(), decision.rationale())
                    .diagnosis(decision.diagnosis())
                    .memoryKey(decision.matchedKey()));

            switch (decision.action()) {
                case RETRY -> {
                    retries[stepIndex]++;
                    checkpoints.release(preStep);
                    Duration delay = backoffs.computeIfAbsent(stepIndex, i -> engine.strategy().newBackoff())
                            .nextDelay();
                    log.debug("Retrying step {} after {} ms", stepIndex, delay.toMillis());
                    clock.pause(delay);
                    return Optional.empty();
                }
                case ROLLBACK_THEN_RETRY -> {
                    world.replaceWith(checkpoints.restore(preStep));
                    checkpoints.release(preStep);
                    rollbacks[stepIndex]++;
                    log.info("Rolled back step {} to its pre-step checkpoint", stepIndex);
                    trace.emit(TraceEvent.builder(TraceEventType.RECOVERY)
                            .step(stepIndex, context.stepName())
                            .call(context.toolName(), context.attempt(), context.params())
                            .hashes(postHash, world.hash())
                            .decision(decision.action(), decision.source(), decision.confidence(),
                                    decision.rationale())
                            .budget(budget.snapshot())
                            .sagaDepth(saga.depth()));
                    return Optional.empty();
                }
                case ABORT -> {
                    checkpoints.release(preStep);
                    return Optional.of(finish(TaskOutcome.FAILED, "aborted:" + result.errorKind()));
                }
                case ESCALATE, COMPENSATE_THEN_ESCALATE -> {
                    return Optional.of(escalate(stepIndex, decision, preStep, result,
                            "escalated:" + result.errorKind()));
                }
                default -> throw new IllegalStateException("Unhandled recovery action " + decision.action());
            }
        }

        /**
         * Terminal escalation. A decision sourced from the budget leaves the Saga stack as it is
         * and names the pending frames in the ticket; any other escalation unwinds it first.
         * The failed attempt's own delta is reverted in both cases.
         */
        private TaskResult escalate(int stepIndex, RecoveryDecision decision, CheckpointToken preStep,
                                    StepResult failed, String reason) {
            StepDefinition step = task.steps().get(stepIndex);
            String preHash = world.hash();
            boolean unwind = decision.source() != DecisionSource.BUDGET;
            List<SagaFrame> pending = saga.frames();
            SagaRollbackResult rollback = null;

            CheckpointToken postFailure = preStep != null ? checkpoints.snapshot(world, "post-failure-" + stepIndex) : null;
            if (unwind) {
                rollback = saga.rollback(this::compensate);
                pending = rollback.pending();
            }
            if (preStep != null) {
                checkpoints.revert(world, preStep, postFailure);
                checkpoints.release(preStep);
                checkpoints.release(postFailure);
            }

            boolean halted = rollback != null && !rollback.completed();
            if (halted) {
                Map<String, Object> breach = new LinkedHashMap<>();
                breach.put("action", "consistency_breach");
                breach.put("critical", true);
                breach.put("step_index", rollback.failedFrame().stepIndex());
                breach.put("tool", rollback.failedFrame().compensatingTool());
                breach.put("reason", rollback.reason());
                world.appendAudit(breach);
                log.error("Compensation {} failed for step {}: {}; {} frame(s) left uncompensated",
                        rollback.failedFrame().compensatingTool(), rollback.failedFrame().stepIndex(),
                        rollback.reason(), rollback.pending().size());
            }
            String ticketId = raiseTicket(step, decision, failed, pending, halted);

            trace.emit(TraceEvent.builder(TraceEventType.ESCALATION)
                    .step(stepIndex, step.stepName())
                    .call(TICKET_TOOL, 0, Map.of("ticket_id", ticketId))
                    .error(failed != null ? failed.errorKind() : null, failed != null ? failed.errorMessage() : null)
                    .hashes(preHash, world.hash())
                    .decision(decision.action(), decision.source(), decision.confidence(), decision.rationale())
                    .budget(budget.snapshot())
                    .sagaDepth(saga.depth())
                    .critical(halted));
            metrics.incrementEscalations(halted ? "compensation_failed" : decision.rationale());
            eventBus.publish(RecoveryEvent.of("task.escalated", task.taskId(), stepIndex,
                    Map.of("ticket_id", ticketId, "critical", halted, "reason", reason)));

            if (halted) {
                return finish(TaskOutcome.UNHANDLED, "compensation_failed:" + rollback.failedFrame().compensatingTool());
            }
            return finish(TaskOutcome.ESCALATED, reason);
        }

        private CompensationResult compensate(SagaFrame frame) {
            ToolSpec spec = toolRegistry.require(frame.compensatingTool());
            String stepName = task.steps().get(frame.stepIndex()).stepName();
            int tokens = tokenEstimator.estimate(frame.args());
            Optional<String> refusal = budget.refusal(tokens, 1);
            if (refusal.isPresent()) {
                trace.emit(TraceEvent.builder(TraceEventType.COMPENSATION)
                        .step(frame.stepIndex(), stepName)
                        .call(spec.name(), 0, frame.args())
                        .status(StepStatus.ERROR)
                        .error("BudgetExhausted", "No budget left for " + spec.name() + ": " + refusal.get())
                        .budget(budget.snapshot())
                        .sagaDepth(saga.depth())
                        .critical(true));
                metrics.recordCompensation(spec.name(), false);
                return CompensationResult.failed("budget_exhausted:" + refusal.get());
            }
            budget.admit(tokens, 1);

            String preHash = world.hash();
            InjectedFault fault = injector.injectCompensation(task, spec.name(), frame.stepIndex()).orElse(null);
            long latency = fault != null
                    ? injector.faultLatencyMs(task.taskId(), fault, 0)
                    : injector.callLatencyMs(task.taskId(), frame.stepIndex(), compensationsRun, spec.name());
            StepResult result = toolExecutor.execute(spec, world, frame.args(), fault, latency);
            clock.pause(Duration.ofMillis(latency));
            totalAttempts++;
            compensationsRun++;

            trace.emit(TraceEvent.builder(TraceEventType.COMPENSATION)
                    .step(frame.stepIndex(), stepName)
                    .call(spec.name(), 0, frame.args())
                    .status(result.status())
                    .latencyMs(result.latencyMs())
                    .error(result.errorKind(), result.errorMessage())
                    .injectedFault(result.injectedFault())
                    .hashes(preHash, world.hash())
                    .budget(budget.snapshot())
                    .sagaDepth(saga.depth())
                    .critical(!result.isOk()));
            metrics.recordCompensation(spec.name(), result.isOk());
            eventBus.publish(RecoveryEvent.of("compensation.executed", task.taskId(), frame.stepIndex(),
                    Map.of("tool", spec.name(), "ok", result.isOk())));
            log.info("Compensated step {} with {}: {}", frame.stepIndex(), spec.name(), result.status());

            return result.isOk()
                    ? CompensationResult.success()
                    : CompensationResult.failed(result.errorKind() + ": " + result.errorMessage());
        }

        /** Tickets are raised outside the budget so an exhausted task can still escalate. */
        private String raiseTicket(StepDefinition step, RecoveryDecision decision, StepResult failed,
                                   List<SagaFrame> pending, boolean critical) {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("summary", task.taskId() + ": " + step.stepName() + " "
                    + (failed != null ? failed.errorKind() : "not attempted") + " (" + decision.rationale() + ")");
            args.put("severity", critical ? "critical" : "normal");
            if (!pending.isEmpty()) {
                args.put("pending_compensations", pending.stream()
                        .map(frame -> frame.stepIndex() + ":" + frame.compensatingTool())
                        .collect(Collectors.toList()));
            }
            StepResult ticket = toolExecutor.execute(toolRegistry.require(TICKET_TOOL), world, args, null, 0);
            if (!ticket.isOk()) {
                throw new IllegalStateException("Escalation ticket could not be raised: " + ticket.errorMessage());
            }
            return String.valueOf(ticket.output().get("ticket_id"));
        }

        private TaskResult finish(TaskOutcome outcome, String reason) {
            boolean compensated = compensationsRun > 0;
            ConsistencyReport report = consistencyChecker.check(world, task.initialWorldState(), compensated);
            if (!report.consistent()) {
                log.warn("Task {} ended inconsistent: {}", task.taskId(), report.violations());
            }
            trace.emit(TraceEvent.builder(TraceEventType.FINAL)
                    .hashes(null, world.hash())
                    .budget(budget.snapshot())
                    .sagaDepth(saga.depth())
                    .outcome(outcome, reason, compensated, report.consistent()));

            for (PendingFeedback pending : feedback) {
                engine.strategy().onOutcome(pending.signature(), pending.action(), stepsCompleted > pending.stepIndex());
            }

            metrics.recordTaskOutcome(strategyCode, outcome);
            metrics.recordAttemptsPerTask(totalAttempts);
            metrics.recordTaskDuration(budget.elapsedMs());
            eventBus.publish(RecoveryEvent.of("task.finished", task.taskId(), null,
                    Map.of("outcome", outcome.name(), "reason", reason)));
            return new TaskResult(task.taskId(), outcome, reason, totalAttempts, stepsCompleted, compensated,
                    report.consistent(), diagnosisCalls, memoryHits);
        }

        private void noteDecision(int stepIndex, FaultSignature signature, RecoveryDecision decision) {
            if (decision.source() == DecisionSource.DIAGNOSIS) {
                diagnosisCalls++;
                metrics.incrementDiagnosisCalls();
            }
            if (engine.strategy().type() == StrategyType.MEMORY_AUGMENTED && decision.source() != DecisionSource.GUARD
                    && decision.source() != DecisionSource.BUDGET) {
                boolean hit = decision.source() == DecisionSource.MEMORY;
                if (hit) {
                    memoryHits++;
                }
                metrics.recordMemoryLookup(hit);
            }
            if (decision.learnable()) {
                feedback.add(new PendingFeedback(stepIndex, signature, decision.action()));
            }
            metrics.recordDecision(strategyCode, decision.action(), decision.source());
            eventBus.publish(RecoveryEvent.of("recovery.decided", task.taskId(), stepIndex,
                    Map.of("action", decision.action().name(), "source", decision.source().name(),
                            "confidence", decision.confidence())));
            log.info("Recovery decision at step {}: {} from {} ({})", stepIndex, decision.action(),
                    decision.source(), decision.rationale());
        }

        private void completeStep(int stepIndex) {
            loopGuard.clear(stepIndex);
            stepsCompleted = stepIndex + 1;
        }

        private void remember(String stepName, StepResult result) {
            history.add(new DiagnosisRequest.HistoryEntry(stepName, result.status().name().toLowerCase(Locale.ROOT),
                    result.errorKind()));
            int window = properties.getDiagnosis().getHistoryWindow();
            while (history.size() > window) {
                history.remove(0);
            }
        }

        private TraceEvent.Builder toolCall(StepContext context, StepResult result, String postHash) {
            return TraceEvent.builder(TraceEventType.TOOL_CALL)
                    .step(context.stepIndex(), context.stepName())
                    .call(context.toolName(), context.attempt(), context.params())
                    .status(result.status())
                    .latencyMs(result.latencyMs())
                    .error(result.errorKind(), result.errorMessage())
                    .injectedFault(result.injectedFault())
                    .hashes(context.preStateHash(), postHash)
                    .budget(budget.snapshot())
                    .sagaDepth(saga.depth());
        }
    }
}
