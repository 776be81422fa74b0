package com.reflow.core.fault;

import com.reflow.core.model.FaultPhase;
import com.reflow.core.model.FaultSpec;
import com.reflow.core.model.InjectedFault;
import com.reflow.core.model.Task;

import java.util.Optional;

/**
 * Deterministic fault injection.
 * <p>
 * Every decision is a pure function of (seed, task id, fault id, step index, attempt index,
 * rollbacks observed). The injector keeps no state and never touches the world, so the same
 * task set under the same seed sees the same faults under every strategy.
 */
public class FaultInjector {

    private static final int CALL_LATENCY_MIN_MS = 5;
    private static final int CALL_LATENCY_MAX_MS = 20;

    private final long seed;

    public FaultInjector(long seed) {
        this.seed = seed;
    }

    public long seed() {
        return seed;
    }

    /**
     * Fault for a forward attempt, if any schedule entry fires.
     *
     * @param task              the task whose schedule is consulted
     * @param stepIndex         forward step index
     * @param attempt           zero-based attempt index at the step
     * @param rollbacksObserved rollbacks already executed at the step
     */
    public Optional<InjectedFault> inject(Task task, int stepIndex, int attempt, int rollbacksObserved) {
        for (FaultSpec spec : task.faultSchedule()) {
            if (spec.phase() != FaultPhase.FORWARD || spec.stepIndex() != stepIndex) {
                continue;
            }
            if (fires(task.taskId(), spec, attempt, rollbacksObserved)) {
                return Optional.of(InjectedFault.of(spec));
            }
        }
        return Optional.empty();
    }

    /**
     * Fault for a compensating call made while unwinding the frame of {@code owningStepIndex}.
     */
    public Optional<InjectedFault> injectCompensation(Task task, String compensatingTool, int owningStepIndex) {
        for (FaultSpec spec : task.faultSchedule()) {
            if (spec.phase() != FaultPhase.COMPENSATION || spec.stepIndex() != owningStepIndex
                    || !compensatingTool.equals(spec.tool())) {
                continue;
            }
            if (roll(task.taskId(), spec.faultId(), owningStepIndex, "compensation") < spec.probability()) {
                return Optional.of(InjectedFault.of(spec));
            }
        }
        return Optional.empty();
    }

    private boolean fires(String taskId, FaultSpec spec, int attempt, int rollbacksObserved) {
        return switch (spec.mode()) {
            case ONCE -> attempt == 0 && roll(taskId, spec.faultId(), spec.stepIndex()) < spec.probability();
            case PER_ATTEMPT -> roll(taskId, spec.faultId(), spec.stepIndex(), attempt) < spec.probability();
            case PERSISTENT -> roll(taskId, spec.faultId(), spec.stepIndex()) < spec.probability();
            case STATEFUL_CONFLICT -> rollbacksObserved == 0
                    && roll(taskId, spec.faultId(), spec.stepIndex()) < spec.probability();
        };
    }

    private double roll(Object... parts) {
        Object[] seeded = new Object[parts.length + 1];
        seeded[0] = seed;
        System.arraycopy(parts, 0, seeded, 1, parts.length);
        return SeededRandom.of(seeded).nextDouble();
    }

    /** Simulated latency of a faulted call, drawn from the kind's range. */
    public long faultLatencyMs(String taskId, InjectedFault fault, int attempt) {
        return SeededRandom.between(SeededRandom.of(seed, taskId, fault.faultId(), attempt, fault.kind().wireName()),
                fault.kind().minLatencyMs(), fault.kind().maxLatencyMs());
    }

    /** Simulated latency of a healthy call. */
    public long callLatencyMs(String taskId, int stepIndex, int attempt, String tool) {
        return SeededRandom.between(SeededRandom.of(seed, taskId, stepIndex, attempt, tool),
                CALL_LATENCY_MIN_MS, CALL_LATENCY_MAX_MS);
    }
}
