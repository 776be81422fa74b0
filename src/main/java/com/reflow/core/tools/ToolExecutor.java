package com.reflow.core.tools;

import com.reflow.core.model.InjectedFault;
import com.reflow.core.model.StepError;
import com.reflow.core.model.StepResult;
import com.reflow.core.world.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Invokes a tool with an optional injected fault and checks its post-condition.
 * <p>
 * Never throws for domain failures: a refused call, an injected fault or a violated
 * post-condition all come back as an error {@link StepResult}.
 */
@Component
public class ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);

    public StepResult execute(ToolSpec spec, WorldState world, Map<String, Object> args,
                              InjectedFault fault, long latencyMs) {
        if (fault == null) {
            return invoke(spec, world, args, latencyMs, null);
        }
        log.debug("Injecting {} into {}", fault.kind().wireName(), spec.name());
        return switch (fault.kind().effect()) {
            case ERROR -> StepResult.error(StepError.of(fault.kind()), latencyMs, fault);
            case LOST_WRITE -> lostWrite(spec, world, args, latencyMs, fault);
            case ORPHAN_THEN_ERROR -> orphanThenError(spec, world, args, latencyMs, fault);
        };
    }

    private StepResult invoke(ToolSpec spec, WorldState world, Map<String, Object> args,
                              long latencyMs, InjectedFault fault) {
        Map<String, Object> output;
        try {
            output = spec.tool().invoke(world, args);
        } catch (ToolException e) {
            return StepResult.error(new StepError(StepError.TOOL_ERROR, e.getMessage(), spec.name()), latencyMs, fault);
        }
        return checkPostCondition(spec, world, args, output, latencyMs, fault, true);
    }

    /** The call succeeds against a scratch copy, so the live world never sees the write. */
    private StepResult lostWrite(ToolSpec spec, WorldState world, Map<String, Object> args,
                                 long latencyMs, InjectedFault fault) {
        WorldState scratch = world.deepCopy();
        Map<String, Object> output;
        try {
            output = spec.tool().invoke(scratch, args);
        } catch (ToolException e) {
            return StepResult.error(new StepError(StepError.TOOL_ERROR, e.getMessage(), spec.name()), latencyMs, fault);
        }
        return checkPostCondition(spec, world, args, output, latencyMs, fault, false);
    }

    private StepResult orphanThenError(ToolSpec spec, WorldState world, Map<String, Object> args,
                                       long latencyMs, InjectedFault fault) {
        String origin = "injected";
        boolean applied = true;
        try {
            spec.tool().invoke(world, args);
        } catch (ToolException e) {
            origin = "injected; tool refused: " + e.getMessage();
            applied = false;
        }
        Map<String, Object> orphan = new LinkedHashMap<>();
        orphan.put("action", "orphan_write");
        orphan.put("record_id", "orphan-" + fault.faultId());
        orphan.put("tool", spec.name());
        world.appendAudit(orphan);
        StepError error = new StepError(fault.kind().wireName(), fault.kind().message(), origin);
        return applied
                ? StepResult.errorAfterEffect(error, latencyMs, fault)
                : StepResult.error(error, latencyMs, fault);
    }

    private StepResult checkPostCondition(ToolSpec spec, WorldState world, Map<String, Object> args,
                                          Map<String, Object> output, long latencyMs, InjectedFault fault,
                                          boolean applied) {
        if (spec.postCondition() != null && !spec.postCondition().holds(world, args, output)) {
            StepError error = new StepError(StepError.POST_CONDITION_VIOLATED,
                    "Post-condition failed for " + spec.name(), "post_condition");
            return applied
                    ? StepResult.errorAfterEffect(error, latencyMs, fault)
                    : StepResult.error(error, latencyMs, fault);
        }
        return StepResult.ok(output, latencyMs, fault);
    }
}
