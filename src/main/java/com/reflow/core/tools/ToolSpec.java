package com.reflow.core.tools;

import com.reflow.core.world.WorldState;

import java.util.Map;

/**
 * Registration of a tool: the operation plus its recovery metadata.
 *
 * @param name              registered name
 * @param tool              implementation
 * @param irreversible      external side effect that cannot be undone; never re-invoked and never compensated
 * @param compensatingTool  name of the tool that undoes a successful call, or null
 * @param compensationArgs  derives the compensating call's arguments, required when {@code compensatingTool} is set
 * @param postCondition     checked after an ok call; a violation turns the result into an error
 */
public record ToolSpec(
        String name,
        Tool tool,
        boolean irreversible,
        String compensatingTool,
        CompensationArgs compensationArgs,
        PostCondition postCondition
) {

    public ToolSpec {
        if (compensatingTool != null && compensationArgs == null) {
            throw new IllegalArgumentException("Tool " + name + " names a compensation without argument derivation");
        }
        if (irreversible && compensatingTool != null) {
            throw new IllegalArgumentException("Irreversible tool " + name + " cannot be compensated");
        }
    }

    public static ToolSpec of(String name, Tool tool) {
        return new ToolSpec(name, tool, false, null, null, null);
    }

    public ToolSpec asIrreversible() {
        return new ToolSpec(name, tool, true, compensatingTool, compensationArgs, postCondition);
    }

    public ToolSpec compensatedBy(String compensatingTool, CompensationArgs compensationArgs) {
        return new ToolSpec(name, tool, irreversible, compensatingTool, compensationArgs, postCondition);
    }

    public ToolSpec withPostCondition(PostCondition postCondition) {
        return new ToolSpec(name, tool, irreversible, compensatingTool, compensationArgs, postCondition);
    }

    public boolean compensable() {
        return compensatingTool != null;
    }

    /** Derives the arguments of the compensating call from the forward call. */
    @FunctionalInterface
    public interface CompensationArgs {
        Map<String, Object> derive(Map<String, Object> args, Map<String, Object> output);
    }

    /** Predicate over the world after an ok call. */
    @FunctionalInterface
    public interface PostCondition {
        boolean holds(WorldState world, Map<String, Object> args, Map<String, Object> output);
    }
}
