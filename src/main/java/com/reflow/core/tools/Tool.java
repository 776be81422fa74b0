package com.reflow.core.tools;

import com.reflow.core.world.WorldState;

import java.util.Map;

/**
 * A callable operation against the world state.
 */
@FunctionalInterface
public interface Tool {

    /**
     * Invokes the operation.
     *
     * @param world live world state, mutated in place
     * @param args  call arguments
     * @return output map
     * @throws ToolException when the operation itself refuses the call
     */
    Map<String, Object> invoke(WorldState world, Map<String, Object> args) throws ToolException;
}
