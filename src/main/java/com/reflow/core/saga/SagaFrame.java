package com.reflow.core.saga;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pending compensation for one completed forward step.
 *
 * @param stepIndex        forward step index
 * @param forwardTool      tool that produced the effect
 * @param compensatingTool tool that undoes it
 * @param args             arguments of the compensating call
 */
public record SagaFrame(int stepIndex, String forwardTool, String compensatingTool, Map<String, Object> args) {

    public SagaFrame {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }
}
