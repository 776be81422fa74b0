package com.reflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a workflow: a named call of a registered tool with fixed parameters.
 *
 * @param stepName human-readable step name
 * @param toolName registered tool to invoke
 * @param params   call parameters
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepDefinition(
        @JsonProperty("step_name") String stepName,
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("params") Map<String, Object> params
) {

    public StepDefinition {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("tool_name is required");
        }
        if (stepName == null || stepName.isBlank()) {
            stepName = toolName;
        }
        params = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
