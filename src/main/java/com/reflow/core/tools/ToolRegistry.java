package com.reflow.core.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name → {@link ToolSpec} registry, pre-populated with the built-in mock API.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolSpec> tools = new ConcurrentHashMap<>();

    public ToolRegistry() {
        BuiltinTools.specs().forEach(this::register);
        log.debug("Registered {} built-in tools", tools.size());
    }

    public void register(ToolSpec spec) {
        ToolSpec previous = tools.put(spec.name(), spec);
        if (previous != null) {
            log.info("Tool {} re-registered", spec.name());
        }
    }

    public Optional<ToolSpec> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * @throws IllegalArgumentException if no tool is registered under {@code name}
     */
    public ToolSpec require(String name) {
        ToolSpec spec = tools.get(name);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown tool: " + name);
        }
        return spec;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(tools.keySet());
    }
}
