package com.reflow.core.tools;

import java.util.Map;

/**
 * Typed access to loosely typed call arguments.
 */
final class ToolArgs {

    private ToolArgs() {}

    static String string(Map<String, Object> args, String key) throws ToolException {
        Object value = args.get(key);
        if (value == null) {
            throw new ToolException("Missing argument: " + key);
        }
        return value.toString();
    }

    static String string(Map<String, Object> args, String key, String defaultValue) {
        Object value = args.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    static int integer(Map<String, Object> args, String key) throws ToolException {
        Object value = args.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new ToolException("Argument " + key + " is not an integer: " + text);
            }
        }
        throw new ToolException("Missing argument: " + key);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(Map<String, Object> args, String key) throws ToolException {
        Object value = args.getOrDefault(key, Map.of());
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new ToolException("Argument " + key + " is not an object");
    }
}
