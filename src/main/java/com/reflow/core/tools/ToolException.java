package com.reflow.core.tools;

/**
 * Raised by a tool implementation that refuses a call (missing record, insufficient inventory).
 * The executor turns it into a {@code ToolError} step result.
 */
public class ToolException extends Exception {

    public ToolException(String message) {
        super(message);
    }
}
