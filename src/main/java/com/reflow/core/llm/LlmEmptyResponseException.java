package com.reflow.core.llm;

/**
 * Thrown when the LLM returns null or blank content instead of a diagnosis.
 */
public class LlmEmptyResponseException extends RuntimeException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
