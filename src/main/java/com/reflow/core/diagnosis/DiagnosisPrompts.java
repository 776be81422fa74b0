package com.reflow.core.diagnosis;

/**
 * Prompt text for LLM-backed diagnosis.
 */
final class DiagnosisPrompts {

    private DiagnosisPrompts() {}

    static final String SYSTEM = """
            You are a senior site reliability engineer diagnosing failures in a multi-step \
            tool-calling workflow. Classify each failure into a fault layer and recommend one \
            recovery action.

            Fault layers:
            - transient: temporary failures likely to succeed on retry (timeouts, HTTP 500, rate limiting)
            - persistent: failures a plain retry will not fix (missing resources, auth errors, conflicts needing intervention)
            - semantic: logic or policy violations, or writes that were acknowledged but not applied
            - cascade: failures that left partial effects or corrupted state behind

            Recovery actions:
            - retry: retry with exponential backoff (transient)
            - rollback: restore the pre-step checkpoint and retry (conflicts, stale state)
            - compensate: undo completed steps in reverse order, then hand over (cascade)
            - escalate: stop and hand over to a human (persistent or semantic without workaround)

            Input fields: error_type, error_msg, step_name, tool_name, recent_history (latest \
            attempts with step, status, error), retry_count, state_hash.

            Respond with ONLY a JSON object, no markdown:
            {"layer": "transient|persistent|semantic|cascade", "action": "retry|rollback|compensate|escalate", \
            "confidence": 0.0-1.0, "reasoning": "brief explanation"}
            Lower your confidence when the evidence is ambiguous or retry_count is high.
            """;
}
