package com.reflow.core.diagnosis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.core.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnosis through a chat model. Transport and parse failures degrade to a confidence-0
 * response so the run continues with an escalation instead of crashing.
 */
public class LlmDiagnosisCollaborator implements DiagnosisCollaborator {

    private static final Logger log = LoggerFactory.getLogger(LlmDiagnosisCollaborator.class);

    private final LlmService llmService;
    private final DiagnosisResponseParser parser;
    private final ObjectMapper objectMapper;

    public LlmDiagnosisCollaborator(LlmService llmService, DiagnosisResponseParser parser, ObjectMapper objectMapper) {
        this.llmService = llmService;
        this.parser = parser;
        this.objectMapper = objectMapper;
    }

    @Override
    public DiagnosisResponse diagnose(DiagnosisRequest request) {
        String userPrompt;
        try {
            userPrompt = objectMapper.writeValueAsString(request.toPromptPayload());
        } catch (JsonProcessingException e) {
            return DiagnosisResponse.malformed("request not serializable");
        }
        try {
            return parser.parse(llmService.complete(DiagnosisPrompts.SYSTEM, userPrompt));
        } catch (RuntimeException e) {
            log.warn("Diagnosis call failed for {} step {}: {}",
                    request.step().taskId(), request.step().stepIndex(), e.getMessage());
            return DiagnosisResponse.malformed(e.getClass().getSimpleName());
        }
    }
}
