package com.reflow.core.diagnosis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.core.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the diagnosis collaborator from {@code reflow.diagnosis.mode}.
 */
@Configuration
public class DiagnosisConfig {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisConfig.class);

    @Bean
    @ConditionalOnProperty(name = "reflow.diagnosis.mode", havingValue = "llm")
    public LlmService llmService(ChatClient.Builder builder) {
        return new LlmService(builder.build());
    }

    @Bean
    @ConditionalOnProperty(name = "reflow.diagnosis.mode", havingValue = "llm")
    public DiagnosisCollaborator llmDiagnosisCollaborator(LlmService llmService,
                                                          DiagnosisResponseParser parser,
                                                          ObjectMapper objectMapper) {
        log.info("Diagnosis collaborator: LLM");
        return new LlmDiagnosisCollaborator(llmService, parser, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "reflow.diagnosis.mode", havingValue = "heuristic", matchIfMissing = true)
    public DiagnosisCollaborator heuristicDiagnosisCollaborator() {
        log.info("Diagnosis collaborator: heuristic");
        return new HeuristicDiagnosisCollaborator();
    }
}
