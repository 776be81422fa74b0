package com.reflow.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Thin wrapper over Spring AI's {@link ChatClient} for plain system + user prompts.
 * <p>
 * Created only when diagnosis runs in {@code llm} mode; callers own response parsing.
 */
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;

    public LlmService(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    /**
     * Sends the prompts and returns the raw response text.
     *
     * @throws LlmEmptyResponseException if the model returns no content
     */
    public String complete(String systemPrompt, String userPrompt) {
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content. "
                    + "Check that the model is reachable and answers with JSON.");
        }
        log.debug("Raw LLM response: {}", response);
        return response;
    }
}
