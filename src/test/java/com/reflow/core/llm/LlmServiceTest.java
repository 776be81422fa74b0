package com.reflow.core.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Mocks the whole {@link ChatClient} chain so no model is called.
 */
class LlmServiceTest {

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        llmService = new LlmService(mockChatClient);
    }

    @Test
    @DisplayName("complete sends both prompts through the fluent chain")
    void completeInvokesFullChain() {
        when(mockCallResponse.content()).thenReturn("{\"layer\":\"transient\"}");

        String response = llmService.complete("sys", "usr");

        assertEquals("{\"layer\":\"transient\"}", response);
        verify(mockChatClient).prompt();
        verify(mockRequestSpec).system("sys");
        verify(mockRequestSpec).user("usr");
        verify(mockRequestSpec).call();
        verify(mockCallResponse).content();
    }

    @Test
    @DisplayName("blank content is an error")
    void blankContentThrows() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class, () -> llmService.complete("sys", "usr"));
    }

    @Test
    @DisplayName("null content is an error")
    void nullContentThrows() {
        when(mockCallResponse.content()).thenReturn(null);

        assertThrows(LlmEmptyResponseException.class, () -> llmService.complete("sys", "usr"));
    }
}
