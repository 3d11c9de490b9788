package com.recursa.core.llm;

import com.recursa.core.consolidation.SnapshotDraft;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real model calls are made.
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

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, "http://test:1234");
    }

    @Test
    @DisplayName("sends the system prompt and the user prompt followed by format instructions")
    void sendsPrompts() {
        when(mockCallResponse.content()).thenReturn("""
                {"thinking":"read first","actions":[{"name":"file_read","arguments":{"path":"a.md"}}]}
                """);

        llmService.structuredCall("System prompt", "User prompt", ActionBatch.class);

        verify(mockRequestSpec).system("System prompt");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        assertTrue(userCaptor.getValue().startsWith("User prompt\n\n"));
        assertTrue(userCaptor.getValue().length() > "User prompt\n\n".length());
    }

    @Test
    @DisplayName("deserializes an action batch")
    void deserializesActionBatch() {
        when(mockCallResponse.content()).thenReturn("""
                {"thinking":"spawn","actions":[{"name":"researcher","arguments":{"task":"find sources"}},
                 {"name":"final_output","arguments":{"output":"done"}}]}
                """);

        ActionBatch batch = llmService.structuredCall("sys", "usr", ActionBatch.class);

        assertEquals(2, batch.actions().size());
        assertEquals("researcher", batch.actions().get(0).name());
        assertEquals("find sources", batch.actions().get(0).arguments().get("task"));
    }

    @Test
    @DisplayName("falls back to lenient parsing for fenced JSON with unknown fields")
    void lenientFallback() {
        when(mockCallResponse.content()).thenReturn("""
                ```json
                {"todoList":[{"text":"read","status":"done","notes":null}],
                 "fileDescriptions":"","durableFacts":"x","nextSteps":"1. go","confidence":0.9}
                ```
                """);

        SnapshotDraft draft = llmService.structuredCall("sys", "usr", SnapshotDraft.class);

        assertEquals("1. go", draft.nextSteps());
        assertEquals(1, draft.todoList().size());
    }

    @Test
    @DisplayName("empty content is reported as an empty response")
    void emptyContent() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("sys", "usr", ActionBatch.class));
    }

    @Test
    @DisplayName("unparseable content is reported as a parse failure")
    void unparseable() {
        assertThrows(LlmParseException.class, () -> llmService.parseWithJackson("I will read the file now.",
                ActionBatch.class));
    }
}
