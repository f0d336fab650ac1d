package com.lorekeeper.core.llm;

import com.lorekeeper.core.dispatch.AgentTurn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.util.Map;

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
    @DisplayName("structuredCall sends the system prompt and appends format instructions to the user prompt")
    void sendsPrompts() {
        when(mockCallResponse.content()).thenReturn("""
                {"finalText":"done","toolRequests":[]}
                """);

        llmService.structuredCall("System prompt", "User prompt", AgentTurn.class);

        verify(mockRequestSpec).system("System prompt");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        assertTrue(userCaptor.getValue().startsWith("User prompt\n\n"));
        assertTrue(userCaptor.getValue().length() > "User prompt\n\n".length());
    }

    @Test
    @DisplayName("structuredCall deserializes a final answer")
    void deserializesAnswer() {
        when(mockCallResponse.content()).thenReturn("""
                {"finalText":"Water boils at 100C.","toolRequests":[]}
                """);

        AgentTurn turn = llmService.structuredCall("sys", "usr", AgentTurn.class);

        assertTrue(turn.isFinal());
        assertEquals("Water boils at 100C.", turn.finalText());
    }

    @Test
    @DisplayName("structuredCall deserializes tool requests with their arguments")
    void deserializesToolRequests() {
        when(mockCallResponse.content()).thenReturn("""
                {"finalText":null,"toolRequests":[
                  {"tool":"research_agent","arguments":{"task":"find the boiling point"}},
                  {"tool":"write_to_scratch","arguments":{"note":"check units"}}]}
                """);

        AgentTurn turn = llmService.structuredCall("sys", "usr", AgentTurn.class);

        assertFalse(turn.isFinal());
        assertEquals(2, turn.toolRequests().size());
        assertEquals("research_agent", turn.toolRequests().get(0).tool());
        assertEquals(Map.of("note", "check units"), turn.toolRequests().get(1).arguments());
    }

    @Test
    @DisplayName("blank content raises LlmEmptyResponseException")
    void emptyContent() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("sys", "usr", AgentTurn.class));
    }

    @Test
    @DisplayName("unparseable content raises LlmParseException")
    void unparseableContent() {
        when(mockCallResponse.content()).thenReturn("I would rather not answer in JSON.");

        assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("sys", "usr", AgentTurn.class));
    }

    @Test
    @DisplayName("the lenient fallback reads fenced JSON and ignores unknown fields")
    void lenientFallback() {
        AgentTurn turn = llmService.parseWithJackson("""
                ```json
                {"finalText":"ok","toolRequests":[],"reasoning":"short"}
                ```
                """, AgentTurn.class);

        assertEquals("ok", turn.finalText());
    }

    @Test
    @DisplayName("stripFence removes markdown fences only")
    void stripFence() {
        assertEquals("{\"a\":1}", LlmService.stripFence("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", LlmService.stripFence("```\n{\"a\":1}```"));
        assertEquals("{\"a\":1}", LlmService.stripFence("  {\"a\":1}  "));
    }
}
