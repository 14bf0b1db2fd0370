package me.golemcore.governor.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.governor.domain.model.CallUsage;
import me.golemcore.governor.domain.model.ModelLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jBackendInvokerTest {

    private static final ModelLimits LIMITS = ModelLimits.builder()
            .provider("openai")
            .modelName("gpt-4o")
            .requestsPerMinute(500)
            .tokensPerMinute(30_000)
            .maxContextTokens(128_000)
            .build();

    private ChatModel chatModel;
    private Langchain4jBackendInvoker invoker;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        invoker = new Langchain4jBackendInvoker(chatModel, LIMITS);
    }

    @Test
    void invoke_delegatesToChatModel() {
        ChatRequest request = ChatRequest.builder().messages(UserMessage.from("hello")).build();
        ChatResponse response = ChatResponse.builder().aiMessage(AiMessage.from("hi")).build();
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response);

        assertSame(response, invoker.invoke(request));
        verify(chatModel).chat(request);
    }

    @Test
    void invoke_propagatesProviderErrors() {
        ChatRequest request = ChatRequest.builder().messages(UserMessage.from("hello")).build();
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RateLimitException("429"));

        assertThrows(RateLimitException.class, () -> invoker.invoke(request));
    }

    @Test
    void usageOf_mapsTokenUsage() {
        ChatResponse response = ChatResponse.builder()
                .aiMessage(AiMessage.from("hi"))
                .tokenUsage(new TokenUsage(120, 30))
                .build();

        Optional<CallUsage> usage = invoker.usageOf(response);

        assertTrue(usage.isPresent());
        assertEquals(120, usage.get().inputTokens());
        assertEquals(30, usage.get().outputTokens());
    }

    @Test
    void usageOf_missingCountsBecomeZero() {
        ChatResponse response = ChatResponse.builder()
                .aiMessage(AiMessage.from("hi"))
                .tokenUsage(new TokenUsage(50, null))
                .build();

        CallUsage usage = invoker.usageOf(response).orElseThrow();

        assertEquals(50, usage.inputTokens());
        assertEquals(0, usage.outputTokens());
    }

    @Test
    void usageOf_emptyWhenProviderReportsNothing() {
        ChatResponse response = ChatResponse.builder().aiMessage(AiMessage.from("hi")).build();

        assertTrue(invoker.usageOf(response).isEmpty());
        assertTrue(invoker.usageOf(null).isEmpty());
    }

    @Test
    void describesBackendFromLimits() {
        assertEquals("openai", invoker.getProvider());
        assertEquals("gpt-4o", invoker.getModelName());
        assertEquals("openai/gpt-4o", invoker.modelKey());
        assertSame(LIMITS, invoker.getLimits());
    }
}
