package me.golemcore.governor.adapter.outbound.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.governor.domain.exception.RouterConfigurationException;
import me.golemcore.governor.domain.model.ModelLimits;
import me.golemcore.governor.infrastructure.config.GovernorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChatModelFactoryTest {

    private GovernorProperties properties;
    private ChatModelFactory factory;

    @BeforeEach
    void setUp() {
        properties = new GovernorProperties();
        factory = new ChatModelFactory(properties);
    }

    @Test
    void createModel_missingProviderThrows() {
        RouterConfigurationException ex = assertThrows(RouterConfigurationException.class,
                () -> factory.createModel("openai", "gpt-4o"));
        assertTrue(ex.getMessage().contains("governor.providers.openai.api-key"));
    }

    @Test
    void createModel_blankApiKeyThrows() {
        properties.getProviders().put("openai", provider(" ", null));

        assertThrows(RouterConfigurationException.class, () -> factory.createModel("openai", "gpt-4o"));
    }

    @Test
    void createModel_anthropicUsesCompatibilityEndpoint() {
        GovernorProperties.ProviderProperties anthropic = provider("sk-ant-test", null);
        properties.getProviders().put("anthropic", anthropic);

        ChatModel model = factory.createModel("anthropic", "claude-sonnet-4-5");

        assertInstanceOf(OpenAiChatModel.class, model);
        assertEquals(ChatModelFactory.ANTHROPIC_BASE_URL, ChatModelFactory.baseUrlFor("anthropic", anthropic));
    }

    @Test
    void baseUrlFor_configuredUrlWins() {
        assertEquals("https://proxy.local/v1/",
                ChatModelFactory.baseUrlFor("anthropic", provider("k", "https://proxy.local/v1/")));
        assertNull(ChatModelFactory.baseUrlFor("openai", provider("k", null)));
    }

    @Test
    void createModel_otherProvidersUseOpenAiCompatibleClient() {
        properties.getProviders().put("openai", provider("sk-test", null));
        properties.getProviders().put("gemini", provider("g-test",
                "https://generativelanguage.googleapis.com/v1beta/openai/"));

        assertInstanceOf(OpenAiChatModel.class, factory.createModel("openai", "gpt-4o"));
        assertInstanceOf(OpenAiChatModel.class, factory.createModel("gemini", "gemini-2.5-pro"));
    }

    @Test
    void createInvoker_wrapsModelWithLimits() {
        properties.getProviders().put("openai", provider("sk-test", null));
        ModelLimits limits = ModelLimits.builder()
                .provider("openai")
                .modelName("gpt-4o-mini")
                .requestsPerMinute(500)
                .tokensPerMinute(200_000)
                .maxContextTokens(128_000)
                .build();

        Langchain4jBackendInvoker invoker = factory.createInvoker(limits);

        assertEquals("openai/gpt-4o-mini", invoker.modelKey());
        assertSame(limits, invoker.getLimits());
    }

    private static GovernorProperties.ProviderProperties provider(String apiKey, String baseUrl) {
        GovernorProperties.ProviderProperties provider = new GovernorProperties.ProviderProperties();
        provider.setApiKey(apiKey);
        provider.setBaseUrl(baseUrl);
        return provider;
    }
}
