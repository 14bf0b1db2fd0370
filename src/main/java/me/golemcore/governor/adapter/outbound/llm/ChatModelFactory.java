/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.governor.adapter.outbound.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.governor.domain.exception.RouterConfigurationException;
import me.golemcore.governor.domain.model.ModelLimits;
import me.golemcore.governor.infrastructure.config.GovernorProperties;

/**
 * Builds langchain4j chat models for catalog backends from
 * {@code governor.providers.*} credentials.
 *
 * <p>
 * Every provider is reached through an OpenAI-compatible endpoint. Anthropic
 * defaults to its compatibility endpoint; other non-OpenAI providers need
 * {@code base-url}. Client retries are disabled because the router falls back
 * instead.
 *
 * @since 1.0
 */
@RequiredArgsConstructor
@Slf4j
public class ChatModelFactory {

    static final String ANTHROPIC_BASE_URL = "https://api.anthropic.com/v1/";

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final int ANTHROPIC_MAX_TOKENS = 4096;

    private final GovernorProperties properties;

    public Langchain4jBackendInvoker createInvoker(ModelLimits limits) {
        return new Langchain4jBackendInvoker(createModel(limits.getProvider(), limits.getModelName()), limits);
    }

    public ChatModel createModel(String provider, String modelName) {
        GovernorProperties.ProviderProperties config = getProviderConfig(provider);
        log.debug("[LLM] Creating chat model {}/{}", provider, modelName);
        return createOpenAiModel(provider, modelName, config);
    }

    static String baseUrlFor(String provider, GovernorProperties.ProviderProperties config) {
        if (config.getBaseUrl() != null) {
            return config.getBaseUrl();
        }
        return PROVIDER_ANTHROPIC.equals(provider) ? ANTHROPIC_BASE_URL : null;
    }

    private GovernorProperties.ProviderProperties getProviderConfig(String provider) {
        GovernorProperties.ProviderProperties config = properties.getProviders().get(provider);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new RouterConfigurationException("Provider not configured: " + provider
                    + ". Add governor.providers." + provider + ".api-key");
        }
        return config;
    }

    private ChatModel createOpenAiModel(String provider, String modelName,
            GovernorProperties.ProviderProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .timeout(properties.getTimeout());
        String baseUrl = baseUrlFor(provider, config);
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        if (PROVIDER_ANTHROPIC.equals(provider)) {
            // Anthropic rejects requests without max_tokens
            builder.maxTokens(ANTHROPIC_MAX_TOKENS);
        }
        return builder.build();
    }
}
