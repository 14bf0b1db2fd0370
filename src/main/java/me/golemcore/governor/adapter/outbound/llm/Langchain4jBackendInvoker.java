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
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.governor.domain.model.CallUsage;
import me.golemcore.governor.domain.model.ModelLimits;
import me.golemcore.governor.port.outbound.BackendInvoker;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link BackendInvoker} over a langchain4j {@link ChatModel}.
 *
 * <p>
 * The wrapped model should be built with retries disabled: a failed call is
 * handed back to the router, which moves on to the next backend instead of
 * retrying the same one.
 *
 * @since 1.0
 * @see ChatModelFactory
 */
@Slf4j
public class Langchain4jBackendInvoker implements BackendInvoker<ChatRequest, ChatResponse> {

    private final ChatModel chatModel;
    private final ModelLimits limits;

    public Langchain4jBackendInvoker(ChatModel chatModel, ModelLimits limits) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    @Override
    public ChatResponse invoke(ChatRequest request) {
        log.trace("[LLM] Calling {} with {} messages", limits.modelKey(), request.messages().size());
        return chatModel.chat(request);
    }

    @Override
    public Optional<CallUsage> usageOf(ChatResponse response) {
        TokenUsage usage = response != null ? response.tokenUsage() : null;
        if (usage == null) {
            return Optional.empty();
        }
        return Optional.of(new CallUsage(orZero(usage.inputTokenCount()), orZero(usage.outputTokenCount())));
    }

    @Override
    public String getProvider() {
        return limits.getProvider();
    }

    @Override
    public String getModelName() {
        return limits.getModelName();
    }

    @Override
    public ModelLimits getLimits() {
        return limits;
    }

    public String modelKey() {
        return limits.modelKey();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
