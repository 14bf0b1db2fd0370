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

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.ChatRequest;
import me.golemcore.governor.context.TokenEstimator;

/**
 * Estimates the input tokens of a chat request from the text of its messages
 * and tool specifications, four characters per token.
 */
public class ChatRequestTokenEstimator implements TokenEstimator<ChatRequest> {

    @Override
    public int estimate(ChatRequest request) {
        if (request == null) {
            return 0;
        }
        long chars = 0;
        for (ChatMessage message : request.messages()) {
            chars += textLength(message);
        }
        if (request.toolSpecifications() != null) {
            for (ToolSpecification tool : request.toolSpecifications()) {
                chars += length(tool.name()) + length(tool.description());
            }
        }
        return (int) Math.min(Integer.MAX_VALUE, chars / CHARS_PER_TOKEN);
    }

    private static long textLength(ChatMessage message) {
        if (message instanceof SystemMessage system) {
            return length(system.text());
        }
        if (message instanceof UserMessage user) {
            long chars = 0;
            for (Content content : user.contents()) {
                if (content instanceof TextContent text) {
                    chars += length(text.text());
                }
            }
            return chars;
        }
        if (message instanceof AiMessage ai) {
            long chars = length(ai.text());
            if (ai.hasToolExecutionRequests()) {
                for (ToolExecutionRequest request : ai.toolExecutionRequests()) {
                    chars += length(request.name()) + length(request.arguments());
                }
            }
            return chars;
        }
        if (message instanceof ToolExecutionResultMessage result) {
            return length(result.text());
        }
        return length(String.valueOf(message));
    }

    private static int length(String text) {
        return text != null ? text.length() : 0;
    }
}
