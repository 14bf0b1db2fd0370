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

package me.golemcore.governor.routing.strategy;

import dev.langchain4j.exception.RateLimitException;

import java.util.List;

/**
 * Recognizes provider rate-limit errors anywhere in a cause chain.
 */
public final class RateLimitErrors {

    private static final List<String> MARKERS = List.of("rate_limit", "rate limit", "token_quota_exceeded",
            "too_many_tokens", "Too Many Requests", "429", "model_cooldown", "cooling down");

    private RateLimitErrors() {
    }

    public static boolean isRateLimitError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException
            if (current instanceof RateLimitException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && MARKERS.stream().anyMatch(message::contains)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
