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

package me.golemcore.governor.domain.exception;

import java.util.Locale;

/**
 * No configured backend has a context window large enough for the payload.
 */
public class ContextTooLargeException extends GovernorException {

    private static final long serialVersionUID = 1L;

    private final int estimatedTokens;
    private final int maxAvailableContext;

    public ContextTooLargeException(int estimatedTokens, int maxAvailableContext) {
        super(String.format(Locale.ROOT,
                "Input is too large (%,d tokens) for any available model. Maximum supported context: %,d tokens",
                estimatedTokens, maxAvailableContext));
        this.estimatedTokens = estimatedTokens;
        this.maxAvailableContext = maxAvailableContext;
    }

    public int getEstimatedTokens() {
        return estimatedTokens;
    }

    public int getMaxAvailableContext() {
        return maxAvailableContext;
    }
}
