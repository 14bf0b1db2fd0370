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

import java.time.Duration;

/**
 * The rate-limit window of a backend did not clear within the maximum wait.
 * Only ever seen as the cause of a candidate failure inside
 * {@link AllBackendsExhaustedException}.
 */
public class RateLimitWaitTimeoutException extends GovernorException {

    private static final long serialVersionUID = 1L;

    private final String modelKey;
    private final transient Duration maxWait;

    public RateLimitWaitTimeoutException(String modelKey, Duration maxWait) {
        super("Rate limit for " + modelKey + " did not clear within " + maxWait.toMillis() + "ms");
        this.modelKey = modelKey;
        this.maxWait = maxWait;
    }

    public String getModelKey() {
        return modelKey;
    }

    public Duration getMaxWait() {
        return maxWait;
    }
}
