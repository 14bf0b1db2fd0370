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

package me.golemcore.governor.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Published limits of a single backend model.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code requestsPerMinute} - provider RPM limit</li>
 * <li>{@code tokensPerMinute} - provider TPM limit</li>
 * <li>{@code maxContextTokens} - context window size (input + output)</li>
 * <li>{@code requestsPerDay} - optional daily request quota, {@code null} when
 * the provider has none</li>
 * </ul>
 *
 * <p>
 * Instances are immutable and created once per configured backend.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
public class ModelLimits {

    private static final String KEY_SEPARATOR = "/";

    String provider;
    String modelName;
    int requestsPerMinute;
    int tokensPerMinute;
    int maxContextTokens;
    Integer requestsPerDay;

    /**
     * Key used by the ledger, scheduler and budget: {@code provider/model}.
     */
    public String modelKey() {
        return modelKey(provider, modelName);
    }

    public static String modelKey(String provider, String modelName) {
        return provider + KEY_SEPARATOR + modelName;
    }

    /**
     * Minimum spacing between two calls, {@code 60 / RPM} seconds, in nanoseconds.
     */
    public long minSpacingNanos() {
        if (requestsPerMinute <= 0) {
            return 0L;
        }
        return 60_000_000_000L / requestsPerMinute;
    }

    public boolean hasDailyQuota() {
        return requestsPerDay != null && requestsPerDay > 0;
    }
}
