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

import java.time.Duration;

/**
 * Result of one backend invocation, used to update budget and health state.
 * Not persisted.
 */
@Value
@Builder
public class CallOutcome {

    String modelKey;
    int tokensUsed;
    double cost;
    boolean success;
    FailureKind failureKind;
    Duration latency;

    public static CallOutcome success(String modelKey, int tokensUsed, double cost, Duration latency) {
        return CallOutcome.builder()
                .modelKey(modelKey)
                .tokensUsed(tokensUsed)
                .cost(cost)
                .success(true)
                .latency(latency)
                .build();
    }

    public static CallOutcome failure(String modelKey, Duration latency) {
        return CallOutcome.builder()
                .modelKey(modelKey)
                .success(false)
                .failureKind(FailureKind.INVOCATION_ERROR)
                .latency(latency)
                .build();
    }
}
