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
 * What a fallback strategy knows about the call being routed.
 *
 * <p>
 * {@code lastFailure} is {@code null} on the first ordering of a call.
 */
@Value
@Builder
public class AttemptContext {

    int estimatedTokens;
    int attempt;
    CandidateFailure lastFailure;

    public static AttemptContext initial(int estimatedTokens) {
        return AttemptContext.builder()
                .estimatedTokens(estimatedTokens)
                .attempt(0)
                .build();
    }

    public AttemptContext next(CandidateFailure failure) {
        return AttemptContext.builder()
                .estimatedTokens(estimatedTokens)
                .attempt(attempt + 1)
                .lastFailure(failure)
                .build();
    }

    public boolean failedWith(FailureKind kind) {
        return lastFailure != null && lastFailure.kind() == kind;
    }
}
