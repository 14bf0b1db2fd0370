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

/**
 * Why one candidate did not produce a response during a routed call.
 */
public record CandidateFailure(String modelKey, FailureKind kind, String message, Throwable cause) {

    public static CandidateFailure of(String modelKey, FailureKind kind, String message) {
        return new CandidateFailure(modelKey, kind, message, null);
    }

    public static CandidateFailure of(String modelKey, FailureKind kind, Throwable cause) {
        return new CandidateFailure(modelKey, kind, cause.getMessage(), cause);
    }

    @Override
    public String toString() {
        return modelKey + ": " + kind + " (" + message + ")";
    }
}
