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
 * Machine-readable reason a candidate backend was skipped or failed.
 *
 * <p>
 * This exists to avoid relying on string matching in error messages.
 */
public enum FailureKind {

    /**
     * The payload does not fit in the backend's context window.
     */
    CONTEXT_TOO_LARGE,

    /**
     * A hard budget cannot afford the estimated cost of the call.
     */
    BUDGET_EXCEEDED,

    /**
     * The rate-limit window did not clear within the maximum wait.
     */
    RATE_LIMIT_TIMEOUT,

    /**
     * The backend was called and failed.
     */
    INVOCATION_ERROR
}
