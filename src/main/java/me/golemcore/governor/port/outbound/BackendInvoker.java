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

package me.golemcore.governor.port.outbound;

import me.golemcore.governor.domain.model.CallUsage;
import me.golemcore.governor.domain.model.ModelLimits;

import java.util.Optional;

/**
 * Port for a single backend model the router can call.
 *
 * <p>
 * Implemented by the host application (or by
 * {@link me.golemcore.governor.adapter.outbound.llm.Langchain4jBackendInvoker}).
 * The router never calls {@link #invoke(Object)} concurrently for the same
 * logical request, but may call it from several threads for different
 * requests.
 *
 * @param <P>
 *            payload type
 * @param <R>
 *            response type
 * @since 1.0
 */
public interface BackendInvoker<P, R> {

    /**
     * Call the backend. Any exception is treated as a failure of this backend
     * and the router moves on to the next candidate.
     */
    R invoke(P payload) throws Exception;

    String getProvider();

    String getModelName();

    ModelLimits getLimits();

    /**
     * Token usage reported by the backend for a response, if known. When empty
     * the router accounts the estimated input tokens instead.
     */
    default Optional<CallUsage> usageOf(R response) {
        return Optional.empty();
    }
}
