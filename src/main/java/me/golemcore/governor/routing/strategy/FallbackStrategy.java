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

import me.golemcore.governor.domain.model.AttemptContext;
import me.golemcore.governor.domain.model.BackendDescriptor;

import java.util.List;

/**
 * Orders the candidates of a routed call.
 *
 * <p>
 * Implementations must be deterministic and must not drop or add candidates.
 * The router asks again after every failed attempt, passing only the
 * candidates not tried yet and the last failure in the context.
 *
 * @since 1.0
 * @see FallbackStrategies
 */
public interface FallbackStrategy {

    <P, R> List<BackendDescriptor<P, R>> order(List<BackendDescriptor<P, R>> candidates, AttemptContext context);

    String getName();
}
