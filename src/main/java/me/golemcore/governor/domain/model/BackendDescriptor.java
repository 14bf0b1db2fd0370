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

import me.golemcore.governor.port.outbound.BackendInvoker;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A configured backend: identity, invoke capability, limits and (optional)
 * pricing.
 *
 * @param <P>
 *            payload type
 * @param <R>
 *            response type
 * @since 1.0
 */
@Value
@Builder
public class BackendDescriptor<P, R> {

    @NonNull
    String provider;
    @NonNull
    String modelName;
    @NonNull
    BackendInvoker<P, R> invoker;
    @NonNull
    ModelLimits limits;
    ModelPricing pricing;

    public static <P, R> BackendDescriptor<P, R> of(BackendInvoker<P, R> invoker, ModelPricing pricing) {
        return BackendDescriptor.<P, R>builder()
                .provider(invoker.getProvider())
                .modelName(invoker.getModelName())
                .invoker(invoker)
                .limits(invoker.getLimits())
                .pricing(pricing)
                .build();
    }

    public String modelKey() {
        return ModelLimits.modelKey(provider, modelName);
    }

    public int maxContextTokens() {
        return limits.getMaxContextTokens();
    }

    public boolean hasPricing() {
        return pricing != null;
    }

    @Override
    public String toString() {
        return modelKey();
    }
}
