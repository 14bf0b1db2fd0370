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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Primary backend followed by fallbacks in configured order.
 */
public record FallbackChain<P, R>(BackendDescriptor<P, R> primary, List<BackendDescriptor<P, R>> fallbacks) {

    public FallbackChain {
        Objects.requireNonNull(primary, "primary");
        fallbacks = fallbacks == null ? List.of() : List.copyOf(fallbacks);
    }

    /**
     * {@code [primary] + fallbacks}.
     */
    public List<BackendDescriptor<P, R>> candidates() {
        List<BackendDescriptor<P, R>> all = new ArrayList<>(fallbacks.size() + 1);
        all.add(primary);
        all.addAll(fallbacks);
        return List.copyOf(all);
    }

    public boolean isPrimary(BackendDescriptor<P, R> backend) {
        return primary.modelKey().equals(backend.modelKey());
    }
}
