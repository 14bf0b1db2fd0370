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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Tries the cheapest candidate first, by average of input and output cost per
 * token. Candidates without pricing go last; ties keep configured order.
 */
public class CostOptimizedFallbackStrategy implements FallbackStrategy {

    @Override
    public <P, R> List<BackendDescriptor<P, R>> order(List<BackendDescriptor<P, R>> candidates,
            AttemptContext context) {
        List<BackendDescriptor<P, R>> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingDouble(CostOptimizedFallbackStrategy::costPerToken));
        return List.copyOf(ordered);
    }

    static double costPerToken(BackendDescriptor<?, ?> backend) {
        if (!backend.hasPricing()) {
            return Double.POSITIVE_INFINITY;
        }
        return backend.getPricing().averageCostPerToken();
    }

    @Override
    public String getName() {
        return "cost_optimized";
    }
}
