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
 * Counters of routed calls since the router was built.
 */
@Value
@Builder
public class RouterStats {

    long totalRequests;
    long primaryRequests;
    long fallbackRequests;
    long rateLimitFallbacks;
    long contextFallbacks;
    long budgetSkips;
    long invocationFailures;
    long exhausted;

    public double primaryUsagePercent() {
        return percentOfTotal(primaryRequests);
    }

    public double fallbackUsagePercent() {
        return percentOfTotal(fallbackRequests);
    }

    private double percentOfTotal(long value) {
        if (totalRequests == 0) {
            return 0.0;
        }
        return value * 100.0 / totalRequests;
    }
}
