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

import java.util.Map;

/**
 * Introspection view of a router for health endpoints: per-backend window usage
 * (keyed by model key, in candidate order), per-period budget status and call
 * counters.
 *
 * @since 1.0
 */
@Value
@Builder
public class RouterStatus {

    String primaryModel;
    String strategy;
    Map<String, UsageSnapshot> usage;
    Map<BudgetPeriod, BudgetStatus> budgets;
    RouterStats stats;
}
