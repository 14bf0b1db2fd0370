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
 * Current sliding-window usage of one backend against its limits.
 *
 * <p>
 * {@code atCapacity} is {@code true} when either window dimension has reached
 * its safe limit.
 *
 * @since 1.0
 */
@Value
@Builder
public class UsageSnapshot {

    String modelKey;
    int currentRequests;
    long currentTokens;
    int requestLimit;
    int tokenLimit;
    int safeRequestLimit;
    int safeTokenLimit;
    int requestsToday;
    Integer requestsPerDay;
    boolean atCapacity;
}
