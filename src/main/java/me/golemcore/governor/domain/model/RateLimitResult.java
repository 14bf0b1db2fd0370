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

import java.time.Duration;

/**
 * Result of a scheduler readiness check.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether the call may proceed now</li>
 * <li>{@code waitTime} - if denied, how long to wait before the next check
 * (never negative, {@link Duration#ZERO} when allowed)</li>
 * <li>{@code reason} - explanation for denial</li>
 * <li>{@code admissible} - {@code false} when waiting can never make the call
 * ready, e.g. it needs more tokens than the per-minute limit allows</li>
 * </ul>
 *
 * <p>
 * Factory methods {@link #allowed()}, {@link #denied(Duration, String)} and
 * {@link #inadmissible(Duration, String)} provide convenient result
 * construction.
 *
 * @since 1.0
 */
@Value
@Builder
public class RateLimitResult {

    private static final RateLimitResult ALLOWED = RateLimitResult.builder()
            .allowed(true)
            .admissible(true)
            .waitTime(Duration.ZERO)
            .build();

    boolean allowed;
    Duration waitTime;
    String reason;
    boolean admissible;

    public static RateLimitResult allowed() {
        return ALLOWED;
    }

    public static RateLimitResult denied(Duration waitTime, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .admissible(true)
                .waitTime(clamp(waitTime))
                .reason(reason)
                .build();
    }

    /**
     * Denied for good: no amount of waiting admits the call.
     */
    public static RateLimitResult inadmissible(Duration waitTime, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .admissible(false)
                .waitTime(clamp(waitTime))
                .reason(reason)
                .build();
    }

    /**
     * Wait time in (fractional) seconds.
     */
    public double waitSeconds() {
        return waitTime.toNanos() / 1_000_000_000.0;
    }

    private static Duration clamp(Duration waitTime) {
        return waitTime == null || waitTime.isNegative() ? Duration.ZERO : waitTime;
    }
}
