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

package me.golemcore.governor.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-backend sliding-window counters of requests and tokens.
 *
 * <p>
 * Each model key owns a {@code UsageWindow}: an ordered deque of
 * {@link UsageEvent}s plus a running token sum. Only events younger than
 * {@link #WINDOW} are current. Expired events are evicted lazily on every read
 * or write of that window, there is no background timer.
 *
 * <p>
 * Every window also keeps a daily request counter that restarts
 * {@link #DAY} after its first request, used for providers with daily quotas.
 *
 * <p>
 * Windows are stored in a concurrent map and each window serializes its own
 * evict-then-count sequence, so different backends never contend on the same
 * lock.
 *
 * @since 1.0
 * @see RateLimitScheduler
 */
@Slf4j
public class UsageLedger {

    public static final Duration WINDOW = Duration.ofSeconds(60);
    public static final Duration DAY = Duration.ofDays(1);

    private final Clock clock;
    private final Map<String, UsageWindow> windows = new ConcurrentHashMap<>();

    public UsageLedger() {
        this(Clock.systemUTC());
    }

    public UsageLedger(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Append a usage event at the current time.
     */
    public void record(String modelKey, int tokens) {
        windows.computeIfAbsent(modelKey, key -> new UsageWindow()).add(clock.instant(), Math.max(0, tokens));
    }

    /**
     * Requests and tokens recorded for the model within the last 60 seconds.
     */
    public Usage usage(String modelKey) {
        UsageWindow window = windows.get(modelKey);
        if (window == null) {
            return Usage.ZERO;
        }
        return window.usage(clock.instant());
    }

    /**
     * Current events, oldest first.
     */
    public List<UsageEvent> events(String modelKey) {
        UsageWindow window = windows.get(modelKey);
        if (window == null) {
            return List.of();
        }
        return window.events(clock.instant());
    }

    public int requestsToday(String modelKey) {
        UsageWindow window = windows.get(modelKey);
        if (window == null) {
            return 0;
        }
        return window.requestsToday(clock.instant());
    }

    /**
     * Instant the daily counter restarts, or {@code null} if the model has no
     * requests today.
     */
    public Instant dailyResetAt(String modelKey) {
        UsageWindow window = windows.get(modelKey);
        if (window == null) {
            return null;
        }
        return window.dailyResetAt(clock.instant());
    }

    public Set<String> modelKeys() {
        return Set.copyOf(windows.keySet());
    }

    public void reset(String modelKey) {
        windows.remove(modelKey);
    }

    public void clear() {
        windows.clear();
        log.debug("[RateLimit] Usage ledger cleared");
    }

    /**
     * Window counts at one instant.
     */
    public record Usage(int requests, long tokens) {
        public static final Usage ZERO = new Usage(0, 0L);
    }

    private static final class UsageWindow {

        private final Deque<UsageEvent> events = new ArrayDeque<>();
        private long tokenSum;
        private int dailyRequests;
        private Instant dailyStart;

        synchronized void add(Instant now, int tokens) {
            evict(now);
            events.addLast(new UsageEvent(now, tokens));
            tokenSum += tokens;
            rollDay(now);
            if (dailyStart == null) {
                dailyStart = now;
            }
            dailyRequests++;
        }

        synchronized Usage usage(Instant now) {
            evict(now);
            return new Usage(events.size(), tokenSum);
        }

        synchronized List<UsageEvent> events(Instant now) {
            evict(now);
            return List.copyOf(events);
        }

        synchronized int requestsToday(Instant now) {
            rollDay(now);
            return dailyRequests;
        }

        synchronized Instant dailyResetAt(Instant now) {
            rollDay(now);
            return dailyStart == null ? null : dailyStart.plus(DAY);
        }

        private void evict(Instant now) {
            Instant cutoff = now.minus(WINDOW);
            while (!events.isEmpty() && !events.peekFirst().timestamp().isAfter(cutoff)) {
                tokenSum -= events.pollFirst().tokens();
            }
        }

        private void rollDay(Instant now) {
            if (dailyStart != null && !now.isBefore(dailyStart.plus(DAY))) {
                dailyStart = null;
                dailyRequests = 0;
            }
        }
    }
}
