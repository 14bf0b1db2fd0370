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
import me.golemcore.governor.domain.model.ModelLimits;
import me.golemcore.governor.domain.model.RateLimitResult;
import me.golemcore.governor.domain.model.UsageSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Decides whether a call to a backend may start now, and how long to wait when
 * it may not.
 *
 * <p>
 * A call is ready when all of the following hold:
 * <ul>
 * <li><b>Window</b> - requests and tokens of the last 60 seconds plus this call
 * stay within the safe limits (published limit minus the safety margin)</li>
 * <li><b>Spacing</b> - at least {@code 60 / RPM} seconds passed since the last
 * call to the same model</li>
 * <li><b>Daily quota</b> - the optional requests-per-day counter is not used
 * up</li>
 * </ul>
 *
 * <p>
 * A call whose tokens exceed the safe token limit, or any call to a model whose
 * safe request limit is zero, can never become ready. It is reported as
 * {@linkplain RateLimitResult#isAdmissible() inadmissible} with a full-window
 * wait, and the blocking methods give up on it at once.
 *
 * <p>
 * {@link #tryAcquire} performs check and record under the model's lock, so
 * concurrent callers never both take the last slot of a window.
 *
 * @since 1.0
 * @see UsageLedger
 */
@Slf4j
public class RateLimitScheduler {

    public static final int DEFAULT_SAFETY_MARGIN = 2;

    private static final Duration MIN_POLL_INTERVAL = Duration.ofMillis(10);

    private final UsageLedger ledger;
    private final Map<String, ModelLimits> limitsByModel;
    private final int safetyMargin;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Map<String, Instant> lastCallAt = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public RateLimitScheduler(UsageLedger ledger, Map<String, ModelLimits> limitsByModel) {
        this(ledger, limitsByModel, DEFAULT_SAFETY_MARGIN, Clock.systemUTC(), Sleeper.system());
    }

    public RateLimitScheduler(UsageLedger ledger, Map<String, ModelLimits> limitsByModel, int safetyMargin,
            Clock clock, Sleeper sleeper) {
        if (safetyMargin < 0) {
            throw new IllegalArgumentException("safetyMargin must be >= 0, got " + safetyMargin);
        }
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.limitsByModel = Map.copyOf(limitsByModel);
        this.safetyMargin = safetyMargin;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Check whether a call of {@code tokens} estimated tokens may start now.
     */
    public RateLimitResult canProceed(String modelKey, int tokens) {
        ModelLimits limits = limitsByModel.get(modelKey);
        if (limits == null) {
            log.debug("[RateLimit] No limits configured for {}, allowing", modelKey);
            return RateLimitResult.allowed();
        }
        synchronized (lockFor(modelKey)) {
            return evaluate(modelKey, limits, Math.max(0, tokens));
        }
    }

    /**
     * Record a call that has just started.
     */
    public void recordRequest(String modelKey, int tokens) {
        synchronized (lockFor(modelKey)) {
            ledger.record(modelKey, tokens);
            lastCallAt.put(modelKey, clock.instant());
        }
    }

    /**
     * Check and record atomically. Returns the check result; the call is recorded
     * only when it is allowed.
     */
    public RateLimitResult tryAcquire(String modelKey, int tokens) {
        synchronized (lockFor(modelKey)) {
            RateLimitResult result = canProceed(modelKey, tokens);
            if (result.isAllowed()) {
                recordRequest(modelKey, tokens);
            }
            return result;
        }
    }

    /**
     * Block until a call may start or until {@code maxWait} would be exceeded.
     *
     * @return {@code true} if ready, {@code false} on timeout or interrupt
     */
    public boolean waitUntilReady(String modelKey, int tokens, Duration maxWait) {
        return await(modelKey, maxWait, () -> canProceed(modelKey, tokens));
    }

    /**
     * Like {@link #waitUntilReady} but records the call once ready.
     */
    public boolean acquire(String modelKey, int tokens, Duration maxWait) {
        return await(modelKey, maxWait, () -> tryAcquire(modelKey, tokens));
    }

    public UsageSnapshot getStatus(String modelKey) {
        ModelLimits limits = limitsByModel.get(modelKey);
        UsageLedger.Usage usage = ledger.usage(modelKey);
        int requestLimit = limits != null ? limits.getRequestsPerMinute() : 0;
        int tokenLimit = limits != null ? limits.getTokensPerMinute() : 0;
        int safeRequests = safeLimit(requestLimit);
        int safeTokens = safeLimit(tokenLimit);
        boolean atCapacity = limits != null
                && (usage.requests() >= safeRequests || usage.tokens() >= safeTokens);
        return UsageSnapshot.builder()
                .modelKey(modelKey)
                .currentRequests(usage.requests())
                .currentTokens(usage.tokens())
                .requestLimit(requestLimit)
                .tokenLimit(tokenLimit)
                .safeRequestLimit(safeRequests)
                .safeTokenLimit(safeTokens)
                .requestsToday(ledger.requestsToday(modelKey))
                .requestsPerDay(limits != null ? limits.getRequestsPerDay() : null)
                .atCapacity(atCapacity)
                .build();
    }

    public int getSafetyMargin() {
        return safetyMargin;
    }

    private boolean await(String modelKey, Duration maxWait, Supplier<RateLimitResult> check) {
        Instant deadline = clock.instant().plus(maxWait);
        while (true) {
            RateLimitResult result = check.get();
            if (result.isAllowed()) {
                return true;
            }
            if (!result.isAdmissible()) {
                log.debug("[RateLimit] {} can never admit this call ({})", modelKey, result.getReason());
                return false;
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero() || result.getWaitTime().compareTo(remaining) > 0) {
                log.debug("[RateLimit] {} not ready within {}ms ({}, wait {}ms)", modelKey, maxWait.toMillis(),
                        result.getReason(), result.getWaitTime().toMillis());
                return false;
            }
            Duration pause = result.getWaitTime().compareTo(MIN_POLL_INTERVAL) < 0
                    ? MIN_POLL_INTERVAL
                    : result.getWaitTime();
            if (pause.compareTo(remaining) > 0) {
                pause = remaining;
            }
            log.debug("[RateLimit] Waiting {}ms for {} ({})", pause.toMillis(), modelKey, result.getReason());
            try {
                sleeper.sleep(pause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[RateLimit] Interrupted while waiting for {}", modelKey);
                return false;
            }
        }
    }

    private RateLimitResult evaluate(String modelKey, ModelLimits limits, int tokens) {
        Instant now = clock.instant();
        List<UsageEvent> events = ledger.events(modelKey);
        List<String> reasons = new ArrayList<>();
        Duration wait = Duration.ZERO;
        boolean admissible = true;

        Instant last = lastCallAt.get(modelKey);
        if (last != null) {
            Duration spacing = Duration.ofNanos(limits.minSpacingNanos());
            Duration elapsed = Duration.between(last, now);
            if (elapsed.compareTo(spacing) < 0) {
                wait = max(wait, spacing.minus(elapsed));
                reasons.add("spacing");
            }
        }

        int safeRequests = safeLimit(limits.getRequestsPerMinute());
        if (safeRequests == 0) {
            admissible = false;
        }
        if (events.size() + 1 > safeRequests) {
            int mustExpire = events.size() + 1 - safeRequests;
            wait = max(wait, untilExpired(events, mustExpire, now));
            reasons.add("requests " + events.size() + "/" + safeRequests);
        }

        int safeTokens = safeLimit(limits.getTokensPerMinute());
        long windowTokens = 0;
        for (UsageEvent event : events) {
            windowTokens += event.tokens();
        }
        if (tokens > safeTokens) {
            admissible = false;
        }
        if (windowTokens + tokens > safeTokens) {
            wait = max(wait, untilTokensFreed(events, windowTokens + tokens - safeTokens, tokens, safeTokens, now));
            reasons.add("tokens " + windowTokens + "+" + tokens + "/" + safeTokens);
        }

        if (limits.hasDailyQuota() && ledger.requestsToday(modelKey) >= limits.getRequestsPerDay()) {
            Instant resetAt = ledger.dailyResetAt(modelKey);
            if (resetAt != null) {
                wait = max(wait, Duration.between(now, resetAt));
            }
            reasons.add("daily quota " + limits.getRequestsPerDay());
        }

        if (reasons.isEmpty()) {
            return RateLimitResult.allowed();
        }
        String reason = String.join(", ", reasons);
        return admissible ? RateLimitResult.denied(wait, reason) : RateLimitResult.inadmissible(wait, reason);
    }

    private int safeLimit(int limit) {
        return Math.max(0, limit - safetyMargin);
    }

    private Duration untilExpired(List<UsageEvent> events, int count, Instant now) {
        if (count > events.size() || count <= 0) {
            return UsageLedger.WINDOW;
        }
        return expiryOf(events.get(count - 1), now);
    }

    private Duration untilTokensFreed(List<UsageEvent> events, long excess, int tokens, int safeTokens,
            Instant now) {
        if (tokens > safeTokens) {
            return UsageLedger.WINDOW;
        }
        long freed = 0;
        for (UsageEvent event : events) {
            freed += event.tokens();
            if (freed >= excess) {
                return expiryOf(event, now);
            }
        }
        return UsageLedger.WINDOW;
    }

    private Duration expiryOf(UsageEvent event, Instant now) {
        return Duration.between(now, event.timestamp().plus(UsageLedger.WINDOW));
    }

    private Object lockFor(String modelKey) {
        return locks.computeIfAbsent(modelKey, key -> new Object());
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
