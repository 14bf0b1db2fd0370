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

package me.golemcore.governor.routing;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.governor.budget.BudgetEnforcer;
import me.golemcore.governor.context.ContextFitPolicy;
import me.golemcore.governor.domain.exception.AllBackendsExhaustedException;
import me.golemcore.governor.domain.exception.BackendInvocationException;
import me.golemcore.governor.domain.exception.BudgetExceededException;
import me.golemcore.governor.domain.exception.ContextTooLargeException;
import me.golemcore.governor.domain.exception.RateLimitWaitTimeoutException;
import me.golemcore.governor.domain.model.AttemptContext;
import me.golemcore.governor.domain.model.BackendDescriptor;
import me.golemcore.governor.domain.model.CallOutcome;
import me.golemcore.governor.domain.model.CallUsage;
import me.golemcore.governor.domain.model.CandidateFailure;
import me.golemcore.governor.domain.model.FailureKind;
import me.golemcore.governor.domain.model.FallbackChain;
import me.golemcore.governor.domain.model.FallbackEvent;
import me.golemcore.governor.domain.model.RouterStats;
import me.golemcore.governor.domain.model.RouterStatus;
import me.golemcore.governor.domain.model.UsageSnapshot;
import me.golemcore.governor.ratelimit.RateLimitScheduler;
import me.golemcore.governor.routing.strategy.BackendHealthTracker;
import me.golemcore.governor.routing.strategy.FallbackStrategy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes a payload to the first backend of a fallback chain that can take it.
 *
 * <p>
 * For every candidate, in the order given by the {@link FallbackStrategy}:
 * <ol>
 * <li>check the estimated tokens against the backend's context window</li>
 * <li>check the estimated cost against hard budgets</li>
 * <li>wait (bounded) for the backend's rate-limit window and reserve a slot</li>
 * <li>invoke the backend and account its cost</li>
 * </ol>
 * A failing step moves on to the next candidate. The strategy is asked again
 * after every failure with the candidates not tried yet, so each backend is
 * tried at most once per call.
 *
 * <p>
 * When no chain backend can hold the payload, the smallest configured backend
 * that can (including large-context backends registered with the builder) is
 * tried last.
 *
 * <p>
 * Instances are built with {@link RouterBuilder} and are safe for concurrent
 * callers.
 *
 * @param <P>
 *            payload type
 * @param <R>
 *            response type
 * @since 1.0
 */
@Slf4j
public class Router<P, R> {

    private final FallbackChain<P, R> chain;
    private final List<BackendDescriptor<P, R>> largeContextBackends;
    private final FallbackStrategy strategy;
    private final ContextFitPolicy<P> contextPolicy;
    private final RateLimitScheduler scheduler;
    private final BudgetEnforcer budget;
    private final BackendHealthTracker healthTracker;
    private final FallbackListener listener;
    private final Duration maxWait;
    private final Clock clock;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong primaryRequests = new AtomicLong();
    private final AtomicLong fallbackRequests = new AtomicLong();
    private final AtomicLong rateLimitFallbacks = new AtomicLong();
    private final AtomicLong contextFallbacks = new AtomicLong();
    private final AtomicLong budgetSkips = new AtomicLong();
    private final AtomicLong invocationFailures = new AtomicLong();
    private final AtomicLong exhausted = new AtomicLong();

    @SuppressWarnings("PMD.ExcessiveParameterList") // package-private, only called by RouterBuilder.build
    Router(FallbackChain<P, R> chain, List<BackendDescriptor<P, R>> largeContextBackends,
            FallbackStrategy strategy, ContextFitPolicy<P> contextPolicy, RateLimitScheduler scheduler,
            BudgetEnforcer budget, BackendHealthTracker healthTracker, FallbackListener listener,
            Duration maxWait, Clock clock) {
        this.chain = chain;
        this.largeContextBackends = List.copyOf(largeContextBackends);
        this.strategy = strategy;
        this.contextPolicy = contextPolicy;
        this.scheduler = scheduler;
        this.budget = budget;
        this.healthTracker = healthTracker;
        this.listener = listener;
        this.maxWait = maxWait;
        this.clock = clock;
    }

    public static <P, R> RouterBuilder<P, R> builder() {
        return new RouterBuilder<>();
    }

    /**
     * Send the payload to the first candidate that passes every check.
     *
     * @throws ContextTooLargeException
     *             if no configured backend can hold the payload
     * @throws BudgetExceededException
     *             if every candidate was skipped for budget
     * @throws AllBackendsExhaustedException
     *             if every candidate failed
     */
    public R invoke(P payload) {
        totalRequests.incrementAndGet();
        int estimatedTokens = contextPolicy.estimateTokens(payload);
        List<BackendDescriptor<P, R>> remaining = new ArrayList<>(chain.candidates());
        List<CandidateFailure> failures = new ArrayList<>();
        AttemptContext context = AttemptContext.initial(estimatedTokens);
        BudgetExceededException budgetError = null;
        boolean anyFit = false;

        while (!remaining.isEmpty()) {
            BackendDescriptor<P, R> candidate = strategy.order(remaining, context).get(0);
            remaining.remove(candidate);

            if (contextPolicy.isEnabled()) {
                if (contextPolicy.fits(estimatedTokens, candidate).fits()) {
                    anyFit = true;
                } else {
                    CandidateFailure failure = CandidateFailure.of(candidate.modelKey(),
                            FailureKind.CONTEXT_TOO_LARGE, new ContextTooLargeException(estimatedTokens,
                                    candidate.maxContextTokens()));
                    failures.add(failure);
                    context = context.next(failure);
                    if (!remaining.isEmpty() || anyFit) {
                        continue;
                    }
                    candidate = escalate(estimatedTokens);
                }
            }

            CandidateFailure failure;
            try {
                return attempt(candidate, payload, context, failures);
            } catch (BudgetExceededException e) {
                budgetSkips.incrementAndGet();
                budgetError = e;
                failure = CandidateFailure.of(candidate.modelKey(), FailureKind.BUDGET_EXCEEDED, e);
            } catch (RateLimitWaitTimeoutException e) {
                failure = CandidateFailure.of(candidate.modelKey(), FailureKind.RATE_LIMIT_TIMEOUT, e);
            } catch (BackendInvocationException e) {
                invocationFailures.incrementAndGet();
                failure = CandidateFailure.of(candidate.modelKey(), FailureKind.INVOCATION_ERROR, e);
            }
            log.warn("[Router] {} failed: {}", candidate.modelKey(), failure.message());
            failures.add(failure);
            context = context.next(failure);
        }

        exhausted.incrementAndGet();
        if (budgetError != null && failures.stream().allMatch(f -> f.kind() == FailureKind.BUDGET_EXCEEDED)) {
            log.warn("[Router] Every candidate blocked by budget");
            throw budgetError;
        }
        AllBackendsExhaustedException error = new AllBackendsExhaustedException(failures);
        log.error("[Router] {}", error.getMessage());
        throw error;
    }

    public RouterStatus status() {
        Map<String, UsageSnapshot> usage = new LinkedHashMap<>();
        for (BackendDescriptor<P, R> backend : allBackends()) {
            usage.put(backend.modelKey(), scheduler.getStatus(backend.modelKey()));
        }
        return RouterStatus.builder()
                .primaryModel(chain.primary().modelKey())
                .strategy(strategy.getName())
                .usage(usage)
                .budgets(budget.status())
                .stats(getStats())
                .build();
    }

    public RouterStats getStats() {
        return RouterStats.builder()
                .totalRequests(totalRequests.get())
                .primaryRequests(primaryRequests.get())
                .fallbackRequests(fallbackRequests.get())
                .rateLimitFallbacks(rateLimitFallbacks.get())
                .contextFallbacks(contextFallbacks.get())
                .budgetSkips(budgetSkips.get())
                .invocationFailures(invocationFailures.get())
                .exhausted(exhausted.get())
                .build();
    }

    public FallbackChain<P, R> getChain() {
        return chain;
    }

    public List<BackendDescriptor<P, R>> getLargeContextBackends() {
        return largeContextBackends;
    }

    public FallbackStrategy getStrategy() {
        return strategy;
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    public BudgetEnforcer getBudget() {
        return budget;
    }

    private R attempt(BackendDescriptor<P, R> candidate, P payload, AttemptContext context,
            List<CandidateFailure> failures) {
        String modelKey = candidate.modelKey();
        int estimatedTokens = context.getEstimatedTokens();

        if (budget.isConfigured()) {
            budget.ensureAffordable(estimatedCost(candidate, estimatedTokens));
        }

        if (!scheduler.acquire(modelKey, estimatedTokens, maxWait)) {
            throw new RateLimitWaitTimeoutException(modelKey, maxWait);
        }

        boolean primary = chain.isPrimary(candidate);
        if (!primary) {
            notifyFallback(candidate, context);
        }

        Instant started = clock.instant();
        R response;
        try {
            log.debug("[Router] Invoking {} (~{} tokens)", modelKey, estimatedTokens);
            response = candidate.getInvoker().invoke(payload);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            healthTracker.record(CallOutcome.failure(modelKey, Duration.between(started, clock.instant())));
            throw new BackendInvocationException(modelKey, e);
        } catch (Exception e) {
            healthTracker.record(CallOutcome.failure(modelKey, Duration.between(started, clock.instant())));
            throw new BackendInvocationException(modelKey, e);
        }
        Duration latency = Duration.between(started, clock.instant());
        Optional<CallUsage> usage = candidate.getInvoker().usageOf(response);
        CallOutcome outcome = CallOutcome.success(modelKey, usage.map(CallUsage::totalTokens).orElse(estimatedTokens),
                actualCost(candidate, usage, estimatedTokens), latency);
        healthTracker.record(outcome);
        recordCost(outcome);

        if (primary) {
            primaryRequests.incrementAndGet();
        } else {
            fallbackRequests.incrementAndGet();
            countFallbackReason(failures);
        }
        log.debug("[Router] {} answered in {}ms, {} tokens, ${}", modelKey, latency.toMillis(),
                outcome.getTokensUsed(), String.format(Locale.ROOT, "%.6f", outcome.getCost()));
        return response;
    }

    private BackendDescriptor<P, R> escalate(int estimatedTokens) {
        try {
            return contextPolicy.selectContextCapable(estimatedTokens, allBackends());
        } catch (ContextTooLargeException e) {
            exhausted.incrementAndGet();
            log.error("[Router] {}", e.getMessage());
            throw e;
        }
    }

    private void recordCost(CallOutcome outcome) {
        if (!budget.isConfigured()) {
            return;
        }
        try {
            budget.recordCost(outcome.getCost(), outcome.getModelKey());
        } catch (BudgetExceededException e) {
            // the call already happened; later calls are blocked by the pre-call check
            log.warn("[Budget] Response from {} pushed spend over budget: {}", outcome.getModelKey(),
                    e.getMessage());
        }
    }

    private void notifyFallback(BackendDescriptor<P, R> candidate, AttemptContext context) {
        CandidateFailure last = context.getLastFailure();
        FallbackEvent event = FallbackEvent.builder()
                .attemptedModel(last != null ? last.modelKey() : chain.primary().modelKey())
                .fallbackModel(candidate.modelKey())
                .reason(last != null ? last.kind().name().toLowerCase(Locale.ROOT) : "strategy_order")
                .estimatedTokens(context.getEstimatedTokens())
                .limits(candidate.getLimits())
                .timestamp(clock.instant())
                .build();
        log.info("[Router] Falling back from {} to {} ({})", event.attemptedModel(), event.fallbackModel(),
                event.reason());
        if (listener == null) {
            return;
        }
        try {
            listener.onFallback(event);
        } catch (RuntimeException e) {
            log.warn("[Router] Fallback listener failed: {}", e.getMessage(), e);
        }
    }

    private void countFallbackReason(List<CandidateFailure> failures) {
        if (failures.isEmpty()) {
            return;
        }
        FailureKind kind = failures.get(failures.size() - 1).kind();
        if (kind == FailureKind.RATE_LIMIT_TIMEOUT) {
            rateLimitFallbacks.incrementAndGet();
        } else if (kind == FailureKind.CONTEXT_TOO_LARGE) {
            contextFallbacks.incrementAndGet();
        }
    }

    private List<BackendDescriptor<P, R>> allBackends() {
        List<BackendDescriptor<P, R>> all = new ArrayList<>(chain.candidates());
        all.addAll(largeContextBackends);
        return all;
    }

    private static double estimatedCost(BackendDescriptor<?, ?> backend, int estimatedTokens) {
        return backend.hasPricing() ? backend.getPricing().cost(estimatedTokens, 0) : 0.0;
    }

    private static double actualCost(BackendDescriptor<?, ?> backend, Optional<CallUsage> usage,
            int estimatedTokens) {
        if (!backend.hasPricing()) {
            return 0.0;
        }
        return usage.map(u -> backend.getPricing().cost(u.inputTokens(), u.outputTokens()))
                .orElseGet(() -> backend.getPricing().cost(estimatedTokens, 0));
    }
}
