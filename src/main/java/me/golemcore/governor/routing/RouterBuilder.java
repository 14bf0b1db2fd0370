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
import me.golemcore.governor.context.TokenEstimator;
import me.golemcore.governor.domain.exception.RouterConfigurationException;
import me.golemcore.governor.domain.model.BackendDescriptor;
import me.golemcore.governor.domain.model.BudgetConfig;
import me.golemcore.governor.domain.model.BudgetPeriod;
import me.golemcore.governor.domain.model.FallbackChain;
import me.golemcore.governor.domain.model.ModelLimits;
import me.golemcore.governor.domain.model.ModelPricing;
import me.golemcore.governor.port.outbound.BackendInvoker;
import me.golemcore.governor.ratelimit.RateLimitScheduler;
import me.golemcore.governor.ratelimit.Sleeper;
import me.golemcore.governor.ratelimit.UsageLedger;
import me.golemcore.governor.routing.strategy.BackendHealthTracker;
import me.golemcore.governor.routing.strategy.FallbackStrategies;
import me.golemcore.governor.routing.strategy.FallbackStrategy;
import me.golemcore.governor.routing.strategy.FallbackStrategyKind;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fluent configuration of a {@link Router}.
 *
 * <p>
 * Defaults: sequential strategy, context fallback on, 300 second maximum rate
 * limit wait, safety margin of 2, character based token estimate, no budget.
 *
 * <pre>{@code
 * Router<ChatRequest, ChatResponse> router = Router.<ChatRequest, ChatResponse>builder()
 *         .withPrimary(gpt4o, gpt4oPricing)
 *         .withFallback(claude)
 *         .withBudget(BudgetConfig.of(10.0, BudgetPeriod.DAILY))
 *         .withFallbackStrategy(FallbackStrategyKind.SMART)
 *         .build();
 * }</pre>
 *
 * @param <P>
 *            payload type
 * @param <R>
 *            response type
 * @since 1.0
 */
@Slf4j
public class RouterBuilder<P, R> {

    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(300);

    private BackendDescriptor<P, R> primary;
    private final List<BackendDescriptor<P, R>> fallbacks = new ArrayList<>();
    private final List<BackendDescriptor<P, R>> largeContextBackends = new ArrayList<>();
    private final List<BudgetConfig> budgets = new ArrayList<>();
    private FallbackStrategyKind strategyKind = FallbackStrategyKind.SEQUENTIAL;
    private FallbackStrategy customStrategy;
    private boolean contextFallback = true;
    private Duration maxWait = DEFAULT_MAX_WAIT;
    private int safetyMargin = RateLimitScheduler.DEFAULT_SAFETY_MARGIN;
    private TokenEstimator<P> tokenEstimator = TokenEstimator.characterBased();
    private FallbackListener listener;
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = Sleeper.system();

    RouterBuilder() {
    }

    public RouterBuilder<P, R> withPrimary(BackendInvoker<P, R> invoker) {
        return withPrimary(invoker, null);
    }

    public RouterBuilder<P, R> withPrimary(BackendInvoker<P, R> invoker, ModelPricing pricing) {
        if (primary != null) {
            throw new RouterConfigurationException("Primary backend already set: " + primary.modelKey());
        }
        primary = describe(invoker, pricing);
        return this;
    }

    public RouterBuilder<P, R> withFallback(BackendInvoker<P, R> invoker) {
        return withFallback(invoker, null);
    }

    public RouterBuilder<P, R> withFallback(BackendInvoker<P, R> invoker, ModelPricing pricing) {
        fallbacks.add(describe(invoker, pricing));
        return this;
    }

    public RouterBuilder<P, R> withFallbacks(List<? extends BackendInvoker<P, R>> invokers) {
        invokers.forEach(this::withFallback);
        return this;
    }

    /**
     * Register a backend used only when no chain backend can hold a payload.
     */
    public RouterBuilder<P, R> withLargeContextBackend(BackendInvoker<P, R> invoker) {
        return withLargeContextBackend(invoker, null);
    }

    public RouterBuilder<P, R> withLargeContextBackend(BackendInvoker<P, R> invoker, ModelPricing pricing) {
        largeContextBackends.add(describe(invoker, pricing));
        return this;
    }

    public RouterBuilder<P, R> withBudget(BudgetConfig... configs) {
        budgets.addAll(List.of(configs));
        return this;
    }

    /**
     * Hard-limited budgets with the default warning threshold; {@code null}
     * leaves a period unlimited.
     */
    public RouterBuilder<P, R> withBudget(Double hourly, Double daily, Double monthly, Double total) {
        return withBudget(hourly, daily, monthly, total, true, BudgetConfig.DEFAULT_WARNING_THRESHOLD);
    }

    public RouterBuilder<P, R> withBudget(Double hourly, Double daily, Double monthly, Double total,
            boolean hardLimit, double warningThreshold) {
        addBudget(hourly, BudgetPeriod.HOURLY, hardLimit, warningThreshold);
        addBudget(daily, BudgetPeriod.DAILY, hardLimit, warningThreshold);
        addBudget(monthly, BudgetPeriod.MONTHLY, hardLimit, warningThreshold);
        addBudget(total, BudgetPeriod.TOTAL, hardLimit, warningThreshold);
        return this;
    }

    public RouterBuilder<P, R> withFallbackStrategy(FallbackStrategyKind kind) {
        this.strategyKind = Objects.requireNonNull(kind, "kind");
        this.customStrategy = null;
        return this;
    }

    public RouterBuilder<P, R> withFallbackStrategy(FallbackStrategy strategy) {
        this.customStrategy = Objects.requireNonNull(strategy, "strategy");
        return this;
    }

    public RouterBuilder<P, R> withContextFallback(boolean enabled) {
        this.contextFallback = enabled;
        return this;
    }

    public RouterBuilder<P, R> withMaxWait(Duration maxWait) {
        this.maxWait = maxWait;
        return this;
    }

    public RouterBuilder<P, R> withSafetyMargin(int safetyMargin) {
        this.safetyMargin = safetyMargin;
        return this;
    }

    public RouterBuilder<P, R> withTokenEstimator(TokenEstimator<P> tokenEstimator) {
        this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator");
        return this;
    }

    public RouterBuilder<P, R> withFallbackListener(FallbackListener listener) {
        this.listener = listener;
        return this;
    }

    public RouterBuilder<P, R> withClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    public RouterBuilder<P, R> withSleeper(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        return this;
    }

    /**
     * @throws RouterConfigurationException
     *             if no primary was set, a model key is configured twice, or a
     *             setting is out of range
     */
    public Router<P, R> build() {
        if (primary == null) {
            throw new RouterConfigurationException("Primary backend is required");
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new RouterConfigurationException("maxWait must be >= 0, got " + maxWait);
        }
        if (safetyMargin < 0) {
            throw new RouterConfigurationException("safetyMargin must be >= 0, got " + safetyMargin);
        }

        FallbackChain<P, R> chain = new FallbackChain<>(primary, fallbacks);
        Map<String, ModelLimits> limits = new HashMap<>();
        Set<String> keys = new HashSet<>();
        List<BackendDescriptor<P, R>> all = new ArrayList<>(chain.candidates());
        all.addAll(largeContextBackends);
        for (BackendDescriptor<P, R> backend : all) {
            if (!keys.add(backend.modelKey())) {
                throw new RouterConfigurationException("Backend configured twice: " + backend.modelKey());
            }
            limits.put(backend.modelKey(), backend.getLimits());
        }

        BudgetEnforcer budget;
        try {
            budget = BudgetEnforcer.of(budgets, clock);
        } catch (IllegalArgumentException e) {
            throw new RouterConfigurationException("Invalid budget: " + e.getMessage(), e);
        }

        BackendHealthTracker healthTracker = new BackendHealthTracker(clock);
        FallbackStrategy strategy = customStrategy != null
                ? customStrategy
                : FallbackStrategies.create(strategyKind, healthTracker);
        RateLimitScheduler scheduler = new RateLimitScheduler(new UsageLedger(clock), limits, safetyMargin, clock,
                sleeper);
        ContextFitPolicy<P> contextPolicy = new ContextFitPolicy<>(tokenEstimator, contextFallback);

        log.info("[Router] Built: primary={}, fallbacks={}, largeContext={}, strategy={}, budgets={}",
                primary.modelKey(), fallbacks, largeContextBackends, strategy.getName(), budget.getBudgets().keySet());
        return new Router<>(chain, largeContextBackends, strategy, contextPolicy, scheduler, budget, healthTracker,
                listener, maxWait, clock);
    }

    private void addBudget(Double amount, BudgetPeriod period, boolean hardLimit, double warningThreshold) {
        if (amount == null) {
            return;
        }
        try {
            budgets.add(new BudgetConfig(amount, period, hardLimit, warningThreshold));
        } catch (IllegalArgumentException e) {
            throw new RouterConfigurationException("Invalid " + period.label() + " budget: " + e.getMessage(), e);
        }
    }

    private BackendDescriptor<P, R> describe(BackendInvoker<P, R> invoker, ModelPricing pricing) {
        if (invoker == null) {
            throw new RouterConfigurationException("Backend invoker must not be null");
        }
        String provider = invoker.getProvider();
        String model = invoker.getModelName();
        if (provider == null || provider.isBlank() || model == null || model.isBlank()) {
            throw new RouterConfigurationException("Backend must report a provider and model name, got "
                    + provider + "/" + model);
        }
        ModelLimits limits = invoker.getLimits();
        if (limits == null) {
            throw new RouterConfigurationException("Backend " + provider + "/" + model + " has no limits");
        }
        if (limits.getRequestsPerMinute() <= 0 || limits.getTokensPerMinute() <= 0
                || limits.getMaxContextTokens() <= 0) {
            throw new RouterConfigurationException("Backend " + provider + "/" + model
                    + " limits must be positive: " + limits);
        }
        if (limits.getRequestsPerDay() != null && limits.getRequestsPerDay() <= 0) {
            throw new RouterConfigurationException("Backend " + provider + "/" + model
                    + " requestsPerDay must be positive");
        }
        return BackendDescriptor.of(invoker, pricing);
    }
}
