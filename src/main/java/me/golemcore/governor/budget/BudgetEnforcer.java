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

package me.golemcore.governor.budget;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.governor.domain.exception.BudgetExceededException;
import me.golemcore.governor.domain.model.BudgetConfig;
import me.golemcore.governor.domain.model.BudgetPeriod;
import me.golemcore.governor.domain.model.BudgetStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Tracks spend per budget period and per model, and blocks spend beyond hard
 * limits.
 *
 * <p>
 * Periods other than {@link BudgetPeriod#TOTAL} restart automatically once
 * their interval has elapsed since the period started. The check happens on
 * every read or write, so an idle enforcer needs no timer.
 *
 * <p>
 * All operations run under a single lock because a period total aggregates
 * the spend of every model.
 *
 * @since 1.0
 */
@Slf4j
public class BudgetEnforcer {

    private final Map<BudgetPeriod, BudgetConfig> budgets;
    private final Map<BudgetPeriod, PeriodAccount> accounts = new EnumMap<>(BudgetPeriod.class);
    private final Clock clock;
    private final Object lock = new Object();

    public BudgetEnforcer(Map<BudgetPeriod, BudgetConfig> budgets) {
        this(budgets, Clock.systemUTC());
    }

    public BudgetEnforcer(Map<BudgetPeriod, BudgetConfig> budgets, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Map<BudgetPeriod, BudgetConfig> copy = new EnumMap<>(BudgetPeriod.class);
        budgets.forEach((period, config) -> {
            if (config.period() != period) {
                throw new IllegalArgumentException(
                        "Budget registered under " + period + " is for " + config.period());
            }
            copy.put(period, config);
        });
        this.budgets = Collections.unmodifiableMap(copy);
        Instant now = clock.instant();
        for (BudgetPeriod period : this.budgets.keySet()) {
            accounts.put(period, new PeriodAccount(now));
        }
    }

    public static BudgetEnforcer of(List<BudgetConfig> configs, Clock clock) {
        Map<BudgetPeriod, BudgetConfig> map = new EnumMap<>(BudgetPeriod.class);
        for (BudgetConfig config : configs) {
            if (map.put(config.period(), config) != null) {
                throw new IllegalArgumentException("Duplicate budget for period " + config.period());
            }
        }
        return new BudgetEnforcer(map, clock);
    }

    /**
     * Build an enforcer from optional per-period amounts sharing one limit mode and
     * warning threshold. {@code null} amounts leave the period unconfigured.
     */
    public static BudgetEnforcer of(Double hourly, Double daily, Double monthly, Double total, boolean hardLimit,
            double warningThreshold) {
        List<BudgetConfig> configs = new ArrayList<>();
        addIfSet(configs, hourly, BudgetPeriod.HOURLY, hardLimit, warningThreshold);
        addIfSet(configs, daily, BudgetPeriod.DAILY, hardLimit, warningThreshold);
        addIfSet(configs, monthly, BudgetPeriod.MONTHLY, hardLimit, warningThreshold);
        addIfSet(configs, total, BudgetPeriod.TOTAL, hardLimit, warningThreshold);
        return of(configs, Clock.systemUTC());
    }

    private static void addIfSet(List<BudgetConfig> configs, Double amount, BudgetPeriod period, boolean hardLimit,
            double warningThreshold) {
        if (amount != null) {
            configs.add(new BudgetConfig(amount, period, hardLimit, warningThreshold));
        }
    }

    public void recordCost(double amount) {
        recordCost(amount, null);
    }

    /**
     * Add spend to every configured period.
     *
     * @throws BudgetExceededException
     *             if a hard-limited period is over its amount after recording
     */
    public void recordCost(double amount, String modelKey) {
        if (amount < 0 || Double.isNaN(amount)) {
            throw new IllegalArgumentException("Cost must be >= 0, got " + amount);
        }
        BudgetExceededException exceeded = null;
        synchronized (lock) {
            rollPeriods();
            for (Map.Entry<BudgetPeriod, BudgetConfig> entry : budgets.entrySet()) {
                BudgetPeriod period = entry.getKey();
                BudgetConfig config = entry.getValue();
                PeriodAccount account = accounts.get(period);
                account.add(amount, modelKey);

                if (!account.warned && account.spent >= config.amount() * config.warningThreshold()) {
                    account.warned = true;
                    log.warn("[Budget] {} spend ${} reached {}% of ${}", period.label(), format(account.spent),
                            Math.round(config.warningThreshold() * 100), format(config.amount()));
                }
                if (config.hardLimit() && account.spent > config.amount() && exceeded == null) {
                    exceeded = new BudgetExceededException(config.amount(), account.spent, period);
                }
            }
        }
        if (exceeded != null) {
            log.warn("[Budget] {}", exceeded.getMessage());
            throw exceeded;
        }
    }

    /**
     * Whether {@code amount} more spend stays within every hard-limited period.
     */
    public boolean canAfford(double amount) {
        synchronized (lock) {
            rollPeriods();
            for (BudgetPeriod period : budgets.keySet()) {
                if (!affordable(period, amount)) {
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Like {@link #canAfford(double)} but reports the first blocking period.
     *
     * @throws BudgetExceededException
     *             if {@code amount} more spend would exceed a hard-limited period
     */
    public void ensureAffordable(double amount) {
        synchronized (lock) {
            rollPeriods();
            for (Map.Entry<BudgetPeriod, BudgetConfig> entry : budgets.entrySet()) {
                if (!affordable(entry.getKey(), amount)) {
                    throw new BudgetExceededException(entry.getValue().amount(), accounts.get(entry.getKey()).spent,
                            entry.getKey());
                }
            }
        }
    }

    public boolean canAfford(double amount, BudgetPeriod period) {
        synchronized (lock) {
            rollPeriods();
            return affordable(period, amount);
        }
    }

    public double getSpent(BudgetPeriod period) {
        synchronized (lock) {
            rollPeriods();
            PeriodAccount account = accounts.get(period);
            return account == null ? 0.0 : account.spent;
        }
    }

    public double getSpent(BudgetPeriod period, String modelKey) {
        synchronized (lock) {
            rollPeriods();
            PeriodAccount account = accounts.get(period);
            return account == null ? 0.0 : account.byModel.getOrDefault(modelKey, 0.0);
        }
    }

    /**
     * Budget left in the period, never negative. Infinite when the period has no
     * budget.
     */
    public double remaining(BudgetPeriod period) {
        synchronized (lock) {
            rollPeriods();
            BudgetConfig config = budgets.get(period);
            if (config == null) {
                return Double.POSITIVE_INFINITY;
            }
            return Math.max(0.0, config.amount() - accounts.get(period).spent);
        }
    }

    public Map<BudgetPeriod, BudgetStatus> status() {
        synchronized (lock) {
            rollPeriods();
            Map<BudgetPeriod, BudgetStatus> result = new EnumMap<>(BudgetPeriod.class);
            budgets.forEach((period, config) -> {
                double spent = accounts.get(period).spent;
                result.put(period, BudgetStatus.builder()
                        .period(period)
                        .budget(config.amount())
                        .spent(spent)
                        .remaining(Math.max(0.0, config.amount() - spent))
                        .percentage(percentage(spent, config.amount()))
                        .hardLimit(config.hardLimit())
                        .warning(spent >= config.amount() * config.warningThreshold())
                        .build());
            });
            return Collections.unmodifiableMap(result);
        }
    }

    public void reset() {
        synchronized (lock) {
            Instant now = clock.instant();
            accounts.replaceAll((period, account) -> new PeriodAccount(now));
        }
        log.info("[Budget] All periods reset");
    }

    public void reset(BudgetPeriod period) {
        synchronized (lock) {
            if (accounts.containsKey(period)) {
                accounts.put(period, new PeriodAccount(clock.instant()));
            }
        }
        log.info("[Budget] {} period reset", period.label());
    }

    public boolean isConfigured() {
        return !budgets.isEmpty();
    }

    public Map<BudgetPeriod, BudgetConfig> getBudgets() {
        return budgets;
    }

    private boolean affordable(BudgetPeriod period, double amount) {
        BudgetConfig config = budgets.get(period);
        if (config == null || !config.hardLimit()) {
            return true;
        }
        return accounts.get(period).spent + amount <= config.amount();
    }

    private void rollPeriods() {
        Instant now = clock.instant();
        for (Map.Entry<BudgetPeriod, PeriodAccount> entry : accounts.entrySet()) {
            BudgetPeriod period = entry.getKey();
            if (!period.isAutoReset()) {
                continue;
            }
            PeriodAccount account = entry.getValue();
            if (!now.isBefore(account.startedAt.plus(period.getResetInterval()))) {
                log.debug("[Budget] {} period rolled over, spent was ${}", period.label(), format(account.spent));
                entry.setValue(new PeriodAccount(now));
            }
        }
    }

    private static double percentage(double spent, double budget) {
        if (budget > 0) {
            return spent / budget * 100.0;
        }
        return spent > 0 ? Double.POSITIVE_INFINITY : 0.0;
    }

    private static String format(double amount) {
        return String.format(Locale.ROOT, "%.4f", amount);
    }

    private static final class PeriodAccount {

        private final Instant startedAt;
        private final Map<String, Double> byModel = new HashMap<>();
        private double spent;
        private boolean warned;

        PeriodAccount(Instant startedAt) {
            this.startedAt = startedAt;
        }

        void add(double amount, String modelKey) {
            spent += amount;
            if (modelKey != null) {
                byModel.merge(modelKey, amount, Double::sum);
            }
        }
    }
}
