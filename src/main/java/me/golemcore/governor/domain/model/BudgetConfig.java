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

import java.util.Objects;

/**
 * Spending limit for one budget period.
 *
 * <p>
 * Hard limits block further spend once reached; soft limits only track and
 * warn. A warning is logged when spend reaches {@code warningThreshold} of the
 * amount.
 *
 * @since 1.0
 */
public record BudgetConfig(double amount, BudgetPeriod period, boolean hardLimit, double warningThreshold) {

    public static final double DEFAULT_WARNING_THRESHOLD = 0.8;

    public BudgetConfig {
        Objects.requireNonNull(period, "period");
        if (amount < 0 || Double.isNaN(amount)) {
            throw new IllegalArgumentException("Budget amount must be >= 0, got " + amount);
        }
        if (warningThreshold < 0.0 || warningThreshold > 1.0) {
            throw new IllegalArgumentException("warningThreshold must be in [0,1], got " + warningThreshold);
        }
    }

    /**
     * Hard limit with the default warning threshold.
     */
    public static BudgetConfig of(double amount, BudgetPeriod period) {
        return new BudgetConfig(amount, period, true, DEFAULT_WARNING_THRESHOLD);
    }

    public static BudgetConfig soft(double amount, BudgetPeriod period) {
        return new BudgetConfig(amount, period, false, DEFAULT_WARNING_THRESHOLD);
    }
}
