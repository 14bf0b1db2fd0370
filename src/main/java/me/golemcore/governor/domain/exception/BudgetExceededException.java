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

package me.golemcore.governor.domain.exception;

import me.golemcore.governor.domain.model.BudgetPeriod;

import java.util.Locale;

/**
 * Spend exceeded, or would exceed, a hard-limited budget.
 */
public class BudgetExceededException extends GovernorException {

    private static final long serialVersionUID = 1L;

    private final double budget;
    private final double current;
    private final BudgetPeriod period;

    public BudgetExceededException(double budget, double current, BudgetPeriod period) {
        super(String.format(Locale.ROOT, "%s budget exceeded: $%.4f spent of $%.4f",
                period.label(), current, budget));
        this.budget = budget;
        this.current = current;
        this.period = period;
    }

    public double getBudget() {
        return budget;
    }

    public double getCurrent() {
        return current;
    }

    public BudgetPeriod getPeriod() {
        return period;
    }
}
