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

import java.time.Duration;
import java.util.Locale;

/**
 * Accounting period of a cost budget. {@link #TOTAL} never resets on its own.
 */
public enum BudgetPeriod {

    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1)),
    MONTHLY(Duration.ofDays(30)),
    TOTAL(null);

    private final Duration resetInterval;

    BudgetPeriod(Duration resetInterval) {
        this.resetInterval = resetInterval;
    }

    public Duration getResetInterval() {
        return resetInterval;
    }

    public boolean isAutoReset() {
        return resetInterval != null;
    }

    /**
     * Lower-case name used in status maps and log lines.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
