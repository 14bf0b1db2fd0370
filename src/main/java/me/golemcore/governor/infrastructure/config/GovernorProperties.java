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

package me.golemcore.governor.infrastructure.config;

import lombok.Data;
import me.golemcore.governor.domain.model.BudgetConfig;
import me.golemcore.governor.ratelimit.RateLimitScheduler;
import me.golemcore.governor.routing.RouterBuilder;
import me.golemcore.governor.routing.strategy.FallbackStrategyKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Router configuration bound from {@code governor.*}.
 *
 * <pre>
 * governor.primary=openai/gpt-4o
 * governor.fallbacks=anthropic/claude-sonnet-4-5,openai/gpt-4o-mini
 * governor.large-context-models=gemini/gemini-2.5-pro
 * governor.tier=tier1
 * governor.strategy=smart
 * governor.budget.daily=10.0
 * governor.providers.openai.api-key=${OPENAI_API_KEY}
 * </pre>
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "governor")
@Data
public class GovernorProperties {

    private boolean enabled = true;
    private String catalog = ModelCatalog.DEFAULT_RESOURCE;
    private String tier = "tier1";
    /** Model key of the primary backend. */
    private String primary;
    private List<String> fallbacks = new ArrayList<>();
    private List<String> largeContextModels = new ArrayList<>();
    private FallbackStrategyKind strategy = FallbackStrategyKind.SEQUENTIAL;
    private boolean contextFallback = true;
    private Duration maxWait = RouterBuilder.DEFAULT_MAX_WAIT;
    private int safetyMargin = RateLimitScheduler.DEFAULT_SAFETY_MARGIN;
    private BudgetProperties budget = new BudgetProperties();
    private Map<String, ProviderProperties> providers = new HashMap<>();
    private Duration timeout = Duration.ofSeconds(300);

    @Data
    public static class BudgetProperties {
        private Double hourly;
        private Double daily;
        private Double monthly;
        private Double total;
        private boolean hardLimit = true;
        private double warningThreshold = BudgetConfig.DEFAULT_WARNING_THRESHOLD;
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }
}
