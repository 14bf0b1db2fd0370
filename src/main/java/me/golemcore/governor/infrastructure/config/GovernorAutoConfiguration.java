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

import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.governor.adapter.outbound.llm.ChatModelFactory;
import me.golemcore.governor.adapter.outbound.llm.ChatRequestTokenEstimator;
import me.golemcore.governor.adapter.outbound.llm.Langchain4jBackendInvoker;
import me.golemcore.governor.domain.exception.RouterConfigurationException;
import me.golemcore.governor.domain.model.ModelPricing;
import me.golemcore.governor.routing.FallbackListener;
import me.golemcore.governor.routing.Router;
import me.golemcore.governor.routing.RouterBuilder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot auto-configuration that assembles a
 * {@code Router<ChatRequest, ChatResponse>} from {@code governor.*} properties.
 *
 * <p>
 * Each configured model key is resolved to a backend as follows:
 * <ul>
 * <li>a {@link Langchain4jBackendInvoker} bean registered by the host for that
 * key, if any</li>
 * <li>otherwise a chat model built by {@link ChatModelFactory} with the
 * catalog's limits for {@code governor.tier}</li>
 * </ul>
 * Pricing comes from the {@link ModelCatalog} when it knows the model.
 *
 * <p>
 * Disabled with {@code governor.enabled=false}. The router bean is only
 * created when {@code governor.primary} is set.
 *
 * @since 1.0
 */
@AutoConfiguration
@EnableConfigurationProperties(GovernorProperties.class)
@ConditionalOnProperty(prefix = "governor", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class GovernorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ModelCatalog modelCatalog(GovernorProperties properties) {
        return ModelCatalog.loadFromClasspath(properties.getCatalog());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChatModelFactory chatModelFactory(GovernorProperties properties) {
        return new ChatModelFactory(properties);
    }

    @Bean
    @ConditionalOnMissingBean(Router.class)
    @ConditionalOnProperty(prefix = "governor", name = "primary")
    public Router<ChatRequest, ChatResponse> governorRouter(GovernorProperties properties, ModelCatalog catalog,
            ChatModelFactory chatModelFactory, ObjectProvider<Langchain4jBackendInvoker> invokers,
            ObjectProvider<FallbackListener> listener) {
        return buildRouter(properties, catalog, chatModelFactory, invokers.orderedStream().toList(),
                listener.getIfAvailable());
    }

    static Router<ChatRequest, ChatResponse> buildRouter(GovernorProperties properties, ModelCatalog catalog,
            ChatModelFactory chatModelFactory, List<Langchain4jBackendInvoker> hostInvokers,
            FallbackListener listener) {
        if (properties.getPrimary() == null || properties.getPrimary().isBlank()) {
            throw new RouterConfigurationException("governor.primary is required");
        }
        Map<String, Langchain4jBackendInvoker> byKey = new HashMap<>();
        for (Langchain4jBackendInvoker invoker : hostInvokers) {
            byKey.put(invoker.modelKey(), invoker);
        }
        BackendResolver resolver = new BackendResolver(properties.getTier(), catalog, chatModelFactory, byKey);

        RouterBuilder<ChatRequest, ChatResponse> builder = Router.<ChatRequest, ChatResponse>builder()
                .withPrimary(resolver.invoker(properties.getPrimary()), resolver.pricing(properties.getPrimary()))
                .withFallbackStrategy(properties.getStrategy())
                .withContextFallback(properties.isContextFallback())
                .withMaxWait(properties.getMaxWait())
                .withSafetyMargin(properties.getSafetyMargin())
                .withTokenEstimator(new ChatRequestTokenEstimator())
                .withFallbackListener(listener);
        for (String key : properties.getFallbacks()) {
            builder.withFallback(resolver.invoker(key), resolver.pricing(key));
        }
        for (String key : properties.getLargeContextModels()) {
            builder.withLargeContextBackend(resolver.invoker(key), resolver.pricing(key));
        }
        GovernorProperties.BudgetProperties budget = properties.getBudget();
        builder.withBudget(budget.getHourly(), budget.getDaily(), budget.getMonthly(), budget.getTotal(),
                budget.isHardLimit(), budget.getWarningThreshold());

        log.info("[Router] Configured from properties: primary={}, fallbacks={}, tier={}", properties.getPrimary(),
                properties.getFallbacks(), properties.getTier());
        return builder.build();
    }

    private record BackendResolver(String tier, ModelCatalog catalog, ChatModelFactory chatModelFactory,
            Map<String, Langchain4jBackendInvoker> hostInvokers) {

        Langchain4jBackendInvoker invoker(String modelKey) {
            Langchain4jBackendInvoker invoker = hostInvokers.get(modelKey);
            if (invoker != null) {
                return invoker;
            }
            if (!catalog.contains(modelKey)) {
                throw new RouterConfigurationException("No backend bean and no catalog entry for " + modelKey);
            }
            return chatModelFactory.createInvoker(catalog.limitsFor(modelKey, tier));
        }

        ModelPricing pricing(String modelKey) {
            return catalog.contains(modelKey) ? catalog.pricingFor(modelKey, tier) : null;
        }
    }
}
