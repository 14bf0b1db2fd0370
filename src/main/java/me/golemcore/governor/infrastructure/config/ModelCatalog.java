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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.governor.domain.exception.RouterConfigurationException;
import me.golemcore.governor.domain.model.ModelLimits;
import me.golemcore.governor.domain.model.ModelPricing;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Published limits, context windows and pricing of known models, loaded from a
 * {@code models.json} catalog.
 *
 * <p>
 * Models are keyed by {@code provider/model}. Rate limits are given per
 * provider tier (e.g. {@code tier1}, {@code free}, {@code paid}); a value of
 * {@code -1} means unlimited. Prices are per million tokens in the file and
 * per thousand tokens once loaded. Tiers listed in {@code freeTiers} cost
 * nothing.
 *
 * @since 1.0
 */
@Slf4j
public class ModelCatalog {

    public static final String DEFAULT_RESOURCE = "models.json";

    private static final int UNLIMITED = -1;
    private static final double PER_MILLION_TO_PER_THOUSAND = 1000.0;

    private final CatalogConfig config;

    ModelCatalog(CatalogConfig config) {
        this.config = config;
    }

    /**
     * Load the catalog bundled on the classpath.
     */
    public static ModelCatalog loadDefault() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public static ModelCatalog loadFromClasspath(String resourceName) {
        ClassPathResource resource = new ClassPathResource(resourceName);
        if (!resource.exists()) {
            throw new RouterConfigurationException("Model catalog not found on classpath: " + resourceName);
        }
        try (InputStream is = resource.getInputStream()) {
            ModelCatalog catalog = load(is);
            log.info("[ModelCatalog] Loaded from classpath {}: {} models", resourceName, catalog.getModelKeys().size());
            return catalog;
        } catch (IOException e) {
            throw new RouterConfigurationException("Failed to read model catalog " + resourceName, e);
        }
    }

    public static ModelCatalog load(InputStream json) throws IOException {
        CatalogConfig config = new ObjectMapper().readValue(json, CatalogConfig.class);
        for (String key : config.getModels().keySet()) {
            if (key.indexOf('/') <= 0) {
                throw new RouterConfigurationException("Model key must be provider/model, got: " + key);
            }
        }
        return new ModelCatalog(config);
    }

    public Set<String> getModelKeys() {
        return Set.copyOf(config.getModels().keySet());
    }

    public boolean contains(String modelKey) {
        return config.getModels().containsKey(modelKey);
    }

    public Set<String> getTiers(String modelKey) {
        return Set.copyOf(settings(modelKey).getRateLimits().keySet());
    }

    /**
     * Limits of a model at a provider tier.
     *
     * @throws RouterConfigurationException
     *             if the model or tier is unknown
     */
    public ModelLimits limitsFor(String modelKey, String tier) {
        ModelSettings settings = settings(modelKey);
        RateLimitSettings limits = settings.getRateLimits().get(tier);
        if (limits == null) {
            throw new RouterConfigurationException("Model " + modelKey + " has no rate limits for tier '" + tier
                    + "', known tiers: " + settings.getRateLimits().keySet());
        }
        int separator = modelKey.indexOf('/');
        return ModelLimits.builder()
                .provider(modelKey.substring(0, separator))
                .modelName(modelKey.substring(separator + 1))
                .requestsPerMinute(unlimitedAsMax(limits.getRequestsPerMinute()))
                .tokensPerMinute(unlimitedAsMax(limits.getTokensPerMinute()))
                .maxContextTokens(settings.getContextLength())
                .requestsPerDay(limits.getRequestsPerDay() == null || limits.getRequestsPerDay() == UNLIMITED
                        ? null
                        : limits.getRequestsPerDay())
                .build();
    }

    /**
     * Pricing of a model, or {@code null} when the catalog has none.
     */
    public ModelPricing pricingFor(String modelKey) {
        PricingSettings pricing = settings(modelKey).getPricing();
        if (pricing == null) {
            return null;
        }
        return new ModelPricing(pricing.getInputPer1m() / PER_MILLION_TO_PER_THOUSAND,
                pricing.getOutputPer1m() / PER_MILLION_TO_PER_THOUSAND);
    }

    /**
     * Pricing at a tier; free tiers cost nothing.
     */
    public ModelPricing pricingFor(String modelKey, String tier) {
        if (settings(modelKey).getFreeTiers().contains(tier)) {
            return ModelPricing.FREE;
        }
        return pricingFor(modelKey);
    }

    public int contextLengthOf(String modelKey) {
        return settings(modelKey).getContextLength();
    }

    /**
     * Fallback models in preference order, optionally restricted to a use case.
     */
    public List<String> fallbackModels(String useCase) {
        List<String> result = new ArrayList<>();
        for (String key : config.getFallbackPriority()) {
            ModelSettings settings = config.getModels().get(key);
            if (settings != null && (useCase == null || settings.getUseCases().contains(useCase))) {
                result.add(key);
            }
        }
        return result;
    }

    /**
     * All models, largest context window first.
     */
    public List<String> largeContextModels() {
        List<String> keys = new ArrayList<>(config.getModels().keySet());
        keys.sort(Comparator.<String>comparingInt(this::contextLengthOf).reversed()
                .thenComparing(Comparator.naturalOrder()));
        return keys;
    }

    private ModelSettings settings(String modelKey) {
        ModelSettings settings = config.getModels().get(modelKey);
        if (settings == null) {
            throw new RouterConfigurationException("Unknown model: " + modelKey);
        }
        return settings;
    }

    private static int unlimitedAsMax(int value) {
        return value == UNLIMITED ? Integer.MAX_VALUE : value;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CatalogConfig {
        private List<String> fallbackPriority = new ArrayList<>();
        private Map<String, ModelSettings> models = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelSettings {
        private int contextLength = 4096;
        private int maxOutputTokens;
        private Map<String, RateLimitSettings> rateLimits = new LinkedHashMap<>();
        private PricingSettings pricing;
        private List<String> freeTiers = new ArrayList<>();
        private List<String> useCases = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RateLimitSettings {
        private int requestsPerMinute;
        private int tokensPerMinute;
        private Integer requestsPerDay;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PricingSettings {
        private double inputPer1m;
        private double outputPer1m;
    }
}
