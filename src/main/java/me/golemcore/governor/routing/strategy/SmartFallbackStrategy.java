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

package me.golemcore.governor.routing.strategy;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.governor.domain.model.AttemptContext;
import me.golemcore.governor.domain.model.BackendDescriptor;
import me.golemcore.governor.domain.model.CandidateFailure;
import me.golemcore.governor.domain.model.FailureKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orders candidates by a weighted score over recent health and cost.
 *
 * <p>
 * score = 0.5 * successRate + 0.3 * (1 - latency / maxLatency) + 0.2 * (1 -
 * cost / maxCost), where the maxima are taken across the candidates being
 * ordered. Higher is better.
 *
 * <p>
 * The last failure adjusts the order before scoring is applied:
 * <ul>
 * <li>after a rate-limit failure, candidates of other providers go first</li>
 * <li>candidates whose context cannot hold the estimated tokens go last</li>
 * </ul>
 * All sorts are stable, so ties keep the configured order.
 *
 * @since 1.0
 */
@Slf4j
public class SmartFallbackStrategy implements FallbackStrategy {

    static final double SUCCESS_WEIGHT = 0.5;
    static final double LATENCY_WEIGHT = 0.3;
    static final double COST_WEIGHT = 0.2;

    private final BackendHealthTracker healthTracker;

    public SmartFallbackStrategy(BackendHealthTracker healthTracker) {
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
    }

    @Override
    public <P, R> List<BackendDescriptor<P, R>> order(List<BackendDescriptor<P, R>> candidates,
            AttemptContext context) {
        Map<String, Double> scores = score(candidates);
        String rateLimitedProvider = rateLimitedProvider(context.getLastFailure());
        int estimatedTokens = context.getEstimatedTokens();

        Comparator<BackendDescriptor<P, R>> order = Comparator
                .comparingInt((BackendDescriptor<P, R> b) -> b.maxContextTokens() >= estimatedTokens ? 0 : 1)
                .thenComparingInt(b -> b.getProvider().equals(rateLimitedProvider) ? 1 : 0)
                .thenComparing(b -> scores.get(b.modelKey()), Comparator.reverseOrder());

        List<BackendDescriptor<P, R>> ordered = new ArrayList<>(candidates);
        ordered.sort(order);
        if (log.isDebugEnabled()) {
            log.debug("[Router] Smart order {} (scores {})", ordered, scores);
        }
        return List.copyOf(ordered);
    }

    <P, R> Map<String, Double> score(List<BackendDescriptor<P, R>> candidates) {
        long maxLatency = 0;
        double maxCost = 0.0;
        for (BackendDescriptor<P, R> candidate : candidates) {
            maxLatency = Math.max(maxLatency, healthTracker.averageLatency(candidate.modelKey()).toNanos());
            maxCost = Math.max(maxCost, cost(candidate));
        }
        Map<String, Double> scores = new HashMap<>();
        for (BackendDescriptor<P, R> candidate : candidates) {
            String key = candidate.modelKey();
            double latencyScore = maxLatency == 0
                    ? 1.0
                    : 1.0 - (double) healthTracker.averageLatency(key).toNanos() / maxLatency;
            double costScore = maxCost == 0.0 ? 1.0 : 1.0 - cost(candidate) / maxCost;
            double score = SUCCESS_WEIGHT * healthTracker.successRate(key)
                    + LATENCY_WEIGHT * latencyScore
                    + COST_WEIGHT * costScore;
            scores.put(key, score);
        }
        return scores;
    }

    private static double cost(BackendDescriptor<?, ?> backend) {
        return backend.hasPricing() ? backend.getPricing().averageCostPerToken() : 0.0;
    }

    private static String rateLimitedProvider(CandidateFailure failure) {
        if (failure == null) {
            return null;
        }
        boolean rateLimited = failure.kind() == FailureKind.RATE_LIMIT_TIMEOUT
                || (failure.kind() == FailureKind.INVOCATION_ERROR
                        && RateLimitErrors.isRateLimitError(failure.cause()));
        if (!rateLimited) {
            return null;
        }
        int separator = failure.modelKey().indexOf('/');
        return separator < 0 ? failure.modelKey() : failure.modelKey().substring(0, separator);
    }

    @Override
    public String getName() {
        return "smart";
    }
}
