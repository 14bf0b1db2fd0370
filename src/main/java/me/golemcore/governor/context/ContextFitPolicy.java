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

package me.golemcore.governor.context;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.governor.domain.exception.ContextTooLargeException;
import me.golemcore.governor.domain.model.BackendDescriptor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Checks whether a payload fits a backend's context window, and picks the
 * smallest backend that can hold an oversized payload.
 *
 * <p>
 * When disabled every backend is treated as fitting and no estimates are
 * compared.
 *
 * @param <P>
 *            payload type
 * @since 1.0
 */
@Slf4j
public class ContextFitPolicy<P> {

    private static final Comparator<BackendDescriptor<?, ?>> BY_CONTEXT = Comparator
            .comparingInt(BackendDescriptor::maxContextTokens);

    private final TokenEstimator<P> estimator;
    private final boolean enabled;

    public ContextFitPolicy(TokenEstimator<P> estimator, boolean enabled) {
        this.estimator = Objects.requireNonNull(estimator, "estimator");
        this.enabled = enabled;
    }

    public static <P> ContextFitPolicy<P> enabled(TokenEstimator<P> estimator) {
        return new ContextFitPolicy<>(estimator, true);
    }

    public static <P> ContextFitPolicy<P> disabled(TokenEstimator<P> estimator) {
        return new ContextFitPolicy<>(estimator, false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int estimateTokens(P payload) {
        return Math.max(0, estimator.estimate(payload));
    }

    public ContextFit fits(P payload, BackendDescriptor<P, ?> backend) {
        return fits(estimateTokens(payload), backend);
    }

    public ContextFit fits(int estimatedTokens, BackendDescriptor<?, ?> backend) {
        int maxContext = backend.maxContextTokens();
        if (!enabled) {
            return new ContextFit(true, estimatedTokens, maxContext);
        }
        boolean fits = estimatedTokens <= maxContext;
        if (!fits) {
            log.warn("[Context] ~{} tokens exceed {} context of {}", estimatedTokens, maxContext,
                    backend.modelKey());
        }
        return new ContextFit(fits, estimatedTokens, maxContext);
    }

    public <R> BackendDescriptor<P, R> selectContextCapable(P payload, List<BackendDescriptor<P, R>> candidates) {
        return selectContextCapable(estimateTokens(payload), candidates);
    }

    /**
     * Smallest-context candidate that can hold {@code estimatedTokens}.
     *
     * @throws ContextTooLargeException
     *             if no candidate is large enough
     */
    public <R> BackendDescriptor<P, R> selectContextCapable(int estimatedTokens,
            List<BackendDescriptor<P, R>> candidates) {
        List<BackendDescriptor<P, R>> capable = largerContextCandidates(estimatedTokens, candidates);
        if (!capable.isEmpty()) {
            BackendDescriptor<P, R> selected = capable.get(0);
            log.info("[Context] Escalating ~{} tokens to {} ({} context)", estimatedTokens, selected.modelKey(),
                    selected.maxContextTokens());
            return selected;
        }
        int largest = candidates.stream()
                .mapToInt(BackendDescriptor::maxContextTokens)
                .max()
                .orElse(0);
        throw new ContextTooLargeException(estimatedTokens, largest);
    }

    /**
     * Every candidate that can hold {@code requiredTokens}, smallest context first.
     */
    public <R> List<BackendDescriptor<P, R>> largerContextCandidates(int requiredTokens,
            List<BackendDescriptor<P, R>> candidates) {
        List<BackendDescriptor<P, R>> capable = new ArrayList<>();
        for (BackendDescriptor<P, R> candidate : candidates) {
            if (candidate.maxContextTokens() >= requiredTokens) {
                capable.add(candidate);
            }
        }
        capable.sort(BY_CONTEXT);
        return capable;
    }
}
