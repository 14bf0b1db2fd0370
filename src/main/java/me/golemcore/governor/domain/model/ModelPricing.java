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

/**
 * Price of a backend in dollars per 1K input and output tokens.
 */
public record ModelPricing(double inputCostPer1k, double outputCostPer1k) {

    public static final ModelPricing FREE = new ModelPricing(0.0, 0.0);

    public ModelPricing {
        if (inputCostPer1k < 0 || outputCostPer1k < 0) {
            throw new IllegalArgumentException("Pricing must not be negative");
        }
    }

    public double cost(long inputTokens, long outputTokens) {
        return (Math.max(0, inputTokens) * inputCostPer1k + Math.max(0, outputTokens) * outputCostPer1k) / 1000.0;
    }

    /**
     * Mean of input and output price, per single token.
     */
    public double averageCostPerToken() {
        return (inputCostPer1k + outputCostPer1k) / 2.0 / 1000.0;
    }
}
