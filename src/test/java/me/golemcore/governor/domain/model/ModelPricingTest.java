package me.golemcore.governor.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelPricingTest {

    @Test
    void cost_isPricedPerThousandTokens() {
        ModelPricing pricing = new ModelPricing(0.01, 0.03);

        assertEquals(0.025, pricing.cost(1000, 500), 1e-12);
        assertEquals(0.0, pricing.cost(0, 0));
    }

    @Test
    void cost_ignoresNegativeCounts() {
        assertEquals(0.01, new ModelPricing(0.01, 0.03).cost(1000, -5), 1e-12);
    }

    @Test
    void averageCostPerToken_isMeanOfInputAndOutput() {
        assertEquals(0.00002, new ModelPricing(0.01, 0.03).averageCostPerToken(), 1e-15);
        assertEquals(0.0, ModelPricing.FREE.averageCostPerToken());
    }

    @Test
    void rejectsNegativePrices() {
        assertThrows(IllegalArgumentException.class, () -> new ModelPricing(-0.01, 0.0));
    }
}
