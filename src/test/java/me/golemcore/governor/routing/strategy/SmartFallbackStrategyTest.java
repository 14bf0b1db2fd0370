package me.golemcore.governor.routing.strategy;

import dev.langchain4j.exception.RateLimitException;
import me.golemcore.governor.domain.exception.BackendInvocationException;
import me.golemcore.governor.domain.exception.RateLimitWaitTimeoutException;
import me.golemcore.governor.domain.model.AttemptContext;
import me.golemcore.governor.domain.model.BackendDescriptor;
import me.golemcore.governor.domain.model.CandidateFailure;
import me.golemcore.governor.domain.model.FailureKind;
import me.golemcore.governor.domain.model.ModelPricing;
import me.golemcore.governor.testsupport.FakeBackend;
import me.golemcore.governor.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SmartFallbackStrategyTest {

    private static final BackendDescriptor<String, String> OPENAI = FakeBackend
            .of("openai", "gpt-4o", 500, 30_000, 128_000).descriptor(new ModelPricing(1.0, 1.0));
    private static final BackendDescriptor<String, String> OPENAI_MINI = FakeBackend
            .of("openai", "gpt-4o-mini", 500, 30_000, 128_000).descriptor(new ModelPricing(1.0, 1.0));
    private static final BackendDescriptor<String, String> ANTHROPIC = FakeBackend
            .of("anthropic", "claude", 50, 40_000, 200_000).descriptor(new ModelPricing(1.0, 1.0));
    private static final BackendDescriptor<String, String> SMALL = FakeBackend
            .of("local", "tiny", 60, 10_000, 4_096).descriptor(new ModelPricing(1.0, 1.0));

    private MutableClock clock;
    private BackendHealthTracker tracker;
    private SmartFallbackStrategy strategy;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        tracker = new BackendHealthTracker(clock);
        strategy = new SmartFallbackStrategy(tracker);
    }

    @Test
    void order_withoutHistoryKeepsConfiguredOrder() {
        List<BackendDescriptor<String, String>> candidates = List.of(OPENAI, ANTHROPIC, OPENAI_MINI);

        assertEquals(candidates, strategy.order(candidates, AttemptContext.initial(100)));
        assertEquals("smart", strategy.getName());
    }

    @Test
    void order_prefersHealthierBackend() {
        tracker.record(OPENAI.modelKey(), false, Duration.ofMillis(100));
        tracker.record(OPENAI.modelKey(), false, Duration.ofMillis(100));
        tracker.record(ANTHROPIC.modelKey(), true, Duration.ofMillis(100));

        List<BackendDescriptor<String, String>> ordered = strategy.order(List.of(OPENAI, ANTHROPIC),
                AttemptContext.initial(100));

        assertEquals(List.of(ANTHROPIC, OPENAI), ordered);
    }

    @Test
    void order_prefersFasterBackendAtEqualSuccess() {
        tracker.record(OPENAI.modelKey(), true, Duration.ofSeconds(4));
        tracker.record(ANTHROPIC.modelKey(), true, Duration.ofSeconds(1));

        assertEquals(List.of(ANTHROPIC, OPENAI),
                strategy.order(List.of(OPENAI, ANTHROPIC), AttemptContext.initial(100)));
    }

    @Test
    void order_prefersCheaperBackendAtEqualHealth() {
        BackendDescriptor<String, String> pricey = FakeBackend.of("a", "pricey").descriptor(new ModelPricing(10, 30));
        BackendDescriptor<String, String> cheap = FakeBackend.of("b", "cheap").descriptor(new ModelPricing(1, 3));

        assertEquals(List.of(cheap, pricey), strategy.order(List.of(pricey, cheap), AttemptContext.initial(10)));
    }

    @Test
    void score_usesWeightedFormula() {
        tracker.record(OPENAI.modelKey(), true, Duration.ofSeconds(2));
        tracker.record(OPENAI.modelKey(), false, Duration.ofSeconds(2));
        tracker.record(ANTHROPIC.modelKey(), true, Duration.ofSeconds(1));

        var scores = strategy.score(List.of(OPENAI, ANTHROPIC));

        // openai: 0.5*0.5 + 0.3*(1-1) + 0.2*(1-1); anthropic: 0.5*1 + 0.3*0.5 + 0.2*0
        assertEquals(0.25, scores.get(OPENAI.modelKey()), 1e-9);
        assertEquals(0.65, scores.get(ANTHROPIC.modelKey()), 1e-9);
    }

    @Test
    void order_afterRateLimitTimeoutPrefersOtherProvider() {
        CandidateFailure failure = CandidateFailure.of(OPENAI.modelKey(), FailureKind.RATE_LIMIT_TIMEOUT,
                new RateLimitWaitTimeoutException(OPENAI.modelKey(), Duration.ZERO));
        AttemptContext context = AttemptContext.initial(100).next(failure);

        List<BackendDescriptor<String, String>> ordered = strategy.order(List.of(OPENAI_MINI, ANTHROPIC), context);

        assertEquals(List.of(ANTHROPIC, OPENAI_MINI), ordered);
    }

    @Test
    void order_afterProviderRateLimitErrorPrefersOtherProvider() {
        BackendInvocationException error = new BackendInvocationException(OPENAI.modelKey(),
                new RateLimitException("429 from provider"));
        AttemptContext context = AttemptContext.initial(100)
                .next(CandidateFailure.of(OPENAI.modelKey(), FailureKind.INVOCATION_ERROR, error));

        assertEquals(List.of(ANTHROPIC, OPENAI_MINI), strategy.order(List.of(OPENAI_MINI, ANTHROPIC), context));
    }

    @Test
    void order_afterOtherErrorKeepsScoreOrder() {
        AttemptContext context = AttemptContext.initial(100).next(CandidateFailure.of(OPENAI.modelKey(),
                FailureKind.INVOCATION_ERROR, new IllegalStateException("boom")));

        assertEquals(List.of(OPENAI_MINI, ANTHROPIC), strategy.order(List.of(OPENAI_MINI, ANTHROPIC), context));
    }

    @Test
    void order_candidatesTooSmallForEstimateGoLast() {
        List<BackendDescriptor<String, String>> ordered = strategy.order(List.of(SMALL, OPENAI),
                AttemptContext.initial(50_000));

        assertEquals(List.of(OPENAI, SMALL), ordered);
    }
}
