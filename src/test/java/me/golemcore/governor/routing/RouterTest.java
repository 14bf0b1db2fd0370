package me.golemcore.governor.routing;

import me.golemcore.governor.domain.exception.AllBackendsExhaustedException;
import me.golemcore.governor.domain.exception.BackendInvocationException;
import me.golemcore.governor.domain.exception.BudgetExceededException;
import me.golemcore.governor.domain.exception.ContextTooLargeException;
import me.golemcore.governor.domain.exception.RateLimitWaitTimeoutException;
import me.golemcore.governor.domain.model.BudgetConfig;
import me.golemcore.governor.domain.model.BudgetPeriod;
import me.golemcore.governor.domain.model.CandidateFailure;
import me.golemcore.governor.domain.model.FailureKind;
import me.golemcore.governor.domain.model.FallbackEvent;
import me.golemcore.governor.domain.model.ModelPricing;
import me.golemcore.governor.domain.model.RouterStats;
import me.golemcore.governor.domain.model.RouterStatus;
import me.golemcore.governor.routing.strategy.FallbackStrategyKind;
import me.golemcore.governor.testsupport.ClockAdvancingSleeper;
import me.golemcore.governor.testsupport.FakeBackend;
import me.golemcore.governor.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RouterTest {

    private MutableClock clock;
    private ClockAdvancingSleeper sleeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        sleeper = new ClockAdvancingSleeper(clock);
    }

    private RouterBuilder<String, String> builder() {
        return Router.<String, String>builder()
                .withClock(clock)
                .withSleeper(sleeper);
    }

    @Test
    void invoke_primarySucceeds() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o");
        FakeBackend fallback = FakeBackend.of("anthropic", "claude");
        Router<String, String> router = builder().withPrimary(primary).withFallback(fallback).build();

        assertEquals("gpt-4o:hello", router.invoke("hello"));

        assertEquals(1, primary.getCalls());
        assertEquals(0, fallback.getCalls());
        RouterStats stats = router.getStats();
        assertEquals(1, stats.getTotalRequests());
        assertEquals(1, stats.getPrimaryRequests());
        assertEquals(0, stats.getFallbackRequests());
    }

    @Test
    void invoke_fallsBackWhenPrimaryThrows() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o").failingWith(new IOException("connection reset"));
        FakeBackend fallback = FakeBackend.of("anthropic", "claude");
        FallbackListener listener = mock(FallbackListener.class);
        Router<String, String> router = builder()
                .withPrimary(primary)
                .withFallback(fallback)
                .withFallbackListener(listener)
                .build();

        assertEquals("claude:hi", router.invoke("hi"));

        assertEquals(1, primary.getCalls());
        assertEquals(1, fallback.getCalls());
        ArgumentCaptor<FallbackEvent> captor = ArgumentCaptor.forClass(FallbackEvent.class);
        verify(listener).onFallback(captor.capture());
        FallbackEvent event = captor.getValue();
        assertEquals("openai/gpt-4o", event.attemptedModel());
        assertEquals("anthropic/claude", event.fallbackModel());
        assertEquals("invocation_error", event.reason());
        assertEquals(fallback.getLimits(), event.limits());
        assertEquals(clock.instant(), event.timestamp());

        RouterStats stats = router.getStats();
        assertEquals(1, stats.getFallbackRequests());
        assertEquals(1, stats.getInvocationFailures());
        assertEquals(100.0, stats.fallbackUsagePercent(), 1e-9);
    }

    @Test
    void invoke_listenerFailureDoesNotAffectRouting() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o").failingWith(new IllegalStateException("boom"));
        FakeBackend fallback = FakeBackend.of("anthropic", "claude");
        FallbackListener listener = mock(FallbackListener.class);
        doThrow(new IllegalStateException("listener broke")).when(listener).onFallback(any());
        Router<String, String> router = builder()
                .withPrimary(primary)
                .withFallback(fallback)
                .withFallbackListener(listener)
                .build();

        assertEquals("claude:x", router.invoke("x"));
        verify(listener, times(1)).onFallback(any());
    }

    @Test
    void invoke_noFallbackEventWhenPrimaryServes() {
        FallbackListener listener = mock(FallbackListener.class);
        Router<String, String> router = builder()
                .withPrimary(FakeBackend.of("openai", "gpt-4o"))
                .withFallback(FakeBackend.of("anthropic", "claude"))
                .withFallbackListener(listener)
                .build();

        router.invoke("x");

        verify(listener, never()).onFallback(any());
    }

    @Test
    void invoke_allFailuresAggregatedInAttemptOrder() {
        FakeBackend a = FakeBackend.of("openai", "gpt-4o").failingWith(new IOException("a down"));
        FakeBackend b = FakeBackend.of("anthropic", "claude").failingWith(new IOException("b down"));
        Router<String, String> router = builder().withPrimary(a).withFallback(b).build();

        AllBackendsExhaustedException ex = assertThrows(AllBackendsExhaustedException.class,
                () -> router.invoke("x"));

        List<CandidateFailure> failures = ex.getFailures();
        assertEquals(2, failures.size());
        assertEquals("openai/gpt-4o", failures.get(0).modelKey());
        assertEquals("anthropic/claude", failures.get(1).modelKey());
        assertTrue(ex.allFailedWith(FailureKind.INVOCATION_ERROR));
        assertInstanceOf(BackendInvocationException.class, failures.get(0).cause());
        assertInstanceOf(IOException.class, failures.get(0).cause().getCause());
        assertTrue(ex.getMessage().contains("openai/gpt-4o: INVOCATION_ERROR"));
        assertEquals(1, router.getStats().getExhausted());
    }

    @Test
    void invoke_rateLimitTimeoutWithZeroWait() {
        FakeBackend only = FakeBackend.of("local", "tiny", 1, 10_000, 8_000);
        Router<String, String> router = builder()
                .withPrimary(only)
                .withSafetyMargin(0)
                .withMaxWait(Duration.ZERO)
                .build();

        assertEquals("tiny:first", router.invoke("first"));
        AllBackendsExhaustedException ex = assertThrows(AllBackendsExhaustedException.class,
                () -> router.invoke("second"));

        assertEquals(1, ex.getFailures().size());
        CandidateFailure failure = ex.getFailures().get(0);
        assertEquals(FailureKind.RATE_LIMIT_TIMEOUT, failure.kind());
        assertInstanceOf(RateLimitWaitTimeoutException.class, failure.cause());
        assertEquals(1, only.getCalls());
        assertTrue(sleeper.getPauses().isEmpty());
    }

    @Test
    void invoke_waitsForRateLimitWithinMaxWait() {
        FakeBackend only = FakeBackend.of("local", "tiny", 1, 10_000, 8_000);
        Router<String, String> router = builder()
                .withPrimary(only)
                .withSafetyMargin(0)
                .withMaxWait(Duration.ofSeconds(90))
                .build();

        router.invoke("first");
        assertEquals("tiny:second", router.invoke("second"));

        assertEquals(Duration.ofSeconds(60), sleeper.totalSlept());
        assertEquals(2, only.getCalls());
    }

    @Test
    void invoke_rateLimitedPrimaryFallsBack() {
        FakeBackend primary = FakeBackend.of("local", "tiny", 1, 10_000, 8_000);
        FakeBackend fallback = FakeBackend.of("anthropic", "claude");
        Router<String, String> router = builder()
                .withPrimary(primary)
                .withFallback(fallback)
                .withSafetyMargin(0)
                .withMaxWait(Duration.ofSeconds(1))
                .build();

        router.invoke("one");
        assertEquals("claude:two", router.invoke("two"));

        RouterStats stats = router.getStats();
        assertEquals(1, stats.getPrimaryRequests());
        assertEquals(1, stats.getFallbackRequests());
        assertEquals(1, stats.getRateLimitFallbacks());
    }

    @Test
    void invoke_payloadAboveTokenLimitFallsBackWithoutWaiting() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o", 500, 30_000, 128_000);
        FakeBackend fallback = FakeBackend.of("anthropic", "claude");
        Router<String, String> router = builder()
                .withPrimary(primary)
                .withFallback(fallback)
                .build();
        String payload = "x".repeat(200_000);

        assertEquals("claude:" + payload, router.invoke(payload));

        assertEquals(0, primary.getCalls());
        assertEquals(1, fallback.getCalls());
        assertTrue(sleeper.getPauses().isEmpty());
        assertEquals(1, router.getStats().getRateLimitFallbacks());
    }

    @Test
    void invoke_escalatesToLargeContextBackend() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o", 500, 10_000_000, 128_000);
        FakeBackend large = FakeBackend.of("google", "gemini-pro", 60, 10_000_000, 2_097_152);
        Router<String, String> router = builder()
                .withPrimary(primary)
                .withLargeContextBackend(large)
                .build();

        String payload = "x".repeat(150_000 * 4);
        assertEquals("gemini-pro:" + payload, router.invoke(payload));

        assertEquals(0, primary.getCalls());
        assertEquals(1, large.getCalls());
        assertEquals(1, router.getStats().getContextFallbacks());
    }

    @Test
    void invoke_largeFallbackInChainServesOversizedPayload() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o", 500, 10_000_000, 128_000);
        FakeBackend large = FakeBackend.of("google", "gemini-pro", 60, 10_000_000, 2_097_152);
        Router<String, String> router = builder().withPrimary(primary).withFallback(large).build();

        router.invoke("x".repeat(150_000 * 4));

        assertEquals(0, primary.getCalls());
        assertEquals(1, large.getCalls());
        assertEquals(1, router.getStats().getContextFallbacks());
    }

    @Test
    void invoke_throwsWhenNoBackendHoldsPayload() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o", 500, 100_000_000, 128_000);
        FakeBackend large = FakeBackend.of("google", "gemini-pro", 60, 100_000_000, 2_097_152);
        Router<String, String> router = builder()
                .withPrimary(primary)
                .withLargeContextBackend(large)
                .withTokenEstimator(payload -> 3_000_000)
                .build();

        ContextTooLargeException ex = assertThrows(ContextTooLargeException.class, () -> router.invoke("big"));

        assertEquals(3_000_000, ex.getEstimatedTokens());
        assertEquals(2_097_152, ex.getMaxAvailableContext());
        assertEquals(0, primary.getCalls());
        assertEquals(0, large.getCalls());
    }

    @Test
    void invoke_contextFallbackDisabledSkipsCheck() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o", 500, 100_000_000, 128_000);
        Router<String, String> router = builder()
                .withPrimary(primary)
                .withContextFallback(false)
                .withTokenEstimator(payload -> 500_000)
                .build();

        assertEquals("gpt-4o:big", router.invoke("big"));
    }

    @Test
    void invoke_budgetBlocksAllCandidates() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o");
        Router<String, String> router = builder()
                .withPrimary(primary, new ModelPricing(10.0, 30.0))
                .withBudget(BudgetConfig.of(0.01, BudgetPeriod.DAILY))
                .withTokenEstimator(payload -> 1_000)
                .build();

        BudgetExceededException ex = assertThrows(BudgetExceededException.class, () -> router.invoke("x"));

        assertEquals(BudgetPeriod.DAILY, ex.getPeriod());
        assertEquals(0.01, ex.getBudget(), 1e-9);
        assertEquals(0, primary.getCalls());
        assertEquals(1, router.getStats().getBudgetSkips());
    }

    @Test
    void invoke_budgetSkipFallsBackToCheaperBackend() {
        FakeBackend pricey = FakeBackend.of("openai", "gpt-4o");
        FakeBackend free = FakeBackend.of("local", "llama");
        Router<String, String> router = builder()
                .withPrimary(pricey, new ModelPricing(10.0, 30.0))
                .withFallback(free)
                .withBudget(BudgetConfig.of(0.01, BudgetPeriod.DAILY))
                .withTokenEstimator(payload -> 1_000)
                .build();

        assertEquals("llama:x", router.invoke("x"));
        assertEquals(0, pricey.getCalls());
    }

    @Test
    void invoke_recordsCostFromReportedUsage() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o").reportingUsage(1_000, 500);
        Router<String, String> router = builder()
                .withPrimary(primary, new ModelPricing(2.0, 4.0))
                .withBudget(BudgetConfig.of(100.0, BudgetPeriod.DAILY))
                .build();

        router.invoke("x");

        // 1000 * 2/1000 + 500 * 4/1000
        assertEquals(4.0, router.getBudget().getSpent(BudgetPeriod.DAILY), 1e-9);
        assertEquals(4.0, router.getBudget().getSpent(BudgetPeriod.DAILY, "openai/gpt-4o"), 1e-9);
    }

    @Test
    void invoke_overspendOnSuccessStillReturnsResponse() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o").reportingUsage(1_000, 1_000);
        Router<String, String> router = builder()
                .withPrimary(primary, new ModelPricing(1.0, 1.0))
                .withBudget(BudgetConfig.of(1.0, BudgetPeriod.DAILY))
                .withTokenEstimator(payload -> 10)
                .build();

        assertEquals("gpt-4o:x", router.invoke("x"));
        assertEquals(2.0, router.getBudget().getSpent(BudgetPeriod.DAILY), 1e-9);
        assertThrows(BudgetExceededException.class, () -> router.invoke("y"));
    }

    @Test
    void invoke_costOptimizedTriesCheapestFirst() {
        FakeBackend pricey = FakeBackend.of("openai", "gpt-4o");
        FakeBackend cheap = FakeBackend.of("openai", "gpt-4o-mini");
        Router<String, String> router = builder()
                .withPrimary(pricey, new ModelPricing(5.0, 15.0))
                .withFallback(cheap, new ModelPricing(0.15, 0.6))
                .withFallbackStrategy(FallbackStrategyKind.COST_OPTIMIZED)
                .build();

        assertEquals("gpt-4o-mini:x", router.invoke("x"));
        assertEquals(0, pricey.getCalls());
    }

    @Test
    void invoke_smartStrategyLearnsFromFailures() {
        FakeBackend flaky = FakeBackend.of("openai", "gpt-4o").failingWith(new IOException("down"));
        FakeBackend steady = FakeBackend.of("anthropic", "claude");
        Router<String, String> router = builder()
                .withPrimary(flaky)
                .withFallback(steady)
                .withFallbackStrategy(FallbackStrategyKind.SMART)
                .build();

        router.invoke("first");
        router.invoke("second");

        assertEquals(1, flaky.getCalls());
        assertEquals(2, steady.getCalls());
    }

    @Test
    void invoke_eachCandidateTriedAtMostOnce() {
        FakeBackend a = FakeBackend.of("openai", "gpt-4o").failingWith(new IOException("down"));
        FakeBackend b = FakeBackend.of("anthropic", "claude").failingWith(new IOException("down"));
        FakeBackend c = FakeBackend.of("google", "gemini").failingWith(new IOException("down"));
        Router<String, String> router = builder()
                .withPrimary(a)
                .withFallbacks(List.of(b, c))
                .withFallbackStrategy(FallbackStrategyKind.SMART)
                .build();

        assertThrows(AllBackendsExhaustedException.class, () -> router.invoke("x"));

        assertEquals(1, a.getCalls());
        assertEquals(1, b.getCalls());
        assertEquals(1, c.getCalls());
    }

    @Test
    void invoke_concurrentCallersNeverExceedSafeLimit() throws Exception {
        // RPM 6 with margin 2: at most 4 calls per window, one per 10s spacing
        FakeBackend only = FakeBackend.of("openai", "gpt-4o", 6, 1_000_000, 128_000);
        Router<String, String> router = builder()
                .withPrimary(only)
                .withMaxWait(Duration.ZERO)
                .build();
        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        int served = 0;
        for (int wave = 0; wave < 6; wave++) {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                tasks.add(() -> {
                    try {
                        router.invoke("hi");
                        return true;
                    } catch (AllBackendsExhaustedException e) {
                        return false;
                    }
                });
            }
            int servedInWave = 0;
            for (Future<Boolean> result : executor.invokeAll(tasks)) {
                if (result.get()) {
                    servedInWave++;
                }
            }
            assertTrue(servedInWave <= 1, "spacing admits a single caller per instant");
            served += servedInWave;
            clock.advanceSeconds(10);
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(4, served);
        assertEquals(4, only.getCalls());
        RouterStats stats = router.getStats();
        assertEquals(6L * callers, stats.getTotalRequests());
        assertEquals(4, stats.getPrimaryRequests());
        assertEquals(6L * callers - 4, stats.getExhausted());
    }

    @Test
    void status_reportsUsageBudgetsAndStats() {
        FakeBackend primary = FakeBackend.of("openai", "gpt-4o");
        FakeBackend large = FakeBackend.of("google", "gemini-pro", 60, 10_000_000, 2_097_152);
        Router<String, String> router = builder()
                .withPrimary(primary, new ModelPricing(1.0, 1.0))
                .withLargeContextBackend(large)
                .withBudget(10.0, null, null, 100.0)
                .withTokenEstimator(payload -> 40)
                .build();

        router.invoke("x");
        RouterStatus status = router.status();

        assertEquals("openai/gpt-4o", status.getPrimaryModel());
        assertEquals("sequential", status.getStrategy());
        assertEquals(List.of("openai/gpt-4o", "google/gemini-pro"), List.copyOf(status.getUsage().keySet()));
        assertEquals(1, status.getUsage().get("openai/gpt-4o").getCurrentRequests());
        assertEquals(40L, status.getUsage().get("openai/gpt-4o").getCurrentTokens());
        assertEquals(2, status.getBudgets().size());
        assertEquals(0.04, status.getBudgets().get(BudgetPeriod.HOURLY).getSpent(), 1e-9);
        assertEquals(1, status.getStats().getTotalRequests());
    }
}
