package me.golemcore.governor.routing.strategy;

import me.golemcore.governor.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackendHealthTrackerTest {

    private static final String KEY = "openai/gpt-4o";

    private MutableClock clock;
    private BackendHealthTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        tracker = new BackendHealthTracker(clock);
    }

    @Test
    void noHistory_reportsHealthy() {
        assertEquals(1.0, tracker.successRate(KEY));
        assertEquals(Duration.ZERO, tracker.averageLatency(KEY));
        assertEquals(0, tracker.sampleCount(KEY));
    }

    @Test
    void record_tracksSuccessRateAndLatency() {
        tracker.record(KEY, true, Duration.ofMillis(100));
        tracker.record(KEY, true, Duration.ofMillis(300));
        tracker.record(KEY, false, Duration.ofMillis(200));
        tracker.record(KEY, false, null);

        assertEquals(0.5, tracker.successRate(KEY));
        assertEquals(Duration.ofMillis(150), tracker.averageLatency(KEY));
        assertEquals(4, tracker.sampleCount(KEY));
    }

    @Test
    void samplesExpireAfterWindow() {
        tracker.record(KEY, false, Duration.ofSeconds(2));
        clock.advance(Duration.ofMinutes(3));
        tracker.record(KEY, true, Duration.ofSeconds(1));
        clock.advance(Duration.ofMinutes(3));

        assertEquals(1, tracker.sampleCount(KEY));
        assertEquals(1.0, tracker.successRate(KEY));
        assertEquals(Duration.ofSeconds(1), tracker.averageLatency(KEY));
    }

    @Test
    void samplesAreCappedKeepingNewest() {
        BackendHealthTracker small = new BackendHealthTracker(Duration.ofMinutes(5), 2, clock);
        small.record(KEY, false, Duration.ZERO);
        small.record(KEY, true, Duration.ZERO);
        small.record(KEY, true, Duration.ZERO);

        assertEquals(2, small.sampleCount(KEY));
        assertEquals(1.0, small.successRate(KEY));
    }

    @Test
    void rejectsNonPositiveSampleCap() {
        assertThrows(IllegalArgumentException.class, () -> new BackendHealthTracker(Duration.ofMinutes(1), 0, clock));
    }
}
