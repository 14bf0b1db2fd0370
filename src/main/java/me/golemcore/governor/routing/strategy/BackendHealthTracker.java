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

import me.golemcore.governor.domain.model.CallOutcome;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recent success rate and latency per backend, over a trailing time window
 * capped at a fixed number of samples.
 *
 * <p>
 * A backend with no recent samples reports a success rate of 1.0 and zero
 * latency.
 *
 * @since 1.0
 */
public class BackendHealthTracker {

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_SAMPLES = 100;

    private final Duration window;
    private final int maxSamples;
    private final Clock clock;
    private final Map<String, HealthWindow> windows = new ConcurrentHashMap<>();

    public BackendHealthTracker(Clock clock) {
        this(DEFAULT_WINDOW, DEFAULT_MAX_SAMPLES, clock);
    }

    public BackendHealthTracker(Duration window, int maxSamples, Clock clock) {
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be > 0, got " + maxSamples);
        }
        this.window = Objects.requireNonNull(window, "window");
        this.maxSamples = maxSamples;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void record(String modelKey, boolean success, Duration latency) {
        windows.computeIfAbsent(modelKey, key -> new HealthWindow())
                .add(new Sample(clock.instant(), success, latency == null ? Duration.ZERO : latency));
    }

    public void record(CallOutcome outcome) {
        record(outcome.getModelKey(), outcome.isSuccess(), outcome.getLatency());
    }

    public double successRate(String modelKey) {
        HealthWindow health = windows.get(modelKey);
        return health == null ? 1.0 : health.successRate(clock.instant());
    }

    public Duration averageLatency(String modelKey) {
        HealthWindow health = windows.get(modelKey);
        return health == null ? Duration.ZERO : health.averageLatency(clock.instant());
    }

    public int sampleCount(String modelKey) {
        HealthWindow health = windows.get(modelKey);
        return health == null ? 0 : health.size(clock.instant());
    }

    public void clear() {
        windows.clear();
    }

    private record Sample(Instant at, boolean success, Duration latency) {
    }

    private final class HealthWindow {

        private final Deque<Sample> samples = new ArrayDeque<>();

        synchronized void add(Sample sample) {
            samples.addLast(sample);
            while (samples.size() > maxSamples) {
                samples.pollFirst();
            }
        }

        synchronized double successRate(Instant now) {
            evict(now);
            if (samples.isEmpty()) {
                return 1.0;
            }
            long successes = samples.stream().filter(Sample::success).count();
            return (double) successes / samples.size();
        }

        synchronized Duration averageLatency(Instant now) {
            evict(now);
            if (samples.isEmpty()) {
                return Duration.ZERO;
            }
            long totalNanos = 0;
            for (Sample sample : samples) {
                totalNanos += sample.latency().toNanos();
            }
            return Duration.ofNanos(totalNanos / samples.size());
        }

        synchronized int size(Instant now) {
            evict(now);
            return samples.size();
        }

        private void evict(Instant now) {
            Instant cutoff = now.minus(window);
            while (!samples.isEmpty() && samples.peekFirst().at().isBefore(cutoff)) {
                samples.pollFirst();
            }
        }
    }
}
