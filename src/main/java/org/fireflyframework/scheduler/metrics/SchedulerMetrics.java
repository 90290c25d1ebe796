/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.scheduler.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Provides Micrometer metrics for the snapshot scheduler.
 * <p>
 * This class tracks the following metrics:
 * <ul>
 *   <li><b>scans</b> - Counter of completed scan cycles</li>
 *   <li><b>candidates</b> - Counter of timers returned by scans</li>
 *   <li><b>decisions</b> - Counter of per-timer scan decisions (tags: decision)</li>
 *   <li><b>dispatches</b> - Counter of dispatch outcomes (tags: outcome)</li>
 *   <li><b>reconciliations</b> - Counter of membership changes (tags: result)</li>
 *   <li><b>pending</b> - Gauge of deferred dispatches waiting in this process</li>
 * </ul>
 * <p>
 * All metrics are prefixed with "firefly.scheduler.".
 */
@Slf4j
public class SchedulerMetrics {

    private static final String METRIC_PREFIX = "firefly.scheduler.";

    private static final String TAG_DECISION = "decision";
    private static final String TAG_OUTCOME = "outcome";
    private static final String TAG_RESULT = "result";

    private final MeterRegistry meterRegistry;

    public SchedulerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("SchedulerMetrics initialized with MeterRegistry: {}", meterRegistry.getClass().getSimpleName());
    }

    /**
     * Records a finished scan and the number of candidate timers it found.
     */
    public void recordScan(int candidates) {
        Counter.builder(METRIC_PREFIX + "scans")
                .description("Number of due-timer scans")
                .register(meterRegistry)
                .increment();

        Counter.builder(METRIC_PREFIX + "candidates")
                .description("Number of timers found due by scans")
                .register(meterRegistry)
                .increment(candidates);

        log.debug("METRIC: scan candidates={}", candidates);
    }

    /**
     * Records what a scan decided for one timer.
     *
     * @param decision e.g. "immediate", "deferred", "skipped", "failed"
     */
    public void recordDecision(String decision) {
        Counter.builder(METRIC_PREFIX + "decisions")
                .description("Per-timer scan decisions")
                .tag(TAG_DECISION, decision)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Records the outcome of one dispatch.
     */
    public void recordDispatch(String outcome) {
        Counter.builder(METRIC_PREFIX + "dispatches")
                .description("Timer dispatch outcomes")
                .tag(TAG_OUTCOME, outcome.toLowerCase())
                .register(meterRegistry)
                .increment();

        log.debug("METRIC: dispatch outcome={}", outcome);
    }

    /**
     * Records a membership change made by reconciliation.
     *
     * @param result "narrowed" or "promoted"
     */
    public void recordReconciliation(String result) {
        Counter.builder(METRIC_PREFIX + "reconciliations")
                .description("Timer membership reconciliations")
                .tag(TAG_RESULT, result)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Registers the gauge of deferred dispatches pending in this process.
     */
    public void registerPendingGauge(Supplier<Number> pending) {
        Gauge.builder(METRIC_PREFIX + "pending", pending)
                .description("Deferred dispatches scheduled in this process")
                .register(meterRegistry);
    }
}
