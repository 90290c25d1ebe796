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

package org.fireflyframework.scheduler.core;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.directory.EntityDirectory;
import org.fireflyframework.scheduler.metrics.SchedulerMetrics;
import org.fireflyframework.scheduler.model.EntityKind;
import org.fireflyframework.scheduler.model.SnapshotRequest;
import org.fireflyframework.scheduler.model.Timer;
import org.fireflyframework.scheduler.store.TimerStore;
import org.fireflyframework.scheduler.trigger.SnapshotTrigger;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fires a single timer.
 * <p>
 * A dispatch:
 * <ol>
 *   <li>optionally re-reads the timer and gives up unless it is still due</li>
 *   <li>reconciles the membership lists of custom timers</li>
 *   <li>advances and stores the next trigger time</li>
 *   <li>builds the snapshot request, limited to enabled entities for custom timers</li>
 *   <li>calls the snapshot service</li>
 * </ol>
 * <p>
 * A failing snapshot call does not roll back the advanced trigger time: a
 * missed firing is not retried, the timer simply waits for its next one.
 * Errors never escape {@link #dispatch}; they are logged and reported as a
 * {@link DispatchOutcome}.
 */
@Slf4j
public class TimerDispatcher {

    private final TimerStore timerStore;
    private final EntityDirectory directory;
    private final TimerReconciler reconciler;
    private final NextFireTimeCalculator calculator;
    private final SnapshotTrigger snapshotTrigger;
    private final Clock clock;
    private final SchedulerMetrics metrics;

    public TimerDispatcher(TimerStore timerStore,
                           EntityDirectory directory,
                           TimerReconciler reconciler,
                           NextFireTimeCalculator calculator,
                           SnapshotTrigger snapshotTrigger,
                           Clock clock,
                           @Nullable SchedulerMetrics metrics) {
        this.timerStore = timerStore;
        this.directory = directory;
        this.reconciler = reconciler;
        this.calculator = calculator;
        this.snapshotTrigger = snapshotTrigger;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Dispatches a timer.
     *
     * @param timer   the timer as seen by the scan
     * @param checked whether to re-read the timer and verify it is still due
     *                (used for deferred dispatches, whose configuration may
     *                have changed since they were scheduled)
     * @return a Mono with the outcome; never errors
     */
    public Mono<DispatchOutcome> dispatch(Timer timer, boolean checked) {
        Mono<Timer> source = checked ? recheck(timer) : Mono.just(timer);

        return source
                .flatMap(current -> reconciler.reconcile(current)
                        .flatMap(this::advance)
                        .flatMap(this::buildRequest)
                        .flatMap(this::trigger))
                .defaultIfEmpty(DispatchOutcome.NOT_DUE)
                .onErrorResume(e -> {
                    log.error("Dispatch abandoned for project {}; timer stays due for the next scan",
                            timer.getProjectId(), e);
                    return Mono.just(DispatchOutcome.ABANDONED);
                })
                .doOnNext(outcome -> {
                    log.debug("Dispatch finished: projectId={}, outcome={}", timer.getProjectId(), outcome);
                    if (metrics != null) {
                        metrics.recordDispatch(outcome.name());
                    }
                });
    }

    private Mono<Timer> recheck(Timer timer) {
        return timerStore.findTimerById(timer.getId())
                .filter(current -> current.isDueAt(clock.instant()))
                .doOnNext(current -> log.info("Check timer needDispatch: true, projectId={}", current.getProjectId()))
                .switchIfEmpty(Mono.fromRunnable(() ->
                        log.info("Check timer needDispatch: false, projectId={}", timer.getProjectId())));
    }

    private Mono<Timer> advance(Timer timer) {
        Instant next = calculator.nextFireTime(timer, clock.instant());
        log.info("Update next trigger time with project id: {}, and next time is {}", timer.getProjectId(), next);
        return timerStore.updateNextFireTime(timer.getId(), next)
                .thenReturn(timer.toBuilder().nextTriggerTime(next).build());
    }

    private Mono<SnapshotRequest> buildRequest(Timer timer) {
        if (!timer.isCustom()) {
            return Mono.just(SnapshotRequest.allEntities(timer.getProjectId()));
        }

        Long projectId = timer.getProjectId();
        return Mono.zip(
                        directory.listEnabled(EntityKind.PAGE, projectId),
                        directory.listEnabled(EntityKind.PROFILE, projectId),
                        directory.listEnabled(EntityKind.ENVIRONMENT, projectId))
                .map(enabled -> SnapshotRequest.of(projectId,
                        retainEnabled(timer.idsOf(EntityKind.PAGE), enabled.getT1()),
                        retainEnabled(timer.idsOf(EntityKind.PROFILE), enabled.getT2()),
                        retainEnabled(timer.idsOf(EntityKind.ENVIRONMENT), enabled.getT3())));
    }

    private Mono<DispatchOutcome> trigger(SnapshotRequest request) {
        return Mono.defer(() -> snapshotTrigger.trigger(request))
                .thenReturn(DispatchOutcome.DISPATCHED)
                .doOnNext(outcome -> log.info("Snapshot triggered for project {}", request.projectId()))
                .onErrorResume(e -> {
                    log.error("Failed to dispatch schedule job for project {}", request.projectId(), e);
                    return Mono.just(DispatchOutcome.TRIGGER_FAILED);
                });
    }

    private static List<Long> retainEnabled(List<Long> ids, List<Long> enabled) {
        Set<Long> enabledSet = new HashSet<>(enabled);
        return ids.stream().filter(enabledSet::contains).toList();
    }
}
