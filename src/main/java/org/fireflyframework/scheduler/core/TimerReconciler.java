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
import org.fireflyframework.scheduler.model.MonitorType;
import org.fireflyframework.scheduler.model.Timer;
import org.fireflyframework.scheduler.store.TimerStore;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops deleted entities from the membership lists of custom timers.
 * <p>
 * Pages, profiles and environments can be deleted without the timer being
 * told. Before each dispatch the stored ids are intersected with the ids
 * that still exist. If any of the three lists ends up empty, the timer is
 * promoted to {@link MonitorType#ALL} and all lists are cleared; otherwise
 * the lists are narrowed in their original order. Timers are written back
 * only when something changed, so reconciling twice is a no-op.
 */
@Slf4j
public class TimerReconciler {

    private final EntityDirectory directory;
    private final TimerStore timerStore;
    private final SchedulerMetrics metrics;

    public TimerReconciler(EntityDirectory directory, TimerStore timerStore, @Nullable SchedulerMetrics metrics) {
        this.directory = directory;
        this.timerStore = timerStore;
        this.metrics = metrics;
    }

    /**
     * Reconciles a timer against the entities that currently exist.
     *
     * @param timer the timer to check
     * @return a Mono with the reconciled (and persisted, if changed) timer
     */
    public Mono<Timer> reconcile(Timer timer) {
        if (!timer.isCustom()) {
            return Mono.just(timer);
        }

        return Mono.zip(
                        directory.listAll(EntityKind.PAGE),
                        directory.listAll(EntityKind.PROFILE),
                        directory.listAll(EntityKind.ENVIRONMENT))
                .flatMap(live -> {
                    Timer reconciled = reconcileAgainst(timer, live.getT1(), live.getT2(), live.getT3());
                    if (reconciled.equals(timer)) {
                        return Mono.just(timer);
                    }

                    String result = reconciled.isCustom() ? "narrowed" : "promoted";
                    log.info("Timer membership {} for project {}: pages={}, profiles={}, envs={}",
                            result, timer.getProjectId(),
                            reconciled.getPageIds(), reconciled.getProfileIds(), reconciled.getEnvIds());
                    if (metrics != null) {
                        metrics.recordReconciliation(result);
                    }
                    return timerStore.createOrUpdateTimer(reconciled);
                });
    }

    /**
     * Pure reconciliation step against known live id sets.
     */
    Timer reconcileAgainst(Timer timer, Collection<Long> livePages,
                           Collection<Long> liveProfiles, Collection<Long> liveEnvs) {
        if (!timer.isCustom()) {
            return timer;
        }

        List<Long> pageIds = retainLive(timer.idsOf(EntityKind.PAGE), livePages);
        List<Long> profileIds = retainLive(timer.idsOf(EntityKind.PROFILE), liveProfiles);
        List<Long> envIds = retainLive(timer.idsOf(EntityKind.ENVIRONMENT), liveEnvs);

        if (pageIds.isEmpty() || profileIds.isEmpty() || envIds.isEmpty()) {
            return timer.toBuilder()
                    .monitorType(MonitorType.ALL)
                    .pageIds(new ArrayList<>())
                    .profileIds(new ArrayList<>())
                    .envIds(new ArrayList<>())
                    .build();
        }

        return timer.toBuilder()
                .pageIds(pageIds)
                .profileIds(profileIds)
                .envIds(envIds)
                .build();
    }

    private static List<Long> retainLive(List<Long> ids, Collection<Long> live) {
        Set<Long> liveSet = new HashSet<>(live);
        List<Long> kept = new ArrayList<>(ids.size());
        for (Long id : ids) {
            if (liveSet.contains(id)) {
                kept.add(id);
            }
        }
        return kept;
    }
}
