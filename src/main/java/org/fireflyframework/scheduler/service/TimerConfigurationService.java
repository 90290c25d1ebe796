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

package org.fireflyframework.scheduler.service;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.NextFireTimeCalculator;
import org.fireflyframework.scheduler.directory.EntityDirectory;
import org.fireflyframework.scheduler.exception.TimerConfigurationException;
import org.fireflyframework.scheduler.model.EntityKind;
import org.fireflyframework.scheduler.model.Timer;
import org.fireflyframework.scheduler.model.TimerUpdate;
import org.fireflyframework.scheduler.store.TimerStore;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and updates the timer configuration of a project.
 * <p>
 * Callers work with external entity ids; the stored timer holds internal
 * ids. Every update recomputes the next trigger time from the merged
 * configuration, so a reconfigured timer starts a fresh cycle.
 */
@Slf4j
public class TimerConfigurationService {

    private final TimerStore timerStore;
    private final EntityDirectory directory;
    private final NextFireTimeCalculator calculator;
    private final Clock clock;

    public TimerConfigurationService(TimerStore timerStore,
                                     EntityDirectory directory,
                                     NextFireTimeCalculator calculator,
                                     Clock clock) {
        this.timerStore = timerStore;
        this.directory = directory;
        this.calculator = calculator;
        this.clock = clock;
    }

    /**
     * Returns the timer of a project with external entity ids.
     *
     * @param projectId the project ID
     * @return a Mono containing the timer, empty if none is configured
     */
    public Mono<Timer> getTimer(Long projectId) {
        return timerStore.findTimerByProject(projectId)
                .flatMap(timer -> Mono.zip(
                                directory.resolveInternalToExternal(EntityKind.PAGE, timer.idsOf(EntityKind.PAGE)),
                                directory.resolveInternalToExternal(EntityKind.PROFILE, timer.idsOf(EntityKind.PROFILE)),
                                directory.resolveInternalToExternal(EntityKind.ENVIRONMENT, timer.idsOf(EntityKind.ENVIRONMENT)))
                        .map(ids -> timer.toBuilder()
                                .pageIds(new ArrayList<>(ids.getT1()))
                                .profileIds(new ArrayList<>(ids.getT2()))
                                .envIds(new ArrayList<>(ids.getT3()))
                                .build()));
    }

    /**
     * Applies a configuration update, creating the timer on first use.
     *
     * @param projectId the project ID
     * @param update    the fields to change
     * @return a Mono containing the saved timer (internal entity ids)
     * @throws TimerConfigurationException (as an error signal) if the update is invalid
     */
    public Mono<Timer> updateTimer(Long projectId, TimerUpdate update) {
        return Mono.fromRunnable(() -> validate(projectId, update))
                .then(Mono.defer(() -> Mono.zip(
                        resolve(EntityKind.PAGE, projectId, update.pageIds()),
                        resolve(EntityKind.PROFILE, projectId, update.profileIds()),
                        resolve(EntityKind.ENVIRONMENT, projectId, update.envIds()))))
                .flatMap(resolved -> timerStore.findTimerByProject(projectId)
                        .defaultIfEmpty(Timer.builder().projectId(projectId).build())
                        .map(existing -> merge(existing, update,
                                resolved.getT1(), resolved.getT2(), resolved.getT3())))
                .flatMap(timerStore::createOrUpdateTimer)
                .doOnSuccess(saved -> log.info("Timer updated for project {}: schedule={}, monitorType={}, next={}",
                        projectId, saved.getSchedule(), saved.getMonitorType(), saved.getNextTriggerTime()));
    }

    private Timer merge(Timer existing, TimerUpdate update,
                        List<Long> pageIds, List<Long> profileIds, List<Long> envIds) {
        Timer.TimerBuilder builder = existing.toBuilder();
        if (update.schedule() != null) {
            builder.schedule(update.schedule());
        }
        if (update.timeOfDay() != null) {
            builder.timeOfDay(update.timeOfDay());
        }
        if (update.hour() != null) {
            builder.hour(update.hour());
        }
        if (update.monitorType() != null) {
            builder.monitorType(update.monitorType());
        }
        if (hasIds(update.pageIds())) {
            builder.pageIds(new ArrayList<>(pageIds));
        }
        if (hasIds(update.profileIds())) {
            builder.profileIds(new ArrayList<>(profileIds));
        }
        if (hasIds(update.envIds())) {
            builder.envIds(new ArrayList<>(envIds));
        }

        Timer merged = builder.build();
        merged.setNextTriggerTime(calculator.nextFireTime(merged, clock.instant()));
        return merged;
    }

    private Mono<List<Long>> resolve(EntityKind kind, Long projectId, List<Long> externalIds) {
        return hasIds(externalIds)
                ? directory.resolveExternalToInternal(kind, projectId, externalIds)
                : Mono.just(List.of());
    }

    private static boolean hasIds(List<Long> ids) {
        return ids != null && !ids.isEmpty();
    }

    private static void validate(Long projectId, TimerUpdate update) {
        if (projectId == null) {
            throw new TimerConfigurationException(null, "Project id is required");
        }
        if (update.timeOfDay() != null && (update.timeOfDay() < 0 || update.timeOfDay() > 23)) {
            throw new TimerConfigurationException(projectId,
                    "timeOfDay must be between 0 and 23, got " + update.timeOfDay());
        }
        if (update.hour() != null && update.hour() < 1) {
            throw new TimerConfigurationException(projectId,
                    "hour must be at least 1, got " + update.hour());
        }
    }
}
