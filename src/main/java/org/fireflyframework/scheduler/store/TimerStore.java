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

package org.fireflyframework.scheduler.store;

import org.fireflyframework.scheduler.model.Timer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Durable storage of project timers.
 * <p>
 * Writes are last-write-wins; the store does not serialize concurrent
 * updates of the same timer.
 */
public interface TimerStore {

    /**
     * Finds the timer of a project.
     *
     * @param projectId the project ID
     * @return a Mono containing the timer if one is configured
     */
    Mono<Timer> findTimerByProject(Long projectId);

    /**
     * Finds a timer by its ID.
     *
     * @param id the timer ID
     * @return a Mono containing the timer if found
     */
    Mono<Timer> findTimerById(Long id);

    /**
     * Finds all scheduled timers whose next trigger time is strictly before
     * {@code before}. Timers with schedule {@code OFF} are never returned.
     *
     * @param before exclusive upper bound for the next trigger time
     * @return a Flux of candidate timers
     */
    Flux<Timer> findDueTimers(Instant before);

    /**
     * Inserts the timer, or replaces the timer of the same project.
     *
     * @param timer the timer to save
     * @return a Mono containing the saved timer with its ID assigned
     */
    Mono<Timer> createOrUpdateTimer(Timer timer);

    /**
     * Updates only the next trigger time of a timer.
     *
     * @param id          the timer ID
     * @param nextTrigger the new next trigger time
     * @return a Mono that completes when updated
     */
    Mono<Void> updateNextFireTime(Long id, Instant nextTrigger);
}
