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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.model.EntityKind;
import org.fireflyframework.scheduler.model.ScheduleType;
import org.fireflyframework.scheduler.model.Timer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TimerStore} held in process memory.
 * <p>
 * Timers are keyed by ID with a secondary index by project ID. Returned
 * timers are copies, so callers cannot mutate stored state. Used by tests
 * and by single-process deployments without a database.
 */
@Slf4j
public class InMemoryTimerStore implements TimerStore {

    private final ConcurrentHashMap<Long, Timer> timers = new ConcurrentHashMap<>();
    private final Map<Long, Long> projectIndex = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Mono<Timer> findTimerByProject(Long projectId) {
        return Mono.fromSupplier(() -> {
            Long id = projectIndex.get(projectId);
            return id != null ? copyOf(timers.get(id)) : null;
        });
    }

    @Override
    public Mono<Timer> findTimerById(Long id) {
        return Mono.fromSupplier(() -> copyOf(timers.get(id)));
    }

    @Override
    public Flux<Timer> findDueTimers(Instant before) {
        return Flux.defer(() -> Flux.fromIterable(timers.values().stream()
                .filter(timer -> timer.getSchedule() != ScheduleType.OFF)
                .filter(timer -> timer.getNextTriggerTime() != null && timer.getNextTriggerTime().isBefore(before))
                .sorted(Comparator.comparing(Timer::getNextTriggerTime))
                .map(this::copyOf)
                .toList()));
    }

    @Override
    public Mono<Timer> createOrUpdateTimer(Timer timer) {
        return Mono.fromSupplier(() -> {
            Long id = projectIndex.computeIfAbsent(timer.getProjectId(), projectId -> {
                if (timer.getId() != null) {
                    sequence.accumulateAndGet(timer.getId(), Math::max);
                    return timer.getId();
                }
                return sequence.incrementAndGet();
            });
            Timer stored = copyOf(timer);
            stored.setId(id);
            timers.put(id, stored);
            log.debug("Saved timer: id={}, projectId={}", id, timer.getProjectId());
            return copyOf(stored);
        });
    }

    @Override
    public Mono<Void> updateNextFireTime(Long id, Instant nextTrigger) {
        return Mono.fromRunnable(() -> timers.computeIfPresent(id, (key, timer) -> {
            Timer updated = copyOf(timer);
            updated.setNextTriggerTime(nextTrigger);
            return updated;
        }));
    }

    public int size() {
        return timers.size();
    }

    private Timer copyOf(Timer timer) {
        if (timer == null) {
            return null;
        }
        return timer.toBuilder()
                .pageIds(new ArrayList<>(timer.idsOf(EntityKind.PAGE)))
                .profileIds(new ArrayList<>(timer.idsOf(EntityKind.PROFILE)))
                .envIds(new ArrayList<>(timer.idsOf(EntityKind.ENVIRONMENT)))
                .build();
    }
}
