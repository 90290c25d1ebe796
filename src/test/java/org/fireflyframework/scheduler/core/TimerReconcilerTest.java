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

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.scheduler.directory.EntityDirectory;
import org.fireflyframework.scheduler.metrics.SchedulerMetrics;
import org.fireflyframework.scheduler.model.EntityKind;
import org.fireflyframework.scheduler.model.MonitorType;
import org.fireflyframework.scheduler.model.ScheduleType;
import org.fireflyframework.scheduler.model.Timer;
import org.fireflyframework.scheduler.store.InMemoryTimerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link TimerReconciler}.
 */
@ExtendWith(MockitoExtension.class)
class TimerReconcilerTest {

    private static final Long PROJECT_ID = 7L;

    @Mock
    private EntityDirectory directory;

    private InMemoryTimerStore timerStore;
    private SimpleMeterRegistry meterRegistry;
    private TimerReconciler reconciler;

    @BeforeEach
    void setUp() {
        timerStore = new InMemoryTimerStore();
        meterRegistry = new SimpleMeterRegistry();
        reconciler = new TimerReconciler(directory, timerStore, new SchedulerMetrics(meterRegistry));
    }

    private Timer customTimer(List<Long> pages, List<Long> profiles, List<Long> envs) {
        return Timer.builder()
                .projectId(PROJECT_ID)
                .schedule(ScheduleType.HOURLY)
                .monitorType(MonitorType.CUSTOM)
                .pageIds(new ArrayList<>(pages))
                .profileIds(new ArrayList<>(profiles))
                .envIds(new ArrayList<>(envs))
                .nextTriggerTime(Instant.parse("2024-01-10T09:00:00Z"))
                .build();
    }

    private void liveEntities(List<Long> pages, List<Long> profiles, List<Long> envs) {
        when(directory.listAll(EntityKind.PAGE)).thenReturn(Mono.just(pages));
        when(directory.listAll(EntityKind.PROFILE)).thenReturn(Mono.just(profiles));
        when(directory.listAll(EntityKind.ENVIRONMENT)).thenReturn(Mono.just(envs));
    }

    @Nested
    @DisplayName("reconcileAgainst")
    class PureReconciliationTests {

        @Test
        @DisplayName("should drop deleted ids and keep the original order")
        void shouldNarrowInOrder() {
            Timer timer = customTimer(List.of(3L, 1L, 2L), List.of(10L), List.of(20L, 21L));

            Timer result = reconciler.reconcileAgainst(timer, List.of(1L, 3L), List.of(10L, 11L), List.of(21L, 20L));

            assertThat(result.getMonitorType()).isEqualTo(MonitorType.CUSTOM);
            assertThat(result.getPageIds()).containsExactly(3L, 1L);
            assertThat(result.getProfileIds()).containsExactly(10L);
            assertThat(result.getEnvIds()).containsExactly(20L, 21L);
        }

        @Test
        @DisplayName("should promote to ALL and clear every list when one kind is emptied")
        void shouldPromoteWhenAnyListEmpties() {
            Timer timer = customTimer(List.of(1L, 2L), List.of(10L), List.of(20L));

            Timer result = reconciler.reconcileAgainst(timer, List.of(1L, 2L), List.of(99L), List.of(20L));

            assertThat(result.getMonitorType()).isEqualTo(MonitorType.ALL);
            assertThat(result.getPageIds()).isEmpty();
            assertThat(result.getProfileIds()).isEmpty();
            assertThat(result.getEnvIds()).isEmpty();
        }

        @Test
        @DisplayName("should promote a custom timer whose lists were already empty")
        void shouldPromoteAlreadyEmptyCustomTimer() {
            Timer timer = customTimer(List.of(), List.of(10L), List.of(20L));

            Timer result = reconciler.reconcileAgainst(timer, List.of(1L), List.of(10L), List.of(20L));

            assertThat(result.getMonitorType()).isEqualTo(MonitorType.ALL);
        }

        @Test
        @DisplayName("should be idempotent")
        void shouldBeIdempotent() {
            Timer timer = customTimer(List.of(1L, 2L, 3L), List.of(10L), List.of(20L));
            List<Long> livePages = List.of(1L, 3L);

            Timer once = reconciler.reconcileAgainst(timer, livePages, List.of(10L), List.of(20L));
            Timer twice = reconciler.reconcileAgainst(once, livePages, List.of(10L), List.of(20L));

            assertThat(twice).isEqualTo(once);
        }
    }

    @Nested
    @DisplayName("reconcile")
    class ReconcileTests {

        @Test
        @DisplayName("should persist a narrowed timer")
        void shouldPersistNarrowedTimer() {
            Timer stored = timerStore.createOrUpdateTimer(customTimer(List.of(1L, 2L, 3L), List.of(10L), List.of(20L)))
                    .block();
            liveEntities(List.of(1L, 3L), List.of(10L), List.of(20L));

            StepVerifier.create(reconciler.reconcile(stored))
                    .assertNext(result -> assertThat(result.getPageIds()).containsExactly(1L, 3L))
                    .verifyComplete();

            StepVerifier.create(timerStore.findTimerByProject(PROJECT_ID))
                    .assertNext(persisted -> {
                        assertThat(persisted.getMonitorType()).isEqualTo(MonitorType.CUSTOM);
                        assertThat(persisted.getPageIds()).containsExactly(1L, 3L);
                    })
                    .verifyComplete();
            assertThat(meterRegistry.counter("firefly.scheduler.reconciliations", "result", "narrowed").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should persist a promoted timer")
        void shouldPersistPromotedTimer() {
            Timer stored = timerStore.createOrUpdateTimer(customTimer(List.of(1L), List.of(10L), List.of(20L)))
                    .block();
            liveEntities(List.of(1L), List.of(), List.of(20L));

            StepVerifier.create(reconciler.reconcile(stored))
                    .assertNext(result -> assertThat(result.getMonitorType()).isEqualTo(MonitorType.ALL))
                    .verifyComplete();

            assertThat(timerStore.findTimerByProject(PROJECT_ID).block().getMonitorType())
                    .isEqualTo(MonitorType.ALL);
        }

        @Test
        @DisplayName("should not write when nothing changed")
        void shouldNotWriteUnchangedTimer() {
            InMemoryTimerStore spyStore = spy(new InMemoryTimerStore());
            TimerReconciler spyReconciler = new TimerReconciler(directory, spyStore, null);
            Timer timer = customTimer(List.of(1L), List.of(10L), List.of(20L));
            liveEntities(List.of(1L, 2L), List.of(10L), List.of(20L));

            StepVerifier.create(spyReconciler.reconcile(timer))
                    .expectNext(timer)
                    .verifyComplete();

            verify(spyStore, never()).createOrUpdateTimer(any());
        }

        @Test
        @DisplayName("should pass ALL timers through without touching the directory")
        void shouldPassThroughAllTimers() {
            Timer timer = Timer.builder().projectId(PROJECT_ID).schedule(ScheduleType.HOURLY).build();

            StepVerifier.create(reconciler.reconcile(timer))
                    .expectNext(timer)
                    .verifyComplete();

            verifyNoInteractions(directory);
        }
    }
}
