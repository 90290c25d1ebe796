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
import org.fireflyframework.scheduler.model.SnapshotRequest;
import org.fireflyframework.scheduler.model.SnapshotTriggerSource;
import org.fireflyframework.scheduler.model.Timer;
import org.fireflyframework.scheduler.store.InMemoryTimerStore;
import org.fireflyframework.scheduler.store.TimerStore;
import org.fireflyframework.scheduler.trigger.SnapshotTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link TimerDispatcher}.
 */
@ExtendWith(MockitoExtension.class)
class TimerDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-01-10T08:00:00Z");
    private static final Long PROJECT_ID = 42L;

    @Mock
    private EntityDirectory directory;

    private final List<SnapshotRequest> triggered = new CopyOnWriteArrayList<>();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final NextFireTimeCalculator calculator = new NextFireTimeCalculator(ZoneOffset.UTC);

    private InMemoryTimerStore timerStore;
    private SimpleMeterRegistry meterRegistry;
    private SchedulerMetrics metrics;

    @BeforeEach
    void setUp() {
        timerStore = new InMemoryTimerStore();
        meterRegistry = new SimpleMeterRegistry();
        metrics = new SchedulerMetrics(meterRegistry);
    }

    private TimerDispatcher dispatcher(TimerStore store, SnapshotTrigger trigger) {
        TimerReconciler reconciler = new TimerReconciler(directory, store, metrics);
        return new TimerDispatcher(store, directory, reconciler, calculator, trigger, clock, metrics);
    }

    private TimerDispatcher recordingDispatcher() {
        return dispatcher(timerStore, request -> Mono.fromRunnable(() -> triggered.add(request)));
    }

    private Timer save(Timer timer) {
        return timerStore.createOrUpdateTimer(timer).block();
    }

    private Timer hourlyTimer(Instant nextTriggerTime) {
        return Timer.builder()
                .projectId(PROJECT_ID)
                .schedule(ScheduleType.HOURLY)
                .nextTriggerTime(nextTriggerTime)
                .build();
    }

    private double dispatchCount(String outcome) {
        return meterRegistry.counter("firefly.scheduler.dispatches", "outcome", outcome).count();
    }

    @Nested
    @DisplayName("Unchecked dispatch")
    class UncheckedDispatchTests {

        @Test
        @DisplayName("should advance the timer and trigger a snapshot of all entities")
        void shouldDispatchAllTimer() {
            Timer timer = save(hourlyTimer(NOW.minusSeconds(5)));

            StepVerifier.create(recordingDispatcher().dispatch(timer, false))
                    .expectNext(DispatchOutcome.DISPATCHED)
                    .verifyComplete();

            assertThat(triggered).hasSize(1);
            SnapshotRequest request = triggered.get(0);
            assertThat(request.projectId()).isEqualTo(PROJECT_ID);
            assertThat(request.coversAllEntities()).isTrue();
            assertThat(request.trigger()).isEqualTo(SnapshotTriggerSource.SCHEDULER);

            assertThat(timerStore.findTimerById(timer.getId()).block().getNextTriggerTime())
                    .isEqualTo(NOW.plus(Duration.ofHours(1)));
            assertThat(dispatchCount("dispatched")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should limit a custom snapshot to enabled entities")
        void shouldFilterCustomTimerToEnabledEntities() {
            Timer timer = save(Timer.builder()
                    .projectId(PROJECT_ID)
                    .schedule(ScheduleType.HOURLY)
                    .monitorType(MonitorType.CUSTOM)
                    .pageIds(new ArrayList<>(List.of(1L, 2L, 3L)))
                    .profileIds(new ArrayList<>(List.of(10L, 11L)))
                    .envIds(new ArrayList<>(List.of(20L)))
                    .nextTriggerTime(NOW)
                    .build());
            when(directory.listAll(EntityKind.PAGE)).thenReturn(Mono.just(List.of(1L, 2L, 3L)));
            when(directory.listAll(EntityKind.PROFILE)).thenReturn(Mono.just(List.of(10L, 11L)));
            when(directory.listAll(EntityKind.ENVIRONMENT)).thenReturn(Mono.just(List.of(20L)));
            when(directory.listEnabled(EntityKind.PAGE, PROJECT_ID)).thenReturn(Mono.just(List.of(3L, 1L)));
            when(directory.listEnabled(EntityKind.PROFILE, PROJECT_ID)).thenReturn(Mono.just(List.of(11L)));
            when(directory.listEnabled(EntityKind.ENVIRONMENT, PROJECT_ID)).thenReturn(Mono.just(List.of(20L)));

            StepVerifier.create(recordingDispatcher().dispatch(timer, false))
                    .expectNext(DispatchOutcome.DISPATCHED)
                    .verifyComplete();

            SnapshotRequest request = triggered.get(0);
            assertThat(request.pageIds()).containsExactly(1L, 3L);
            assertThat(request.profileIds()).containsExactly(11L);
            assertThat(request.envIds()).containsExactly(20L);
        }

        @Test
        @DisplayName("should promote a custom timer with deleted entities and snapshot everything")
        void shouldPromoteAndDispatchAll() {
            Timer timer = save(Timer.builder()
                    .projectId(PROJECT_ID)
                    .schedule(ScheduleType.HOURLY)
                    .monitorType(MonitorType.CUSTOM)
                    .pageIds(new ArrayList<>(List.of(1L)))
                    .profileIds(new ArrayList<>(List.of(10L)))
                    .envIds(new ArrayList<>(List.of(20L)))
                    .nextTriggerTime(NOW)
                    .build());
            when(directory.listAll(EntityKind.PAGE)).thenReturn(Mono.just(List.of()));
            when(directory.listAll(EntityKind.PROFILE)).thenReturn(Mono.just(List.of(10L)));
            when(directory.listAll(EntityKind.ENVIRONMENT)).thenReturn(Mono.just(List.of(20L)));

            StepVerifier.create(recordingDispatcher().dispatch(timer, false))
                    .expectNext(DispatchOutcome.DISPATCHED)
                    .verifyComplete();

            assertThat(triggered.get(0).coversAllEntities()).isTrue();
            Timer stored = timerStore.findTimerById(timer.getId()).block();
            assertThat(stored.getMonitorType()).isEqualTo(MonitorType.ALL);
            assertThat(stored.getNextTriggerTime()).isEqualTo(NOW.plus(Duration.ofHours(1)));
            verify(directory, never()).listEnabled(any(), any());
        }
    }

    @Nested
    @DisplayName("Checked dispatch")
    class CheckedDispatchTests {

        @Test
        @DisplayName("should do nothing when the stored timer is no longer due")
        void shouldSkipWhenNotDue() {
            Timer timer = save(hourlyTimer(NOW.plusSeconds(60)));

            StepVerifier.create(recordingDispatcher().dispatch(timer, true))
                    .expectNext(DispatchOutcome.NOT_DUE)
                    .verifyComplete();

            assertThat(triggered).isEmpty();
            assertThat(timerStore.findTimerById(timer.getId()).block().getNextTriggerTime())
                    .isEqualTo(NOW.plusSeconds(60));
            assertThat(dispatchCount("not_due")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should do nothing when the timer was switched off")
        void shouldSkipWhenSwitchedOff() {
            Timer timer = save(hourlyTimer(NOW.minusSeconds(1)));
            save(timer.toBuilder().schedule(ScheduleType.OFF).build());

            StepVerifier.create(recordingDispatcher().dispatch(timer, true))
                    .expectNext(DispatchOutcome.NOT_DUE)
                    .verifyComplete();

            assertThat(triggered).isEmpty();
        }

        @Test
        @DisplayName("should do nothing when the timer no longer exists")
        void shouldSkipWhenMissing() {
            Timer timer = hourlyTimer(NOW).toBuilder().id(999L).build();

            StepVerifier.create(recordingDispatcher().dispatch(timer, true))
                    .expectNext(DispatchOutcome.NOT_DUE)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should use the stored configuration rather than the scanned one")
        void shouldUseCurrentConfiguration() {
            Timer scanned = save(hourlyTimer(NOW.minusSeconds(1)));
            save(scanned.toBuilder().schedule(ScheduleType.EVERY_X_HOUR).hour(3).build());

            StepVerifier.create(recordingDispatcher().dispatch(scanned, true))
                    .expectNext(DispatchOutcome.DISPATCHED)
                    .verifyComplete();

            assertThat(timerStore.findTimerById(scanned.getId()).block().getNextTriggerTime())
                    .isEqualTo(NOW.plus(Duration.ofHours(3)));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should keep the advanced trigger time when the snapshot call fails")
        void shouldNotRollBackOnTriggerFailure() {
            Timer timer = save(hourlyTimer(NOW));
            TimerDispatcher dispatcher = dispatcher(timerStore,
                    request -> Mono.error(new IllegalStateException("snapshot service down")));

            StepVerifier.create(dispatcher.dispatch(timer, false))
                    .expectNext(DispatchOutcome.TRIGGER_FAILED)
                    .verifyComplete();

            assertThat(timerStore.findTimerById(timer.getId()).block().getNextTriggerTime())
                    .isEqualTo(NOW.plus(Duration.ofHours(1)));
            assertThat(dispatchCount("trigger_failed")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should report a trigger that throws as a trigger failure")
        void shouldHandleThrowingTrigger() {
            Timer timer = save(hourlyTimer(NOW));
            TimerDispatcher dispatcher = dispatcher(timerStore, request -> {
                throw new IllegalStateException("boom");
            });

            StepVerifier.create(dispatcher.dispatch(timer, false))
                    .expectNext(DispatchOutcome.TRIGGER_FAILED)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should abandon the dispatch when the store fails")
        void shouldAbandonOnStoreError() {
            TimerStore failingStore = mock(TimerStore.class);
            when(failingStore.updateNextFireTime(any(), any()))
                    .thenReturn(Mono.error(new IllegalStateException("db down")));
            Timer timer = hourlyTimer(NOW).toBuilder().id(1L).build();

            StepVerifier.create(dispatcher(failingStore, request -> Mono.fromRunnable(() -> triggered.add(request)))
                            .dispatch(timer, false))
                    .expectNext(DispatchOutcome.ABANDONED)
                    .verifyComplete();

            assertThat(triggered).isEmpty();
            assertThat(dispatchCount("abandoned")).isEqualTo(1.0);
        }
    }
}
