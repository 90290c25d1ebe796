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

package org.fireflyframework.scheduler.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.TimerScanner;
import org.fireflyframework.scheduler.lock.DedupLockStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Health indicator for the snapshot scheduler.
 * <p>
 * Reports the health status based on:
 * <ul>
 *   <li>Lease store connectivity</li>
 *   <li>Scan loop state and pending deferred dispatches (details only)</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class SchedulerHealthIndicator implements ReactiveHealthIndicator {

    static final String HEALTH_CHECK_KEY = "__health_check__";

    private final TimerScanner scanner;
    private final DedupLockStore lockStore;

    @Override
    public Mono<Health> health() {
        return checkLockStore()
                .map(storeHealthy -> {
                    Health.Builder builder = storeHealthy ? Health.up() : Health.down();
                    Instant lastScanAt = scanner.getLastScanAt();

                    return builder
                            .withDetail("scannerRunning", scanner.isRunning())
                            .withDetail("pendingDispatches", scanner.getPendingDispatchCount())
                            .withDetail("lastScanAt", lastScanAt != null ? lastScanAt.toString() : "never")
                            .withDetail("lockStore", storeHealthy ? "connected" : "disconnected")
                            .build();
                })
                .onErrorResume(e -> {
                    log.warn("Scheduler health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Mono<Boolean> checkLockStore() {
        return lockStore.get(HEALTH_CHECK_KEY)
                .map(value -> true)
                .switchIfEmpty(Mono.just(true))
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false);
    }
}
