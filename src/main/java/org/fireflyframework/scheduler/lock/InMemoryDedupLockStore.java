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

package org.fireflyframework.scheduler.lock;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link DedupLockStore}.
 * <p>
 * Only suitable for single-process deployments and tests: leases are not
 * visible to other processes. Expired entries are removed lazily on read.
 */
@Slf4j
public class InMemoryDedupLockStore implements DedupLockStore {

    private final Map<String, LeaseEntry> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    private record LeaseEntry(String value, Instant expiresAt) {
    }

    public InMemoryDedupLockStore(Clock clock) {
        this.clock = clock;
        log.info("InMemoryDedupLockStore initialized; leases are not shared between processes");
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> {
            LeaseEntry entry = leases.get(key);
            if (entry == null) {
                return null;
            }
            if (!clock.instant().isBefore(entry.expiresAt())) {
                leases.remove(key, entry);
                return null;
            }
            return entry.value();
        });
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        return Mono.fromRunnable(() -> leases.put(key, new LeaseEntry(value, clock.instant().plus(ttl))));
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> leases.remove(key));
    }

    /**
     * Number of stored leases, including expired ones not yet evicted.
     */
    public int size() {
        return leases.size();
    }
}
