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
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis-backed {@link DedupLockStore}.
 * <p>
 * Every operation is bounded by {@code operationTimeout}. Read and write
 * failures are propagated so the caller can abandon the timer for the
 * current scan; delete failures are logged and swallowed.
 */
@Slf4j
public class RedisDedupLockStore implements DedupLockStore {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final Duration operationTimeout;

    public RedisDedupLockStore(ReactiveStringRedisTemplate redisTemplate, Duration operationTimeout) {
        this.redisTemplate = redisTemplate;
        this.operationTimeout = operationTimeout;
        log.info("RedisDedupLockStore initialized with operation timeout: {}", operationTimeout);
    }

    @Override
    public Mono<String> get(String key) {
        log.debug("Lease get: {}", key);
        return redisTemplate.opsForValue().get(key)
                .timeout(operationTimeout)
                .doOnError(e -> log.warn("Lease get failed for key {}: {}", key, e.getMessage()));
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        log.debug("Lease set: {} (ttl={})", key, ttl);
        return redisTemplate.opsForValue().set(key, value, ttl)
                .timeout(operationTimeout)
                .doOnError(e -> log.warn("Lease set failed for key {}: {}", key, e.getMessage()))
                .then();
    }

    @Override
    public Mono<Void> delete(String key) {
        log.debug("Lease delete: {}", key);
        return redisTemplate.opsForValue().delete(key)
                .timeout(operationTimeout)
                .onErrorResume(e -> {
                    log.debug("Lease delete failed for key {} (lease will expire): {}", key, e.getMessage());
                    return Mono.just(false);
                })
                .then();
    }
}
