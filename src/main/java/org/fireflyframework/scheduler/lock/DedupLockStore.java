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

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Shared key-value store with expiring keys used as an advisory dispatch lease.
 * <p>
 * The lease is not a mutual-exclusion primitive: it only prevents processes
 * from scheduling the same firing twice during one scan window. An expired
 * key is indistinguishable from an absent one.
 */
public interface DedupLockStore {

    /**
     * Reads a key.
     *
     * @param key the key
     * @return a Mono with the value, empty if the key is absent or expired
     */
    Mono<String> get(String key);

    /**
     * Writes a key that expires after {@code ttl}.
     *
     * @param key   the key
     * @param value the value
     * @param ttl   time-to-live
     * @return a Mono that completes when the key is written
     */
    Mono<Void> set(String key, String value, Duration ttl);

    /**
     * Deletes a key. Best effort: implementations complete normally even if
     * the underlying store fails.
     *
     * @param key the key
     * @return a Mono that completes when the delete was attempted
     */
    Mono<Void> delete(String key);
}
