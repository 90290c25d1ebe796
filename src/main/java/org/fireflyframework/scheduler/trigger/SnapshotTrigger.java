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

package org.fireflyframework.scheduler.trigger;

import org.fireflyframework.scheduler.model.SnapshotRequest;
import reactor.core.publisher.Mono;

/**
 * Downstream snapshot service invoked once per timer firing.
 * <p>
 * Applications provide the implementation as a Spring bean. The scheduler
 * never retries a failed call and may, rarely, call twice for one firing,
 * so implementations should tolerate duplicates.
 */
@FunctionalInterface
public interface SnapshotTrigger {

    /**
     * Requests snapshots for the given project entities.
     *
     * @param request the snapshot request
     * @return a Mono that completes when the request has been accepted
     */
    Mono<Void> trigger(SnapshotRequest request);
}
