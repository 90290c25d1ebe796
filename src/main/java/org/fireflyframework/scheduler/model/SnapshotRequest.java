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

package org.fireflyframework.scheduler.model;

import java.util.List;

/**
 * Payload handed to the snapshot service for one firing of a timer.
 * <p>
 * {@code null} id lists mean "every currently enabled entity of the project".
 *
 * @param projectId  the project to snapshot
 * @param pageIds    internal page ids, or {@code null}
 * @param profileIds internal profile ids, or {@code null}
 * @param envIds     internal environment ids, or {@code null}
 * @param trigger    origin of the request
 */
public record SnapshotRequest(
        Long projectId,
        List<Long> pageIds,
        List<Long> profileIds,
        List<Long> envIds,
        SnapshotTriggerSource trigger
) {

    /**
     * Request covering every enabled entity of the project.
     */
    public static SnapshotRequest allEntities(Long projectId) {
        return new SnapshotRequest(projectId, null, null, null, SnapshotTriggerSource.SCHEDULER);
    }

    /**
     * Request limited to the given entity ids.
     */
    public static SnapshotRequest of(Long projectId, List<Long> pageIds, List<Long> profileIds, List<Long> envIds) {
        return new SnapshotRequest(projectId, List.copyOf(pageIds), List.copyOf(profileIds),
                List.copyOf(envIds), SnapshotTriggerSource.SCHEDULER);
    }

    public boolean coversAllEntities() {
        return pageIds == null && profileIds == null && envIds == null;
    }
}
