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

package org.fireflyframework.scheduler.directory;

import org.fireflyframework.scheduler.model.EntityKind;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;

/**
 * Read access to the pages, profiles and environments a timer can target.
 * <p>
 * Entities have an internal id (storage key, used on timers) and an
 * external id that is unique within a project and shown to users.
 */
public interface EntityDirectory {

    /**
     * Lists internal ids of the enabled entities of a project.
     *
     * @param kind      the entity kind
     * @param projectId the project ID
     * @return a Mono containing the internal ids
     */
    Mono<List<Long>> listEnabled(EntityKind kind, Long projectId);

    /**
     * Lists internal ids of every existing entity of a kind, enabled or not.
     *
     * @param kind the entity kind
     * @return a Mono containing the internal ids
     */
    Mono<List<Long>> listAll(EntityKind kind);

    /**
     * Translates external ids of a project into internal ids. Unknown ids
     * are dropped.
     *
     * @param kind        the entity kind
     * @param projectId   the project ID
     * @param externalIds the external ids
     * @return a Mono containing the matching internal ids
     */
    Mono<List<Long>> resolveExternalToInternal(EntityKind kind, Long projectId, Collection<Long> externalIds);

    /**
     * Translates internal ids into external ids. Unknown ids are dropped.
     *
     * @param kind        the entity kind
     * @param internalIds the internal ids
     * @return a Mono containing the matching external ids
     */
    Mono<List<Long>> resolveInternalToExternal(EntityKind kind, Collection<Long> internalIds);
}
