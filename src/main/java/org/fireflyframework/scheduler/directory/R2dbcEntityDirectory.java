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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.model.EntityKind;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;

/**
 * {@link EntityDirectory} reading the {@code page}, {@code profile} and
 * {@code environment} tables through Spring R2DBC.
 * <p>
 * Column {@code id} is the internal id, {@code iid} the external one.
 * Empty id collections short-circuit without a query.
 */
@Slf4j
@RequiredArgsConstructor
public class R2dbcEntityDirectory implements EntityDirectory {

    private final DatabaseClient databaseClient;

    @Override
    public Mono<List<Long>> listEnabled(EntityKind kind, Long projectId) {
        return databaseClient.sql("SELECT id FROM " + kind.tableName()
                        + " WHERE project_id = :projectId AND disable = FALSE")
                .bind("projectId", projectId)
                .map(row -> row.get("id", Long.class))
                .all()
                .collectList();
    }

    @Override
    public Mono<List<Long>> listAll(EntityKind kind) {
        return databaseClient.sql("SELECT id FROM " + kind.tableName())
                .map(row -> row.get("id", Long.class))
                .all()
                .collectList();
    }

    @Override
    public Mono<List<Long>> resolveExternalToInternal(EntityKind kind, Long projectId, Collection<Long> externalIds) {
        if (externalIds == null || externalIds.isEmpty()) {
            return Mono.just(List.of());
        }
        return databaseClient.sql("SELECT id FROM " + kind.tableName()
                        + " WHERE project_id = :projectId AND iid IN (:iids)")
                .bind("projectId", projectId)
                .bind("iids", List.copyOf(externalIds))
                .map(row -> row.get("id", Long.class))
                .all()
                .collectList()
                .doOnNext(ids -> log.debug("Resolved {} external {} ids to {} internal ids in project {}",
                        externalIds.size(), kind, ids.size(), projectId));
    }

    @Override
    public Mono<List<Long>> resolveInternalToExternal(EntityKind kind, Collection<Long> internalIds) {
        if (internalIds == null || internalIds.isEmpty()) {
            return Mono.just(List.of());
        }
        return databaseClient.sql("SELECT iid FROM " + kind.tableName() + " WHERE id IN (:ids)")
                .bind("ids", List.copyOf(internalIds))
                .map(row -> row.get("iid", Long.class))
                .all()
                .collectList();
    }
}
