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

package org.fireflyframework.scheduler.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.r2dbc.spi.Readable;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.model.EntityKind;
import org.fireflyframework.scheduler.model.MonitorType;
import org.fireflyframework.scheduler.model.ScheduleType;
import org.fireflyframework.scheduler.model.Timer;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TimerStore} backed by the {@code scheduler_timer} table through Spring R2DBC.
 * <p>
 * Id lists are stored as JSON arrays in text columns. Upserts rely on the
 * unique {@code project_id} constraint (PostgreSQL {@code ON CONFLICT}).
 * See {@code db/scheduler-schema.sql} for the DDL.
 */
@Slf4j
public class R2dbcTimerStore implements TimerStore {

    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() {};

    private static final String SELECT_COLUMNS = """
            SELECT id, project_id, schedule, time_of_day, hour, monitor_type,
                   page_ids, profile_ids, env_ids, next_trigger_time
            FROM scheduler_timer
            """;

    private final DatabaseClient databaseClient;
    private final ObjectMapper objectMapper;

    public R2dbcTimerStore(DatabaseClient databaseClient, ObjectMapper objectMapper) {
        this.databaseClient = databaseClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Timer> findTimerByProject(Long projectId) {
        return databaseClient.sql(SELECT_COLUMNS + "WHERE project_id = :projectId")
                .bind("projectId", projectId)
                .map(this::toTimer)
                .one();
    }

    @Override
    public Mono<Timer> findTimerById(Long id) {
        return databaseClient.sql(SELECT_COLUMNS + "WHERE id = :id")
                .bind("id", id)
                .map(this::toTimer)
                .one();
    }

    @Override
    public Flux<Timer> findDueTimers(Instant before) {
        return databaseClient.sql(SELECT_COLUMNS + """
                    WHERE schedule <> 'OFF' AND next_trigger_time < :before
                    ORDER BY next_trigger_time
                    """)
                .bind("before", before)
                .map(this::toTimer)
                .all();
    }

    @Override
    public Mono<Timer> createOrUpdateTimer(Timer timer) {
        return Mono.fromCallable(() -> bindTimer(databaseClient.sql("""
                    INSERT INTO scheduler_timer
                        (project_id, schedule, time_of_day, hour, monitor_type,
                         page_ids, profile_ids, env_ids, next_trigger_time, updated_at)
                    VALUES
                        (:projectId, :schedule, :timeOfDay, :hour, :monitorType,
                         :pageIds, :profileIds, :envIds, :nextTriggerTime, NOW())
                    ON CONFLICT (project_id) DO UPDATE SET
                        schedule = EXCLUDED.schedule,
                        time_of_day = EXCLUDED.time_of_day,
                        hour = EXCLUDED.hour,
                        monitor_type = EXCLUDED.monitor_type,
                        page_ids = EXCLUDED.page_ids,
                        profile_ids = EXCLUDED.profile_ids,
                        env_ids = EXCLUDED.env_ids,
                        next_trigger_time = EXCLUDED.next_trigger_time,
                        updated_at = NOW()
                    RETURNING id
                    """), timer))
                .flatMap(spec -> spec.map(row -> row.get("id", Long.class)).one())
                .map(id -> timer.toBuilder().id(id).build())
                .doOnSuccess(saved -> log.debug("Saved timer: id={}, projectId={}", saved.getId(), saved.getProjectId()))
                .doOnError(e -> log.error("Failed to save timer for project {}", timer.getProjectId(), e));
    }

    @Override
    public Mono<Void> updateNextFireTime(Long id, Instant nextTrigger) {
        return databaseClient.sql("""
                    UPDATE scheduler_timer
                    SET next_trigger_time = :nextTriggerTime, updated_at = NOW()
                    WHERE id = :id
                    """)
                .bind("nextTriggerTime", nextTrigger)
                .bind("id", id)
                .fetch()
                .rowsUpdated()
                .doOnNext(count -> {
                    if (count == 0) {
                        log.warn("No timer with id {} to update next trigger time", id);
                    }
                })
                .then();
    }

    private GenericExecuteSpec bindTimer(GenericExecuteSpec spec, Timer timer) {
        GenericExecuteSpec bound = spec
                .bind("projectId", timer.getProjectId())
                .bind("schedule", timer.getSchedule().name())
                .bind("monitorType", timer.getMonitorType().name())
                .bind("pageIds", writeIds(timer.idsOf(EntityKind.PAGE)))
                .bind("profileIds", writeIds(timer.idsOf(EntityKind.PROFILE)))
                .bind("envIds", writeIds(timer.idsOf(EntityKind.ENVIRONMENT)));
        bound = timer.getNextTriggerTime() != null
                ? bound.bind("nextTriggerTime", timer.getNextTriggerTime())
                : bound.bindNull("nextTriggerTime", Instant.class);
        bound = timer.getTimeOfDay() != null
                ? bound.bind("timeOfDay", timer.getTimeOfDay())
                : bound.bindNull("timeOfDay", Integer.class);
        return timer.getHour() != null
                ? bound.bind("hour", timer.getHour())
                : bound.bindNull("hour", Integer.class);
    }

    private Timer toTimer(Readable row) {
        return Timer.builder()
                .id(row.get("id", Long.class))
                .projectId(row.get("project_id", Long.class))
                .schedule(ScheduleType.valueOf(row.get("schedule", String.class)))
                .timeOfDay(row.get("time_of_day", Integer.class))
                .hour(row.get("hour", Integer.class))
                .monitorType(MonitorType.valueOf(row.get("monitor_type", String.class)))
                .pageIds(readIds(row.get("page_ids", String.class)))
                .profileIds(readIds(row.get("profile_ids", String.class)))
                .envIds(readIds(row.get("env_ids", String.class)))
                .nextTriggerTime(row.get("next_trigger_time", Instant.class))
                .build();
    }

    private String writeIds(List<Long> ids) {
        try {
            return objectMapper.writeValueAsString(ids);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot serialize id list " + ids, e);
        }
    }

    private List<Long> readIds(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, ID_LIST));
        } catch (Exception e) {
            throw new IllegalStateException("Cannot parse stored id list: " + json, e);
        }
    }
}
