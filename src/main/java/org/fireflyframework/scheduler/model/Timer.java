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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Recurring snapshot schedule of a single project.
 * <p>
 * At most one timer exists per project. The id lists hold internal entity
 * identifiers and are only meaningful when {@link #monitorType} is
 * {@link MonitorType#CUSTOM}. {@link #nextTriggerTime} is a cached value:
 * it is recomputed whenever the timer fires or is reconfigured.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Timer {

    private Long id;

    private Long projectId;

    @Builder.Default
    private ScheduleType schedule = ScheduleType.OFF;

    /**
     * Hour of day (0-23), used by {@link ScheduleType#DAILY}.
     */
    private Integer timeOfDay;

    /**
     * Hour multiplier, used by {@link ScheduleType#EVERY_X_HOUR}.
     */
    private Integer hour;

    @Builder.Default
    private MonitorType monitorType = MonitorType.ALL;

    @Builder.Default
    private List<Long> pageIds = new ArrayList<>();

    @Builder.Default
    private List<Long> profileIds = new ArrayList<>();

    @Builder.Default
    private List<Long> envIds = new ArrayList<>();

    private Instant nextTriggerTime;

    /**
     * Returns the stored ids for the given entity kind, never {@code null}.
     */
    public List<Long> idsOf(EntityKind kind) {
        List<Long> ids = switch (kind) {
            case PAGE -> pageIds;
            case PROFILE -> profileIds;
            case ENVIRONMENT -> envIds;
        };
        return ids != null ? ids : List.of();
    }

    public boolean isCustom() {
        return monitorType == MonitorType.CUSTOM;
    }

    /**
     * Whether this timer should fire at {@code now}: scheduled and with a
     * next trigger time at or before {@code now}.
     */
    public boolean isDueAt(Instant now) {
        return schedule != null
                && schedule != ScheduleType.OFF
                && nextTriggerTime != null
                && !nextTriggerTime.isAfter(now);
    }
}
