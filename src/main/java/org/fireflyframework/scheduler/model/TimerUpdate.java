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

import lombok.Builder;

import java.util.List;

/**
 * Partial timer configuration. {@code null} fields keep the stored value.
 * <p>
 * Entity ids are the externally visible ids ({@code iid}) of the project's
 * pages, profiles and environments.
 *
 * @param schedule    new recurrence kind
 * @param timeOfDay   new hour of day for daily timers
 * @param hour        new multiplier for every-x-hour timers
 * @param monitorType new monitor scope
 * @param pageIds     external page ids
 * @param profileIds  external profile ids
 * @param envIds      external environment ids
 */
@Builder
public record TimerUpdate(
        ScheduleType schedule,
        Integer timeOfDay,
        Integer hour,
        MonitorType monitorType,
        List<Long> pageIds,
        List<Long> profileIds,
        List<Long> envIds
) {
}
