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

/**
 * Recurrence kind of a project timer.
 */
public enum ScheduleType {

    /**
     * Timer is inert and never scanned as due.
     */
    OFF,

    /**
     * Fires once a day at {@code timeOfDay:00}.
     */
    DAILY,

    /**
     * Fires one hour after the previous firing.
     */
    HOURLY,

    /**
     * Fires {@code hour} hours after the previous firing.
     */
    EVERY_X_HOUR
}
