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

package org.fireflyframework.scheduler.core;

import org.fireflyframework.scheduler.model.Timer;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Computes the next trigger instant of a timer from its recurrence settings.
 * <p>
 * Rules:
 * <ul>
 *   <li>no schedule or {@code OFF}: {@code now}</li>
 *   <li>{@code DAILY}: today at {@code timeOfDay:00} in the configured zone,
 *       pushed forward by exactly 24 hours when that is not more than one
 *       second after {@code now}</li>
 *   <li>{@code HOURLY}: {@code now + 1h}</li>
 *   <li>{@code EVERY_X_HOUR}: {@code now + hour * 1h}, {@code hour} defaults to 1</li>
 * </ul>
 * Instances are stateless and thread-safe.
 */
public class NextFireTimeCalculator {

    private static final Duration ONE_HOUR = Duration.ofHours(1);
    private static final Duration ONE_DAY = Duration.ofHours(24);
    private static final Duration MIN_LEAD = Duration.ofSeconds(1);

    private final ZoneId zone;

    public NextFireTimeCalculator(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Returns the next trigger instant for the given recurrence settings.
     *
     * @param config timer carrying {@code schedule}, {@code timeOfDay} and {@code hour}
     * @param now    the reference instant
     * @return the next trigger instant
     */
    public Instant nextFireTime(Timer config, Instant now) {
        if (config.getSchedule() == null) {
            return now;
        }

        return switch (config.getSchedule()) {
            case DAILY -> nextDaily(config.getTimeOfDay(), now);
            case HOURLY -> now.plus(ONE_HOUR);
            case EVERY_X_HOUR -> now.plus(ONE_HOUR.multipliedBy(config.getHour() != null ? config.getHour() : 1));
            case OFF -> now;
        };
    }

    private Instant nextDaily(Integer timeOfDay, Instant now) {
        int hourOfDay = timeOfDay != null ? timeOfDay : 0;
        Instant candidate = now.atZone(zone)
                .with(LocalTime.of(hourOfDay, 0))
                .toInstant();

        if (Duration.between(now, candidate).compareTo(MIN_LEAD) <= 0) {
            candidate = candidate.plus(ONE_DAY);
        }
        return candidate;
    }

    public ZoneId getZone() {
        return zone;
    }
}
