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

package org.fireflyframework.scheduler.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for the snapshot scheduler.
 */
@ConfigurationProperties(prefix = "firefly.scheduler")
@Validated
@Data
public class SchedulerProperties {

    /**
     * Whether the scheduler is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether the scan loop starts together with the application context.
     */
    private boolean autoStart = true;

    /**
     * Whether scheduler metrics are published to Micrometer.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether the scheduler health indicator is registered.
     */
    private boolean healthIndicatorEnabled = true;

    /**
     * How often due timers are scanned.
     */
    @NotNull
    private Duration scanInterval = Duration.ofMinutes(10);

    /**
     * How far ahead of now a timer counts as due. Must not be shorter than
     * the scan interval or firings between two scans are missed.
     */
    @NotNull
    private Duration lookahead = Duration.ofMinutes(10);

    /**
     * Time zone defining "today" for daily timers.
     */
    @NotNull
    private ZoneId zone = ZoneId.systemDefault();

    /**
     * Dispatch lease configuration.
     */
    @Valid
    @NotNull
    private LockConfig lock = new LockConfig();

    /**
     * Resilience configuration for calls to the snapshot service.
     */
    @Valid
    @NotNull
    private ResilienceConfig resilience = new ResilienceConfig();

    /**
     * Backing store for dispatch leases.
     */
    public enum LockStoreType {
        REDIS,
        MEMORY
    }

    /**
     * Dispatch lease configuration.
     */
    @Data
    public static class LockConfig {

        /**
         * Lease store implementation.
         */
        @NotNull
        private LockStoreType store = LockStoreType.REDIS;

        /**
         * Prefix of the per-project lease key.
         */
        @NotBlank
        private String keyPrefix = "cron_scheduled_";

        /**
         * Lease lifetime. Slightly longer than the scan interval.
         */
        @NotNull
        private Duration ttl = Duration.ofMinutes(11);

        /**
         * Timeout applied to every lease store operation.
         */
        @NotNull
        private Duration operationTimeout = Duration.ofSeconds(2);
    }

    /**
     * Resilience configuration for the snapshot trigger.
     */
    @Data
    public static class ResilienceConfig {

        /**
         * Whether the snapshot trigger is decorated at all.
         */
        private boolean enabled = true;

        /**
         * Maximum time a single trigger call may take.
         */
        @NotNull
        private Duration triggerTimeout = Duration.ofSeconds(30);

        /**
         * Circuit breaker configuration.
         */
        @Valid
        @NotNull
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    }

    /**
     * Circuit breaker configuration.
     */
    @Data
    public static class CircuitBreakerConfig {

        /**
         * Whether the circuit breaker is enabled.
         */
        private boolean enabled = true;

        /**
         * Failure rate threshold percentage (0-100) to open the circuit.
         */
        @Min(1)
        private int failureRateThreshold = 50;

        /**
         * Number of calls in the count-based sliding window.
         */
        @Min(1)
        private int slidingWindowSize = 20;

        /**
         * Minimum number of calls before calculating failure rate.
         */
        @Min(1)
        private int minimumNumberOfCalls = 10;

        /**
         * Wait duration in open state before transitioning to half-open.
         */
        @NotNull
        private Duration waitDurationInOpenState = Duration.ofMinutes(1);
    }
}
