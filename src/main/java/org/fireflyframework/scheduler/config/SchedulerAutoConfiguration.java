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

package org.fireflyframework.scheduler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.NextFireTimeCalculator;
import org.fireflyframework.scheduler.core.TimerDispatcher;
import org.fireflyframework.scheduler.core.TimerReconciler;
import org.fireflyframework.scheduler.core.TimerScanner;
import org.fireflyframework.scheduler.directory.EntityDirectory;
import org.fireflyframework.scheduler.directory.R2dbcEntityDirectory;
import org.fireflyframework.scheduler.health.SchedulerHealthIndicator;
import org.fireflyframework.scheduler.lock.DedupLockStore;
import org.fireflyframework.scheduler.lock.InMemoryDedupLockStore;
import org.fireflyframework.scheduler.lock.RedisDedupLockStore;
import org.fireflyframework.scheduler.metrics.SchedulerMetrics;
import org.fireflyframework.scheduler.properties.SchedulerProperties;
import org.fireflyframework.scheduler.service.TimerConfigurationService;
import org.fireflyframework.scheduler.store.InMemoryTimerStore;
import org.fireflyframework.scheduler.store.R2dbcTimerStore;
import org.fireflyframework.scheduler.store.TimerStore;
import org.fireflyframework.scheduler.trigger.ResilientSnapshotTrigger;
import org.fireflyframework.scheduler.trigger.SnapshotTrigger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.lang.Nullable;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Auto-configuration for the Firefly snapshot scheduler.
 * <p>
 * This configuration provides:
 * <ul>
 *   <li>TimerStore - R2DBC when a DatabaseClient exists, in memory otherwise</li>
 *   <li>EntityDirectory - R2DBC lookups of pages, profiles and environments</li>
 *   <li>DedupLockStore - Redis or in-memory dispatch leases</li>
 *   <li>TimerReconciler, TimerDispatcher and TimerScanner - the firing pipeline</li>
 *   <li>TimerConfigurationService - timer configuration reads and updates</li>
 *   <li>SchedulerHealthIndicator - health monitoring</li>
 * </ul>
 * <p>
 * The firing pipeline requires a {@link SnapshotTrigger} bean supplied by
 * the application.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.r2dbc.R2dbcDataAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration",
        "org.fireflyframework.scheduler.metrics.SchedulerMetricsAutoConfiguration"
})
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "firefly.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock schedulerClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean(name = "timerScannerScheduler")
    public Scheduler timerScannerScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    @ConditionalOnMissingBean
    public NextFireTimeCalculator nextFireTimeCalculator(SchedulerProperties properties) {
        log.info("Creating NextFireTimeCalculator with zone: {}", properties.getZone());
        return new NextFireTimeCalculator(properties.getZone());
    }

    // ==================== Storage Beans ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DatabaseClient.class)
    public TimerStore r2dbcTimerStore(DatabaseClient databaseClient, ObjectProvider<ObjectMapper> objectMapper) {
        log.info("Creating R2dbcTimerStore");
        return new R2dbcTimerStore(databaseClient, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public TimerStore inMemoryTimerStore() {
        log.warn("No DatabaseClient available; creating InMemoryTimerStore. Timers will not survive a restart");
        return new InMemoryTimerStore();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DatabaseClient.class)
    public EntityDirectory r2dbcEntityDirectory(DatabaseClient databaseClient) {
        log.info("Creating R2dbcEntityDirectory");
        return new R2dbcEntityDirectory(databaseClient);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(ReactiveStringRedisTemplate.class)
    @ConditionalOnBean(ReactiveStringRedisTemplate.class)
    @ConditionalOnProperty(prefix = "firefly.scheduler.lock", name = "store", havingValue = "REDIS", matchIfMissing = true)
    public DedupLockStore redisDedupLockStore(ReactiveStringRedisTemplate redisTemplate, SchedulerProperties properties) {
        log.info("Creating RedisDedupLockStore with key prefix: {}, TTL: {}",
                properties.getLock().getKeyPrefix(), properties.getLock().getTtl());
        return new RedisDedupLockStore(redisTemplate, properties.getLock().getOperationTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public DedupLockStore inMemoryDedupLockStore(Clock clock, SchedulerProperties properties) {
        if (properties.getLock().getStore() == SchedulerProperties.LockStoreType.REDIS) {
            log.warn("Lock store REDIS requested but no ReactiveStringRedisTemplate is available; "
                    + "falling back to in-memory leases (no cross-process deduplication)");
        } else {
            log.info("Creating InMemoryDedupLockStore");
        }
        return new InMemoryDedupLockStore(clock);
    }

    // ==================== Firing Pipeline Beans ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(EntityDirectory.class)
    public TimerReconciler timerReconciler(
            EntityDirectory directory,
            TimerStore timerStore,
            @Nullable SchedulerMetrics schedulerMetrics) {
        log.info("Creating TimerReconciler");
        return new TimerReconciler(directory, timerStore, schedulerMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({SnapshotTrigger.class, TimerReconciler.class})
    public TimerDispatcher timerDispatcher(
            TimerStore timerStore,
            EntityDirectory directory,
            TimerReconciler reconciler,
            NextFireTimeCalculator calculator,
            SnapshotTrigger snapshotTrigger,
            Clock clock,
            SchedulerProperties properties,
            @Nullable SchedulerMetrics schedulerMetrics) {
        SnapshotTrigger effectiveTrigger = properties.getResilience().isEnabled()
                ? new ResilientSnapshotTrigger(snapshotTrigger, properties)
                : snapshotTrigger;
        log.info("Creating TimerDispatcher with resilience: {}, metrics: {}",
                properties.getResilience().isEnabled(), schedulerMetrics != null);
        return new TimerDispatcher(timerStore, directory, reconciler, calculator,
                effectiveTrigger, clock, schedulerMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TimerDispatcher.class)
    public TimerScanner timerScanner(
            TimerStore timerStore,
            DedupLockStore lockStore,
            TimerDispatcher dispatcher,
            SchedulerProperties properties,
            Clock clock,
            Scheduler timerScannerScheduler,
            @Nullable SchedulerMetrics schedulerMetrics) {
        TimerScanner scanner = new TimerScanner(timerStore, lockStore, dispatcher, properties,
                clock, timerScannerScheduler, schedulerMetrics);
        if (properties.isAutoStart()) {
            scanner.start();
            log.info("Created and started TimerScanner with scanInterval={}, lookahead={}",
                    properties.getScanInterval(), properties.getLookahead());
        } else {
            log.info("Created TimerScanner (auto-start disabled)");
        }
        return scanner;
    }

    // ==================== Configuration Service ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(EntityDirectory.class)
    public TimerConfigurationService timerConfigurationService(
            TimerStore timerStore,
            EntityDirectory directory,
            NextFireTimeCalculator calculator,
            Clock clock) {
        log.info("Creating TimerConfigurationService");
        return new TimerConfigurationService(timerStore, directory, calculator, clock);
    }

    /**
     * Health indicator for scheduler monitoring.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TimerScanner.class)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    @ConditionalOnProperty(prefix = "firefly.scheduler", name = "health-indicator-enabled", havingValue = "true", matchIfMissing = true)
    public SchedulerHealthIndicator schedulerHealthIndicator(TimerScanner timerScanner, DedupLockStore lockStore) {
        log.info("Creating SchedulerHealthIndicator");
        return new SchedulerHealthIndicator(timerScanner, lockStore);
    }
}
