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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.lock.DedupLockStore;
import org.fireflyframework.scheduler.metrics.SchedulerMetrics;
import org.fireflyframework.scheduler.model.Timer;
import org.fireflyframework.scheduler.properties.SchedulerProperties;
import org.fireflyframework.scheduler.store.TimerStore;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodically finds timers that are due soon and arranges their dispatch.
 * <p>
 * Every {@code scanInterval} the scanner queries the timers whose next
 * trigger time falls before {@code now + lookahead}. For each of them:
 * <ul>
 *   <li>if a lease for the project exists, another process (or an earlier
 *       scan of this one) already owns the firing, so skip it</li>
 *   <li>if the timer is already due, dispatch it right away (fire-and-forget)</li>
 *   <li>otherwise claim the lease and schedule a deferred, re-checked
 *       dispatch at the trigger time; the lease is released once that
 *       dispatch finishes</li>
 * </ul>
 * <p>
 * <b>Distributed safety:</b> the lease is advisory and expires after
 * {@code lock.ttl}. A process that dies while holding it delays the firing
 * until the lease expires and a later scan picks the timer up again; a
 * lease that expires just before a deferred dispatch runs can cause a
 * duplicate dispatch. Both are accepted.
 * <p>
 * <b>Error resilience:</b> candidates are processed concurrently and each
 * one is isolated: a lease store error abandons that timer for the current
 * cycle only.
 * <p>
 * Deferred dispatches live in a per-process map keyed by timer id. They are
 * abandoned (not persisted) on {@link #stop()}.
 */
@Slf4j
public class TimerScanner implements DisposableBean {

    static final String LEASE_VALUE = "1";

    private final TimerStore timerStore;
    private final DedupLockStore lockStore;
    private final TimerDispatcher dispatcher;
    private final Clock clock;
    private final Scheduler scheduler;
    private final SchedulerMetrics metrics;

    private final Duration scanInterval;
    private final Duration lookahead;
    private final Duration leaseTtl;
    private final String leaseKeyPrefix;

    private final Map<Long, Disposable> pendingDispatches = new ConcurrentHashMap<>();

    private volatile Disposable scanSubscription;
    private volatile Instant lastScanAt;

    public TimerScanner(TimerStore timerStore,
                        DedupLockStore lockStore,
                        TimerDispatcher dispatcher,
                        SchedulerProperties properties,
                        Clock clock,
                        Scheduler scheduler,
                        @Nullable SchedulerMetrics metrics) {
        this.timerStore = timerStore;
        this.lockStore = lockStore;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.scanInterval = properties.getScanInterval();
        this.lookahead = properties.getLookahead();
        this.leaseTtl = properties.getLock().getTtl();
        this.leaseKeyPrefix = properties.getLock().getKeyPrefix();

        if (lookahead.compareTo(scanInterval) < 0) {
            log.warn("Lookahead {} is shorter than scan interval {}; timers may fire late",
                    lookahead, scanInterval);
        }
        if (metrics != null) {
            metrics.registerPendingGauge(pendingDispatches::size);
        }
    }

    /**
     * Starts the periodic scan loop. The first scan runs immediately.
     * <p>
     * A tick that arrives while the previous scan is still running is
     * dropped. Errors during a scan are logged and do not end the loop.
     */
    public synchronized void start() {
        if (isRunning()) {
            log.warn("Timer scanner is already running");
            return;
        }

        log.info("Starting timer scanner with scanInterval={}, lookahead={}, leaseTtl={}",
                scanInterval, lookahead, leaseTtl);

        scanSubscription = Flux.interval(Duration.ZERO, scanInterval, scheduler)
                .onBackpressureDrop(tick -> log.warn("Skipping scan tick {}: previous scan still running", tick))
                .flatMap(tick -> scan()
                        .onErrorResume(error -> {
                            log.error("Error during timer scan cycle", error);
                            return Mono.empty();
                        }), 1)
                .subscribe();
    }

    /**
     * Stops the scan loop and abandons all deferred dispatches of this process.
     * <p>
     * Safe to call multiple times or before {@link #start()} has been called.
     */
    public synchronized void stop() {
        if (scanSubscription != null && !scanSubscription.isDisposed()) {
            log.info("Stopping timer scanner");
            scanSubscription.dispose();
            scanSubscription = null;
        }
        if (!pendingDispatches.isEmpty()) {
            log.info("Abandoning {} deferred dispatch(es)", pendingDispatches.size());
            pendingDispatches.values().forEach(Disposable::dispose);
            pendingDispatches.clear();
        }
    }

    public boolean isRunning() {
        return scanSubscription != null && !scanSubscription.isDisposed();
    }

    /**
     * Runs one scan cycle.
     *
     * @return a Mono with a summary of the decisions taken; errors only if
     *         the due-timer query itself fails
     */
    public Mono<ScanReport> scan() {
        Instant now = clock.instant();

        return timerStore.findDueTimers(now.plus(lookahead))
                .collectList()
                .doOnNext(timers -> log.info("{} projects are time to dispatch.", timers.size()))
                .flatMapMany(Flux::fromIterable)
                .flatMap(timer -> handleCandidate(timer)
                        .onErrorResume(e -> {
                            log.error("Failed to schedule dispatch for project {}; retrying on next scan",
                                    timer.getProjectId(), e);
                            return Mono.just(ScanDecision.FAILED);
                        })
                        .doOnNext(decision -> {
                            if (metrics != null) {
                                metrics.recordDecision(decision.tag());
                            }
                        }))
                .collectList()
                .map(ScanReport::of)
                .doOnNext(report -> {
                    lastScanAt = now;
                    log.info("Timer scan finished: candidates={}, immediate={}, deferred={}, skipped={}, failed={}",
                            report.candidates(), report.immediate(), report.deferred(),
                            report.skipped(), report.failed());
                    if (metrics != null) {
                        metrics.recordScan(report.candidates());
                    }
                });
    }

    private Mono<ScanDecision> handleCandidate(Timer timer) {
        if (pendingDispatches.containsKey(timer.getId())) {
            log.debug("Dispatch for project {} already pending in this process", timer.getProjectId());
            return Mono.just(ScanDecision.SKIPPED);
        }

        String leaseKey = leaseKey(timer.getProjectId());
        return lockStore.get(leaseKey)
                .map(owner -> {
                    log.debug("Lease {} present, firing already scheduled", leaseKey);
                    return ScanDecision.SKIPPED;
                })
                .switchIfEmpty(Mono.defer(() -> claim(timer, leaseKey)));
    }

    private Mono<ScanDecision> claim(Timer timer, String leaseKey) {
        Duration restTime = Duration.between(clock.instant(), timer.getNextTriggerTime());
        log.info("Dispatch a snapshot with projectId:{} and rest time is {}ms",
                timer.getProjectId(), restTime.toMillis());

        if (restTime.isZero() || restTime.isNegative()) {
            dispatcher.dispatch(timer, false)
                    .subscribe(
                            outcome -> log.debug("Immediate dispatch for project {}: {}", timer.getProjectId(), outcome),
                            e -> log.error("Failed to dispatch schedule job", e));
            return Mono.just(ScanDecision.IMMEDIATE);
        }

        return lockStore.set(leaseKey, LEASE_VALUE, leaseTtl)
                .then(Mono.fromSupplier(() -> {
                    scheduleDeferred(timer, leaseKey, restTime);
                    return ScanDecision.DEFERRED;
                }));
    }

    private void scheduleDeferred(Timer timer, String leaseKey, Duration restTime) {
        Disposable.Swap slot = Disposables.swap();
        pendingDispatches.put(timer.getId(), slot);

        slot.update(Mono.delay(restTime, scheduler)
                .then(Mono.defer(() -> dispatcher.dispatch(timer, true)))
                .doFinally(signal -> {
                    pendingDispatches.remove(timer.getId(), slot);
                    releaseLease(leaseKey);
                })
                .subscribe(
                        outcome -> log.debug("Deferred dispatch for project {}: {}", timer.getProjectId(), outcome),
                        e -> log.error("Failed to dispatch schedule job", e)));
    }

    private void releaseLease(String leaseKey) {
        lockStore.delete(leaseKey)
                .onErrorResume(e -> {
                    log.debug("Could not release lease {}: {}", leaseKey, e.getMessage());
                    return Mono.empty();
                })
                .subscribe();
    }

    String leaseKey(Long projectId) {
        return leaseKeyPrefix + projectId;
    }

    public int getPendingDispatchCount() {
        return pendingDispatches.size();
    }

    @Nullable
    public Instant getLastScanAt() {
        return lastScanAt;
    }

    /**
     * Stops the scanner on Spring context shutdown.
     */
    @Override
    public void destroy() {
        stop();
    }
}
