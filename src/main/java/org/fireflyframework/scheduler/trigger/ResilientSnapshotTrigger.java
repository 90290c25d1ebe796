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

package org.fireflyframework.scheduler.trigger;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.model.SnapshotRequest;
import org.fireflyframework.scheduler.properties.SchedulerProperties;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Decorates a {@link SnapshotTrigger} with a timeout and a Resilience4j
 * circuit breaker.
 * <p>
 * The timeout is the innermost operator, so a hanging snapshot service is
 * counted as a failure by the breaker. While the circuit is open calls fail
 * fast with {@code CallNotPermittedException}; the dispatcher logs them
 * like any other trigger failure.
 */
@Slf4j
public class ResilientSnapshotTrigger implements SnapshotTrigger {

    static final String CIRCUIT_BREAKER_NAME = "snapshot-trigger";

    private final SnapshotTrigger delegate;
    private final SchedulerProperties.ResilienceConfig config;
    private final CircuitBreaker circuitBreaker;

    public ResilientSnapshotTrigger(SnapshotTrigger delegate, SchedulerProperties properties) {
        this.delegate = delegate;
        this.config = properties.getResilience();
        this.circuitBreaker = createCircuitBreaker(config.getCircuitBreaker());

        log.info("RESILIENCE_INIT: triggerTimeout={}, circuitBreaker={}",
                config.getTriggerTimeout(), config.getCircuitBreaker().isEnabled());
    }

    @Override
    public Mono<Void> trigger(SnapshotRequest request) {
        if (!config.isEnabled()) {
            return delegate.trigger(request);
        }

        Duration timeout = config.getTriggerTimeout();
        Mono<Void> decorated = Mono.defer(() -> delegate.trigger(request))
                .timeout(timeout)
                .doOnError(TimeoutException.class, e ->
                        log.warn("TRIGGER_TIMEOUT: projectId={}, timeout={}", request.projectId(), timeout));

        if (config.getCircuitBreaker().isEnabled()) {
            decorated = decorated.transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
        }
        return decorated;
    }

    /**
     * Current state of the circuit breaker.
     */
    public CircuitBreaker.State getCircuitBreakerState() {
        return circuitBreaker.getState();
    }

    private CircuitBreaker createCircuitBreaker(SchedulerProperties.CircuitBreakerConfig cbConfig) {
        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(cbConfig.getFailureRateThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(cbConfig.getSlidingWindowSize())
                .minimumNumberOfCalls(cbConfig.getMinimumNumberOfCalls())
                .waitDurationInOpenState(cbConfig.getWaitDurationInOpenState())
                .build();

        CircuitBreaker cb = CircuitBreakerRegistry.of(breakerConfig).circuitBreaker(CIRCUIT_BREAKER_NAME);
        cb.getEventPublisher()
                .onStateTransition(event ->
                        log.info("CIRCUIT_BREAKER_STATE: name={}, from={}, to={}",
                                event.getCircuitBreakerName(),
                                event.getStateTransition().getFromState(),
                                event.getStateTransition().getToState()))
                .onError(event ->
                        log.warn("CIRCUIT_BREAKER_ERROR: name={}, error={}",
                                event.getCircuitBreakerName(),
                                event.getThrowable().getMessage()));
        return cb;
    }
}
