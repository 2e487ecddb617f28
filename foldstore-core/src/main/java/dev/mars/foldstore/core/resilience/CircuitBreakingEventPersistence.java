package dev.mars.foldstore.core.resilience;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.CommittedEvent;
import dev.mars.foldstore.api.CommittedEventsPage;
import dev.mars.foldstore.api.EventPersistence;
import dev.mars.foldstore.api.SerializedEvent;
import dev.mars.foldstore.api.error.EventPersistenceException;
import dev.mars.foldstore.api.error.FoldStoreException;
import dev.mars.foldstore.core.config.FoldStoreConfiguration;
import dev.mars.foldstore.core.retry.Futures;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Wraps an {@link EventPersistence} in a Resilience4j circuit breaker, so a failing store is
 * given time to recover instead of being hammered by every caller.
 *
 * <p>Only storage failures count against the breaker. Concurrency conflicts, argument errors and
 * cancellations are normal outcomes and are ignored. While the breaker is open calls fail fast
 * with an {@link EventPersistenceException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class CircuitBreakingEventPersistence implements EventPersistence {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakingEventPersistence.class);

    private final EventPersistence delegate;
    private final CircuitBreaker circuitBreaker;

    public CircuitBreakingEventPersistence(EventPersistence delegate, String name,
                                           FoldStoreConfiguration.CircuitBreakerConfig config,
                                           MeterRegistry meterRegistry) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate cannot be null");
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(config, "Circuit breaker config cannot be null");

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold((float) config.getFailureRateThreshold())
            .waitDurationInOpenState(config.getWaitDuration())
            .slidingWindowSize(config.getRingBufferSize())
            .minimumNumberOfCalls(config.getFailureThreshold())
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .ignoreException(CircuitBreakingEventPersistence::isExpectedOutcome)
            .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(cbConfig);
        if (meterRegistry != null) {
            TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(registry).bindTo(meterRegistry);
        }
        this.circuitBreaker = registry.circuitBreaker(name);
        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                logger.info("Circuit breaker '{}' state transition: {} -> {}",
                    name, event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()))
            .onFailureRateExceeded(event ->
                logger.warn("Circuit breaker '{}' failure rate exceeded: {}%", name, event.getFailureRate()))
            .onCallNotPermitted(event ->
                logger.debug("Circuit breaker '{}' call not permitted", name));
        logger.info("Circuit breaker '{}' created for {}", name, delegate.getClass().getSimpleName());
    }

    /**
     * Applies the circuit breaker when it is enabled in the configuration, otherwise returns the
     * delegate unchanged.
     */
    public static EventPersistence wrap(EventPersistence delegate, String name,
                                        FoldStoreConfiguration.CircuitBreakerConfig config,
                                        MeterRegistry meterRegistry) {
        if (!config.isEnabled()) {
            logger.info("Circuit breaker is disabled for '{}'", name);
            return delegate;
        }
        return new CircuitBreakingEventPersistence(delegate, name, config, meterRegistry);
    }

    static boolean isExpectedOutcome(Throwable throwable) {
        Throwable cause = Futures.unwrap(throwable);
        return (cause instanceof FoldStoreException fse && fse.isConcurrencyConflict())
            || cause instanceof IllegalArgumentException
            || cause instanceof CancellationException;
    }

    @Override
    public CompletableFuture<List<CommittedEvent>> commitEvents(AggregateKey aggregateKey, List<SerializedEvent> serializedEvents) {
        return execute(() -> delegate.commitEvents(aggregateKey, serializedEvents));
    }

    @Override
    public CompletableFuture<List<CommittedEvent>> loadCommittedEvents(AggregateKey aggregateKey, long fromSequenceNumber) {
        return execute(() -> delegate.loadCommittedEvents(aggregateKey, fromSequenceNumber));
    }

    @Override
    public CompletableFuture<CommittedEventsPage> loadAllCommittedEvents(long fromGlobalSequenceNumber, int pageSize) {
        return execute(() -> delegate.loadAllCommittedEvents(fromGlobalSequenceNumber, pageSize));
    }

    @Override
    public CompletableFuture<Void> deleteEvents(AggregateKey aggregateKey) {
        return execute(() -> delegate.deleteEvents(aggregateKey));
    }

    private <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> action) {
        return circuitBreaker.executeCompletionStage(() -> Futures.invoke(action))
            .toCompletableFuture()
            .exceptionallyCompose(error -> {
                Throwable cause = Futures.unwrap(error);
                if (cause instanceof CallNotPermittedException) {
                    return CompletableFuture.<T>failedFuture(EventPersistenceException.unavailable(
                        "Event store is unavailable: " + cause.getMessage(), cause));
                }
                return CompletableFuture.<T>failedFuture(cause);
            });
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public EventPersistence getDelegate() {
        return delegate;
    }
}
