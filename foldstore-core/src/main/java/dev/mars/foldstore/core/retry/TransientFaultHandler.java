package dev.mars.foldstore.core.retry;

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

import dev.mars.foldstore.api.error.EventPersistenceException;
import dev.mars.foldstore.api.error.FoldStoreException;
import dev.mars.foldstore.api.retry.RetryDecision;
import dev.mars.foldstore.api.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs storage operations under a {@link RetryStrategy}, retrying transient failures with
 * non-blocking delays.
 *
 * <p>Concurrency conflicts and cancellations are never retried here. A failure the strategy
 * declines on the first attempt is propagated as is (wrapped in an
 * {@link EventPersistenceException} unless it already is a {@link FoldStoreException} or an
 * {@link IllegalArgumentException}); a
 * failure that outlives its retries becomes
 * {@link EventPersistenceException#transientRetriesExhausted}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class TransientFaultHandler {
    private static final Logger logger = LoggerFactory.getLogger(TransientFaultHandler.class);

    private final String name;
    private final RetryStrategy retryStrategy;
    private final Clock clock;

    public TransientFaultHandler(String name, RetryStrategy retryStrategy) {
        this(name, retryStrategy, Clock.systemUTC());
    }

    public TransientFaultHandler(String name, RetryStrategy retryStrategy, Clock clock) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Executes an asynchronous operation, retrying it while the strategy allows.
     *
     * @param operation label used in logs and error messages
     * @param action produces a new attempt each time it is called
     */
    public <T> CompletableFuture<T> tryAsync(String operation, Supplier<CompletableFuture<T>> action) {
        return attempt(operation, action, 1, clock.instant());
    }

    private <T> CompletableFuture<T> attempt(String operation, Supplier<CompletableFuture<T>> action,
                                             int attemptCount, Instant start) {
        return Futures.invoke(action)
            .<CompletableFuture<T>>handle((result, error) -> {
                if (error == null) {
                    if (attemptCount > 1) {
                        logger.info("{} operation '{}' succeeded on attempt {}", name, operation, attemptCount);
                    }
                    return CompletableFuture.completedFuture(result);
                }

                Throwable cause = Futures.unwrap(error);
                if (cause instanceof CancellationException
                        || (cause instanceof FoldStoreException fse && fse.isConcurrencyConflict())) {
                    return CompletableFuture.failedFuture(cause);
                }

                Duration elapsed = Duration.between(start, clock.instant());
                RetryDecision decision = retryStrategy.shouldRetry(cause, elapsed, attemptCount);
                if (!decision.retry()) {
                    return CompletableFuture.failedFuture(translate(operation, cause, attemptCount));
                }

                logger.warn("{} operation '{}' failed on attempt {}, retrying in {} ms: {}",
                    name, operation, attemptCount, decision.delay().toMillis(), cause.getMessage());
                Executor delayed = CompletableFuture.delayedExecutor(decision.delay().toMillis(), TimeUnit.MILLISECONDS);
                return CompletableFuture.runAsync(() -> { }, delayed)
                    .thenCompose(ignored -> attempt(operation, action, attemptCount + 1, start));
            })
            .thenCompose(Function.identity());
    }

    private Throwable translate(String operation, Throwable cause, int attemptCount) {
        if (attemptCount > 1) {
            logger.error("{} operation '{}' gave up after {} attempts: {}", name, operation, attemptCount, cause.getMessage());
            return EventPersistenceException.transientRetriesExhausted(operation, attemptCount, cause);
        }
        if (cause instanceof FoldStoreException || cause instanceof IllegalArgumentException) {
            return cause;
        }
        return new EventPersistenceException(name + " operation '" + operation + "' failed: " + cause.getMessage(), cause);
    }

    public RetryStrategy getRetryStrategy() {
        return retryStrategy;
    }
}
