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

import dev.mars.foldstore.api.retry.RetryDecision;
import dev.mars.foldstore.api.retry.RetryStrategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry strategy with a retry budget and exponential backoff capped at a maximum delay.
 * Subclasses decide which failures are worth retrying.
 *
 * <p>With {@code maxRetries = 3} an operation is attempted at most four times. A multiplier of
 * 1.0 gives a fixed delay.</p>
 */
public abstract class BackoffRetryStrategy implements RetryStrategy {

    private final int maxRetries;
    private final Duration initialDelay;
    private final double backoffMultiplier;
    private final Duration maxDelay;

    protected BackoffRetryStrategy(int maxRetries, Duration initialDelay, double backoffMultiplier, Duration maxDelay) {
        Objects.requireNonNull(initialDelay, "Initial delay cannot be null");
        Objects.requireNonNull(maxDelay, "Max delay cannot be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must be non-negative");
        }
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("Initial delay cannot be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1.0");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("Max delay must be greater than or equal to initial delay");
        }
        this.maxRetries = maxRetries;
        this.initialDelay = initialDelay;
        this.backoffMultiplier = backoffMultiplier;
        this.maxDelay = maxDelay;
    }

    /**
     * Returns true if the failure may go away when the operation is attempted again.
     */
    protected abstract boolean isRetryable(Throwable failure);

    @Override
    public RetryDecision shouldRetry(Throwable failure, Duration elapsed, int attemptCount) {
        if (attemptCount > maxRetries || !isRetryable(failure)) {
            return RetryDecision.noRetry();
        }
        return RetryDecision.retryAfter(delayForAttempt(attemptCount));
    }

    /**
     * Delay before the attempt following {@code attemptCount}.
     */
    Duration delayForAttempt(int attemptCount) {
        double millis = initialDelay.toMillis() * Math.pow(backoffMultiplier, attemptCount - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{maxRetries=" + maxRetries + ", initialDelay=" + initialDelay
            + ", backoffMultiplier=" + backoffMultiplier + ", maxDelay=" + maxDelay + '}';
    }
}
