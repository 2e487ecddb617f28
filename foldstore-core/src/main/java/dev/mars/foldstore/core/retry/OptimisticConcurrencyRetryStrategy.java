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

import dev.mars.foldstore.api.error.OptimisticConcurrencyException;

import java.time.Duration;

/**
 * Retries an aggregate update after it lost an optimistic concurrency race. Every other failure
 * is final.
 */
public class OptimisticConcurrencyRetryStrategy extends BackoffRetryStrategy {

    public static final int DEFAULT_MAX_RETRIES = 4;
    public static final Duration DEFAULT_DELAY = Duration.ofMillis(100);

    public OptimisticConcurrencyRetryStrategy(int maxRetries, Duration initialDelay, double backoffMultiplier,
                                              Duration maxDelay) {
        super(maxRetries, initialDelay, backoffMultiplier, maxDelay);
    }

    public static OptimisticConcurrencyRetryStrategy defaults() {
        return fixed(DEFAULT_MAX_RETRIES, DEFAULT_DELAY);
    }

    public static OptimisticConcurrencyRetryStrategy fixed(int maxRetries, Duration delay) {
        return new OptimisticConcurrencyRetryStrategy(maxRetries, delay, 1.0, delay);
    }

    public static OptimisticConcurrencyRetryStrategy exponential(int maxRetries, Duration initialDelay, Duration maxDelay) {
        return new OptimisticConcurrencyRetryStrategy(maxRetries, initialDelay, 2.0, maxDelay);
    }

    @Override
    protected boolean isRetryable(Throwable failure) {
        return failure instanceof OptimisticConcurrencyException;
    }
}
