package dev.mars.foldstore.api.retry;

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

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a {@link RetryStrategy}: either give up, or try again after a delay.
 *
 * @param retry whether to retry
 * @param delay how long to wait before the next attempt, zero when not retrying
 */
public record RetryDecision(boolean retry, Duration delay) {

    private static final RetryDecision NO_RETRY = new RetryDecision(false, Duration.ZERO);

    public RetryDecision {
        Objects.requireNonNull(delay, "Delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay cannot be negative: " + delay);
        }
    }

    public static RetryDecision noRetry() {
        return NO_RETRY;
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }
}
