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

/**
 * Decides whether a failed operation should be attempted again.
 *
 * <p>Backends supply one per storage technology to classify transient and fatal errors; the
 * aggregate store uses one for optimistic concurrency conflicts.</p>
 */
@FunctionalInterface
public interface RetryStrategy {

    /**
     * @param failure the failure of the last attempt, already unwrapped from completion wrappers
     * @param elapsed time since the first attempt started
     * @param attemptCount number of attempts made so far, starting at 1
     */
    RetryDecision shouldRetry(Throwable failure, Duration elapsed, int attemptCount);

    static RetryStrategy never() {
        return (failure, elapsed, attemptCount) -> RetryDecision.noRetry();
    }
}
