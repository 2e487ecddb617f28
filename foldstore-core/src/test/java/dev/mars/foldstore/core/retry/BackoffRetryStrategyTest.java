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
import dev.mars.foldstore.api.error.OptimisticConcurrencyException;
import dev.mars.foldstore.api.retry.RetryDecision;
import dev.mars.foldstore.core.testdomain.OrderFixtures;
import dev.mars.foldstore.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class BackoffRetryStrategyTest {

    private static final OptimisticConcurrencyException CONFLICT =
        new OptimisticConcurrencyException(OrderFixtures.key("order-1"), 3, "sequence 3 taken");

    @Test
    void testExponentialDelaysAreCapped() {
        OptimisticConcurrencyRetryStrategy strategy =
            OptimisticConcurrencyRetryStrategy.exponential(5, Duration.ofMillis(100), Duration.ofMillis(350));

        assertEquals(Duration.ofMillis(100), strategy.delayForAttempt(1));
        assertEquals(Duration.ofMillis(200), strategy.delayForAttempt(2));
        assertEquals(Duration.ofMillis(350), strategy.delayForAttempt(3));
        assertEquals(Duration.ofMillis(350), strategy.delayForAttempt(10));
    }

    @Test
    void testFixedDelay() {
        OptimisticConcurrencyRetryStrategy strategy = OptimisticConcurrencyRetryStrategy.fixed(3, Duration.ofMillis(25));
        assertEquals(Duration.ofMillis(25), strategy.delayForAttempt(1));
        assertEquals(Duration.ofMillis(25), strategy.delayForAttempt(3));
    }

    @Test
    void testRetriesConflictsUntilLimit() {
        OptimisticConcurrencyRetryStrategy strategy = OptimisticConcurrencyRetryStrategy.fixed(2, Duration.ofMillis(5));

        RetryDecision first = strategy.shouldRetry(CONFLICT, Duration.ZERO, 1);
        assertTrue(first.retry());
        assertEquals(Duration.ofMillis(5), first.delay());
        assertTrue(strategy.shouldRetry(CONFLICT, Duration.ZERO, 2).retry());
        assertFalse(strategy.shouldRetry(CONFLICT, Duration.ZERO, 3).retry());
    }

    @Test
    void testOtherFailuresAreNotRetried() {
        OptimisticConcurrencyRetryStrategy strategy = OptimisticConcurrencyRetryStrategy.defaults();
        assertFalse(strategy.shouldRetry(new EventPersistenceException("down", null), Duration.ZERO, 1).retry());
        assertFalse(strategy.shouldRetry(new IllegalStateException("bug"), Duration.ZERO, 1).retry());
    }

    @Test
    void testDefaults() {
        OptimisticConcurrencyRetryStrategy strategy = OptimisticConcurrencyRetryStrategy.defaults();
        assertEquals(OptimisticConcurrencyRetryStrategy.DEFAULT_MAX_RETRIES, strategy.getMaxRetries());
        assertEquals(OptimisticConcurrencyRetryStrategy.DEFAULT_DELAY, strategy.getInitialDelay());
        assertEquals(1.0, strategy.getBackoffMultiplier());
    }

    @Test
    void testInvalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> OptimisticConcurrencyRetryStrategy.fixed(-1, Duration.ofMillis(5)));
        assertThrows(IllegalArgumentException.class,
            () -> new OptimisticConcurrencyRetryStrategy(1, Duration.ofMillis(5), 0.5, Duration.ofMillis(5)));
        assertThrows(IllegalArgumentException.class,
            () -> OptimisticConcurrencyRetryStrategy.exponential(1, Duration.ofSeconds(2), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
            () -> OptimisticConcurrencyRetryStrategy.fixed(1, Duration.ofMillis(-1)));
    }
}
