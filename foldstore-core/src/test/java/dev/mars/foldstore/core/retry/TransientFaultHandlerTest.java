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
import dev.mars.foldstore.api.error.FoldStoreErrorCodes;
import dev.mars.foldstore.api.error.OptimisticConcurrencyException;
import dev.mars.foldstore.api.retry.RetryStrategy;
import dev.mars.foldstore.core.persistence.files.IoRetryStrategy;
import dev.mars.foldstore.core.testdomain.OrderFixtures;
import dev.mars.foldstore.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class TransientFaultHandlerTest {

    private final TransientFaultHandler handler =
        new TransientFaultHandler("test", new IoRetryStrategy(2, Duration.ofMillis(1), Duration.ofMillis(5)));

    private static UncheckedIOException ioFailure() {
        return new UncheckedIOException(new IOException("connection reset"));
    }

    @Test
    void testTransientFailuresAreRetried() {
        AtomicInteger attempts = new AtomicInteger();

        String result = handler.tryAsync("read", () -> attempts.incrementAndGet() < 3
            ? CompletableFuture.<String>failedFuture(ioFailure())
            : CompletableFuture.completedFuture("ok")).join();

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
    }

    @Test
    void testExhaustedRetriesBecomeFatal() {
        AtomicInteger attempts = new AtomicInteger();

        Throwable failure = OrderFixtures.failureOf(() -> handler.tryAsync("read", () -> {
            attempts.incrementAndGet();
            return CompletableFuture.<String>failedFuture(ioFailure());
        }));

        EventPersistenceException ex = assertInstanceOf(EventPersistenceException.class, failure);
        assertTrue(ex.isTransientExhausted());
        assertInstanceOf(UncheckedIOException.class, ex.getCause());
        assertEquals(3, attempts.get());
    }

    @Test
    void testConcurrencyConflictPassesThroughUntouched() {
        AtomicInteger attempts = new AtomicInteger();
        OptimisticConcurrencyException conflict =
            new OptimisticConcurrencyException(OrderFixtures.key("order-1"), 1, "taken");

        Throwable failure = OrderFixtures.failureOf(() -> handler.tryAsync("commit", () -> {
            attempts.incrementAndGet();
            return CompletableFuture.<String>failedFuture(conflict);
        }));

        assertSame(conflict, failure);
        assertEquals(1, attempts.get());
    }

    @Test
    void testCancellationIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        Throwable failure = OrderFixtures.failureOf(() -> handler.tryAsync("read", () -> {
            attempts.incrementAndGet();
            throw new CancellationException("cancelled");
        }));

        assertInstanceOf(CancellationException.class, failure);
        assertEquals(1, attempts.get());
    }

    @Test
    void testNonTransientFailureIsWrappedOnce() {
        AtomicInteger attempts = new AtomicInteger();
        Throwable failure = OrderFixtures.failureOf(() -> handler.tryAsync("read", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("unexpected row");
        }));

        EventPersistenceException ex = assertInstanceOf(EventPersistenceException.class, failure);
        assertEquals(FoldStoreErrorCodes.STORAGE_FAILURE, ex.getErrorCode());
        assertEquals(1, attempts.get());
    }

    @Test
    void testCallerErrorsAreNotWrapped() {
        IllegalArgumentException invalid = new IllegalArgumentException("bad batch");
        Throwable failure = OrderFixtures.failureOf(() -> new TransientFaultHandler("test", RetryStrategy.never())
            .tryAsync("commit", () -> CompletableFuture.<String>failedFuture(invalid)));

        assertSame(invalid, failure);
    }
}
