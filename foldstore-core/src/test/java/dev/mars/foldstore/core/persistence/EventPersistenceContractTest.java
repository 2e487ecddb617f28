package dev.mars.foldstore.core.persistence;

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
import dev.mars.foldstore.api.error.OptimisticConcurrencyException;
import dev.mars.foldstore.core.retry.Futures;
import dev.mars.foldstore.core.serialization.JacksonEventSerializer;
import dev.mars.foldstore.core.testdomain.OrderEvent;
import dev.mars.foldstore.core.testdomain.OrderFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link EventPersistence} backend must show. Subclasses supply the backend.
 */
public abstract class EventPersistenceContractTest {

    protected EventPersistence persistence;
    protected JacksonEventSerializer serializer;

    /**
     * Creates an empty backend for one test.
     */
    protected abstract EventPersistence createPersistence() throws Exception;

    @BeforeEach
    protected void setUpPersistence() throws Exception {
        serializer = OrderFixtures.serializer();
        persistence = createPersistence();
    }

    protected AggregateKey newKey() {
        return OrderFixtures.key("order-" + UUID.randomUUID());
    }

    protected List<SerializedEvent> batch(AggregateKey key, long first, String... skus) {
        OrderEvent[] events = new OrderEvent[skus.length];
        for (int i = 0; i < skus.length; i++) {
            events[i] = new OrderEvent.ItemAdded(skus[i]);
        }
        return OrderFixtures.batch(serializer, key, first, events);
    }

    protected static <T> Throwable failureOf(Supplier<CompletableFuture<T>> action) {
        return OrderFixtures.failureOf(action);
    }

    @Test
    void testCommitAndLoadInSequenceOrder() {
        AggregateKey key = newKey();
        List<CommittedEvent> first = persistence.commitEvents(key, batch(key, 1, "X")).join();
        List<CommittedEvent> second = persistence.commitEvents(key, batch(key, 2, "Y", "Z")).join();

        assertEquals(1, first.size());
        assertEquals(2, second.size());
        assertEquals(2, second.get(0).aggregateSequenceNumber());
        assertEquals(3, second.get(1).aggregateSequenceNumber());
        assertEquals(second.get(0).batchId(), second.get(1).batchId());
        assertNotEquals(first.get(0).batchId(), second.get(0).batchId());

        List<CommittedEvent> loaded = persistence.loadCommittedEvents(key, 1).join();
        assertEquals(List.of(1L, 2L, 3L), loaded.stream().map(CommittedEvent::aggregateSequenceNumber).collect(Collectors.toList()));
        assertEquals("item-added", loaded.get(0).eventName());
        assertEquals(2, loaded.get(0).eventVersion());
        assertEquals(key, loaded.get(2).aggregateKey());
    }

    @Test
    void testGlobalSequenceNumbersIncreaseWithinBatch() {
        AggregateKey key = newKey();
        List<CommittedEvent> committed = persistence.commitEvents(key, batch(key, 1, "A", "B", "C")).join();
        assertTrue(committed.get(0).globalSequenceNumber() < committed.get(1).globalSequenceNumber());
        assertTrue(committed.get(1).globalSequenceNumber() < committed.get(2).globalSequenceNumber());
    }

    @Test
    void testLoadFromSequenceNumberIsInclusive() {
        AggregateKey key = newKey();
        persistence.commitEvents(key, batch(key, 1, "A", "B", "C", "D")).join();

        List<CommittedEvent> tail = persistence.loadCommittedEvents(key, 3).join();
        assertEquals(2, tail.size());
        assertEquals(3, tail.get(0).aggregateSequenceNumber());
        assertTrue(persistence.loadCommittedEvents(key, 5).join().isEmpty());
    }

    @Test
    void testLoadUnknownStreamIsEmpty() {
        assertTrue(persistence.loadCommittedEvents(newKey(), 1).join().isEmpty());
    }

    @Test
    void testStreamsAreKeyedByAggregateName() {
        AggregateKey order = newKey();
        AggregateKey invoice = new AggregateKey("invoice", order.aggregateId());
        persistence.commitEvents(order, batch(order, 1, "A")).join();
        persistence.commitEvents(invoice, batch(invoice, 1, "B")).join();

        assertEquals(1, persistence.loadCommittedEvents(order, 1).join().size());
        assertEquals(1, persistence.loadCommittedEvents(invoice, 1).join().size());
    }

    @Test
    void testCommittingTakenSequenceNumberIsConcurrencyConflict() {
        AggregateKey key = newKey();
        persistence.commitEvents(key, batch(key, 1, "A")).join();

        Throwable failure = failureOf(() -> persistence.commitEvents(key, batch(key, 1, "B")));
        OptimisticConcurrencyException conflict = assertInstanceOf(OptimisticConcurrencyException.class, failure);
        assertTrue(conflict.isConcurrencyConflict());
        assertEquals(key, conflict.getAggregateKey());
        assertEquals(1, persistence.loadCommittedEvents(key, 1).join().size());
    }

    @Test
    void testConflictingBatchIsAllOrNothing() {
        AggregateKey key = newKey();
        persistence.commitEvents(key, batch(key, 1, "A", "B")).join();

        failureOf(() -> persistence.commitEvents(key, batch(key, 2, "C", "D")));
        List<CommittedEvent> loaded = persistence.loadCommittedEvents(key, 1).join();
        assertEquals(2, loaded.size());
    }

    @Test
    void testRecommittingIdenticalBatchIsIdempotent() {
        AggregateKey key = newKey();
        List<SerializedEvent> batch = batch(key, 1, "X", "Y");
        List<CommittedEvent> first = persistence.commitEvents(key, batch).join();
        List<CommittedEvent> second = persistence.commitEvents(key, batch).join();

        assertEquals(first.stream().map(CommittedEvent::globalSequenceNumber).collect(Collectors.toList()),
            second.stream().map(CommittedEvent::globalSequenceNumber).collect(Collectors.toList()));
        assertEquals(2, persistence.loadCommittedEvents(key, 1).join().size());
        assertEquals(2, persistence.loadAllCommittedEvents(0, 100).join().events().stream()
            .filter(event -> event.aggregateKey().equals(key)).count());
    }

    @Test
    void testPartialOverlapIsConcurrencyConflict() {
        AggregateKey key = newKey();
        List<SerializedEvent> batch = batch(key, 1, "X", "Y");
        persistence.commitEvents(key, batch.subList(0, 1)).join();

        Throwable failure = failureOf(() -> persistence.commitEvents(key, batch));
        assertInstanceOf(OptimisticConcurrencyException.class, failure);
        assertEquals(1, persistence.loadCommittedEvents(key, 1).join().size());
    }

    @Test
    void testEmptyBatchIsRejected() {
        AggregateKey key = newKey();
        assertInstanceOf(IllegalArgumentException.class, failureOf(() -> persistence.commitEvents(key, List.of())));
    }

    @Test
    void testNonConsecutiveBatchIsRejected() {
        AggregateKey key = newKey();
        List<SerializedEvent> events = new ArrayList<>(batch(key, 1, "A"));
        events.addAll(batch(key, 3, "C"));
        assertInstanceOf(IllegalArgumentException.class, failureOf(() -> persistence.commitEvents(key, events)));
        assertTrue(persistence.loadCommittedEvents(key, 1).join().isEmpty());
    }

    @Test
    void testBatchForAnotherAggregateIsRejected() {
        AggregateKey key = newKey();
        AggregateKey other = newKey();
        assertInstanceOf(IllegalArgumentException.class,
            failureOf(() -> persistence.commitEvents(key, batch(other, 1, "A"))));
    }

    @Test
    void testGlobalReadIsOrderedAndRestartable() {
        AggregateKey first = newKey();
        AggregateKey second = newKey();
        persistence.commitEvents(first, batch(first, 1, "A", "B")).join();
        persistence.commitEvents(second, batch(second, 1, "C")).join();
        persistence.commitEvents(first, batch(first, 3, "D")).join();

        List<CommittedEvent> all = new ArrayList<>();
        long cursor = 0;
        CommittedEventsPage page;
        do {
            page = persistence.loadAllCommittedEvents(cursor, 2).join();
            assertTrue(page.events().size() <= 2);
            all.addAll(page.events());
            cursor = page.nextGlobalSequenceNumber();
        } while (!page.isEmpty());

        assertEquals(4, all.size());
        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i - 1).globalSequenceNumber() < all.get(i).globalSequenceNumber());
        }

        CommittedEventsPage replay = persistence.loadAllCommittedEvents(all.get(2).globalSequenceNumber(), 10).join();
        assertEquals(2, replay.events().size());
        assertEquals(all.get(2).globalSequenceNumber(), replay.events().get(0).globalSequenceNumber());

        CommittedEventsPage end = persistence.loadAllCommittedEvents(cursor, 10).join();
        assertTrue(end.isEmpty());
        assertEquals(cursor, end.nextGlobalSequenceNumber());
    }

    @Test
    void testNonPositivePageSizeIsRejected() {
        assertInstanceOf(IllegalArgumentException.class, failureOf(() -> persistence.loadAllCommittedEvents(0, 0)));
    }

    @Test
    void testDeleteEventsPurgesOnlyThatStream() {
        AggregateKey doomed = newKey();
        AggregateKey kept = newKey();
        persistence.commitEvents(doomed, batch(doomed, 1, "A", "B")).join();
        persistence.commitEvents(kept, batch(kept, 1, "C")).join();

        persistence.deleteEvents(doomed).join();

        assertTrue(persistence.loadCommittedEvents(doomed, 1).join().isEmpty());
        assertEquals(1, persistence.loadCommittedEvents(kept, 1).join().size());
        assertTrue(persistence.loadAllCommittedEvents(0, 100).join().events().stream()
            .noneMatch(event -> event.aggregateKey().equals(doomed)));

        persistence.commitEvents(doomed, batch(doomed, 1, "E")).join();
        assertEquals(1, persistence.loadCommittedEvents(doomed, 1).join().size());
    }

    @Test
    void testRacingWritersForSamePositionProduceOneWinner() {
        AggregateKey key = newKey();
        List<CompletableFuture<List<CommittedEvent>>> attempts = IntStream.range(0, 8)
            .mapToObj(i -> CompletableFuture.supplyAsync(() -> batch(key, 1, "sku-" + i))
                .thenCompose(batch -> persistence.commitEvents(key, batch)))
            .collect(Collectors.toList());

        int winners = 0;
        for (CompletableFuture<List<CommittedEvent>> attempt : attempts) {
            try {
                attempt.join();
                winners++;
            } catch (CompletionException e) {
                assertInstanceOf(OptimisticConcurrencyException.class, Futures.unwrap(e));
            }
        }
        assertEquals(1, winners);
        assertEquals(1, persistence.loadCommittedEvents(key, 1).join().size());
    }

    @Test
    void testParallelWritersToDifferentStreamsGetDistinctGlobalNumbers() {
        List<AggregateKey> keys = IntStream.range(0, 10).mapToObj(i -> newKey()).collect(Collectors.toList());
        List<CompletableFuture<List<CommittedEvent>>> commits = keys.stream()
            .map(key -> CompletableFuture.supplyAsync(() -> batch(key, 1, "A", "B"))
                .thenCompose(batch -> persistence.commitEvents(key, batch)))
            .collect(Collectors.toList());

        Set<Long> globals = new HashSet<>();
        for (CompletableFuture<List<CommittedEvent>> commit : commits) {
            commit.join().forEach(event -> globals.add(event.globalSequenceNumber()));
        }
        assertEquals(20, globals.size());
    }
}
