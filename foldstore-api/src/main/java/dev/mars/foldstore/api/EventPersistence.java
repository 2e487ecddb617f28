package dev.mars.foldstore.api;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Durable, append-only storage of committed events for one storage technology.
 *
 * <p>Every implementation enforces uniqueness of
 * (aggregate name, aggregate id, aggregate sequence number) with a backend native primitive and
 * reports a violation as {@link dev.mars.foldstore.api.error.OptimisticConcurrencyException}.
 * Transient storage failures are retried inside the backend; concurrency conflicts are never
 * retried here.</p>
 *
 * <p>Implementations must be safe for concurrent use.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface EventPersistence {

    /**
     * Commits a batch of events for one aggregate, all or nothing.
     *
     * <p>If every sequence number in the batch is already committed with identical content the
     * call succeeds without writing and returns the stored events. A batch that only partly
     * overlaps committed events, or overlaps them with different content, is a concurrency
     * conflict.</p>
     *
     * @param aggregateKey the stream to append to
     * @param serializedEvents non-empty batch with consecutive sequence numbers
     * @return the committed events in batch order
     */
    CompletableFuture<List<CommittedEvent>> commitEvents(AggregateKey aggregateKey, List<SerializedEvent> serializedEvents);

    /**
     * Loads the events of one stream in ascending sequence order.
     *
     * @param aggregateKey the stream to read
     * @param fromSequenceNumber first sequence number to return, inclusive
     * @return the events, empty if the stream has none at or after the given position
     */
    CompletableFuture<List<CommittedEvent>> loadCommittedEvents(AggregateKey aggregateKey, long fromSequenceNumber);

    /**
     * Loads one page of the global, cross-aggregate commit order.
     *
     * @param fromGlobalSequenceNumber first global sequence number to return, inclusive
     * @param pageSize maximum number of events, must be positive
     * @return the page and the cursor to continue from
     */
    CompletableFuture<CommittedEventsPage> loadAllCommittedEvents(long fromGlobalSequenceNumber, int pageSize);

    /**
     * Administrative purge of one stream. Not used by normal operation.
     */
    CompletableFuture<Void> deleteEvents(AggregateKey aggregateKey);
}
