package dev.mars.foldstore.core.persistence.inmemory;

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
import dev.mars.foldstore.core.persistence.CommittedEventMatcher;
import dev.mars.foldstore.core.persistence.EventBatches;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference backend keeping every stream in memory.
 *
 * <p>Commits are serialized under one lock, so global sequence numbers become visible in
 * order. Global log pages are read under the same lock so a reader never passes over a commit in
 * progress; stream reads see immutable copies and do not take the lock.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class InMemoryEventPersistence implements EventPersistence {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventPersistence.class);

    private final ReentrantLock commitLock = new ReentrantLock();
    private final ConcurrentHashMap<AggregateKey, List<CommittedEvent>> streams = new ConcurrentHashMap<>();
    private final ConcurrentSkipListMap<Long, CommittedEvent> globalLog = new ConcurrentSkipListMap<>();
    private final CommittedEventMatcher matcher;
    private long globalSequenceNumber;

    public InMemoryEventPersistence() {
        this(new CommittedEventMatcher());
    }

    public InMemoryEventPersistence(CommittedEventMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    public CompletableFuture<List<CommittedEvent>> commitEvents(AggregateKey aggregateKey, List<SerializedEvent> serializedEvents) {
        try {
            EventBatches.validate(aggregateKey, serializedEvents);
            return CompletableFuture.completedFuture(commit(aggregateKey, serializedEvents));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private List<CommittedEvent> commit(AggregateKey aggregateKey, List<SerializedEvent> serializedEvents) {
        commitLock.lock();
        try {
            List<CommittedEvent> stream = streams.getOrDefault(aggregateKey, List.of());
            long firstSequenceNumber = EventBatches.firstSequenceNumber(serializedEvents);

            if (firstSequenceNumber <= stream.size()) {
                if (matcher.isRepeatOf(stream, serializedEvents)) {
                    logger.debug("Batch for {} from sequence {} is already committed", aggregateKey, firstSequenceNumber);
                    return List.copyOf(stream.subList((int) firstSequenceNumber - 1,
                        (int) firstSequenceNumber - 1 + serializedEvents.size()));
                }
                throw new OptimisticConcurrencyException(aggregateKey, firstSequenceNumber,
                    "Sequence number " + firstSequenceNumber + " of " + aggregateKey + " is already committed");
            }
            if (firstSequenceNumber != stream.size() + 1) {
                throw new OptimisticConcurrencyException(aggregateKey, firstSequenceNumber,
                    "Stream " + aggregateKey + " ends at sequence " + stream.size()
                        + ", cannot append at " + firstSequenceNumber);
            }

            List<CommittedEvent> committed = new ArrayList<>(serializedEvents.size());
            for (SerializedEvent event : serializedEvents) {
                committed.add(CommittedEvent.from(event, ++globalSequenceNumber));
            }
            List<CommittedEvent> updated = new ArrayList<>(stream.size() + committed.size());
            updated.addAll(stream);
            updated.addAll(committed);
            streams.put(aggregateKey, List.copyOf(updated));
            for (CommittedEvent event : committed) {
                globalLog.put(event.globalSequenceNumber(), event);
            }
            logger.debug("Committed {} event(s) to {} at sequence {}-{}", committed.size(), aggregateKey,
                firstSequenceNumber, firstSequenceNumber + committed.size() - 1);
            return committed;
        } finally {
            commitLock.unlock();
        }
    }

    @Override
    public CompletableFuture<List<CommittedEvent>> loadCommittedEvents(AggregateKey aggregateKey, long fromSequenceNumber) {
        try {
            EventBatches.validateFromSequenceNumber(fromSequenceNumber);
            List<CommittedEvent> stream = streams.getOrDefault(aggregateKey, List.of());
            if (fromSequenceNumber > stream.size()) {
                return CompletableFuture.completedFuture(List.of());
            }
            return CompletableFuture.completedFuture(stream.subList((int) fromSequenceNumber - 1, stream.size()));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<CommittedEventsPage> loadAllCommittedEvents(long fromGlobalSequenceNumber, int pageSize) {
        try {
            EventBatches.validatePageSize(pageSize);
            List<CommittedEvent> events = new ArrayList<>(pageSize);
            commitLock.lock();
            try {
                for (Map.Entry<Long, CommittedEvent> entry : globalLog.tailMap(fromGlobalSequenceNumber, true).entrySet()) {
                    if (events.size() == pageSize) {
                        break;
                    }
                    events.add(entry.getValue());
                }
            } finally {
                commitLock.unlock();
            }
            long next = events.isEmpty()
                ? fromGlobalSequenceNumber
                : events.get(events.size() - 1).globalSequenceNumber() + 1;
            return CompletableFuture.completedFuture(new CommittedEventsPage(events, next));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Void> deleteEvents(AggregateKey aggregateKey) {
        commitLock.lock();
        try {
            List<CommittedEvent> removed = streams.remove(aggregateKey);
            if (removed != null) {
                removed.forEach(event -> globalLog.remove(event.globalSequenceNumber()));
                logger.info("Deleted {} event(s) of {}", removed.size(), aggregateKey);
            }
            return CompletableFuture.completedFuture(null);
        } finally {
            commitLock.unlock();
        }
    }
}
