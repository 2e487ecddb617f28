package dev.mars.foldstore.core.aggregate;

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

import dev.mars.foldstore.api.CancellationToken;
import dev.mars.foldstore.api.CommittedEvent;
import dev.mars.foldstore.api.CommittedEventsPage;
import dev.mars.foldstore.api.DomainEvent;
import dev.mars.foldstore.api.EventPersistence;
import dev.mars.foldstore.api.EventSerializer;
import dev.mars.foldstore.core.config.FoldStoreConfiguration;
import dev.mars.foldstore.core.retry.Futures;
import dev.mars.foldstore.core.upgrade.EventUpgradeChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Reads events across all aggregates in global commit order, deserialized and upgraded with the
 * chain of the aggregate type each event belongs to. Events of unregistered aggregate types are
 * returned as stored.
 */
public class GlobalEventReader {
    private static final Logger logger = LoggerFactory.getLogger(GlobalEventReader.class);

    public static final int DEFAULT_PAGE_SIZE = 200;

    private final EventPersistence persistence;
    private final EventSerializer serializer;
    private final Map<String, EventUpgradeChain> upgradeChains = new HashMap<>();
    private final int pageSize;

    public GlobalEventReader(EventPersistence persistence, EventSerializer serializer) {
        this(persistence, serializer, DEFAULT_PAGE_SIZE);
    }

    /**
     * Reads pages of {@code foldstore.global-reader.page-size} events.
     */
    public GlobalEventReader(EventPersistence persistence, EventSerializer serializer,
                             FoldStoreConfiguration.AggregateStoreConfig config) {
        this(persistence, serializer, config.getGlobalReaderPageSize());
    }

    public GlobalEventReader(EventPersistence persistence, EventSerializer serializer, int pageSize) {
        this.persistence = Objects.requireNonNull(persistence, "Event persistence cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "Event serializer cannot be null");
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive, was " + pageSize);
        }
        this.pageSize = pageSize;
    }

    /**
     * Registers the upgrade chain of an aggregate type. Call before reading.
     */
    public GlobalEventReader register(AggregateDefinition<?> definition) {
        if (upgradeChains.putIfAbsent(definition.getName(), definition.getUpgradeChain()) != null) {
            throw new IllegalArgumentException("Aggregate '" + definition.getName() + "' is already registered");
        }
        return this;
    }

    public CompletableFuture<DomainEventsPage> readPage(long fromGlobalSequenceNumber, CancellationToken token) {
        return readPage(fromGlobalSequenceNumber, pageSize, token);
    }

    public CompletableFuture<DomainEventsPage> readPage(long fromGlobalSequenceNumber, int pageSize, CancellationToken token) {
        return Futures.invoke(() -> {
                token.throwIfCancellationRequested();
                return persistence.loadAllCommittedEvents(fromGlobalSequenceNumber, pageSize);
            })
            .thenApply(this::upgrade);
    }

    /**
     * Reads pages until the end of the log, handing every event to the consumer. Pages that are
     * already available are consumed in a loop, so the call stack does not grow with the length
     * of the log.
     *
     * @return the cursor to resume from later
     */
    public CompletableFuture<Long> catchUp(long fromGlobalSequenceNumber, Consumer<DomainEvent> consumer,
                                           CancellationToken token) {
        Objects.requireNonNull(consumer, "Consumer cannot be null");
        CompletableFuture<Long> result = new CompletableFuture<>();
        readFrom(fromGlobalSequenceNumber, consumer, token, result);
        return result;
    }

    private void readFrom(long cursor, Consumer<DomainEvent> consumer, CancellationToken token,
                          CompletableFuture<Long> result) {
        long position = cursor;
        while (true) {
            CompletableFuture<DomainEventsPage> pending = readPage(position, token);
            if (!pending.isDone()) {
                long resumeAt = position;
                pending.whenComplete((page, error) -> {
                    if (error != null) {
                        result.completeExceptionally(Futures.unwrap(error));
                    } else if (accept(page, resumeAt, consumer, result)) {
                        readFrom(page.nextGlobalSequenceNumber(), consumer, token, result);
                    }
                });
                return;
            }
            DomainEventsPage page;
            try {
                page = pending.join();
            } catch (CompletionException | CancellationException e) {
                result.completeExceptionally(Futures.unwrap(e));
                return;
            }
            if (!accept(page, position, consumer, result)) {
                return;
            }
            position = page.nextGlobalSequenceNumber();
        }
    }

    /**
     * Hands a page to the consumer. Completes the result and returns false at the end of the log
     * or when the consumer fails.
     */
    private static boolean accept(DomainEventsPage page, long position, Consumer<DomainEvent> consumer,
                                  CompletableFuture<Long> result) {
        try {
            page.events().forEach(consumer);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return false;
        }
        if (page.nextGlobalSequenceNumber() == position) {
            logger.debug("Caught up at global sequence number {}", position);
            result.complete(position);
            return false;
        }
        return true;
    }

    public int getPageSize() {
        return pageSize;
    }

    private DomainEventsPage upgrade(CommittedEventsPage page) {
        List<DomainEvent> events = new ArrayList<>(page.events().size());
        for (CommittedEvent committed : page.events()) {
            DomainEvent event = serializer.deserialize(committed);
            EventUpgradeChain chain = upgradeChains.getOrDefault(committed.aggregateName(), EventUpgradeChain.empty());
            events.addAll(chain.upgrade(List.of(event)));
        }
        return new DomainEventsPage(events, page.nextGlobalSequenceNumber());
    }
}
