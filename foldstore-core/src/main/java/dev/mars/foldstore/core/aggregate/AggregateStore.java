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

import dev.mars.foldstore.api.AggregateId;
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.CancellationToken;
import dev.mars.foldstore.api.CommittedEvent;
import dev.mars.foldstore.api.DomainEvent;
import dev.mars.foldstore.api.EventPersistence;
import dev.mars.foldstore.api.EventSerializer;
import dev.mars.foldstore.api.MetadataProvider;
import dev.mars.foldstore.api.SerializedEvent;
import dev.mars.foldstore.api.SourceId;
import dev.mars.foldstore.api.error.OptimisticConcurrencyException;
import dev.mars.foldstore.api.retry.RetryDecision;
import dev.mars.foldstore.api.retry.RetryStrategy;
import dev.mars.foldstore.core.cache.CachedEventStream;
import dev.mars.foldstore.core.cache.EventStreamCache;
import dev.mars.foldstore.core.config.FoldStoreConfiguration;
import dev.mars.foldstore.core.metrics.AggregateStoreMetrics;
import dev.mars.foldstore.core.retry.Futures;
import dev.mars.foldstore.core.retry.OptimisticConcurrencyRetryStrategy;
import dev.mars.foldstore.core.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Loads, mutates and commits aggregates of one type with optimistic concurrency.
 *
 * <p>An update loads the aggregate, runs the caller's mutation, and commits the emitted events
 * at the sequence numbers following the loaded version. Same-id writers are not serialized
 * in-process: a writer that loses the race gets a concurrency conflict from the backend, and
 * the update reloads and runs the mutation again until the retry strategy gives up.</p>
 *
 * <pre>{@code
 * AggregateStore<Order> store = AggregateStore.builder(Order.DEFINITION)
 *     .persistence(persistence)
 *     .serializer(serializer)
 *     .build();
 *
 * store.update(AggregateId.of("order-1"), SourceId.of(commandId),
 *     AggregateMutation.of(order -> order.addItem("X")), CancellationToken.NONE);
 * }</pre>
 *
 * @param <A> the aggregate type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class AggregateStore<A extends AggregateRoot<A>> {
    private static final Logger logger = LoggerFactory.getLogger(AggregateStore.class);

    private final AggregateDefinition<A> definition;
    private final EventPersistence persistence;
    private final EventSerializer serializer;
    private final EventStreamCache cache;
    private final SnapshotStore snapshotStore;
    private final MetadataAssembler metadataAssembler;
    private final RetryStrategy retryStrategy;
    private final AggregateStoreMetrics metrics;
    private final Clock clock;

    private AggregateStore(Builder<A> builder) {
        this.definition = builder.definition;
        this.persistence = Objects.requireNonNull(builder.persistence, "Event persistence cannot be null");
        this.serializer = Objects.requireNonNull(builder.serializer, "Event serializer cannot be null");
        this.clock = builder.clock;
        this.cache = builder.cache != null ? builder.cache
            : builder.configuration != null ? builder.configuration.getCacheConfig().createCache(clock)
            : EventStreamCache.disabled();
        this.retryStrategy = builder.retryStrategy != null ? builder.retryStrategy
            : builder.configuration != null ? builder.configuration.getAggregateStoreConfig().createRetryStrategy()
            : OptimisticConcurrencyRetryStrategy.defaults();
        this.snapshotStore = builder.snapshotStore;
        this.metadataAssembler = new MetadataAssembler(builder.metadataProviders, clock);
        this.metrics = builder.metrics != null ? builder.metrics : new AggregateStoreMetrics(definition.getName());

        if (snapshotStore != null && definition.getSnapshotSupport().isEmpty()) {
            logger.warn("Aggregate '{}' has a snapshot store but no snapshot support, snapshots are disabled",
                definition.getName());
        }
        logger.info("Created aggregate store for {} (cache {}, snapshots {}, retry {})", definition,
            cache.isEnabled() ? "enabled" : "disabled", snapshotsEnabled() ? "enabled" : "disabled", retryStrategy);
    }

    public static <A extends AggregateRoot<A>> Builder<A> builder(AggregateDefinition<A> definition) {
        return new Builder<>(definition);
    }

    /**
     * Loads the aggregate, applies the mutation and commits the events it emitted.
     *
     * <p>If {@code sourceId} is the source of the aggregate's most recent batch the mutation is
     * skipped and that batch's events are returned. A mutation that emits nothing completes with an
     * empty list without contacting the backend.</p>
     *
     * @param id the aggregate to update
     * @param sourceId idempotency token of the caller, usually a command id; a random one is used when null
     * @param mutation business logic, run once per attempt against a freshly loaded aggregate
     * @param token checked before every I/O call
     * @return the committed events; fails with {@link OptimisticConcurrencyException} when conflict
     *         retries are exhausted
     */
    public CompletableFuture<List<CommittedEvent>> update(AggregateId id, SourceId sourceId,
                                                          AggregateMutation<A> mutation, CancellationToken token) {
        Objects.requireNonNull(id, "Aggregate id cannot be null");
        Objects.requireNonNull(mutation, "Mutation cannot be null");
        Objects.requireNonNull(token, "Cancellation token cannot be null");
        SourceId effectiveSourceId = sourceId != null ? sourceId : SourceId.of(UUID.randomUUID().toString());
        Instant start = clock.instant();

        return updateAttempt(id, effectiveSourceId, mutation, token, 1, start)
            .whenComplete((events, error) -> metrics.recordUpdateTime(Duration.between(start, clock.instant())));
    }

    private CompletableFuture<List<CommittedEvent>> updateAttempt(AggregateId id, SourceId sourceId,
                                                                  AggregateMutation<A> mutation, CancellationToken token,
                                                                  int attemptCount, Instant start) {
        AggregateKey key = definition.keyOf(id);
        return loadAggregate(key, token)
            .thenCompose(aggregate -> mutateAndCommit(aggregate, sourceId, mutation, token))
            .thenCompose(outcome -> {
                if (outcome instanceof CommitOutcome.Committed committed) {
                    if (attemptCount > 1) {
                        logger.info("Updated {} on attempt {}", key, attemptCount);
                    }
                    return CompletableFuture.completedFuture(committed.events());
                }
                if (outcome instanceof CommitOutcome.ConcurrencyConflict conflict) {
                    return retryAfterConflict(id, sourceId, mutation, token, attemptCount, start, conflict.exception());
                }
                return CompletableFuture.<List<CommittedEvent>>failedFuture(((CommitOutcome.Fatal) outcome).cause());
            });
    }

    private CompletableFuture<List<CommittedEvent>> retryAfterConflict(AggregateId id, SourceId sourceId,
                                                                       AggregateMutation<A> mutation, CancellationToken token,
                                                                       int attemptCount, Instant start,
                                                                       OptimisticConcurrencyException conflict) {
        metrics.recordConcurrencyConflict();
        RetryDecision decision = retryStrategy.shouldRetry(conflict, Duration.between(start, clock.instant()), attemptCount);
        if (!decision.retry()) {
            logger.warn("Giving up on {} after {} attempts: {}", conflict.getAggregateKey(), attemptCount, conflict.getMessage());
            return CompletableFuture.failedFuture(OptimisticConcurrencyException.retriesExhausted(conflict, attemptCount));
        }

        metrics.recordRetry();
        logger.debug("Concurrency conflict on {} at sequence {}, attempt {}, retrying in {} ms",
            conflict.getAggregateKey(), conflict.getExpectedSequenceNumber(), attemptCount, decision.delay().toMillis());
        Executor delayed = CompletableFuture.delayedExecutor(decision.delay().toMillis(), TimeUnit.MILLISECONDS);
        return CompletableFuture.runAsync(() -> { }, delayed)
            .thenCompose(ignored -> updateAttempt(id, sourceId, mutation, token, attemptCount + 1, start));
    }

    private CompletableFuture<CommitOutcome> mutateAndCommit(A aggregate, SourceId sourceId,
                                                             AggregateMutation<A> mutation, CancellationToken token) {
        Optional<LastBatch> lastBatch = aggregate.getLastBatch();
        if (lastBatch.isPresent() && lastBatch.get().sourceId().equals(sourceId)) {
            return replayLastBatch(aggregate.getKey(), lastBatch.get(), token);
        }

        return Futures.invoke(() -> {
                token.throwIfCancellationRequested();
                return mutation.mutate(aggregate, token);
            })
            .thenCompose(ignored -> commit(aggregate, sourceId, token));
    }

    private CompletableFuture<CommitOutcome> replayLastBatch(AggregateKey key, LastBatch lastBatch, CancellationToken token) {
        logger.debug("Source {} already applied to {} in batch {}, skipping mutation",
            lastBatch.sourceId(), key, lastBatch.batchId());
        metrics.recordIdempotentSkip();
        return Futures.invoke(() -> {
                token.throwIfCancellationRequested();
                return persistence.loadCommittedEvents(key, lastBatch.firstSequenceNumber());
            })
            .thenApply(events -> new CommitOutcome.Committed(events.stream()
                .filter(event -> lastBatch.batchId().equals(event.batchId()))
                .collect(Collectors.toList())));
    }

    /**
     * Commits the uncommitted events of an aggregate the caller loaded and mutated itself.
     *
     * <p>Unlike {@link #update} there is no reload and no retry: a concurrency conflict fails the
     * returned future with {@link OptimisticConcurrencyException}.</p>
     */
    public CompletableFuture<List<CommittedEvent>> store(A aggregate, SourceId sourceId, CancellationToken token) {
        Objects.requireNonNull(aggregate, "Aggregate cannot be null");
        Objects.requireNonNull(token, "Cancellation token cannot be null");
        if (!definition.getName().equals(aggregate.getKey().aggregateName())) {
            throw new IllegalArgumentException("Aggregate " + aggregate.getKey() + " does not belong to store of '"
                + definition.getName() + "'");
        }
        SourceId effectiveSourceId = sourceId != null ? sourceId : SourceId.of(UUID.randomUUID().toString());

        return commit(aggregate, effectiveSourceId, token).thenCompose(outcome -> {
            if (outcome instanceof CommitOutcome.Committed committed) {
                return CompletableFuture.completedFuture(committed.events());
            }
            if (outcome instanceof CommitOutcome.ConcurrencyConflict conflict) {
                metrics.recordConcurrencyConflict();
                return CompletableFuture.<List<CommittedEvent>>failedFuture(conflict.exception());
            }
            return CompletableFuture.<List<CommittedEvent>>failedFuture(((CommitOutcome.Fatal) outcome).cause());
        });
    }

    private CompletableFuture<CommitOutcome> commit(A aggregate, SourceId sourceId, CancellationToken token) {
        List<UncommittedEvent> uncommitted = aggregate.getUncommittedEvents();
        if (uncommitted.isEmpty()) {
            logger.debug("No events emitted for {}, nothing to commit", aggregate.getKey());
            return CompletableFuture.completedFuture(new CommitOutcome.Committed(List.of()));
        }

        AggregateKey key = aggregate.getKey();
        String batchId = UUID.randomUUID().toString();
        List<SerializedEvent> serialized;
        try {
            serialized = serialize(key, uncommitted, sourceId, batchId);
            token.throwIfCancellationRequested();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        long firstSequenceNumber = uncommitted.get(0).expectedSequenceNumber();
        // Cancellation is not observed again until the backend has finished
        return Futures.invoke(() -> persistence.commitEvents(key, serialized))
            .handle(CommitOutcome::of)
            .thenApply(outcome -> {
                if (outcome instanceof CommitOutcome.Committed committed) {
                    cache.invalidate(key);
                    aggregate.markCommitted(new LastBatch(sourceId, batchId, firstSequenceNumber));
                    metrics.recordCommit(committed.events().size());
                    logger.debug("Committed {} events to {} (sequence {} to {})", committed.events().size(), key,
                        firstSequenceNumber, aggregate.getVersion());
                    snapshotAfterCommit(aggregate, token);
                } else if (outcome instanceof CommitOutcome.ConcurrencyConflict) {
                    cache.invalidate(key);
                }
                return outcome;
            });
    }

    private List<SerializedEvent> serialize(AggregateKey key, List<UncommittedEvent> uncommitted,
                                            SourceId sourceId, String batchId) {
        List<SerializedEvent> serialized = new ArrayList<>(uncommitted.size());
        for (UncommittedEvent event : uncommitted) {
            serialized.add(serializer.serialize(key, event.expectedSequenceNumber(), event.event(),
                metadataAssembler.assemble(key, event, serializer.definitionOf(event.event()), sourceId, batchId)));
        }
        return serialized;
    }

    private void snapshotAfterCommit(A aggregate, CancellationToken token) {
        if (!snapshotsEnabled()
                || !snapshotStore.getStrategy().shouldSnapshot(aggregate.getVersion(), aggregate.getSnapshotVersion())) {
            return;
        }
        if (token.isCancellationRequested()) {
            logger.debug("Skipping snapshot of {}, operation was cancelled", aggregate.getKey());
            return;
        }
        writeSnapshot(definition.getSnapshotSupport().orElseThrow(), aggregate)
            .thenAccept(metrics::recordSnapshot);
    }

    private <S> CompletableFuture<Boolean> writeSnapshot(SnapshotSupport<A, S> support, A aggregate) {
        return snapshotStore.write(aggregate.getKey(), aggregate.getVersion(), support, aggregate,
            aggregate.getLastBatch().orElse(null));
    }

    /**
     * Loads the current state of an aggregate. An aggregate without events loads as a new
     * aggregate at version 0.
     */
    public CompletableFuture<A> load(AggregateId id, CancellationToken token) {
        Objects.requireNonNull(id, "Aggregate id cannot be null");
        Objects.requireNonNull(token, "Cancellation token cannot be null");
        return loadAggregate(definition.keyOf(id), token);
    }

    private CompletableFuture<A> loadAggregate(AggregateKey key, CancellationToken token) {
        Instant start = clock.instant();
        return Futures.invoke(() -> {
                token.throwIfCancellationRequested();
                Optional<CachedEventStream> cached = cache.get(key);
                if (cached.isPresent()) {
                    metrics.recordCacheHit();
                    return CompletableFuture.completedFuture(rebuild(key, cached.get()));
                }
                if (cache.isEnabled()) {
                    metrics.recordCacheMiss();
                }
                return loadFromStorage(key, token);
            })
            .whenComplete((aggregate, error) -> metrics.recordLoadTime(Duration.between(start, clock.instant())));
    }

    private CompletableFuture<A> loadFromStorage(AggregateKey key, CancellationToken token) {
        long ticket = cache.ticket(key);
        return loadSnapshot(key, token).thenCompose(snapshot -> {
            token.throwIfCancellationRequested();
            if (snapshot.isEmpty()) {
                return persistence.loadCommittedEvents(key, 1)
                    .thenApply(committed -> assemble(key, ticket, null, committed));
            }
            // Reading from the snapshot's own last event proves the stream it was taken from still exists
            SnapshotStore.RestorableSnapshot restorable = snapshot.get();
            return persistence.loadCommittedEvents(key, restorable.version()).thenCompose(committed -> {
                if (isCoveredBy(restorable, committed)) {
                    return CompletableFuture.completedFuture(
                        assemble(key, ticket, restorable, committed.subList(1, committed.size())));
                }
                logger.warn("Ignoring snapshot of {} at version {}, the stream no longer contains its last event",
                    key, restorable.version());
                token.throwIfCancellationRequested();
                return persistence.loadCommittedEvents(key, 1)
                    .thenApply(all -> assemble(key, ticket, null, all));
            });
        });
    }

    private static boolean isCoveredBy(SnapshotStore.RestorableSnapshot snapshot, List<CommittedEvent> committed) {
        if (committed.isEmpty() || committed.get(0).aggregateSequenceNumber() != snapshot.version()) {
            return false;
        }
        return snapshot.lastBatch() == null || snapshot.lastBatch().batchId().equals(committed.get(0).batchId());
    }

    private A assemble(AggregateKey key, long ticket, SnapshotStore.RestorableSnapshot snapshot,
                       List<CommittedEvent> committed) {
        long snapshotVersion = snapshot != null ? snapshot.version() : 0L;
        LastBatch snapshotBatch = snapshot != null ? snapshot.lastBatch() : null;
        List<DomainEvent> stored = new ArrayList<>(committed.size());
        for (CommittedEvent event : committed) {
            stored.add(serializer.deserialize(event));
        }
        List<DomainEvent> upgraded = definition.getUpgradeChain().upgrade(stored);
        long version = committed.isEmpty()
            ? snapshotVersion
            : committed.get(committed.size() - 1).aggregateSequenceNumber();

        CachedEventStream stream = new CachedEventStream(snapshot != null ? snapshot.snapshot() : null,
            upgraded, version, lastBatchOf(committed, stored, snapshotBatch));
        A aggregate = rebuild(key, stream);
        cache.put(key, ticket, stream);
        logger.debug("Loaded {} at version {} ({} events{})", key, version, committed.size(),
            snapshot != null ? ", snapshot at " + snapshotVersion : "");
        return aggregate;
    }

    private CompletableFuture<Optional<SnapshotStore.RestorableSnapshot>> loadSnapshot(AggregateKey key,
                                                                                       CancellationToken token) {
        if (!snapshotsEnabled()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        token.throwIfCancellationRequested();
        return snapshotStore.load(key, definition.getSnapshotSupport().orElseThrow());
    }

    private A rebuild(AggregateKey key, CachedEventStream stream) {
        A aggregate = definition.create(key.aggregateId());
        long snapshotVersion = 0;
        if (stream.getSnapshot().isPresent()) {
            snapshotStore.restore(aggregate, definition.getSnapshotSupport().orElseThrow(), stream.snapshot());
            snapshotVersion = stream.snapshot().aggregateSequenceNumber();
        }
        for (DomainEvent event : stream.events()) {
            aggregate.replay(event.event());
        }
        aggregate.markLoaded(stream.version(), snapshotVersion, stream.lastBatch());
        return aggregate;
    }

    /**
     * Finds the batch of the last stored event. The batch may have started before the events read,
     * in which case the snapshot's record of it supplies the first sequence number.
     */
    private static LastBatch lastBatchOf(List<CommittedEvent> committed, List<DomainEvent> stored, LastBatch snapshotBatch) {
        if (committed.isEmpty()) {
            return snapshotBatch;
        }
        int last = committed.size() - 1;
        String batchId = committed.get(last).batchId();
        long firstSequenceNumber = committed.get(last).aggregateSequenceNumber();
        int index = last;
        while (index >= 0 && batchId.equals(committed.get(index).batchId())) {
            firstSequenceNumber = committed.get(index).aggregateSequenceNumber();
            index--;
        }
        if (index < 0 && snapshotBatch != null && snapshotBatch.batchId().equals(batchId)) {
            firstSequenceNumber = snapshotBatch.firstSequenceNumber();
        }
        long first = firstSequenceNumber;
        return stored.get(last).metadata().sourceId()
            .map(sourceId -> new LastBatch(sourceId, batchId, first))
            .orElse(null);
    }

    /**
     * Purges the events and snapshots of an aggregate. Administrative, not used by normal operation.
     */
    public CompletableFuture<Void> delete(AggregateId id, CancellationToken token) {
        Objects.requireNonNull(id, "Aggregate id cannot be null");
        Objects.requireNonNull(token, "Cancellation token cannot be null");
        AggregateKey key = definition.keyOf(id);
        return Futures.invoke(() -> {
                token.throwIfCancellationRequested();
                return persistence.deleteEvents(key);
            })
            .thenCompose(ignored -> snapshotStore != null ? snapshotStore.delete(key) : CompletableFuture.<Void>completedFuture(null))
            .whenComplete((ignored, error) -> {
                cache.invalidate(key);
                if (error == null) {
                    logger.info("Deleted {}", key);
                }
            });
    }

    private boolean snapshotsEnabled() {
        return snapshotStore != null && definition.getSnapshotSupport().isPresent();
    }

    public AggregateDefinition<A> getDefinition() {
        return definition;
    }

    public EventStreamCache getCache() {
        return cache;
    }

    public AggregateStoreMetrics getMetrics() {
        return metrics;
    }

    public RetryStrategy getRetryStrategy() {
        return retryStrategy;
    }

    public static final class Builder<A extends AggregateRoot<A>> {
        private final AggregateDefinition<A> definition;
        private final List<MetadataProvider> metadataProviders = new ArrayList<>();
        private EventPersistence persistence;
        private EventSerializer serializer;
        private EventStreamCache cache;
        private SnapshotStore snapshotStore;
        private RetryStrategy retryStrategy;
        private AggregateStoreMetrics metrics;
        private FoldStoreConfiguration configuration;
        private Clock clock = Clock.systemUTC();

        private Builder(AggregateDefinition<A> definition) {
            this.definition = Objects.requireNonNull(definition, "Aggregate definition cannot be null");
        }

        public Builder<A> persistence(EventPersistence persistence) {
            this.persistence = persistence;
            return this;
        }

        public Builder<A> serializer(EventSerializer serializer) {
            this.serializer = serializer;
            return this;
        }

        public Builder<A> cache(EventStreamCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder<A> snapshotStore(SnapshotStore snapshotStore) {
            this.snapshotStore = snapshotStore;
            return this;
        }

        public Builder<A> metadataProvider(MetadataProvider provider) {
            this.metadataProviders.add(Objects.requireNonNull(provider, "Metadata provider cannot be null"));
            return this;
        }

        public Builder<A> metadataProviders(List<MetadataProvider> providers) {
            providers.forEach(this::metadataProvider);
            return this;
        }

        public Builder<A> retryStrategy(RetryStrategy retryStrategy) {
            this.retryStrategy = retryStrategy;
            return this;
        }

        public Builder<A> metrics(AggregateStoreMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Supplies the retry strategy and cache when they are not set explicitly.
         */
        public Builder<A> configuration(FoldStoreConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder<A> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
            return this;
        }

        public AggregateStore<A> build() {
            return new AggregateStore<>(this);
        }
    }
}
