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

import dev.mars.foldstore.api.AggregateEvent;
import dev.mars.foldstore.api.AggregateId;
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.Metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class of event-sourced aggregates.
 *
 * <p>State only changes through {@link #emit(AggregateEvent)}, which applies the event
 * immediately through the handler table of the aggregate's {@link AggregateDefinition} and
 * queues it for commit. An aggregate instance is created fresh for every load and is not
 * thread-safe.</p>
 *
 * @param <A> the concrete aggregate type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public abstract class AggregateRoot<A extends AggregateRoot<A>> {

    private final AggregateId id;
    private final List<UncommittedEvent> uncommittedEvents = new ArrayList<>();
    private long version;
    private long snapshotVersion;
    private LastBatch lastBatch;

    protected AggregateRoot(AggregateId id) {
        this.id = Objects.requireNonNull(id, "Aggregate id cannot be null");
    }

    /**
     * Returns the definition holding this aggregate type's handler table, usually a static constant.
     */
    protected abstract AggregateDefinition<A> definition();

    public AggregateId getId() {
        return id;
    }

    public AggregateKey getKey() {
        return definition().keyOf(id);
    }

    /**
     * Sequence number of the last committed event this instance has seen, 0 for a new aggregate.
     */
    public long getVersion() {
        return version;
    }

    public boolean isNew() {
        return version == 0;
    }

    public List<UncommittedEvent> getUncommittedEvents() {
        return Collections.unmodifiableList(uncommittedEvents);
    }

    public Optional<LastBatch> getLastBatch() {
        return Optional.ofNullable(lastBatch);
    }

    protected final void emit(AggregateEvent event) {
        emit(event, Metadata.empty());
    }

    protected final void emit(AggregateEvent event, Metadata metadata) {
        Objects.requireNonNull(event, "Event cannot be null");
        Objects.requireNonNull(metadata, "Metadata cannot be null");
        definition().apply(self(), event);
        uncommittedEvents.add(new UncommittedEvent(event, metadata, version + uncommittedEvents.size() + 1));
    }

    void replay(AggregateEvent event) {
        definition().apply(self(), event);
    }

    /** Version of the snapshot this instance was restored from, 0 if it was replayed from scratch */
    protected long getSnapshotVersion() {
        return snapshotVersion;
    }

    void markLoaded(long loadedVersion, long loadedSnapshotVersion, LastBatch loadedBatch) {
        if (!uncommittedEvents.isEmpty()) {
            throw new IllegalStateException("Aggregate " + getKey() + " has uncommitted events");
        }
        this.version = loadedVersion;
        this.snapshotVersion = loadedSnapshotVersion;
        this.lastBatch = loadedBatch;
    }

    void markCommitted(LastBatch committedBatch) {
        this.version += uncommittedEvents.size();
        this.lastBatch = committedBatch;
        uncommittedEvents.clear();
    }

    @SuppressWarnings("unchecked")
    private A self() {
        return (A) this;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + getKey() + " v" + version
            + (uncommittedEvents.isEmpty() ? "" : " +" + uncommittedEvents.size() + " uncommitted") + '}';
    }
}
