package dev.mars.foldstore.core.snapshot;

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
import dev.mars.foldstore.api.SerializedSnapshot;
import dev.mars.foldstore.api.SnapshotPersistence;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest snapshot of each aggregate in memory. Intended for tests and single process use.
 */
public class InMemorySnapshotPersistence implements SnapshotPersistence {

    private final ConcurrentHashMap<AggregateKey, SerializedSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Optional<SerializedSnapshot>> getSnapshot(AggregateKey aggregateKey) {
        Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
        return CompletableFuture.completedFuture(Optional.ofNullable(snapshots.get(aggregateKey)));
    }

    @Override
    public CompletableFuture<Void> setSnapshot(SerializedSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        snapshots.merge(snapshot.aggregateKey(), snapshot, (existing, candidate) ->
            candidate.aggregateSequenceNumber() > existing.aggregateSequenceNumber() ? candidate : existing);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> deleteSnapshots(AggregateKey aggregateKey) {
        Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
        snapshots.remove(aggregateKey);
        return CompletableFuture.completedFuture(null);
    }
}
