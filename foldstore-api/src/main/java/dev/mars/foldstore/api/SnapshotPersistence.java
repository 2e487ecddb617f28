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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Storage for serialized aggregate snapshots. Only the latest snapshot of a stream is ever read.
 */
public interface SnapshotPersistence {

    CompletableFuture<Optional<SerializedSnapshot>> getSnapshot(AggregateKey aggregateKey);

    /**
     * Stores a snapshot. A snapshot older than the one already stored is ignored.
     */
    CompletableFuture<Void> setSnapshot(SerializedSnapshot snapshot);

    CompletableFuture<Void> deleteSnapshots(AggregateKey aggregateKey);
}
