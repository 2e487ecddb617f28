package dev.mars.foldstore.core.cache;

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

import dev.mars.foldstore.api.DomainEvent;
import dev.mars.foldstore.api.SerializedSnapshot;
import dev.mars.foldstore.core.aggregate.LastBatch;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything needed to rebuild an aggregate without touching storage: the snapshot it started
 * from, the upgraded events read after it, and the resulting version and last batch.
 *
 * @param snapshot the snapshot the load started from, or null
 * @param events upgraded events after the snapshot, in stream order
 * @param version the aggregate version after replay
 * @param lastBatch the most recent committed batch, or null for an empty stream
 */
public record CachedEventStream(SerializedSnapshot snapshot, List<DomainEvent> events, long version, LastBatch lastBatch) {

    public CachedEventStream {
        events = List.copyOf(Objects.requireNonNull(events, "Events cannot be null"));
    }

    public Optional<SerializedSnapshot> getSnapshot() {
        return Optional.ofNullable(snapshot);
    }

    public Optional<LastBatch> getLastBatch() {
        return Optional.ofNullable(lastBatch);
    }
}
