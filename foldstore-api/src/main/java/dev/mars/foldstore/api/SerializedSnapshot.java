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

import java.util.Objects;

/**
 * Point-in-time serialized aggregate state.
 *
 * @param aggregateKey aggregate name and id
 * @param aggregateSequenceNumber sequence number of the last event folded into the state
 * @param data serialized state
 * @param metadata serialized snapshot metadata
 */
public record SerializedSnapshot(
    AggregateKey aggregateKey,
    long aggregateSequenceNumber,
    String data,
    String metadata
) {

    public SerializedSnapshot {
        Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
        Objects.requireNonNull(data, "Data cannot be null");
        Objects.requireNonNull(metadata, "Metadata cannot be null");
        if (aggregateSequenceNumber < 1) {
            throw new IllegalArgumentException("Snapshot sequence number must be positive, was " + aggregateSequenceNumber);
        }
    }
}
