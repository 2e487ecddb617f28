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
 * An uncommitted event after serialization, ready to be handed to an {@link EventPersistence}.
 *
 * @param aggregateKey the stream the event belongs to
 * @param aggregateSequenceNumber the sequence number the event expects to occupy
 * @param eventName persisted event name
 * @param eventVersion persisted event schema version
 * @param data serialized payload
 * @param serializedMetadata serialized metadata
 * @param metadata the metadata that was serialized
 */
public record SerializedEvent(
    AggregateKey aggregateKey,
    long aggregateSequenceNumber,
    String eventName,
    int eventVersion,
    String data,
    String serializedMetadata,
    Metadata metadata
) {

    public SerializedEvent {
        Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
        Objects.requireNonNull(eventName, "Event name cannot be null");
        Objects.requireNonNull(data, "Data cannot be null");
        Objects.requireNonNull(serializedMetadata, "Serialized metadata cannot be null");
        Objects.requireNonNull(metadata, "Metadata cannot be null");
        if (aggregateSequenceNumber < 1) {
            throw new IllegalArgumentException("Aggregate sequence number must be positive, was " + aggregateSequenceNumber);
        }
    }

    public String batchId() {
        return metadata.batchId().orElse("");
    }
}
