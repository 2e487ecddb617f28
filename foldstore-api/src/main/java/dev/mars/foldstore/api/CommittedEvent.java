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
 * The atomic persisted unit of an event stream. Created exactly once when a batch commits and
 * never mutated afterwards.
 *
 * <p>This is the portable layout every backend must be able to store and return; the physical
 * representation is backend specific.</p>
 *
 * @param aggregateKey aggregate name and id
 * @param aggregateSequenceNumber 1-based position within the aggregate stream
 * @param globalSequenceNumber position in the backend wide commit order
 * @param eventName persisted event name
 * @param eventVersion persisted event schema version
 * @param data serialized payload
 * @param metadata serialized metadata
 * @param batchId id of the commit batch the event was written in
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public record CommittedEvent(
    AggregateKey aggregateKey,
    long aggregateSequenceNumber,
    long globalSequenceNumber,
    String eventName,
    int eventVersion,
    String data,
    String metadata,
    String batchId
) {

    public CommittedEvent {
        Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
        Objects.requireNonNull(eventName, "Event name cannot be null");
        Objects.requireNonNull(data, "Data cannot be null");
        Objects.requireNonNull(metadata, "Metadata cannot be null");
        Objects.requireNonNull(batchId, "Batch id cannot be null");
    }

    public static CommittedEvent from(SerializedEvent event, long globalSequenceNumber) {
        return new CommittedEvent(
            event.aggregateKey(),
            event.aggregateSequenceNumber(),
            globalSequenceNumber,
            event.eventName(),
            event.eventVersion(),
            event.data(),
            event.serializedMetadata(),
            event.batchId()
        );
    }

    public AggregateId aggregateId() {
        return aggregateKey.aggregateId();
    }

    public String aggregateName() {
        return aggregateKey.aggregateName();
    }

    @Override
    public String toString() {
        return "CommittedEvent{" + aggregateKey + " #" + aggregateSequenceNumber
            + " (global " + globalSequenceNumber + ") " + eventName + " v" + eventVersion
            + ", batch " + batchId + "}";
    }
}
