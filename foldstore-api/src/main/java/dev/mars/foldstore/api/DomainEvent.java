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
 * A committed event after deserialization: the typed event together with its metadata and
 * stream position. Upgraders consume and produce domain events.
 *
 * @param aggregateKey aggregate name and id
 * @param aggregateSequenceNumber position within the aggregate stream
 * @param globalSequenceNumber position in the backend wide commit order
 * @param event the typed event
 * @param metadata the event metadata
 */
public record DomainEvent(
    AggregateKey aggregateKey,
    long aggregateSequenceNumber,
    long globalSequenceNumber,
    AggregateEvent event,
    Metadata metadata
) {

    public DomainEvent {
        Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
        Objects.requireNonNull(event, "Event cannot be null");
        Objects.requireNonNull(metadata, "Metadata cannot be null");
    }

    /**
     * Returns a copy carrying a different event at the same stream position.
     */
    public DomainEvent withEvent(AggregateEvent replacement) {
        return new DomainEvent(aggregateKey, aggregateSequenceNumber, globalSequenceNumber, replacement, metadata);
    }

    public Class<? extends AggregateEvent> eventType() {
        return event.getClass();
    }
}
