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


/**
 * Converts typed events and their metadata to the persisted envelope and back.
 *
 * <p>Re-serializing an unchanged event must produce semantically identical output, though not
 * necessarily the same bytes.</p>
 */
public interface EventSerializer {

    /**
     * Looks up the persisted name and version of an event.
     *
     * @throws dev.mars.foldstore.api.error.EventSerializationException if the event type is not registered
     */
    EventDefinition definitionOf(AggregateEvent event);

    /**
     * Serializes an event whose metadata is already complete.
     */
    SerializedEvent serialize(AggregateKey aggregateKey, long aggregateSequenceNumber, AggregateEvent event, Metadata metadata);

    /**
     * Deserializes a committed event into its typed form, as stored (before any upgrade).
     *
     * @throws dev.mars.foldstore.api.error.EventSerializationException for corrupt payloads or unknown event names
     */
    DomainEvent deserialize(CommittedEvent committedEvent);

    String serializeMetadata(Metadata metadata);

    Metadata deserializeMetadata(String serializedMetadata);
}
