package dev.mars.foldstore.core.serialization;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.foldstore.api.AggregateEvent;
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.CommittedEvent;
import dev.mars.foldstore.api.DomainEvent;
import dev.mars.foldstore.api.EventDefinition;
import dev.mars.foldstore.api.EventSerializer;
import dev.mars.foldstore.api.Metadata;
import dev.mars.foldstore.api.SerializedEvent;
import dev.mars.foldstore.api.error.EventSerializationException;
import dev.mars.foldstore.api.error.FoldStoreErrorCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * JSON event serializer backed by Jackson and an explicit {@link EventDefinitionRegistry}.
 *
 * <p>Payloads are the Jackson representation of the event class; metadata is a flat JSON object
 * of strings in insertion order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class JacksonEventSerializer implements EventSerializer {
    private static final Logger logger = LoggerFactory.getLogger(JacksonEventSerializer.class);

    private static final TypeReference<LinkedHashMap<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private final EventDefinitionRegistry registry;
    private final ObjectMapper objectMapper;

    public JacksonEventSerializer(EventDefinitionRegistry registry) {
        this(registry, ObjectMappers.createDefaultObjectMapper());
    }

    public JacksonEventSerializer(EventDefinitionRegistry registry, ObjectMapper objectMapper) {
        this.registry = Objects.requireNonNull(registry, "Event definition registry cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    @Override
    public EventDefinition definitionOf(AggregateEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        return registry.findByType(event.getClass())
            .orElseThrow(() -> new EventSerializationException(FoldStoreErrorCodes.UNKNOWN_EVENT_TYPE,
                "Event type " + event.getClass().getName() + " is not registered", null));
    }

    @Override
    public SerializedEvent serialize(AggregateKey aggregateKey, long aggregateSequenceNumber,
                                     AggregateEvent event, Metadata metadata) {
        EventDefinition definition = definitionOf(event);
        try {
            String data = objectMapper.writeValueAsString(event);
            String serializedMetadata = serializeMetadata(metadata);
            return new SerializedEvent(aggregateKey, aggregateSequenceNumber, definition.name(), definition.version(),
                data, serializedMetadata, metadata);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(FoldStoreErrorCodes.SERIALIZATION_FAILED, aggregateKey,
                aggregateSequenceNumber, definition.name(), definition.version(), "Failed to serialize event", e);
        }
    }

    @Override
    public DomainEvent deserialize(CommittedEvent committedEvent) {
        EventDefinition definition = registry.findByNameAndVersion(committedEvent.eventName(), committedEvent.eventVersion())
            .orElseThrow(() -> new EventSerializationException(FoldStoreErrorCodes.UNKNOWN_EVENT_TYPE,
                committedEvent.aggregateKey(), committedEvent.aggregateSequenceNumber(), committedEvent.eventName(),
                committedEvent.eventVersion(), "No event class registered", null));
        try {
            AggregateEvent event = objectMapper.readValue(committedEvent.data(), definition.type());
            Metadata metadata = Metadata.of(objectMapper.readValue(committedEvent.metadata(), METADATA_TYPE));
            return new DomainEvent(committedEvent.aggregateKey(), committedEvent.aggregateSequenceNumber(),
                committedEvent.globalSequenceNumber(), event, metadata);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.error("Failed to deserialize {} #{} ({} v{})", committedEvent.aggregateKey(),
                committedEvent.aggregateSequenceNumber(), committedEvent.eventName(), committedEvent.eventVersion());
            throw new EventSerializationException(FoldStoreErrorCodes.DESERIALIZATION_FAILED,
                committedEvent.aggregateKey(), committedEvent.aggregateSequenceNumber(), committedEvent.eventName(),
                committedEvent.eventVersion(), "Corrupt event payload or metadata", e);
        }
    }

    @Override
    public String serializeMetadata(Metadata metadata) {
        Objects.requireNonNull(metadata, "Metadata cannot be null");
        try {
            return objectMapper.writeValueAsString(metadata.asMap());
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(FoldStoreErrorCodes.SERIALIZATION_FAILED,
                "Failed to serialize metadata", e);
        }
    }

    @Override
    public Metadata deserializeMetadata(String serializedMetadata) {
        try {
            return Metadata.of(objectMapper.readValue(serializedMetadata, METADATA_TYPE));
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(FoldStoreErrorCodes.DESERIALIZATION_FAILED,
                "Corrupt metadata: " + e.getOriginalMessage(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
