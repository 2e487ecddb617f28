package dev.mars.foldstore.core.persistence;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.foldstore.api.CommittedEvent;
import dev.mars.foldstore.api.SerializedEvent;
import dev.mars.foldstore.core.serialization.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether a commit batch is a repeat of events that are already stored.
 *
 * <p>Payload and metadata are compared as JSON trees, so a backend that normalises JSON (for
 * example PostgreSQL {@code jsonb}) still recognises its own events. Because metadata carries
 * the batch id, two writers racing for the same positions never match each other.</p>
 */
public class CommittedEventMatcher {
    private static final Logger logger = LoggerFactory.getLogger(CommittedEventMatcher.class);

    private final ObjectMapper objectMapper;

    public CommittedEventMatcher() {
        this(ObjectMappers.createDefaultObjectMapper());
    }

    public CommittedEventMatcher(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    /**
     * Returns true if {@code stored} holds every event of {@code batch} with identical content.
     */
    public boolean isRepeatOf(List<CommittedEvent> stored, List<SerializedEvent> batch) {
        Map<Long, CommittedEvent> bySequence = new HashMap<>();
        for (CommittedEvent event : stored) {
            bySequence.put(event.aggregateSequenceNumber(), event);
        }
        for (SerializedEvent candidate : batch) {
            CommittedEvent existing = bySequence.get(candidate.aggregateSequenceNumber());
            if (existing == null || !sameContent(existing, candidate)) {
                return false;
            }
        }
        return true;
    }

    public boolean sameContent(CommittedEvent stored, SerializedEvent candidate) {
        return stored.eventName().equals(candidate.eventName())
            && stored.eventVersion() == candidate.eventVersion()
            && sameJson(stored.data(), candidate.data())
            && sameJson(stored.metadata(), candidate.serializedMetadata());
    }

    private boolean sameJson(String left, String right) {
        if (left.equals(right)) {
            return true;
        }
        try {
            JsonNode leftTree = objectMapper.readTree(left);
            JsonNode rightTree = objectMapper.readTree(right);
            return leftTree.equals(rightTree);
        } catch (JsonProcessingException e) {
            logger.debug("Treating unparseable JSON as different content: {}", e.getOriginalMessage());
            return false;
        }
    }
}
