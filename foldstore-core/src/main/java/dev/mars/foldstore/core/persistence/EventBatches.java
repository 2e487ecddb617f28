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

import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.SerializedEvent;

import java.util.List;
import java.util.Objects;

/**
 * Argument checks shared by the event persistence backends.
 */
public final class EventBatches {

    private EventBatches() {
        // Utility class - no instantiation
    }

    /**
     * Validates a commit batch: non-empty, every event belongs to {@code key}, sequence numbers
     * consecutive and ascending.
     *
     * @throws IllegalArgumentException if the batch is malformed
     */
    public static void validate(AggregateKey key, List<SerializedEvent> events) {
        Objects.requireNonNull(key, "Aggregate key cannot be null");
        Objects.requireNonNull(events, "Events cannot be null");
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Cannot commit an empty batch for " + key);
        }
        long expected = events.get(0).aggregateSequenceNumber();
        for (SerializedEvent event : events) {
            if (!key.equals(event.aggregateKey())) {
                throw new IllegalArgumentException("Event for " + event.aggregateKey() + " in batch for " + key);
            }
            if (event.aggregateSequenceNumber() != expected) {
                throw new IllegalArgumentException("Batch for " + key + " is not consecutive: expected sequence "
                    + expected + " but found " + event.aggregateSequenceNumber());
            }
            expected++;
        }
    }

    public static void validateFromSequenceNumber(long fromSequenceNumber) {
        if (fromSequenceNumber < 1) {
            throw new IllegalArgumentException("From sequence number must be at least 1, was " + fromSequenceNumber);
        }
    }

    public static void validatePageSize(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive, was " + pageSize);
        }
    }

    public static long firstSequenceNumber(List<SerializedEvent> events) {
        return events.get(0).aggregateSequenceNumber();
    }
}
