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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable key-to-string mapping attached to every event.
 *
 * <p>Keys are case-sensitive and unique. Metadata is additive: {@link #with(String, String)}
 * returns a new instance with the entry appended and never removes or replaces an entry.
 * Adding a key that is already present with a different value is rejected.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class Metadata {

    private static final Metadata EMPTY = new Metadata(new LinkedHashMap<>());

    private final Map<String, String> entries;

    private Metadata(LinkedHashMap<String, String> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static Metadata empty() {
        return EMPTY;
    }

    public static Metadata of(Map<String, String> entries) {
        return EMPTY.withAll(entries);
    }

    public static Metadata of(String key, String value) {
        return EMPTY.with(key, value);
    }

    public Metadata with(String key, String value) {
        Objects.requireNonNull(key, "Metadata key cannot be null");
        Objects.requireNonNull(value, "Metadata value cannot be null for key " + key);
        if (key.isBlank()) {
            throw new IllegalArgumentException("Metadata key cannot be blank");
        }
        String existing = entries.get(key);
        if (existing != null) {
            if (existing.equals(value)) {
                return this;
            }
            throw new IllegalArgumentException("Metadata key '" + key + "' is already set to '"
                + existing + "', cannot change it to '" + value + "'");
        }
        LinkedHashMap<String, String> copy = new LinkedHashMap<>(entries);
        copy.put(key, value);
        return new Metadata(copy);
    }

    public Metadata withAll(Map<String, String> additional) {
        Objects.requireNonNull(additional, "Metadata entries cannot be null");
        Metadata result = this;
        for (Map.Entry<String, String> entry : additional.entrySet()) {
            result = result.with(entry.getKey(), entry.getValue());
        }
        return result;
    }

    public Metadata withAll(Metadata additional) {
        return withAll(additional.entries);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Map<String, String> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Optional<String> eventId() {
        return get(MetadataKeys.EVENT_ID);
    }

    public Optional<String> batchId() {
        return get(MetadataKeys.BATCH_ID);
    }

    public Optional<SourceId> sourceId() {
        return get(MetadataKeys.SOURCE_ID).map(SourceId::new);
    }

    public Optional<String> eventName() {
        return get(MetadataKeys.EVENT_NAME);
    }

    public Optional<Integer> eventVersion() {
        return get(MetadataKeys.EVENT_VERSION).map(Integer::parseInt);
    }

    public Optional<Long> aggregateSequenceNumber() {
        return get(MetadataKeys.AGGREGATE_SEQUENCE_NUMBER).map(Long::parseLong);
    }

    public Optional<Instant> timestamp() {
        return get(MetadataKeys.TIMESTAMP).map(Instant::parse);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((Metadata) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Metadata" + entries;
    }
}
