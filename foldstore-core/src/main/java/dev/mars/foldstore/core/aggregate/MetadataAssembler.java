package dev.mars.foldstore.core.aggregate;

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
import dev.mars.foldstore.api.EventDefinition;
import dev.mars.foldstore.api.Metadata;
import dev.mars.foldstore.api.MetadataKeys;
import dev.mars.foldstore.api.MetadataProvider;
import dev.mars.foldstore.api.SourceId;
import dev.mars.foldstore.api.error.FoldStoreErrorCodes;
import dev.mars.foldstore.api.error.MetadataConfigurationException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds the complete metadata of an event about to be committed.
 *
 * <p>Caller metadata comes first, then the output of every provider, then the reserved keys
 * owned by the store. Each provider sees only the caller metadata, never another provider's
 * output. Reserved keys from callers or providers, and keys written by two sources, are rejected
 * with {@link MetadataConfigurationException}.</p>
 */
public final class MetadataAssembler {

    private final List<MetadataProvider> providers;
    private final Clock clock;

    public MetadataAssembler(List<MetadataProvider> providers, Clock clock) {
        this.providers = List.copyOf(Objects.requireNonNull(providers, "Metadata providers cannot be null"));
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public Metadata assemble(AggregateKey key, UncommittedEvent event, EventDefinition definition,
                             SourceId sourceId, String batchId) {
        Metadata callerMetadata = event.metadata();
        for (String callerKey : callerMetadata.asMap().keySet()) {
            if (MetadataKeys.isReserved(callerKey)) {
                throw new MetadataConfigurationException(FoldStoreErrorCodes.METADATA_RESERVED_KEY, callerKey,
                    "Event metadata for " + key + " cannot set reserved key '" + callerKey + "'");
            }
        }

        Map<String, String> entries = new LinkedHashMap<>(callerMetadata.asMap());
        for (MetadataProvider provider : providers) {
            Map<String, String> provided = provider.provideMetadata(key, event.event(), callerMetadata);
            if (provided == null) {
                continue;
            }
            for (Map.Entry<String, String> entry : provided.entrySet()) {
                String providedKey = entry.getKey();
                if (MetadataKeys.isReserved(providedKey)) {
                    throw new MetadataConfigurationException(FoldStoreErrorCodes.METADATA_RESERVED_KEY, providedKey,
                        provider.getClass().getSimpleName() + " cannot provide reserved metadata key '" + providedKey + "'");
                }
                if (entries.putIfAbsent(providedKey, entry.getValue()) != null) {
                    throw new MetadataConfigurationException(FoldStoreErrorCodes.METADATA_KEY_COLLISION, providedKey,
                        provider.getClass().getSimpleName() + " provided metadata key '" + providedKey
                            + "' which is already set for " + key);
                }
            }
        }

        Instant now = clock.instant();
        long sequenceNumber = event.expectedSequenceNumber();
        entries.put(MetadataKeys.TIMESTAMP, now.toString());
        entries.put(MetadataKeys.TIMESTAMP_EPOCH, Long.toString(now.getEpochSecond()));
        entries.put(MetadataKeys.SOURCE_ID, sourceId.value());
        entries.put(MetadataKeys.BATCH_ID, batchId);
        entries.put(MetadataKeys.EVENT_ID, eventId(key, sequenceNumber).toString());
        entries.put(MetadataKeys.EVENT_NAME, definition.name());
        entries.put(MetadataKeys.EVENT_VERSION, Integer.toString(definition.version()));
        entries.put(MetadataKeys.AGGREGATE_SEQUENCE_NUMBER, Long.toString(sequenceNumber));
        entries.put(MetadataKeys.AGGREGATE_NAME, key.aggregateName());
        entries.put(MetadataKeys.AGGREGATE_ID, key.aggregateId().value());
        return Metadata.of(entries);
    }

    /**
     * Deterministic event id, the same for every attempt to write the same stream position.
     */
    static UUID eventId(AggregateKey key, long sequenceNumber) {
        // Length prefixes keep names and ids containing the separator apart
        String name = key.aggregateName().length() + ":" + key.aggregateName() + "-"
            + key.aggregateId().value().length() + ":" + key.aggregateId().value() + "-" + sequenceNumber;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }
}
