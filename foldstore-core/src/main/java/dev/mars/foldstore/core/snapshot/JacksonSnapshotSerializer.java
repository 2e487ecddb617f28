package dev.mars.foldstore.core.snapshot;

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
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.Metadata;
import dev.mars.foldstore.api.MetadataKeys;
import dev.mars.foldstore.api.SerializedSnapshot;
import dev.mars.foldstore.api.SourceId;
import dev.mars.foldstore.api.error.FoldStoreErrorCodes;
import dev.mars.foldstore.api.error.SnapshotException;
import dev.mars.foldstore.core.aggregate.LastBatch;
import dev.mars.foldstore.core.aggregate.SnapshotSupport;
import dev.mars.foldstore.core.serialization.ObjectMappers;

import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;

/**
 * Serializes snapshot state with Jackson. Snapshot metadata records the snapshot name and
 * version plus the last batch folded into the state, so a repeated update is still recognised
 * when no events follow the snapshot.
 */
public class JacksonSnapshotSerializer {

    private static final TypeReference<LinkedHashMap<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JacksonSnapshotSerializer() {
        this(ObjectMappers.createDefaultObjectMapper());
    }

    public JacksonSnapshotSerializer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    public <S> SerializedSnapshot serialize(AggregateKey key, long version, SnapshotSupport<?, S> support,
                                            S state, LastBatch lastBatch) {
        Metadata metadata = Metadata.empty()
            .with(SnapshotMetadataKeys.SNAPSHOT_NAME, support.snapshotName())
            .with(SnapshotMetadataKeys.SNAPSHOT_VERSION, String.valueOf(support.snapshotVersion()))
            .with(MetadataKeys.AGGREGATE_SEQUENCE_NUMBER, String.valueOf(version));
        if (lastBatch != null) {
            metadata = metadata
                .with(MetadataKeys.SOURCE_ID, lastBatch.sourceId().value())
                .with(MetadataKeys.BATCH_ID, lastBatch.batchId())
                .with(SnapshotMetadataKeys.BATCH_FIRST_SEQUENCE_NUMBER, String.valueOf(lastBatch.firstSequenceNumber()));
        }
        try {
            return new SerializedSnapshot(key, version, objectMapper.writeValueAsString(state),
                objectMapper.writeValueAsString(metadata.asMap()));
        } catch (JsonProcessingException e) {
            throw new SnapshotException(FoldStoreErrorCodes.SNAPSHOT_SERIALIZATION_FAILED,
                "Failed to serialize snapshot of " + key + " at version " + version, e);
        }
    }

    public <S> S deserializeState(SerializedSnapshot snapshot, Class<S> stateType) {
        try {
            return objectMapper.readValue(snapshot.data(), stateType);
        } catch (JsonProcessingException e) {
            throw new SnapshotException(FoldStoreErrorCodes.SNAPSHOT_SERIALIZATION_FAILED,
                "Corrupt snapshot of " + snapshot.aggregateKey() + " at version " + snapshot.aggregateSequenceNumber(), e);
        }
    }

    public Metadata deserializeMetadata(SerializedSnapshot snapshot) {
        try {
            return Metadata.of(objectMapper.readValue(snapshot.metadata(), METADATA_TYPE));
        } catch (JsonProcessingException e) {
            throw new SnapshotException(FoldStoreErrorCodes.SNAPSHOT_SERIALIZATION_FAILED,
                "Corrupt snapshot metadata of " + snapshot.aggregateKey(), e);
        }
    }

    /**
     * Reads the last batch recorded in snapshot metadata, if any.
     */
    public Optional<LastBatch> lastBatchOf(Metadata metadata) {
        Optional<SourceId> sourceId = metadata.sourceId();
        Optional<String> batchId = metadata.batchId();
        Optional<String> firstSequence = metadata.get(SnapshotMetadataKeys.BATCH_FIRST_SEQUENCE_NUMBER);
        if (sourceId.isEmpty() || batchId.isEmpty() || firstSequence.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new LastBatch(sourceId.get(), batchId.get(), Long.parseLong(firstSequence.get())));
    }
}
