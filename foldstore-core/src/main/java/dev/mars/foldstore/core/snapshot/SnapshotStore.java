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

import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.Metadata;
import dev.mars.foldstore.api.SerializedSnapshot;
import dev.mars.foldstore.api.SnapshotPersistence;
import dev.mars.foldstore.api.error.FoldStoreErrorCodes;
import dev.mars.foldstore.api.error.SnapshotException;
import dev.mars.foldstore.core.aggregate.LastBatch;
import dev.mars.foldstore.core.aggregate.SnapshotSupport;
import dev.mars.foldstore.core.retry.Futures;
import dev.mars.foldstore.core.upgrade.SnapshotUpgrader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reads and writes aggregate snapshots through a {@link SnapshotPersistence}.
 *
 * <p>Writes are best effort: {@link #write} never completes exceptionally, failures are logged
 * and reported as {@code false}. A snapshot stored at an older version is brought up to date
 * with the support's {@link SnapshotUpgrader}s on restore. A stored snapshot with another name,
 * a newer version, no upgrade path, or unreadable metadata is ignored and the aggregate is
 * replayed from its events.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class SnapshotStore {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotStore.class);

    private final SnapshotPersistence persistence;
    private final JacksonSnapshotSerializer serializer;
    private final SnapshotStrategy strategy;

    public SnapshotStore(SnapshotPersistence persistence, SnapshotStrategy strategy) {
        this(persistence, new JacksonSnapshotSerializer(), strategy);
    }

    public SnapshotStore(SnapshotPersistence persistence, JacksonSnapshotSerializer serializer, SnapshotStrategy strategy) {
        this.persistence = Objects.requireNonNull(persistence, "Snapshot persistence cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "Snapshot serializer cannot be null");
        this.strategy = Objects.requireNonNull(strategy, "Snapshot strategy cannot be null");
    }

    public SnapshotStrategy getStrategy() {
        return strategy;
    }

    /**
     * Loads the latest snapshot that the given support can restore.
     */
    public CompletableFuture<Optional<RestorableSnapshot>> load(AggregateKey key, SnapshotSupport<?, ?> support) {
        return persistence.getSnapshot(key).thenApply(found -> found.flatMap(snapshot -> {
            Metadata metadata;
            try {
                metadata = serializer.deserializeMetadata(snapshot);
            } catch (SnapshotException e) {
                logger.warn("Ignoring snapshot of {} at version {}: {}", key, snapshot.aggregateSequenceNumber(), e.getMessage());
                return Optional.empty();
            }
            String name = metadata.get(SnapshotMetadataKeys.SNAPSHOT_NAME).orElse("");
            int storedVersion = storedVersionOf(metadata);
            if (!support.snapshotName().equals(name) || upgradePath(support, storedVersion).isEmpty()) {
                logger.info("Ignoring snapshot of {} at version {}: stored as {} v{}, expected {} v{}",
                    key, snapshot.aggregateSequenceNumber(), name, storedVersion, support.snapshotName(), support.snapshotVersion());
                return Optional.empty();
            }
            return Optional.of(new RestorableSnapshot(snapshot, serializer.lastBatchOf(metadata).orElse(null)));
        }));
    }

    /**
     * Restores aggregate state from a snapshot returned by {@link #load}, upgrading state stored at
     * an older version first.
     */
    public <A, S> void restore(A aggregate, SnapshotSupport<A, S> support, SerializedSnapshot snapshot) {
        int storedVersion = storedVersionOf(serializer.deserializeMetadata(snapshot));
        if (storedVersion == support.snapshotVersion()) {
            support.restore(aggregate, serializer.deserializeState(snapshot, support.stateType()));
            return;
        }
        List<SnapshotUpgrader<?, ?>> path = upgradePath(support, storedVersion)
            .orElseThrow(() -> new SnapshotException(FoldStoreErrorCodes.SNAPSHOT_UPGRADE_FAILED,
                "No upgrade path for snapshot of " + snapshot.aggregateKey() + " from v" + storedVersion
                    + " to v" + support.snapshotVersion(), null));
        Object state = serializer.deserializeState(snapshot, path.get(0).fromType());
        try {
            for (SnapshotUpgrader<?, ?> upgrader : path) {
                state = upgrade(upgrader, state);
            }
            support.restore(aggregate, support.stateType().cast(state));
        } catch (ClassCastException e) {
            throw new SnapshotException(FoldStoreErrorCodes.SNAPSHOT_UPGRADE_FAILED,
                "Snapshot upgraders of " + support.snapshotName() + " do not chain from v" + storedVersion, e);
        }
        logger.debug("Upgraded snapshot of {} from v{} to v{}", snapshot.aggregateKey(), storedVersion,
            support.snapshotVersion());
    }

    private static <F, T> T upgrade(SnapshotUpgrader<F, T> upgrader, Object state) {
        return upgrader.upgrade(upgrader.fromType().cast(state));
    }

    /**
     * Upgraders leading from the stored version to the current one, empty when the stored version
     * is current, empty optional when there is no path.
     */
    private static Optional<List<SnapshotUpgrader<?, ?>>> upgradePath(SnapshotSupport<?, ?> support, int storedVersion) {
        if (storedVersion < 1 || storedVersion > support.snapshotVersion()) {
            return Optional.empty();
        }
        List<SnapshotUpgrader<?, ?>> path = new ArrayList<>();
        int version = storedVersion;
        for (SnapshotUpgrader<?, ?> upgrader : support.upgraders()) {
            if (upgrader.fromVersion() == version && version < support.snapshotVersion()) {
                path.add(upgrader);
                version++;
            }
        }
        return version == support.snapshotVersion() ? Optional.of(path) : Optional.empty();
    }

    private static int storedVersionOf(Metadata metadata) {
        String version = metadata.get(SnapshotMetadataKeys.SNAPSHOT_VERSION).orElse("");
        try {
            return Integer.parseInt(version);
        } catch (NumberFormatException e) {
            logger.debug("Unreadable snapshot version '{}'", version);
            return 0;
        }
    }

    /**
     * Captures the aggregate's state now and writes it in the background.
     *
     * @return completes with true if the snapshot was stored, false if it failed
     */
    public <A, S> CompletableFuture<Boolean> write(AggregateKey key, long version, SnapshotSupport<A, S> support,
                                                   A aggregate, LastBatch lastBatch) {
        SerializedSnapshot snapshot;
        try {
            snapshot = serializer.serialize(key, version, support, support.capture(aggregate), lastBatch);
        } catch (RuntimeException e) {
            logger.warn("Failed to capture snapshot of {} at version {}: {}", key, version, e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
        return Futures.invoke(() -> persistence.setSnapshot(snapshot))
            .handle((ignored, error) -> {
                if (error != null) {
                    logger.warn("Failed to store snapshot of {} at version {}: {}", key, version,
                        Futures.unwrap(error).getMessage());
                    return false;
                }
                logger.debug("Stored snapshot of {} at version {}", key, version);
                return true;
            });
    }

    public CompletableFuture<Void> delete(AggregateKey key) {
        return persistence.deleteSnapshots(key);
    }

    /**
     * A snapshot that matches the current snapshot support, with the last batch it recorded.
     *
     * @param snapshot the serialized snapshot
     * @param lastBatch last batch folded into the snapshot, or null
     */
    public record RestorableSnapshot(SerializedSnapshot snapshot, LastBatch lastBatch) {

        public long version() {
            return snapshot.aggregateSequenceNumber();
        }
    }
}
