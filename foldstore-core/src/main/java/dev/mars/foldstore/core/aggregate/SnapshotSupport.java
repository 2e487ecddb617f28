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

import dev.mars.foldstore.core.upgrade.SnapshotUpgrader;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Captures and restores the state of an aggregate type for snapshotting.
 *
 * @param <A> the aggregate type
 * @param <S> the snapshot state type, serialized with Jackson
 */
public interface SnapshotSupport<A, S> {

    /** Stable name written to snapshot metadata */
    String snapshotName();

    /** Schema version of the snapshot state, starting at 1 */
    int snapshotVersion();

    Class<S> stateType();

    S capture(A aggregate);

    void restore(A aggregate, S state);

    /**
     * Upgraders for states stored at older versions, ordered by {@link SnapshotUpgrader#fromVersion()}.
     * A snapshot is restorable when the upgraders form an unbroken path from its stored version to
     * {@link #snapshotVersion()}.
     */
    default List<SnapshotUpgrader<?, ?>> upgraders() {
        return List.of();
    }

    static <A, S> SnapshotSupport<A, S> of(String snapshotName, int snapshotVersion, Class<S> stateType,
                                           Function<A, S> capture, BiConsumer<A, S> restore) {
        return of(snapshotName, snapshotVersion, stateType, capture, restore, List.of());
    }

    static <A, S> SnapshotSupport<A, S> of(String snapshotName, int snapshotVersion, Class<S> stateType,
                                           Function<A, S> capture, BiConsumer<A, S> restore,
                                           List<SnapshotUpgrader<?, ?>> upgraders) {
        Objects.requireNonNull(snapshotName, "Snapshot name cannot be null");
        Objects.requireNonNull(stateType, "State type cannot be null");
        Objects.requireNonNull(capture, "Capture function cannot be null");
        Objects.requireNonNull(restore, "Restore function cannot be null");
        Objects.requireNonNull(upgraders, "Upgraders cannot be null");
        if (snapshotVersion < 1) {
            throw new IllegalArgumentException("Snapshot version must be at least 1");
        }
        List<SnapshotUpgrader<?, ?>> ordered = new ArrayList<>(upgraders);
        ordered.sort(Comparator.comparingInt(SnapshotUpgrader::fromVersion));
        for (int i = 0; i < ordered.size(); i++) {
            int fromVersion = ordered.get(i).fromVersion();
            if (fromVersion >= snapshotVersion) {
                throw new IllegalArgumentException("Snapshot upgrader from version " + fromVersion
                    + " does not lead below current version " + snapshotVersion);
            }
            if (i > 0 && ordered.get(i - 1).fromVersion() == fromVersion) {
                throw new IllegalArgumentException("Duplicate snapshot upgrader from version " + fromVersion);
            }
        }
        List<SnapshotUpgrader<?, ?>> chain = List.copyOf(ordered);
        return new SnapshotSupport<>() {
            @Override
            public String snapshotName() {
                return snapshotName;
            }

            @Override
            public int snapshotVersion() {
                return snapshotVersion;
            }

            @Override
            public Class<S> stateType() {
                return stateType;
            }

            @Override
            public S capture(A aggregate) {
                return capture.apply(aggregate);
            }

            @Override
            public void restore(A aggregate, S state) {
                restore.accept(aggregate, state);
            }

            @Override
            public List<SnapshotUpgrader<?, ?>> upgraders() {
                return chain;
            }
        };
    }
}
