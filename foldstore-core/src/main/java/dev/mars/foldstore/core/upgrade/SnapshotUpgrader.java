package dev.mars.foldstore.core.upgrade;

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
import java.util.function.Function;

/**
 * Converts snapshot state stored at one schema version into the state of the next version.
 * Upgraders run in version order on load until the state reaches the version the aggregate
 * currently writes.
 *
 * @param <F> the state type stored at {@link #fromVersion()}
 * @param <T> the state type of the following version
 */
public interface SnapshotUpgrader<F, T> {

    /** The version this upgrader reads; it produces {@code fromVersion() + 1} */
    int fromVersion();

    /** Jackson target type of the state stored at {@link #fromVersion()} */
    Class<F> fromType();

    T upgrade(F state);

    static <F, T> SnapshotUpgrader<F, T> of(int fromVersion, Class<F> fromType, Function<F, T> upgrade) {
        Objects.requireNonNull(fromType, "From type cannot be null");
        Objects.requireNonNull(upgrade, "Upgrade function cannot be null");
        if (fromVersion < 1) {
            throw new IllegalArgumentException("Snapshot version must be at least 1");
        }
        return new SnapshotUpgrader<>() {
            @Override
            public int fromVersion() {
                return fromVersion;
            }

            @Override
            public Class<F> fromType() {
                return fromType;
            }

            @Override
            public T upgrade(F state) {
                return upgrade.apply(state);
            }

            @Override
            public String toString() {
                return "SnapshotUpgrader{v" + fromVersion + " " + fromType.getSimpleName() + " -> v" + (fromVersion + 1) + '}';
            }
        };
    }
}
