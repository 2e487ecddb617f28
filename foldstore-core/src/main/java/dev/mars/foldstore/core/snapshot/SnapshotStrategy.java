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

import java.util.Random;

/**
 * Decides after a commit whether the aggregate's new state should be snapshotted.
 */
@FunctionalInterface
public interface SnapshotStrategy {

    /**
     * @param currentVersion aggregate version after the commit
     * @param lastSnapshotVersion version of the latest snapshot the load started from, 0 if none
     */
    boolean shouldSnapshot(long currentVersion, long lastSnapshotVersion);

    static SnapshotStrategy never() {
        return (currentVersion, lastSnapshotVersion) -> false;
    }

    static SnapshotStrategy everyFewVersions(int versions) {
        return new SnapshotEveryFewVersionsStrategy(versions);
    }

    static SnapshotStrategy randomly(double probability) {
        return new SnapshotRandomlyStrategy(probability, new Random());
    }
}
