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

/**
 * Snapshots once the aggregate has moved at least {@code versions} events past its last snapshot.
 */
public class SnapshotEveryFewVersionsStrategy implements SnapshotStrategy {

    public static final int DEFAULT_VERSIONS = 100;

    private final int versions;

    public SnapshotEveryFewVersionsStrategy(int versions) {
        if (versions < 1) {
            throw new IllegalArgumentException("Snapshot interval must be at least 1 version");
        }
        this.versions = versions;
    }

    @Override
    public boolean shouldSnapshot(long currentVersion, long lastSnapshotVersion) {
        return currentVersion - lastSnapshotVersion >= versions;
    }

    public int getVersions() {
        return versions;
    }

    @Override
    public String toString() {
        return "SnapshotEveryFewVersionsStrategy{versions=" + versions + '}';
    }
}
