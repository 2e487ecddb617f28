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
 * Metadata keys of serialized snapshots, next to the batch keys shared with events.
 */
public final class SnapshotMetadataKeys {

    private SnapshotMetadataKeys() {
        // Utility class - no instantiation
    }

    public static final String SNAPSHOT_NAME = "snapshot_name";
    public static final String SNAPSHOT_VERSION = "snapshot_version";
    public static final String BATCH_FIRST_SEQUENCE_NUMBER = "batch_first_sequence_number";
}
