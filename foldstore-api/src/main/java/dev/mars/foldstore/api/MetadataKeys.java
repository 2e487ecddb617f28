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

import java.util.Set;

/**
 * Metadata keys written by the aggregate store itself.
 *
 * <p>Metadata providers and callers may not use any of the {@link #RESERVED} keys.</p>
 */
public final class MetadataKeys {

    private MetadataKeys() {
        // Utility class - no instantiation
    }

    public static final String EVENT_ID = "event_id";
    public static final String BATCH_ID = "batch_id";
    public static final String SOURCE_ID = "source_id";
    public static final String EVENT_NAME = "event_name";
    public static final String EVENT_VERSION = "event_version";
    public static final String TIMESTAMP = "timestamp";
    public static final String TIMESTAMP_EPOCH = "timestamp_epoch";
    public static final String AGGREGATE_SEQUENCE_NUMBER = "aggregate_sequence_number";
    public static final String AGGREGATE_NAME = "aggregate_name";
    public static final String AGGREGATE_ID = "aggregate_id";

    public static final Set<String> RESERVED = Set.of(
        EVENT_ID, BATCH_ID, SOURCE_ID, EVENT_NAME, EVENT_VERSION, TIMESTAMP, TIMESTAMP_EPOCH,
        AGGREGATE_SEQUENCE_NUMBER, AGGREGATE_NAME, AGGREGATE_ID
    );

    public static boolean isReserved(String key) {
        return RESERVED.contains(key);
    }
}
