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

import dev.mars.foldstore.api.SourceId;

import java.util.Objects;

/**
 * The most recent committed batch of an aggregate, used to recognise a repeated update.
 *
 * @param sourceId the source id the batch was committed with
 * @param batchId the batch id shared by every event of the batch
 * @param firstSequenceNumber sequence number of the first event of the batch
 */
public record LastBatch(SourceId sourceId, String batchId, long firstSequenceNumber) {

    public LastBatch {
        Objects.requireNonNull(sourceId, "Source id cannot be null");
        Objects.requireNonNull(batchId, "Batch id cannot be null");
    }
}
