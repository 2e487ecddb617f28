package dev.mars.foldstore.core.persistence.files;

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

import dev.mars.foldstore.api.AggregateId;
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.CommittedEvent;

/**
 * JSON layout of one event file.
 */
record FileEventRecord(
    String aggregateName,
    String aggregateId,
    long aggregateSequenceNumber,
    long globalSequenceNumber,
    String eventName,
    int eventVersion,
    String batchId,
    String data,
    String metadata
) {

    static FileEventRecord from(CommittedEvent event) {
        return new FileEventRecord(event.aggregateName(), event.aggregateId().value(), event.aggregateSequenceNumber(),
            event.globalSequenceNumber(), event.eventName(), event.eventVersion(), event.batchId(), event.data(),
            event.metadata());
    }

    CommittedEvent toCommittedEvent() {
        return new CommittedEvent(new AggregateKey(aggregateName, new AggregateId(aggregateId)), aggregateSequenceNumber,
            globalSequenceNumber, eventName, eventVersion, data, metadata, batchId);
    }
}
