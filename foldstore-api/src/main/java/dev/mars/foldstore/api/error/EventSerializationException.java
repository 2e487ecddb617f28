package dev.mars.foldstore.api.error;

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

/**
 * An event could not be serialized or deserialized. Never retried.
 *
 * <p>The message always names the stream, sequence number and event name/version so the
 * offending row can be found.</p>
 */
public class EventSerializationException extends FoldStoreException {

    private final AggregateKey aggregateKey;
    private final long aggregateSequenceNumber;
    private final String eventName;
    private final int eventVersion;

    public EventSerializationException(String errorCode, AggregateKey aggregateKey, long aggregateSequenceNumber,
                                       String eventName, int eventVersion, String reason, Throwable cause) {
        super(errorCode, describe(aggregateKey, aggregateSequenceNumber, eventName, eventVersion, reason), cause);
        this.aggregateKey = aggregateKey;
        this.aggregateSequenceNumber = aggregateSequenceNumber;
        this.eventName = eventName;
        this.eventVersion = eventVersion;
    }

    public EventSerializationException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.aggregateKey = null;
        this.aggregateSequenceNumber = 0;
        this.eventName = null;
        this.eventVersion = 0;
    }

    private static String describe(AggregateKey aggregateKey, long sequenceNumber, String eventName,
                                   int eventVersion, String reason) {
        return reason + " [aggregate=" + aggregateKey + ", sequence=" + sequenceNumber
            + ", event=" + eventName + " v" + eventVersion + "]";
    }

    public AggregateKey getAggregateKey() { return aggregateKey; }
    public long getAggregateSequenceNumber() { return aggregateSequenceNumber; }
    public String getEventName() { return eventName; }
    public int getEventVersion() { return eventVersion; }
}
