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
 * Another writer committed events for the same aggregate between load and commit.
 *
 * <p>Raised by backends when the (aggregate, sequence number) uniqueness constraint is violated,
 * and by the aggregate store when its conflict retries are exhausted.</p>
 */
public class OptimisticConcurrencyException extends FoldStoreException {

    private final AggregateKey aggregateKey;
    private final long expectedSequenceNumber;

    public OptimisticConcurrencyException(AggregateKey aggregateKey, long expectedSequenceNumber, String message) {
        this(FoldStoreErrorCodes.OPTIMISTIC_CONCURRENCY_CONFLICT, aggregateKey, expectedSequenceNumber, message, null);
    }

    public OptimisticConcurrencyException(AggregateKey aggregateKey, long expectedSequenceNumber, String message,
                                          Throwable cause) {
        this(FoldStoreErrorCodes.OPTIMISTIC_CONCURRENCY_CONFLICT, aggregateKey, expectedSequenceNumber, message, cause);
    }

    private OptimisticConcurrencyException(String errorCode, AggregateKey aggregateKey, long expectedSequenceNumber,
                                           String message, Throwable cause) {
        super(errorCode, message, cause);
        this.aggregateKey = aggregateKey;
        this.expectedSequenceNumber = expectedSequenceNumber;
    }

    public static OptimisticConcurrencyException retriesExhausted(OptimisticConcurrencyException last, int attempts) {
        return new OptimisticConcurrencyException(
            FoldStoreErrorCodes.OPTIMISTIC_CONCURRENCY_RETRIES_EXHAUSTED,
            last.getAggregateKey(),
            last.getExpectedSequenceNumber(),
            "Gave up updating " + last.getAggregateKey() + " after " + attempts
                + " attempts due to concurrent writers: " + last.getMessage(),
            last);
    }

    public AggregateKey getAggregateKey() {
        return aggregateKey;
    }

    /** First sequence number of the batch that lost the race */
    public long getExpectedSequenceNumber() {
        return expectedSequenceNumber;
    }

    @Override
    public boolean isConcurrencyConflict() {
        return true;
    }
}
