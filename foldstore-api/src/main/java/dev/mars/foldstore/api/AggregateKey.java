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

import java.util.Objects;

/**
 * Identity of one event stream: the aggregate type name plus the aggregate id.
 *
 * <p>Aggregate ids are only unique within their type namespace, so every backend keys
 * streams, sequence-number constraints and cache entries by this pair.</p>
 *
 * @param aggregateName the aggregate type name, never blank
 * @param aggregateId the aggregate id
 */
public record AggregateKey(String aggregateName, AggregateId aggregateId) {

    public AggregateKey {
        Objects.requireNonNull(aggregateName, "Aggregate name cannot be null");
        Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        if (aggregateName.isBlank()) {
            throw new IllegalArgumentException("Aggregate name cannot be blank");
        }
    }

    public static AggregateKey of(String aggregateName, String aggregateId) {
        return new AggregateKey(aggregateName, AggregateId.of(aggregateId));
    }

    @Override
    public String toString() {
        return aggregateName + "/" + aggregateId.value();
    }
}
