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
 * Opaque, immutable identity of one aggregate instance within its aggregate-type namespace.
 *
 * @param value the identity value, never blank
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public record AggregateId(String value) {

    public AggregateId {
        Objects.requireNonNull(value, "Aggregate id cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Aggregate id cannot be blank");
        }
    }

    public static AggregateId of(String value) {
        return new AggregateId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
