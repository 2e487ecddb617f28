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
 * Name and schema version under which an event class is persisted.
 *
 * @param name the stable event name written to storage
 * @param version the schema version, starting at 1
 * @param type the Java class carrying this name and version
 */
public record EventDefinition(String name, int version, Class<? extends AggregateEvent> type) {

    public EventDefinition {
        Objects.requireNonNull(name, "Event name cannot be null");
        Objects.requireNonNull(type, "Event type cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Event name cannot be blank");
        }
        if (version < 1) {
            throw new IllegalArgumentException("Event version must be at least 1, was " + version);
        }
    }

    @Override
    public String toString() {
        return name + " v" + version;
    }
}
