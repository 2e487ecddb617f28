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

import dev.mars.foldstore.api.AggregateEvent;
import dev.mars.foldstore.api.Metadata;

import java.util.Objects;

/**
 * An event emitted by business logic that has not been committed yet.
 *
 * @param event the emitted event
 * @param metadata caller supplied metadata
 * @param expectedSequenceNumber the stream position the event will occupy if the commit wins
 */
public record UncommittedEvent(AggregateEvent event, Metadata metadata, long expectedSequenceNumber) {

    public UncommittedEvent {
        Objects.requireNonNull(event, "Event cannot be null");
        Objects.requireNonNull(metadata, "Metadata cannot be null");
    }
}
