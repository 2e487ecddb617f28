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

import java.util.List;
import java.util.Objects;

/**
 * One page of a globally ordered scan.
 *
 * @param events committed events in ascending global sequence order
 * @param nextGlobalSequenceNumber cursor to pass to the next scan; equal to the requested
 *                                 position when the page is empty
 */
public record CommittedEventsPage(List<CommittedEvent> events, long nextGlobalSequenceNumber) {

    public CommittedEventsPage {
        events = List.copyOf(Objects.requireNonNull(events, "Events cannot be null"));
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
