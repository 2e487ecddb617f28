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


/**
 * An aggregate was asked to apply an event type it has no handler for. This is a programming
 * error: skipping the event would silently corrupt the aggregate state.
 */
public class MissingEventHandlerException extends FoldStoreException {

    private final String aggregateName;
    private final Class<?> eventType;

    public MissingEventHandlerException(String aggregateName, Class<?> eventType) {
        super(FoldStoreErrorCodes.MISSING_EVENT_HANDLER,
            "Aggregate '" + aggregateName + "' has no handler registered for event type " + eventType.getName());
        this.aggregateName = aggregateName;
        this.eventType = eventType;
    }

    public String getAggregateName() {
        return aggregateName;
    }

    public Class<?> getEventType() {
        return eventType;
    }
}
