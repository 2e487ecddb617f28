package dev.mars.foldstore.core.metadata;

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
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.Metadata;
import dev.mars.foldstore.api.MetadataProvider;

import java.util.Map;

/**
 * Records the Java class of every event, useful when debugging serializer registrations.
 */
public class EventTypeMetadataProvider implements MetadataProvider {

    public static final String EVENT_TYPE_CLASS_NAME = "event_type_class_name";

    @Override
    public Map<String, String> provideMetadata(AggregateKey aggregateKey, AggregateEvent event, Metadata metadata) {
        return Map.of(EVENT_TYPE_CLASS_NAME, event.getClass().getName());
    }
}
