package dev.mars.foldstore.core.serialization;

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
import dev.mars.foldstore.api.EventDefinition;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit mapping between persisted event names/versions and Java classes.
 *
 * <p>Every event class is registered once under exactly one name and version. Older versions of
 * an event keep their own class so that upgraders can turn them into the current one.</p>
 */
public final class EventDefinitionRegistry {

    private final Map<Class<? extends AggregateEvent>, EventDefinition> byType = new ConcurrentHashMap<>();
    private final Map<String, EventDefinition> byNameAndVersion = new ConcurrentHashMap<>();

    public EventDefinitionRegistry register(String name, int version, Class<? extends AggregateEvent> type) {
        return register(new EventDefinition(name, version, type));
    }

    public synchronized EventDefinitionRegistry register(EventDefinition definition) {
        Objects.requireNonNull(definition, "Event definition cannot be null");
        EventDefinition existingType = byType.get(definition.type());
        if (existingType != null && !existingType.equals(definition)) {
            throw new IllegalArgumentException("Event type " + definition.type().getName()
                + " is already registered as " + existingType);
        }
        EventDefinition existingName = byNameAndVersion.get(key(definition.name(), definition.version()));
        if (existingName != null && !existingName.equals(definition)) {
            throw new IllegalArgumentException("Event " + definition + " is already registered for "
                + existingName.type().getName());
        }
        byType.put(definition.type(), definition);
        byNameAndVersion.put(key(definition.name(), definition.version()), definition);
        return this;
    }

    public Optional<EventDefinition> findByType(Class<? extends AggregateEvent> type) {
        return Optional.ofNullable(byType.get(type));
    }

    public Optional<EventDefinition> findByNameAndVersion(String name, int version) {
        return Optional.ofNullable(byNameAndVersion.get(key(name, version)));
    }

    public Collection<EventDefinition> getDefinitions() {
        return List.copyOf(byType.values());
    }

    private static String key(String name, int version) {
        return name + "#" + version;
    }
}
