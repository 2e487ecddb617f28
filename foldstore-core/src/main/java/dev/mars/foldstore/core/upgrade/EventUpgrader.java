package dev.mars.foldstore.core.upgrade;

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
import dev.mars.foldstore.api.DomainEvent;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Transforms one older event type into zero or more newer events on read. Returning an empty
 * list drops the event, returning several splits it.
 *
 * <p>The declared output types are used to detect cycles when the chain is built; an upgrader
 * must never produce a type it did not declare.</p>
 *
 * @param <E> the input event type
 */
public interface EventUpgrader<E extends AggregateEvent> {

    Class<E> inputType();

    Set<Class<? extends AggregateEvent>> outputTypes();

    /**
     * @param event a domain event whose payload is an instance of {@link #inputType()}
     * @return the replacement events
     */
    List<DomainEvent> upgrade(DomainEvent event);

    /**
     * Creates an upgrader from a function over the typed payload. The replacement events keep
     * the position and metadata of the input.
     */
    static <E extends AggregateEvent> EventUpgrader<E> of(Class<E> inputType,
                                                          Set<Class<? extends AggregateEvent>> outputTypes,
                                                          Function<E, List<? extends AggregateEvent>> upgrade) {
        Objects.requireNonNull(inputType, "Input type cannot be null");
        Objects.requireNonNull(outputTypes, "Output types cannot be null");
        Objects.requireNonNull(upgrade, "Upgrade function cannot be null");
        Set<Class<? extends AggregateEvent>> outputs = Set.copyOf(outputTypes);
        return new EventUpgrader<>() {
            @Override
            public Class<E> inputType() {
                return inputType;
            }

            @Override
            public Set<Class<? extends AggregateEvent>> outputTypes() {
                return outputs;
            }

            @Override
            public List<DomainEvent> upgrade(DomainEvent event) {
                return upgrade.apply(inputType.cast(event.event())).stream()
                    .map(event::withEvent)
                    .toList();
            }

            @Override
            public String toString() {
                return "EventUpgrader{" + inputType.getSimpleName() + " -> " + outputs.stream().map(Class::getSimpleName).toList() + '}';
            }
        };
    }
}
