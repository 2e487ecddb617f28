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
import dev.mars.foldstore.api.AggregateId;
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.error.MissingEventHandlerException;
import dev.mars.foldstore.core.upgrade.EventUpgradeChain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Everything the aggregate store needs to know about one aggregate type: its stream name, how
 * to create a fresh instance, the event handler table, the upgrader chain and optional snapshot
 * support.
 *
 * <p>Handlers are registered explicitly per concrete event class and resolved once at build
 * time; applying an event without a handler fails with {@link MissingEventHandlerException}.</p>
 *
 * <pre>{@code
 * static final AggregateDefinition<Order> DEFINITION = AggregateDefinition.builder("order", Order::new)
 *     .on(ItemAdded.class, Order::apply)
 *     .build();
 * }</pre>
 *
 * @param <A> the aggregate type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class AggregateDefinition<A extends AggregateRoot<A>> {

    private final String name;
    private final Function<AggregateId, A> factory;
    private final Map<Class<? extends AggregateEvent>, EventHandler<A, ? extends AggregateEvent>> handlers;
    private final EventUpgradeChain upgradeChain;
    private final SnapshotSupport<A, ?> snapshotSupport;

    private AggregateDefinition(Builder<A> builder) {
        this.name = builder.name;
        this.factory = builder.factory;
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlers));
        this.upgradeChain = builder.upgradeChain;
        this.snapshotSupport = builder.snapshotSupport;
    }

    public static <A extends AggregateRoot<A>> Builder<A> builder(String name, Function<AggregateId, A> factory) {
        return new Builder<>(name, factory);
    }

    public String getName() {
        return name;
    }

    public AggregateKey keyOf(AggregateId id) {
        return new AggregateKey(name, id);
    }

    public A create(AggregateId id) {
        A aggregate = factory.apply(id);
        if (aggregate == null) {
            throw new IllegalStateException("Factory of aggregate '" + name + "' returned null for id " + id);
        }
        return aggregate;
    }

    public EventUpgradeChain getUpgradeChain() {
        return upgradeChain;
    }

    public Optional<SnapshotSupport<A, ?>> getSnapshotSupport() {
        return Optional.ofNullable(snapshotSupport);
    }

    public Set<Class<? extends AggregateEvent>> getHandledEventTypes() {
        return handlers.keySet();
    }

    /**
     * Applies an event to the aggregate through its registered handler.
     *
     * @throws MissingEventHandlerException if no handler is registered for the event's class
     */
    @SuppressWarnings("unchecked")
    void apply(A aggregate, AggregateEvent event) {
        EventHandler<A, AggregateEvent> handler = (EventHandler<A, AggregateEvent>) handlers.get(event.getClass());
        if (handler == null) {
            throw new MissingEventHandlerException(name, event.getClass());
        }
        handler.apply(aggregate, event);
    }

    @Override
    public String toString() {
        return "AggregateDefinition{name='" + name + "', handlers=" + handlers.size()
            + ", upgraders=" + upgradeChain.size() + ", snapshots=" + (snapshotSupport != null) + '}';
    }

    public static final class Builder<A extends AggregateRoot<A>> {
        private final String name;
        private final Function<AggregateId, A> factory;
        private final Map<Class<? extends AggregateEvent>, EventHandler<A, ? extends AggregateEvent>> handlers = new LinkedHashMap<>();
        private EventUpgradeChain upgradeChain = EventUpgradeChain.empty();
        private SnapshotSupport<A, ?> snapshotSupport;

        private Builder(String name, Function<AggregateId, A> factory) {
            Objects.requireNonNull(name, "Aggregate name cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Aggregate name cannot be blank");
            }
            this.name = name;
            this.factory = Objects.requireNonNull(factory, "Aggregate factory cannot be null");
        }

        public <E extends AggregateEvent> Builder<A> on(Class<E> eventType, EventHandler<A, E> handler) {
            Objects.requireNonNull(eventType, "Event type cannot be null");
            Objects.requireNonNull(handler, "Event handler cannot be null");
            if (handlers.putIfAbsent(eventType, handler) != null) {
                throw new IllegalArgumentException("Aggregate '" + name + "' already has a handler for " + eventType.getName());
            }
            return this;
        }

        public Builder<A> upgradeChain(EventUpgradeChain upgradeChain) {
            this.upgradeChain = Objects.requireNonNull(upgradeChain, "Upgrade chain cannot be null");
            return this;
        }

        public Builder<A> snapshotSupport(SnapshotSupport<A, ?> snapshotSupport) {
            this.snapshotSupport = Objects.requireNonNull(snapshotSupport, "Snapshot support cannot be null");
            return this;
        }

        public AggregateDefinition<A> build() {
            return new AggregateDefinition<>(this);
        }
    }
}
