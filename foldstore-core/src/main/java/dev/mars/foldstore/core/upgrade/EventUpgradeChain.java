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
import dev.mars.foldstore.api.error.EventUpgradeException;
import dev.mars.foldstore.api.error.FoldStoreErrorCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered list of upgraders for one aggregate type, applied on read until a fixpoint.
 *
 * <p>Each pass runs every upgrader, in registration order, over every event. Passes repeat until
 * one changes nothing. The declared input to output graph is checked for cycles when the chain is
 * built, and the number of passes is bounded by {@code maxIterations}. Upgraded events keep the
 * sequence numbers and metadata of the event they replace.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class EventUpgradeChain {
    private static final Logger logger = LoggerFactory.getLogger(EventUpgradeChain.class);

    public static final int DEFAULT_MAX_ITERATIONS = 32;

    private static final EventUpgradeChain EMPTY = new EventUpgradeChain(List.of(), DEFAULT_MAX_ITERATIONS);

    private final List<EventUpgrader<?>> upgraders;
    private final int maxIterations;

    private EventUpgradeChain(List<EventUpgrader<?>> upgraders, int maxIterations) {
        this.upgraders = List.copyOf(upgraders);
        this.maxIterations = maxIterations;
    }

    public static EventUpgradeChain empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return upgraders.size();
    }

    public boolean isEmpty() {
        return upgraders.isEmpty();
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Upgrades a stream of events until no upgrader applies.
     *
     * @throws EventUpgradeException if no fixpoint is reached within {@code maxIterations} passes
     */
    public List<DomainEvent> upgrade(List<DomainEvent> events) {
        if (upgraders.isEmpty() || events.isEmpty()) {
            return events;
        }

        List<DomainEvent> current = events;
        for (int pass = 1; pass <= maxIterations; pass++) {
            boolean changed = false;
            for (EventUpgrader<?> upgrader : upgraders) {
                List<DomainEvent> next = new ArrayList<>(current.size());
                for (DomainEvent event : current) {
                    if (upgrader.inputType().equals(event.eventType())) {
                        List<DomainEvent> replacements = upgrader.upgrade(event);
                        logger.debug("Upgraded {} #{} from {} into {} event(s)", event.aggregateKey(),
                            event.aggregateSequenceNumber(), event.eventType().getSimpleName(), replacements.size());
                        for (DomainEvent replacement : replacements) {
                            next.add(event.withEvent(replacement.event()));
                        }
                        changed = true;
                    } else {
                        next.add(event);
                    }
                }
                current = next;
            }
            if (!changed) {
                return current;
            }
        }

        throw new EventUpgradeException(FoldStoreErrorCodes.UPGRADE_ITERATION_LIMIT_EXCEEDED,
            "Event upgrades did not reach a fixpoint within " + maxIterations + " passes");
    }

    @Override
    public String toString() {
        return "EventUpgradeChain{upgraders=" + upgraders + ", maxIterations=" + maxIterations + '}';
    }

    public static final class Builder {
        private final List<EventUpgrader<?>> upgraders = new ArrayList<>();
        private int maxIterations = DEFAULT_MAX_ITERATIONS;

        private Builder() {
        }

        public Builder add(EventUpgrader<?> upgrader) {
            upgraders.add(Objects.requireNonNull(upgrader, "Upgrader cannot be null"));
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            if (maxIterations < 1) {
                throw new IllegalArgumentException("Max iterations must be at least 1");
            }
            this.maxIterations = maxIterations;
            return this;
        }

        /**
         * @throws EventUpgradeException if the declared upgrade graph contains a cycle
         */
        public EventUpgradeChain build() {
            Map<Class<?>, Set<Class<?>>> graph = new HashMap<>();
            for (EventUpgrader<?> upgrader : upgraders) {
                Set<Class<?>> edges = graph.computeIfAbsent(upgrader.inputType(), k -> new HashSet<>());
                for (Class<? extends AggregateEvent> output : upgrader.outputTypes()) {
                    edges.add(output);
                }
            }

            Set<Class<?>> done = new HashSet<>();
            for (Class<?> start : graph.keySet()) {
                List<Class<?>> path = new ArrayList<>();
                findCycle(start, graph, path, done);
            }
            return new EventUpgradeChain(upgraders, maxIterations);
        }

        private static void findCycle(Class<?> node, Map<Class<?>, Set<Class<?>>> graph,
                                      List<Class<?>> path, Set<Class<?>> done) {
            if (done.contains(node)) {
                return;
            }
            int index = path.indexOf(node);
            if (index >= 0) {
                List<String> cycle = new ArrayList<>();
                for (Class<?> type : path.subList(index, path.size())) {
                    cycle.add(type.getSimpleName());
                }
                cycle.add(node.getSimpleName());
                throw new EventUpgradeException(FoldStoreErrorCodes.UPGRADE_CYCLE_DETECTED,
                    "Event upgraders form a cycle: " + String.join(" -> ", cycle));
            }
            path.add(node);
            for (Class<?> next : graph.getOrDefault(node, Set.of())) {
                findCycle(next, graph, path, done);
            }
            path.remove(path.size() - 1);
            done.add(node);
        }
    }
}
