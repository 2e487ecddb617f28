package dev.mars.foldstore.pg;

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


import dev.mars.foldstore.api.AggregateId;
import dev.mars.foldstore.api.CancellationToken;
import dev.mars.foldstore.api.DomainEvent;
import dev.mars.foldstore.api.SerializedSnapshot;
import dev.mars.foldstore.api.SourceId;
import dev.mars.foldstore.core.aggregate.AggregateDefinition;
import dev.mars.foldstore.core.aggregate.AggregateMutation;
import dev.mars.foldstore.core.aggregate.AggregateStore;
import dev.mars.foldstore.core.aggregate.GlobalEventReader;
import dev.mars.foldstore.core.testdomain.Order;
import dev.mars.foldstore.core.testdomain.OrderFixtures;
import dev.mars.foldstore.core.upgrade.EventUpgradeChain;
import dev.mars.foldstore.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the aggregate store against PostgreSQL through a {@link PgFoldStoreManager}.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
@ExtendWith(SharedPostgresExtension.class)
class PgFoldStoreManagerIntegrationTest {

    private final AggregateDefinition<Order> definition = Order.definition(EventUpgradeChain.empty(), true);

    private SimpleMeterRegistry meterRegistry;
    private PgFoldStoreManager manager;
    private AggregateId id;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.setProperty("foldstore.snapshot.strategy", "every");
        props.setProperty("foldstore.snapshot.every-versions", "2");
        props.setProperty("foldstore.cache.enabled", "false");
        props.setProperty("foldstore.aggregate-store.retry.max-retries", "20");
        props.setProperty("foldstore.aggregate-store.retry.delay", "PT0.01S");

        meterRegistry = new SimpleMeterRegistry();
        manager = new PgFoldStoreManager(SharedPostgresExtension.configuration(props), meterRegistry);
        manager.start();
        id = AggregateId.of("order-" + UUID.randomUUID());
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
    }

    private AggregateStore<Order> newStore() {
        return manager.aggregateStore(definition, OrderFixtures.serializer()).build();
    }

    private void addItem(AggregateStore<Order> store, String sku) {
        store.update(id, SourceId.of("add-" + sku), AggregateMutation.of(order -> order.addItem(sku)),
            CancellationToken.NONE).join();
    }

    @Test
    void testStartIsIdempotent() {
        assertTrue(manager.isStarted());
        manager.start();
        assertTrue(manager.isStarted());
    }

    @Test
    void testUpdatesAreVisibleToAnotherStore() {
        AggregateStore<Order> writer = newStore();
        addItem(writer, "A");
        addItem(writer, "B");
        addItem(writer, "C");

        Order order = newStore().load(id, CancellationToken.NONE).join();
        assertEquals(3, order.getVersion());
        assertEquals(List.of("A", "B", "C"), order.getItems());

        Optional<SerializedSnapshot> snapshot = manager.getSnapshotPersistence()
            .getSnapshot(definition.keyOf(id)).join();
        assertTrue(snapshot.isPresent());
        assertEquals(2, snapshot.get().aggregateSequenceNumber());
        assertEquals(3.0, meterRegistry.get("foldstore.commits").tag("aggregate", Order.NAME).counter().count());
    }

    @Test
    void testConcurrentUpdatesAllLand() {
        AggregateStore<Order> first = newStore();
        AggregateStore<Order> second = newStore();

        List<CompletableFuture<?>> updates = IntStream.range(0, 6)
            .mapToObj(i -> (i % 2 == 0 ? first : second).update(id, SourceId.of("add-" + i),
                AggregateMutation.of(order -> order.addItem("sku-" + i)), CancellationToken.NONE))
            .collect(Collectors.toList());
        CompletableFuture.allOf(updates.toArray(new CompletableFuture[0])).join();

        Order order = newStore().load(id, CancellationToken.NONE).join();
        assertEquals(6, order.getVersion());
        assertEquals(6, order.getItems().stream().distinct().count());
    }

    @Test
    void testDeleteRemovesEventsAndSnapshot() {
        AggregateStore<Order> store = newStore();
        addItem(store, "A");
        addItem(store, "B");

        store.delete(id, CancellationToken.NONE).join();

        assertTrue(store.load(id, CancellationToken.NONE).join().isNew());
        assertTrue(manager.getSnapshotPersistence().getSnapshot(definition.keyOf(id)).join().isEmpty());
    }

    @Test
    void testGlobalReaderSeesCommittedEvents() {
        addItem(newStore(), "A");

        GlobalEventReader reader = manager.globalEventReader(OrderFixtures.serializer()).register(definition);
        assertEquals(manager.getConfiguration().getAggregateStoreConfig().getGlobalReaderPageSize(), reader.getPageSize());
        List<DomainEvent> seen = new ArrayList<>();
        long cursor = reader.catchUp(0, seen::add, CancellationToken.NONE).join();

        assertTrue(cursor > 0);
        boolean found = seen.stream().anyMatch(event -> event.aggregateKey().equals(definition.keyOf(id)));
        assertTrue(found);
    }
}
