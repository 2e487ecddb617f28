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

import dev.mars.foldstore.api.AggregateId;
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.CancellationToken;
import dev.mars.foldstore.api.SerializedSnapshot;
import dev.mars.foldstore.api.SnapshotPersistence;
import dev.mars.foldstore.api.SourceId;
import dev.mars.foldstore.core.metrics.AggregateStoreMetrics;
import dev.mars.foldstore.core.persistence.inmemory.InMemoryEventPersistence;
import dev.mars.foldstore.core.serialization.JacksonEventSerializer;
import dev.mars.foldstore.core.snapshot.InMemorySnapshotPersistence;
import dev.mars.foldstore.core.snapshot.SnapshotStore;
import dev.mars.foldstore.core.snapshot.SnapshotStrategy;
import dev.mars.foldstore.core.testdomain.Order;
import dev.mars.foldstore.core.testdomain.OrderFixtures;
import dev.mars.foldstore.core.upgrade.EventUpgradeChain;
import dev.mars.foldstore.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Snapshots written after commits and used on load.
 */
@Tag(TestCategories.CORE)
class AggregateSnapshotTest {

    private static final AggregateId ID = AggregateId.of("order-snap");

    private InMemoryEventPersistence persistence;
    private InMemorySnapshotPersistence snapshots;
    private JacksonEventSerializer serializer;
    private AggregateDefinition<Order> definition;

    @BeforeEach
    void setUp() {
        persistence = new InMemoryEventPersistence();
        snapshots = new InMemorySnapshotPersistence();
        serializer = OrderFixtures.serializer();
        definition = Order.definition(EventUpgradeChain.empty(), true);
    }

    private AggregateStore<Order> snapshottingStore(SnapshotPersistence snapshotPersistence, AggregateStoreMetrics metrics) {
        return AggregateStore.builder(definition)
            .persistence(persistence)
            .serializer(serializer)
            .snapshotStore(new SnapshotStore(snapshotPersistence, SnapshotStrategy.everyFewVersions(2)))
            .metrics(metrics)
            .build();
    }

    private void addItems(AggregateStore<Order> store, int count) {
        IntStream.rangeClosed(1, count).forEach(i -> store.update(ID, SourceId.of("add-" + i),
            AggregateMutation.of(order -> order.addItem("sku-" + i)), CancellationToken.NONE).join());
    }

    @Test
    void testSnapshotsAreWrittenByStrategy() {
        AggregateStore<Order> store = snapshottingStore(snapshots, new AggregateStoreMetrics(Order.NAME));
        addItems(store, 5);

        Optional<SerializedSnapshot> snapshot = snapshots.getSnapshot(definition.keyOf(ID)).join();
        assertTrue(snapshot.isPresent());
        assertEquals(4, snapshot.get().aggregateSequenceNumber());
    }

    @Test
    void testLoadFromSnapshotMatchesFullReplay() {
        AggregateStore<Order> store = snapshottingStore(snapshots, new AggregateStoreMetrics(Order.NAME));
        addItems(store, 5);
        store.update(ID, SourceId.of("remove"), AggregateMutation.of(order -> order.removeItem("sku-2")),
            CancellationToken.NONE).join();

        AggregateStore<Order> replaying = AggregateStore.builder(definition)
            .persistence(persistence)
            .serializer(serializer)
            .build();

        Order fromSnapshot = store.load(ID, CancellationToken.NONE).join();
        Order fromEvents = replaying.load(ID, CancellationToken.NONE).join();

        assertEquals(fromEvents.getItems(), fromSnapshot.getItems());
        assertEquals(fromEvents.getVersion(), fromSnapshot.getVersion());
        assertEquals(6, fromSnapshot.getVersion());
    }

    @Test
    void testSourceIdOfBatchInSnapshotIsStillRecognised() {
        AggregateStore<Order> store = snapshottingStore(snapshots, new AggregateStoreMetrics(Order.NAME));
        store.update(ID, SourceId.of("pair"), AggregateMutation.of(order -> {
            order.addItem("A");
            order.addItem("B");
        }), CancellationToken.NONE).join();
        assertTrue(snapshots.getSnapshot(definition.keyOf(ID)).join().isPresent());

        List<?> repeat = store.update(ID, SourceId.of("pair"), AggregateMutation.of(order -> order.addItem("C")),
            CancellationToken.NONE).join();

        assertEquals(2, repeat.size());
        assertEquals(List.of("A", "B"), store.load(ID, CancellationToken.NONE).join().getItems());
    }

    @Test
    void testFailedSnapshotWriteDoesNotFailCommit() {
        SnapshotPersistence failing = mock(SnapshotPersistence.class);
        when(failing.getSnapshot(any())).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
        when(failing.setSnapshot(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("no space")));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AggregateStoreMetrics metrics = new AggregateStoreMetrics(Order.NAME);
        metrics.bindTo(registry);
        AggregateStore<Order> store = snapshottingStore(failing, metrics);

        addItems(store, 2);

        assertEquals(List.of("sku-1", "sku-2"), store.load(ID, CancellationToken.NONE).join().getItems());
        assertEquals(1.0, registry.get("foldstore.snapshots.failed").tag("aggregate", Order.NAME).counter().count());
        verify(failing).setSnapshot(any());
    }

    @Test
    void testDeleteRemovesSnapshots() {
        AggregateStore<Order> store = snapshottingStore(snapshots, new AggregateStoreMetrics(Order.NAME));
        addItems(store, 2);
        AggregateKey key = definition.keyOf(ID);
        assertTrue(snapshots.getSnapshot(key).join().isPresent());

        store.delete(ID, CancellationToken.NONE).join();

        assertTrue(snapshots.getSnapshot(key).join().isEmpty());
        assertTrue(store.load(ID, CancellationToken.NONE).join().isNew());
    }

    @Test
    void testSnapshotLandingAfterDeleteIsNotRestored() {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        SnapshotPersistence delayed = mock(SnapshotPersistence.class);
        when(delayed.getSnapshot(any())).thenAnswer(invocation -> snapshots.getSnapshot(invocation.getArgument(0)));
        when(delayed.deleteSnapshots(any())).thenAnswer(invocation -> snapshots.deleteSnapshots(invocation.getArgument(0)));
        when(delayed.setSnapshot(any())).thenAnswer(invocation ->
            gate.thenCompose(ignored -> snapshots.setSnapshot(invocation.getArgument(0))));
        AggregateStore<Order> store = snapshottingStore(delayed, new AggregateStoreMetrics(Order.NAME));
        addItems(store, 2);

        store.delete(ID, CancellationToken.NONE).join();
        gate.complete(null);
        assertEquals(2, snapshots.getSnapshot(definition.keyOf(ID)).join().orElseThrow().aggregateSequenceNumber());

        Order reloaded = store.load(ID, CancellationToken.NONE).join();
        assertTrue(reloaded.isNew());
        assertEquals(List.of(), reloaded.getItems());

        store.update(ID, SourceId.of("after-delete-1"), AggregateMutation.of(order -> order.addItem("C")),
            CancellationToken.NONE).join();
        store.update(ID, SourceId.of("after-delete-2"), AggregateMutation.of(order -> order.addItem("D")),
            CancellationToken.NONE).join();

        Order recreated = store.load(ID, CancellationToken.NONE).join();
        assertEquals(List.of("C", "D"), recreated.getItems());
        assertEquals(2, recreated.getVersion());
    }

    @Test
    void testSnapshotOfOlderVersionIsUpgradedOnLoad() {
        AggregateStore<Order> v1Store = snapshottingStore(snapshots, new AggregateStoreMetrics(Order.NAME));
        addItems(v1Store, 5);
        assertEquals(4, snapshots.getSnapshot(definition.keyOf(ID)).join().orElseThrow().aggregateSequenceNumber());

        AggregateDefinition<Order> counted = Order.definitionWithCountedSnapshots();
        AggregateStore<Order> v2Store = AggregateStore.builder(counted)
            .persistence(persistence)
            .serializer(serializer)
            .snapshotStore(new SnapshotStore(snapshots, SnapshotStrategy.never()))
            .build();
        AggregateStore<Order> replaying = AggregateStore.builder(counted)
            .persistence(persistence)
            .serializer(serializer)
            .build();

        Order upgraded = v2Store.load(ID, CancellationToken.NONE).join();
        Order fromEvents = replaying.load(ID, CancellationToken.NONE).join();

        assertEquals(4, upgraded.getSnapshotVersion());
        assertEquals(fromEvents.getItems(), upgraded.getItems());
        assertEquals(5, upgraded.getVersion());
    }
}
