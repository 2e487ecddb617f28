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


import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.SerializedSnapshot;
import dev.mars.foldstore.test.categories.TestCategories;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
@ExtendWith(SharedPostgresExtension.class)
class PgSnapshotPersistenceTest {

    private static PgFoldStoreManager manager;

    private PgSnapshotPersistence snapshots;
    private AggregateKey key;

    @BeforeAll
    static void startManager() {
        manager = new PgFoldStoreManager(SharedPostgresExtension.configuration());
        manager.start();
    }

    @AfterAll
    static void closeManager() {
        if (manager != null) {
            manager.close();
        }
    }

    @BeforeEach
    void setUp() {
        snapshots = new PgSnapshotPersistence(manager.getPool());
        key = AggregateKey.of("order", "order-" + UUID.randomUUID());
    }

    private static SerializedSnapshot snapshot(AggregateKey key, long version, String items) {
        return new SerializedSnapshot(key, version, "{\"items\":" + items + "}",
            "{\"snapshot_name\":\"order-state\",\"snapshot_version\":\"1\"}");
    }

    @Test
    void testMissingSnapshotIsEmpty() {
        assertTrue(snapshots.getSnapshot(key).join().isEmpty());
    }

    @Test
    void testStoredSnapshotIsReturned() {
        snapshots.setSnapshot(snapshot(key, 3, "[\"A\",\"B\"]")).join();

        Optional<SerializedSnapshot> loaded = snapshots.getSnapshot(key).join();
        assertTrue(loaded.isPresent());
        assertEquals(3, loaded.get().aggregateSequenceNumber());
        assertEquals(key, loaded.get().aggregateKey());
        assertTrue(loaded.get().data().contains("\"B\""));
        assertTrue(loaded.get().metadata().contains("order-state"));
    }

    @Test
    void testNewerSnapshotReplacesOlder() {
        snapshots.setSnapshot(snapshot(key, 3, "[\"A\"]")).join();
        snapshots.setSnapshot(snapshot(key, 7, "[\"A\",\"B\"]")).join();

        assertEquals(7, snapshots.getSnapshot(key).join().orElseThrow().aggregateSequenceNumber());
    }

    @Test
    void testOlderSnapshotDoesNotReplaceNewer() {
        snapshots.setSnapshot(snapshot(key, 7, "[\"A\",\"B\"]")).join();
        snapshots.setSnapshot(snapshot(key, 3, "[\"A\"]")).join();

        SerializedSnapshot loaded = snapshots.getSnapshot(key).join().orElseThrow();
        assertEquals(7, loaded.aggregateSequenceNumber());
        assertTrue(loaded.data().contains("\"B\""));
    }

    @Test
    void testDeleteRemovesOnlyThatAggregate() {
        AggregateKey other = AggregateKey.of("order", "order-" + UUID.randomUUID());
        snapshots.setSnapshot(snapshot(key, 2, "[\"A\"]")).join();
        snapshots.setSnapshot(snapshot(other, 2, "[\"C\"]")).join();

        snapshots.deleteSnapshots(key).join();

        assertTrue(snapshots.getSnapshot(key).join().isEmpty());
        assertTrue(snapshots.getSnapshot(other).join().isPresent());
    }
}
