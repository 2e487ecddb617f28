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
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reactive lifecycle of a manager running on a Vert.x instance it does not own.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
@ExtendWith({SharedPostgresExtension.class, VertxExtension.class})
class PgFoldStoreManagerLifecycleTest {

    @Test
    void testStartReactiveOnSharedVertx(Vertx vertx, VertxTestContext testContext) {
        PgFoldStoreManager manager = new PgFoldStoreManager(SharedPostgresExtension.configuration(), null, vertx);

        manager.startReactive()
            .compose(v -> manager.startReactive())
            .onComplete(testContext.succeeding(v -> testContext.verify(() -> {
                assertTrue(manager.isStarted());
                assertSame(vertx, manager.getVertx());
                manager.closeReactive().onComplete(testContext.succeeding(closed -> testContext.verify(() -> {
                    assertFalse(manager.isStarted());
                    testContext.completeNow();
                })));
            })));
    }

    @Test
    void testSnapshotRoundTripOnSharedVertx(Vertx vertx, VertxTestContext testContext) {
        PgFoldStoreManager manager = new PgFoldStoreManager(SharedPostgresExtension.configuration(), null, vertx);
        AggregateKey key = AggregateKey.of("order", "order-" + UUID.randomUUID());
        SerializedSnapshot snapshot = new SerializedSnapshot(key, 4, "{\"items\":[\"A\"]}", "{}");

        manager.startReactive()
            .compose(v -> Future.fromCompletionStage(
                manager.getSnapshotPersistence().setSnapshot(snapshot)
                    .thenCompose(stored -> manager.getSnapshotPersistence().getSnapshot(key))))
            .onComplete(testContext.succeeding(loaded -> testContext.verify(() -> {
                assertEquals(4, loaded.orElseThrow().aggregateSequenceNumber());
                manager.closeReactive().onComplete(closed -> testContext.completeNow());
            })));
    }
}
