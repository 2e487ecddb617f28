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
import dev.mars.foldstore.api.SnapshotPersistence;
import dev.mars.foldstore.api.retry.RetryStrategy;
import dev.mars.foldstore.core.retry.TransientFaultHandler;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowIterator;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static dev.mars.foldstore.pg.PgEventPersistence.toCompletableFuture;

/**
 * Keeps the latest snapshot of each aggregate in {@code foldstore_snapshots}. The upsert only
 * replaces a row holding an older sequence number.
 */
public class PgSnapshotPersistence implements SnapshotPersistence {
    private static final Logger logger = LoggerFactory.getLogger(PgSnapshotPersistence.class);

    private static final String UPSERT_SQL = """
        INSERT INTO foldstore_snapshots
            (aggregate_name, aggregate_id, aggregate_sequence_number, data, metadata, updated_at)
        VALUES ($1, $2, $3, $4::text::jsonb, $5::text::jsonb, NOW())
        ON CONFLICT (aggregate_name, aggregate_id) DO UPDATE
        SET aggregate_sequence_number = EXCLUDED.aggregate_sequence_number,
            data = EXCLUDED.data,
            metadata = EXCLUDED.metadata,
            updated_at = NOW()
        WHERE foldstore_snapshots.aggregate_sequence_number < EXCLUDED.aggregate_sequence_number
        """;

    private static final String SELECT_SQL = """
        SELECT aggregate_sequence_number, data::text AS data, metadata::text AS metadata
        FROM foldstore_snapshots
        WHERE aggregate_name = $1 AND aggregate_id = $2
        """;

    private static final String DELETE_SQL =
        "DELETE FROM foldstore_snapshots WHERE aggregate_name = $1 AND aggregate_id = $2";

    private final Pool pool;
    private final TransientFaultHandler faultHandler;

    public PgSnapshotPersistence(Pool pool) {
        this(pool, PgTransientErrorRetryStrategy.defaults());
    }

    public PgSnapshotPersistence(Pool pool, RetryStrategy retryStrategy) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.faultHandler = new TransientFaultHandler("PostgreSQL snapshots",
            Objects.requireNonNull(retryStrategy, "Retry strategy cannot be null"));
    }

    @Override
    public CompletableFuture<Optional<SerializedSnapshot>> getSnapshot(AggregateKey aggregateKey) {
        Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
        return faultHandler.tryAsync("load snapshot " + aggregateKey, () -> toCompletableFuture(
            pool.preparedQuery(SELECT_SQL)
                .execute(keyOf(aggregateKey))
                .map(rowSet -> {
                    RowIterator<Row> rows = rowSet.iterator();
                    if (!rows.hasNext()) {
                        return Optional.<SerializedSnapshot>empty();
                    }
                    Row row = rows.next();
                    return Optional.of(new SerializedSnapshot(aggregateKey,
                        row.getLong("aggregate_sequence_number"),
                        row.getString("data"),
                        row.getString("metadata")));
                })));
    }

    @Override
    public CompletableFuture<Void> setSnapshot(SerializedSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        AggregateKey key = snapshot.aggregateKey();
        return faultHandler.tryAsync("store snapshot " + key, () -> toCompletableFuture(
            pool.preparedQuery(UPSERT_SQL)
                .execute(Tuple.of(key.aggregateName(), key.aggregateId().value(),
                    snapshot.aggregateSequenceNumber(), snapshot.data(), snapshot.metadata()))
                .onSuccess(rowSet -> {
                    if (rowSet.rowCount() == 0) {
                        logger.debug("Kept newer snapshot of {} over version {}", key, snapshot.aggregateSequenceNumber());
                    }
                })
                .<Void>mapEmpty()));
    }

    @Override
    public CompletableFuture<Void> deleteSnapshots(AggregateKey aggregateKey) {
        Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
        return faultHandler.tryAsync("delete snapshots " + aggregateKey, () -> toCompletableFuture(
            pool.preparedQuery(DELETE_SQL)
                .execute(keyOf(aggregateKey))
                .<Void>mapEmpty()));
    }

    private static Tuple keyOf(AggregateKey aggregateKey) {
        return Tuple.of(aggregateKey.aggregateName(), aggregateKey.aggregateId().value());
    }
}
