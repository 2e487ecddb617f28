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
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.CommittedEvent;
import dev.mars.foldstore.api.CommittedEventsPage;
import dev.mars.foldstore.api.EventPersistence;
import dev.mars.foldstore.api.SerializedEvent;
import dev.mars.foldstore.api.error.OptimisticConcurrencyException;
import dev.mars.foldstore.api.retry.RetryStrategy;
import dev.mars.foldstore.core.persistence.CommittedEventMatcher;
import dev.mars.foldstore.core.persistence.EventBatches;
import dev.mars.foldstore.core.retry.TransientFaultHandler;
import io.vertx.core.Future;
import io.vertx.pgclient.PgException;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * PostgreSQL backend for event streams.
 *
 * <p>A batch is inserted in one transaction with {@code executeBatch}. The unique constraint on
 * (aggregate name, aggregate id, sequence number) decides which of two racing writers wins; the
 * loser sees SQLSTATE 23505 and gets an {@link OptimisticConcurrencyException}, unless the rows
 * already stored are the same batch, in which case the stored events are returned.</p>
 *
 * <p>Global sequence numbers come from a {@code BIGSERIAL}, which hands out values before commit.
 * A global read therefore only returns rows whose writing transaction is older than every
 * transaction still in flight ({@code pg_snapshot_xmin}); a reader never skips a row that
 * commits later with a lower number.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class PgEventPersistence implements EventPersistence {
    private static final Logger logger = LoggerFactory.getLogger(PgEventPersistence.class);

    static final String UNIQUE_VIOLATION = "23505";

    private static final String INSERT_EVENT_SQL = """
        INSERT INTO foldstore_events
            (batch_id, aggregate_name, aggregate_id, aggregate_sequence_number,
             event_name, event_version, data, metadata)
        VALUES ($1, $2, $3, $4, $5, $6, $7::text::jsonb, $8::text::json)
        RETURNING global_sequence_number
        """;

    private static final String SELECT_COLUMNS = """
        SELECT global_sequence_number, batch_id, aggregate_name, aggregate_id, aggregate_sequence_number,
               event_name, event_version, data::text AS data, metadata::text AS metadata
        FROM foldstore_events
        """;

    private static final String SELECT_STREAM_SQL = SELECT_COLUMNS + """
        WHERE aggregate_name = $1 AND aggregate_id = $2 AND aggregate_sequence_number >= $3
        ORDER BY aggregate_sequence_number
        """;

    private static final String SELECT_STREAM_RANGE_SQL = SELECT_COLUMNS + """
        WHERE aggregate_name = $1 AND aggregate_id = $2
          AND aggregate_sequence_number BETWEEN $3 AND $4
        ORDER BY aggregate_sequence_number
        """;

    private static final String SELECT_GLOBAL_SQL = SELECT_COLUMNS + """
        WHERE global_sequence_number >= $1
          AND transaction_id < pg_snapshot_xmin(pg_current_snapshot())
        ORDER BY global_sequence_number
        LIMIT $2
        """;

    private static final String DELETE_STREAM_SQL =
        "DELETE FROM foldstore_events WHERE aggregate_name = $1 AND aggregate_id = $2";

    private final Pool pool;
    private final TransientFaultHandler faultHandler;
    private final CommittedEventMatcher matcher;

    public PgEventPersistence(Pool pool) {
        this(pool, PgTransientErrorRetryStrategy.defaults());
    }

    public PgEventPersistence(Pool pool, RetryStrategy retryStrategy) {
        this(pool, retryStrategy, new CommittedEventMatcher());
    }

    public PgEventPersistence(Pool pool, RetryStrategy retryStrategy, CommittedEventMatcher matcher) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.faultHandler = new TransientFaultHandler("PostgreSQL",
            Objects.requireNonNull(retryStrategy, "Retry strategy cannot be null"));
        this.matcher = Objects.requireNonNull(matcher, "Matcher cannot be null");
    }

    @Override
    public CompletableFuture<List<CommittedEvent>> commitEvents(AggregateKey aggregateKey, List<SerializedEvent> serializedEvents) {
        try {
            EventBatches.validate(aggregateKey, serializedEvents);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return faultHandler.tryAsync("commit " + aggregateKey,
            () -> toCompletableFuture(insertBatch(aggregateKey, serializedEvents)));
    }

    private Future<List<CommittedEvent>> insertBatch(AggregateKey aggregateKey, List<SerializedEvent> serializedEvents) {
        List<Tuple> rows = new ArrayList<>(serializedEvents.size());
        for (SerializedEvent event : serializedEvents) {
            rows.add(Tuple.of(
                event.batchId(),
                aggregateKey.aggregateName(),
                aggregateKey.aggregateId().value(),
                event.aggregateSequenceNumber(),
                event.eventName(),
                event.eventVersion(),
                event.data(),
                event.serializedMetadata()));
        }

        return pool.withTransaction(connection -> connection.preparedQuery(INSERT_EVENT_SQL).executeBatch(rows))
            .map(rowSet -> toCommitted(serializedEvents, rowSet))
            .onSuccess(committed -> logger.debug("Committed {} event(s) to {} at sequence {}-{}",
                committed.size(), aggregateKey, committed.get(0).aggregateSequenceNumber(),
                committed.get(committed.size() - 1).aggregateSequenceNumber()))
            .recover(error -> isUniqueViolation(error)
                ? resolveDuplicate(aggregateKey, serializedEvents, error)
                : Future.<List<CommittedEvent>>failedFuture(error));
    }

    private static List<CommittedEvent> toCommitted(List<SerializedEvent> serializedEvents, RowSet<Row> rowSet) {
        // executeBatch chains one RowSet per statement
        List<CommittedEvent> committed = new ArrayList<>(serializedEvents.size());
        RowSet<Row> current = rowSet;
        while (current != null) {
            for (Row row : current) {
                SerializedEvent event = serializedEvents.get(committed.size());
                committed.add(CommittedEvent.from(event, row.getLong("global_sequence_number")));
            }
            current = current.next();
        }
        if (committed.size() != serializedEvents.size()) {
            throw new IllegalStateException("Expected " + serializedEvents.size()
                + " generated global sequence numbers but got " + committed.size());
        }
        return committed;
    }

    private Future<List<CommittedEvent>> resolveDuplicate(AggregateKey aggregateKey, List<SerializedEvent> serializedEvents,
                                                          Throwable violation) {
        long first = EventBatches.firstSequenceNumber(serializedEvents);
        long last = first + serializedEvents.size() - 1;
        return pool.preparedQuery(SELECT_STREAM_RANGE_SQL)
            .execute(Tuple.of(aggregateKey.aggregateName(), aggregateKey.aggregateId().value(), first, last))
            .compose(rowSet -> {
                List<CommittedEvent> stored = toEvents(rowSet);
                if (stored.size() == serializedEvents.size() && matcher.isRepeatOf(stored, serializedEvents)) {
                    logger.debug("Batch for {} from sequence {} is already committed", aggregateKey, first);
                    return Future.succeededFuture(stored);
                }
                return Future.<List<CommittedEvent>>failedFuture(new OptimisticConcurrencyException(aggregateKey, first,
                    "Sequence number " + first + " of " + aggregateKey + " is already committed", violation));
            });
    }

    static boolean isUniqueViolation(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof PgException pgException) {
                return UNIQUE_VIOLATION.equals(pgException.getSqlState());
            }
            cause = cause.getCause();
        }
        return false;
    }

    @Override
    public CompletableFuture<List<CommittedEvent>> loadCommittedEvents(AggregateKey aggregateKey, long fromSequenceNumber) {
        try {
            Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
            EventBatches.validateFromSequenceNumber(fromSequenceNumber);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return faultHandler.tryAsync("load " + aggregateKey, () -> toCompletableFuture(
            pool.preparedQuery(SELECT_STREAM_SQL)
                .execute(Tuple.of(aggregateKey.aggregateName(), aggregateKey.aggregateId().value(), fromSequenceNumber))
                .map(PgEventPersistence::toEvents)));
    }

    @Override
    public CompletableFuture<CommittedEventsPage> loadAllCommittedEvents(long fromGlobalSequenceNumber, int pageSize) {
        try {
            EventBatches.validatePageSize(pageSize);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return faultHandler.tryAsync("load all from " + fromGlobalSequenceNumber, () -> toCompletableFuture(
            pool.preparedQuery(SELECT_GLOBAL_SQL)
                .execute(Tuple.of(fromGlobalSequenceNumber, (long) pageSize))
                .map(rowSet -> {
                    List<CommittedEvent> events = toEvents(rowSet);
                    long next = events.isEmpty()
                        ? fromGlobalSequenceNumber
                        : events.get(events.size() - 1).globalSequenceNumber() + 1;
                    return new CommittedEventsPage(events, next);
                })));
    }

    @Override
    public CompletableFuture<Void> deleteEvents(AggregateKey aggregateKey) {
        Objects.requireNonNull(aggregateKey, "Aggregate key cannot be null");
        return faultHandler.tryAsync("delete " + aggregateKey, () -> toCompletableFuture(
            pool.preparedQuery(DELETE_STREAM_SQL)
                .execute(Tuple.of(aggregateKey.aggregateName(), aggregateKey.aggregateId().value()))
                .onSuccess(rowSet -> logger.info("Deleted {} event(s) of {}", rowSet.rowCount(), aggregateKey))
                .<Void>mapEmpty()));
    }

    private static List<CommittedEvent> toEvents(RowSet<Row> rowSet) {
        List<CommittedEvent> events = new ArrayList<>(rowSet.size());
        for (Row row : rowSet) {
            events.add(new CommittedEvent(
                new AggregateKey(row.getString("aggregate_name"), AggregateId.of(row.getString("aggregate_id"))),
                row.getLong("aggregate_sequence_number"),
                row.getLong("global_sequence_number"),
                row.getString("event_name"),
                row.getInteger("event_version"),
                row.getString("data"),
                row.getString("metadata"),
                row.getString("batch_id")));
        }
        return events;
    }

    static <T> CompletableFuture<T> toCompletableFuture(Future<T> future) {
        return future.toCompletionStage().toCompletableFuture();
    }

    public Pool getPool() {
        return pool;
    }
}
