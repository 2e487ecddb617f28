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


import dev.mars.foldstore.api.EventPersistence;
import dev.mars.foldstore.api.EventSerializer;
import dev.mars.foldstore.api.SnapshotPersistence;
import dev.mars.foldstore.core.aggregate.AggregateDefinition;
import dev.mars.foldstore.core.aggregate.AggregateRoot;
import dev.mars.foldstore.core.aggregate.AggregateStore;
import dev.mars.foldstore.core.aggregate.GlobalEventReader;
import dev.mars.foldstore.core.config.FoldStoreConfiguration;
import dev.mars.foldstore.core.metrics.AggregateStoreMetrics;
import dev.mars.foldstore.core.resilience.CircuitBreakingEventPersistence;
import dev.mars.foldstore.core.snapshot.SnapshotStore;
import dev.mars.foldstore.pg.config.PgConnectionConfig;
import dev.mars.foldstore.pg.config.PgPoolConfig;
import dev.mars.foldstore.pg.setup.PgSchemaInitializer;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the Vert.x pool of a PostgreSQL backed FoldStore and hands out the persistence services
 * built on it.
 *
 * <p>The manager creates its own {@link Vertx} unless one is passed in, and closes only what it
 * created. {@link #startReactive()} creates the schema; stores built before the schema exists fail
 * on first use.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class PgFoldStoreManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgFoldStoreManager.class);

    private final FoldStoreConfiguration configuration;
    private final MeterRegistry meterRegistry;
    private final Vertx vertx;
    private final boolean vertxOwnedByManager;
    private final Pool pool;
    private final EventPersistence eventPersistence;
    private final SnapshotPersistence snapshotPersistence;
    private volatile boolean started;

    public PgFoldStoreManager(FoldStoreConfiguration configuration) {
        this(configuration, null, null);
    }

    public PgFoldStoreManager(FoldStoreConfiguration configuration, MeterRegistry meterRegistry) {
        this(configuration, meterRegistry, null);
    }

    public PgFoldStoreManager(FoldStoreConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx) {
        this(configuration, PgConnectionConfig.from(configuration), PgPoolConfig.from(configuration), meterRegistry, vertx);
    }

    public PgFoldStoreManager(FoldStoreConfiguration configuration, PgConnectionConfig connectionConfig,
                              PgPoolConfig poolConfig, MeterRegistry meterRegistry, Vertx vertx) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        Objects.requireNonNull(connectionConfig, "Connection config cannot be null");
        Objects.requireNonNull(poolConfig, "Pool config cannot be null");
        this.meterRegistry = meterRegistry;

        logger.info("Initializing FoldStore PostgreSQL manager with profile: {}", configuration.getProfile());
        if (vertx != null) {
            this.vertx = vertx;
            this.vertxOwnedByManager = false;
            logger.info("Using provided Vert.x instance (external ownership)");
        } else {
            this.vertx = Vertx.vertx();
            this.vertxOwnedByManager = true;
            logger.info("Created new Vert.x instance (manager ownership)");
        }

        this.pool = PgBuilder.pool()
            .with(poolConfig.toPoolOptions())
            .connectingTo(connectionConfig.toConnectOptions())
            .using(this.vertx)
            .build();
        logger.info("Created pool for {} with {}", connectionConfig, poolConfig);

        PgTransientErrorRetryStrategy retryStrategy = PgTransientErrorRetryStrategy.from(configuration);
        this.eventPersistence = CircuitBreakingEventPersistence.wrap(
            new PgEventPersistence(pool, retryStrategy),
            "foldstore-pg",
            configuration.getCircuitBreakerConfig(),
            meterRegistry);
        this.snapshotPersistence = new PgSnapshotPersistence(pool, retryStrategy);
    }

    /**
     * Creates the tables if needed. Completing twice is harmless.
     */
    public Future<Void> startReactive() {
        if (started) {
            logger.warn("FoldStore PostgreSQL manager is already started");
            return Future.succeededFuture();
        }
        return new PgSchemaInitializer(pool).initializeSchema()
            .onSuccess(v -> {
                started = true;
                logger.info("FoldStore PostgreSQL manager started");
            })
            .recover(error -> Future.failedFuture(
                new IllegalStateException("Failed to start FoldStore PostgreSQL manager", error)));
    }

    /**
     * Blocking variant of {@link #startReactive()}. Must not be called on an event loop thread.
     */
    public synchronized void start() {
        if (Vertx.currentContext() != null && Vertx.currentContext().isEventLoopContext()) {
            throw new IllegalStateException("Do not call blocking start() on event-loop thread - use startReactive() instead");
        }
        try {
            startReactive().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting FoldStore PostgreSQL manager", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Failed to start FoldStore PostgreSQL manager", e);
        }
    }

    /**
     * Returns a store builder already wired to this backend: event and snapshot persistence, the
     * configured snapshot strategy, and metrics bound to the manager's registry.
     */
    public <A extends AggregateRoot<A>> AggregateStore.Builder<A> aggregateStore(AggregateDefinition<A> definition,
                                                                                EventSerializer serializer) {
        AggregateStoreMetrics metrics = new AggregateStoreMetrics(definition.getName());
        if (meterRegistry != null) {
            metrics.bindTo(meterRegistry);
        }
        SnapshotStore snapshotStore = new SnapshotStore(snapshotPersistence,
            configuration.getSnapshotConfig().createStrategy(new Random()));
        return AggregateStore.builder(definition)
            .persistence(eventPersistence)
            .serializer(serializer)
            .snapshotStore(snapshotStore)
            .metrics(metrics)
            .configuration(configuration);
    }

    /**
     * Returns a global reader over this backend with the configured page size. Register the
     * aggregate definitions whose events need upgrading before reading.
     */
    public GlobalEventReader globalEventReader(EventSerializer serializer) {
        return new GlobalEventReader(eventPersistence, serializer, configuration.getAggregateStoreConfig());
    }

    public Future<Void> closeReactive() {
        logger.info("Closing FoldStore PostgreSQL manager");
        started = false;
        return pool.close()
            .onSuccess(v -> logger.info("Pool closed"))
            .onFailure(e -> logger.warn("Error closing pool: {}", e.getMessage()))
            .recover(e -> Future.succeededFuture())
            .compose(v -> {
                if (!vertxOwnedByManager) {
                    logger.info("Skipping Vert.x close (external ownership)");
                    return Future.succeededFuture();
                }
                return vertx.close()
                    .onSuccess(v2 -> logger.info("Vert.x instance closed"));
            });
    }

    @Override
    public void close() {
        if (Vertx.currentContext() != null && Vertx.currentContext().isEventLoopContext()) {
            logger.warn("Blocking close() called on event loop thread, closing asynchronously");
            closeReactive();
            return;
        }
        try {
            closeReactive().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing FoldStore PostgreSQL manager");
        } catch (ExecutionException | TimeoutException e) {
            logger.error("Error during synchronous close", e);
        }
    }

    public boolean isStarted() {
        return started;
    }

    public FoldStoreConfiguration getConfiguration() { return configuration; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public Vertx getVertx() { return vertx; }
    public Pool getPool() { return pool; }
    public EventPersistence getEventPersistence() { return eventPersistence; }
    public SnapshotPersistence getSnapshotPersistence() { return snapshotPersistence; }
}
