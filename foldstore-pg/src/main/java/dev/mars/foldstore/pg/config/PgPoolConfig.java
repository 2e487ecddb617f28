package dev.mars.foldstore.pg.config;

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

import dev.mars.foldstore.core.config.FoldStoreConfiguration;
import io.vertx.sqlclient.PoolOptions;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Reactive pool settings of the PostgreSQL backend, mapped onto Vert.x {@link PoolOptions}.
 */
public final class PgPoolConfig {
    private final int maxSize;
    private final int maxWaitQueueSize;
    private final Duration connectionTimeout;
    private final Duration idleTimeout;
    private final boolean shared;

    private PgPoolConfig(Builder builder) {
        if (builder.maxSize < 1) {
            throw new IllegalArgumentException("Pool max size must be at least 1, was " + builder.maxSize);
        }
        this.maxSize = builder.maxSize;
        this.maxWaitQueueSize = builder.maxWaitQueueSize;
        this.connectionTimeout = builder.connectionTimeout;
        this.idleTimeout = builder.idleTimeout;
        this.shared = builder.shared;
    }

    /**
     * Reads the {@code foldstore.database.pool.*} keys.
     */
    public static PgPoolConfig from(FoldStoreConfiguration configuration) {
        return new Builder()
            .maxSize(configuration.getInt("foldstore.database.pool.max-size", 16))
            .maxWaitQueueSize(configuration.getInt("foldstore.database.pool.max-wait-queue-size", 128))
            .connectionTimeout(configuration.getDuration("foldstore.database.pool.connection-timeout", Duration.ofSeconds(30)))
            .idleTimeout(configuration.getDuration("foldstore.database.pool.idle-timeout", Duration.ofMinutes(10)))
            .shared(configuration.getBoolean("foldstore.database.pool.shared", false))
            .build();
    }

    public int getMaxSize() {
        return maxSize;
    }

    /** Requests allowed to wait for a connection, -1 for unbounded */
    public int getMaxWaitQueueSize() {
        return maxWaitQueueSize;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public boolean isShared() {
        return shared;
    }

    public PoolOptions toPoolOptions() {
        return new PoolOptions()
            .setMaxSize(maxSize)
            .setMaxWaitQueueSize(maxWaitQueueSize)
            .setConnectionTimeout((int) connectionTimeout.toMillis())
            .setConnectionTimeoutUnit(TimeUnit.MILLISECONDS)
            .setIdleTimeout((int) idleTimeout.toMillis())
            .setIdleTimeoutUnit(TimeUnit.MILLISECONDS)
            .setShared(shared)
            .setName("foldstore-pool");
    }

    @Override
    public String toString() {
        return "PgPoolConfig{" +
            "maxSize=" + maxSize +
            ", maxWaitQueueSize=" + maxWaitQueueSize +
            ", connectionTimeout=" + connectionTimeout +
            ", idleTimeout=" + idleTimeout +
            ", shared=" + shared +
            '}';
    }

    public static final class Builder {
        private int maxSize = 16;
        private int maxWaitQueueSize = 128;
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofMinutes(10);
        private boolean shared = false;

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder maxWaitQueueSize(int maxWaitQueueSize) {
            this.maxWaitQueueSize = maxWaitQueueSize;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = Objects.requireNonNull(connectionTimeout, "Connection timeout cannot be null");
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = Objects.requireNonNull(idleTimeout, "Idle timeout cannot be null");
            return this;
        }

        public Builder shared(boolean shared) {
            this.shared = shared;
            return this;
        }

        public PgPoolConfig build() {
            return new PgPoolConfig(this);
        }
    }
}
