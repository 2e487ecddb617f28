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

import dev.mars.foldstore.core.config.FoldStoreConfiguration;
import dev.mars.foldstore.core.retry.BackoffRetryStrategy;
import io.vertx.pgclient.PgException;
import io.vertx.sqlclient.ClosedConnectionException;

import java.net.ConnectException;
import java.time.Duration;
import java.util.Set;

/**
 * Retries PostgreSQL failures that a later attempt can get past: serialization failures,
 * deadlocks, lock timeouts, administrator shutdowns and lost connections (SQLSTATE class 08).
 */
public class PgTransientErrorRetryStrategy extends BackoffRetryStrategy {

    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "40001", // serialization_failure
        "40P01", // deadlock_detected
        "55P03", // lock_not_available
        "57P01"  // admin_shutdown
    );

    public PgTransientErrorRetryStrategy(int maxRetries, Duration initialDelay, Duration maxDelay) {
        super(maxRetries, initialDelay, 2.0, maxDelay);
    }

    public static PgTransientErrorRetryStrategy defaults() {
        return new PgTransientErrorRetryStrategy(3, Duration.ofMillis(50), Duration.ofSeconds(1));
    }

    /**
     * Reads the {@code foldstore.database.retry.*} keys.
     */
    public static PgTransientErrorRetryStrategy from(FoldStoreConfiguration configuration) {
        return new PgTransientErrorRetryStrategy(
            configuration.getInt("foldstore.database.retry.max-retries", 3),
            configuration.getDuration("foldstore.database.retry.initial-delay", Duration.ofMillis(50)),
            configuration.getDuration("foldstore.database.retry.max-delay", Duration.ofSeconds(1)));
    }

    @Override
    protected boolean isRetryable(Throwable failure) {
        Throwable cause = failure;
        while (cause != null) {
            if (cause instanceof PgException pgException) {
                return isTransientSqlState(pgException.getSqlState());
            }
            if (cause instanceof ClosedConnectionException || cause instanceof ConnectException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    static boolean isTransientSqlState(String sqlState) {
        return sqlState != null && (TRANSIENT_SQL_STATES.contains(sqlState) || sqlState.startsWith("08"));
    }
}
