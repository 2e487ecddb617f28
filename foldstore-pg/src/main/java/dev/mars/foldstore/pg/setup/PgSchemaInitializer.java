package dev.mars.foldstore.pg.setup;

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

import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates the FoldStore tables if they do not exist yet. Safe to run on every start.
 */
public class PgSchemaInitializer {
    private static final Logger logger = LoggerFactory.getLogger(PgSchemaInitializer.class);

    public static final String SCHEMA_RESOURCE = "/db/foldstore-schema.sql";

    private final Pool pool;

    public PgSchemaInitializer(Pool pool) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
    }

    public Future<Void> initializeSchema() {
        List<String> statements;
        try {
            statements = parseSqlStatements(loadSchemaScript());
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        logger.info("Initializing FoldStore schema ({} statements)", statements.size());
        return pool.withTransaction(conn -> {
                Future<Void> chain = Future.succeededFuture();
                for (String statement : statements) {
                    chain = chain.compose(v -> {
                        logger.trace("Executing: {}", statement.substring(0, Math.min(60, statement.length())));
                        return conn.query(statement).execute().<Void>mapEmpty();
                    });
                }
                return chain;
            })
            .onSuccess(v -> logger.info("FoldStore schema initialized"))
            .onFailure(error -> logger.error("Failed to initialize FoldStore schema", error));
    }

    private String loadSchemaScript() {
        try (InputStream is = getClass().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Schema script not found: " + SCHEMA_RESOURCE);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema script " + SCHEMA_RESOURCE, e);
        }
    }

    /**
     * Splits a script on semicolons, dropping comment lines. The schema script uses no
     * dollar-quoted bodies.
     */
    static List<String> parseSqlStatements(String content) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : content.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("--")) {
                continue;
            }
            current.append(line).append('\n');
            if (trimmed.endsWith(";")) {
                String statement = current.toString().trim();
                statements.add(statement.substring(0, statement.length() - 1));
                current.setLength(0);
            }
        }
        if (!current.toString().isBlank()) {
            statements.add(current.toString().trim());
        }
        return statements;
    }
}
