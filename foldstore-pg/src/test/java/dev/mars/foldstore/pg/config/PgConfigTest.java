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
import dev.mars.foldstore.test.categories.TestCategories;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.PoolOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class PgConfigTest {

    @Test
    void testDefaults() {
        FoldStoreConfiguration configuration = new FoldStoreConfiguration("default", new Properties());

        PgConnectionConfig connection = PgConnectionConfig.from(configuration);
        assertEquals("localhost", connection.getHost());
        assertEquals(5432, connection.getPort());
        assertEquals("foldstore", connection.getDatabase());
        assertFalse(connection.isSslEnabled());

        PgPoolConfig pool = PgPoolConfig.from(configuration);
        assertEquals(16, pool.getMaxSize());
        assertFalse(pool.isShared());
    }

    @Test
    void testConnectOptionsCarrySchemaAndSsl() {
        Properties props = new Properties();
        props.setProperty("foldstore.database.host", "db.internal");
        props.setProperty("foldstore.database.port", "6432");
        props.setProperty("foldstore.database.schema", "events");
        props.setProperty("foldstore.database.ssl.enabled", "true");

        PgConnectOptions options = PgConnectionConfig.from(new FoldStoreConfiguration("default", props)).toConnectOptions();

        assertEquals("db.internal", options.getHost());
        assertEquals(6432, options.getPort());
        assertEquals(SslMode.REQUIRE, options.getSslMode());
        assertEquals("events", options.getProperties().get("search_path"));
    }

    @Test
    void testPoolOptions() {
        Properties props = new Properties();
        props.setProperty("foldstore.database.pool.max-size", "4");
        props.setProperty("foldstore.database.pool.connection-timeout", "PT2S");

        PoolOptions options = PgPoolConfig.from(new FoldStoreConfiguration("default", props)).toPoolOptions();

        assertEquals(4, options.getMaxSize());
        assertEquals(2000, options.getConnectionTimeout());
        assertEquals("foldstore-pool", options.getName());
    }

    @Test
    void testInvalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PgConnectionConfig.Builder()
            .database("d").username("u").port(0).build());
        assertThrows(NullPointerException.class, () -> new PgConnectionConfig.Builder().username("u").build());
        assertThrows(IllegalArgumentException.class, () -> new PgPoolConfig.Builder().maxSize(0).build());
    }
}
