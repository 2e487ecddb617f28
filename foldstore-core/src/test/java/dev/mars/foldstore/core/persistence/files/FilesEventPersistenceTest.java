package dev.mars.foldstore.core.persistence.files;

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
import dev.mars.foldstore.api.CommittedEvent;
import dev.mars.foldstore.api.EventPersistence;
import dev.mars.foldstore.api.error.EventPersistenceException;
import dev.mars.foldstore.api.error.OptimisticConcurrencyException;
import dev.mars.foldstore.core.config.FoldStoreConfiguration;
import dev.mars.foldstore.core.persistence.EventPersistenceContractTest;
import dev.mars.foldstore.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the backend contract against the file store, plus its on-disk layout and log recovery.
 */
@Tag(TestCategories.INTEGRATION)
class FilesEventPersistenceTest extends EventPersistenceContractTest {

    @TempDir
    Path storePath;

    private final List<FilesEventPersistence> opened = new ArrayList<>();

    @Override
    protected EventPersistence createPersistence() {
        return open();
    }

    private FilesEventPersistence open() {
        FilesEventPersistence files = new FilesEventPersistence(storePath,
            new IoRetryStrategy(2, Duration.ofMillis(1), Duration.ofMillis(5)));
        opened.add(files);
        return files;
    }

    @AfterEach
    void closeStores() {
        opened.forEach(FilesEventPersistence::close);
    }

    @Test
    void testStoreOpensAtConfiguredPath() {
        Path configuredPath = storePath.resolve("configured");
        Properties props = new Properties();
        props.setProperty("foldstore.files.store-path", configuredPath.toString());
        props.setProperty("foldstore.files.retry.max-retries", "1");
        FoldStoreConfiguration configuration = new FoldStoreConfiguration("default", props);

        FilesEventPersistence configured = new FilesEventPersistence(configuration.getFilesConfig());
        opened.add(configured);
        AggregateKey key = newKey();
        configured.commitEvents(key, batch(key, 1, "A")).join();

        assertTrue(Files.isRegularFile(new FilesEventLocator(configuredPath).getEventPath(key, 1)));
        assertEquals(1, configured.loadCommittedEvents(key, 1).join().size());
    }

    @Test
    void testEventsAreStoredOneFilePerSequenceNumber() {
        AggregateKey key = newKey();
        persistence.commitEvents(key, batch(key, 1, "A", "B")).join();

        FilesEventLocator locator = new FilesEventLocator(storePath);
        assertTrue(Files.isRegularFile(locator.getEventPath(key, 1)));
        assertTrue(Files.isRegularFile(locator.getEventPath(key, 2)));
        assertTrue(Files.isRegularFile(storePath.resolve(FilesEventPersistence.LOG_FILE_NAME)));
    }

    @Test
    void testAppendingPastTheEndOfTheStreamIsConcurrencyConflict() {
        AggregateKey key = newKey();
        persistence.commitEvents(key, batch(key, 1, "A")).join();

        assertInstanceOf(OptimisticConcurrencyException.class,
            failureOf(() -> persistence.commitEvents(key, batch(key, 3, "C"))));
        assertFalse(Files.exists(new FilesEventLocator(storePath).getEventPath(key, 3)));
    }

    @Test
    void testEventsSurviveReopening() {
        AggregateKey key = newKey();
        List<CommittedEvent> committed = persistence.commitEvents(key, batch(key, 1, "A", "B")).join();
        ((FilesEventPersistence) persistence).close();

        FilesEventPersistence reopened = open();
        assertEquals(committed, reopened.loadCommittedEvents(key, 1).join());
        List<CommittedEvent> next = reopened.commitEvents(key, batch(key, 3, "C")).join();
        assertTrue(next.get(0).globalSequenceNumber() > committed.get(1).globalSequenceNumber());
    }

    @Test
    void testMissingGlobalLogIsRebuiltFromEventFiles() throws IOException {
        AggregateKey first = newKey();
        AggregateKey second = newKey();
        persistence.commitEvents(first, batch(first, 1, "A")).join();
        persistence.commitEvents(second, batch(second, 1, "B", "C")).join();
        ((FilesEventPersistence) persistence).close();
        Files.delete(storePath.resolve(FilesEventPersistence.LOG_FILE_NAME));

        FilesEventPersistence reopened = open();
        List<CommittedEvent> all = reopened.loadAllCommittedEvents(0, 10).join().events();
        assertEquals(List.of(1L, 2L, 3L), all.stream().map(CommittedEvent::globalSequenceNumber).collect(Collectors.toList()));
        assertTrue(Files.isRegularFile(storePath.resolve(FilesEventPersistence.LOG_FILE_NAME)));
    }

    @Test
    void testCorruptGlobalLogIsRebuilt() throws IOException {
        AggregateKey key = newKey();
        persistence.commitEvents(key, batch(key, 1, "A", "B")).join();
        ((FilesEventPersistence) persistence).close();
        Files.write(storePath.resolve(FilesEventPersistence.LOG_FILE_NAME), "{not json".getBytes(StandardCharsets.UTF_8));

        FilesEventPersistence reopened = open();
        assertEquals(2, reopened.loadAllCommittedEvents(0, 10).join().events().size());
        assertEquals(3, reopened.commitEvents(key, batch(key, 3, "C")).join().get(0).globalSequenceNumber());
    }

    @Test
    void testCorruptEventFileFailsTheLoad() throws IOException {
        AggregateKey key = newKey();
        persistence.commitEvents(key, batch(key, 1, "A")).join();
        Files.write(new FilesEventLocator(storePath).getEventPath(key, 1), "garbage".getBytes(StandardCharsets.UTF_8));

        Throwable failure = failureOf(() -> persistence.loadCommittedEvents(key, 1));
        assertInstanceOf(EventPersistenceException.class, failure);
    }
}
