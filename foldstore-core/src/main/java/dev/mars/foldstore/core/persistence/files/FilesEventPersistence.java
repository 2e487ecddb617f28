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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.CommittedEvent;
import dev.mars.foldstore.api.CommittedEventsPage;
import dev.mars.foldstore.api.EventPersistence;
import dev.mars.foldstore.api.SerializedEvent;
import dev.mars.foldstore.api.error.EventPersistenceException;
import dev.mars.foldstore.api.error.OptimisticConcurrencyException;
import dev.mars.foldstore.api.retry.RetryStrategy;
import dev.mars.foldstore.core.config.FoldStoreConfiguration;
import dev.mars.foldstore.core.persistence.CommittedEventMatcher;
import dev.mars.foldstore.core.persistence.EventBatches;
import dev.mars.foldstore.core.retry.TransientFaultHandler;
import dev.mars.foldstore.core.serialization.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Append-only file backend: one JSON file per event under
 * {@code <root>/<aggregate name>/<aggregate id>/<sequence>.json} plus a global {@code log.json}
 * index from global sequence number to event file.
 *
 * <p>Event files are created with {@link StandardOpenOption#CREATE_NEW}, so an existing file is
 * the uniqueness violation. All file I/O runs on one dedicated thread, which also orders global
 * sequence numbers; {@link IOException}s are retried through a {@link TransientFaultHandler}. A
 * batch that fails part way is rolled back before the error is reported.</p>
 *
 * <p>On startup the global log is checked against the event files on disk and rebuilt from them
 * when it is missing, unreadable or inconsistent.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class FilesEventPersistence implements EventPersistence, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FilesEventPersistence.class);

    static final String LOG_FILE_NAME = "log.json";

    /** Persistent form of the global log. */
    record GlobalLog(long globalSequenceNumber, Map<Long, String> log) {
    }

    @FunctionalInterface
    private interface IoWork<T> {
        T run() throws IOException;
    }

    private final FilesEventLocator locator;
    private final ObjectMapper objectMapper;
    private final CommittedEventMatcher matcher;
    private final TransientFaultHandler faultHandler;
    private final ExecutorService ioExecutor;
    private final Path logFile;

    // Only accessed on the I/O thread after construction
    private final TreeMap<Long, String> eventLog = new TreeMap<>();
    private long globalSequenceNumber;

    public FilesEventPersistence(Path storePath) {
        this(storePath, IoRetryStrategy.defaults());
    }

    /**
     * Opens the store at the configured path with the configured I/O retry policy.
     */
    public FilesEventPersistence(FoldStoreConfiguration.FilesConfig config) {
        this(config.getStorePath(), config.createRetryStrategy());
    }

    public FilesEventPersistence(Path storePath, RetryStrategy retryStrategy) {
        Objects.requireNonNull(storePath, "Store path cannot be null");
        this.locator = new FilesEventLocator(storePath);
        this.objectMapper = ObjectMappers.createDefaultObjectMapper();
        this.matcher = new CommittedEventMatcher(objectMapper);
        this.faultHandler = new TransientFaultHandler("Files", retryStrategy);
        this.logFile = storePath.resolve(LOG_FILE_NAME);
        this.ioExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "foldstore-files-io");
            t.setDaemon(true);
            return t;
        });

        try {
            Files.createDirectories(storePath);
            loadOrRebuildLog();
        } catch (IOException e) {
            ioExecutor.shutdownNow();
            throw new EventPersistenceException("Failed to open file event store at " + storePath, e);
        }
        logger.info("Opened file event store at {} (global sequence {}, {} events)", storePath,
            globalSequenceNumber, eventLog.size());
    }

    @Override
    public CompletableFuture<List<CommittedEvent>> commitEvents(AggregateKey aggregateKey, List<SerializedEvent> serializedEvents) {
        try {
            EventBatches.validate(aggregateKey, serializedEvents);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return io("commitEvents", () -> commit(aggregateKey, serializedEvents));
    }

    @Override
    public CompletableFuture<List<CommittedEvent>> loadCommittedEvents(AggregateKey aggregateKey, long fromSequenceNumber) {
        try {
            EventBatches.validateFromSequenceNumber(fromSequenceNumber);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return io("loadCommittedEvents", () -> readStream(aggregateKey, fromSequenceNumber));
    }

    @Override
    public CompletableFuture<CommittedEventsPage> loadAllCommittedEvents(long fromGlobalSequenceNumber, int pageSize) {
        try {
            EventBatches.validatePageSize(pageSize);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return io("loadAllCommittedEvents", () -> readGlobalPage(fromGlobalSequenceNumber, pageSize));
    }

    @Override
    public CompletableFuture<Void> deleteEvents(AggregateKey aggregateKey) {
        return io("deleteEvents", () -> {
            deleteStream(aggregateKey);
            return null;
        });
    }

    private <T> CompletableFuture<T> io(String operation, IoWork<T> work) {
        return faultHandler.tryAsync(operation, () -> CompletableFuture.supplyAsync(() -> {
            try {
                return work.run();
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, ioExecutor));
    }

    private List<CommittedEvent> commit(AggregateKey key, List<SerializedEvent> events) throws IOException {
        long firstSequenceNumber = EventBatches.firstSequenceNumber(events);

        List<CommittedEvent> existing = new ArrayList<>();
        for (SerializedEvent event : events) {
            Path eventPath = locator.getEventPath(key, event.aggregateSequenceNumber());
            if (Files.exists(eventPath)) {
                existing.add(readEvent(eventPath));
            }
        }
        if (!existing.isEmpty()) {
            if (matcher.isRepeatOf(existing, events)) {
                logger.debug("Batch for {} from sequence {} is already committed", key, firstSequenceNumber);
                return existing;
            }
            throw new OptimisticConcurrencyException(key, firstSequenceNumber,
                "Event " + existing.get(0).aggregateSequenceNumber() + " already exists for " + key);
        }
        if (firstSequenceNumber > 1 && !Files.exists(locator.getEventPath(key, firstSequenceNumber - 1))) {
            throw new OptimisticConcurrencyException(key, firstSequenceNumber,
                "Stream " + key + " has no event " + (firstSequenceNumber - 1) + ", cannot append at " + firstSequenceNumber);
        }

        Files.createDirectories(locator.getStreamPath(key));
        List<Path> written = new ArrayList<>(events.size());
        List<CommittedEvent> committed = new ArrayList<>(events.size());
        long nextGlobal = globalSequenceNumber;
        try {
            for (SerializedEvent event : events) {
                CommittedEvent committedEvent = CommittedEvent.from(event, ++nextGlobal);
                Path eventPath = locator.getEventPath(key, event.aggregateSequenceNumber());
                logger.trace("Writing file '{}'", eventPath);
                Files.write(eventPath, objectMapper.writeValueAsBytes(FileEventRecord.from(committedEvent)),
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                written.add(eventPath);
                committed.add(committedEvent);
                eventLog.put(committedEvent.globalSequenceNumber(), relativePath(eventPath));
            }
            writeLog(nextGlobal);
            globalSequenceNumber = nextGlobal;
        } catch (FileAlreadyExistsException e) {
            rollback(written, committed, e);
            throw new OptimisticConcurrencyException(key, firstSequenceNumber,
                "Event file " + e.getFile() + " already exists", e);
        } catch (IOException | RuntimeException e) {
            rollback(written, committed, e);
            throw e;
        }
        logger.debug("Committed {} event(s) to {} at sequence {}-{}", committed.size(), key,
            firstSequenceNumber, firstSequenceNumber + committed.size() - 1);
        return committed;
    }

    private void rollback(List<Path> written, List<CommittedEvent> committed, Exception cause) {
        committed.forEach(event -> eventLog.remove(event.globalSequenceNumber()));
        for (Path path : written) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                logger.error("Failed to roll back event file {}", path, e);
                cause.addSuppressed(e);
            }
        }
    }

    private List<CommittedEvent> readStream(AggregateKey key, long fromSequenceNumber) throws IOException {
        Path streamPath = locator.getStreamPath(key);
        if (!Files.isDirectory(streamPath)) {
            return List.of();
        }
        List<Long> sequenceNumbers = new ArrayList<>();
        try (Stream<Path> files = Files.list(streamPath)) {
            files.forEach(file -> {
                OptionalLong sequence = FilesEventLocator.sequenceNumberOf(file);
                if (sequence.isPresent() && sequence.getAsLong() >= fromSequenceNumber) {
                    sequenceNumbers.add(sequence.getAsLong());
                }
            });
        }
        sequenceNumbers.sort(Comparator.naturalOrder());
        List<CommittedEvent> events = new ArrayList<>(sequenceNumbers.size());
        for (long sequence : sequenceNumbers) {
            events.add(readEvent(locator.getEventPath(key, sequence)));
        }
        return events;
    }

    private CommittedEventsPage readGlobalPage(long fromGlobalSequenceNumber, int pageSize) throws IOException {
        List<CommittedEvent> events = new ArrayList<>(pageSize);
        for (Map.Entry<Long, String> entry : eventLog.tailMap(fromGlobalSequenceNumber, true).entrySet()) {
            if (events.size() == pageSize) {
                break;
            }
            Path eventPath = locator.getRoot().resolve(entry.getValue());
            if (Files.exists(eventPath)) {
                events.add(readEvent(eventPath));
            } else {
                logger.warn("Global log entry {} points to missing file {}", entry.getKey(), eventPath);
            }
        }
        long next = events.isEmpty()
            ? fromGlobalSequenceNumber
            : events.get(events.size() - 1).globalSequenceNumber() + 1;
        return new CommittedEventsPage(events, next);
    }

    private void deleteStream(AggregateKey key) throws IOException {
        Path streamPath = locator.getStreamPath(key);
        if (!Files.exists(streamPath)) {
            return;
        }
        String prefix = relativePath(streamPath) + "/";
        eventLog.values().removeIf(path -> path.startsWith(prefix));
        writeLog(globalSequenceNumber);
        try (Stream<Path> paths = Files.walk(streamPath)) {
            List<Path> toDelete = paths.sorted(Comparator.reverseOrder()).toList();
            for (Path path : toDelete) {
                Files.deleteIfExists(path);
            }
        }
        logger.info("Deleted event files of {}", key);
    }

    private CommittedEvent readEvent(Path eventPath) throws IOException {
        return objectMapper.readValue(eventPath.toFile(), FileEventRecord.class).toCommittedEvent();
    }

    private void writeLog(long sequenceNumber) throws IOException {
        Path temp = logFile.resolveSibling(LOG_FILE_NAME + ".tmp");
        Files.write(temp, objectMapper.writeValueAsBytes(new GlobalLog(sequenceNumber, eventLog)));
        try {
            Files.move(temp, logFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, logFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void loadOrRebuildLog() throws IOException {
        Set<String> onDisk = scanEventFiles();
        long loggedSequence = 0;

        if (Files.exists(logFile)) {
            try {
                GlobalLog stored = objectMapper.readValue(logFile.toFile(), GlobalLog.class);
                loggedSequence = stored.globalSequenceNumber();
                Map<Long, String> log = stored.log() != null ? stored.log() : Map.of();
                if (new HashSet<>(log.values()).equals(onDisk) && log.size() == onDisk.size()
                        && log.keySet().stream().allMatch(global -> global <= stored.globalSequenceNumber())) {
                    eventLog.putAll(log);
                    globalSequenceNumber = stored.globalSequenceNumber();
                    return;
                }
                logger.warn("Global log {} does not match the event files on disk, rebuilding it", logFile);
            } catch (IOException e) {
                logger.warn("Global log {} is unreadable, rebuilding it: {}", logFile, e.getMessage());
            }
        } else if (!onDisk.isEmpty()) {
            logger.warn("Global log {} is missing, rebuilding it from {} event files", logFile, onDisk.size());
        }

        long maxGlobal = loggedSequence;
        for (String relative : onDisk) {
            CommittedEvent event = readEvent(locator.getRoot().resolve(relative));
            if (eventLog.put(event.globalSequenceNumber(), relative) != null) {
                throw EventPersistenceException.corrupt("Two event files claim global sequence number "
                    + event.globalSequenceNumber() + " in " + locator.getRoot());
            }
            maxGlobal = Math.max(maxGlobal, event.globalSequenceNumber());
        }
        globalSequenceNumber = maxGlobal;
        writeLog(globalSequenceNumber);
    }

    private Set<String> scanEventFiles() throws IOException {
        Path root = locator.getRoot();
        try (Stream<Path> paths = Files.walk(root, 3)) {
            Set<String> result = new HashSet<>();
            paths.filter(path -> root.relativize(path).getNameCount() == 3)
                .filter(Files::isRegularFile)
                .filter(path -> FilesEventLocator.sequenceNumberOf(path).isPresent())
                .forEach(path -> result.add(relativePath(path)));
            return result;
        }
    }

    private String relativePath(Path path) {
        return locator.getRoot().relativize(path).toString().replace(File.separatorChar, '/');
    }

    public Path getStorePath() {
        return locator.getRoot();
    }

    @Override
    public void close() {
        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("File I/O executor did not terminate in time");
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ioExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Closed file event store at {}", locator.getRoot());
    }
}
