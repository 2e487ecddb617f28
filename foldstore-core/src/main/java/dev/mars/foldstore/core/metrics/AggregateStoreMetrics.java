package dev.mars.foldstore.core.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Micrometer metrics of one aggregate store, tagged with the aggregate name.
 *
 * <p>Recording methods are no-ops until {@link #bindTo(MeterRegistry)} has been called.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class AggregateStoreMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(AggregateStoreMetrics.class);

    private final String aggregateName;
    private volatile MeterRegistry registry;

    // Counters
    private Counter commits;
    private Counter eventsCommitted;
    private Counter concurrencyConflicts;
    private Counter retries;
    private Counter idempotentSkips;
    private Counter cacheHits;
    private Counter cacheMisses;
    private Counter snapshotsWritten;
    private Counter snapshotFailures;

    // Timers
    private Timer loadTime;
    private Timer updateTime;

    public AggregateStoreMetrics(String aggregateName) {
        this.aggregateName = Objects.requireNonNull(aggregateName, "Aggregate name cannot be null");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        commits = Counter.builder("foldstore.commits")
            .description("Number of successful event batch commits")
            .tag("aggregate", aggregateName)
            .register(registry);

        eventsCommitted = Counter.builder("foldstore.events.committed")
            .description("Number of events committed")
            .tag("aggregate", aggregateName)
            .register(registry);

        concurrencyConflicts = Counter.builder("foldstore.concurrency.conflicts")
            .description("Number of commits rejected by the optimistic concurrency check")
            .tag("aggregate", aggregateName)
            .register(registry);

        retries = Counter.builder("foldstore.update.retries")
            .description("Number of update attempts repeated after a concurrency conflict")
            .tag("aggregate", aggregateName)
            .register(registry);

        idempotentSkips = Counter.builder("foldstore.update.idempotent_skips")
            .description("Number of updates skipped because their source id was already committed")
            .tag("aggregate", aggregateName)
            .register(registry);

        cacheHits = Counter.builder("foldstore.cache.hits")
            .description("Number of aggregate loads served from the event cache")
            .tag("aggregate", aggregateName)
            .register(registry);

        cacheMisses = Counter.builder("foldstore.cache.misses")
            .description("Number of aggregate loads that read storage")
            .tag("aggregate", aggregateName)
            .register(registry);

        snapshotsWritten = Counter.builder("foldstore.snapshots.written")
            .description("Number of snapshots stored")
            .tag("aggregate", aggregateName)
            .register(registry);

        snapshotFailures = Counter.builder("foldstore.snapshots.failed")
            .description("Number of snapshot writes that failed")
            .tag("aggregate", aggregateName)
            .register(registry);

        loadTime = Timer.builder("foldstore.load.time")
            .description("Time taken to load and replay an aggregate")
            .tag("aggregate", aggregateName)
            .register(registry);

        updateTime = Timer.builder("foldstore.update.time")
            .description("Time taken by an aggregate update including retries")
            .tag("aggregate", aggregateName)
            .register(registry);

        this.registry = registry;
        logger.debug("Bound metrics of aggregate store '{}'", aggregateName);
    }

    public boolean isBound() {
        return registry != null;
    }

    public void recordCommit(int events) {
        if (isBound()) {
            commits.increment();
            eventsCommitted.increment(events);
        }
    }

    public void recordConcurrencyConflict() {
        if (isBound()) {
            concurrencyConflicts.increment();
        }
    }

    public void recordRetry() {
        if (isBound()) {
            retries.increment();
        }
    }

    public void recordIdempotentSkip() {
        if (isBound()) {
            idempotentSkips.increment();
        }
    }

    public void recordCacheHit() {
        if (isBound()) {
            cacheHits.increment();
        }
    }

    public void recordCacheMiss() {
        if (isBound()) {
            cacheMisses.increment();
        }
    }

    public void recordSnapshot(boolean stored) {
        if (isBound()) {
            if (stored) {
                snapshotsWritten.increment();
            } else {
                snapshotFailures.increment();
            }
        }
    }

    public void recordLoadTime(Duration duration) {
        if (isBound()) {
            loadTime.record(duration);
        }
    }

    public void recordUpdateTime(Duration duration) {
        if (isBound()) {
            updateTime.record(duration);
        }
    }
}
