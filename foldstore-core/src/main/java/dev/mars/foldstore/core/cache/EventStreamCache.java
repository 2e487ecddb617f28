package dev.mars.foldstore.core.cache;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Short lived cache of loaded event streams, keyed by aggregate.
 *
 * <p>A load takes a {@link #ticket(AggregateKey)} before reading storage and hands it back to
 * {@link #put}. Every {@link #invalidate(AggregateKey)} stamps the key with a newer generation, so
 * a put whose ticket predates the invalidation is discarded and a writer's invalidate can never be
 * undone by a slower concurrent reader.</p>
 *
 * <p>Evicted keys raise a shared floor generation instead of keeping their stamp, which may turn
 * a few puts into misses but never lets stale data in.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class EventStreamCache {
    private static final Logger logger = LoggerFactory.getLogger(EventStreamCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final boolean enabled;
    private final Clock clock;
    private final Duration ttl;
    private final int maxEntries;
    private final ConcurrentHashMap<AggregateKey, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong evictedFloor = new AtomicLong();

    /** Generation stamp plus the cached stream, null for an invalidated key. */
    private record Slot(long generation, CachedEventStream stream, Instant expiresAt) {
    }

    public EventStreamCache(Clock clock, Duration ttl, int maxEntries) {
        this(true, clock, ttl, maxEntries);
    }

    private EventStreamCache(boolean enabled, Clock clock, Duration ttl, int maxEntries) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.ttl = Objects.requireNonNull(ttl, "TTL cannot be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache max entries must be at least 1");
        }
        this.enabled = enabled;
        this.maxEntries = maxEntries;
    }

    public static EventStreamCache withDefaults() {
        return new EventStreamCache(Clock.systemUTC(), DEFAULT_TTL, DEFAULT_MAX_ENTRIES);
    }

    public static EventStreamCache disabled() {
        return new EventStreamCache(false, Clock.systemUTC(), DEFAULT_TTL, 1);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Returns the generation to pass to {@link #put} for a load that starts now.
     */
    public long ticket(AggregateKey key) {
        Objects.requireNonNull(key, "Aggregate key cannot be null");
        return generation.get();
    }

    public Optional<CachedEventStream> get(AggregateKey key) {
        if (!enabled) {
            return Optional.empty();
        }
        Slot slot = slots.get(key);
        if (slot == null || slot.stream() == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(slot.expiresAt())) {
            logger.debug("Cached stream of {} expired", key);
            return Optional.empty();
        }
        return Optional.of(slot.stream());
    }

    /**
     * Caches a stream unless the key was invalidated after {@code ticket} was taken.
     *
     * @return true if the stream was cached
     */
    public boolean put(AggregateKey key, long ticket, CachedEventStream stream) {
        Objects.requireNonNull(key, "Aggregate key cannot be null");
        Objects.requireNonNull(stream, "Stream cannot be null");
        if (!enabled) {
            return false;
        }
        Instant expiresAt = clock.instant().plus(ttl);
        boolean[] stored = new boolean[1];
        slots.compute(key, (k, existing) -> {
            long stamp = existing != null ? existing.generation() : evictedFloor.get();
            if (stamp > ticket) {
                return existing;
            }
            stored[0] = true;
            return new Slot(stamp, stream, expiresAt);
        });
        if (!stored[0]) {
            logger.debug("Discarded stale cache put for {} (ticket {})", key, ticket);
        } else if (slots.size() > maxEntries) {
            evict();
        }
        return stored[0];
    }

    public void invalidate(AggregateKey key) {
        Objects.requireNonNull(key, "Aggregate key cannot be null");
        slots.compute(key, (k, existing) -> new Slot(generation.incrementAndGet(), null, Instant.MIN));
    }

    public void clear() {
        long stamp = generation.incrementAndGet();
        raiseFloor(stamp);
        slots.clear();
    }

    public int size() {
        return (int) slots.values().stream().filter(slot -> slot.stream() != null).count();
    }

    private void evict() {
        Instant now = clock.instant();
        for (Map.Entry<AggregateKey, Slot> entry : slots.entrySet()) {
            Slot slot = entry.getValue();
            if (slot.stream() == null || !now.isBefore(slot.expiresAt())) {
                removeSlot(entry.getKey(), slot);
            }
        }
        while (slots.size() > maxEntries) {
            Optional<Map.Entry<AggregateKey, Slot>> oldest = slots.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().expiresAt()));
            if (oldest.isEmpty()) {
                break;
            }
            removeSlot(oldest.get().getKey(), oldest.get().getValue());
        }
    }

    private void removeSlot(AggregateKey key, Slot slot) {
        raiseFloor(slot.generation());
        slots.remove(key, slot);
    }

    private void raiseFloor(long stamp) {
        evictedFloor.accumulateAndGet(stamp, Math::max);
    }

    @Override
    public String toString() {
        return "EventStreamCache{enabled=" + enabled + ", ttl=" + ttl + ", maxEntries=" + maxEntries
            + ", size=" + slots.size() + '}';
    }
}
