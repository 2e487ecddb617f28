package dev.mars.foldstore.core.aggregate;

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
import dev.mars.foldstore.api.EventDefinition;
import dev.mars.foldstore.api.Metadata;
import dev.mars.foldstore.api.MetadataKeys;
import dev.mars.foldstore.api.MetadataProvider;
import dev.mars.foldstore.api.SourceId;
import dev.mars.foldstore.api.error.FoldStoreErrorCodes;
import dev.mars.foldstore.api.error.MetadataConfigurationException;
import dev.mars.foldstore.core.metadata.CorrelationMetadataProvider;
import dev.mars.foldstore.core.metadata.EventTypeMetadataProvider;
import dev.mars.foldstore.core.metadata.HostNameMetadataProvider;
import dev.mars.foldstore.core.testdomain.OrderEvent;
import dev.mars.foldstore.core.testdomain.OrderFixtures;
import dev.mars.foldstore.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class MetadataAssemblerTest {

    private static final AggregateKey KEY = OrderFixtures.key("order-1");
    private static final EventDefinition ITEM_ADDED = new EventDefinition("item-added", 2, OrderEvent.ItemAdded.class);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-11-03T10:15:30Z"), ZoneOffset.UTC);

    private static UncommittedEvent event(Metadata metadata) {
        return new UncommittedEvent(new OrderEvent.ItemAdded("X"), metadata, 7);
    }

    @Test
    void testReservedKeysAreWrittenAfterCallerAndProviders() {
        MetadataAssembler assembler = new MetadataAssembler(List.of(new HostNameMetadataProvider("build-agent")), CLOCK);

        Metadata metadata = assembler.assemble(KEY, event(Metadata.of("user", "alice")), ITEM_ADDED,
            SourceId.of("command-1"), "batch-1");

        List<String> keys = new ArrayList<>(metadata.asMap().keySet());
        assertEquals("user", keys.get(0));
        assertEquals(HostNameMetadataProvider.HOST_NAME, keys.get(1));
        assertEquals("build-agent", metadata.get(HostNameMetadataProvider.HOST_NAME).orElseThrow());
        assertEquals("2025-11-03T10:15:30Z", metadata.get(MetadataKeys.TIMESTAMP).orElseThrow());
        assertEquals(Long.toString(CLOCK.instant().getEpochSecond()), metadata.get(MetadataKeys.TIMESTAMP_EPOCH).orElseThrow());
        assertEquals("batch-1", metadata.batchId().orElseThrow());
        assertEquals(7L, metadata.aggregateSequenceNumber().orElseThrow());
        assertTrue(metadata.asMap().keySet().containsAll(MetadataKeys.RESERVED));
    }

    @Test
    void testEventIdIsStablePerStreamPosition() {
        MetadataAssembler assembler = new MetadataAssembler(List.of(), CLOCK);
        Metadata first = assembler.assemble(KEY, event(Metadata.empty()), ITEM_ADDED, SourceId.of("a"), "batch-1");
        Metadata second = assembler.assemble(KEY, event(Metadata.empty()), ITEM_ADDED, SourceId.of("b"), "batch-2");

        assertEquals(first.eventId(), second.eventId());
        assertNotEquals(MetadataAssembler.eventId(KEY, 7), MetadataAssembler.eventId(KEY, 8));
    }

    @Test
    void testEventIdSeparatesNamesAndIdsContainingDashes() {
        AggregateKey dashedName = new AggregateKey("a-b", AggregateId.of("c"));
        AggregateKey dashedId = new AggregateKey("a", AggregateId.of("b-c"));

        assertNotEquals(MetadataAssembler.eventId(dashedName, 1), MetadataAssembler.eventId(dashedId, 1));
        assertNotEquals(MetadataAssembler.eventId(new AggregateKey("a", AggregateId.of("1-2")), 3),
            MetadataAssembler.eventId(new AggregateKey("a", AggregateId.of("1")), 23));
    }

    @Test
    void testCallerCannotSetReservedKey() {
        MetadataAssembler assembler = new MetadataAssembler(List.of(), CLOCK);
        MetadataConfigurationException ex = assertThrows(MetadataConfigurationException.class,
            () -> assembler.assemble(KEY, event(Metadata.of(MetadataKeys.TIMESTAMP, "yesterday")), ITEM_ADDED,
                SourceId.of("a"), "batch-1"));
        assertEquals(FoldStoreErrorCodes.METADATA_RESERVED_KEY, ex.getErrorCode());
        assertEquals(MetadataKeys.TIMESTAMP, ex.getKey());
    }

    @Test
    void testProviderCannotWriteReservedKey() {
        MetadataProvider rogue = (key, event, metadata) -> Map.of(MetadataKeys.SOURCE_ID, "spoofed");
        MetadataAssembler assembler = new MetadataAssembler(List.of(rogue), CLOCK);

        MetadataConfigurationException ex = assertThrows(MetadataConfigurationException.class,
            () -> assembler.assemble(KEY, event(Metadata.empty()), ITEM_ADDED, SourceId.of("a"), "batch-1"));
        assertEquals(FoldStoreErrorCodes.METADATA_RESERVED_KEY, ex.getErrorCode());
    }

    @Test
    void testProvidersWritingSameKeyCollide() {
        MetadataAssembler assembler = new MetadataAssembler(List.of(
            new HostNameMetadataProvider("one"), new HostNameMetadataProvider("two")), CLOCK);

        MetadataConfigurationException ex = assertThrows(MetadataConfigurationException.class,
            () -> assembler.assemble(KEY, event(Metadata.empty()), ITEM_ADDED, SourceId.of("a"), "batch-1"));
        assertEquals(FoldStoreErrorCodes.METADATA_KEY_COLLISION, ex.getErrorCode());
        assertEquals(HostNameMetadataProvider.HOST_NAME, ex.getKey());
    }

    @Test
    void testProviderCollidingWithCallerMetadata() {
        MetadataAssembler assembler = new MetadataAssembler(List.of(new HostNameMetadataProvider("agent")), CLOCK);
        assertThrows(MetadataConfigurationException.class, () -> assembler.assemble(KEY,
            event(Metadata.of(HostNameMetadataProvider.HOST_NAME, "caller")), ITEM_ADDED, SourceId.of("a"), "batch-1"));
    }

    @Test
    void testProvidersSeeOnlyCallerMetadata() {
        List<Metadata> seen = new ArrayList<>();
        MetadataProvider first = (key, event, metadata) -> {
            seen.add(metadata);
            return Map.of("first", "1");
        };
        MetadataProvider second = (key, event, metadata) -> {
            seen.add(metadata);
            return Map.of("second", "2");
        };
        new MetadataAssembler(List.of(first, second), CLOCK)
            .assemble(KEY, event(Metadata.of("user", "alice")), ITEM_ADDED, SourceId.of("a"), "batch-1");

        assertEquals(List.of(Metadata.of("user", "alice"), Metadata.of("user", "alice")), seen);
    }

    @Test
    void testShippedProviders() {
        MetadataAssembler assembler = new MetadataAssembler(List.of(
            new EventTypeMetadataProvider(),
            new CorrelationMetadataProvider(() -> "corr-1", () -> "")), CLOCK);

        Metadata metadata = assembler.assemble(KEY, event(Metadata.empty()), ITEM_ADDED, SourceId.of("a"), "batch-1");

        assertEquals(OrderEvent.ItemAdded.class.getName(),
            metadata.get(EventTypeMetadataProvider.EVENT_TYPE_CLASS_NAME).orElseThrow());
        assertEquals("corr-1", metadata.get(CorrelationMetadataProvider.CORRELATION_ID).orElseThrow());
        assertFalse(metadata.containsKey(CorrelationMetadataProvider.CAUSATION_ID));
    }
}
