package dev.mars.foldstore.api;

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

import dev.mars.foldstore.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class AggregateKeyTest {

    @Test
    void testAggregateIdRejectsBlank() {
        assertThrows(IllegalArgumentException.class, () -> AggregateId.of(""));
        assertThrows(IllegalArgumentException.class, () -> AggregateId.of("   "));
        assertThrows(NullPointerException.class, () -> AggregateId.of(null));
    }

    @Test
    void testSameIdDifferentAggregateNamesAreDifferentStreams() {
        AggregateKey order = AggregateKey.of("order", "1");
        AggregateKey invoice = AggregateKey.of("invoice", "1");

        assertNotEquals(order, invoice);
        assertEquals(order.aggregateId(), invoice.aggregateId());
        assertEquals(order, AggregateKey.of("order", "1"));
        assertEquals("order/1", order.toString());
    }

    @Test
    void testSourceIdRejectsBlank() {
        assertThrows(IllegalArgumentException.class, () -> SourceId.of(""));
        assertEquals("cmd-1", SourceId.of("cmd-1").value());
    }

    @Test
    void testEventDefinitionVersionStartsAtOne() {
        assertThrows(IllegalArgumentException.class, () -> new EventDefinition("X", 0, AggregateEvent.class));
        assertEquals("X v3", new EventDefinition("X", 3, AggregateEvent.class).toString());
    }

    @Test
    void testSerializedEventRejectsNonPositiveSequence() {
        AggregateKey key = AggregateKey.of("order", "1");
        assertThrows(IllegalArgumentException.class,
            () -> new SerializedEvent(key, 0, "X", 1, "{}", "{}", Metadata.empty()));
    }

    @Test
    void testCommittedEventFromSerializedEvent() {
        AggregateKey key = AggregateKey.of("order", "1");
        Metadata metadata = Metadata.of(MetadataKeys.BATCH_ID, "batch-1");
        SerializedEvent serialized = new SerializedEvent(key, 3, "ItemAdded", 1, "{\"sku\":\"X\"}", "{}", metadata);

        CommittedEvent committed = CommittedEvent.from(serialized, 42);

        assertEquals(key, committed.aggregateKey());
        assertEquals("order", committed.aggregateName());
        assertEquals(3, committed.aggregateSequenceNumber());
        assertEquals(42, committed.globalSequenceNumber());
        assertEquals("batch-1", committed.batchId());
        assertEquals("{\"sku\":\"X\"}", committed.data());
    }

    @Test
    void testCommittedEventsPageCopiesEvents() {
        CommittedEventsPage page = new CommittedEventsPage(List.of(), 5);
        assertTrue(page.isEmpty());
        assertEquals(5, page.nextGlobalSequenceNumber());
    }
}
