package dev.mars.foldstore.core.metadata;

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

import dev.mars.foldstore.api.AggregateEvent;
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.Metadata;
import dev.mars.foldstore.api.MetadataProvider;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Copies the current correlation and causation ids onto every event. The suppliers usually read
 * request scoped context; a null or blank value omits the key.
 */
public class CorrelationMetadataProvider implements MetadataProvider {

    public static final String CORRELATION_ID = "correlation_id";
    public static final String CAUSATION_ID = "causation_id";

    private final Supplier<String> correlationId;
    private final Supplier<String> causationId;

    public CorrelationMetadataProvider(Supplier<String> correlationId, Supplier<String> causationId) {
        this.correlationId = Objects.requireNonNull(correlationId, "Correlation id supplier cannot be null");
        this.causationId = Objects.requireNonNull(causationId, "Causation id supplier cannot be null");
    }

    @Override
    public Map<String, String> provideMetadata(AggregateKey aggregateKey, AggregateEvent event, Metadata metadata) {
        Map<String, String> result = new LinkedHashMap<>();
        putIfPresent(result, CORRELATION_ID, correlationId.get());
        putIfPresent(result, CAUSATION_ID, causationId.get());
        return result;
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value);
        }
    }
}
