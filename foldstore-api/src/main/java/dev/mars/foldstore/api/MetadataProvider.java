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

import java.util.Map;

/**
 * Contributes metadata entries to every event committed by an aggregate store.
 *
 * <p>Providers are invoked once per event and must not depend on the output of other providers.
 * Returning a reserved key ({@link MetadataKeys#RESERVED}) or a key another source already set is
 * a configuration error.</p>
 */
@FunctionalInterface
public interface MetadataProvider {

    Map<String, String> provideMetadata(AggregateKey aggregateKey, AggregateEvent event, Metadata metadata);
}
