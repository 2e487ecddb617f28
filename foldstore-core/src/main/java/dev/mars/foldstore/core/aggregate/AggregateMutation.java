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

import dev.mars.foldstore.api.CancellationToken;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Business logic run against a freshly loaded aggregate during an update. It may run more than
 * once when the commit loses an optimistic concurrency race, so it must only change the
 * aggregate through {@link AggregateRoot#emit}.
 */
@FunctionalInterface
public interface AggregateMutation<A> {

    CompletableFuture<Void> mutate(A aggregate, CancellationToken token);

    /**
     * Adapts synchronous business logic.
     */
    static <A> AggregateMutation<A> of(Consumer<A> action) {
        return (aggregate, token) -> {
            action.accept(aggregate);
            return CompletableFuture.completedFuture(null);
        };
    }
}
