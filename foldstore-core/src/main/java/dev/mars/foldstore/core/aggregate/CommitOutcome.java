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

import dev.mars.foldstore.api.CommittedEvent;
import dev.mars.foldstore.api.error.OptimisticConcurrencyException;
import dev.mars.foldstore.core.retry.Futures;

import java.util.List;
import java.util.Objects;

/**
 * Result of one commit attempt. The update loop iterates over these values instead of
 * catching concurrency exceptions.
 */
public sealed interface CommitOutcome
        permits CommitOutcome.Committed, CommitOutcome.ConcurrencyConflict, CommitOutcome.Fatal {

    /**
     * Classifies the completion of a backend commit.
     */
    static CommitOutcome of(List<CommittedEvent> events, Throwable error) {
        if (error == null) {
            return new Committed(events);
        }
        Throwable cause = Futures.unwrap(error);
        if (cause instanceof OptimisticConcurrencyException conflict) {
            return new ConcurrencyConflict(conflict);
        }
        return new Fatal(cause);
    }

    record Committed(List<CommittedEvent> events) implements CommitOutcome {
        public Committed {
            events = List.copyOf(Objects.requireNonNull(events, "Events cannot be null"));
        }
    }

    record ConcurrencyConflict(OptimisticConcurrencyException exception) implements CommitOutcome {
        public ConcurrencyConflict {
            Objects.requireNonNull(exception, "Exception cannot be null");
        }
    }

    record Fatal(Throwable cause) implements CommitOutcome {
        public Fatal {
            Objects.requireNonNull(cause, "Cause cannot be null");
        }
    }
}
