package dev.mars.foldstore.core.snapshot;

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

import java.util.Objects;
import java.util.Random;

/**
 * Snapshots after a commit with a fixed probability, spreading snapshot load across aggregates.
 */
public class SnapshotRandomlyStrategy implements SnapshotStrategy {

    private final double probability;
    private final Random random;

    public SnapshotRandomlyStrategy(double probability, Random random) {
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("Snapshot probability must be between 0.0 and 1.0");
        }
        this.probability = probability;
        this.random = Objects.requireNonNull(random, "Random cannot be null");
    }

    @Override
    public boolean shouldSnapshot(long currentVersion, long lastSnapshotVersion) {
        if (currentVersion <= lastSnapshotVersion) {
            return false;
        }
        return random.nextDouble() < probability;
    }

    @Override
    public String toString() {
        return "SnapshotRandomlyStrategy{probability=" + probability + '}';
    }
}
