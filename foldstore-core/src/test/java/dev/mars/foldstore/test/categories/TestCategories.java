package dev.mars.foldstore.test.categories;

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


/**
 * Test categories for organizing FoldStore tests by execution time and infrastructure needs.
 *
 * Usage:
 * - @Tag(TestCategories.CORE) - Fast unit tests, no external infrastructure
 * - @Tag(TestCategories.INTEGRATION) - Tests with real infrastructure (file system, PostgreSQL)
 *
 * Maven execution examples:
 * - mvn test -Dgroups="core" (fast core tests only)
 * - mvn test -DexcludedGroups="integration"
 */
public final class TestCategories {

    /**
     * CORE - Fast unit tests that validate the event model and contracts.
     */
    public static final String CORE = "core";

    /**
     * INTEGRATION - Tests that require real infrastructure (TestContainers, temp directories).
     */
    public static final String INTEGRATION = "integration";

    private TestCategories() {
        // Utility class - no instantiation
    }
}
