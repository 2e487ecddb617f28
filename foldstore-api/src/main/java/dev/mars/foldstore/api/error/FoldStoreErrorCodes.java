package dev.mars.foldstore.api.error;

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
 * Standard error codes for FoldStore.
 *
 * Error code ranges:
 * - FSERR0001-0099: General/System errors
 * - FSERR0100-0149: Concurrency errors
 * - FSERR0150-0199: Storage errors
 * - FSERR0200-0249: Serialization errors
 * - FSERR0250-0299: Aggregate errors
 * - FSERR0300-0349: Upgrade errors
 * - FSERR0350-0399: Metadata errors
 * - FSERR0400-0449: Snapshot errors
 */
public final class FoldStoreErrorCodes {

    private FoldStoreErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0099)
    // ========================================================================
    public static final String INTERNAL_ERROR = "FSERR0001";
    public static final String INVALID_CONFIGURATION = "FSERR0002";

    // ========================================================================
    // Concurrency Errors (0100-0149)
    // ========================================================================
    public static final String OPTIMISTIC_CONCURRENCY_CONFLICT = "FSERR0100";
    public static final String OPTIMISTIC_CONCURRENCY_RETRIES_EXHAUSTED = "FSERR0101";

    // ========================================================================
    // Storage Errors (0150-0199)
    // ========================================================================
    public static final String STORAGE_FAILURE = "FSERR0150";
    public static final String STORAGE_TRANSIENT_RETRIES_EXHAUSTED = "FSERR0151";
    public static final String STORAGE_CORRUPT = "FSERR0152";
    public static final String STORAGE_UNAVAILABLE = "FSERR0153";

    // ========================================================================
    // Serialization Errors (0200-0249)
    // ========================================================================
    public static final String SERIALIZATION_FAILED = "FSERR0200";
    public static final String DESERIALIZATION_FAILED = "FSERR0201";
    public static final String UNKNOWN_EVENT_TYPE = "FSERR0202";

    // ========================================================================
    // Aggregate Errors (0250-0299)
    // ========================================================================
    public static final String MISSING_EVENT_HANDLER = "FSERR0250";

    // ========================================================================
    // Upgrade Errors (0300-0349)
    // ========================================================================
    public static final String UPGRADE_CYCLE_DETECTED = "FSERR0300";
    public static final String UPGRADE_ITERATION_LIMIT_EXCEEDED = "FSERR0301";

    // ========================================================================
    // Metadata Errors (0350-0399)
    // ========================================================================
    public static final String METADATA_RESERVED_KEY = "FSERR0350";
    public static final String METADATA_KEY_COLLISION = "FSERR0351";

    // ========================================================================
    // Snapshot Errors (0400-0449)
    // ========================================================================
    public static final String SNAPSHOT_SERIALIZATION_FAILED = "FSERR0400";
    public static final String SNAPSHOT_UPGRADE_FAILED = "FSERR0401";
}
