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
 * Fatal storage failure: either a non-transient backend error, or a transient one whose
 * retries were exhausted.
 */
public class EventPersistenceException extends FoldStoreException {

    public EventPersistenceException(String message, Throwable cause) {
        super(FoldStoreErrorCodes.STORAGE_FAILURE, message, cause);
    }

    public EventPersistenceException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static EventPersistenceException transientRetriesExhausted(String operation, int attempts, Throwable cause) {
        return new EventPersistenceException(
            FoldStoreErrorCodes.STORAGE_TRANSIENT_RETRIES_EXHAUSTED,
            "Operation '" + operation + "' failed after " + attempts + " attempts: " + cause.getMessage(),
            cause);
    }

    /** Returns true if a transient failure was retried until the retry strategy gave up */
    public boolean isTransientExhausted() {
        return FoldStoreErrorCodes.STORAGE_TRANSIENT_RETRIES_EXHAUSTED.equals(getErrorCode());
    }

    public static EventPersistenceException unavailable(String message, Throwable cause) {
        return new EventPersistenceException(FoldStoreErrorCodes.STORAGE_UNAVAILABLE, message, cause);
    }

    public static EventPersistenceException corrupt(String message) {
        return new EventPersistenceException(FoldStoreErrorCodes.STORAGE_CORRUPT, message, null);
    }
}
