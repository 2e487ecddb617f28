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

import java.util.Objects;

/**
 * Base type of every failure raised by FoldStore. Carries one of the
 * {@link FoldStoreErrorCodes} so callers can tell a "please retry" conflict from an
 * unrecoverable failure without parsing messages.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class FoldStoreException extends RuntimeException {

    private final String errorCode;

    public FoldStoreException(String errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    public FoldStoreException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    /** Returns the FSERR code of this failure */
    public String getErrorCode() {
        return errorCode;
    }

    /** Returns true if retrying the whole request may succeed */
    public boolean isConcurrencyConflict() {
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "]: " + getMessage();
    }
}
