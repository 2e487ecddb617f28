package dev.mars.foldstore.core.persistence.files;

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

import dev.mars.foldstore.core.retry.BackoffRetryStrategy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.time.Duration;

/**
 * Retries file system operations that failed with an {@link IOException}. An existing event
 * file is a concurrency conflict and is never retried.
 */
public class IoRetryStrategy extends BackoffRetryStrategy {

    public IoRetryStrategy(int maxRetries, Duration initialDelay, Duration maxDelay) {
        super(maxRetries, initialDelay, 2.0, maxDelay);
    }

    public static IoRetryStrategy defaults() {
        return new IoRetryStrategy(3, Duration.ofMillis(50), Duration.ofSeconds(1));
    }

    @Override
    protected boolean isRetryable(Throwable failure) {
        Throwable cause = failure instanceof UncheckedIOException ? failure.getCause() : failure;
        return cause instanceof IOException && !(cause instanceof FileAlreadyExistsException);
    }
}
