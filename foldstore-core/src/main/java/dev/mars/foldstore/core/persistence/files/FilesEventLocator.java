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

import dev.mars.foldstore.api.AggregateKey;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Maps streams and events to paths below the store root:
 * {@code <root>/<aggregate name>/<aggregate id>/<sequence>.json}. Names and ids are URL encoded
 * so any identity is a valid single path segment.
 */
public class FilesEventLocator {

    static final String EVENT_FILE_SUFFIX = ".json";

    private final Path root;

    public FilesEventLocator(Path root) {
        this.root = Objects.requireNonNull(root, "Store root cannot be null");
    }

    public Path getRoot() {
        return root;
    }

    public Path getStreamPath(AggregateKey key) {
        return root.resolve(encode(key.aggregateName())).resolve(encode(key.aggregateId().value()));
    }

    public Path getEventPath(AggregateKey key, long sequenceNumber) {
        return getStreamPath(key).resolve(sequenceNumber + EVENT_FILE_SUFFIX);
    }

    /**
     * Parses the sequence number out of an event file name.
     */
    public static OptionalLong sequenceNumberOf(Path eventFile) {
        String fileName = eventFile.getFileName().toString();
        if (!fileName.endsWith(EVENT_FILE_SUFFIX)) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(fileName.substring(0, fileName.length() - EVENT_FILE_SUFFIX.length())));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static String encode(String segment) {
        String encoded = URLEncoder.encode(segment, StandardCharsets.UTF_8);
        // "." and ".." are not usable as directory names
        return encoded.replace(".", "%2E");
    }
}
