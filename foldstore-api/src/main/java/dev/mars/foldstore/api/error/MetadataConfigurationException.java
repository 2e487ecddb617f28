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
 * A metadata provider or caller tried to write a reserved key, or a key another source already
 * wrote.
 */
public class MetadataConfigurationException extends FoldStoreException {

    private final String key;

    public MetadataConfigurationException(String errorCode, String key, String message) {
        super(errorCode, message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
