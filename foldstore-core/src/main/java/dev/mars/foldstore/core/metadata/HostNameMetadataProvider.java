package dev.mars.foldstore.core.metadata;

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

import dev.mars.foldstore.api.AggregateEvent;
import dev.mars.foldstore.api.AggregateKey;
import dev.mars.foldstore.api.Metadata;
import dev.mars.foldstore.api.MetadataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Map;
import java.util.Objects;

/**
 * Records the name of the host that committed each event. The name is resolved once.
 */
public class HostNameMetadataProvider implements MetadataProvider {
    private static final Logger logger = LoggerFactory.getLogger(HostNameMetadataProvider.class);

    public static final String HOST_NAME = "host_name";

    private final String hostName;

    public HostNameMetadataProvider() {
        this(resolveHostName());
    }

    public HostNameMetadataProvider(String hostName) {
        this.hostName = Objects.requireNonNull(hostName, "Host name cannot be null");
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("Could not resolve local host name, events will carry 'unknown': {}", e.getMessage());
            return "unknown";
        }
    }

    @Override
    public Map<String, String> provideMetadata(AggregateKey aggregateKey, AggregateEvent event, Metadata metadata) {
        return Map.of(HOST_NAME, hostName);
    }
}
