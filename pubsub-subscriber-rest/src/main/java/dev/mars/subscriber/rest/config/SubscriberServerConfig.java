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

package dev.mars.subscriber.rest.config;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, validated configuration for the subscriber server.
 * Parsed once at bootstrap, injected into the verticle.
 *
 * Values may arrive as JSON numbers/arrays (config file) or as strings
 * (environment variables, system properties); both forms are accepted.
 *
 * @param port           HTTP port to listen on
 * @param pubsubName     Name of the pub/sub component returned in subscriptions
 * @param allowedOrigins CORS origins, {@code *} allows any origin
 * @param bodyLimitBytes Maximum request body size, -1 for no limit
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public record SubscriberServerConfig(
        int port,
        String pubsubName,
        List<String> allowedOrigins,
        long bodyLimitBytes) {

    public static final int DEFAULT_PORT = 3000;
    public static final String DEFAULT_PUBSUB_NAME = "messagebus";
    public static final String ANY_ORIGIN = "*";
    public static final long UNLIMITED_BODY = -1L;

    /**
     * Validation in compact constructor.
     * Throws IllegalArgumentException if any values are invalid.
     */
    public SubscriberServerConfig {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        if (pubsubName == null || pubsubName.isBlank()) {
            throw new IllegalArgumentException("pubsubName must not be blank");
        }
        Objects.requireNonNull(allowedOrigins, "allowedOrigins must not be null");
        if (allowedOrigins.isEmpty()) {
            throw new IllegalArgumentException("allowedOrigins must not be empty");
        }
        if (bodyLimitBytes != UNLIMITED_BODY && bodyLimitBytes <= 0) {
            throw new IllegalArgumentException("bodyLimitBytes must be -1 or positive");
        }
        allowedOrigins = List.copyOf(allowedOrigins);
    }

    /**
     * Defaults: port 3000, pub/sub component {@code messagebus}, any origin, no body limit.
     */
    public static SubscriberServerConfig defaults() {
        return new SubscriberServerConfig(DEFAULT_PORT, DEFAULT_PUBSUB_NAME, List.of(ANY_ORIGIN), UNLIMITED_BODY);
    }

    /**
     * Same configuration listening on another port. Tests use this to pick a free port.
     */
    public SubscriberServerConfig withPort(int newPort) {
        return new SubscriberServerConfig(newPort, pubsubName, allowedOrigins, bodyLimitBytes);
    }

    public boolean allowsAnyOrigin() {
        return allowedOrigins.contains(ANY_ORIGIN);
    }

    /**
     * Parse and validate configuration from JsonObject.
     * Called once at bootstrap after ConfigRetriever merges all sources.
     *
     * @param json Merged configuration from ConfigRetriever
     * @return Validated, immutable configuration
     * @throws IllegalArgumentException if validation fails
     */
    public static SubscriberServerConfig from(JsonObject json) {
        int port = (int) longValue(json, "port", DEFAULT_PORT);
        String pubsubName = json.getValue("pubsubName") == null
                ? DEFAULT_PUBSUB_NAME
                : json.getValue("pubsubName").toString();
        List<String> allowedOrigins = originsValue(json.getValue("allowedOrigins"));
        long bodyLimitBytes = longValue(json, "bodyLimitBytes", UNLIMITED_BODY);

        return new SubscriberServerConfig(port, pubsubName, allowedOrigins, bodyLimitBytes);
    }

    private static long longValue(JsonObject json, String key, long defaultValue) {
        Object value = json.getValue(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + value, e);
        }
    }

    private static List<String> originsValue(Object value) {
        if (value == null) {
            return List.of(ANY_ORIGIN);
        }
        if (value instanceof JsonArray) {
            return ((JsonArray) value).stream()
                    .map(Object::toString)
                    .toList();
        }
        // comma-separated when set through env or system properties
        return Arrays.stream(value.toString().split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toList();
    }
}
