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
package dev.mars.subscriber.api.error;

import java.time.Instant;

/**
 * Immutable error record for failures outside the delivery routes.
 *
 * Delivery failures are never reported this way; they are answered with a
 * DROP status so the broker does not redeliver.
 *
 * @param code      The standard error code (e.g., SUBERR0001)
 * @param message   Human-readable error message
 * @param timestamp When the error occurred
 * @param details   Optional additional details (can be null)
 */
public record SubscriberError(
    String code,
    String message,
    Instant timestamp,
    String details
) {
    /**
     * Creates an error with code and message, using current timestamp.
     */
    public static SubscriberError of(String code, String message) {
        return new SubscriberError(code, message, Instant.now(), null);
    }

    /**
     * Creates an error with code, message, and details, using current timestamp.
     */
    public static SubscriberError of(String code, String message, String details) {
        return new SubscriberError(code, message, Instant.now(), details);
    }

    /**
     * Creates a route not found error.
     */
    public static SubscriberError routeNotFound(String path) {
        return of(SubscriberErrorCodes.ROUTE_NOT_FOUND, "Route not found: " + path);
    }

    /**
     * Creates a method not allowed error.
     */
    public static SubscriberError methodNotAllowed(String method, String path) {
        return of(SubscriberErrorCodes.METHOD_NOT_ALLOWED,
                  "Method " + method + " not allowed on " + path);
    }

    /**
     * Creates an invalid request error.
     */
    public static SubscriberError invalidRequest(String message) {
        return of(SubscriberErrorCodes.INVALID_REQUEST, message);
    }

    /**
     * Creates an internal error.
     */
    public static SubscriberError internalError(String message) {
        return of(SubscriberErrorCodes.INTERNAL_ERROR, message);
    }

    /**
     * Creates an internal error with details.
     */
    public static SubscriberError internalError(String message, String details) {
        return of(SubscriberErrorCodes.INTERNAL_ERROR, message, details);
    }
}
