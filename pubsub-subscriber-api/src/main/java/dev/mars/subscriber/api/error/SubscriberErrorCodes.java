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

/**
 * Standard error codes for the subscriber application.
 *
 * Error code ranges:
 * - SUBERR0001-0049: General/System errors
 */
public final class SubscriberErrorCodes {

    private SubscriberErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "SUBERR0001";
    public static final String INVALID_REQUEST = "SUBERR0002";
    public static final String ROUTE_NOT_FOUND = "SUBERR0005";
    public static final String METHOD_NOT_ALLOWED = "SUBERR0006";
}
