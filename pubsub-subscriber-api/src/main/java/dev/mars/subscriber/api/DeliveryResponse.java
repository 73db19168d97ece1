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

package dev.mars.subscriber.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Response body written by the subscriber application.
 *
 * Empty strings and zero times are left out of the JSON, so a liveness
 * response serializes as {@code {"message":"OK"}} and a delivery response as
 * {@code {"status":"SUCCESS","message":"consumed"}}.
 *
 * @param status    The delivery status, null for non-delivery responses
 * @param message   Human-readable message
 * @param startTime Optional start time, omitted when zero
 * @param endTime   Optional end time, omitted when zero
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
@JsonPropertyOrder({"status", "message", "start_time", "end_time"})
public record DeliveryResponse(
    @JsonProperty("status") @JsonInclude(JsonInclude.Include.NON_NULL) DeliveryStatus status,
    @JsonProperty("message") @JsonInclude(JsonInclude.Include.NON_EMPTY) String message,
    @JsonProperty("start_time") @JsonInclude(JsonInclude.Include.NON_DEFAULT) int startTime,
    @JsonProperty("end_time") @JsonInclude(JsonInclude.Include.NON_DEFAULT) int endTime
) {

    public static final String CONSUMED_MESSAGE = "consumed";
    public static final String RETRY_MESSAGE = "retry later";

    /**
     * Creates a response with a status and message and no timing information.
     */
    public static DeliveryResponse of(DeliveryStatus status, String message) {
        return new DeliveryResponse(status, message, 0, 0);
    }

    /**
     * Creates a response carrying only a message, used by the liveness endpoint.
     */
    public static DeliveryResponse message(String message) {
        return new DeliveryResponse(null, message, 0, 0);
    }

    public static DeliveryResponse success() {
        return of(DeliveryStatus.SUCCESS, CONSUMED_MESSAGE);
    }

    public static DeliveryResponse retry() {
        return of(DeliveryStatus.RETRY, RETRY_MESSAGE);
    }

    public static DeliveryResponse drop(String reason) {
        return of(DeliveryStatus.DROP, reason);
    }
}
