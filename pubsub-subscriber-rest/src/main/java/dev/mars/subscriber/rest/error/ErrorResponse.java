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
package dev.mars.subscriber.rest.error;

import dev.mars.subscriber.api.error.SubscriberError;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * Utility class for sending standardized error responses from the router's
 * error and failure handlers.
 */
public final class ErrorResponse {

    private ErrorResponse() {
        // Utility class - no instantiation
    }

    /**
     * Sends an error response with the given SubscriberError.
     *
     * @param ctx        The routing context
     * @param statusCode HTTP status code
     * @param error      The subscriber error
     */
    public static void send(RoutingContext ctx, int statusCode, SubscriberError error) {
        if (ctx.response().ended()) {
            return;
        }
        ctx.response()
            .setStatusCode(statusCode)
            .putHeader("Content-Type", "application/json")
            .end(toJson(error).encode());
    }

    /**
     * Sends a 404 Not Found error.
     */
    public static void notFound(RoutingContext ctx, SubscriberError error) {
        send(ctx, 404, error);
    }

    /**
     * Sends a 405 Method Not Allowed error.
     */
    public static void methodNotAllowed(RoutingContext ctx, SubscriberError error) {
        send(ctx, 405, error);
    }

    /**
     * Sends a 500 Internal Server Error.
     */
    public static void internalError(RoutingContext ctx, SubscriberError error) {
        send(ctx, 500, error);
    }

    /**
     * Converts a SubscriberError to a JsonObject.
     */
    public static JsonObject toJson(SubscriberError error) {
        JsonObject json = new JsonObject()
            .put("code", error.code())
            .put("error", error.message())
            .put("timestamp", error.timestamp().toEpochMilli());

        if (error.details() != null) {
            json.put("details", error.details());
        }

        return json;
    }
}
