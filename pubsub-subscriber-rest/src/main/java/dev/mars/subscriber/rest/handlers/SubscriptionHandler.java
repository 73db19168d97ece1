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

package dev.mars.subscriber.rest.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.subscriber.api.SubscriptionDescriptor;
import dev.mars.subscriber.api.error.SubscriberError;
import dev.mars.subscriber.rest.error.ErrorResponse;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * REST handler for GET /dapr/subscribe, called by the sidecar at startup to
 * learn which topics this application subscribes to and where they are delivered.
 */
public class SubscriptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionHandler.class);

    private final List<SubscriptionDescriptor> subscriptions;
    private final ObjectMapper objectMapper;

    public SubscriptionHandler(String pubsubName, ObjectMapper objectMapper) {
        this.subscriptions = SubscriptionDescriptor.forAllTopics(pubsubName);
        this.objectMapper = objectMapper;
    }

    public void listSubscriptions(RoutingContext ctx) {
        logger.info("Subscribing to: {}", subscriptions);
        try {
            ctx.response()
                .setStatusCode(200)
                .putHeader("content-type", "application/json")
                .end(objectMapper.writeValueAsString(subscriptions));
        } catch (JsonProcessingException e) {
            logger.error("Failed to encode subscriptions", e);
            ErrorResponse.internalError(ctx, SubscriberError.internalError("Failed to encode subscriptions"));
        }
    }
}
