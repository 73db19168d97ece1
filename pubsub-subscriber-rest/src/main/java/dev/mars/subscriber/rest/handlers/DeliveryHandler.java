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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import dev.mars.subscriber.api.BehaviorFlags;
import dev.mars.subscriber.api.DeliveryOutcome;
import dev.mars.subscriber.api.DeliveryResponse;
import dev.mars.subscriber.api.DeliveryStatus;
import dev.mars.subscriber.api.SubscriberState;
import dev.mars.subscriber.api.Topic;
import dev.mars.subscriber.api.error.SubscriberError;
import dev.mars.subscriber.rest.error.ErrorResponse;
import dev.mars.subscriber.rest.metrics.DeliveryMetrics;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * REST handler for messages the broker delivers to the topic routes.
 *
 * Handles:
 * - POST /pubsub-a-topic
 * - POST /pubsub-b-topic
 * - POST /pubsub-c-topic
 *
 * Every response except the armed error mode is HTTP 200; the body status
 * tells the broker whether the message was consumed (SUCCESS), should be
 * redelivered (RETRY) or should be discarded (DROP). Malformed deliveries are
 * always dropped so the broker does not redeliver them forever.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class DeliveryHandler {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryHandler.class);

    static final String DATA_FIELD = "data";
    static final String EMPTY_JSON = "{}";

    private final SubscriberState state;
    private final ObjectMapper objectMapper;
    private final ObjectReader bodyReader;
    private final DeliveryMetrics metrics;

    public DeliveryHandler(SubscriberState state, ObjectMapper objectMapper, DeliveryMetrics metrics) {
        this.state = state;
        this.objectMapper = objectMapper;
        // a body is one JSON value, anything after it makes the body unreadable
        this.bodyReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.metrics = metrics;
    }

    /**
     * POST /pubsub-{a,b,c}-topic
     * Records the delivered payload for the topic the route belongs to.
     */
    public void handleDelivery(RoutingContext ctx) {
        String path = ctx.normalizedPath();
        String topicLabel = topicLabel(path);
        logger.info("Delivery received on {}", path);

        BehaviorFlags flags = state.flags();
        if (answerArmedFailure(ctx, flags, topicLabel)) {
            return;
        }

        String payload;
        try {
            payload = extractMessage(ctx.body().buffer());
        } catch (IllegalArgumentException | IOException e) {
            logger.warn("Dropping delivery on {}: {}", path, e.getMessage());
            drop(ctx, topicLabel, e.getMessage());
            return;
        }

        DeliveryOutcome outcome = state.recordDelivery(path, payload);
        if (!outcome.isRecorded()) {
            String errorMessage = "Unexpected/Multiple redelivery of message from " + path;
            if (outcome == DeliveryOutcome.DUPLICATE) {
                logger.warn("Redelivery of already received message on {}: '{}'", path, payload);
            } else {
                logger.warn("Message delivered to unknown topic route {}", path);
            }
            drop(ctx, topicLabel, errorMessage);
            return;
        }

        logger.debug("Recorded message on {}: '{}'", path, payload);
        metrics.recordStatus(topicLabel, DeliveryStatus.SUCCESS);
        if (flags.respondWithEmptyJson()) {
            ctx.response()
                .setStatusCode(200)
                .putHeader("content-type", "application/json")
                .end(EMPTY_JSON);
        } else {
            sendResponse(ctx, DeliveryResponse.success());
        }
    }

    /**
     * Answers a delivery that could not be read before it reached this handler,
     * such as a body rejected by the body handler.
     */
    public void dropUnreadable(RoutingContext ctx, String reason) {
        String path = ctx.normalizedPath();
        String topicLabel = topicLabel(path);
        if (answerArmedFailure(ctx, state.flags(), topicLabel)) {
            return;
        }
        logger.warn("Dropping unreadable delivery on {}: {}", path, reason);
        drop(ctx, topicLabel, reason);
    }

    /**
     * Answers with the armed retry or error mode, retry taking precedence.
     *
     * @return true if a response was sent
     */
    private boolean answerArmedFailure(RoutingContext ctx, BehaviorFlags flags, String topicLabel) {
        if (flags.respondWithRetry()) {
            // not recorded, the broker is expected to redeliver
            metrics.recordStatus(topicLabel, DeliveryStatus.RETRY);
            sendResponse(ctx, DeliveryResponse.retry());
            return true;
        }
        if (flags.respondWithError()) {
            metrics.recordError(topicLabel);
            ctx.response().setStatusCode(500).end();
            return true;
        }
        return false;
    }

    /**
     * Extracts the message payload from a delivery body.
     * The body must be a JSON object whose {@code data} field is a string; other
     * fields of the envelope are ignored.
     *
     * @param body the raw request body, may be null
     * @return the payload
     * @throws IllegalArgumentException if the body is missing or has no string data field
     * @throws IOException if the body is not valid JSON
     */
    String extractMessage(Buffer body) throws IOException {
        if (body == null || body.length() == 0) {
            throw new IllegalArgumentException("request body is empty");
        }
        logger.debug("body={}", body);

        JsonNode root;
        try {
            root = bodyReader.readTree(body.getBytes());
        } catch (JsonProcessingException e) {
            throw new IOException("Could not unmarshal body: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("request body is not a JSON object");
        }
        JsonNode data = root.get(DATA_FIELD);
        if (data == null || data.isNull()) {
            throw new IllegalArgumentException("request body has no data field");
        }
        if (!data.isTextual()) {
            throw new IllegalArgumentException("data field is not a string");
        }
        return data.asText();
    }

    private void drop(RoutingContext ctx, String topicLabel, String reason) {
        DeliveryResponse response = DeliveryResponse.drop(reason);
        metrics.recordStatus(topicLabel, response.status());
        sendResponse(ctx, response);
    }

    private void sendResponse(RoutingContext ctx, DeliveryResponse response) {
        try {
            ctx.response()
                .setStatusCode(200)
                .putHeader("content-type", "application/json")
                .end(objectMapper.writeValueAsString(response));
        } catch (JsonProcessingException e) {
            logger.error("Failed to encode delivery response", e);
            ErrorResponse.internalError(ctx, SubscriberError.internalError("Failed to encode delivery response"));
        }
    }

    private static String topicLabel(String path) {
        return Topic.fromPath(path)
            .map(Topic::topicName)
            .orElse(DeliveryMetrics.UNKNOWN_TOPIC);
    }
}
