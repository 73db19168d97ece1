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

import dev.mars.subscriber.api.ReceivedMessages;
import dev.mars.subscriber.api.SubscriberState;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST handler for the endpoints a test harness uses to inspect and steer the
 * subscriber.
 *
 * Provides endpoints for:
 * - POST /tests/get - Messages received on every topic
 * - POST /tests/set-respond-error - Fail every following delivery with HTTP 500
 * - POST /tests/set-respond-retry - Answer every following delivery with RETRY
 * - POST /tests/set-respond-empty-json - Answer successful deliveries with {}
 * - POST /tests/initialize - Clear the received messages, flags stay armed
 *
 * Request bodies are read by the body handler and ignored.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class TestControlHandler {

    private static final Logger logger = LoggerFactory.getLogger(TestControlHandler.class);

    private final SubscriberState state;

    public TestControlHandler(SubscriberState state) {
        this.state = state;
    }

    /**
     * POST /tests/get
     * Returns {"pubsub-a-topic":[...],"pubsub-b-topic":[...],"pubsub-c-topic":[...]}.
     */
    public void getReceivedMessages(RoutingContext ctx) {
        ReceivedMessages received = state.receivedMessages();
        logger.info("Returning {} received messages", received.totalCount());
        logger.debug("receivedMessages={}", received);

        JsonObject response = new JsonObject();
        received.asTopicNameMap().forEach(response::put);

        ctx.response()
            .setStatusCode(200)
            .putHeader("content-type", "application/json")
            .end(response.encode());
    }

    /**
     * POST /tests/set-respond-error
     */
    public void setRespondWithError(RoutingContext ctx) {
        logger.info("Set respond with error");
        state.armRespondWithError();
        ctx.response().setStatusCode(200).end();
    }

    /**
     * POST /tests/set-respond-retry
     */
    public void setRespondWithRetry(RoutingContext ctx) {
        logger.info("Set respond with retry");
        state.armRespondWithRetry();
        ctx.response().setStatusCode(200).end();
    }

    /**
     * POST /tests/set-respond-empty-json
     */
    public void setRespondWithEmptyJson(RoutingContext ctx) {
        logger.info("Set respond with empty json");
        state.armRespondWithEmptyJson();
        ctx.response().setStatusCode(200).end();
    }

    /**
     * POST /tests/initialize
     */
    public void initialize(RoutingContext ctx) {
        logger.info("Initializing received-message sets");
        state.initialize();
        ctx.response().setStatusCode(200).end();
    }
}
