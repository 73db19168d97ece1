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

package dev.mars.subscriber.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.subscriber.api.DeliveryResponse;
import dev.mars.subscriber.api.SubscriberState;
import dev.mars.subscriber.api.Topic;
import dev.mars.subscriber.api.error.SubscriberError;
import dev.mars.subscriber.rest.config.SubscriberServerConfig;
import dev.mars.subscriber.rest.error.ErrorResponse;
import dev.mars.subscriber.rest.handlers.DeliveryHandler;
import dev.mars.subscriber.rest.handlers.SubscriptionHandler;
import dev.mars.subscriber.rest.handlers.TestControlHandler;
import dev.mars.subscriber.rest.metrics.DeliveryMetrics;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Vert.x-based HTTP server for the pub/sub subscriber test application.
 *
 * Answers the sidecar's subscription query, receives deliveries on one route
 * per topic and exposes the /tests endpoints a test harness uses to inspect
 * received messages and arm failure modes.
 *
 * The {@link SubscriberState} is injected by the deploying application and
 * outlives the verticle; undeploying the server does not clear it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class SubscriberServer extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(SubscriberServer.class);

    static final String OK_MESSAGE = "OK";

    private final SubscriberServerConfig config;
    private final SubscriberState state;
    private final DeliveryMetrics metrics;
    private final ObjectMapper objectMapper;

    private HttpServer server;
    private DeliveryHandler deliveryHandler;

    /**
     * Creates a server with injected configuration and state.
     *
     * @param config The validated server configuration
     * @param state  The shared subscriber state (required)
     * @throws NullPointerException if config or state is null
     */
    public SubscriberServer(SubscriberServerConfig config, SubscriberState state) {
        this(config, state, DeliveryMetrics.prometheus());
    }

    public SubscriberServer(SubscriberServerConfig config, SubscriberState state, DeliveryMetrics metrics) {
        this.config = Objects.requireNonNull(config, "SubscriberServerConfig must be provided");
        this.state = Objects.requireNonNull(state, "SubscriberState must be provided");
        this.metrics = Objects.requireNonNull(metrics, "DeliveryMetrics must be provided");
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void start(Promise<Void> startPromise) {
        Future.succeededFuture()
                .compose(v -> {
                    Router router = createRouter();
                    logger.debug("Router created successfully");
                    return vertx.createHttpServer()
                            .requestHandler(router)
                            .listen(config.port());
                })
                .compose(httpServer -> {
                    server = httpServer;
                    logger.info("Subscriber app listening on http://localhost:{}", httpServer.actualPort());
                    return Future.<Void>succeededFuture();
                })
                .onSuccess(v -> startPromise.complete())
                .onFailure(cause -> {
                    logger.error("Failed to start subscriber server on port {}", config.port(), cause);
                    startPromise.fail(cause);
                });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        logger.info("Stopping subscriber server");
        if (server != null) {
            server.close()
                .onSuccess(v -> {
                    logger.info("Subscriber server stopped");
                    stopPromise.complete();
                })
                .onFailure(cause -> {
                    logger.error("Failed to stop subscriber server", cause);
                    stopPromise.fail(cause);
                });
        } else {
            stopPromise.complete();
        }
    }

    private Router createRouter() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(createCorsHandler());

        deliveryHandler = new DeliveryHandler(state, objectMapper, metrics);
        SubscriptionHandler subscriptionHandler = new SubscriptionHandler(config.pubsubName(), objectMapper);
        TestControlHandler testControlHandler = new TestControlHandler(state);

        // Liveness
        router.get("/").handler(this::index);

        // Programmatic subscriptions
        router.get("/dapr/subscribe").handler(subscriptionHandler::listSubscriptions);

        // Topic deliveries, one route per topic; only these enforce the body limit
        BodyHandler deliveryBodyHandler = BodyHandler.create().setBodyLimit(config.bodyLimitBytes());
        for (Topic topic : Topic.values()) {
            router.post(topic.path())
                    .handler(deliveryBodyHandler)
                    .handler(deliveryHandler::handleDelivery);
        }

        // Test harness control, any request body is read and discarded
        router.post("/tests/*").handler(BodyHandler.create());
        router.post("/tests/get").handler(testControlHandler::getReceivedMessages);
        router.post("/tests/set-respond-error").handler(testControlHandler::setRespondWithError);
        router.post("/tests/set-respond-retry").handler(testControlHandler::setRespondWithRetry);
        router.post("/tests/set-respond-empty-json").handler(testControlHandler::setRespondWithEmptyJson);
        router.post("/tests/initialize").handler(testControlHandler::initialize);

        // Delivery counters
        router.get("/metrics").handler(ctx -> ctx.response()
                .putHeader("content-type", "text/plain; version=0.0.4; charset=utf-8")
                .end(metrics.scrape()));

        router.route().failureHandler(this::handleFailure);
        router.errorHandler(404, ctx ->
                ErrorResponse.notFound(ctx, SubscriberError.routeNotFound(ctx.normalizedPath())));
        router.errorHandler(405, ctx ->
                ErrorResponse.methodNotAllowed(ctx,
                        SubscriberError.methodNotAllowed(ctx.request().method().name(), ctx.normalizedPath())));

        return router;
    }

    private void index(RoutingContext ctx) {
        logger.info("Index called");
        try {
            ctx.response()
                    .setStatusCode(200)
                    .putHeader("content-type", "application/json")
                    .end(objectMapper.writeValueAsString(DeliveryResponse.message(OK_MESSAGE)));
        } catch (JsonProcessingException e) {
            ctx.fail(500, e);
        }
    }

    /**
     * Failures on delivery routes are answered with DROP so the broker acknowledges
     * the message; anywhere else the standard error body is returned.
     */
    private void handleFailure(RoutingContext ctx) {
        int statusCode = ctx.statusCode();
        Throwable failure = ctx.failure();
        boolean deliveryRoute = ctx.request().method() == HttpMethod.POST
                && Topic.fromPath(ctx.normalizedPath()).isPresent();

        if (deliveryRoute && deliveryHandler != null) {
            String reason = failure != null && failure.getMessage() != null
                    ? failure.getMessage()
                    : "request body could not be read (HTTP " + statusCode + ")";
            deliveryHandler.dropUnreadable(ctx, reason);
            return;
        }

        if (statusCode >= 400 && statusCode < 500) {
            logger.warn("Request to {} failed with HTTP {}", ctx.normalizedPath(), statusCode);
            ErrorResponse.send(ctx, statusCode, SubscriberError.invalidRequest("Request failed with HTTP " + statusCode));
        } else {
            logger.error("Unexpected failure handling {}", ctx.normalizedPath(), failure);
            ErrorResponse.internalError(ctx, SubscriberError.internalError(
                    "Unexpected failure",
                    failure != null ? failure.getMessage() : null));
        }
    }

    /**
     * Gets the port this server is configured to listen on.
     *
     * @return the configured port
     */
    public int getPort() {
        return config.port();
    }

    private CorsHandler createCorsHandler() {
        CorsHandler cors = CorsHandler.create()
                .allowedMethod(HttpMethod.GET)
                .allowedMethod(HttpMethod.POST)
                .allowedMethod(HttpMethod.OPTIONS)
                .allowedHeader("Content-Type");
        if (!config.allowsAnyOrigin()) {
            cors.addOrigins(config.allowedOrigins());
        }
        return cors;
    }
}
