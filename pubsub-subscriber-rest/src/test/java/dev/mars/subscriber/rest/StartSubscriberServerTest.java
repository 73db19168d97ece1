package dev.mars.subscriber.rest;

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

import dev.mars.subscriber.rest.config.SubscriberServerConfig;
import dev.mars.subscriber.rest.state.InMemorySubscriberState;
import dev.mars.subscriber.test.categories.TestCategories;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the launcher's configuration loading and deployment.
 */
@Tag(TestCategories.INTEGRATION)
@ExtendWith(VertxExtension.class)
class StartSubscriberServerTest {

    private static final int TEST_PORT = 18320;

    @AfterEach
    void clearProperties() {
        System.clearProperty("port");
        System.clearProperty("pubsubName");
    }

    @Test
    @DisplayName("System properties override the config file")
    void testStartWithSystemProperties(Vertx vertx, VertxTestContext testContext) {
        System.setProperty("port", String.valueOf(TEST_PORT));
        System.setProperty("pubsubName", "orders-bus");
        WebClient client = WebClient.create(vertx);

        StartSubscriberServer.start(vertx, new InMemorySubscriberState())
            .compose(id -> {
                assertNotNull(id);
                return client.get(TEST_PORT, "localhost", "/").send();
            })
            .compose(index -> {
                assertEquals(200, index.statusCode());
                assertEquals(new JsonObject().put("message", "OK"), index.bodyAsJsonObject());
                return client.get(TEST_PORT, "localhost", "/dapr/subscribe").send();
            })
            .onSuccess(response -> testContext.verify(() -> {
                JsonArray subscriptions = response.bodyAsJsonArray();
                assertEquals(3, subscriptions.size());
                assertEquals("orders-bus", subscriptions.getJsonObject(0).getString("pubsubname"));
                testContext.completeNow();
            }))
            .onFailure(testContext::failNow);
    }

    @Test
    @DisplayName("Upper-case environment variables map onto config keys")
    void testEnvironmentConfigUpperCaseNames() {
        JsonObject config = StartSubscriberServer.environmentConfig(Map.of(
            "PORT", "3100",
            "PUBSUB_NAME", "orders-bus",
            "ALLOWED_ORIGINS", "http://a.example,http://b.example",
            "BODY_LIMIT_BYTES", "4096",
            "HOME", "/root"));

        assertEquals(new JsonObject()
                .put("port", "3100")
                .put("pubsubName", "orders-bus")
                .put("allowedOrigins", "http://a.example,http://b.example")
                .put("bodyLimitBytes", "4096"),
            config);

        SubscriberServerConfig parsed = SubscriberServerConfig.from(config);
        assertEquals(3100, parsed.port());
        assertEquals(List.of("http://a.example", "http://b.example"), parsed.allowedOrigins());
        assertEquals(4096L, parsed.bodyLimitBytes());
    }

    @Test
    @DisplayName("Exact key name wins over the upper-case name")
    void testEnvironmentConfigExactKeyWins() {
        JsonObject config = StartSubscriberServer.environmentConfig(Map.of("port", "3200", "PORT", "3100"));

        assertEquals(new JsonObject().put("port", "3200"), config);
        assertEquals(new JsonObject(), StartSubscriberServer.environmentConfig(Map.of()));
    }

    @Test
    @DisplayName("Invalid configuration fails the deployment")
    void testInvalidConfiguration(Vertx vertx, VertxTestContext testContext) {
        System.setProperty("port", "not-a-port");

        StartSubscriberServer.start(vertx, new InMemorySubscriberState())
            .onSuccess(id -> testContext.failNow("deployment should fail for a non-numeric port"))
            .onFailure(cause -> testContext.verify(() -> {
                assertTrue(cause instanceof IllegalArgumentException, cause.toString());
                assertTrue(cause.getMessage().contains("port"));
                testContext.completeNow();
            }));
    }
}
