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

import dev.mars.subscriber.api.SubscriberState;
import dev.mars.subscriber.rest.config.SubscriberServerConfig;
import dev.mars.subscriber.rest.state.InMemorySubscriberState;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Starts the subscriber test application.
 *
 * Configuration precedence (highest to lowest):
 * 1. System properties (-Dport=3001 -DpubsubName=messagebus)
 * 2. Environment variables (export PORT=3001, or the key name itself: export port=3001)
 * 3. Config file (conf/subscriber-server.json)
 * 4. Defaults (in SubscriberServerConfig)
 *
 * Usage:
 * <pre>
 * mvn exec:java -pl pubsub-subscriber-rest
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @see SubscriberServer
 * @see SubscriberServerConfig
 */
public final class StartSubscriberServer {

    private static final Logger logger = LoggerFactory.getLogger(StartSubscriberServer.class);

    static final String CONFIG_FILE = "conf/subscriber-server.json";
    static final String[] CONFIG_KEYS = {"port", "pubsubName", "allowedOrigins", "bodyLimitBytes"};

    // Conventional environment variable names for each config key
    static final Map<String, String> ENV_NAMES = Map.of(
        "port", "PORT",
        "pubsubName", "PUBSUB_NAME",
        "allowedOrigins", "ALLOWED_ORIGINS",
        "bodyLimitBytes", "BODY_LIMIT_BYTES");

    private StartSubscriberServer() {
        // Utility class - not instantiable
    }

    /**
     * Starts the subscriber with configuration loaded from file, environment and system properties.
     *
     * @param args Command line arguments (not used - configure via system properties/env vars)
     */
    public static void main(String[] args) {
        Vertx vertx = Vertx.vertx();

        start(vertx, new InMemorySubscriberState())
            .onSuccess(id -> logger.info("Subscriber application deployed ({})", id))
            .onFailure(cause -> {
                logger.error("Failed to start subscriber application", cause);
                vertx.close();
                System.exit(1);
            });

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down subscriber application");
            vertx.close();
        }));
    }

    /**
     * Loads the configuration and deploys the server with the given state.
     *
     * @param vertx the Vert.x instance to deploy on
     * @param state the state shared by all handlers
     * @return the deployment id
     */
    public static Future<String> start(Vertx vertx, SubscriberState state) {
        return createConfigRetriever(vertx).getConfig()
            .compose(json -> {
                // Parse and validate configuration once
                SubscriberServerConfig config = SubscriberServerConfig.from(json);
                logger.info("Configuration loaded: port={}, pubsubName={}", config.port(), config.pubsubName());
                return vertx.deployVerticle(new SubscriberServer(config, state));
            });
    }

    static ConfigRetriever createConfigRetriever(Vertx vertx) {
        ConfigStoreOptions fileStore = new ConfigStoreOptions()
            .setType("file")
            .setOptional(true)
            .setConfig(new JsonObject().put("path", CONFIG_FILE));

        ConfigStoreOptions envStore = new ConfigStoreOptions()
            .setType("json")
            .setConfig(environmentConfig(System.getenv()));

        ConfigStoreOptions sysPropsStore = new ConfigStoreOptions()
            .setType("sys")
            .setConfig(new JsonObject().put("cache", false));

        ConfigRetrieverOptions retrieverOptions = new ConfigRetrieverOptions()
            .addStore(fileStore)       // Lowest priority
            .addStore(envStore)        // Middle priority
            .addStore(sysPropsStore);  // Highest priority

        return ConfigRetriever.create(vertx, retrieverOptions);
    }

    /**
     * Maps environment variables onto config keys. A variable named exactly like
     * the key wins over its upper-case name ({@code port} over {@code PORT}).
     * Values are kept as strings; {@link SubscriberServerConfig#from} parses them.
     */
    static JsonObject environmentConfig(Map<String, String> env) {
        JsonObject config = new JsonObject();
        for (String key : CONFIG_KEYS) {
            String value = env.get(key);
            if (value == null) {
                value = env.get(ENV_NAMES.get(key));
            }
            if (value != null) {
                config.put(key, value);
            }
        }
        return config;
    }
}
