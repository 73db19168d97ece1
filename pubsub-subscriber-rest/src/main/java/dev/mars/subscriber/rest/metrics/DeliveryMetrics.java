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

package dev.mars.subscriber.rest.metrics;

import dev.mars.subscriber.api.DeliveryStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;

/**
 * Counts delivery responses by topic and outcome.
 *
 * Outcomes are the {@link DeliveryStatus} values plus {@link #ERROR_OUTCOME}
 * for deliveries answered with HTTP 500. Deliveries to unknown routes are
 * tagged with topic {@link #UNKNOWN_TOPIC}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class DeliveryMetrics {

    public static final String DELIVERIES_METER = "subscriber.deliveries";
    public static final String ERROR_OUTCOME = "ERROR";
    public static final String UNKNOWN_TOPIC = "unknown";

    private final MeterRegistry registry;

    public DeliveryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Creates metrics backed by a Prometheus registry, so {@link #scrape()} has output.
     */
    public static DeliveryMetrics prometheus() {
        return new DeliveryMetrics(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public void recordStatus(String topic, DeliveryStatus status) {
        counter(topic, status.name()).increment();
    }

    public void recordError(String topic) {
        counter(topic, ERROR_OUTCOME).increment();
    }

    /**
     * Gets the number of deliveries counted for a topic and outcome.
     */
    public double count(String topic, String outcome) {
        Counter counter = registry.find(DELIVERIES_METER)
                .tag("topic", topic)
                .tag("status", outcome)
                .counter();
        return counter == null ? 0.0 : counter.count();
    }

    /**
     * Renders the registry in Prometheus text exposition format.
     *
     * @return the scrape output, or an empty string when the registry is not a Prometheus registry
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry) {
            return ((PrometheusMeterRegistry) registry).scrape();
        }
        return "";
    }

    private Counter counter(String topic, String outcome) {
        return Counter.builder(DELIVERIES_METER)
                .description("Delivery responses by topic and outcome")
                .tag("topic", topic == null ? UNKNOWN_TOPIC : topic)
                .tag("status", outcome)
                .register(registry);
    }
}
