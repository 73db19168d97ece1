package dev.mars.subscriber.rest.metrics;

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

import dev.mars.subscriber.api.DeliveryStatus;
import dev.mars.subscriber.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("DeliveryMetrics Tests")
class DeliveryMetricsTest {

    @Test
    @DisplayName("Counts by topic and outcome")
    void testCounting() {
        DeliveryMetrics metrics = new DeliveryMetrics(new SimpleMeterRegistry());

        metrics.recordStatus("pubsub-a-topic", DeliveryStatus.SUCCESS);
        metrics.recordStatus("pubsub-a-topic", DeliveryStatus.SUCCESS);
        metrics.recordStatus("pubsub-a-topic", DeliveryStatus.DROP);
        metrics.recordError("pubsub-b-topic");

        assertEquals(2.0, metrics.count("pubsub-a-topic", "SUCCESS"));
        assertEquals(1.0, metrics.count("pubsub-a-topic", "DROP"));
        assertEquals(1.0, metrics.count("pubsub-b-topic", DeliveryMetrics.ERROR_OUTCOME));
        assertEquals(0.0, metrics.count("pubsub-c-topic", "SUCCESS"));
    }

    @Test
    @DisplayName("Null topic is counted as unknown")
    void testUnknownTopic() {
        DeliveryMetrics metrics = new DeliveryMetrics(new SimpleMeterRegistry());

        metrics.recordStatus(null, DeliveryStatus.DROP);

        assertEquals(1.0, metrics.count(DeliveryMetrics.UNKNOWN_TOPIC, "DROP"));
    }

    @Test
    @DisplayName("Prometheus scrape includes the delivery counter")
    void testPrometheusScrape() {
        DeliveryMetrics metrics = DeliveryMetrics.prometheus();

        metrics.recordStatus("pubsub-c-topic", DeliveryStatus.RETRY);

        String scrape = metrics.scrape();
        assertTrue(scrape.contains("subscriber_deliveries_total"), scrape);
        assertTrue(scrape.contains("topic=\"pubsub-c-topic\""), scrape);
        assertTrue(scrape.contains("status=\"RETRY\""), scrape);
    }

    @Test
    @DisplayName("Non-Prometheus registry scrapes to an empty string")
    void testScrapeWithoutPrometheus() {
        assertEquals("", new DeliveryMetrics(new SimpleMeterRegistry()).scrape());
    }
}
