package dev.mars.subscriber.rest.state;

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

import dev.mars.subscriber.api.BehaviorFlags;
import dev.mars.subscriber.api.DeliveryOutcome;
import dev.mars.subscriber.api.ReceivedMessages;
import dev.mars.subscriber.api.Topic;
import dev.mars.subscriber.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("InMemorySubscriberState Tests")
class InMemorySubscriberStateTest {

    private InMemorySubscriberState state;

    @BeforeEach
    void setUp() {
        state = new InMemorySubscriberState();
    }

    @Test
    @DisplayName("Starts with empty sets and no flags armed")
    void testInitialState() {
        assertEquals(BehaviorFlags.none(), state.flags());
        assertEquals(ReceivedMessages.empty(), state.receivedMessages());
    }

    @Test
    @DisplayName("Same payload twice on one topic is recorded once")
    void testDeduplication() {
        assertEquals(DeliveryOutcome.RECORDED, state.recordDelivery("/pubsub-a-topic", "hello"));
        assertEquals(DeliveryOutcome.DUPLICATE, state.recordDelivery("/pubsub-a-topic", "hello"));

        assertEquals(List.of("hello"), state.receivedMessages().forTopic(Topic.PUBSUB_A));
    }

    @Test
    @DisplayName("Same payload on different topics is recorded for each")
    void testSamePayloadDifferentTopics() {
        assertEquals(DeliveryOutcome.RECORDED, state.recordDelivery("/pubsub-a-topic", "hello"));
        assertEquals(DeliveryOutcome.RECORDED, state.recordDelivery("/pubsub-b-topic", "hello"));

        ReceivedMessages received = state.receivedMessages();
        assertEquals(List.of("hello"), received.forTopic(Topic.PUBSUB_A));
        assertEquals(List.of("hello"), received.forTopic(Topic.PUBSUB_B));
        assertEquals(List.of(), received.forTopic(Topic.PUBSUB_C));
    }

    @Test
    @DisplayName("Unknown route is reported and nothing is recorded")
    void testUnknownTopic() {
        assertEquals(DeliveryOutcome.UNKNOWN_TOPIC, state.recordDelivery("/pubsub-x-topic", "hello"));
        assertEquals(0, state.receivedMessages().totalCount());
    }

    @Test
    @DisplayName("Flags are one-directional and independent")
    void testArmFlags() {
        state.armRespondWithEmptyJson();
        assertEquals(new BehaviorFlags(false, false, true), state.flags());

        state.armRespondWithError();
        state.armRespondWithRetry();
        assertEquals(new BehaviorFlags(true, true, true), state.flags());

        state.armRespondWithError();
        assertTrue(state.flags().respondWithError());
    }

    @Test
    @DisplayName("Initialize clears every set but keeps the flags")
    void testInitializeKeepsFlags() {
        state.recordDelivery("/pubsub-a-topic", "a1");
        state.recordDelivery("/pubsub-b-topic", "b1");
        state.recordDelivery("/pubsub-c-topic", "c1");
        state.armRespondWithRetry();

        state.initialize();

        assertEquals(ReceivedMessages.empty(), state.receivedMessages());
        assertTrue(state.flags().respondWithRetry());
        assertEquals(DeliveryOutcome.RECORDED, state.recordDelivery("/pubsub-a-topic", "a1"));
    }

    @Test
    @DisplayName("Concurrent redeliveries of the same payloads leave one entry each")
    void testConcurrentDeliveries() throws Exception {
        int threads = 8;
        int payloads = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                results.add(executor.submit(() -> {
                    start.await();
                    int recorded = 0;
                    for (int i = 0; i < payloads; i++) {
                        if (state.recordDelivery("/pubsub-c-topic", "msg-" + i).isRecorded()) {
                            recorded++;
                        }
                    }
                    return recorded;
                }));
            }
            start.countDown();

            int totalRecorded = 0;
            for (Future<Integer> result : results) {
                totalRecorded += result.get(30, TimeUnit.SECONDS);
            }

            assertEquals(payloads, totalRecorded);
            assertEquals(payloads, state.receivedMessages().forTopic(Topic.PUBSUB_C).size());
        } finally {
            executor.shutdownNow();
        }
    }
}
