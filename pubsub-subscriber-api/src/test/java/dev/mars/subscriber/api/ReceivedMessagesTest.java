package dev.mars.subscriber.api;

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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReceivedMessages Tests")
class ReceivedMessagesTest {

    @Test
    @DisplayName("Missing topics map to empty lists")
    void testEmpty() {
        ReceivedMessages empty = ReceivedMessages.empty();

        for (Topic topic : Topic.values()) {
            assertEquals(List.of(), empty.forTopic(topic));
        }
        assertEquals(0, empty.totalCount());
    }

    @Test
    @DisplayName("Messages are sorted per topic")
    void testSorted() {
        ReceivedMessages received = ReceivedMessages.of(Map.of(
            Topic.PUBSUB_A, Set.of("c", "a", "b"),
            Topic.PUBSUB_C, List.of("z", "y")));

        assertEquals(List.of("a", "b", "c"), received.forTopic(Topic.PUBSUB_A));
        assertEquals(List.of(), received.forTopic(Topic.PUBSUB_B));
        assertEquals(List.of("y", "z"), received.forTopic(Topic.PUBSUB_C));
        assertEquals(5, received.totalCount());
    }

    @Test
    @DisplayName("Snapshot does not follow later changes to the source")
    void testSnapshotIsDetached() {
        List<String> source = new ArrayList<>(List.of("hello"));
        ReceivedMessages received = ReceivedMessages.of(Map.of(Topic.PUBSUB_A, source));

        source.add("world");

        assertEquals(List.of("hello"), received.forTopic(Topic.PUBSUB_A));
        assertThrows(UnsupportedOperationException.class,
            () -> received.forTopic(Topic.PUBSUB_A).add("x"));
    }

    @Test
    @DisplayName("Topic name map keeps topic order")
    void testTopicNameMap() {
        ReceivedMessages received = ReceivedMessages.of(Map.of(Topic.PUBSUB_B, Set.of("m")));

        Map<String, List<String>> byName = received.asTopicNameMap();

        assertEquals(List.of("pubsub-a-topic", "pubsub-b-topic", "pubsub-c-topic"), new ArrayList<>(byName.keySet()));
        assertEquals(List.of("m"), byName.get("pubsub-b-topic"));
    }
}
