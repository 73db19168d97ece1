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

package dev.mars.subscriber.api;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the messages received on every topic.
 *
 * Each topic's messages are sorted in natural string order. A topic with no
 * messages maps to an empty list, never to null.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public final class ReceivedMessages {

    private final Map<Topic, List<String>> messagesByTopic;

    private ReceivedMessages(Map<Topic, List<String>> messagesByTopic) {
        this.messagesByTopic = messagesByTopic;
    }

    /**
     * Creates a snapshot from per-topic message collections. Topics missing from
     * the map are treated as having received nothing.
     *
     * @param messages the messages received per topic
     * @return a sorted, immutable snapshot
     */
    public static ReceivedMessages of(Map<Topic, ? extends Collection<String>> messages) {
        Map<Topic, List<String>> sorted = new EnumMap<>(Topic.class);
        for (Topic topic : Topic.values()) {
            Collection<String> received = messages.get(topic);
            sorted.put(topic, received == null
                ? List.of()
                : received.stream().sorted().toList());
        }
        return new ReceivedMessages(sorted);
    }

    public static ReceivedMessages empty() {
        return of(Map.of());
    }

    /**
     * Gets the messages received on a topic.
     */
    public List<String> forTopic(Topic topic) {
        return messagesByTopic.get(topic);
    }

    /**
     * Total number of distinct messages across all topics.
     */
    public int totalCount() {
        return messagesByTopic.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Returns the snapshot keyed by topic name, in topic declaration order, ready
     * to be written as the {@code /tests/get} response body.
     */
    public Map<String, List<String>> asTopicNameMap() {
        Map<String, List<String>> byName = new LinkedHashMap<>();
        messagesByTopic.forEach((topic, messages) -> byName.put(topic.topicName(), messages));
        return byName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReceivedMessages)) return false;
        return messagesByTopic.equals(((ReceivedMessages) o).messagesByTopic);
    }

    @Override
    public int hashCode() {
        return messagesByTopic.hashCode();
    }

    @Override
    public String toString() {
        return "ReceivedMessages" + asTopicNameMap();
    }
}
