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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A programmatic subscription returned to the sidecar from {@code GET /dapr/subscribe}.
 *
 * @param pubsubName The name of the pub/sub component
 * @param topic      The topic to subscribe to
 * @param route      The route messages for the topic are delivered to
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public record SubscriptionDescriptor(
    @JsonProperty("pubsubname") String pubsubName,
    @JsonProperty("topic") String topic,
    @JsonProperty("route") String route
) {

    public SubscriptionDescriptor {
        Objects.requireNonNull(pubsubName, "pubsubName must not be null");
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(route, "route must not be null");
    }

    /**
     * Creates the descriptor for a single topic.
     */
    public static SubscriptionDescriptor of(String pubsubName, Topic topic) {
        return new SubscriptionDescriptor(pubsubName, topic.topicName(), topic.route());
    }

    /**
     * Creates the descriptors for every topic, in declaration order.
     *
     * @param pubsubName the pub/sub component all topics belong to
     * @return one descriptor per {@link Topic}
     */
    public static List<SubscriptionDescriptor> forAllTopics(String pubsubName) {
        return Arrays.stream(Topic.values())
            .map(topic -> of(pubsubName, topic))
            .toList();
    }
}
