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

import java.util.Optional;

/**
 * The topics this subscriber listens on.
 *
 * Each topic is delivered on a route with the same name as the topic, so
 * {@code pubsub-a-topic} messages arrive on {@code POST /pubsub-a-topic}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public enum Topic {

    PUBSUB_A("pubsub-a-topic"),
    PUBSUB_B("pubsub-b-topic"),
    PUBSUB_C("pubsub-c-topic");

    private final String topicName;

    Topic(String topicName) {
        this.topicName = topicName;
    }

    /**
     * Gets the topic name as registered with the pub/sub component.
     *
     * @return the topic name
     */
    public String topicName() {
        return topicName;
    }

    /**
     * Gets the route the broker delivers this topic's messages to, without the leading slash.
     *
     * @return the delivery route
     */
    public String route() {
        return topicName;
    }

    /**
     * Gets the HTTP path of the delivery route.
     *
     * @return the route path, e.g. {@code /pubsub-a-topic}
     */
    public String path() {
        return "/" + topicName;
    }

    /**
     * Resolves the topic a request path delivers to by matching the path suffix.
     * A trailing slash is tolerated.
     *
     * @param requestPath the request path, may be null
     * @return the topic, or empty if the path does not end with a known route
     */
    public static Optional<Topic> fromPath(String requestPath) {
        if (requestPath == null || requestPath.isEmpty()) {
            return Optional.empty();
        }
        String path = requestPath.endsWith("/") && requestPath.length() > 1
                ? requestPath.substring(0, requestPath.length() - 1)
                : requestPath;
        for (Topic topic : values()) {
            if (path.endsWith(topic.topicName)) {
                return Optional.of(topic);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return topicName;
    }
}
