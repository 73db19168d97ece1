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

package dev.mars.subscriber.rest.state;

import dev.mars.subscriber.api.BehaviorFlags;
import dev.mars.subscriber.api.DeliveryOutcome;
import dev.mars.subscriber.api.ReceivedMessages;
import dev.mars.subscriber.api.SubscriberState;
import dev.mars.subscriber.api.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory {@link SubscriberState} guarded by a single lock.
 *
 * All three message sets and all three flags live behind the same
 * {@link ReentrantLock}. The lock is only ever held for in-memory work, never
 * across I/O, so handlers on the event loop do not block each other for long.
 *
 * One instance is created at bootstrap and shared by every handler of the
 * server; a new instance starts with empty sets and no flags armed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class InMemorySubscriberState implements SubscriberState {

    private static final Logger logger = LoggerFactory.getLogger(InMemorySubscriberState.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Topic, Set<String>> receivedByTopic = new EnumMap<>(Topic.class);
    private BehaviorFlags flags = BehaviorFlags.none();

    public InMemorySubscriberState() {
        resetSets();
    }

    @Override
    public BehaviorFlags flags() {
        lock.lock();
        try {
            return flags;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void armRespondWithError() {
        lock.lock();
        try {
            flags = flags.withRespondWithError();
        } finally {
            lock.unlock();
        }
        logger.info("Armed respond-with-error");
    }

    @Override
    public void armRespondWithRetry() {
        lock.lock();
        try {
            flags = flags.withRespondWithRetry();
        } finally {
            lock.unlock();
        }
        logger.info("Armed respond-with-retry");
    }

    @Override
    public void armRespondWithEmptyJson() {
        lock.lock();
        try {
            flags = flags.withRespondWithEmptyJson();
        } finally {
            lock.unlock();
        }
        logger.info("Armed respond-with-empty-json");
    }

    @Override
    public DeliveryOutcome recordDelivery(String requestPath, String payload) {
        Optional<Topic> topic = Topic.fromPath(requestPath);
        if (topic.isEmpty()) {
            return DeliveryOutcome.UNKNOWN_TOPIC;
        }
        lock.lock();
        try {
            boolean added = receivedByTopic.get(topic.get()).add(payload);
            return added ? DeliveryOutcome.RECORDED : DeliveryOutcome.DUPLICATE;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ReceivedMessages receivedMessages() {
        lock.lock();
        try {
            // of() copies each set before the lock is released
            return ReceivedMessages.of(receivedByTopic);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void initialize() {
        lock.lock();
        try {
            resetSets();
        } finally {
            lock.unlock();
        }
        logger.info("Received-message sets initialized");
    }

    private void resetSets() {
        for (Topic topic : Topic.values()) {
            receivedByTopic.put(topic, new HashSet<>());
        }
    }
}
