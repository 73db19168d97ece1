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

/**
 * Shared state of the subscriber application: one deduplicating message set per
 * {@link Topic} and the {@link BehaviorFlags} armed by the test harness.
 *
 * Implementations must be safe for concurrent use from any number of request
 * handlers. Flags are one-directional: once armed they stay armed for the
 * lifetime of the state object, and {@link #initialize()} does not clear them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public interface SubscriberState {

    /**
     * Gets a consistent snapshot of the behaviour flags.
     *
     * @return the currently armed flags
     */
    BehaviorFlags flags();

    /**
     * Arms the flag that makes every delivery fail with HTTP 500.
     */
    void armRespondWithError();

    /**
     * Arms the flag that makes every delivery answer with a RETRY status.
     */
    void armRespondWithRetry();

    /**
     * Arms the flag that makes successful deliveries answer with an empty JSON object.
     */
    void armRespondWithEmptyJson();

    /**
     * Records a delivered payload against the topic its request path resolves to.
     * Recording the same payload twice for the same topic leaves a single entry.
     *
     * @param requestPath the path the message was delivered on
     * @param payload     the message payload
     * @return whether the payload was recorded, already present, or addressed to an unknown topic
     */
    DeliveryOutcome recordDelivery(String requestPath, String payload);

    /**
     * Gets a snapshot of the messages received on every topic.
     *
     * @return the received messages
     */
    ReceivedMessages receivedMessages();

    /**
     * Clears every topic's received-message set. Behaviour flags are left as they are.
     */
    void initialize();
}
