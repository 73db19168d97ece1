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
 * Result of recording a delivered message against the received-message sets.
 *
 * Both {@link #DUPLICATE} and {@link #UNKNOWN_TOPIC} are answered with the same
 * DROP response; they are kept apart so the two cases can be logged differently.
 */
public enum DeliveryOutcome {

    /** The payload was new for its topic and has been recorded. */
    RECORDED,

    /** The payload had already been recorded for its topic. */
    DUPLICATE,

    /** The request path does not end with a known topic route. */
    UNKNOWN_TOPIC;

    public boolean isRecorded() {
        return this == RECORDED;
    }
}
