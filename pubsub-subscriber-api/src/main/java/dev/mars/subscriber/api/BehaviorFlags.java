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
 * Snapshot of the switches that change how deliveries are answered.
 *
 * @param respondWithError     Answer every delivery with HTTP 500
 * @param respondWithRetry     Answer every delivery with a RETRY status
 * @param respondWithEmptyJson Answer successful deliveries with a bare {@code {}}
 */
public record BehaviorFlags(
    boolean respondWithError,
    boolean respondWithRetry,
    boolean respondWithEmptyJson
) {

    private static final BehaviorFlags NONE = new BehaviorFlags(false, false, false);

    /**
     * Flags as they are when the application starts: nothing armed.
     */
    public static BehaviorFlags none() {
        return NONE;
    }

    public BehaviorFlags withRespondWithError() {
        return new BehaviorFlags(true, respondWithRetry, respondWithEmptyJson);
    }

    public BehaviorFlags withRespondWithRetry() {
        return new BehaviorFlags(respondWithError, true, respondWithEmptyJson);
    }

    public BehaviorFlags withRespondWithEmptyJson() {
        return new BehaviorFlags(respondWithError, respondWithRetry, true);
    }
}
