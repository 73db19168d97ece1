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
 * Status values a subscriber returns to the broker in a delivery response body.
 *
 * <ul>
 *   <li>{@link #SUCCESS} - the message was consumed</li>
 *   <li>{@link #RETRY} - the broker should redeliver the message later</li>
 *   <li>{@link #DROP} - the broker should acknowledge and discard the message</li>
 * </ul>
 */
public enum DeliveryStatus {
    SUCCESS,
    RETRY,
    DROP
}
