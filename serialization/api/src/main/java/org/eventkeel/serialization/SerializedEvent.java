/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventkeel.serialization;

import org.jspecify.annotations.NullMarked;

import java.util.Arrays;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * The serialized form of an event payload: the event type tag that identifies the payload type, the payload bytes
 * and the content type of the bytes.
 */
@NullMarked
public record SerializedEvent(String eventType, byte[] payload, String contentType) {

    public SerializedEvent {
        requireNonNull(eventType, "Event type cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        requireNonNull(contentType, "Content type cannot be null");
        if (eventType.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be blank");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SerializedEvent)) return false;
        SerializedEvent that = (SerializedEvent) o;
        return eventType.equals(that.eventType) && Arrays.equals(payload, that.payload) && contentType.equals(that.contentType);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(eventType, contentType) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "SerializedEvent[eventType=" + eventType + ", contentType=" + contentType + ", payload=" + payload.length + " bytes]";
    }
}
