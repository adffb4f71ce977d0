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

package org.eventkeel.eventstore.api.reactor.spi;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * An event as it's read from an {@link EventLogBackend}, before deserialization.
 *
 * @param position The logical position of the event
 */
@NullMarked
public record StoredEvent(UUID id, String eventType, byte[] payload, byte @Nullable [] metadata, String contentType, long position) {

    public StoredEvent {
        requireNonNull(id, "Event id cannot be null");
        requireNonNull(eventType, "Event type cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        requireNonNull(contentType, "Content type cannot be null");
    }
}
