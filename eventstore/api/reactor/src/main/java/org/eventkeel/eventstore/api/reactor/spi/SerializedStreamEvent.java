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

import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * An event that is ready to be appended by an {@link EventLogBackend}.
 */
@NullMarked
public record SerializedStreamEvent(UUID id, String eventType, byte[] payload, byte[] metadata, String contentType) {

    public SerializedStreamEvent {
        requireNonNull(id, "Event id cannot be null");
        requireNonNull(eventType, "Event type cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        requireNonNull(metadata, "Metadata cannot be null");
        requireNonNull(contentType, "Content type cannot be null");
    }
}
