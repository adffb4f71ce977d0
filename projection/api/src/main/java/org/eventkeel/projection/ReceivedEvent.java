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

package org.eventkeel.projection;

import org.eventkeel.eventstore.api.StreamName;
import org.eventkeel.serialization.Metadata;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * An event as it's delivered to an {@link EventHandler}.
 *
 * @param eventId        The unique id of the event
 * @param eventType      The event type name it was stored with
 * @param contentType    The content type of the stored payload
 * @param stream         The stream the event belongs to
 * @param payload        The deserialized payload, {@code null} if the event could not be deserialized
 * @param metadata       The event metadata
 * @param streamPosition The logical position of the event in its stream
 * @param globalPosition The position of the event in the global log, if the subscription provides one
 */
@NullMarked
public record ReceivedEvent(String eventId, String eventType, String contentType, StreamName stream,
                            @Nullable Object payload, Metadata metadata, long streamPosition, long globalPosition) {

    public ReceivedEvent {
        requireNonNull(eventId, "Event id cannot be null");
        requireNonNull(eventType, "Event type cannot be null");
        requireNonNull(contentType, "Content type cannot be null");
        requireNonNull(stream, StreamName.class.getSimpleName() + " cannot be null");
        requireNonNull(metadata, Metadata.class.getSimpleName() + " cannot be null");
    }

    public boolean hasPayload() {
        return payload != null;
    }
}
