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

package org.eventkeel.eventstore.api;

import org.eventkeel.serialization.DeserializationResult;
import org.eventkeel.serialization.Metadata;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * An event in a stream. Producers create events with {@link #forAppend(Object)}; the {@code position} is only present
 * (as well as the {@code contentType}) on events that have been read from a stream.
 * <p>
 * An event that was read but couldn't be deserialized has a {@code null} payload and a {@link #deserializationFailure()}
 * describing why.
 *
 * @param id          Unique id of the event
 * @param payload     The domain event, {@code null} if it's absent or couldn't be deserialized
 * @param metadata    Event metadata
 * @param contentType The content type of the stored payload, {@code null} until appended
 * @param position    The logical position of the event, {@code null} until appended
 * @param failure     Why the payload couldn't be deserialized, {@code null} otherwise
 */
@NullMarked
public record StreamEvent(UUID id, @Nullable Object payload, Metadata metadata, @Nullable String contentType, @Nullable Long position,
                          DeserializationResult.@Nullable Failure<?> failure) {

    public StreamEvent {
        requireNonNull(id, "Event id cannot be null");
        requireNonNull(metadata, Metadata.class.getSimpleName() + " cannot be null");
    }

    public static StreamEvent forAppend(@Nullable Object payload) {
        return forAppend(payload, Metadata.empty());
    }

    public static StreamEvent forAppend(@Nullable Object payload, Metadata metadata) {
        return forAppend(UUID.randomUUID(), payload, metadata);
    }

    public static StreamEvent forAppend(UUID id, @Nullable Object payload, Metadata metadata) {
        return new StreamEvent(id, payload, metadata, null, null, null);
    }

    public static StreamEvent read(UUID id, Object payload, Metadata metadata, String contentType, long position) {
        return new StreamEvent(id, payload, metadata, contentType, position, null);
    }

    public static StreamEvent failedToRead(UUID id, DeserializationResult.Failure<?> failure, String contentType, long position) {
        requireNonNull(failure, "Failure cannot be null");
        return new StreamEvent(id, null, Metadata.empty(), contentType, position, failure);
    }

    public boolean isDeserialized() {
        return failure == null;
    }

    public Optional<DeserializationResult.Failure<?>> deserializationFailure() {
        return Optional.ofNullable(failure);
    }
}
