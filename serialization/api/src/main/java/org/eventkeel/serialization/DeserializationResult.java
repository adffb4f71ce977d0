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

import static java.util.Objects.requireNonNull;

/**
 * The outcome of deserializing an event payload or event metadata. A failure is a value, not an exception, so that
 * a single bad event doesn't abort the read of an entire stream.
 *
 * @param <T> The type of the deserialized value
 */
@NullMarked
public sealed interface DeserializationResult<T> {

    static <T> DeserializationResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> DeserializationResult<T> failedToDeserialize(String eventType, Throwable error) {
        return new FailedToDeserialize<>(eventType, error);
    }

    static <T> DeserializationResult<T> unknownEventType(String eventType) {
        return new UnknownEventType<>(eventType);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success<T>(T value) implements DeserializationResult<T> {
        public Success {
            requireNonNull(value, "Deserialized value cannot be null");
        }
    }

    /**
     * Describes why something couldn't be deserialized.
     */
    sealed interface Failure<T> extends DeserializationResult<T> {
        String eventType();

        String reason();
    }

    /**
     * The type was known but the bytes couldn't be turned into an instance of it.
     */
    record FailedToDeserialize<T>(String eventType, Throwable error) implements Failure<T> {
        public FailedToDeserialize {
            requireNonNull(eventType, "Event type cannot be null");
            requireNonNull(error, "Error cannot be null");
        }

        @Override
        public String reason() {
            return error.getClass().getSimpleName() + ": " + error.getMessage();
        }
    }

    /**
     * There's no type registered for the event type tag.
     */
    record UnknownEventType<T>(String eventType) implements Failure<T> {
        public UnknownEventType {
            requireNonNull(eventType, "Event type cannot be null");
        }

        @Override
        public String reason() {
            return "No type is registered for event type " + eventType;
        }
    }
}
