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

package org.eventkeel.serialization.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventkeel.serialization.DeserializationResult;
import org.eventkeel.serialization.EventSerializer;
import org.eventkeel.serialization.SerializationException;
import org.eventkeel.serialization.SerializedEvent;
import org.eventkeel.serialization.UnsupportedContentTypeException;
import org.eventkeel.serialization.typemapper.EventTypeMapper;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static org.eventkeel.serialization.ContentTypes.JSON;

/**
 * An {@link EventSerializer} that uses a Jackson {@link ObjectMapper} to serialize event payloads to JSON (content type {@value org.eventkeel.serialization.ContentTypes#JSON}).
 * The event type tag is resolved by the supplied {@link EventTypeMapper}.
 */
@NullMarked
public class JacksonEventSerializer implements EventSerializer {
    private static final Logger log = LoggerFactory.getLogger(JacksonEventSerializer.class);

    private final ObjectMapper objectMapper;
    private final EventTypeMapper eventTypeMapper;
    private final String contentType;

    /**
     * Create a new instance of the {@link JacksonEventSerializer} using content type {@value org.eventkeel.serialization.ContentTypes#JSON}.
     *
     * @param objectMapper    The ObjectMapper instance to use
     * @param eventTypeMapper The event type mapper that maps payload classes to and from event type tags
     * @see Builder The Builder for more advanced configuration
     */
    public JacksonEventSerializer(ObjectMapper objectMapper, EventTypeMapper eventTypeMapper) {
        this(objectMapper, eventTypeMapper, JSON);
    }

    private JacksonEventSerializer(ObjectMapper objectMapper, EventTypeMapper eventTypeMapper, String contentType) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(eventTypeMapper, EventTypeMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(contentType, "contentType cannot be null");
        this.objectMapper = objectMapper;
        this.eventTypeMapper = eventTypeMapper;
        this.contentType = contentType;
    }

    @Override
    public SerializedEvent serializeEvent(Object payload) {
        requireNonNull(payload, "Payload cannot be null");
        String eventType = eventTypeMapper.getEventType(payload);
        try {
            return new SerializedEvent(eventType, objectMapper.writeValueAsBytes(payload), contentType);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize event of type " + eventType, e);
        }
    }

    @Override
    public DeserializationResult<Object> deserializeEvent(byte[] payload, String eventType, String contentType) {
        requireNonNull(eventType, "Event type cannot be null");
        if (!this.contentType.equals(contentType)) {
            return DeserializationResult.failedToDeserialize(eventType, new UnsupportedContentTypeException(contentType, this.contentType));
        }

        Optional<Class<?>> type = eventTypeMapper.getType(eventType);
        if (type.isEmpty()) {
            log.debug("No type registered for event type {}", eventType);
            return DeserializationResult.unknownEventType(eventType);
        }

        try {
            Object value = objectMapper.readValue(requireNonNull(payload, "Payload cannot be null"), type.get());
            if (value == null) {
                return DeserializationResult.failedToDeserialize(eventType, new IllegalArgumentException("Payload of event type " + eventType + " deserialized to null"));
            }
            return DeserializationResult.success(value);
        } catch (IOException | RuntimeException e) {
            return DeserializationResult.failedToDeserialize(eventType, e);
        }
    }

    @Override
    public String contentType() {
        return contentType;
    }

    public static final class Builder {
        private final ObjectMapper objectMapper;
        private final EventTypeMapper eventTypeMapper;
        private String contentType = JSON;

        public Builder(ObjectMapper objectMapper, EventTypeMapper eventTypeMapper) {
            this.objectMapper = objectMapper;
            this.eventTypeMapper = eventTypeMapper;
        }

        /**
         * @param contentType Specify the content type to write for each event. It must be a JSON content type, for example {@code application/vnd.order+json}.
         */
        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        /**
         * @return A {@link JacksonEventSerializer} instance with the configured settings
         */
        public JacksonEventSerializer build() {
            return new JacksonEventSerializer(objectMapper, eventTypeMapper, contentType);
        }
    }
}
