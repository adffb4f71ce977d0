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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventkeel.serialization.DeserializationResult;
import org.eventkeel.serialization.Metadata;
import org.eventkeel.serialization.MetadataSerializer;
import org.eventkeel.serialization.SerializationException;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Serializes {@link Metadata} as a JSON object.
 */
@NullMarked
public class JacksonMetadataSerializer implements MetadataSerializer {
    static final String METADATA_TYPE = "$metadata";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JacksonMetadataSerializer(ObjectMapper objectMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] serialize(Metadata metadata) {
        requireNonNull(metadata, Metadata.class.getSimpleName() + " cannot be null");
        try {
            return objectMapper.writeValueAsBytes(metadata.asMap());
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize metadata", e);
        }
    }

    @Override
    public DeserializationResult<Metadata> deserialize(byte @Nullable [] bytes) {
        if (bytes == null || bytes.length == 0) {
            return DeserializationResult.success(Metadata.empty());
        }

        try {
            Map<String, Object> values = objectMapper.readValue(bytes, MAP_TYPE);
            return DeserializationResult.success(values == null ? Metadata.empty() : Metadata.of(values));
        } catch (IOException | RuntimeException e) {
            return DeserializationResult.failedToDeserialize(METADATA_TYPE, e);
        }
    }
}
