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

/**
 * Converts event payloads to and from their stored representation.
 */
public interface EventSerializer {

    /**
     * @param payload The event payload to serialize
     * @return The serialized event, including the event type tag
     * @throws SerializationException If the payload couldn't be serialized
     */
    SerializedEvent serializeEvent(Object payload);

    /**
     * Deserialize an event payload. This method never throws for bad input, the failure is returned as a
     * {@link DeserializationResult.Failure}.
     *
     * @param payload     The stored bytes
     * @param eventType   The event type tag that was stored together with the bytes
     * @param contentType The content type that was stored together with the bytes
     */
    DeserializationResult<Object> deserializeEvent(byte[] payload, String eventType, String contentType);

    /**
     * @return The content type that this serializer produces
     */
    String contentType();
}
