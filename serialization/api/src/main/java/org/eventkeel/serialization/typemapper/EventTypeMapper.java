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

package org.eventkeel.serialization.typemapper;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps between the class of an event payload and the event type tag that is stored together with the serialized payload.
 */
public interface EventTypeMapper {

    /**
     * Get the event type tag for a class.
     *
     * @param type The class of an event payload
     * @return The event type tag (never {@code null})
     * @throws UnregisteredEventTypeException If {@code type} is not known by this mapper
     */
    String getEventType(Class<?> type);

    /**
     * Get the event type tag for an instance.
     */
    default String getEventType(Object event) {
        Objects.requireNonNull(event, "Event cannot be null");
        return getEventType(event.getClass());
    }

    /**
     * @param eventType The event type tag
     * @return The class for the event type, or an empty {@code Optional} if the event type is unknown
     */
    Optional<Class<?>> getType(String eventType);
}
