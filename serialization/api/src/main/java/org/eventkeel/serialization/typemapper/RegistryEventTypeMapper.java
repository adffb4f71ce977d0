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

import org.jspecify.annotations.NullMarked;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventTypeMapper} with explicit registrations. Each class maps to exactly one event type and vice versa.
 * Registration is thread-safe, but you typically register all event types once when the application starts.
 * <p>
 * Use {@link #registerSimpleName(Class)} to use the simple class name as event type. The fully-qualified class name is
 * never used implicitly since renaming or moving a class would then break existing streams.
 */
@NullMarked
public class RegistryEventTypeMapper implements EventTypeMapper {

    private final Map<Class<?>, String> typeToName = new ConcurrentHashMap<>();
    private final Map<String, Class<?>> nameToType = new ConcurrentHashMap<>();

    /**
     * Register {@code type} with the given {@code eventType}.
     *
     * @return The same {@code RegistryEventTypeMapper} instance
     * @throws IllegalArgumentException If the type or event type is already registered with another mapping
     */
    public synchronized RegistryEventTypeMapper register(Class<?> type, String eventType) {
        requireNonNull(type, "Type cannot be null");
        requireNonNull(eventType, "Event type cannot be null");
        if (eventType.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be blank");
        }

        String existingName = typeToName.get(type);
        if (existingName != null && !existingName.equals(eventType)) {
            throw new IllegalArgumentException("Type " + type.getName() + " is already registered as " + existingName);
        }
        Class<?> existingType = nameToType.get(eventType);
        if (existingType != null && !existingType.equals(type)) {
            throw new IllegalArgumentException("Event type " + eventType + " is already registered for " + existingType.getName());
        }

        typeToName.put(type, eventType);
        nameToType.put(eventType, type);
        return this;
    }

    public RegistryEventTypeMapper registerSimpleName(Class<?> type) {
        requireNonNull(type, "Type cannot be null");
        return register(type, type.getSimpleName());
    }

    @Override
    public String getEventType(Class<?> type) {
        requireNonNull(type, "Type cannot be null");
        String eventType = typeToName.get(type);
        if (eventType == null) {
            throw new UnregisteredEventTypeException(type);
        }
        return eventType;
    }

    @Override
    public Optional<Class<?>> getType(String eventType) {
        requireNonNull(eventType, "Event type cannot be null");
        return Optional.ofNullable(nameToType.get(eventType));
    }

    public boolean isRegistered(Class<?> type) {
        return typeToName.containsKey(type);
    }
}
