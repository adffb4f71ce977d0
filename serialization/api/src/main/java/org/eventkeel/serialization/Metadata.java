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
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Metadata that is stored alongside the payload of an event, for example correlation and causation ids.
 * Instances are immutable, {@link #with(String, Object)} returns a new instance.
 */
@NullMarked
public final class Metadata {
    public static final String CORRELATION_ID = "$correlationId";
    public static final String CAUSATION_ID = "$causationId";

    private static final Metadata EMPTY = new Metadata(Collections.emptyMap());

    private final Map<String, Object> values;

    private Metadata(Map<String, Object> values) {
        this.values = values;
    }

    public static Metadata empty() {
        return EMPTY;
    }

    public static Metadata of(Map<String, ?> values) {
        requireNonNull(values, "Metadata values cannot be null");
        if (values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(requireNonNull(key, "Metadata key cannot be null"), requireNonNull(value, "Metadata value for key " + key + " cannot be null")));
        return new Metadata(Collections.unmodifiableMap(copy));
    }

    public Metadata with(String key, Object value) {
        requireNonNull(key, "Metadata key cannot be null");
        requireNonNull(value, "Metadata value cannot be null");
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new Metadata(Collections.unmodifiableMap(copy));
    }

    public Metadata withCorrelationId(String correlationId) {
        return with(CORRELATION_ID, correlationId);
    }

    public Metadata withCausationId(String causationId) {
        return with(CAUSATION_ID, causationId);
    }

    @Nullable
    public Object get(String key) {
        return values.get(key);
    }

    @Nullable
    public String getString(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Metadata)) return false;
        Metadata metadata = (Metadata) o;
        return Objects.equals(values, metadata.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", Metadata.class.getSimpleName() + "[", "]")
                .add("values=" + values)
                .toString();
    }
}
