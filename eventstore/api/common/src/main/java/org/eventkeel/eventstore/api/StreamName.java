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

import org.jspecify.annotations.NullMarked;

import static java.util.Objects.requireNonNull;

/**
 * The name of an append-only event stream, for example {@code order-1}.
 */
@NullMarked
public record StreamName(String value) {

    public StreamName {
        requireNonNull(value, "Stream name cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Stream name cannot be blank");
        }
    }

    public static StreamName of(String value) {
        return new StreamName(value);
    }

    /**
     * Create a stream name for an entity, {@code forEntity("order", "1")} returns {@code order-1}.
     */
    public static StreamName forEntity(String category, String entityId) {
        requireNonNull(category, "Category cannot be null");
        requireNonNull(entityId, "Entity id cannot be null");
        if (category.isBlank() || entityId.isBlank()) {
            throw new IllegalArgumentException("Category and entity id cannot be blank");
        }
        return new StreamName(category + "-" + entityId);
    }

    /**
     * @return The part of the stream name before the first {@code -}, or the entire name if it contains no {@code -}.
     */
    public String category() {
        int index = value.indexOf('-');
        return index < 0 ? value : value.substring(0, index);
    }

    @Override
    public String toString() {
        return value;
    }
}
