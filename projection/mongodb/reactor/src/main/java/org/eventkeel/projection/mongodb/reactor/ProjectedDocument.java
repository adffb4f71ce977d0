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

package org.eventkeel.projection.mongodb.reactor;

import org.bson.codecs.pojo.annotations.BsonId;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Base class for read-model documents maintained by a {@link MongoProjection}. The {@code position} property is owned
 * by the projection: it's the stream position of the last event that was applied to the document and must not be
 * written by the projection's own operations.
 * <p>
 * Subclasses are mapped with the MongoDB POJO codec, so they need a public no-arg constructor and getters/setters
 * for all persisted properties.
 */
public abstract class ProjectedDocument {
    public static final String ID = "_id";
    public static final String POSITION = "position";

    @BsonId
    private String id;
    @Nullable
    private Long position;

    protected ProjectedDocument() {
    }

    protected ProjectedDocument(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    @Nullable
    public Long getPosition() {
        return position;
    }

    public void setPosition(@Nullable Long position) {
        this.position = position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectedDocument)) return false;
        ProjectedDocument that = (ProjectedDocument) o;
        return Objects.equals(id, that.id) && Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, position);
    }
}
