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

import com.mongodb.reactivestreams.client.MongoCollection;
import org.bson.conversions.Bson;
import org.eventkeel.projection.ReceivedEvent;
import org.reactivestreams.Publisher;

import java.util.function.BiFunction;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * What a {@link MongoProjection} should do for a received event.
 *
 * @param <T> The read-model document type
 */
public sealed interface Operation<T> permits Operation.NoOp, Operation.Update, Operation.CollectionOperation, Operation.OtherOperation {

    static <T> Operation<T> noOp() {
        return new NoOp<>();
    }

    /**
     * The event is of no interest to the projection
     */
    record NoOp<T>() implements Operation<T> {
    }

    /**
     * Upsert the document matching {@code filter} with {@code update}. The projection adds the assignment of
     * {@link ProjectedDocument#POSITION} itself.
     */
    record Update<T>(Bson filter, Bson update) implements Operation<T> {
        public Update {
            requireNonNull(filter, "Filter cannot be null");
            requireNonNull(update, "Update cannot be null");
        }
    }

    /**
     * Run an arbitrary command against the projection's collection. All emitted elements are consumed.
     */
    record CollectionOperation<T>(BiFunction<MongoCollection<T>, ReceivedEvent, Publisher<?>> execute) implements Operation<T> {
        public CollectionOperation {
            requireNonNull(execute, "Collection operation cannot be null");
        }
    }

    /**
     * Run an action that isn't tied to the projection's collection, e.g. a call to another service.
     */
    record OtherOperation<T>(Supplier<Publisher<?>> execute) implements Operation<T> {
        public OtherOperation {
            requireNonNull(execute, "Operation cannot be null");
        }
    }
}
