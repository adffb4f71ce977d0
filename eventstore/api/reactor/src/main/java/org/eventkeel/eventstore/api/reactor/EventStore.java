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

package org.eventkeel.eventstore.api.reactor;

/**
 * An append-only event store with optimistic concurrency control. All operations are lazy: nothing happens
 * until the returned publisher is subscribed to, and cancelling the subscription (for example by applying
 * {@code timeout(..)}) cancels the in-flight backend call.
 */
public interface EventStore extends ReadEventStream, ConditionallyAppendToEventStream, EventStreamExists, EventStoreOperations {
}
