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

import org.eventkeel.eventstore.api.AppendEventsResult;
import org.eventkeel.eventstore.api.ConcurrencyConflictException;
import org.eventkeel.eventstore.api.ExpectedStreamVersion;
import org.eventkeel.eventstore.api.StoreUnavailableException;
import org.eventkeel.eventstore.api.StreamEvent;
import org.eventkeel.eventstore.api.StreamName;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Event stores that supports conditional, atomic, appends to an event stream should implement this interface.
 */
public interface ConditionallyAppendToEventStream {

    /**
     * Append events to a stream if the stream's current version satisfies {@code expectedVersion}. Either all events are
     * appended, in order, or none of them. Events without payload are skipped.
     * May return the following exceptions on the error track:
     *
     * <table>
     *     <tr><th>Exception</th><th>Description</th></tr>
     *     <tr><td>{@link ConcurrencyConflictException}</td><td>When the current version of the stream didn't match {@code expectedVersion}. Nothing was written.</td></tr>
     *     <tr><td>{@link StoreUnavailableException}</td><td>Any other backend failure</td></tr>
     *     <tr><td>{@link org.eventkeel.serialization.SerializationException}</td><td>If an event couldn't be serialized. Nothing was written.</td></tr>
     * </table>
     *
     * @param streamName      The name of the stream
     * @param expectedVersion The concurrency precondition
     * @param events          The events to append
     * @return The new version of the stream and the logical position of the last event
     */
    Mono<AppendEventsResult> appendEvents(StreamName streamName, ExpectedStreamVersion expectedVersion, List<StreamEvent> events);

    /**
     * A convenience function that appends events if the stream version is equal to {@code expectedVersion}.
     *
     * @see #appendEvents(StreamName, ExpectedStreamVersion, List)
     */
    default Mono<AppendEventsResult> appendEvents(StreamName streamName, long expectedVersion, List<StreamEvent> events) {
        return appendEvents(streamName, ExpectedStreamVersion.of(expectedVersion), events);
    }
}
