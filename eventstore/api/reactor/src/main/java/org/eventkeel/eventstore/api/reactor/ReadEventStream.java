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

import org.eventkeel.eventstore.api.StreamEvent;
import org.eventkeel.eventstore.api.StreamName;
import org.eventkeel.eventstore.api.StreamNotFoundException;
import org.eventkeel.eventstore.api.StreamReadPosition;
import reactor.core.publisher.Flux;

/**
 * Event stores that supports reading an event stream should implement this interface.
 */
public interface ReadEventStream {

    /**
     * Read all events from a particular stream.
     *
     * @param streamName The name of the stream to read
     * @return The events of the stream in the order they were appended
     */
    default Flux<StreamEvent> readEvents(StreamName streamName) {
        return readEvents(streamName, StreamReadPosition.START, Integer.MAX_VALUE);
    }

    /**
     * Read at most {@code count} events from a stream, starting strictly after {@code from}.
     * May return the following exceptions on the error track:
     *
     * <table>
     *     <tr><th>Exception</th><th>Description</th></tr>
     *     <tr><td>{@link StreamNotFoundException}</td><td>If the backend has no record of the stream</td></tr>
     *     <tr><td>{@link org.eventkeel.eventstore.api.StoreUnavailableException}</td><td>If the backend couldn't be reached</td></tr>
     *     <tr><td>{@link org.eventkeel.eventstore.api.CorruptedEventException}</td><td>If a stored entry lacks the fields needed to read it as an event</td></tr>
     * </table>
     * <p>
     * Events that cannot be deserialized are included, see {@link StreamEvent#deserializationFailure()}.
     *
     * @param streamName The name of the stream to read
     * @param from       Read events after this position, use {@link StreamReadPosition#START} to read from the beginning
     * @param count      The maximum number of events to read, must be greater than zero
     * @return The events, ordered by position
     */
    Flux<StreamEvent> readEvents(StreamName streamName, StreamReadPosition from, int count);
}
