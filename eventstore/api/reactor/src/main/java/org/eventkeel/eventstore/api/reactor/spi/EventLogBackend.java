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

package org.eventkeel.eventstore.api.reactor.spi;

import org.eventkeel.eventstore.api.AppendEventsResult;
import org.eventkeel.eventstore.api.ConcurrencyConflictException;
import org.eventkeel.eventstore.api.ExpectedStreamVersion;
import org.eventkeel.eventstore.api.StoreUnavailableException;
import org.eventkeel.eventstore.api.StreamName;
import org.eventkeel.eventstore.api.StreamNotFoundException;
import org.eventkeel.eventstore.api.StreamReadPosition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * The narrow set of capabilities that a storage backend must offer to host an event store. Implementations deal
 * with bytes and logical positions only, serialization is done by the event store.
 * <p>
 * Implementations must be safe for concurrent use. They must not hold a client-side lock across calls: concurrent
 * appends to the same stream are resolved by {@link #atomicAppend(StreamName, ExpectedStreamVersion, Instant, List)}
 * alone.
 */
public interface EventLogBackend {

    /**
     * Read at most {@code count} events after {@code exclusiveFrom}, ordered by position.
     * Signals {@link StreamNotFoundException} if the stream doesn't exist.
     */
    Flux<StoredEvent> readRange(StreamName streamName, StreamReadPosition exclusiveFrom, int count);

    /**
     * @return {@code true} if the backend has any record of the stream
     */
    Mono<Boolean> exists(StreamName streamName);

    /**
     * Compare the current version of the stream with {@code expectedVersion} and, if it's satisfied, append all
     * {@code events} in order, as one indivisible operation. If the version is not satisfied nothing is written and
     * {@link ConcurrencyConflictException} is signalled. Other failures are signalled as {@link StoreUnavailableException}.
     *
     * @param timestamp The time to record as the append time of the events
     */
    Mono<AppendEventsResult> atomicAppend(StreamName streamName, ExpectedStreamVersion expectedVersion, Instant timestamp, List<SerializedStreamEvent> events);
}
