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

package org.eventkeel.eventstore.inmemory;

import org.eventkeel.eventstore.api.AppendEventsResult;
import org.eventkeel.eventstore.api.ConcurrencyConflictException;
import org.eventkeel.eventstore.api.ExpectedStreamVersion;
import org.eventkeel.eventstore.api.StreamName;
import org.eventkeel.eventstore.api.StreamNotFoundException;
import org.eventkeel.eventstore.api.StreamReadPosition;
import org.eventkeel.eventstore.api.reactor.spi.EventLogBackend;
import org.eventkeel.eventstore.api.reactor.spi.SerializedStreamEvent;
import org.eventkeel.eventstore.api.reactor.spi.StoredEvent;
import org.jspecify.annotations.NullMarked;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * An in-memory {@link EventLogBackend}. Streams are immutable lists that are replaced atomically on append, so readers
 * never see a partially applied batch. Logical positions are global and start at {@code 1}.
 * <p>
 * Useful for tests and for applications that don't need durability.
 */
@NullMarked
public class InMemoryEventLogBackend implements EventLogBackend {

    private final Map<StreamName, List<StoredEvent>> streams = new ConcurrentHashMap<>();
    private final AtomicLong globalPosition = new AtomicLong();

    @Override
    public Flux<StoredEvent> readRange(StreamName streamName, StreamReadPosition exclusiveFrom, int count) {
        requireNonNull(streamName, StreamName.class.getSimpleName() + " cannot be null");
        requireNonNull(exclusiveFrom, StreamReadPosition.class.getSimpleName() + " cannot be null");
        return Flux.defer(() -> {
            List<StoredEvent> events = streams.get(streamName);
            if (events == null) {
                return Flux.<StoredEvent>error(new StreamNotFoundException(streamName));
            }
            return Flux.fromIterable(events)
                    .filter(event -> Long.compareUnsigned(event.position(), exclusiveFrom.value()) > 0)
                    .take(count);
        });
    }

    @Override
    public Mono<Boolean> exists(StreamName streamName) {
        requireNonNull(streamName, StreamName.class.getSimpleName() + " cannot be null");
        return Mono.fromSupplier(() -> streams.containsKey(streamName));
    }

    @Override
    public Mono<AppendEventsResult> atomicAppend(StreamName streamName, ExpectedStreamVersion expectedVersion, Instant timestamp, List<SerializedStreamEvent> events) {
        requireNonNull(streamName, StreamName.class.getSimpleName() + " cannot be null");
        requireNonNull(expectedVersion, ExpectedStreamVersion.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        return Mono.fromCallable(() -> append(streamName, expectedVersion, List.copyOf(events)));
    }

    private AppendEventsResult append(StreamName streamName, ExpectedStreamVersion expectedVersion, List<SerializedStreamEvent> events) {
        AtomicReference<AppendEventsResult> result = new AtomicReference<>();
        // compute is atomic per key, this is what makes the version check and the append indivisible
        streams.compute(streamName, (__, currentEvents) -> {
            long currentVersion = currentEvents == null ? ExpectedStreamVersion.NO_STREAM_VALUE : currentEvents.size() - 1;
            if (!expectedVersion.isSatisfiedBy(currentVersion)) {
                throw new ConcurrencyConflictException(streamName, expectedVersion);
            }

            if (events.isEmpty()) {
                long lastPosition = currentEvents == null || currentEvents.isEmpty() ? 0 : currentEvents.get(currentEvents.size() - 1).position();
                result.set(new AppendEventsResult(lastPosition, currentVersion));
                return currentEvents;
            }

            List<StoredEvent> newEvents = currentEvents == null ? new ArrayList<>() : new ArrayList<>(currentEvents);
            long lastPosition = 0;
            for (SerializedStreamEvent event : events) {
                lastPosition = globalPosition.incrementAndGet();
                newEvents.add(new StoredEvent(event.id(), event.eventType(), event.payload(), event.metadata(), event.contentType(), lastPosition));
            }
            result.set(new AppendEventsResult(lastPosition, newEvents.size() - 1));
            return Collections.unmodifiableList(newEvents);
        });
        return result.get();
    }
}
