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

package org.eventkeel.eventstore.core;

import org.eventkeel.eventstore.api.AppendEventsResult;
import org.eventkeel.eventstore.api.ConcurrencyConflictException;
import org.eventkeel.eventstore.api.ExpectedStreamVersion;
import org.eventkeel.eventstore.api.StreamEvent;
import org.eventkeel.eventstore.api.StreamName;
import org.eventkeel.eventstore.api.StreamReadPosition;
import org.eventkeel.eventstore.api.StreamTruncatePosition;
import org.eventkeel.eventstore.api.reactor.EventStore;
import org.eventkeel.eventstore.api.reactor.spi.EventLogBackend;
import org.eventkeel.eventstore.api.reactor.spi.SerializedStreamEvent;
import org.eventkeel.eventstore.api.reactor.spi.StoredEvent;
import org.eventkeel.serialization.DeserializationResult;
import org.eventkeel.serialization.DeserializationResult.Failure;
import org.eventkeel.serialization.DeserializationResult.Success;
import org.eventkeel.serialization.EventSerializer;
import org.eventkeel.serialization.Metadata;
import org.eventkeel.serialization.MetadataSerializer;
import org.eventkeel.serialization.SerializedEvent;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventStore} that serializes events and delegates storage to an {@link EventLogBackend}. This is where
 * the serialization pipeline meets the atomic append protocol of the backend:
 * <ol>
 *     <li>Events without payload are skipped</li>
 *     <li>The payload and the metadata of each remaining event are serialized independently</li>
 *     <li>The whole batch is handed to the backend as one conditional append</li>
 * </ol>
 * Truncating and deleting streams is not supported.
 */
@NullMarked
public class SerializingEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(SerializingEventStore.class);

    private final EventLogBackend backend;
    private final EventSerializer eventSerializer;
    private final MetadataSerializer metadataSerializer;
    private final Clock clock;

    /**
     * Create a new instance of {@code SerializingEventStore} that timestamps appends using the UTC system clock.
     *
     * @param backend            The backend that stores the events
     * @param eventSerializer    The serializer to use for event payloads
     * @param metadataSerializer The serializer to use for event metadata
     */
    public SerializingEventStore(EventLogBackend backend, EventSerializer eventSerializer, MetadataSerializer metadataSerializer) {
        this(backend, eventSerializer, metadataSerializer, Clock.systemUTC());
    }

    /**
     * Create a new instance of {@code SerializingEventStore}
     *
     * @param backend            The backend that stores the events
     * @param eventSerializer    The serializer to use for event payloads
     * @param metadataSerializer The serializer to use for event metadata
     * @param clock              The clock used to timestamp appends
     */
    public SerializingEventStore(EventLogBackend backend, EventSerializer eventSerializer, MetadataSerializer metadataSerializer, Clock clock) {
        requireNonNull(backend, EventLogBackend.class.getSimpleName() + " cannot be null");
        requireNonNull(eventSerializer, EventSerializer.class.getSimpleName() + " cannot be null");
        requireNonNull(metadataSerializer, MetadataSerializer.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.backend = backend;
        this.eventSerializer = eventSerializer;
        this.metadataSerializer = metadataSerializer;
        this.clock = clock;
    }

    @Override
    public Flux<StreamEvent> readEvents(StreamName streamName, StreamReadPosition from, int count) {
        requireNonNull(streamName, StreamName.class.getSimpleName() + " cannot be null");
        requireNonNull(from, StreamReadPosition.class.getSimpleName() + " cannot be null");
        if (count <= 0) {
            return Flux.error(new IllegalArgumentException("Count must be greater than zero, was " + count));
        }
        return backend.readRange(streamName, from, count).map(storedEvent -> toStreamEvent(streamName, storedEvent));
    }

    @Override
    public Mono<Boolean> streamExists(StreamName streamName) {
        requireNonNull(streamName, StreamName.class.getSimpleName() + " cannot be null");
        return backend.exists(streamName);
    }

    @Override
    public Mono<AppendEventsResult> appendEvents(StreamName streamName, ExpectedStreamVersion expectedVersion, List<StreamEvent> events) {
        requireNonNull(streamName, StreamName.class.getSimpleName() + " cannot be null");
        requireNonNull(expectedVersion, ExpectedStreamVersion.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");

        return Mono.fromCallable(() -> serialize(events))
                .flatMap(serializedEvents -> backend.atomicAppend(streamName, expectedVersion, clock.instant(), serializedEvents))
                .doOnNext(result -> log.debug("Appended {} event(s) to stream {}, next expected version is {}", events.size(), streamName, result.nextExpectedVersion()))
                .doOnError(ConcurrencyConflictException.class, e -> log.debug("Unable to append events to stream {}: {}", streamName, e.getMessage()));
    }

    @Override
    public Mono<Void> truncateStream(StreamName streamName, StreamTruncatePosition truncatePosition, ExpectedStreamVersion expectedVersion) {
        return Mono.error(new UnsupportedOperationException("Truncating streams is not supported, cannot truncate stream " + streamName));
    }

    @Override
    public Mono<Void> deleteStream(StreamName streamName, ExpectedStreamVersion expectedVersion) {
        return Mono.error(new UnsupportedOperationException("Deleting streams is not supported, cannot delete stream " + streamName));
    }

    private List<SerializedStreamEvent> serialize(List<StreamEvent> events) {
        return events.stream()
                .filter(Objects::nonNull)
                .filter(event -> event.payload() != null)
                .map(this::serialize)
                .collect(Collectors.toList());
    }

    private SerializedStreamEvent serialize(StreamEvent event) {
        SerializedEvent serializedEvent = eventSerializer.serializeEvent(requireNonNull(event.payload()));
        byte[] metadata = metadataSerializer.serialize(event.metadata());
        return new SerializedStreamEvent(event.id(), serializedEvent.eventType(), serializedEvent.payload(), metadata, serializedEvent.contentType());
    }

    private StreamEvent toStreamEvent(StreamName streamName, StoredEvent storedEvent) {
        DeserializationResult<Object> payload = eventSerializer.deserializeEvent(storedEvent.payload(), storedEvent.eventType(), storedEvent.contentType());
        DeserializationResult<Metadata> metadata = metadataSerializer.deserialize(storedEvent.metadata());

        if (payload instanceof Failure<Object> failure) {
            return failedToRead(streamName, storedEvent, failure);
        } else if (metadata instanceof Failure<Metadata> failure) {
            return failedToRead(streamName, storedEvent, failure);
        }

        Object value = ((Success<Object>) payload).value();
        Metadata meta = ((Success<Metadata>) metadata).value();
        return StreamEvent.read(storedEvent.id(), value, meta, storedEvent.contentType(), storedEvent.position());
    }

    private static StreamEvent failedToRead(StreamName streamName, StoredEvent storedEvent, Failure<?> failure) {
        log.warn("Can't deserialize event {} of type {} at position {} in stream {}: {}", storedEvent.id(), failure.eventType(), storedEvent.position(), streamName, failure.reason());
        return StreamEvent.failedToRead(storedEvent.id(), failure, storedEvent.contentType(), storedEvent.position());
    }
}
