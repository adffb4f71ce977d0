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
import org.eventkeel.eventstore.api.StreamName;
import org.eventkeel.eventstore.api.StreamNotFoundException;
import org.eventkeel.eventstore.api.StreamReadPosition;
import org.eventkeel.eventstore.api.reactor.spi.SerializedStreamEvent;
import org.eventkeel.eventstore.api.reactor.spi.StoredEvent;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.eventkeel.eventstore.api.ExpectedStreamVersion.any;
import static org.eventkeel.eventstore.api.ExpectedStreamVersion.exactly;
import static org.eventkeel.eventstore.api.ExpectedStreamVersion.noStream;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryEventLogBackendTest {

    private static final StreamName STREAM = StreamName.of("order-1");

    private final InMemoryEventLogBackend backend = new InMemoryEventLogBackend();

    @Test
    void positions_are_global_and_start_at_one() {
        // When
        AppendEventsResult first = backend.atomicAppend(STREAM, noStream(), Instant.now(), List.of(event("a"), event("b"))).block();
        AppendEventsResult second = backend.atomicAppend(StreamName.of("order-2"), noStream(), Instant.now(), List.of(event("c"))).block();

        // Then
        assertThat(backend.readRange(STREAM, StreamReadPosition.START, 10).map(StoredEvent::position).collectList().block()).containsExactly(1L, 2L);
        assertThat(first).isEqualTo(new AppendEventsResult(2, 1));
        assertThat(second).isEqualTo(new AppendEventsResult(3, 0));
    }

    @Test
    void conflicting_append_stores_nothing() {
        // Given
        backend.atomicAppend(STREAM, noStream(), Instant.now(), List.of(event("a"))).block();

        // When
        Throwable throwable = catchThrowable(() -> backend.atomicAppend(STREAM, exactly(3), Instant.now(), List.of(event("b"), event("c"))).block());

        // Then
        assertThat(throwable).isInstanceOf(ConcurrencyConflictException.class);
        assertThat(backend.readRange(STREAM, StreamReadPosition.START, 10).count().block()).isEqualTo(1);
    }

    @Test
    void read_range_of_a_missing_stream_fails_with_stream_not_found() {
        // When
        Throwable throwable = catchThrowable(() -> backend.readRange(STREAM, StreamReadPosition.START, 10).blockLast());

        // Then
        assertThat(throwable).isInstanceOf(StreamNotFoundException.class);
    }

    @Test
    void only_one_of_many_concurrent_writers_expecting_the_same_version_succeeds() {
        // Given
        backend.atomicAppend(STREAM, noStream(), Instant.now(), List.of(event("initial"))).block();

        // When
        List<Boolean> outcomes = Flux.range(0, 20)
                .flatMap(i -> backend.atomicAppend(STREAM, exactly(0), Instant.now(), List.of(event("writer-" + i), event("writer-" + i)))
                        .subscribeOn(Schedulers.parallel())
                        .map(__ -> true)
                        .onErrorResume(ConcurrencyConflictException.class, __ -> Mono.just(false)))
                .collectList()
                .block();

        // Then
        assertThat(outcomes.stream().filter(Boolean::booleanValue).count()).isEqualTo(1);
        List<String> types = backend.readRange(STREAM, StreamReadPosition.START, 100).map(StoredEvent::eventType).collectList().block();
        assertThat(types).hasSize(3);
        assertThat(types.get(1)).isEqualTo(types.get(2));
    }

    @Test
    void concurrent_writers_using_any_never_lose_events() {
        // When
        Flux.range(0, 50)
                .flatMap(i -> backend.atomicAppend(STREAM, any(), Instant.now(), List.of(event("writer-" + i))).subscribeOn(Schedulers.parallel()))
                .blockLast();

        // Then
        List<StoredEvent> events = backend.readRange(STREAM, StreamReadPosition.START, 100).collectList().block();
        assertThat(events).hasSize(50);
        assertThat(events.stream().map(StoredEvent::position).collect(Collectors.toList())).isSorted().doesNotHaveDuplicates();
    }

    private static SerializedStreamEvent event(String type) {
        return new SerializedStreamEvent(UUID.randomUUID(), type, "{}".getBytes(UTF_8), "{}".getBytes(UTF_8), "application/json");
    }
}
