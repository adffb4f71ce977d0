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

package org.eventkeel.eventstore.redis.spring.reactor;

import org.eventkeel.eventstore.api.AppendEventsResult;
import org.eventkeel.eventstore.api.CorruptedEventException;
import org.eventkeel.eventstore.api.ExpectedStreamVersion;
import org.eventkeel.eventstore.api.StreamName;
import org.eventkeel.eventstore.api.StreamNotFoundException;
import org.eventkeel.eventstore.api.StreamReadPosition;
import org.eventkeel.eventstore.api.reactor.spi.EventLogBackend;
import org.eventkeel.eventstore.api.reactor.spi.SerializedStreamEvent;
import org.eventkeel.eventstore.api.reactor.spi.StoredEvent;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.core.ReactiveRedisOperations;
import org.springframework.data.redis.core.ReactiveStreamOperations;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static org.eventkeel.eventstore.redis.spring.reactor.internal.RedisExceptionTranslator.translateAppendException;
import static org.eventkeel.eventstore.redis.spring.reactor.internal.RedisExceptionTranslator.translateReadException;
import static org.eventkeel.serialization.ContentTypes.JSON;

/**
 * An {@link EventLogBackend} that stores each event stream as a Redis Stream, using Spring Data Redis reactive support.
 * <p>
 * Appends are performed by a Lua script ({@code append_events.lua}) that checks the expected version and adds all
 * entries in one server-side invocation, so the version check and the append can't be interleaved with another
 * writer. The script is executed with {@code EVALSHA}, the first call registers it in the Redis script cache.
 * <p>
 * Reading an entry that lacks a valid {@code message_id}, {@code message_type} or {@code json_data} field fails
 * the read with a {@link CorruptedEventException} naming the entry, rather than a {@code StoreUnavailableException}.
 */
@NullMarked
public class SpringRedisEventLogBackend implements EventLogBackend {
    private static final Logger log = LoggerFactory.getLogger(SpringRedisEventLogBackend.class);

    static final String APPEND_EVENTS_SCRIPT = "org/eventkeel/eventstore/redis/spring/reactor/append_events.lua";

    static final String MESSAGE_ID = "message_id";
    static final String MESSAGE_TYPE = "message_type";
    static final String JSON_DATA = "json_data";
    static final String JSON_METADATA = "json_metadata";
    static final String CONTENT_TYPE = "content_type";

    private final ReactiveRedisOperations<String, String> redis;
    private final RedisEventStoreConfig config;
    private final RedisScript<List<Object>> appendEventsScript;

    /**
     * Create a new instance of {@code SpringRedisEventLogBackend}
     *
     * @param redis  The {@link ReactiveRedisOperations} to use. Keys, values and hash keys/values must be serialized as strings,
     *               e.g. use a {@link org.springframework.data.redis.core.ReactiveStringRedisTemplate}.
     * @param config The {@link RedisEventStoreConfig} that will be used
     */
    public SpringRedisEventLogBackend(ReactiveRedisOperations<String, String> redis, RedisEventStoreConfig config) {
        requireNonNull(redis, ReactiveRedisOperations.class.getSimpleName() + " cannot be null");
        requireNonNull(config, RedisEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.redis = redis;
        this.config = config;
        this.appendEventsScript = appendEventsScript();
        log.info("Using append script {} with sha1 {}", APPEND_EVENTS_SCRIPT, appendEventsScript.getSha1());
    }

    @Override
    public Flux<StoredEvent> readRange(StreamName streamName, StreamReadPosition exclusiveFrom, int count) {
        requireNonNull(streamName, StreamName.class.getSimpleName() + " cannot be null");
        requireNonNull(exclusiveFrom, StreamReadPosition.class.getSimpleName() + " cannot be null");
        String key = config.streamKey(streamName);
        ReactiveStreamOperations<String, String, String> streams = redis.opsForStream();
        Range<String> range = Range.rightUnbounded(Range.Bound.exclusive(RedisStreamPositionCodec.encode(exclusiveFrom)));

        return redis.hasKey(key)
                .flatMapMany(exists -> {
                    if (!exists) {
                        return Flux.<MapRecord<String, String, String>>error(new StreamNotFoundException(streamName));
                    }
                    return streams.range(key, range, Limit.limit().count(count));
                })
                .map(record -> toStoredEvent(streamName, record))
                .onErrorMap(e -> translateReadException(streamName, e));
    }

    @Override
    public Mono<Boolean> exists(StreamName streamName) {
        requireNonNull(streamName, StreamName.class.getSimpleName() + " cannot be null");
        return redis.hasKey(config.streamKey(streamName))
                .onErrorMap(e -> translateReadException(streamName, e));
    }

    @Override
    public Mono<AppendEventsResult> atomicAppend(StreamName streamName, ExpectedStreamVersion expectedVersion, Instant timestamp, List<SerializedStreamEvent> events) {
        requireNonNull(streamName, StreamName.class.getSimpleName() + " cannot be null");
        requireNonNull(expectedVersion, ExpectedStreamVersion.class.getSimpleName() + " cannot be null");
        requireNonNull(timestamp, "Timestamp cannot be null");
        requireNonNull(events, "Events cannot be null");

        List<String> keys = List.of(config.streamKey(streamName));
        List<String> args = new ArrayList<>(2 + events.size() * 5);
        args.add(String.valueOf(expectedVersion.value()));
        args.add(String.valueOf(timestamp.toEpochMilli()));
        for (SerializedStreamEvent event : events) {
            args.add(event.id().toString());
            args.add(event.eventType());
            args.add(new String(event.payload(), UTF_8));
            args.add(new String(event.metadata(), UTF_8));
            args.add(event.contentType());
        }

        return redis.execute(appendEventsScript, keys, args)
                .cast(Object.class)
                .collectList()
                .map(SpringRedisEventLogBackend::toAppendEventsResult)
                .onErrorMap(e -> translateAppendException(streamName, expectedVersion, e));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static RedisScript<List<Object>> appendEventsScript() {
        return (RedisScript) RedisScript.of(new ClassPathResource(APPEND_EVENTS_SCRIPT), List.class);
    }

    private static AppendEventsResult toAppendEventsResult(List<Object> response) {
        // Depending on the driver the script reply is emitted either as one list or element by element
        List<String> values = new ArrayList<>();
        flatten(response, values);
        if (values.size() != 2) {
            throw new IllegalStateException("Expected the append script to return [version, last entry id] but was " + values);
        }
        long nextExpectedVersion = Long.parseLong(values.get(0));
        long globalPosition = RedisStreamPositionCodec.decode(values.get(1));
        return new AppendEventsResult(globalPosition, nextExpectedVersion);
    }

    private static void flatten(Object value, List<String> values) {
        if (value instanceof List<?> list) {
            list.forEach(element -> flatten(element, values));
        } else if (value instanceof byte[] bytes) {
            values.add(new String(bytes, UTF_8));
        } else if (value instanceof ByteBuffer buffer) {
            values.add(UTF_8.decode(buffer.duplicate()).toString());
        } else {
            values.add(String.valueOf(value));
        }
    }

    static StoredEvent toStoredEvent(StreamName streamName, MapRecord<String, String, String> record) {
        Map<String, String> fields = record.getValue();
        String metadata = fields.get(JSON_METADATA);
        return new StoredEvent(
                eventId(streamName, record),
                requiredField(streamName, record, MESSAGE_TYPE),
                requiredField(streamName, record, JSON_DATA).getBytes(UTF_8),
                metadata == null ? null : metadata.getBytes(UTF_8),
                // Entries written before the content type was stored are always JSON
                fields.getOrDefault(CONTENT_TYPE, JSON),
                RedisStreamPositionCodec.decode(record.getId()));
    }

    private static UUID eventId(StreamName streamName, MapRecord<String, String, String> record) {
        String messageId = requiredField(streamName, record, MESSAGE_ID);
        try {
            return UUID.fromString(messageId);
        } catch (IllegalArgumentException e) {
            throw new CorruptedEventException(streamName, record.getId().getValue(), MESSAGE_ID + " '" + messageId + "' is not a UUID", e);
        }
    }

    private static String requiredField(StreamName streamName, MapRecord<String, String, String> record, String field) {
        String value = record.getValue().get(field);
        if (value == null) {
            throw new CorruptedEventException(streamName, record.getId().getValue(), "no " + field + " field");
        }
        return value;
    }
}
