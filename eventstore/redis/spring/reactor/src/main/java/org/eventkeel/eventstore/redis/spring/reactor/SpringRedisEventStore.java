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

import org.eventkeel.eventstore.core.SerializingEventStore;
import org.eventkeel.serialization.EventSerializer;
import org.eventkeel.serialization.MetadataSerializer;
import org.springframework.data.redis.core.ReactiveRedisOperations;

/**
 * An {@link org.eventkeel.eventstore.api.reactor.EventStore} that stores events in Redis Streams using Spring Data Redis.
 *
 * @see SpringRedisEventLogBackend
 */
public class SpringRedisEventStore extends SerializingEventStore {

    /**
     * Create a new instance of {@code SpringRedisEventStore} using {@link RedisEventStoreConfig#defaults()}
     *
     * @param redis              The {@link ReactiveRedisOperations} that the event store will use
     * @param eventSerializer    The serializer to use for event payloads
     * @param metadataSerializer The serializer to use for event metadata
     */
    public SpringRedisEventStore(ReactiveRedisOperations<String, String> redis, EventSerializer eventSerializer, MetadataSerializer metadataSerializer) {
        this(redis, eventSerializer, metadataSerializer, RedisEventStoreConfig.defaults());
    }

    /**
     * Create a new instance of {@code SpringRedisEventStore}
     *
     * @param redis              The {@link ReactiveRedisOperations} that the event store will use
     * @param eventSerializer    The serializer to use for event payloads
     * @param metadataSerializer The serializer to use for event metadata
     * @param config             The {@link RedisEventStoreConfig} that will be used
     */
    public SpringRedisEventStore(ReactiveRedisOperations<String, String> redis, EventSerializer eventSerializer, MetadataSerializer metadataSerializer, RedisEventStoreConfig config) {
        super(new SpringRedisEventLogBackend(redis, config), eventSerializer, metadataSerializer, config.clock);
    }
}
