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

import org.eventkeel.eventstore.api.StreamName;
import org.jspecify.annotations.NullMarked;

import java.time.Clock;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Configuration for the Redis event store
 */
@NullMarked
public class RedisEventStoreConfig {
    private static final String DEFAULT_KEY_PREFIX = "";

    public final String keyPrefix;
    public final Clock clock;

    /**
     * Create an {@link RedisEventStoreConfig} where the key of each stream is the stream name and appends are timestamped using the UTC system clock.
     */
    public static RedisEventStoreConfig defaults() {
        return new Builder().build();
    }

    private RedisEventStoreConfig(String keyPrefix, Clock clock) {
        requireNonNull(keyPrefix, "Key prefix cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.keyPrefix = keyPrefix;
        this.clock = clock;
    }

    /**
     * @return The Redis key of the stream
     */
    public String streamKey(StreamName streamName) {
        return keyPrefix + streamName.value();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RedisEventStoreConfig)) return false;
        RedisEventStoreConfig that = (RedisEventStoreConfig) o;
        return Objects.equals(keyPrefix, that.keyPrefix) && Objects.equals(clock, that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyPrefix, clock);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RedisEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("keyPrefix='" + keyPrefix + "'")
                .add("clock=" + clock)
                .toString();
    }

    public static final class Builder {
        private String keyPrefix = DEFAULT_KEY_PREFIX;
        private Clock clock = Clock.systemUTC();

        /**
         * @param keyPrefix A prefix added to the stream name to form the Redis key of each stream, for example {@code "events:"}. Default is no prefix.
         * @return The builder instance
         */
        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        /**
         * @param clock The clock used to timestamp appends. The timestamp is the base of the entry ids of the appended events.
         * @return The builder instance
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RedisEventStoreConfig build() {
            return new RedisEventStoreConfig(keyPrefix, clock);
        }
    }
}
