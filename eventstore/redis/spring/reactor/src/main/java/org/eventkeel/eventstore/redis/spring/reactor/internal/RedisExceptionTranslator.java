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

package org.eventkeel.eventstore.redis.spring.reactor.internal;

import org.eventkeel.eventstore.api.ConcurrencyConflictException;
import org.eventkeel.eventstore.api.EventStoreException;
import org.eventkeel.eventstore.api.ExpectedStreamVersion;
import org.eventkeel.eventstore.api.StoreUnavailableException;
import org.eventkeel.eventstore.api.StreamName;

/**
 * Translates exceptions raised by Spring Data Redis (or the underlying client) to the event store error taxonomy.
 */
public class RedisExceptionTranslator {
    /**
     * The prefix of the error reply that the append script returns when the expected version is not satisfied.
     */
    public static final String WRONG_EXPECTED_VERSION = "WrongExpectedVersion";

    private RedisExceptionTranslator() {
    }

    /**
     * Translate an exception raised while appending. An error reply from the append script saying that the expected
     * version was wrong becomes a {@link ConcurrencyConflictException}, everything else a {@link StoreUnavailableException}.
     */
    public static EventStoreException translateAppendException(StreamName streamName, ExpectedStreamVersion expectedVersion, Throwable e) {
        if (e instanceof EventStoreException) {
            return (EventStoreException) e;
        } else if (isWrongExpectedVersion(e)) {
            return new ConcurrencyConflictException(streamName, expectedVersion, e);
        }
        return new StoreUnavailableException(streamName, e);
    }

    /**
     * Translate an exception raised while reading.
     */
    public static EventStoreException translateReadException(StreamName streamName, Throwable e) {
        if (e instanceof EventStoreException) {
            return (EventStoreException) e;
        }
        return new StoreUnavailableException(streamName, e);
    }

    // The error reply is wrapped at least once (by Spring's exception translation), so look through the entire cause chain
    private static boolean isWrongExpectedVersion(Throwable e) {
        Throwable current = e;
        int depth = 0;
        while (current != null && depth < 10) {
            String message = current.getMessage();
            if (message != null && message.contains(WRONG_EXPECTED_VERSION)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
            depth++;
        }
        return false;
    }
}
