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

package org.eventkeel.eventstore.api;

import org.jspecify.annotations.Nullable;

import java.util.StringJoiner;

/**
 * The expected version of an append didn't match the actual version of the stream, so no events were written.
 * This is effectively an optimistic locking exception, the caller should re-read the stream and retry. The event store
 * never retries by itself.
 */
public class ConcurrencyConflictException extends EventStoreException {
    public final StreamName streamName;
    public final ExpectedStreamVersion expectedVersion;

    public ConcurrencyConflictException(StreamName streamName, ExpectedStreamVersion expectedVersion) {
        this(streamName, expectedVersion, null);
    }

    public ConcurrencyConflictException(StreamName streamName, ExpectedStreamVersion expectedVersion, @Nullable Throwable cause) {
        super(String.format("Unable to append events to stream %s, expected version %s didn't match the current version of the stream.", streamName, expectedVersion), cause);
        this.streamName = streamName;
        this.expectedVersion = expectedVersion;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ConcurrencyConflictException.class.getSimpleName() + "[", "]")
                .add("streamName='" + streamName + "'")
                .add("expectedVersion=" + expectedVersion)
                .add("message=" + super.getMessage())
                .toString();
    }
}
