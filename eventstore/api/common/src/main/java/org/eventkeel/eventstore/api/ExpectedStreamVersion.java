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

import org.jspecify.annotations.NullMarked;

/**
 * The optimistic concurrency precondition of an append. Versions are zero-based, i.e. a stream with one event
 * has version {@code 0}.
 */
@NullMarked
public sealed interface ExpectedStreamVersion {
    long NO_STREAM_VALUE = -1;
    long ANY_VALUE = -2;

    /**
     * The stream must not exist.
     */
    static ExpectedStreamVersion noStream() {
        return NoStream.INSTANCE;
    }

    /**
     * Append regardless of the current version of the stream.
     */
    static ExpectedStreamVersion any() {
        return Any.INSTANCE;
    }

    /**
     * The index of the last event in the stream must be equal to {@code version}.
     */
    static ExpectedStreamVersion exactly(long version) {
        return new Value(version);
    }

    /**
     * Map a numeric version, as it's sent to a backend, to an {@code ExpectedStreamVersion}.
     */
    static ExpectedStreamVersion of(long value) {
        if (value == NO_STREAM_VALUE) {
            return noStream();
        } else if (value == ANY_VALUE) {
            return any();
        }
        return exactly(value);
    }

    /**
     * @return The numeric representation of this expected version
     */
    long value();

    /**
     * @return {@code true} if a stream whose last event index is {@code currentVersion} ({@code -1} for a stream
     * without events) satisfies this expectation.
     */
    default boolean isSatisfiedBy(long currentVersion) {
        return this instanceof Any || value() == currentVersion;
    }

    enum NoStream implements ExpectedStreamVersion {
        INSTANCE;

        @Override
        public long value() {
            return NO_STREAM_VALUE;
        }

        @Override
        public String toString() {
            return "NoStream";
        }
    }

    enum Any implements ExpectedStreamVersion {
        INSTANCE;

        @Override
        public long value() {
            return ANY_VALUE;
        }

        @Override
        public String toString() {
            return "Any";
        }
    }

    record Value(long version) implements ExpectedStreamVersion {
        public Value {
            if (version < 0) {
                throw new IllegalArgumentException("Expected stream version must be >= 0, was " + version);
            }
        }

        @Override
        public long value() {
            return version;
        }

        @Override
        public String toString() {
            return String.valueOf(version);
        }
    }
}
