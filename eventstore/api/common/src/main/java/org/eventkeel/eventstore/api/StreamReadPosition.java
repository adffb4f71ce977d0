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
 * A read cursor in a stream, expressed as a logical position. Reads return events strictly after the position.
 * {@link #START} means "before the first event".
 */
@NullMarked
public record StreamReadPosition(long value) {
    public static final StreamReadPosition START = new StreamReadPosition(0);

    public static StreamReadPosition of(long value) {
        return value == 0 ? START : new StreamReadPosition(value);
    }

    public boolean isStart() {
        return value == 0;
    }

    @Override
    public String toString() {
        return isStart() ? "Start" : Long.toUnsignedString(value);
    }
}
