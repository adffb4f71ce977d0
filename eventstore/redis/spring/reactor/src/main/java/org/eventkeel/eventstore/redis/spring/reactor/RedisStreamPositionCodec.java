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

import org.eventkeel.eventstore.api.InvalidStreamPositionException;
import org.eventkeel.eventstore.api.StreamReadPosition;
import org.jspecify.annotations.Nullable;
import org.springframework.data.redis.connection.stream.RecordId;

/**
 * Converts between Redis stream entry ids ({@code <major>-<minor>}, where major is a millisecond timestamp and minor a
 * sequence number within the same millisecond) and logical positions.
 * <p>
 * A logical position {@code P} is {@code major * 10 + minor}, i.e. {@code 1676151360658-3} is {@code 16761513606583}.
 * The packing only works if {@code minor} never exceeds {@code 9}, which is why the append script allocates entry ids
 * itself rather than letting Redis do it. Positions are treated as unsigned 64-bit values.
 */
public final class RedisStreamPositionCodec {
    static final int RADIX = 10;

    /**
     * The native position that precedes every entry of a stream. Redis never assigns {@code 0-0} to an entry.
     */
    public static final String START = "0-0";

    private RedisStreamPositionCodec() {
    }

    /**
     * {@code 16761513606580 -> 1676151360658-0}
     */
    public static String encode(long logicalPosition) {
        return Long.toUnsignedString(Long.divideUnsigned(logicalPosition, RADIX)) + "-" + Long.remainderUnsigned(logicalPosition, RADIX);
    }

    public static String encode(StreamReadPosition position) {
        return position.isStart() ? START : encode(position.value());
    }

    /**
     * {@code 1676151360658-0 -> 16761513606580}
     *
     * @throws InvalidStreamPositionException If {@code nativePosition} is not a valid entry id that fits the packing
     */
    public static long decode(@Nullable String nativePosition) {
        if (nativePosition == null) {
            throw new InvalidStreamPositionException(null, "position is missing");
        }

        int separator = nativePosition.indexOf('-');
        if (separator < 0 || separator != nativePosition.lastIndexOf('-')) {
            throw new InvalidStreamPositionException(nativePosition, "expected exactly two parts separated by '-'");
        }

        long major = parsePart(nativePosition, nativePosition.substring(0, separator));
        long minor = parsePart(nativePosition, nativePosition.substring(separator + 1));
        if (minor >= RADIX) {
            throw new InvalidStreamPositionException(nativePosition, "sequence number must be less than " + RADIX);
        }
        if (Long.compareUnsigned(major, Long.divideUnsigned(-1L, RADIX)) > 0) {
            throw new InvalidStreamPositionException(nativePosition, "position is too large");
        }

        long position = major * RADIX + minor;
        if (Long.compareUnsigned(position, major) < 0) {
            throw new InvalidStreamPositionException(nativePosition, "position is too large");
        }
        return position;
    }

    public static long decode(RecordId recordId) {
        return decode(recordId.getValue());
    }

    private static long parsePart(String nativePosition, String part) {
        if (part.isEmpty()) {
            throw new InvalidStreamPositionException(nativePosition, "empty part");
        }
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c < '0' || c > '9') {
                throw new InvalidStreamPositionException(nativePosition, "'" + part + "' is not a number");
            }
        }
        try {
            return Long.parseUnsignedLong(part);
        } catch (NumberFormatException e) {
            throw new InvalidStreamPositionException(nativePosition, "'" + part + "' is too large", e);
        }
    }
}
