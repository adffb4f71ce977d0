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

/**
 * A stored entry lacks the envelope fields needed to read it back as an event, e.g. it was written to the stream
 * by something other than the event store. The rest of the stream is still readable from the entry's position.
 */
public class CorruptedEventException extends EventStoreException {
    public final StreamName streamName;
    public final String entryId;

    public CorruptedEventException(StreamName streamName, String entryId, String reason) {
        this(streamName, entryId, reason, null);
    }

    public CorruptedEventException(StreamName streamName, String entryId, String reason, @Nullable Throwable cause) {
        super("Entry " + entryId + " in stream " + streamName + " is corrupted: " + reason, cause);
        this.streamName = streamName;
        this.entryId = entryId;
    }
}
