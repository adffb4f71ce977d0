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

/**
 * A read was requested from a stream that the backend has no record of. A stream that exists but has no events
 * in the requested range is <i>not</i> an error, it's an empty result.
 */
public class StreamNotFoundException extends EventStoreException {
    public final StreamName streamName;

    public StreamNotFoundException(StreamName streamName) {
        super("Stream " + streamName + " does not exist");
        this.streamName = streamName;
    }
}
