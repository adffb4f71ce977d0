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
 * The backend couldn't be reached or failed for a reason other than a concurrency conflict, for example a timeout or a
 * connection failure. Whether the operation took effect is unknown for appends, but it's guaranteed to be all or nothing.
 */
public class StoreUnavailableException extends EventStoreException {
    @Nullable
    public final StreamName streamName;

    public StoreUnavailableException(@Nullable StreamName streamName, Throwable cause) {
        super(streamName == null ? "Event store is unavailable: " + cause.getMessage() : "Event store is unavailable for stream " + streamName + ": " + cause.getMessage(), cause);
        this.streamName = streamName;
    }
}
