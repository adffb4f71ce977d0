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

package org.eventkeel.eventstore.api.reactor;

import org.eventkeel.eventstore.api.ExpectedStreamVersion;
import org.eventkeel.eventstore.api.StreamName;
import org.eventkeel.eventstore.api.StreamTruncatePosition;
import reactor.core.publisher.Mono;

/**
 * Operations that change or remove events that have already been written to a stream.
 */
public interface EventStoreOperations {

    /**
     * Remove all events before {@code truncatePosition} from the stream.
     *
     * @return A {@code Mono} that signals {@link UnsupportedOperationException} if the event store doesn't support truncation
     */
    Mono<Void> truncateStream(StreamName streamName, StreamTruncatePosition truncatePosition, ExpectedStreamVersion expectedVersion);

    /**
     * Delete the entire stream.
     *
     * @return A {@code Mono} that signals {@link UnsupportedOperationException} if the event store doesn't support deletion
     */
    Mono<Void> deleteStream(StreamName streamName, ExpectedStreamVersion expectedVersion);
}
