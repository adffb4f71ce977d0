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

import org.eventkeel.eventstore.api.StreamName;
import reactor.core.publisher.Mono;

public interface EventStreamExists {

    /**
     * Check if a stream exists or not
     *
     * @param streamName The name of the stream
     * @return {@code true} if the backend has any record of the stream, {@code false} otherwise
     */
    Mono<Boolean> streamExists(StreamName streamName);
}
