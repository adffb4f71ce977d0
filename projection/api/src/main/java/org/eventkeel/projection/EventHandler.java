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

package org.eventkeel.projection;

import reactor.core.publisher.Mono;

/**
 * Consumes events delivered by a subscription. Implementations must tolerate at-least-once delivery,
 * i.e. the same event may be handled more than once.
 */
public interface EventHandler {

    /**
     * Handle a single event. Nothing happens until the returned {@link Mono} is subscribed to.
     *
     * @param event The event to handle
     * @return A {@link Mono} with the outcome, or an error if the event could not be handled
     */
    Mono<EventHandlingStatus> handleEvent(ReceivedEvent event);

    /**
     * @return A name identifying this handler, used for logging
     */
    default String handlerType() {
        return getClass().getSimpleName();
    }
}
