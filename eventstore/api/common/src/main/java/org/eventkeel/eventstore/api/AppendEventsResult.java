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
 * The result of a successful append.
 *
 * @param globalPosition      The logical position of the last event in the stream after the append
 * @param nextExpectedVersion The version of the stream after the append, use it as expected version for the next append
 */
public record AppendEventsResult(long globalPosition, long nextExpectedVersion) {
    public static final AppendEventsResult NO_OP = new AppendEventsResult(0, ExpectedStreamVersion.NO_STREAM_VALUE);
}
