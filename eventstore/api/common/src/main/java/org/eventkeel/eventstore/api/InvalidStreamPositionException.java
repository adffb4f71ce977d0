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
 * A backend-native stream position couldn't be parsed.
 */
public class InvalidStreamPositionException extends EventStoreException {
    @Nullable
    public final String position;

    public InvalidStreamPositionException(@Nullable String position, String reason) {
        this(position, reason, null);
    }

    public InvalidStreamPositionException(@Nullable String position, String reason, @Nullable Throwable cause) {
        super("Invalid stream position '" + position + "': " + reason, cause);
        this.position = position;
    }
}
