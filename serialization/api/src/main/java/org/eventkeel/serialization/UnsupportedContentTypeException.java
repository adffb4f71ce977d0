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

package org.eventkeel.serialization;

/**
 * Returned as the cause of a {@link DeserializationResult.FailedToDeserialize} when a serializer is asked to
 * deserialize a content type it doesn't understand.
 */
public class UnsupportedContentTypeException extends RuntimeException {
    public final String contentType;

    public UnsupportedContentTypeException(String contentType, String supportedContentType) {
        super("Content type " + contentType + " is not supported, only " + supportedContentType + " is supported");
        this.contentType = contentType;
    }
}
