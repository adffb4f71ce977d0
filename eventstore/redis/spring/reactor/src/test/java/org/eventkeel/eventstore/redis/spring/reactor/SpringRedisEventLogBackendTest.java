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

import org.eventkeel.eventstore.api.CorruptedEventException;
import org.eventkeel.eventstore.api.StreamName;
import org.eventkeel.eventstore.api.reactor.spi.StoredEvent;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.RecordId;

import java.util.Map;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class SpringRedisEventLogBackendTest {
    private static final StreamName ORDER_1 = StreamName.of("order-1");

    @Test
    void maps_the_entry_fields_to_a_stored_event() {
        // Given
        UUID id = UUID.randomUUID();
        MapRecord<String, String, String> record = record("12-3", Map.of("message_id", id.toString(), "message_type", "OrderShipped",
                "json_data", "{}", "json_metadata", "{\"$metadata\":{}}"));

        // When
        StoredEvent event = SpringRedisEventLogBackend.toStoredEvent(ORDER_1, record);

        // Then
        assertThat(event.id()).isEqualTo(id);
        assertThat(event.eventType()).isEqualTo("OrderShipped");
        assertThat(new String(event.payload(), UTF_8)).isEqualTo("{}");
        assertThat(event.contentType()).isEqualTo("application/json");
        assertThat(event.position()).isEqualTo(123L);
    }

    @Test
    void a_message_id_that_is_not_a_uuid_is_reported_as_a_corrupted_entry() {
        // Given
        MapRecord<String, String, String> record = record("1-0", Map.of("message_id", "not-a-uuid", "message_type", "OrderShipped", "json_data", "{}"));

        // When
        Throwable throwable = catchThrowable(() -> SpringRedisEventLogBackend.toStoredEvent(ORDER_1, record));

        // Then
        assertThat(throwable).isExactlyInstanceOf(CorruptedEventException.class).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(((CorruptedEventException) throwable).entryId).isEqualTo("1-0");
    }

    @Test
    void a_missing_envelope_field_is_reported_as_a_corrupted_entry() {
        // Given
        MapRecord<String, String, String> record = record("1-1", Map.of("message_id", UUID.randomUUID().toString(), "message_type", "OrderShipped"));

        // When
        Throwable throwable = catchThrowable(() -> SpringRedisEventLogBackend.toStoredEvent(ORDER_1, record));

        // Then
        assertThat(throwable).isExactlyInstanceOf(CorruptedEventException.class).hasMessage("Entry 1-1 in stream order-1 is corrupted: no json_data field");
    }

    private static MapRecord<String, String, String> record(String entryId, Map<String, String> fields) {
        return MapRecord.create("order-1", fields).withId(RecordId.of(entryId));
    }
}
