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

package org.eventkeel.serialization.typemapper;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class RegistryEventTypeMapperTest {

    @Test
    void maps_registered_types_in_both_directions() {
        // Given
        RegistryEventTypeMapper mapper = new RegistryEventTypeMapper().register(ItemAdded.class, "V1.ItemAdded");

        // Then
        assertThat(mapper.getEventType(ItemAdded.class)).isEqualTo("V1.ItemAdded");
        assertThat(mapper.getEventType(new ItemAdded("sku"))).isEqualTo("V1.ItemAdded");
        assertThat(mapper.getType("V1.ItemAdded")).contains(ItemAdded.class);
    }

    @Test
    void register_simple_name_uses_the_simple_class_name() {
        // When
        RegistryEventTypeMapper mapper = new RegistryEventTypeMapper().registerSimpleName(ItemRemoved.class);

        // Then
        assertThat(mapper.getEventType(ItemRemoved.class)).isEqualTo("ItemRemoved");
        assertThat(mapper.isRegistered(ItemRemoved.class)).isTrue();
    }

    @Test
    void unknown_event_type_maps_to_empty() {
        assertThat(new RegistryEventTypeMapper().getType("Unknown")).isEmpty();
    }

    @Test
    void getting_the_event_type_of_an_unregistered_class_throws_unregistered_event_type_exception() {
        // When
        Throwable throwable = catchThrowable(() -> new RegistryEventTypeMapper().getEventType(ItemAdded.class));

        // Then
        assertThat(throwable).isExactlyInstanceOf(UnregisteredEventTypeException.class).hasMessageContaining(ItemAdded.class.getName());
    }

    @Test
    void registering_the_same_event_type_for_two_classes_is_rejected() {
        // Given
        RegistryEventTypeMapper mapper = new RegistryEventTypeMapper().register(ItemAdded.class, "Item");

        // When
        Throwable throwable = catchThrowable(() -> mapper.register(ItemRemoved.class, "Item"));

        // Then
        assertThat(throwable).isInstanceOf(IllegalArgumentException.class);
        assertThat(mapper.getType("Item")).contains(ItemAdded.class);
    }

    @Test
    void registering_the_same_mapping_twice_is_allowed() {
        // Given
        RegistryEventTypeMapper mapper = new RegistryEventTypeMapper().register(ItemAdded.class, "Item");

        // When
        mapper.register(ItemAdded.class, "Item");

        // Then
        assertThat(mapper.getEventType(ItemAdded.class)).isEqualTo("Item");
    }

    record ItemAdded(String sku) {
    }

    record ItemRemoved(String sku) {
    }
}
