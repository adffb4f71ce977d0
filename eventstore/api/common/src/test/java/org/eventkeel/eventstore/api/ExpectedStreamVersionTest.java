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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ExpectedStreamVersionTest {

    @Test
    void sentinels_have_negative_wire_values() {
        assertThat(ExpectedStreamVersion.noStream().value()).isEqualTo(-1);
        assertThat(ExpectedStreamVersion.any().value()).isEqualTo(-2);
    }

    @Test
    void of_maps_wire_values_back_to_the_sentinels() {
        assertThat(ExpectedStreamVersion.of(-1)).isSameAs(ExpectedStreamVersion.noStream());
        assertThat(ExpectedStreamVersion.of(-2)).isSameAs(ExpectedStreamVersion.any());
        assertThat(ExpectedStreamVersion.of(3)).isEqualTo(new ExpectedStreamVersion.Value(3));
    }

    @Test
    void no_stream_is_only_satisfied_by_a_missing_stream() {
        assertThat(ExpectedStreamVersion.noStream().isSatisfiedBy(-1)).isTrue();
        assertThat(ExpectedStreamVersion.noStream().isSatisfiedBy(0)).isFalse();
    }

    @Test
    void any_is_satisfied_by_every_version() {
        assertThat(ExpectedStreamVersion.any().isSatisfiedBy(-1)).isTrue();
        assertThat(ExpectedStreamVersion.any().isSatisfiedBy(42)).isTrue();
    }

    @Test
    void exact_version_is_only_satisfied_by_the_same_version() {
        assertThat(ExpectedStreamVersion.exactly(1).isSatisfiedBy(1)).isTrue();
        assertThat(ExpectedStreamVersion.exactly(1).isSatisfiedBy(2)).isFalse();
    }

    @Test
    void exact_version_cannot_be_negative() {
        // When
        Throwable throwable = catchThrowable(() -> ExpectedStreamVersion.exactly(-3));

        // Then
        assertThat(throwable).isInstanceOf(IllegalArgumentException.class);
    }
}
