/*
 * Copyright 2026 Johan Haleby
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

package org.streamrx.changestream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("Jackson item mapper")
@DisplayNameGeneration(ReplaceUnderscores.class)
class JacksonItemMapperTest {

    @Test
    void marshals_a_value_into_an_attribute_map() {
        // Given
        JacksonItemMapper<Todo> mapper = new JacksonItemMapper<>(new ObjectMapper(), Todo.class);

        // When
        Map<String, Object> item = mapper.marshal(new Todo("x", "Buy milk", 1700000000L));

        // Then
        assertAll(
                () -> assertThat(item).containsOnlyKeys("id", "title", "expires"),
                () -> assertThat(item).containsEntry("id", "x").containsEntry("title", "Buy milk"),
                () -> assertThat(((Number) item.get("expires")).longValue()).isEqualTo(1700000000L)
        );
    }

    @Test
    void unmarshals_an_attribute_map_with_numbers_of_another_type() {
        // Given
        JacksonItemMapper<Todo> mapper = JacksonItemMapper.of(Todo.class);

        // When
        Todo todo = mapper.unmarshal(Map.of("id", "y", "title", "Walk", "expires", 42));

        // Then
        assertAll(
                () -> assertThat(todo.id()).isEqualTo("y"),
                () -> assertThat(todo.title()).isEqualTo("Walk"),
                () -> assertThat(todo.expires()).isEqualTo(42L)
        );
    }

    @Test
    void ignores_attributes_that_the_type_has_no_property_for() {
        // Given
        JacksonItemMapper<Todo> mapper = JacksonItemMapper.of(Todo.class);

        // When
        Todo todo = mapper.unmarshal(Map.of("id", "z", "title", "Read", "expires", 7, "owner", "me"));

        // Then
        assertThat(todo).isEqualTo(new Todo("z", "Read", 7L));
    }

    @Test
    void poll_result_without_next_iterator_is_closed() {
        assertAll(
                () -> assertThat(PollResult.closed(List.of()).isClosed()).isTrue(),
                () -> assertThat(PollResult.of(List.of(), "it").isClosed()).isFalse()
        );
    }

    public record Todo(String id, String title, long expires) {
    }
}
