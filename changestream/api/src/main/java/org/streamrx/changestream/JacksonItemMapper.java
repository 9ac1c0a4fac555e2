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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An {@link ItemMapper} that converts values with a Jackson {@link ObjectMapper}.
 */
@NullMarked
public class JacksonItemMapper<T> implements ItemMapper<T> {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Class<T> type;

    public JacksonItemMapper(ObjectMapper objectMapper, Class<T> type) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(type, "type cannot be null");
        this.objectMapper = objectMapper;
        this.type = type;
    }

    /**
     * Create a mapper that ignores item attributes the type has no property for, such as a TTL attribute.
     */
    public static <T> JacksonItemMapper<T> of(Class<T> type) {
        return new JacksonItemMapper<>(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false), type);
    }

    @Override
    public Map<String, Object> marshal(T value) {
        return objectMapper.convertValue(value, MAP_TYPE);
    }

    @Override
    public T unmarshal(Map<String, Object> item) {
        return objectMapper.convertValue(item, type);
    }
}
