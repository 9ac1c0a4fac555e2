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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A change record as read from the backend, before classification. Attribute maps hold plain Java values
 * ({@code String}, {@code Number}, {@code Boolean}, {@code List}, {@code Map}, {@code byte[]} or {@code null}).
 * <p>
 * {@code eventKind} and {@code sequenceToken} are nullable because backends occasionally hand out records without them,
 * such records are dropped by the consumer.
 * </p>
 *
 * @param payload The backend's own representation of the record
 */
@NullMarked
public record RawRecord(@Nullable EventKind eventKind,
                        Map<String, Object> key,
                        @Nullable Map<String, Object> newValue,
                        @Nullable Map<String, Object> oldValue,
                        @Nullable String sequenceToken,
                        @Nullable Instant timestamp,
                        Object payload) {

    public RawRecord {
        key = key == null ? Map.of() : unmodifiable(key);
        newValue = newValue == null ? null : unmodifiable(newValue);
        oldValue = oldValue == null ? null : unmodifiable(oldValue);
        if (payload == null) {
            throw new NullPointerException("payload cannot be null");
        }
    }

    // Attribute values may be null so Map.copyOf cannot be used
    private static Map<String, Object> unmodifiable(Map<String, Object> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
