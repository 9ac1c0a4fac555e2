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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Point writes and reads against the table whose changes are streamed. Completion only means the backend accepted the
 * write, the corresponding change record shows up on the stream later.
 */
@NullMarked
public interface TableOperations {

    Mono<Void> put(Map<String, Object> item);

    Mono<Void> delete(Map<String, Object> key);

    /**
     * @return The item or an empty {@code Mono} if there's no item with the given key.
     */
    Mono<Map<String, Object>> get(Map<String, Object> key);

    /**
     * @return All items currently in the table, read consistently where the backend supports it.
     */
    Flux<Map<String, Object>> scan();
}
