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

package org.streamrx.persistence;

import reactor.core.publisher.Mono;

/**
 * A store whose writes can be confirmed by observing the change stream.
 *
 * @param <T> The type of the values to store
 * @param <E> The event type of the change stream
 */
@FunctionalInterface
public interface ConfirmingStore<T, E> {

    /**
     * Write {@code value} to the store.
     *
     * @return A {@code Mono} with a matcher that recognises the event that the write produces. The {@code Mono} fails if
     * the write was rejected.
     */
    Mono<EchoMatcher<E>> store(T value);
}
