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

package org.streamrx.controller;

import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * A listener registered with {@link Controller#addEventListener(EventType, EventListener)}. Two listeners are the same
 * listener if they wrap the same function or handler instance.
 *
 * @param <E> The event type
 */
public sealed interface EventListener<E> {

    static <E> EventListener<E> function(Consumer<? super E> consumer) {
        return new FunctionListener<>(consumer);
    }

    static <E> EventListener<E> object(EventHandler<? super E> handler) {
        return new ObjectListener<>(handler);
    }

    record FunctionListener<E>(Consumer<? super E> consumer) implements EventListener<E> {
        public FunctionListener {
            requireNonNull(consumer, Consumer.class.getSimpleName() + " cannot be null");
        }
    }

    record ObjectListener<E>(EventHandler<? super E> handler) implements EventListener<E> {
        public ObjectListener {
            requireNonNull(handler, EventHandler.class.getSimpleName() + " cannot be null");
        }
    }
}
