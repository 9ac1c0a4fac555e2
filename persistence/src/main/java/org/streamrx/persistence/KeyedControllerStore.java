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

import org.jspecify.annotations.NullMarked;
import org.streamrx.controller.Controller;
import org.streamrx.controller.ControllerEvent;
import org.streamrx.controller.EventType;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ConfirmingStore} that puts values through a {@link Controller} and recognises their echo as the first
 * {@link EventType#MODIFIED} event with the same key.
 *
 * @param <T> The type of the values to store
 * @param <E> The event type of the controller
 */
@NullMarked
public class KeyedControllerStore<T, E extends ControllerEvent> implements ConfirmingStore<T, E> {
    private final Controller<T, E> controller;
    private final Function<? super T, ?> valueKey;
    private final Function<? super E, ?> eventKey;

    /**
     * @param valueKey Extracts the key of a value
     * @param eventKey Extracts the key of an event. Keys are compared with {@link Objects#equals(Object, Object)}.
     */
    public KeyedControllerStore(Controller<T, E> controller, Function<? super T, ?> valueKey, Function<? super E, ?> eventKey) {
        requireNonNull(controller, Controller.class.getSimpleName() + " cannot be null");
        requireNonNull(valueKey, "valueKey cannot be null");
        requireNonNull(eventKey, "eventKey cannot be null");
        this.controller = controller;
        this.valueKey = valueKey;
        this.eventKey = eventKey;
    }

    @Override
    public Mono<EchoMatcher<E>> store(T value) {
        Object key = valueKey.apply(value);
        return controller.put(value)
                .then(Mono.fromSupplier(() -> event -> event.type() == EventType.MODIFIED && Objects.equals(key, eventKey.apply(event))));
    }
}
