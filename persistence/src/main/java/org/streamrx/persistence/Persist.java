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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Reactor operators that persist the values of a {@link Flux} and emit each value once it's confirmed. Use with
 * {@link Flux#transform(Function)}:
 * <pre>
 * todos.transform(Persist.to(controller, store))
 *      .subscribe(todo -> log.info("Stored {}", todo));
 * </pre>
 * Values are emitted in the order they were received. The resulting {@code Flux} fails if a value cannot be stored
 * and completes when all values have been confirmed.
 */
@NullMarked
public final class Persist {
    /**
     * The time a value is delayed in no-store mode.
     */
    public static final Duration DEFAULT_SETTLING_DELAY = Duration.ofMillis(1000);

    private Persist() {
    }

    public static <T, E extends ControllerEvent> Function<Flux<T>, Flux<T>> to(Controller<?, E> controller, ConfirmingStore<T, E> store) {
        requireNonNull(store, ConfirmingStore.class.getSimpleName() + " cannot be null");
        return to(controller, Mono.just(store));
    }

    /**
     * Same as {@link #to(Controller, ConfirmingStore)} but with a store that becomes available later. Values are buffered
     * until it's available.
     */
    public static <T, E extends ControllerEvent> Function<Flux<T>, Flux<T>> to(Controller<?, E> controller, Mono<? extends ConfirmingStore<T, E>> store) {
        requireNonNull(controller, Controller.class.getSimpleName() + " cannot be null");
        requireNonNull(store, "store cannot be null");
        return source -> Flux.<T, ConfirmingWriter<T, E>>using(() -> new ConfirmingWriter<>(controller, store),
                writer -> source.flatMapSequential(writer::write),
                ConfirmingWriter::close);
    }

    /**
     * Emits each value after {@link #DEFAULT_SETTLING_DELAY} without storing it.
     */
    public static <T> Function<Flux<T>, Flux<T>> withoutStore() {
        return withoutStore(DEFAULT_SETTLING_DELAY);
    }

    public static <T> Function<Flux<T>, Flux<T>> withoutStore(Duration settlingDelay) {
        requireNonNull(settlingDelay, "settlingDelay cannot be null");
        if (settlingDelay.isNegative()) {
            throw new IllegalArgumentException("settlingDelay cannot be negative");
        }
        return source -> source.flatMapSequential(value -> Mono.delay(settlingDelay).thenReturn(value));
    }
}
