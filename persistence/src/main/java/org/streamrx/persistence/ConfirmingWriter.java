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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamrx.cancellation.Cancellations;
import org.streamrx.controller.Controller;
import org.streamrx.controller.ControllerEvent;
import org.streamrx.controller.EventType;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.*;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Writes values through a {@link ConfirmingStore} and resolves each write once its echo has been observed on the
 * {@link EventType#MODIFIED} or {@link EventType#REMOVED} feed of a controller.
 * <p>
 * Creating a writer registers listeners on the controller, which starts the stream. Values submitted before the store is
 * available and the controller is ready are buffered. Values are stored one at a time in submission order. Each event
 * confirms at most one write, the oldest stored write that it matches. Events that arrive before the write they confirm
 * has been stored are kept in a bounded window of recent events.
 * </p>
 * <p>
 * No confirmation timeout is applied, use {@link Mono#timeout(java.time.Duration)} on the result of {@link #write(Object)}.
 * </p>
 *
 * @param <T> The type of the values to write
 * @param <E> The event type of the controller
 */
@NullMarked
public class ConfirmingWriter<T, E extends ControllerEvent> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConfirmingWriter.class);
    static final int DEFAULT_RECENT_EVENTS = 256;

    private final Controller<?, E> controller;
    private final int recentEventsLimit;
    private final Consumer<E> listener = this::onEvent;
    private final Sinks.Many<PendingWrite<T, E>> submissions = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable flushing;

    private final Object lock = new Object();
    private final Set<PendingWrite<T, E>> outstanding = new LinkedHashSet<>();
    private final List<PendingWrite<T, E>> awaitingEcho = new ArrayList<>();
    private final Deque<E> recentEvents = new ArrayDeque<>();
    private boolean closed;

    public ConfirmingWriter(Controller<?, E> controller, ConfirmingStore<T, E> store) {
        this(controller, Mono.just(requireNonNull(store, ConfirmingStore.class.getSimpleName() + " cannot be null")));
    }

    /**
     * @param store A store that becomes available later. Writes are buffered until it's available. If it fails, or
     *              completes without a store, all outstanding writes fail.
     */
    public ConfirmingWriter(Controller<?, E> controller, Mono<? extends ConfirmingStore<T, E>> store) {
        this(controller, store, DEFAULT_RECENT_EVENTS);
    }

    ConfirmingWriter(Controller<?, E> controller, Mono<? extends ConfirmingStore<T, E>> store, int recentEventsLimit) {
        requireNonNull(controller, Controller.class.getSimpleName() + " cannot be null");
        requireNonNull(store, "store cannot be null");
        if (recentEventsLimit < 1) {
            throw new IllegalArgumentException("recentEventsLimit must be greater than 0");
        }
        this.controller = controller;
        this.recentEventsLimit = recentEventsLimit;

        controller.addEventListener(EventType.MODIFIED, listener);
        controller.addEventListener(EventType.REMOVED, listener);

        Mono<ConfirmingStore<T, E>> availableStore = store
                .<ConfirmingStore<T, E>>map(s -> s)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("No store became available for controller " + controller.id())))
                .cache();
        flushing = submissions.asFlux()
                .delaySubscription(Mono.when(availableStore, controller.ready()))
                .concatMap(pending -> availableStore.flatMap(s -> s.store(pending.value()))
                        .doOnNext(matcher -> stored(pending, matcher))
                        .switchIfEmpty(Mono.fromRunnable(() -> failed(pending, new IllegalStateException("The store produced no matcher for " + pending.value()))))
                        .onErrorResume(e -> {
                            failed(pending, e);
                            return Mono.empty();
                        }), 1)
                .takeUntilOther(controller.whenDisposed())
                .subscribe(null, this::storeUnavailable,
                        () -> failAll(Cancellations.cancellation("Controller " + controller.id() + " was disposed", null)));
    }

    /**
     * @return A {@code Mono} that submits {@code value} when subscribed and emits it once its echo has been observed
     */
    public Mono<T> write(T value) {
        requireNonNull(value, "value cannot be null");
        return Mono.defer(() -> {
            PendingWrite<T, E> pending = new PendingWrite<>(value);
            synchronized (lock) {
                if (closed) {
                    return Mono.error(Cancellations.cancellation("Writer of controller " + controller.id() + " is closed", null));
                }
                outstanding.add(pending);
                Sinks.EmitResult result = submissions.tryEmitNext(pending);
                if (result.isFailure()) {
                    outstanding.remove(pending);
                    return Mono.error(new IllegalStateException("Failed to submit " + value + ": " + result));
                }
            }
            return pending.result();
        });
    }

    /**
     * @return The number of writes that have not been confirmed or failed yet
     */
    public int outstandingWrites() {
        synchronized (lock) {
            return outstanding.size();
        }
    }

    /**
     * Release the controller listeners and fail all outstanding writes with a {@link java.util.concurrent.CancellationException}.
     */
    @Override
    public void close() {
        List<PendingWrite<T, E>> toCancel;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            toCancel = new ArrayList<>(outstanding);
            outstanding.clear();
            awaitingEcho.clear();
            recentEvents.clear();
        }
        controller.removeEventListener(EventType.MODIFIED, listener);
        controller.removeEventListener(EventType.REMOVED, listener);
        flushing.dispose();
        submissions.tryEmitComplete();
        toCancel.forEach(pending -> pending.fail(Cancellations.cancellation("Writer of controller " + controller.id() + " was closed", null)));
    }

    private void stored(PendingWrite<T, E> pending, EchoMatcher<E> matcher) {
        pending.stored(matcher);
        synchronized (lock) {
            if (!outstanding.contains(pending)) {
                return;
            }
            for (Iterator<E> iterator = recentEvents.iterator(); iterator.hasNext(); ) {
                if (matcher.matches(iterator.next())) {
                    iterator.remove();
                    confirm(pending);
                    return;
                }
            }
            awaitingEcho.add(pending);
        }
    }

    private void onEvent(E event) {
        synchronized (lock) {
            if (closed) {
                return;
            }
            for (Iterator<PendingWrite<T, E>> iterator = awaitingEcho.iterator(); iterator.hasNext(); ) {
                PendingWrite<T, E> pending = iterator.next();
                EchoMatcher<E> matcher = pending.matcher();
                if (matcher != null && matcher.matches(event)) {
                    iterator.remove();
                    confirm(pending);
                    return;
                }
            }
            recentEvents.addLast(event);
            if (recentEvents.size() > recentEventsLimit) {
                recentEvents.removeFirst();
            }
        }
    }

    private void confirm(PendingWrite<T, E> pending) {
        outstanding.remove(pending);
        pending.resolve();
    }

    private void failed(PendingWrite<T, E> pending, Throwable throwable) {
        log.debug("Failed to store {} on controller {}: {}", pending.value(), controller.id(), throwable.getMessage());
        synchronized (lock) {
            outstanding.remove(pending);
        }
        pending.fail(throwable);
    }

    private void storeUnavailable(Throwable throwable) {
        if (Cancellations.isCancellation(throwable)) {
            log.debug("Writer of controller {} was cancelled", controller.id());
        } else {
            log.error("No store available for controller {}", controller.id(), throwable);
        }
        failAll(throwable);
    }

    private void failAll(Throwable throwable) {
        List<PendingWrite<T, E>> toFail;
        synchronized (lock) {
            toFail = new ArrayList<>(outstanding);
            outstanding.clear();
            awaitingEcho.clear();
            closed = true;
        }
        toFail.forEach(pending -> pending.fail(throwable));
    }
}
