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

import org.jspecify.annotations.NullMarked;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamrx.cancellation.CancellationScope;
import org.streamrx.cancellation.CancellationSignal;
import org.streamrx.controller.EventListener.FunctionListener;
import org.streamrx.controller.EventListener.ObjectListener;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * A ref-counted source of change events for a single resource (such as a table). Events are published on one internal feed
 * and routed to three typed feeds, see {@link EventType}. The producer behind the feed runs only while at least one
 * listener is registered: the first listener triggers {@link #start()} and removing the last one triggers {@link #stop()}.
 * <p>
 * Each controller owns a {@link CancellationScope} forked from the scope it's created in. Cancelling any ancestor of that
 * scope disposes the controller.
 * </p>
 * <p>
 * Late listeners don't see events that were published before they were registered.
 * </p>
 *
 * @param <V> The type of the values stored in the resource
 * @param <E> The type of the published events
 */
@NullMarked
public abstract class Controller<V, E extends ControllerEvent> implements Disposable {
    private static final Logger log = LoggerFactory.getLogger(Controller.class);

    private final String id;
    private final CancellationScope scope;
    private final Sinks.Many<E> feed = Sinks.many().multicast().directBestEffort();
    private final Flux<E> modified;
    private final Flux<E> removed;
    private final Flux<E> expired;
    private final Sinks.Empty<Void> disposedSignal = Sinks.empty();

    private final Object lock = new Object();
    private final Object emitLock = new Object();
    private final Map<Registration, Disposable> listeners = new LinkedHashMap<>();
    private final AtomicBoolean onDisposeCalled = new AtomicBoolean(false);
    private boolean running;
    private volatile boolean disposed;
    private volatile Sinks.Empty<Void> ready = Sinks.empty();

    /**
     * @param id          The id of the resource, used as key in the {@link ControllerRegistry}.
     * @param parentScope The scope the controller's own scope is forked from.
     */
    protected Controller(String id, CancellationScope parentScope) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        } else if (parentScope == null) {
            throw new IllegalArgumentException(CancellationScope.class.getSimpleName() + " cannot be null");
        } else if (parentScope.isCancelled()) {
            throw new IllegalStateException("Cannot create controller " + id + " in cancelled scope " + parentScope.name());
        }
        this.id = id;
        this.scope = parentScope.fork(getClass().getSimpleName() + ":" + id);
        Flux<E> events = feed.asFlux();
        this.modified = events.filter(e -> e.type() == EventType.MODIFIED);
        this.removed = events.filter(e -> e.type() == EventType.REMOVED);
        this.expired = events.filter(e -> e.type() == EventType.EXPIRED);
        scope.signal().onAbort(this::dispose);
    }

    // Producer

    /**
     * Start producing events. Invoked when the first listener is registered, may be invoked again after {@link #stop()}.
     */
    protected abstract void start();

    /**
     * Stop producing events. Invoked when the last listener is removed and when a running controller is disposed.
     */
    protected abstract void stop();

    /**
     * Invoked exactly once, when the controller is disposed.
     */
    protected void onDispose() {
    }

    protected abstract Mono<Void> doPut(V value);

    protected abstract Mono<Void> doPut(V value, Instant expiresAt);

    protected abstract Mono<Void> doRemove(Map<String, Object> key);

    protected abstract Mono<V> doGet(Map<String, Object> key);

    protected abstract Flux<V> doSnapshot();

    /**
     * Publish an event to the listeners of its type. Safe to call from several threads.
     */
    protected void emit(E event) {
        requireNonNull(event, "event cannot be null");
        if (disposed) {
            return;
        }
        synchronized (emitLock) {
            Sinks.EmitResult result = feed.tryEmitNext(event);
            if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                log.warn("Failed to publish {} event on controller {}: {}", event.type(), id, result);
            }
        }
    }

    /**
     * Signal that the running producer has positioned itself on the stream. Completes {@link #ready()}.
     */
    protected void markReady() {
        ready.tryEmitEmpty();
    }

    /**
     * @return The scope owned by this controller.
     */
    protected CancellationScope scope() {
        return scope;
    }

    // Listeners

    /**
     * Register a listener for events of the given type. Registering the same listener twice for the same type does nothing.
     */
    public void addEventListener(EventType type, EventListener<? super E> listener) {
        if (type == null) {
            throw new IllegalArgumentException(EventType.class.getSimpleName() + " cannot be null");
        } else if (listener == null) {
            throw new IllegalArgumentException(EventListener.class.getSimpleName() + " cannot be null");
        }

        synchronized (lock) {
            Registration registration = new Registration(type, listener);
            if (disposed || listeners.containsKey(registration)) {
                return;
            }
            Disposable subscription = feedFor(type).subscribe(event -> dispatch(listener, event, type));
            listeners.put(registration, subscription);
            if (!running) {
                running = true;
                ready = Sinks.empty();
                log.debug("Starting controller {}", id);
                start();
            }
        }
    }

    public void addEventListener(EventType type, Consumer<? super E> listener) {
        addEventListener(type, EventListener.function(listener));
    }

    /**
     * Remove a previously registered listener. Removing an unknown listener does nothing.
     */
    public void removeEventListener(EventType type, EventListener<? super E> listener) {
        if (type == null || listener == null) {
            return;
        }

        synchronized (lock) {
            Disposable subscription = listeners.remove(new Registration(type, listener));
            if (subscription == null) {
                return;
            }
            subscription.dispose();
            if (listeners.isEmpty() && running) {
                stopProducer();
            }
        }
    }

    public void removeEventListener(EventType type, Consumer<? super E> listener) {
        removeEventListener(type, EventListener.function(listener));
    }

    /**
     * A {@link Flux} of the events of the given type. Subscribing registers a listener and cancelling removes it. The
     * {@code Flux} completes when the controller is disposed.
     */
    public Flux<E> events(EventType type) {
        requireNonNull(type, EventType.class.getSimpleName() + " cannot be null");
        return Flux.create(sink -> {
            EventListener<E> listener = EventListener.function(sink::next);
            Disposable completion = whenDisposed().subscribe(null, sink::error, sink::complete);
            sink.onDispose(() -> {
                completion.dispose();
                removeEventListener(type, listener);
            });
            addEventListener(type, listener);
        });
    }

    public int listenerCount() {
        synchronized (lock) {
            return listeners.size();
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    // Resource

    /**
     * Write a value to the resource. Completes when the write is accepted, the corresponding event is published later.
     */
    public Mono<Void> put(V value) {
        return Mono.defer(() -> {
            requireNonNull(value, "value cannot be null");
            return disposed ? Mono.error(disposedException()) : doPut(value);
        });
    }

    /**
     * Write a value that the resource expires at the given instant. Expiry is performed by the resource itself and is
     * published as an {@link EventType#EXPIRED} event.
     */
    public Mono<Void> put(V value, Instant expiresAt) {
        return Mono.defer(() -> {
            requireNonNull(value, "value cannot be null");
            requireNonNull(expiresAt, "expiresAt cannot be null");
            return disposed ? Mono.error(disposedException()) : doPut(value, expiresAt);
        });
    }

    /**
     * Delete the item with the given key. Completes when the delete is accepted.
     */
    public Mono<Void> remove(Map<String, Object> key) {
        return Mono.defer(() -> {
            requireNonNull(key, "key cannot be null");
            return disposed ? Mono.error(disposedException()) : doRemove(key);
        });
    }

    /**
     * @return The value with the given key or an empty {@code Mono} if there's no such value.
     */
    public Mono<V> get(Map<String, Object> key) {
        return Mono.defer(() -> {
            requireNonNull(key, "key cannot be null");
            return disposed ? Mono.error(disposedException()) : doGet(key);
        });
    }

    /**
     * @return All values currently stored in the resource. Not isolated from concurrent writes.
     */
    public Flux<V> snapshot() {
        return Flux.defer(() -> disposed ? Flux.error(disposedException()) : doSnapshot());
    }

    /**
     * Bind a unit of work to the lifetime of this controller.
     */
    public <T> Flux<T> track(Publisher<T> publisher) {
        return scope.wrap(publisher);
    }

    public <T> Mono<T> track(Mono<T> mono) {
        return scope.wrap(mono);
    }

    public CancellationSignal signal() {
        return scope.signal();
    }

    /**
     * @return A {@link Mono} that completes when the producer has positioned itself on the stream after the latest start.
     */
    public Mono<Void> ready() {
        return Mono.defer(() -> ready.asMono());
    }

    /**
     * @return A {@link Mono} that completes when this controller is disposed.
     */
    public Mono<Void> whenDisposed() {
        return disposedSignal.asMono();
    }

    public String id() {
        return id;
    }

    // Lifecycle

    /**
     * Dispose the controller. Removes it from its registry, stops the producer, completes all feeds and cancels the scope
     * of the controller. Idempotent.
     */
    @Override
    public void dispose() {
        synchronized (lock) {
            if (disposed) {
                return;
            }
            disposed = true;
        }
        log.debug("Disposing controller {}", id);
        disposedSignal.tryEmitEmpty();

        synchronized (lock) {
            if (running) {
                stopProducer();
            }
            listeners.values().forEach(Disposable::dispose);
            listeners.clear();
        }

        if (onDisposeCalled.compareAndSet(false, true)) {
            onDispose();
        }
        synchronized (emitLock) {
            feed.tryEmitComplete();
        }
        scope.dispose();
    }

    @Override
    public boolean isDisposed() {
        return disposed;
    }

    private void stopProducer() {
        running = false;
        log.debug("Stopping controller {}", id);
        try {
            stop();
        } catch (RuntimeException e) {
            log.error("Failed to stop controller {}", id, e);
        }
    }

    private Flux<E> feedFor(EventType type) {
        return switch (type) {
            case MODIFIED -> modified;
            case REMOVED -> removed;
            case EXPIRED -> expired;
        };
    }

    private <T> void dispatch(EventListener<T> listener, T event, EventType type) {
        try {
            if (listener instanceof FunctionListener<T> function) {
                function.consumer().accept(event);
            } else if (listener instanceof ObjectListener<T> object) {
                object.handler().handleEvent(event);
            }
        } catch (RuntimeException e) {
            log.error("Listener for {} events on controller {} failed", type, id, e);
        }
    }

    private IllegalStateException disposedException() {
        return new IllegalStateException("Controller " + id + " is disposed");
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", getClass().getSimpleName() + "[", "]")
                .add("id='" + id + "'")
                .add("listeners=" + listenerCount())
                .add("disposed=" + disposed)
                .toString();
    }

    private record Registration(EventType type, EventListener<?> listener) {
    }
}
