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

package org.streamrx.cancellation;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A node in a cancellation hierarchy. Each scope owns a cancellation signal that fires when the scope itself, or any of
 * its ancestors, is aborted. Work that should stop when the scope is cancelled is bound to it with {@link #wrap(Publisher)}
 * or {@link #track()}:
 * <pre>
 * CancellationScope root = CancellationScope.root("app");
 * CancellationScope controllerScope = root.fork("controller");
 * Flux&lt;Long&gt; ticks = controllerScope.wrap(Flux.interval(Duration.ofSeconds(1)));
 * ...
 * root.dispose(); // completes "ticks" and aborts "controllerScope"
 * </pre>
 * A {@code CancellationScope} is thread-safe. Aborting is idempotent and irreversible.
 */
@NullMarked
public final class CancellationScope {
    private static final Logger log = LoggerFactory.getLogger(CancellationScope.class);

    private final String name;
    private final @Nullable CancellationScope parent;
    private final Set<CancellationScope> children = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    // Emits a single value on abort. A value (rather than an empty completion) is used so that "takeUntilOther" fires.
    private final Sinks.One<Boolean> trigger = Sinks.one();
    private final CancellationSignal signal = new ScopeSignal();
    private final Disposable parentLink;

    private CancellationScope(String name, @Nullable CancellationScope parent) {
        requireNonNull(name, "name cannot be null");
        this.name = name;
        this.parent = parent;
        if (parent == null) {
            parentLink = Disposables.disposed();
        } else {
            parent.children.add(this);
            // Completes synchronously if the parent is already aborted
            parentLink = parent.trigger.asMono().subscribe(__ -> abort());
        }
    }

    /**
     * Create a new root scope. The root is typically owned by the composition root of the application and disposed on shutdown.
     *
     * @param name A diagnostic name
     * @return A new root {@link CancellationScope}
     */
    public static CancellationScope root(String name) {
        return new CancellationScope(name, null);
    }

    /**
     * Create a child scope that is cancelled when this scope is cancelled. Forking from an already cancelled scope returns
     * an already cancelled child.
     *
     * @param name A diagnostic name, should be unique among the children of this scope.
     * @return The child scope
     */
    public CancellationScope fork(String name) {
        return new CancellationScope(name, this);
    }

    /**
     * Bind a publisher to this scope. The returned {@link Flux} relays the signals of {@code source} until this scope is
     * cancelled, at which point the upstream subscription is cancelled and the returned {@code Flux} completes.
     */
    public <T> Flux<T> wrap(Publisher<T> source) {
        requireNonNull(source, Publisher.class.getSimpleName() + " cannot be null");
        return Flux.from(source).takeUntilOther(trigger.asMono());
    }

    /**
     * Bind a {@link Mono} to this scope. The returned {@code Mono} completes empty if this scope is cancelled before {@code source} resolves.
     */
    public <T> Mono<T> wrap(Mono<T> source) {
        requireNonNull(source, Mono.class.getSimpleName() + " cannot be null");
        return source.takeUntilOther(trigger.asMono());
    }

    /**
     * @return An operator, for use with {@link Flux#transform(Function)}, that binds the upstream {@code Flux} to this scope.
     * @see #wrap(Publisher)
     */
    public <T> Function<Flux<T>, Flux<T>> track() {
        return this::wrap;
    }

    /**
     * Cancel this scope and, transitively, all of its descendants. Does nothing if already cancelled.
     */
    public void abort() {
        if (aborted.compareAndSet(false, true)) {
            log.debug("Aborting scope {}", path());
            trigger.tryEmitValue(Boolean.TRUE);
        }
    }

    /**
     * Abort this scope and detach it from its parent. Idempotent.
     */
    public void dispose() {
        abort();
        if (parent != null) {
            parent.children.remove(this);
        }
        parentLink.dispose();
    }

    /**
     * @return {@code true} if this scope or any of its ancestors has been cancelled.
     */
    public boolean isCancelled() {
        return aborted.get() || (parent != null && parent.isCancelled());
    }

    /**
     * @return A {@link Mono} that completes when this scope is cancelled.
     */
    public Mono<Void> cancelled() {
        return trigger.asMono().then();
    }

    /**
     * @return A read-only view of the cancellation signal of this scope.
     */
    public CancellationSignal signal() {
        return signal;
    }

    public String name() {
        return name;
    }

    /**
     * @return A snapshot of this scope and its (not yet disposed) descendants.
     */
    public ScopeNode tree() {
        return new ScopeNode(name, isCancelled(), children.stream().map(CancellationScope::tree).toList());
    }

    private String path() {
        return parent == null ? name : parent.path() + "/" + name;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", CancellationScope.class.getSimpleName() + "[", "]")
                .add("name='" + path() + "'")
                .add("cancelled=" + isCancelled())
                .add("children=" + children.size())
                .toString();
    }

    private class ScopeSignal implements CancellationSignal {

        @Override
        public boolean isAborted() {
            return isCancelled();
        }

        @Override
        public Mono<Void> whenAborted() {
            return cancelled();
        }

        @Override
        public Disposable onAbort(Runnable action) {
            requireNonNull(action, "action cannot be null");
            return trigger.asMono().subscribe(__ -> action.run());
        }
    }
}
