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
import org.jspecify.annotations.Nullable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * A value that has been submitted to a {@link ConfirmingWriter} but not yet confirmed.
 *
 * @param <T> The type of the value
 * @param <E> The event type that confirms the value
 */
@NullMarked
public final class PendingWrite<T, E> {
    private final T value;
    private final Sinks.One<T> completion = Sinks.one();
    private volatile @Nullable EchoMatcher<E> matcher;
    private volatile boolean done;

    PendingWrite(T value) {
        this.value = value;
    }

    public T value() {
        return value;
    }

    /**
     * @return The matcher of the written value, {@code null} until the value has been stored
     */
    public @Nullable EchoMatcher<E> matcher() {
        return matcher;
    }

    public Mono<T> result() {
        return completion.asMono();
    }

    public boolean isDone() {
        return done;
    }

    void stored(EchoMatcher<E> matcher) {
        this.matcher = matcher;
    }

    boolean resolve() {
        return complete(completion.tryEmitValue(value));
    }

    boolean fail(Throwable throwable) {
        return complete(completion.tryEmitError(throwable));
    }

    private boolean complete(Sinks.EmitResult result) {
        if (result.isSuccess()) {
            done = true;
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "PendingWrite{value=" + value + ", stored=" + (matcher != null) + ", done=" + done + '}';
    }
}
