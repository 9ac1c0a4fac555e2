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

package org.streamrx.retry.internal;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.streamrx.retry.Backoff;
import org.streamrx.retry.ErrorInfo;
import org.streamrx.retry.MaxAttempts;
import org.streamrx.retry.RetryStrategy;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.streamrx.retry.MaxAttempts.Infinite.infinite;

/**
 * A retry strategy that does retry. By default, the following settings are used:
 *
 * <ul>
 *     <li>No backoff</li>
 *     <li>Infinite number of retries</li>
 *     <li>Retries all errors</li>
 *     <li>No error listener (will retry silently)</li>
 * </ul>
 */
@NullMarked
public final class RetryImpl implements RetryStrategy.Retry {
    private static final BiConsumer<ErrorInfo, Throwable> NOOP_ERROR_LISTENER = (__, ___) -> {
    };

    final Backoff backoff;
    final MaxAttempts maxAttempts;
    final Predicate<Throwable> retryPredicate;
    final BiConsumer<ErrorInfo, Throwable> errorListener;

    private RetryImpl(Backoff backoff, MaxAttempts maxAttempts, Predicate<Throwable> retryPredicate, @Nullable BiConsumer<ErrorInfo, Throwable> errorListener) {
        Objects.requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(maxAttempts, MaxAttempts.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(retryPredicate, "Retry predicate cannot be null");
        this.backoff = backoff;
        this.maxAttempts = maxAttempts;
        this.retryPredicate = retryPredicate;
        this.errorListener = errorListener == null ? NOOP_ERROR_LISTENER : errorListener;
    }

    public RetryImpl() {
        this(Backoff.none(), infinite(), __ -> true, NOOP_ERROR_LISTENER);
    }

    @Override
    public Retry backoff(Backoff backoff) {
        Objects.requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public Retry infiniteAttempts() {
        return new RetryImpl(backoff, infinite(), retryPredicate, errorListener);
    }

    @Override
    public Retry maxAttempts(int maxAttempts) {
        return new RetryImpl(backoff, new MaxAttempts.Limit(maxAttempts), retryPredicate, errorListener);
    }

    @Override
    public Retry retryIf(Predicate<Throwable> retryPredicate) {
        Objects.requireNonNull(retryPredicate, "Retry predicate cannot be null");
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public Retry mapRetryPredicate(Function<Predicate<Throwable>, Predicate<Throwable>> retryPredicateFn) {
        Objects.requireNonNull(retryPredicateFn, "Retry predicate function cannot be null");
        return new RetryImpl(backoff, maxAttempts, retryPredicateFn.apply(retryPredicate), errorListener);
    }

    @Override
    public Retry onError(BiConsumer<ErrorInfo, Throwable> errorListener) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public Retry onError(Consumer<Throwable> errorListener) {
        Objects.requireNonNull(errorListener, "Error listener cannot be null");
        return onError((__, throwable) -> errorListener.accept(throwable));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryImpl that)) return false;
        return Objects.equals(backoff, that.backoff) && Objects.equals(maxAttempts, that.maxAttempts) && Objects.equals(retryPredicate, that.retryPredicate) && Objects.equals(errorListener, that.errorListener);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryImpl.class.getSimpleName() + "[", "]")
                .add("backoff=" + backoff)
                .add("maxAttempts=" + maxAttempts)
                .add("retryPredicate=" + retryPredicate)
                .add("errorListener=" + errorListener)
                .toString();
    }
}
