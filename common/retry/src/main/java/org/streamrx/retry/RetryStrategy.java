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

package org.streamrx.retry;

import org.jspecify.annotations.NullMarked;
import org.streamrx.retry.internal.ReactorRetryExecution;
import org.streamrx.retry.internal.RetryImpl;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Retry strategy to use if an asynchronous action fails.
 * <p>
 * A {@code RetryStrategy} is thread-safe and immutable, so you can change the settings at any time without impacting the original instance.
 * For example this is perfectly valid:
 * <p>
 * <pre>
 * Retry retryStrategy = RetryStrategy.exponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0).maxAttempts(4);
 * // Retries IllegalStateException at most 3 times
 * mono.retryWhen(retryStrategy.retryIf(IllegalStateException.class::isInstance).toReactorRetry());
 * // Retries everything at most 3 times
 * mono.retryWhen(retryStrategy.toReactorRetry());
 * </pre>
 * </p>
 */
@NullMarked
public interface RetryStrategy {
    /**
     * Create a retry strategy that performs retries if errors are signalled.
     *
     * @return {@link RetryImpl}
     * @see RetryImpl
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * Create a retry strategy that doesn't perform retries (i.e. retries are disabled).
     *
     * @return {@link DontRetry}
     * @see DontRetry
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    /**
     * Shortcut to create a retry strategy with exponential backoff. This is the same as doing:
     *
     * <pre>
     * RetryStrategy.retry().backoff(Backoff.exponential(..));
     * </pre>
     *
     * @param initial    The initial wait time before retrying the first time
     * @param max        Max wait time
     * @param multiplier Multiplier between retries
     * @return A retry strategy with exponential backoff
     */
    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return RetryStrategy.retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    /**
     * Shortcut to create a retry strategy with fixed backoff. This is the same as doing:
     *
     * <pre>
     * RetryStrategy.retry().backoff(Backoff.fixed(..));
     * </pre>
     *
     * @param duration The duration to wait before retry
     * @return A retry strategy with fixed backoff
     */
    static Retry fixed(Duration duration) {
        return RetryStrategy.retry().backoff(Backoff.fixed(duration));
    }

    /**
     * Render this strategy as a <a href="https://projectreactor.io/">project reactor</a> retry spec, for use with
     * {@code retryWhen}. Backoff delays are scheduled on {@link Schedulers#parallel()}. When the strategy is exhausted, or the error is
     * not retryable, the <i>original</i> error is propagated.
     *
     * @return A {@link reactor.util.retry.Retry} instance that honors this strategy.
     */
    default reactor.util.retry.Retry toReactorRetry() {
        return toReactorRetry(Schedulers.parallel());
    }

    /**
     * Same as {@link #toReactorRetry()} but backoff delays are scheduled on the supplied {@code scheduler}.
     */
    default reactor.util.retry.Retry toReactorRetry(Scheduler scheduler) {
        return ReactorRetryExecution.toReactorRetry(this, scheduler);
    }

    /**
     * A retry strategy that doesn't retry at all. Just propagates the error.
     */
    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    interface Retry extends RetryStrategy {
        /**
         * Configure the backoff settings for the retry strategy.
         *
         * @param backoff The backoff to use.
         * @return A new instance of {@link Retry} with the backoff settings applied.
         * @see Backoff
         */
        Retry backoff(Backoff backoff);

        /**
         * Retry an infinite number of times (this is default).
         *
         * @return A new instance of {@link Retry} with infinite number of retry attempts.
         * @see #maxAttempts(int)
         */
        Retry infiniteAttempts();

        /**
         * Specify the max number of attempts (the first attempt included) before failing.
         *
         * @return A new instance of {@link Retry} with the max number of attempts configured.
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Only retry if the specified predicate is {@code true}. Will override previous retry predicate.
         *
         * @return A new instance of {@link Retry} with the given retry predicate
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Allows you to specify a retry predicate by basing it on the current retry predicate.
         *
         * @return A new instance of {@link Retry} with the given retry predicate
         */
        Retry mapRetryPredicate(Function<Predicate<Throwable>, Predicate<Throwable>> retryPredicateFn);

        /**
         * Add an error listener that will be invoked for every error that happens during the execution.
         * You can use {@link ErrorInfo#isRetryable()} to check if the error matches what's specified by the {@link #retryIf(Predicate)},
         * or if number of attempts have been exhausted.
         *
         * @param errorListener The consumer to invoke
         * @return A new instance of {@link Retry} with the given error listener
         */
        Retry onError(BiConsumer<ErrorInfo, Throwable> errorListener);

        /**
         * @param errorListener The consumer to invoke
         * @return A new instance of {@link Retry} with the given error listener
         * @see #onError(BiConsumer)
         */
        Retry onError(Consumer<Throwable> errorListener);
    }
}
