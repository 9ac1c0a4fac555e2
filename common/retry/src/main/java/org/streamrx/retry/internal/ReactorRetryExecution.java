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
import org.streamrx.retry.ErrorInfo;
import org.streamrx.retry.MaxAttempts;
import org.streamrx.retry.RetryStrategy;
import org.streamrx.retry.RetryStrategy.DontRetry;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Internal class for rendering a {@link RetryStrategy} as a reactor {@link Retry}. Never use this class directly from your own code!
 */
@NullMarked
public class ReactorRetryExecution {

    public static Retry toReactorRetry(RetryStrategy retryStrategy, Scheduler scheduler) {
        Objects.requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(scheduler, Scheduler.class.getSimpleName() + " cannot be null");
        if (retryStrategy instanceof DontRetry) {
            return Retry.max(0).onRetryExhaustedThrow((spec, signal) -> signal.failure());
        }
        RetryImpl retry = (RetryImpl) retryStrategy;
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            int attemptNumber = (int) Math.min(Integer.MAX_VALUE - 1, signal.totalRetries() + 1);
            boolean shouldRetryAgain = !isExhausted(attemptNumber, retry.maxAttempts) && retry.retryPredicate.test(failure);
            Duration backoff = shouldRetryAgain ? retry.backoff.delayBeforeRetry(attemptNumber) : null;

            retry.errorListener.accept(new ErrorInfoImpl(attemptNumber, maxAttempts(retry.maxAttempts), backoff), failure);

            if (backoff == null) {
                return Mono.error(failure);
            } else if (backoff.isZero()) {
                return Mono.just(attemptNumber);
            } else {
                return Mono.delay(backoff, scheduler).thenReturn(attemptNumber);
            }
        }));
    }

    private static boolean isExhausted(int attempt, MaxAttempts maxAttempts) {
        if (maxAttempts instanceof MaxAttempts.Infinite) {
            return false;
        }
        return attempt >= ((MaxAttempts.Limit) maxAttempts).limit();
    }

    private static int maxAttempts(MaxAttempts maxAttempts) {
        return maxAttempts instanceof MaxAttempts.Limit limit ? limit.limit() : Integer.MAX_VALUE;
    }

    private record ErrorInfoImpl(int attemptNumber, int maxAttempts, @Nullable Duration backoff) implements ErrorInfo {

        @Override
        public int getAttemptNumber() {
            return attemptNumber;
        }

        @Override
        public int getMaxAttempts() {
            return maxAttempts;
        }

        @Override
        public Optional<Duration> getBackoffBeforeNextRetryAttempt() {
            return Optional.ofNullable(backoff);
        }

        @Override
        public boolean isRetryable() {
            return backoff != null;
        }
    }
}
