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

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * How long to wait between attempts.
 */
@NullMarked
public sealed interface Backoff {

    static Backoff none() {
        return None.INSTANCE;
    }

    static Backoff fixed(long millis) {
        return fixed(Duration.ofMillis(millis));
    }

    static Backoff fixed(Duration duration) {
        return new Fixed(duration);
    }

    static Backoff exponential(Duration initial, Duration max, double multiplier) {
        return new Exponential(initial, max, multiplier);
    }

    /**
     * @param retryNumber The number of the retry that is about to take place, {@code 1} for the first retry.
     * @return The duration to wait before that retry.
     */
    Duration delayBeforeRetry(int retryNumber);

    record None() implements Backoff {
        private static final None INSTANCE = new None();

        @Override
        public Duration delayBeforeRetry(int retryNumber) {
            return Duration.ZERO;
        }
    }

    record Fixed(Duration duration) implements Backoff {
        public Fixed {
            requireNonNull(duration, Duration.class.getSimpleName() + " cannot be null");
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Duration cannot be negative");
            }
        }

        @Override
        public Duration delayBeforeRetry(int retryNumber) {
            return duration;
        }
    }

    record Exponential(Duration initial, Duration max, double multiplier) implements Backoff {
        public Exponential {
            requireNonNull(initial, "Initial duration cannot be null");
            requireNonNull(max, "Max duration cannot be null");
            if (initial.isNegative() || initial.compareTo(max) > 0) {
                throw new IllegalArgumentException("Initial duration must be positive and less than or equal to max duration, was " + initial);
            } else if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than or equal to 1.0, was " + multiplier);
            }
        }

        @Override
        public Duration delayBeforeRetry(int retryNumber) {
            if (retryNumber < 1) {
                throw new IllegalArgumentException("retryNumber must be greater than 0");
            }
            double millis = initial.toMillis() * Math.pow(multiplier, retryNumber - 1);
            return millis >= max.toMillis() ? max : Duration.ofMillis(Math.round(millis));
        }
    }
}
