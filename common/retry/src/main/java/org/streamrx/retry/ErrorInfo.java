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

import java.time.Duration;
import java.util.Optional;

/**
 * Contains useful information of the state of the retry when an error has been signalled
 */
public interface ErrorInfo {

    /**
     * @return The number of the attempt that failed, {@code 1} if first attempt.
     */
    int getAttemptNumber();

    /**
     * @return The maximum number of attempts configured for the retry. Returns {@code Integer.MAX_VALUE} if infinite.
     */
    int getMaxAttempts();

    /**
     * @return The number of attempts left before giving up
     */
    default int getAttemptsLeft() {
        return getMaxAttempts() == Integer.MAX_VALUE ? Integer.MAX_VALUE : getMaxAttempts() - getAttemptNumber();
    }

    /**
     * @return An {@code Optional} containing how long to wait before the next retry attempt kicks in case there additional retries left, or an {@code empty} {@code Optional}.
     */
    Optional<Duration> getBackoffBeforeNextRetryAttempt();

    /**
     * @return {@code true} if the error will be retried, {@code false} otherwise.
     */
    boolean isRetryable();
}
