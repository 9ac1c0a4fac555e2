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

import org.jspecify.annotations.Nullable;

import java.util.concurrent.CancellationException;

/**
 * Cancellation is an expected way for work to end and is never reported as a failure. Use {@link #isCancellation(Throwable)}
 * at catch sites to tell the two apart.
 */
public final class Cancellations {
    private static final int MAX_CAUSE_DEPTH = 16;

    private Cancellations() {
    }

    /**
     * @return {@code true} if {@code throwable}, or one of its causes, represents a cancellation.
     */
    public static boolean isCancellation(@Nullable Throwable throwable) {
        Throwable current = throwable;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof CancellationException || current instanceof InterruptedException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * @return A new {@link CancellationException} with the given cause attached.
     */
    public static CancellationException cancellation(String message, @Nullable Throwable cause) {
        CancellationException exception = new CancellationException(message);
        if (cause != null) {
            exception.initCause(cause);
        }
        return exception;
    }
}
