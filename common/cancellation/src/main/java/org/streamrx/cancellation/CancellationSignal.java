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

import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * A read-only handle to the cancellation signal of a {@link CancellationScope}.
 */
public interface CancellationSignal {

    /**
     * @return {@code true} if the owning scope, or one of its ancestors, has been cancelled.
     */
    boolean isAborted();

    /**
     * @return A {@link Mono} that completes when the signal fires. Completes immediately if it has already fired.
     */
    Mono<Void> whenAborted();

    /**
     * Run {@code action} when the signal fires (immediately if it has already fired).
     *
     * @return A {@link Disposable} that unregisters the action.
     */
    Disposable onAbort(Runnable action);
}
