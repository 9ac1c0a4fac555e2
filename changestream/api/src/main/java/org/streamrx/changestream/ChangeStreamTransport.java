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

package org.streamrx.changestream;

import org.jspecify.annotations.NullMarked;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The three calls a change stream consumer makes against the backend. Every call is lazy and cancelling the subscription
 * aborts the call without side effects.
 * <p>
 * Implementations signal {@link RetryableTransportException} for errors that may go away if the call is repeated and
 * {@link FatalTransportException} for everything else.
 * </p>
 */
@NullMarked
public interface ChangeStreamTransport {

    /**
     * @param streamId The stream to describe
     * @return All partitions that currently make up the stream, open as well as closed.
     */
    Mono<List<Partition>> listPartitions(String streamId);

    /**
     * @param streamId      The stream
     * @param partitionId   The partition in the stream
     * @param startPosition Where in the partition to start reading
     * @return A read-iterator for the partition or an empty {@code Mono} if the partition is closed.
     */
    Mono<String> getReadIterator(String streamId, String partitionId, StartPosition startPosition);

    /**
     * @param iterator A read-iterator previously returned by {@link #getReadIterator(String, String, StartPosition)} or by
     *                 {@link PollResult#nextIterator()}.
     * @return The next batch of records together with the iterator to use for the batch after that.
     */
    Mono<PollResult> pollRecords(String iterator);
}
