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

package org.streamrx.controller.changestream;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;
import org.streamrx.cancellation.Cancellations;
import org.streamrx.changestream.FatalTransportException;
import org.streamrx.changestream.StartPosition;
import org.streamrx.retry.RetryStrategy;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Configuration of a {@link ChangeStreamController}.
 */
@NullMarked
public class ChangeStreamControllerConfig {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(5000);
    public static final String DEFAULT_TTL_ATTRIBUTE = "expires";

    /**
     * Retries everything but cancellation and fatal transport errors 3 times, waiting 1, 2 and 4 seconds.
     */
    public static final RetryStrategy DEFAULT_PARTITION_RETRY = RetryStrategy.exponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0)
            .maxAttempts(4)
            .retryIf(t -> !Cancellations.isCancellation(t) && !(t instanceof FatalTransportException));

    public final Duration pollInterval;
    public final @Nullable String ttlAttribute;
    public final StartPosition startPosition;
    public final RetryStrategy partitionRetry;
    public final Scheduler scheduler;
    public final Clock clock;

    private ChangeStreamControllerConfig(Duration pollInterval, @Nullable String ttlAttribute, StartPosition startPosition, RetryStrategy partitionRetry,
                                         Scheduler scheduler, Clock clock) {
        Objects.requireNonNull(pollInterval, "Poll interval cannot be null");
        Objects.requireNonNull(startPosition, StartPosition.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(partitionRetry, RetryStrategy.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(scheduler, Scheduler.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be greater than zero, was " + pollInterval);
        }
        this.pollInterval = pollInterval;
        this.ttlAttribute = ttlAttribute;
        this.startPosition = startPosition;
        this.partitionRetry = partitionRetry;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * @return A config with default settings
     */
    public static ChangeStreamControllerConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeStreamControllerConfig that)) return false;
        return Objects.equals(pollInterval, that.pollInterval) && Objects.equals(ttlAttribute, that.ttlAttribute) && startPosition == that.startPosition
                && Objects.equals(partitionRetry, that.partitionRetry) && Objects.equals(scheduler, that.scheduler) && Objects.equals(clock, that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pollInterval, ttlAttribute, startPosition, partitionRetry, scheduler, clock);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ChangeStreamControllerConfig.class.getSimpleName() + "[", "]")
                .add("pollInterval=" + pollInterval)
                .add("ttlAttribute='" + ttlAttribute + "'")
                .add("startPosition=" + startPosition)
                .add("partitionRetry=" + partitionRetry)
                .add("scheduler=" + scheduler)
                .add("clock=" + clock)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private String ttlAttribute = DEFAULT_TTL_ATTRIBUTE;
        private StartPosition startPosition = StartPosition.LATEST;
        private RetryStrategy partitionRetry = DEFAULT_PARTITION_RETRY;
        private Scheduler scheduler = Schedulers.parallel();
        private Clock clock = Clock.systemUTC();

        /**
         * @param pollInterval How often partitions are discovered and how long to wait after a poll that returned no records. Default is 5 seconds.
         * @return The builder instance
         */
        @NullMarked
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * @param ttlAttribute The attribute holding the expiry time (epoch seconds) of an item, {@code null} disables expiry detection. Default is {@value DEFAULT_TTL_ATTRIBUTE}.
         * @return The builder instance
         */
        public Builder ttlAttribute(String ttlAttribute) {
            this.ttlAttribute = ttlAttribute;
            return this;
        }

        /**
         * @param startPosition Where to start reading newly discovered partitions. Default is {@link StartPosition#LATEST}.
         * @return The builder instance
         */
        @NullMarked
        public Builder startPosition(StartPosition startPosition) {
            this.startPosition = startPosition;
            return this;
        }

        /**
         * @param partitionRetry How calls made by a partition poller are retried before the partition is given up on.
         * @return The builder instance
         * @see #DEFAULT_PARTITION_RETRY
         */
        @NullMarked
        public Builder partitionRetry(RetryStrategy partitionRetry) {
            this.partitionRetry = partitionRetry;
            return this;
        }

        @NullMarked
        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        @NullMarked
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        @NullMarked
        public ChangeStreamControllerConfig build() {
            return new ChangeStreamControllerConfig(pollInterval, ttlAttribute, startPosition, partitionRetry, scheduler, clock);
        }
    }
}
