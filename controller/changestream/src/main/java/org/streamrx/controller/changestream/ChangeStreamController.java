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
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamrx.cancellation.CancellationScope;
import org.streamrx.cancellation.Cancellations;
import org.streamrx.changestream.*;
import org.streamrx.controller.Controller;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Controller} that publishes the records of a partitioned change stream.
 * <p>
 * While running, a discovery loop lists the partitions of the stream every {@link ChangeStreamControllerConfig#pollInterval}
 * (the first time immediately) and starts one poller per partition it hasn't seen before. A poller obtains a read-iterator
 * for its partition and then polls records until the backend reports that the partition is closed, publishing the records
 * in the order they were read. After a poll that returned no records the poller waits {@code pollInterval} before polling again.
 * </p>
 * <p>
 * Every call made by a poller is retried according to {@link ChangeStreamControllerConfig#partitionRetry}. When the retries
 * are exhausted, or a fatal error occurs, the poller gives up on its partition. Other partitions are unaffected. Errors from
 * the discovery loop are logged and the loop continues on the next tick.
 * </p>
 * <p>
 * Partitions that disappear from the listing are not stopped by the discovery loop, their pollers stop when the partitions
 * are reported as closed.
 * </p>
 *
 * @param <T> The type of the values stored in the table
 */
@NullMarked
public class ChangeStreamController<T> extends Controller<T, ChangeRecord<T>> {
    private static final Logger log = LoggerFactory.getLogger(ChangeStreamController.class);

    private final String streamId;
    private final ChangeStreamTransport transport;
    private final TableOperations table;
    private final ItemMapper<T> mapper;
    private final ChangeStreamControllerConfig config;
    private final RecordClassifier<T> classifier;
    private final Retry retry;

    private final Set<String> knownPartitions = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<String, ActivePartition> activePartitions = new ConcurrentHashMap<>();
    private volatile Disposable discovery = Disposables.disposed();
    private volatile @Nullable CancellationScope run;

    public ChangeStreamController(String id, String streamId, ChangeStreamTransport transport, TableOperations table, ItemMapper<T> mapper,
                                  ChangeStreamControllerConfig config, CancellationScope parentScope) {
        super(id, parentScope);
        if (streamId == null) {
            throw new IllegalArgumentException("streamId cannot be null");
        } else if (transport == null) {
            throw new IllegalArgumentException(ChangeStreamTransport.class.getSimpleName() + " cannot be null");
        } else if (table == null) {
            throw new IllegalArgumentException(TableOperations.class.getSimpleName() + " cannot be null");
        } else if (mapper == null) {
            throw new IllegalArgumentException(ItemMapper.class.getSimpleName() + " cannot be null");
        } else if (config == null) {
            throw new IllegalArgumentException(ChangeStreamControllerConfig.class.getSimpleName() + " cannot be null");
        }
        this.streamId = streamId;
        this.transport = transport;
        this.table = table;
        this.mapper = mapper;
        this.config = config;
        this.classifier = new RecordClassifier<>(config.ttlAttribute, mapper, config.clock);
        this.retry = config.partitionRetry.toReactorRetry(config.scheduler);
    }

    @Override
    protected void start() {
        CancellationScope run = scope().fork("run");
        this.run = run;
        AtomicBoolean firstTick = new AtomicBoolean(true);
        log.info("Starting to consume stream {} (pollInterval={}, startPosition={})", streamId, config.pollInterval, config.startPosition);

        Flux<List<Mono<Void>>> ticks = Flux.interval(Duration.ZERO, config.pollInterval, config.scheduler)
                .onBackpressureDrop(tick -> log.debug("Skipping discovery of stream {} since the previous discovery is still running", streamId))
                .concatMap(__ -> discover(run), 1)
                .doOnNext(positioned -> {
                    if (firstTick.compareAndSet(true, false)) {
                        Mono.when(positioned).subscribe(null, __ -> markReady(), this::markReady);
                    }
                });
        discovery = run.wrap(ticks).subscribe(null, e -> log.error("Discovery of stream {} stopped unexpectedly", streamId, e));
    }

    @Override
    protected void stop() {
        CancellationScope run = this.run;
        this.run = null;
        if (run != null) {
            run.dispose();
        }
        discovery.dispose();
        activePartitions.values().forEach(ActivePartition::dispose);
        activePartitions.clear();
        knownPartitions.clear();
        log.info("Stopped consuming stream {}", streamId);
    }

    @Override
    protected Mono<Void> doPut(T value) {
        return Mono.defer(() -> table.put(mapper.marshal(value)));
    }

    @Override
    protected Mono<Void> doPut(T value, Instant expiresAt) {
        return Mono.defer(() -> {
            String ttlAttribute = config.ttlAttribute;
            if (ttlAttribute == null) {
                return Mono.error(new IllegalStateException("Cannot put " + value + " with an expiry since controller " + id() + " has no time-to-live attribute"));
            }
            Map<String, Object> item = new LinkedHashMap<>(mapper.marshal(value));
            item.put(ttlAttribute, expiresAt.getEpochSecond());
            return table.put(item);
        });
    }

    @Override
    protected Mono<Void> doRemove(Map<String, Object> key) {
        return table.delete(key);
    }

    @Override
    protected Mono<T> doGet(Map<String, Object> key) {
        return table.get(key).map(mapper::unmarshal);
    }

    @Override
    protected Flux<T> doSnapshot() {
        return table.scan().map(mapper::unmarshal);
    }

    public String streamId() {
        return streamId;
    }

    public ChangeStreamControllerConfig config() {
        return config;
    }

    /**
     * @return The ids of the partitions that currently have a poller.
     */
    public Set<String> activePartitionIds() {
        return Set.copyOf(activePartitions.keySet());
    }

    /**
     * @return The ids of all partitions seen since the controller was last started.
     */
    public Set<String> knownPartitionIds() {
        return Set.copyOf(knownPartitions);
    }

    // Discovery

    /**
     * List the partitions and start a poller for every new one.
     *
     * @return Signals that complete when each new poller has acquired its read-iterator or terminated.
     */
    private Mono<List<Mono<Void>>> discover(CancellationScope run) {
        return transport.listPartitions(streamId)
                .onErrorResume(e -> !Cancellations.isCancellation(e), e -> {
                    log.warn("Failed to list partitions of stream {}, trying again in {}", streamId, config.pollInterval, e);
                    return Mono.just(List.of());
                })
                .map(partitions -> {
                    List<Mono<Void>> positioned = new ArrayList<>();
                    for (Partition partition : partitions) {
                        if (knownPartitions.add(partition.id()) && !run.isCancelled()) {
                            positioned.add(spawn(partition.id(), run));
                        }
                    }
                    return positioned;
                });
    }

    private Mono<Void> spawn(String partitionId, CancellationScope run) {
        Sinks.Empty<Void> positioned = Sinks.empty();
        ActivePartition partition = new ActivePartition(partitionId);
        if (activePartitions.putIfAbsent(partitionId, partition) != null) {
            return Mono.empty();
        }
        log.debug("Discovered partition {} of stream {}", partitionId, streamId);

        Disposable task = run.wrap(poll(partition, positioned))
                .doFinally(signal -> {
                    positioned.tryEmitEmpty();
                    activePartitions.remove(partitionId, partition);
                })
                .subscribeOn(config.scheduler)
                .subscribe();
        partition.task(task);
        return positioned.asMono();
    }

    // Polling

    private Flux<PollResult> poll(ActivePartition partition, Sinks.Empty<Void> positioned) {
        String partitionId = partition.id;
        return withRetry(transport.getReadIterator(streamId, partitionId, config.startPosition), "get read-iterator", partitionId)
                .doOnNext(iterator -> {
                    partition.iterator = iterator;
                    positioned.tryEmitEmpty();
                })
                .switchIfEmpty(Mono.fromRunnable(() -> log.debug("Partition {} of stream {} is closed", partitionId, streamId)))
                .flatMapMany(iterator -> pollRecords(partition, iterator)
                        .expand(result -> {
                            String next = result.nextIterator();
                            if (next == null) {
                                log.debug("Partition {} of stream {} is closed", partitionId, streamId);
                                return Mono.empty();
                            }
                            partition.iterator = next;
                            Mono<PollResult> nextPoll = pollRecords(partition, next);
                            return result.records().isEmpty() ? Mono.delay(config.pollInterval, config.scheduler).then(nextPoll) : nextPoll;
                        }))
                .onErrorResume(e -> {
                    if (Cancellations.isCancellation(e)) {
                        log.debug("Polling of partition {} of stream {} was cancelled", partitionId, streamId);
                    } else {
                        log.error("Giving up on partition {} of stream {}", partitionId, streamId, e);
                    }
                    return Mono.empty();
                });
    }

    private Mono<PollResult> pollRecords(ActivePartition partition, String iterator) {
        return withRetry(transport.pollRecords(iterator), "poll records", partition.id)
                .doOnNext(result -> publish(partition.id, result.records()));
    }

    private void publish(String partitionId, List<RawRecord> records) {
        for (RawRecord record : records) {
            classifier.classify(record, partitionId).ifPresent(this::emit);
        }
    }

    private <R> Mono<R> withRetry(Mono<R> call, String operation, String partitionId) {
        return call
                .doOnError(e -> !Cancellations.isCancellation(e), e -> log.warn("Failed to {} for partition {} of stream {}: {}", operation, partitionId, streamId, e.toString()))
                .retryWhen(retry);
    }

    private static final class ActivePartition {
        private final String id;
        private volatile @Nullable String iterator;
        private volatile Disposable task = Disposables.disposed();

        private ActivePartition(String id) {
            this.id = id;
        }

        private void task(Disposable task) {
            this.task = task;
        }

        private void dispose() {
            task.dispose();
        }
    }
}
