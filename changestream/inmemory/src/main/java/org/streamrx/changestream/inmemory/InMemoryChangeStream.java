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

package org.streamrx.changestream.inmemory;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamrx.changestream.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * A table and its change stream kept in-memory. This is mainly useful for testing and/or demo purposes.
 * <p>
 * Every write is appended to the currently open partition. {@link #splitPartition()} closes the open partition and opens a
 * new one, the same way a backend reshards a stream. Read-iterators have the form {@code <partitionId>:<offset>}.
 * </p>
 */
@NullMarked
public class InMemoryChangeStream implements ChangeStreamTransport, TableOperations {
    private static final Logger log = LoggerFactory.getLogger(InMemoryChangeStream.class);
    private static final int DEFAULT_MAX_BATCH_SIZE = 1000;

    private final String streamId;
    private final List<String> keyAttributes;
    private final Clock clock;
    private final int maxBatchSize;

    private final Object lock = new Object();
    // Insertion order is the iteration order of the table
    private final Map<Map<String, Object>, Map<String, Object>> table = new LinkedHashMap<>();
    private final Map<String, PartitionLog> partitions = new LinkedHashMap<>();
    private PartitionLog openPartition;
    private long sequenceNumber;

    /**
     * Create an instance of {@link InMemoryChangeStream} keyed by the {@code id} attribute.
     */
    public InMemoryChangeStream(String streamId) {
        this(streamId, Clock.systemUTC(), List.of("id"), DEFAULT_MAX_BATCH_SIZE);
    }

    /**
     * @param streamId      The id of the stream, calls for other stream ids fail with a {@link FatalTransportException}.
     * @param clock         The clock used to timestamp records.
     * @param keyAttributes The attributes that make up the key of an item.
     * @param maxBatchSize  The max number of records returned by a single poll.
     */
    public InMemoryChangeStream(String streamId, Clock clock, List<String> keyAttributes, int maxBatchSize) {
        requireNonNull(streamId, "streamId cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        requireNonNull(keyAttributes, "keyAttributes cannot be null");
        if (keyAttributes.isEmpty()) {
            throw new IllegalArgumentException("keyAttributes cannot be empty");
        } else if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be greater than 0");
        }
        this.streamId = streamId;
        this.clock = clock;
        this.keyAttributes = List.copyOf(keyAttributes);
        this.maxBatchSize = maxBatchSize;
        this.openPartition = newPartition();
    }

    public String streamId() {
        return streamId;
    }

    // Transport

    @Override
    public Mono<List<Partition>> listPartitions(String streamId) {
        return Mono.fromCallable(() -> {
            requireStream(streamId);
            synchronized (lock) {
                return partitions.keySet().stream().map(Partition::new).toList();
            }
        });
    }

    @Override
    public Mono<String> getReadIterator(String streamId, String partitionId, StartPosition startPosition) {
        return Mono.fromCallable(() -> {
            requireStream(streamId);
            synchronized (lock) {
                PartitionLog partition = requirePartition(partitionId);
                return switch (startPosition) {
                    case OLDEST -> iterator(partitionId, 0);
                    case LATEST -> partition.closed ? null : iterator(partitionId, partition.records.size());
                };
            }
        });
    }

    @Override
    public Mono<PollResult> pollRecords(String iterator) {
        return Mono.fromCallable(() -> {
            int separator = iterator.lastIndexOf(':');
            if (separator < 1) {
                throw new FatalTransportException("Malformed iterator: " + iterator);
            }
            String partitionId = iterator.substring(0, separator);
            int offset;
            try {
                offset = Integer.parseInt(iterator.substring(separator + 1));
            } catch (NumberFormatException e) {
                throw new FatalTransportException("Malformed iterator: " + iterator, e);
            }

            synchronized (lock) {
                PartitionLog partition = requirePartition(partitionId);
                if (offset < 0 || offset > partition.records.size()) {
                    throw new FatalTransportException("Iterator " + iterator + " is out of range");
                }
                int end = Math.min(partition.records.size(), offset + maxBatchSize);
                List<RawRecord> batch = List.copyOf(partition.records.subList(offset, end));
                boolean exhausted = partition.closed && end == partition.records.size();
                return PollResult.of(batch, exhausted ? null : iterator(partitionId, end));
            }
        });
    }

    // Table

    @Override
    public Mono<Void> put(Map<String, Object> item) {
        return Mono.fromRunnable(() -> {
            requireNonNull(item, "item cannot be null");
            Map<String, Object> key = keyOf(item);
            Map<String, Object> newValue = copy(item);
            synchronized (lock) {
                Map<String, Object> oldValue = table.put(key, newValue);
                append(oldValue == null ? EventKind.INSERT : EventKind.MODIFY, key, newValue, oldValue);
            }
        });
    }

    @Override
    public Mono<Void> delete(Map<String, Object> key) {
        return Mono.fromRunnable(() -> {
            Map<String, Object> itemKey = keyOf(key);
            synchronized (lock) {
                Map<String, Object> oldValue = table.remove(itemKey);
                if (oldValue != null) {
                    append(EventKind.REMOVE, itemKey, null, oldValue);
                }
            }
        });
    }

    @Override
    public Mono<Map<String, Object>> get(Map<String, Object> key) {
        return Mono.fromCallable(() -> {
            Map<String, Object> itemKey = keyOf(key);
            synchronized (lock) {
                Map<String, Object> item = table.get(itemKey);
                return item == null ? null : copy(item);
            }
        });
    }

    /**
     * Emits a copy of the items taken when subscribed, in insertion order.
     */
    @Override
    public Flux<Map<String, Object>> scan() {
        return Flux.defer(() -> {
            List<Map<String, Object>> items;
            synchronized (lock) {
                items = table.values().stream().map(InMemoryChangeStream::copy).toList();
            }
            return Flux.fromIterable(items);
        });
    }

    // Simulation

    /**
     * Close the open partition and open a new one. Later writes end up in the new partition.
     *
     * @return The new partition
     */
    public Partition splitPartition() {
        synchronized (lock) {
            openPartition.closed = true;
            PartitionLog closed = openPartition;
            openPartition = newPartition();
            log.debug("Split partition {} into {} (stream={})", closed.id, openPartition.id, streamId);
            return new Partition(openPartition.id);
        }
    }

    /**
     * Delete every item whose {@code ttlAttribute}, interpreted as epoch seconds, has elapsed according to the clock. The
     * deletions are streamed as ordinary {@link EventKind#REMOVE} records, the same way a backend's TTL sweeper does it.
     *
     * @return The number of expired items
     */
    public int expireElapsed(String ttlAttribute) {
        requireNonNull(ttlAttribute, "ttlAttribute cannot be null");
        long now = clock.instant().getEpochSecond();
        int expired = 0;
        synchronized (lock) {
            Iterator<Map.Entry<Map<String, Object>, Map<String, Object>>> iterator = table.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<Map<String, Object>, Map<String, Object>> entry = iterator.next();
                if (entry.getValue().get(ttlAttribute) instanceof Number ttl && ttl.longValue() <= now) {
                    iterator.remove();
                    append(EventKind.REMOVE, entry.getKey(), null, entry.getValue());
                    expired++;
                }
            }
        }
        return expired;
    }

    /**
     * Append a record as-is to the open partition, bypassing the table.
     */
    public void appendRecord(RawRecord record) {
        requireNonNull(record, RawRecord.class.getSimpleName() + " cannot be null");
        synchronized (lock) {
            openPartition.records.add(record);
        }
    }

    public String nextSequenceToken() {
        synchronized (lock) {
            return sequenceToken(++sequenceNumber);
        }
    }

    public int size() {
        synchronized (lock) {
            return table.size();
        }
    }

    private void append(EventKind eventKind, Map<String, Object> key, @Nullable Map<String, Object> newValue, @Nullable Map<String, Object> oldValue) {
        String sequenceToken = sequenceToken(++sequenceNumber);
        Instant timestamp = clock.instant();
        StreamEntry entry = new StreamEntry(openPartition.id, openPartition.records.size(), sequenceToken);
        openPartition.records.add(new RawRecord(eventKind, key, newValue, oldValue, sequenceToken, timestamp, entry));
        log.trace("Appended {} record {} to partition {}", eventKind, sequenceToken, openPartition.id);
    }

    private PartitionLog newPartition() {
        PartitionLog partition = new PartitionLog(String.format("shard-%05d", partitions.size() + 1));
        partitions.put(partition.id, partition);
        return partition;
    }

    private PartitionLog requirePartition(String partitionId) {
        PartitionLog partition = partitions.get(partitionId);
        if (partition == null) {
            throw new FatalTransportException("Partition " + partitionId + " doesn't exist in stream " + streamId);
        }
        return partition;
    }

    private void requireStream(String streamId) {
        if (!this.streamId.equals(streamId)) {
            throw new FatalTransportException("Stream " + streamId + " doesn't exist");
        }
    }

    private Map<String, Object> keyOf(Map<String, Object> item) {
        requireNonNull(item, "key cannot be null");
        Map<String, Object> key = new LinkedHashMap<>();
        for (String keyAttribute : keyAttributes) {
            Object value = item.get(keyAttribute);
            if (value == null) {
                throw new IllegalArgumentException("Key attribute " + keyAttribute + " is missing");
            }
            key.put(keyAttribute, value);
        }
        return Collections.unmodifiableMap(key);
    }

    private static Map<String, Object> copy(Map<String, Object> item) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(item));
    }

    private static String iterator(String partitionId, int offset) {
        return partitionId + ":" + offset;
    }

    private static String sequenceToken(long sequenceNumber) {
        return String.format("%021d", sequenceNumber);
    }

    /**
     * The payload of records written through the table
     */
    public record StreamEntry(String partitionId, int offset, String sequenceToken) {
    }

    private static final class PartitionLog {
        private final String id;
        private final List<RawRecord> records = new ArrayList<>();
        private boolean closed;

        private PartitionLog(String id) {
            this.id = id;
        }
    }
}
