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

package org.streamrx.controller.dynamodb;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.streamrx.changestream.*;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.dynamodb.model.*;
import software.amazon.awssdk.services.dynamodb.model.Record;
import software.amazon.awssdk.services.dynamodb.streams.DynamoDbStreamsAsyncClient;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ChangeStreamTransport} for DynamoDB Streams. The stream id is the stream ARN and partitions are shards.
 */
@NullMarked
public class DynamoDBStreamsTransport implements ChangeStreamTransport {
    private final DynamoDbStreamsAsyncClient client;

    public DynamoDBStreamsTransport(DynamoDbStreamsAsyncClient client) {
        requireNonNull(client, DynamoDbStreamsAsyncClient.class.getSimpleName() + " cannot be null");
        this.client = client;
    }

    @Override
    public Mono<List<Partition>> listPartitions(String streamArn) {
        return describeStream(streamArn, null)
                .expand(description -> description.lastEvaluatedShardId() == null ? Mono.empty() : describeStream(streamArn, description.lastEvaluatedShardId()))
                .flatMapIterable(StreamDescription::shards)
                .map(shard -> new Partition(shard.shardId()))
                .collectList();
    }

    @Override
    public Mono<String> getReadIterator(String streamArn, String shardId, StartPosition startPosition) {
        GetShardIteratorRequest request = GetShardIteratorRequest.builder()
                .streamArn(streamArn)
                .shardId(shardId)
                .shardIteratorType(startPosition == StartPosition.OLDEST ? ShardIteratorType.TRIM_HORIZON : ShardIteratorType.LATEST)
                .build();
        return call(() -> client.getShardIterator(request), "GetShardIterator")
                .mapNotNull(GetShardIteratorResponse::shardIterator);
    }

    @Override
    public Mono<PollResult> pollRecords(String iterator) {
        GetRecordsRequest request = GetRecordsRequest.builder().shardIterator(iterator).build();
        return call(() -> client.getRecords(request), "GetRecords")
                .map(response -> PollResult.of(response.records().stream().map(DynamoDBStreamsTransport::toRawRecord).toList(), response.nextShardIterator()));
    }

    private Mono<StreamDescription> describeStream(String streamArn, @Nullable String exclusiveStartShardId) {
        DescribeStreamRequest request = DescribeStreamRequest.builder()
                .streamArn(streamArn)
                .exclusiveStartShardId(exclusiveStartShardId)
                .build();
        return call(() -> client.describeStream(request), "DescribeStream")
                .handle((response, sink) -> {
                    if (response.streamDescription() == null) {
                        sink.error(new FatalTransportException("DescribeStream returned no description for " + streamArn));
                    } else {
                        sink.next(response.streamDescription());
                    }
                });
    }

    static RawRecord toRawRecord(Record record) {
        StreamRecord streamRecord = record.dynamodb();
        if (streamRecord == null) {
            return new RawRecord(toEventKind(record.eventName()), Map.of(), null, null, null, null, record);
        }
        return new RawRecord(toEventKind(record.eventName()),
                AttributeValues.toMap(streamRecord.keys()),
                streamRecord.hasNewImage() ? AttributeValues.toMap(streamRecord.newImage()) : null,
                streamRecord.hasOldImage() ? AttributeValues.toMap(streamRecord.oldImage()) : null,
                streamRecord.sequenceNumber(),
                streamRecord.approximateCreationDateTime(),
                record);
    }

    private static @Nullable EventKind toEventKind(@Nullable OperationType operationType) {
        if (operationType == null) {
            return null;
        }
        return switch (operationType) {
            case INSERT -> EventKind.INSERT;
            case MODIFY -> EventKind.MODIFY;
            case REMOVE -> EventKind.REMOVE;
            default -> null;
        };
    }

    private static <R> Mono<R> call(Supplier<CompletableFuture<R>> call, String operation) {
        return Mono.fromFuture(call).onErrorMap(e -> DynamoDBErrors.translate(e, operation));
    }
}
