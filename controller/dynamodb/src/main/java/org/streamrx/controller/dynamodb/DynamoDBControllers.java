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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamrx.cancellation.CancellationScope;
import org.streamrx.cancellation.Cancellations;
import org.streamrx.changestream.FatalTransportException;
import org.streamrx.changestream.ItemMapper;
import org.streamrx.changestream.RetryableTransportException;
import org.streamrx.controller.ControllerRegistry;
import org.streamrx.controller.changestream.ChangeStreamControllerConfig;
import org.streamrx.retry.RetryStrategy;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;
import software.amazon.awssdk.services.dynamodb.streams.DynamoDbStreamsAsyncClient;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Creates {@link DynamoDBController}s, at most one per table.
 * <p>
 * The table is described first. A table that isn't {@code ACTIVE} yet is described again according to the table retry strategy,
 * a table without a stream is an error.
 * </p>
 */
@NullMarked
public class DynamoDBControllers {
    private static final Logger log = LoggerFactory.getLogger(DynamoDBControllers.class);
    private static final String ARN_PREFIX = "arn:aws:dynamodb:";
    // arn:aws:dynamodb:<region>:<account>:table/<name>[/stream/<label>]
    private static final String TABLE_RESOURCE = ":table/";

    /**
     * Describes a table at most 10 times, waiting up to 10 seconds between attempts.
     */
    public static final RetryStrategy DEFAULT_TABLE_RETRY = RetryStrategy.exponentialBackoff(Duration.ofMillis(500), Duration.ofSeconds(10), 2.0)
            .maxAttempts(10)
            .retryIf(t -> !Cancellations.isCancellation(t) && !(t instanceof FatalTransportException));

    private final DynamoDbAsyncClient dynamoDbClient;
    private final DynamoDBStreamsTransport transport;
    private final ControllerRegistry<DynamoDBController<?>> registry;
    private final CancellationScope scope;
    private final RetryStrategy tableRetry;

    public DynamoDBControllers(DynamoDbAsyncClient dynamoDbClient, DynamoDbStreamsAsyncClient streamsClient, ControllerRegistry<DynamoDBController<?>> registry,
                               CancellationScope scope) {
        this(dynamoDbClient, streamsClient, registry, scope, DEFAULT_TABLE_RETRY);
    }

    public DynamoDBControllers(DynamoDbAsyncClient dynamoDbClient, DynamoDbStreamsAsyncClient streamsClient, ControllerRegistry<DynamoDBController<?>> registry,
                               CancellationScope scope, RetryStrategy tableRetry) {
        requireNonNull(dynamoDbClient, DynamoDbAsyncClient.class.getSimpleName() + " cannot be null");
        requireNonNull(streamsClient, DynamoDbStreamsAsyncClient.class.getSimpleName() + " cannot be null");
        requireNonNull(registry, ControllerRegistry.class.getSimpleName() + " cannot be null");
        requireNonNull(scope, CancellationScope.class.getSimpleName() + " cannot be null");
        requireNonNull(tableRetry, RetryStrategy.class.getSimpleName() + " cannot be null");
        this.dynamoDbClient = dynamoDbClient;
        this.transport = new DynamoDBStreamsTransport(streamsClient);
        this.registry = registry;
        this.scope = scope;
        this.tableRetry = tableRetry;
    }

    /**
     * @param tableNameOrArn The name or the ARN of the table
     * @return The live controller of the table or a new one if there is none. The {@code mapper} and {@code config} are
     * ignored if the controller already exists.
     */
    @SuppressWarnings("unchecked")
    public <T> Mono<DynamoDBController<T>> from(String tableNameOrArn, ItemMapper<T> mapper, ChangeStreamControllerConfig config) {
        requireNonNull(tableNameOrArn, "tableNameOrArn cannot be null");
        requireNonNull(mapper, ItemMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(config, ChangeStreamControllerConfig.class.getSimpleName() + " cannot be null");
        String tableName = tableName(tableNameOrArn);
        return scope.wrap(describeActiveTable(tableName)
                .map(table -> (DynamoDBController<T>) registry.getOrCreate(table.tableArn(), tableArn -> {
                    log.info("Creating controller for table {} with stream {}", tableArn, table.latestStreamArn());
                    return new DynamoDBController<>(tableArn, table.latestStreamArn(), transport, new DynamoDBTableOperations(dynamoDbClient, tableName), mapper, config, scope);
                })));
    }

    public <T> Mono<DynamoDBController<T>> from(String tableNameOrArn, ItemMapper<T> mapper) {
        return from(tableNameOrArn, mapper, ChangeStreamControllerConfig.defaults());
    }

    private Mono<TableDescription> describeActiveTable(String tableName) {
        DescribeTableRequest request = DescribeTableRequest.builder().tableName(tableName).build();
        return Mono.fromFuture(() -> dynamoDbClient.describeTable(request))
                .onErrorMap(e -> DynamoDBErrors.translate(e, "DescribeTable"))
                .<TableDescription>handle((response, sink) -> {
                    TableDescription table = response.table();
                    if (table == null) {
                        sink.error(new FatalTransportException("Table " + tableName + " was not described"));
                    } else if (table.tableStatus() != TableStatus.ACTIVE) {
                        sink.error(new RetryableTransportException("Table " + tableName + " is " + table.tableStatusAsString() + ", waiting for it to become ACTIVE"));
                    } else if (table.latestStreamArn() == null) {
                        sink.error(new FatalTransportException("Table " + tableName + " has no stream enabled"));
                    } else {
                        sink.next(table);
                    }
                })
                .doOnError(e -> log.debug("Failed to describe table {}: {}", tableName, e.getMessage()))
                .retryWhen(tableRetry.toReactorRetry());
    }

    static String tableName(String tableNameOrArn) {
        if (tableNameOrArn.startsWith(ARN_PREFIX)) {
            int index = tableNameOrArn.indexOf(TABLE_RESOURCE);
            if (index < 0) {
                throw new IllegalArgumentException(tableNameOrArn + " is not a table ARN");
            }
            String rest = tableNameOrArn.substring(index + TABLE_RESOURCE.length());
            int slash = rest.indexOf('/');
            return slash < 0 ? rest : rest.substring(0, slash);
        }
        return tableNameOrArn;
    }
}
