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
import org.streamrx.changestream.TableOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Writes and reads items of a single DynamoDB table. Reads are strongly consistent.
 */
@NullMarked
public class DynamoDBTableOperations implements TableOperations {
    private final DynamoDbAsyncClient client;
    private final String tableName;

    public DynamoDBTableOperations(DynamoDbAsyncClient client, String tableName) {
        requireNonNull(client, DynamoDbAsyncClient.class.getSimpleName() + " cannot be null");
        requireNonNull(tableName, "tableName cannot be null");
        this.client = client;
        this.tableName = tableName;
    }

    @Override
    public Mono<Void> put(Map<String, Object> item) {
        PutItemRequest request = PutItemRequest.builder().tableName(tableName).item(AttributeValues.fromMap(item)).build();
        return Mono.fromFuture(() -> client.putItem(request))
                .onErrorMap(e -> DynamoDBErrors.translate(e, "PutItem"))
                .then();
    }

    @Override
    public Mono<Void> delete(Map<String, Object> key) {
        DeleteItemRequest request = DeleteItemRequest.builder().tableName(tableName).key(AttributeValues.fromMap(key)).build();
        return Mono.fromFuture(() -> client.deleteItem(request))
                .onErrorMap(e -> DynamoDBErrors.translate(e, "DeleteItem"))
                .then();
    }

    @Override
    public Mono<Map<String, Object>> get(Map<String, Object> key) {
        GetItemRequest request = GetItemRequest.builder().tableName(tableName).key(AttributeValues.fromMap(key)).consistentRead(true).build();
        return Mono.fromFuture(() -> client.getItem(request))
                .onErrorMap(e -> DynamoDBErrors.translate(e, "GetItem"))
                .filter(GetItemResponse::hasItem)
                .map(response -> AttributeValues.toMap(response.item()));
    }

    @Override
    public Flux<Map<String, Object>> scan() {
        return scan(null)
                .expand(response -> response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty() ? scan(response.lastEvaluatedKey()) : Mono.empty())
                .flatMapIterable(ScanResponse::items)
                .map(AttributeValues::toMap);
    }

    private Mono<ScanResponse> scan(@Nullable Map<String, AttributeValue> exclusiveStartKey) {
        ScanRequest.Builder builder = ScanRequest.builder().tableName(tableName).consistentRead(true);
        if (exclusiveStartKey != null) {
            builder.exclusiveStartKey(exclusiveStartKey);
        }
        ScanRequest request = builder.build();
        return Mono.fromFuture(() -> client.scan(request))
                .onErrorMap(e -> DynamoDBErrors.translate(e, "Scan"));
    }

    public String tableName() {
        return tableName;
    }
}
