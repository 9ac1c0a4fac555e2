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
import org.streamrx.cancellation.CancellationScope;
import org.streamrx.changestream.ChangeStreamTransport;
import org.streamrx.changestream.ItemMapper;
import org.streamrx.changestream.TableOperations;
import org.streamrx.controller.changestream.ChangeStreamController;
import org.streamrx.controller.changestream.ChangeStreamControllerConfig;

/**
 * A {@link ChangeStreamController} for a DynamoDB table with streams enabled. The controller is identified by the table ARN
 * and follows the latest stream of the table.
 *
 * @param <T> The type of the items in the table
 */
@NullMarked
public class DynamoDBController<T> extends ChangeStreamController<T> {

    public DynamoDBController(String tableArn, String streamArn, ChangeStreamTransport transport, TableOperations table, ItemMapper<T> mapper,
                              ChangeStreamControllerConfig config, CancellationScope parentScope) {
        super(tableArn, streamArn, transport, table, mapper, config, parentScope);
    }

    public String tableArn() {
        return id();
    }

    public String streamArn() {
        return streamId();
    }
}
