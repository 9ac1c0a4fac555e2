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
import org.streamrx.cancellation.CancellationScope;
import org.streamrx.changestream.ChangeStreamTransport;
import org.streamrx.changestream.ItemMapper;
import org.streamrx.changestream.TableOperations;
import org.streamrx.controller.ControllerRegistry;

import static java.util.Objects.requireNonNull;

/**
 * Creates {@link ChangeStreamController}s, at most one per stream, over a single transport.
 */
@NullMarked
public class ChangeStreamControllers {
    private final ChangeStreamTransport transport;
    private final TableOperations table;
    private final ControllerRegistry<ChangeStreamController<?>> registry;
    private final CancellationScope scope;

    /**
     * @param registry The registry that keeps track of the live controllers
     * @param scope    The scope controllers are created in. Cancelling it disposes all controllers.
     */
    public ChangeStreamControllers(ChangeStreamTransport transport, TableOperations table, ControllerRegistry<ChangeStreamController<?>> registry, CancellationScope scope) {
        requireNonNull(transport, ChangeStreamTransport.class.getSimpleName() + " cannot be null");
        requireNonNull(table, TableOperations.class.getSimpleName() + " cannot be null");
        requireNonNull(registry, ControllerRegistry.class.getSimpleName() + " cannot be null");
        requireNonNull(scope, CancellationScope.class.getSimpleName() + " cannot be null");
        this.transport = transport;
        this.table = table;
        this.registry = registry;
        this.scope = scope;
    }

    /**
     * @return The live controller of the stream or a new one if there is none. The {@code mapper} and {@code config} are
     * ignored if the controller already exists.
     */
    @SuppressWarnings("unchecked")
    public <T> ChangeStreamController<T> from(String streamId, ItemMapper<T> mapper, ChangeStreamControllerConfig config) {
        requireNonNull(streamId, "streamId cannot be null");
        return (ChangeStreamController<T>) registry.getOrCreate(streamId, id -> new ChangeStreamController<>(id, id, transport, table, mapper, config, scope));
    }

    public <T> ChangeStreamController<T> from(String streamId, ItemMapper<T> mapper) {
        return from(streamId, mapper, ChangeStreamControllerConfig.defaults());
    }
}
