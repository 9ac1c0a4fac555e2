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

package org.streamrx.controller;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Keeps at most one live controller per resource id. A controller removes itself from the registry when disposed, after
 * which {@link #getOrCreate(String, Function)} creates a new one.
 * <p>
 * A registry is typically created by the composition root of the application and injected into controller factories.
 * </p>
 *
 * @param <C> The controller type
 */
@NullMarked
public final class ControllerRegistry<C extends Controller<?, ?>> {
    private static final Logger log = LoggerFactory.getLogger(ControllerRegistry.class);

    private final ConcurrentMap<String, C> instances = new ConcurrentHashMap<>();

    /**
     * @param id      The resource id
     * @param factory Creates the controller if there's no live controller for {@code id}. Invoked at most once per call.
     * @return The live controller for {@code id}
     */
    public C getOrCreate(String id, Function<String, ? extends C> factory) {
        requireNonNull(id, "id cannot be null");
        requireNonNull(factory, "factory cannot be null");
        while (true) {
            AtomicBoolean created = new AtomicBoolean(false);
            C controller = instances.computeIfAbsent(id, key -> {
                created.set(true);
                return requireNonNull(factory.apply(key), "factory returned null");
            });
            if (created.get()) {
                log.debug("Created controller for {}", id);
                controller.whenDisposed().doOnTerminate(() -> instances.remove(id, controller)).subscribe();
            }

            if (!controller.isDisposed()) {
                return controller;
            }
            // Disposed but not yet removed
            instances.remove(id, controller);
        }
    }

    public @Nullable C get(String id) {
        requireNonNull(id, "id cannot be null");
        return instances.get(id);
    }

    public int size() {
        return instances.size();
    }

    /**
     * Dispose every controller in the registry.
     */
    public void clear() {
        List<C> controllers = List.copyOf(instances.values());
        controllers.forEach(Controller::dispose);
        instances.clear();
    }
}
