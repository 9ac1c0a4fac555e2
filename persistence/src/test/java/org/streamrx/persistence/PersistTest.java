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

package org.streamrx.persistence;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.streamrx.cancellation.CancellationScope;
import org.streamrx.changestream.JacksonItemMapper;
import org.streamrx.changestream.StartPosition;
import org.streamrx.changestream.inmemory.InMemoryChangeStream;
import org.streamrx.controller.ControllerRegistry;
import org.streamrx.controller.changestream.ChangeRecord;
import org.streamrx.controller.changestream.ChangeStreamController;
import org.streamrx.controller.changestream.ChangeStreamControllerConfig;
import org.streamrx.controller.changestream.ChangeStreamControllers;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("persist")
@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(20)
class PersistTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @Nested
    @DisplayName("to controller")
    class ToController {
        private CancellationScope root;
        private InMemoryChangeStream changeStream;
        private ChangeStreamController<Todo> controller;
        private KeyedControllerStore<Todo, ChangeRecord<Todo>> store;

        @BeforeEach
        void create_controller() {
            root = CancellationScope.root("test");
            changeStream = new InMemoryChangeStream("todos");
            ChangeStreamControllers controllers = new ChangeStreamControllers(changeStream, changeStream, new ControllerRegistry<>(), root);
            ChangeStreamControllerConfig config = ChangeStreamControllerConfig.builder()
                    .pollInterval(Duration.ofMillis(50))
                    .startPosition(StartPosition.LATEST)
                    .build();
            controller = controllers.from("todos", JacksonItemMapper.of(Todo.class), config);
            store = new KeyedControllerStore<>(controller, Todo::id, record -> record.key().get("id"));
        }

        @AfterEach
        void dispose_root() {
            root.dispose();
        }

        @Test
        void emits_every_value_in_order_once_confirmed() {
            // Given
            List<Todo> todos = IntStream.range(0, 20).mapToObj(i -> new Todo("todo-" + i, "Task " + i)).toList();

            // When
            List<Todo> persisted = Flux.fromIterable(todos).transform(Persist.to(controller, store)).collectList().block(TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(persisted).containsExactlyElementsOf(todos),
                    () -> assertThat(changeStream.size()).isEqualTo(20)
            );
        }

        @Test
        void releases_the_controller_when_the_source_completes() {
            // When
            Flux.just(new Todo("todo-1", "Buy milk")).transform(Persist.to(controller, store)).blockLast(TIMEOUT);

            // Then
            assertAll(
                    () -> assertThat(controller.listenerCount()).isZero(),
                    () -> assertThat(controller.isRunning()).isFalse()
            );
        }

        @Test
        void fails_when_a_value_cannot_be_stored() {
            // Given
            ConfirmingStore<Todo, ChangeRecord<Todo>> failsOnBad = todo -> todo.id().equals("bad") ? Mono.error(new IllegalStateException("rejected")) : store.store(todo);

            // When
            Flux<Todo> persisted = Flux.just(new Todo("good", "a"), new Todo("bad", "b")).transform(Persist.to(controller, failsOnBad));

            // Then
            StepVerifier.create(persisted)
                    .thenConsumeWhile(todo -> todo.id().equals("good"))
                    .expectErrorMessage("rejected")
                    .verify(TIMEOUT);
        }

        @Test
        void waits_for_a_store_that_becomes_available_later() {
            // Given
            Mono<ConfirmingStore<Todo, ChangeRecord<Todo>>> laterStore = Mono.delay(Duration.ofMillis(300)).thenReturn(store);

            // When
            List<Todo> persisted = Flux.just(new Todo("todo-1", "Buy milk"), new Todo("todo-2", "Walk the dog"))
                    .transform(Persist.to(controller, laterStore))
                    .collectList()
                    .block(TIMEOUT);

            // Then
            assertThat(persisted).containsExactly(new Todo("todo-1", "Buy milk"), new Todo("todo-2", "Walk the dog"));
        }
    }

    @Nested
    @DisplayName("without store")
    class WithoutStore {

        @Test
        void emits_each_value_after_the_default_settling_delay() {
            StepVerifier.withVirtualTime(() -> Flux.just("a", "b").transform(Persist.withoutStore()))
                    .expectSubscription()
                    .expectNoEvent(Duration.ofMillis(999))
                    .thenAwait(Duration.ofMillis(1))
                    .expectNext("a", "b")
                    .verifyComplete();
        }

        @Test
        void emits_each_value_after_a_custom_settling_delay() {
            StepVerifier.withVirtualTime(() -> Flux.just("a").transform(Persist.withoutStore(Duration.ofSeconds(3))))
                    .expectSubscription()
                    .expectNoEvent(Duration.ofSeconds(3).minusMillis(1))
                    .thenAwait(Duration.ofMillis(1))
                    .expectNext("a")
                    .verifyComplete();
        }

        @Test
        void negative_settling_delay_is_rejected() {
            assertThatThrownBy(() -> Persist.withoutStore(Duration.ofMillis(-1)))
                    .isExactlyInstanceOf(IllegalArgumentException.class)
                    .hasMessage("settlingDelay cannot be negative");
        }
    }
}
