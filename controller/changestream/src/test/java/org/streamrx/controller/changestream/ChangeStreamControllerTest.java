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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.streamrx.cancellation.CancellationScope;
import org.streamrx.changestream.EventKind;
import org.streamrx.changestream.FatalTransportException;
import org.streamrx.changestream.RawRecord;
import org.streamrx.changestream.RetryableTransportException;
import org.streamrx.changestream.StartPosition;
import org.streamrx.changestream.inmemory.InMemoryChangeStream;
import org.streamrx.controller.ControllerRegistry;
import org.streamrx.controller.EventType;
import org.streamrx.retry.RetryStrategy;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.streamrx.controller.EventType.*;

@DisplayName("change stream controller")
@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(20)
class ChangeStreamControllerTest {
    private static final String STREAM = "todos";
    private static final Duration POLL_INTERVAL = Duration.ofMillis(50);

    private CancellationScope root;
    private InMemoryChangeStream changeStream;
    private FaultyTransport transport;
    private ControllerRegistry<ChangeStreamController<?>> registry;
    private ChangeStreamControllers controllers;

    private final List<ChangeRecord<Map<String, Object>>> modified = new CopyOnWriteArrayList<>();
    private final List<ChangeRecord<Map<String, Object>>> removed = new CopyOnWriteArrayList<>();
    private final List<ChangeRecord<Map<String, Object>>> expired = new CopyOnWriteArrayList<>();

    @BeforeEach
    void create_controllers() {
        root = CancellationScope.root("test");
        changeStream = new InMemoryChangeStream(STREAM);
        transport = new FaultyTransport(changeStream);
        registry = new ControllerRegistry<>();
        controllers = new ChangeStreamControllers(transport, changeStream, registry, root);
    }

    @AfterEach
    void dispose_root() {
        root.dispose();
    }

    @Test
    void example_scenario_insert_then_expired_and_removed_deletes() {
        // Given
        ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), config(StartPosition.LATEST).build());
        listenToAllFeeds(controller);
        controller.ready().block(Duration.ofSeconds(5));
        long now = Instant.now().getEpochSecond();

        // When
        controller.put(Map.of("id", "x")).block();

        // Then
        await().untilAsserted(() -> assertThat(modified).hasSize(1));
        assertAll(
                () -> assertThat(modified.get(0).key()).isEqualTo(Map.of("id", "x")),
                () -> assertThat(modified.get(0).eventName()).isEqualTo(EventKind.INSERT),
                () -> assertThat(modified.get(0).newValue()).isEqualTo(Map.of("id", "x")),
                () -> assertThat(modified.get(0).partitionId()).isEqualTo("shard-00001")
        );

        // When
        controller.put(Map.of("id", "x", "expires", now - 3600)).block();
        controller.remove(Map.of("id", "x")).block();

        // Then
        await().untilAsserted(() -> assertThat(expired).hasSize(1));
        assertAll(
                () -> assertThat(expired.get(0).key()).isEqualTo(Map.of("id", "x")),
                () -> assertThat(expired.get(0).eventName()).isEqualTo(EventKind.REMOVE),
                () -> assertThat(removed).isEmpty()
        );

        // When
        controller.put(Map.of("id", "x", "expires", now + 3600)).block();
        controller.remove(Map.of("id", "x")).block();

        // Then
        await().untilAsserted(() -> assertThat(removed).hasSize(1));
        assertAll(
                () -> assertThat(removed.get(0).oldValue()).containsEntry("expires", now + 3600),
                () -> assertThat(expired).hasSize(1),
                () -> assertThat(modified).extracting(ChangeRecord::eventName).containsExactly(EventKind.INSERT, EventKind.MODIFY, EventKind.INSERT)
        );
    }

    @Test
    void records_of_each_partition_are_published_in_the_order_they_were_written() {
        // Given
        IntStream.range(0, 50).forEach(i -> {
            changeStream.put(Map.of("id", "item-" + i, "n", i)).block();
            if (i % 10 == 9) {
                changeStream.splitPartition();
            }
        });
        ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), config(StartPosition.OLDEST).build());

        // When
        listenToAllFeeds(controller);

        // Then
        await().untilAsserted(() -> assertThat(modified).hasSize(50));
        Map<String, List<Integer>> numbersByPartition = modified.stream().collect(Collectors.groupingBy(ChangeRecord::partitionId,
                Collectors.mapping(r -> (Integer) r.newValue().get("n"), Collectors.toList())));
        Map<String, List<String>> sequenceTokensByPartition = modified.stream().collect(Collectors.groupingBy(ChangeRecord::partitionId,
                Collectors.mapping(ChangeRecord::sequenceToken, Collectors.toList())));
        assertAll(
                () -> assertThat(numbersByPartition).hasSize(5),
                () -> assertThat(numbersByPartition.get("shard-00001")).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9),
                () -> assertThat(numbersByPartition.get("shard-00003")).containsExactly(20, 21, 22, 23, 24, 25, 26, 27, 28, 29),
                () -> assertThat(numbersByPartition.values()).allSatisfy(numbers -> assertThat(numbers).isSorted()),
                () -> assertThat(sequenceTokensByPartition.values()).allSatisfy(tokens -> assertThat(tokens).isSorted())
        );
    }

    @Test
    void a_closed_partition_is_removed_and_never_polled_again() {
        // Given
        ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), config(StartPosition.OLDEST).build());
        listenToAllFeeds(controller);
        changeStream.put(Map.of("id", "a")).block();
        await().untilAsserted(() -> assertThat(modified).hasSize(1));

        // When
        changeStream.splitPartition();
        changeStream.put(Map.of("id", "b")).block();

        // Then
        await().untilAsserted(() -> assertAll(
                () -> assertThat(modified).hasSize(2),
                () -> assertThat(controller.activePartitionIds()).containsExactly("shard-00002"),
                () -> assertThat(controller.knownPartitionIds()).containsExactlyInAnyOrder("shard-00001", "shard-00002")
        ));
        int pollsAfterClose = transport.pollCalls("shard-00001");
        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2)).until(() -> transport.pollCalls("shard-00001") == pollsAfterClose);
    }

    @Nested
    @DisplayName("errors")
    class ErrorsTest {

        @Test
        void exhausted_retries_give_up_on_one_partition_only() {
            // Given
            changeStream.put(Map.of("id", "a")).block();
            changeStream.splitPartition();
            transport.failPollsOf("shard-00001", () -> new RetryableTransportException("Throttled"));
            ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(),
                    config(StartPosition.OLDEST).partitionRetry(RetryStrategy.fixed(Duration.ofMillis(10)).maxAttempts(4)).build());
            listenToAllFeeds(controller);

            // When
            await().untilAsserted(() -> assertThat(controller.activePartitionIds()).containsExactly("shard-00002"));
            changeStream.put(Map.of("id", "b")).block();

            // Then
            await().untilAsserted(() -> assertThat(modified).extracting(r -> r.key().get("id")).containsExactly("b"));
            assertAll(
                    () -> assertThat(transport.pollCalls("shard-00001")).isEqualTo(4),
                    () -> assertThat(controller.isRunning()).isTrue()
            );
        }

        @Test
        void fatal_errors_are_not_retried_by_default() {
            // Given
            changeStream.put(Map.of("id", "a")).block();
            transport.failPollsOf("shard-00001", () -> new FatalTransportException("Expired iterator"));
            ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), config(StartPosition.OLDEST).build());

            // When
            listenToAllFeeds(controller);

            // Then
            await().untilAsserted(() -> assertAll(
                    () -> assertThat(controller.knownPartitionIds()).containsExactly("shard-00001"),
                    () -> assertThat(controller.activePartitionIds()).isEmpty()
            ));
            assertThat(transport.pollCalls("shard-00001")).isEqualTo(1);
        }

        @Test
        void discovery_errors_do_not_stop_the_controller() {
            // Given
            transport.failListing(3);
            changeStream.put(Map.of("id", "a")).block();
            ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), config(StartPosition.OLDEST).build());

            // When
            listenToAllFeeds(controller);

            // Then
            await().untilAsserted(() -> assertThat(modified).hasSize(1));
            assertThat(transport.listCalls()).isGreaterThanOrEqualTo(4);
        }

        @Test
        void malformed_records_are_dropped_without_dropping_the_batch() {
            // Given
            changeStream.put(Map.of("id", "a")).block();
            changeStream.appendRecord(new RawRecord(EventKind.INSERT, Map.of("id", "bad"), Map.of("id", "bad"), null, null, Instant.now(), "garbage"));
            changeStream.put(Map.of("id", "b")).block();
            ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), config(StartPosition.OLDEST).build());

            // When
            listenToAllFeeds(controller);

            // Then
            await().untilAsserted(() -> assertThat(modified).extracting(r -> r.key().get("id")).containsExactly("a", "b"));
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTest {

        @Test
        void removing_the_last_listener_stops_polling_and_forgets_partitions() {
            // Given
            ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), config(StartPosition.LATEST).build());
            Consumer<ChangeRecord<Map<String, Object>>> listener = modified::add;
            controller.addEventListener(MODIFIED, listener);
            controller.ready().block(Duration.ofSeconds(5));

            // When
            controller.removeEventListener(MODIFIED, listener);

            // Then
            assertAll(
                    () -> assertThat(controller.isRunning()).isFalse(),
                    () -> assertThat(controller.activePartitionIds()).isEmpty(),
                    () -> assertThat(controller.knownPartitionIds()).isEmpty()
            );
            int listCalls = transport.listCalls();
            await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> transport.listCalls() == listCalls);
        }

        @Test
        void a_restarted_controller_rediscovers_partitions() {
            // Given
            ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), config(StartPosition.LATEST).build());
            Consumer<ChangeRecord<Map<String, Object>>> listener = modified::add;
            controller.addEventListener(MODIFIED, listener);
            controller.ready().block(Duration.ofSeconds(5));
            controller.removeEventListener(MODIFIED, listener);

            // When
            controller.addEventListener(MODIFIED, listener);
            controller.ready().block(Duration.ofSeconds(5));
            controller.put(Map.of("id", "after-restart")).block();

            // Then
            await().untilAsserted(() -> assertAll(
                    () -> assertThat(controller.knownPartitionIds()).containsExactly("shard-00001"),
                    () -> assertThat(modified).extracting(r -> r.key().get("id")).containsExactly("after-restart")
            ));
        }

        @Test
        void disposing_the_parent_scope_stops_polling_and_removes_the_controller_from_the_registry() {
            // Given
            CancellationScope service = root.fork("service");
            ChangeStreamControllers serviceControllers = new ChangeStreamControllers(transport, changeStream, registry, service.fork("controllers"));
            ChangeStreamController<Map<String, Object>> controller = serviceControllers.from(STREAM, new MapItemMapper(), config(StartPosition.LATEST).build());
            listenToAllFeeds(controller);
            controller.ready().block(Duration.ofSeconds(5));

            // When
            service.dispose();

            // Then
            assertAll(
                    () -> assertThat(controller.isDisposed()).isTrue(),
                    () -> assertThat(controller.signal().isAborted()).isTrue(),
                    () -> assertThat(controller.activePartitionIds()).isEmpty(),
                    () -> assertThat(registry.get(STREAM)).isNull()
            );
            int listCalls = transport.listCalls();
            await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> transport.listCalls() == listCalls);
        }

        @Test
        void one_controller_per_stream() {
            // When
            ChangeStreamController<Map<String, Object>> first = controllers.from(STREAM, new MapItemMapper());
            ChangeStreamController<Map<String, Object>> second = controllers.from(STREAM, new MapItemMapper());
            first.dispose();
            ChangeStreamController<Map<String, Object>> third = controllers.from(STREAM, new MapItemMapper());

            // Then
            assertAll(
                    () -> assertThat(second).isSameAs(first),
                    () -> assertThat(third).isNotSameAs(first)
            );
        }
    }

    @Test
    void get_reads_through_the_table() {
        // Given
        ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper());

        // When
        controller.put(Map.of("id", "x", "title", "Buy milk")).block();

        // Then
        assertAll(
                () -> assertThat(controller.get(Map.of("id", "x")).block()).containsEntry("title", "Buy milk"),
                () -> assertThat(controller.get(Map.of("id", "y")).blockOptional()).isEmpty()
        );
    }

    @Test
    void snapshot_returns_the_value_of_every_item_in_the_table() {
        // Given
        changeStream.put(Map.of("id", "a", "title", "Buy milk")).block();
        changeStream.put(Map.of("id", "b", "title", "Walk the dog")).block();
        ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper());

        // When
        List<Map<String, Object>> snapshot = controller.snapshot().collectList().block();

        // Then
        assertThat(snapshot).containsExactly(Map.of("id", "a", "title", "Buy milk"), Map.of("id", "b", "title", "Walk the dog"));
    }

    @Nested
    @DisplayName("expiry")
    class ExpiryTest {

        @Test
        void put_with_expiry_writes_the_ttl_attribute_and_the_item_is_published_as_expired_once_it_has_elapsed() {
            // Given
            ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), config(StartPosition.LATEST).build());
            listenToAllFeeds(controller);
            controller.ready().block(Duration.ofSeconds(5));
            Instant expiresAt = Instant.now().minusSeconds(60);

            // When
            controller.put(Map.of("id", "x", "title", "Buy milk"), expiresAt).block();

            // Then
            await().untilAsserted(() -> assertThat(modified).hasSize(1));
            assertThat(modified.get(0).newValue()).containsEntry("expires", expiresAt.getEpochSecond());

            // When
            int expiredItems = changeStream.expireElapsed("expires");

            // Then
            await().untilAsserted(() -> assertThat(expired).hasSize(1));
            assertAll(
                    () -> assertThat(expiredItems).isEqualTo(1),
                    () -> assertThat(expired.get(0).key()).isEqualTo(Map.of("id", "x")),
                    () -> assertThat(expired.get(0).oldValue()).containsEntry("expires", expiresAt.getEpochSecond()),
                    () -> assertThat(removed).isEmpty()
            );
        }

        @Test
        void put_with_expiry_fails_when_the_controller_has_no_ttl_attribute() {
            // Given
            ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), config(StartPosition.LATEST).ttlAttribute(null).build());

            // Then
            StepVerifier.create(controller.put(Map.of("id", "x"), Instant.now()))
                    .expectError(IllegalStateException.class)
                    .verify();
            assertThat(changeStream.size()).isZero();
        }
    }

    private void listenToAllFeeds(ChangeStreamController<Map<String, Object>> controller) {
        controller.addEventListener(MODIFIED, modified::add);
        controller.addEventListener(REMOVED, removed::add);
        controller.addEventListener(EXPIRED, expired::add);
    }

    private static ChangeStreamControllerConfig.Builder config(StartPosition startPosition) {
        return ChangeStreamControllerConfig.builder()
                .pollInterval(POLL_INTERVAL)
                .startPosition(startPosition);
    }
}
