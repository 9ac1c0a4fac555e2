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
import org.junit.jupiter.api.Test;
import org.streamrx.cancellation.CancellationScope;
import org.streamrx.changestream.RetryableTransportException;
import org.streamrx.changestream.StartPosition;
import org.streamrx.changestream.inmemory.InMemoryChangeStream;
import org.streamrx.controller.ControllerRegistry;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.streamrx.controller.EventType.MODIFIED;

@DisplayName("change stream controller timing")
@DisplayNameGeneration(ReplaceUnderscores.class)
class ChangeStreamControllerTimingTest {
    private static final String STREAM = "todos";
    private static final String PARTITION = "shard-00001";

    private VirtualTimeScheduler scheduler;
    private CancellationScope root;
    private InMemoryChangeStream changeStream;
    private FaultyTransport transport;
    private ChangeStreamControllers controllers;

    private final List<ChangeRecord<Map<String, Object>>> modified = new CopyOnWriteArrayList<>();

    @BeforeEach
    void create_controllers() {
        scheduler = VirtualTimeScheduler.create();
        root = CancellationScope.root("test");
        changeStream = new InMemoryChangeStream(STREAM, Clock.systemUTC(), List.of("id"), 2);
        transport = new FaultyTransport(changeStream);
        controllers = new ChangeStreamControllers(transport, changeStream, new ControllerRegistry<>(), root);
    }

    @AfterEach
    void dispose() {
        root.dispose();
        scheduler.dispose();
    }

    @Test
    void non_empty_batches_are_followed_by_an_immediate_poll_and_empty_batches_by_the_poll_interval() {
        // Given
        IntStream.range(0, 5).forEach(i -> changeStream.put(Map.of("id", "item-" + i)).block());
        ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), ChangeStreamControllerConfig.builder()
                .startPosition(StartPosition.OLDEST)
                .pollInterval(Duration.ofSeconds(5))
                .scheduler(scheduler)
                .build());

        // When
        controller.addEventListener(MODIFIED, modified::add);
        scheduler.advanceTime();

        // Then batches of 2, 2 and 1 records and then an empty batch
        assertAll(
                () -> assertThat(transport.pollCalls(PARTITION)).isEqualTo(4),
                () -> assertThat(modified).hasSize(5)
        );

        // When
        scheduler.advanceTimeBy(Duration.ofMillis(4999));

        // Then
        assertThat(transport.pollCalls(PARTITION)).isEqualTo(4);

        // When
        scheduler.advanceTimeBy(Duration.ofMillis(1));

        // Then
        assertThat(transport.pollCalls(PARTITION)).isEqualTo(5);
    }

    @Test
    void default_partition_retry_backs_off_exponentially_and_gives_up_after_four_attempts() {
        // Given
        transport.failPollsOf(PARTITION, () -> new RetryableTransportException("Throttled"));
        ChangeStreamController<Map<String, Object>> controller = controllers.from(STREAM, new MapItemMapper(), ChangeStreamControllerConfig.builder()
                .startPosition(StartPosition.OLDEST)
                .scheduler(scheduler)
                .build());

        // When
        controller.addEventListener(MODIFIED, modified::add);
        scheduler.advanceTime();

        // Then attempts are made at 0s, 1s, 3s and 7s
        assertThat(transport.pollCalls(PARTITION)).isEqualTo(1);
        assertPollCallsAfter(Duration.ofMillis(999), 1);
        assertPollCallsAfter(Duration.ofMillis(1), 2);
        assertPollCallsAfter(Duration.ofMillis(1999), 2);
        assertPollCallsAfter(Duration.ofMillis(1), 3);
        assertPollCallsAfter(Duration.ofMillis(3999), 3);
        assertPollCallsAfter(Duration.ofMillis(1), 4);
        assertThat(controller.activePartitionIds()).isEmpty();

        // When
        scheduler.advanceTimeBy(Duration.ofSeconds(20));

        // Then
        assertAll(
                () -> assertThat(transport.pollCalls(PARTITION)).isEqualTo(4),
                () -> assertThat(controller.knownPartitionIds()).containsExactly(PARTITION),
                () -> assertThat(controller.isRunning()).isTrue()
        );
    }

    private void assertPollCallsAfter(Duration elapsed, int expectedCalls) {
        scheduler.advanceTimeBy(elapsed);
        assertThat(transport.pollCalls(PARTITION)).isEqualTo(expectedCalls);
    }
}
