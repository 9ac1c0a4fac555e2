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
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamrx.changestream.EventKind;
import org.streamrx.changestream.ItemMapper;
import org.streamrx.changestream.RawRecord;
import org.streamrx.controller.EventType;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Turns raw records into {@link ChangeRecord}s.
 * <p>
 * Inserts and modifications are {@link EventType#MODIFIED}. Removals are {@link EventType#EXPIRED} if the removed item
 * carries a numeric time-to-live attribute (epoch seconds) that had elapsed when the item was removed, otherwise
 * {@link EventType#REMOVED}.
 * </p>
 */
@NullMarked
public class RecordClassifier<T> {
    private static final Logger log = LoggerFactory.getLogger(RecordClassifier.class);

    private final @Nullable String ttlAttribute;
    private final ItemMapper<T> mapper;
    private final Clock clock;

    /**
     * @param ttlAttribute The time-to-live attribute, {@code null} disables expiry detection.
     */
    public RecordClassifier(@Nullable String ttlAttribute, ItemMapper<T> mapper, Clock clock) {
        requireNonNull(mapper, ItemMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.ttlAttribute = ttlAttribute;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * @return The classified record or an empty {@code Optional} if the record is malformed or its values cannot be unmarshalled.
     */
    public Optional<ChangeRecord<T>> classify(RawRecord record, String partitionId) {
        EventKind eventKind = record.eventKind();
        String sequenceToken = record.sequenceToken();
        if (eventKind == null || sequenceToken == null) {
            log.warn("Dropping malformed record from partition {} (eventKind={}, sequenceToken={})", partitionId, eventKind, sequenceToken);
            return Optional.empty();
        }

        Instant timestamp = record.timestamp() == null ? clock.instant() : record.timestamp();
        EventType type = classify(eventKind, record.oldValue(), timestamp, ttlAttribute);
        try {
            T newValue = unmarshal(record.newValue());
            T oldValue = unmarshal(record.oldValue());
            return Optional.of(new ChangeRecord<>(type, eventKind, record.key(), newValue, oldValue, timestamp, sequenceToken, partitionId, record));
        } catch (RuntimeException e) {
            log.warn("Dropping record {} from partition {} since it couldn't be unmarshalled", sequenceToken, partitionId, e);
            return Optional.empty();
        }
    }

    /**
     * Classify a change.
     *
     * @param eventKind    The kind of change
     * @param oldValue     The item before the change
     * @param timestamp    When the change happened
     * @param ttlAttribute The time-to-live attribute or {@code null} if expiry detection is disabled
     */
    public static EventType classify(EventKind eventKind, @Nullable Map<String, Object> oldValue, Instant timestamp, @Nullable String ttlAttribute) {
        if (eventKind != EventKind.REMOVE) {
            return EventType.MODIFIED;
        } else if (ttlAttribute == null || oldValue == null) {
            return EventType.REMOVED;
        }

        if (oldValue.get(ttlAttribute) instanceof Number expiresAt && expiresAt.doubleValue() * 1000 <= timestamp.toEpochMilli()) {
            return EventType.EXPIRED;
        }
        return EventType.REMOVED;
    }

    private @Nullable T unmarshal(@Nullable Map<String, Object> item) {
        return item == null ? null : mapper.unmarshal(item);
    }
}
