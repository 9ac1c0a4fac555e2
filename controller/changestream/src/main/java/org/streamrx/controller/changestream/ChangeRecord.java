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
import org.streamrx.changestream.EventKind;
import org.streamrx.changestream.RawRecord;
import org.streamrx.controller.ControllerEvent;
import org.streamrx.controller.EventType;

import java.time.Instant;
import java.util.Map;

/**
 * A classified change record.
 *
 * @param type          The feed the record is published on
 * @param eventName     The kind of change as reported by the backend
 * @param key           The key attributes of the changed item
 * @param newValue      The item after the change, present for {@link EventType#MODIFIED}
 * @param oldValue      The item before the change, present for {@link EventKind#MODIFY} and for removed and expired items
 * @param timestamp     When the change was captured
 * @param sequenceToken Orders the records of a partition
 * @param partitionId   The partition the record was read from
 * @param raw           The record as read from the backend
 * @param <T>           The type of the values
 */
@NullMarked
public record ChangeRecord<T>(EventType type,
                              EventKind eventName,
                              Map<String, Object> key,
                              @Nullable T newValue,
                              @Nullable T oldValue,
                              Instant timestamp,
                              String sequenceToken,
                              String partitionId,
                              RawRecord raw) implements ControllerEvent {
}
