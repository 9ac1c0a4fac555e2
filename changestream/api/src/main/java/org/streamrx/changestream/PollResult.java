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

package org.streamrx.changestream;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of one poll of a partition.
 *
 * @param records      The records in the order the backend returned them, possibly empty.
 * @param nextIterator The iterator to poll next, {@code null} when the partition is closed.
 */
@NullMarked
public record PollResult(List<RawRecord> records, @Nullable String nextIterator) {

    public PollResult {
        requireNonNull(records, "records cannot be null");
        records = List.copyOf(records);
    }

    public static PollResult of(List<RawRecord> records, @Nullable String nextIterator) {
        return new PollResult(records, nextIterator);
    }

    public static PollResult closed(List<RawRecord> records) {
        return new PollResult(records, null);
    }

    public boolean isClosed() {
        return nextIterator == null;
    }
}
