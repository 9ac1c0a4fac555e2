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

package org.streamrx.cancellation;

import java.util.List;

/**
 * An immutable snapshot of a {@link CancellationScope} and its descendants, useful for diagnostics.
 */
public record ScopeNode(String name, boolean aborted, List<ScopeNode> children) {
    public ScopeNode {
        children = List.copyOf(children);
    }
}
