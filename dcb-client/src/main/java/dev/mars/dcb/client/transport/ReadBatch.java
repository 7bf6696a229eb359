/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.dcb.client.transport;

import dev.mars.dcb.api.SequencedEvent;

import java.util.List;

/**
 * One chunk of a read, as returned by a single round trip.
 *
 * @param events the events of this chunk, in the requested order
 * @param head   the store head when the chunk was read, null if the store was empty
 */
public record ReadBatch(
    List<SequencedEvent> events,
    Long head
) {
    public ReadBatch {
        events = List.copyOf(events);
    }
}
