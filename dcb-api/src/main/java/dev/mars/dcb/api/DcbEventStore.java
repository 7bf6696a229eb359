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

package dev.mars.dcb.api;

import dev.mars.dcb.api.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Synchronous contract of a Dynamic Consistency Boundary event store.
 *
 * <p>All methods block the calling thread until the store has answered.
 * Failures are reported as subclasses of
 * {@link dev.mars.dcb.api.exception.DcbException}.
 */
public interface DcbEventStore extends AutoCloseable {

    /**
     * Reads events matching the options.
     *
     * @param options the read parameters
     * @return a lazily produced sequence of events
     */
    ReadResponse read(ReadOptions options);

    /**
     * Reads events using explicit optional parameters.
     *
     * @param query the query, or null for every event
     * @param start the first position to consider, or null for the start (or head when reading backwards)
     * @param backwards true to read in decreasing position order
     * @param limit the maximum number of events, or null for no limit
     * @param subscribe true to keep waiting for new events after the current ones
     * @return a lazily produced sequence of events
     */
    default ReadResponse read(Query query, Long start, boolean backwards, Integer limit, boolean subscribe) {
        return read(ReadOptions.builder()
            .query(query)
            .start(start)
            .backwards(backwards)
            .limit(limit)
            .subscribe(subscribe)
            .build());
    }

    /**
     * Reads every event matching the query, forwards from the start of the log.
     */
    default ReadResponse read(Query query) {
        return read(ReadOptions.forQuery(query));
    }

    /**
     * Reads a bounded result completely into a list.
     *
     * @throws ValidationException if the options request a subscription
     */
    default List<SequencedEvent> readAll(ReadOptions options) {
        if (options.isSubscribe()) {
            throw new ValidationException("readAll cannot be used with a subscription");
        }
        List<SequencedEvent> events = new ArrayList<>();
        try (ReadResponse response = read(options)) {
            response.forEachRemaining(events::add);
        }
        return events;
    }

    /**
     * Returns the position of the most recent event, or empty if the store holds no events.
     */
    Optional<Long> head();

    /**
     * Appends events atomically.
     *
     * @param events the events, must not be empty
     * @param condition the optimistic concurrency condition, or null for an unconditional append
     * @return the position of the last appended event
     * @throws dev.mars.dcb.api.exception.IntegrityException if the condition matched an existing event
     * @throws ValidationException if no events were given
     */
    long append(List<Event> events, AppendCondition condition);

    /**
     * Appends events unconditionally.
     */
    default long append(List<Event> events) {
        return append(events, null);
    }

    /**
     * Releases the resources held by this store handle.
     */
    @Override
    void close();
}
