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

import dev.mars.dcb.api.AppendCondition;
import dev.mars.dcb.api.Event;
import dev.mars.dcb.api.Query;
import dev.mars.dcb.api.SequencedEvent;
import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

/**
 * Non-blocking channel to a remote DCB event store.
 *
 * <p>Every operation maps to one request. Failed futures carry a
 * {@link dev.mars.dcb.api.exception.DcbException} subclass, never a
 * transport-specific error type.
 *
 * @see HttpDcbTransport
 */
public interface DcbTransport extends AutoCloseable {

    /**
     * Fetches the position of the most recent event.
     *
     * @return future containing the head, empty if the store holds no events
     */
    Future<Optional<Long>> head();

    /**
     * Appends a batch of events, evaluating the condition atomically with the write.
     *
     * @param events the events to append
     * @param condition the append condition, or null for an unconditional append
     * @return future containing the position of the last appended event
     */
    Future<Long> append(List<Event> events, AppendCondition condition);

    /**
     * Reads one chunk of at most {@code limit} matching events.
     *
     * @param query the query to match
     * @param start the first position to consider, or null for the start (or head when backwards)
     * @param backwards true to read in decreasing position order
     * @param limit the maximum number of events in this chunk
     * @return future containing the chunk
     */
    Future<ReadBatch> read(Query query, Long start, boolean backwards, int limit);

    /**
     * Creates a live stream of matching events at or after {@code start}. The
     * stream first delivers stored events, then new ones as they are appended.
     *
     * @param query the query to match
     * @param start the first position to deliver, or null for the start of the log
     * @return an unstarted stream
     */
    SubscriptionStream<SequencedEvent> subscribe(Query query, Long start);

    /**
     * Releases the connection resources.
     */
    @Override
    void close();
}
