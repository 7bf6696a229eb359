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

package dev.mars.dcb.client;

import dev.mars.dcb.api.Query;
import dev.mars.dcb.api.ReadOptions;
import dev.mars.dcb.api.ReadResponse;
import dev.mars.dcb.api.SequencedEvent;
import dev.mars.dcb.api.error.DcbErrorCodes;
import dev.mars.dcb.api.exception.CorruptionException;
import dev.mars.dcb.api.exception.DcbException;
import dev.mars.dcb.client.transport.DcbTransport;
import dev.mars.dcb.client.transport.ReadBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Historical read that pulls events from the store one chunk at a time.
 *
 * <p>A chunk is requested only when the previous one has been consumed, so at
 * most one request is in flight. A chunk shorter than requested marks the end
 * of the result. Positions are checked to move strictly in the requested
 * direction.
 */
final class BatchedReadResponse implements ReadResponse {

    private static final Logger logger = LoggerFactory.getLogger(BatchedReadResponse.class);

    private final DcbTransport transport;
    private final Query query;
    private final boolean backwards;
    private final int batchSize;
    private final Duration timeout;
    private final Deque<SequencedEvent> buffer = new ArrayDeque<>();

    private Long nextStart;
    private Integer remaining;
    private Long lastPosition;
    private boolean exhausted;
    private boolean closed;

    BatchedReadResponse(DcbTransport transport, ReadOptions options, int batchSize, Duration timeout) {
        this.transport = transport;
        this.query = options.effectiveQuery();
        this.backwards = options.isBackwards();
        this.batchSize = batchSize;
        this.timeout = timeout;
        this.nextStart = options.getStart().orElse(null);
        this.remaining = options.getLimit().orElse(null);
    }

    @Override
    public boolean hasNext() {
        if (!buffer.isEmpty()) {
            return true;
        }
        if (closed || exhausted) {
            return false;
        }
        fetchBatch();
        return !buffer.isEmpty();
    }

    @Override
    public SequencedEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return buffer.poll();
    }

    @Override
    public void close() {
        closed = true;
        buffer.clear();
    }

    /**
     * Returns the position of the last event fetched, or null if none was.
     */
    Long getLastPosition() {
        return lastPosition;
    }

    private void fetchBatch() {
        int requested = remaining == null ? batchSize : Math.min(batchSize, remaining);
        if (requested <= 0) {
            exhausted = true;
            return;
        }

        List<SequencedEvent> events;
        Long head;
        try {
            ReadBatch batch = Await.result(transport.read(query, nextStart, backwards, requested), timeout);
            events = batch.events();
            head = batch.head();
            verify(events, requested);
        } catch (DcbException e) {
            exhausted = true;
            logger.warn("Read aborted after position {}: {}", lastPosition, e.getMessage());
            throw e;
        }

        buffer.addAll(events);
        logger.debug("Fetched {} events (requested {}) from {}", events.size(), requested, nextStart);

        if (remaining != null) {
            remaining -= events.size();
        }
        if (events.size() < requested || (remaining != null && remaining <= 0)) {
            exhausted = true;
            return;
        }
        if (backwards) {
            if (lastPosition <= 1) {
                exhausted = true;
            } else {
                nextStart = lastPosition - 1;
            }
        } else if (head != null && lastPosition >= head) {
            // Nothing exists past the head reported with this batch
            exhausted = true;
        } else {
            nextStart = lastPosition + 1;
        }
    }

    private void verify(List<SequencedEvent> events, int requested) {
        if (events.size() > requested) {
            throw new CorruptionException(DcbErrorCodes.CORRUPTION_OUT_OF_ORDER,
                "Store returned " + events.size() + " events where at most " + requested + " were requested");
        }
        for (SequencedEvent event : events) {
            long position = event.getPosition();
            boolean outOfBounds = nextStart != null && (backwards ? position > nextStart : position < nextStart);
            boolean outOfOrder = lastPosition != null && (backwards ? position >= lastPosition : position <= lastPosition);
            if (outOfBounds || outOfOrder) {
                throw new CorruptionException(DcbErrorCodes.CORRUPTION_OUT_OF_ORDER,
                    "Store returned position " + position + " after " + lastPosition
                        + (backwards ? " in a backwards read" : " in a forward read"));
            }
            if (!query.matches(event.getEvent())) {
                throw new CorruptionException(DcbErrorCodes.CORRUPTION_INVALID_EVENT,
                    "Store returned position " + position + " which does not match " + query);
            }
            lastPosition = position;
        }
    }
}
