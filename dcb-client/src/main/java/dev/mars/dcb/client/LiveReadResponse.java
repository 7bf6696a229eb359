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
import dev.mars.dcb.api.exception.TransportException;
import dev.mars.dcb.client.transport.DcbTransport;
import dev.mars.dcb.client.transport.SubscriptionStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Subscription read: catches up with a batched read, then tails a live stream
 * opened just after the last delivered position.
 *
 * <p>The live stream feeds a queue drained by the consuming thread, which
 * blocks in {@link #hasNext()} until an event, a failure or {@link #close()}
 * arrives. The stream is paused once {@code batchSize} events are queued and
 * resumed when the queue has drained to half of that.
 */
final class LiveReadResponse implements ReadResponse {

    private static final Logger logger = LoggerFactory.getLogger(LiveReadResponse.class);

    private static final Object CLOSED = new Object();

    private final DcbTransport transport;
    private final Query query;
    private final Long start;
    private final Integer limit;
    private final int batchSize;
    private final BatchedReadResponse catchUp;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean paused = new AtomicBoolean();

    private volatile SubscriptionStream<SequencedEvent> stream;
    private SequencedEvent peeked;
    private Long lastPosition;
    private int yielded;
    private boolean live;
    private boolean done;
    private volatile boolean closed;

    LiveReadResponse(DcbTransport transport, ReadOptions options, int batchSize, Duration timeout) {
        this.transport = transport;
        this.query = options.effectiveQuery();
        this.start = options.getStart().orElse(null);
        this.limit = options.getLimit().orElse(null);
        this.batchSize = batchSize;
        this.catchUp = new BatchedReadResponse(transport, options, batchSize, timeout);
    }

    @Override
    public boolean hasNext() {
        if (peeked != null) {
            return true;
        }
        if (done || closed) {
            return false;
        }
        if (limit != null && yielded >= limit) {
            release();
            return false;
        }
        if (!live) {
            boolean more;
            try {
                more = catchUp.hasNext();
            } catch (DcbException e) {
                done = true;
                throw e;
            }
            if (more) {
                return true;
            }
            lastPosition = catchUp.getLastPosition();
            if (closed) {
                return false;
            }
            openStream();
        }
        return awaitLiveEvent();
    }

    @Override
    public SequencedEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        yielded++;
        SequencedEvent result;
        if (!live) {
            result = catchUp.next();
        } else {
            result = peeked;
            peeked = null;
        }
        if (limit != null && yielded >= limit) {
            release();
        }
        return result;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        catchUp.close();
        if (stream != null) {
            stream.close();
        }
        queue.offer(CLOSED);
        logger.debug("Subscription closed after {} events", yielded);
    }

    // The live stream holds a connection, so it is closed as soon as iteration ends
    private void release() {
        done = true;
        catchUp.close();
        if (stream != null) {
            stream.close();
        }
    }

    private void openStream() {
        live = true;
        Long from = lastPosition != null ? Long.valueOf(lastPosition + 1) : start;
        stream = transport.subscribe(query, from);
        stream.handler(event -> {
            queue.offer(event);
            if (queue.size() >= batchSize && paused.compareAndSet(false, true)) {
                stream.pause();
            }
        });
        stream.exceptionHandler(queue::offer);
        stream.endHandler(v -> queue.offer(new TransportException(DcbErrorCodes.TRANSPORT_STREAM_CLOSED,
            "Live event stream ended by the store", null)));
        stream.start();
        if (closed) {
            // close() may have run before the stream was assigned
            stream.close();
        }
        logger.info("Subscription caught up at position {}, now following live events", lastPosition);
    }

    private boolean awaitLiveEvent() {
        Object item;
        try {
            item = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new TransportException(DcbErrorCodes.TRANSPORT_INTERRUPTED,
                "Interrupted while waiting for live events", e);
        }

        if (paused.get() && queue.size() <= batchSize / 2 && paused.compareAndSet(true, false)) {
            stream.resume();
        }

        if (item == CLOSED) {
            release();
            return false;
        }
        if (item instanceof Throwable) {
            done = true;
            stream.close();
            Throwable error = (Throwable) item;
            logger.warn("Subscription failed after position {}: {}", lastPosition, error.getMessage());
            if (error instanceof DcbException) {
                throw (DcbException) error;
            }
            throw new TransportException(DcbErrorCodes.TRANSPORT_CONNECTION_FAILED,
                "Live event stream failed: " + error.getMessage(), error);
        }

        SequencedEvent event = (SequencedEvent) item;
        if (lastPosition != null && event.getPosition() <= lastPosition) {
            done = true;
            stream.close();
            throw new CorruptionException(DcbErrorCodes.CORRUPTION_OUT_OF_ORDER,
                "Live stream delivered position " + event.getPosition() + " after " + lastPosition);
        }
        if (!query.matches(event.getEvent())) {
            done = true;
            stream.close();
            throw new CorruptionException(DcbErrorCodes.CORRUPTION_INVALID_EVENT,
                "Live stream delivered position " + event.getPosition() + " which does not match " + query);
        }
        lastPosition = event.getPosition();
        peeked = event;
        return true;
    }
}
