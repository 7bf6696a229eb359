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

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A lazily produced sequence of events returned by a read.
 *
 * <p>Events are pulled on demand. {@link #hasNext()} and {@link #next()} may
 * block while the next batch is fetched or, for subscriptions, until a new
 * matching event is appended. A failure is thrown once from the call that
 * observed it; afterwards the response reports no further events.
 *
 * <p>{@link #close()} cancels the read, releases the underlying stream and
 * unblocks a thread waiting in {@link #next()}. Responses are single-consumer.
 */
public interface ReadResponse extends Iterator<SequencedEvent>, AutoCloseable {

    /**
     * Cancels the read and releases its resources. Idempotent.
     */
    @Override
    void close();

    /**
     * Returns the remaining events as a sequential stream that closes this
     * response when the stream is closed.
     */
    default Stream<SequencedEvent> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(this::close);
    }
}
