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

package dev.mars.dcb.client.support;

import dev.mars.dcb.api.AppendCondition;
import dev.mars.dcb.api.Event;
import dev.mars.dcb.api.Query;
import dev.mars.dcb.api.SequencedEvent;
import dev.mars.dcb.client.transport.DcbTransport;
import dev.mars.dcb.client.transport.ReadBatch;
import dev.mars.dcb.client.transport.SubscriptionStream;
import io.vertx.core.Future;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Transport answering read requests from a queue of prepared batches.
 */
public final class ScriptedTransport implements DcbTransport {

    /** A read request as the client issued it */
    public record ReadCall(Query query, Long start, boolean backwards, int limit) {
    }

    private final Deque<Future<ReadBatch>> batches = new ArrayDeque<>();
    private final List<ReadCall> readCalls = new ArrayList<>();
    private Future<Optional<Long>> head = Future.succeededFuture(Optional.empty());
    private Future<Long> append = Future.succeededFuture(1L);
    private int appendCalls;
    private boolean closed;

    public ScriptedTransport thenBatch(SequencedEvent... events) {
        batches.add(Future.succeededFuture(new ReadBatch(List.of(events), null)));
        return this;
    }

    /** Queues a batch that reports the given store head alongside its events */
    public ScriptedTransport thenBatchWithHead(Long head, SequencedEvent... events) {
        batches.add(Future.succeededFuture(new ReadBatch(List.of(events), head)));
        return this;
    }

    public ScriptedTransport thenFail(Throwable error) {
        batches.add(Future.failedFuture(error));
        return this;
    }

    public ScriptedTransport head(Future<Optional<Long>> head) {
        this.head = head;
        return this;
    }

    public ScriptedTransport append(Future<Long> append) {
        this.append = append;
        return this;
    }

    public List<ReadCall> readCalls() {
        return readCalls;
    }

    public int appendCalls() {
        return appendCalls;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public Future<Optional<Long>> head() {
        return head;
    }

    @Override
    public Future<Long> append(List<Event> events, AppendCondition condition) {
        appendCalls++;
        return append;
    }

    @Override
    public Future<ReadBatch> read(Query query, Long start, boolean backwards, int limit) {
        readCalls.add(new ReadCall(query, start, backwards, limit));
        Future<ReadBatch> next = batches.poll();
        return next != null ? next : Future.succeededFuture(new ReadBatch(List.of(), null));
    }

    @Override
    public SubscriptionStream<SequencedEvent> subscribe(Query query, Long start) {
        throw new UnsupportedOperationException("Scripted transport has no live stream");
    }

    @Override
    public void close() {
        closed = true;
    }
}
