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

package dev.mars.dcb.client.sse;

import dev.mars.dcb.client.transport.SubscriptionStream;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.RequestOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A ReadStream implementation for Server-Sent Events (SSE).
 * Parses SSE frames and emits parsed objects.
 *
 * <p>Frames of type {@code error} are handed to the error parser and reported
 * through the exception handler, which also ends the stream. Bytes are
 * buffered until a complete frame has arrived, so multi-byte characters split
 * across chunks decode correctly.
 *
 * <p>All state lives on one Vert.x context; the public control methods hop
 * onto it when called from another thread. The stream owns its HTTP client
 * and closes it together with the connection.
 *
 * @param <T> the type of objects emitted by this stream
 */
public class EventStreamReadStream<T> implements SubscriptionStream<T> {
    
    private static final Logger logger = LoggerFactory.getLogger(EventStreamReadStream.class);

    private final Context context;
    private final HttpClient httpClient;
    private final RequestOptions requestOptions;
    private final Buffer requestBody;
    private final Function<String, T> parser;
    private final Function<String, Throwable> errorFrameParser;
    private final BiFunction<Integer, String, Throwable> statusErrorMapper;
    
    private Handler<T> dataHandler;
    private Handler<Throwable> exceptionHandler;
    private Handler<Void> endHandler;
    private HttpClientRequest request;
    private HttpClientResponse response;
    private Buffer buffer = Buffer.buffer();
    private boolean paused = false;
    private volatile boolean closed = false;

    /**
     * Creates an unstarted stream.
     *
     * @param vertx the Vert.x instance
     * @param httpClient a client dedicated to this stream, closed with it
     * @param requestOptions the request to send
     * @param requestBody the request body
     * @param parser converts the data of a frame into an item
     * @param errorFrameParser converts the data of an error frame into a failure
     * @param statusErrorMapper converts a non-200 status and its body into a failure
     */
    public EventStreamReadStream(Vertx vertx,
                                 HttpClient httpClient,
                                 RequestOptions requestOptions,
                                 Buffer requestBody,
                                 Function<String, T> parser,
                                 Function<String, Throwable> errorFrameParser,
                                 BiFunction<Integer, String, Throwable> statusErrorMapper) {
        this.context = vertx.getOrCreateContext();
        this.httpClient = httpClient;
        this.requestOptions = requestOptions;
        this.requestBody = requestBody;
        this.parser = parser;
        this.errorFrameParser = errorFrameParser;
        this.statusErrorMapper = statusErrorMapper;
    }
    
    /**
     * Starts the SSE connection.
     */
    @Override
    public void start() {
        onContext(this::doStart);
    }

    private void doStart() {
        if (closed) return;
        httpClient.request(requestOptions)
            .compose(req -> {
                this.request = req;
                return req.send(requestBody);
            })
            .onSuccess(resp -> {
                if (closed) {
                    resp.request().reset();
                    return;
                }
                this.response = resp;
                logger.debug("SSE connection established, status: {}", resp.statusCode());
                
                if (resp.statusCode() != 200) {
                    int status = resp.statusCode();
                    resp.body()
                        .onComplete(ar -> fail(statusErrorMapper.apply(status,
                            ar.succeeded() && ar.result() != null ? ar.result().toString(StandardCharsets.UTF_8) : null)));
                    return;
                }
                
                resp.handler(chunk -> {
                    if (closed) return;
                    buffer.appendBuffer(chunk);
                    processBuffer();
                });
                
                resp.endHandler(v -> {
                    if (closed) return;
                    closed = true;
                    httpClient.close();
                    if (endHandler != null) {
                        endHandler.handle(null);
                    }
                });
                
                resp.exceptionHandler(this::fail);

                if (paused) {
                    resp.pause();
                }
            })
            .onFailure(this::fail);
    }
    
    private void processBuffer() {
        Buffer frame;
        while (!paused && !closed && (frame = nextFrame()) != null) {
            parseAndEmitFrame(frame.toString(StandardCharsets.UTF_8));
        }
    }

    // SSE frames are separated by a blank line
    private Buffer nextFrame() {
        int length = buffer.length();
        for (int i = 0; i < length - 1; i++) {
            if (buffer.getByte(i) != '\n') {
                continue;
            }
            int next = i + 1;
            if (buffer.getByte(next) == '\r' && next + 1 < length) {
                next++;
            }
            if (buffer.getByte(next) == '\n') {
                Buffer frame = buffer.getBuffer(0, i);
                buffer = buffer.getBuffer(next + 1, length);
                return frame;
            }
        }
        return null;
    }
    
    private void parseAndEmitFrame(String frame) {
        StringBuilder data = null;
        String eventType = null;
        
        for (String rawLine : frame.split("\n")) {
            String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
            if (line.startsWith("data:")) {
                if (data == null) {
                    data = new StringBuilder();
                } else {
                    data.append('\n');
                }
                data.append(stripLeadingSpace(line.substring(5)));
            } else if (line.startsWith("event:")) {
                eventType = line.substring(6).trim();
            }
            // "id:" and ":" comment lines carry nothing the parser needs
        }

        if (data == null || data.length() == 0) {
            return;
        }
        if ("error".equals(eventType)) {
            fail(errorFrameParser.apply(data.toString()));
            return;
        }
        T parsed;
        try {
            parsed = parser.apply(data.toString());
        } catch (RuntimeException e) {
            logger.warn("Failed to parse SSE event data: {}", data, e);
            fail(e);
            return;
        }
        if (dataHandler != null && parsed != null) {
            dataHandler.handle(parsed);
        }
    }

    private static String stripLeadingSpace(String value) {
        return value.startsWith(" ") ? value.substring(1) : value;
    }

    private void fail(Throwable error) {
        if (closed) return;
        closeConnection();
        if (exceptionHandler != null) {
            exceptionHandler.handle(error);
        } else {
            logger.warn("SSE stream failed with no exception handler registered", error);
        }
    }
    
    @Override
    public SubscriptionStream<T> exceptionHandler(Handler<Throwable> handler) {
        this.exceptionHandler = handler;
        return this;
    }
    
    @Override
    public SubscriptionStream<T> handler(Handler<T> handler) {
        this.dataHandler = handler;
        return this;
    }
    
    @Override
    public SubscriptionStream<T> pause() {
        onContext(() -> {
            this.paused = true;
            if (response != null) {
                response.pause();
            }
        });
        return this;
    }
    
    @Override
    public SubscriptionStream<T> resume() {
        onContext(() -> {
            this.paused = false;
            if (response != null) {
                response.resume();
            }
            processBuffer();
        });
        return this;
    }
    
    @Override
    public SubscriptionStream<T> fetch(long amount) {
        return resume();
    }
    
    @Override
    public SubscriptionStream<T> endHandler(Handler<Void> handler) {
        this.endHandler = handler;
        return this;
    }
    
    /**
     * Closes the SSE connection.
     */
    @Override
    public void close() {
        if (closed) return;
        onContext(() -> {
            if (!closed) {
                closeConnection();
                logger.debug("SSE stream closed");
            }
        });
    }

    private void closeConnection() {
        closed = true;
        buffer = Buffer.buffer();
        if (request != null) {
            request.reset();
        }
        Future<Void> closing = httpClient.close();
        closing.onFailure(err -> logger.debug("Closing SSE client failed: {}", err.getMessage()));
    }

    private void onContext(Runnable action) {
        if (Vertx.currentContext() == context) {
            action.run();
        } else {
            context.runOnContext(v -> action.run());
        }
    }
}
