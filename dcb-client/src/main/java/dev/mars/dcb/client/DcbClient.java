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

import dev.mars.dcb.api.AppendCondition;
import dev.mars.dcb.api.DcbEventStore;
import dev.mars.dcb.api.Event;
import dev.mars.dcb.api.ReadOptions;
import dev.mars.dcb.api.ReadResponse;
import dev.mars.dcb.api.error.DcbErrorCodes;
import dev.mars.dcb.api.exception.ValidationException;
import dev.mars.dcb.client.config.ClientConfig;
import dev.mars.dcb.client.transport.DcbTransport;
import dev.mars.dcb.client.transport.HttpDcbTransport;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Blocking client for a remote DCB event store.
 *
 * <p>Calls suspend the calling thread until the store answers; I/O runs on the
 * Vert.x event loop. The client may be shared between threads, but each
 * {@link ReadResponse} must be consumed by one thread. Blocking calls made
 * from an event loop thread are rejected.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (DcbClient client = DcbClient.connect(ClientConfig.builder()
 *         .url("http://localhost:50051")
 *         .build())) {
 *
 *     Query boundary = Query.of(QueryItem.types("UserRegistered").withTags("email:alice@example.com"));
 *     List<SequencedEvent> existing = client.readAll(ReadOptions.forQuery(boundary));
 *     Optional<Long> head = client.head();
 *
 *     if (existing.isEmpty()) {
 *         client.append(List.of(registered), AppendCondition.of(boundary, head));
 *     }
 * }
 * }</pre>
 */
public class DcbClient implements DcbEventStore {

    private static final Logger logger = LoggerFactory.getLogger(DcbClient.class);

    private final DcbTransport transport;
    private final ClientConfig config;
    private final Vertx ownedVertx;
    private final AtomicBoolean closed = new AtomicBoolean();

    private DcbClient(DcbTransport transport, ClientConfig config, Vertx ownedVertx) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.ownedVertx = ownedVertx;
        logger.info("DCB client created for {} (batchSize: {})", config.getUrl(), config.getBatchSize());
    }

    /**
     * Connects to the store with a Vert.x instance owned by the client and
     * closed together with it. The store is contacted once before this method
     * returns, so an unreachable store fails here rather than on first use.
     *
     * @param config the client configuration
     * @return a new client instance
     * @throws dev.mars.dcb.api.exception.DcbIoException if the CA certificate cannot be read
     * @throws dev.mars.dcb.api.exception.TransportException if the store cannot be reached
     */
    public static DcbClient connect(ClientConfig config) {
        Vertx vertx = Vertx.vertx();
        DcbClient client;
        try {
            client = new DcbClient(HttpDcbTransport.create(vertx, config), config, vertx);
        } catch (RuntimeException e) {
            vertx.close();
            throw e;
        }
        try {
            Optional<Long> head = client.head();
            logger.debug("Connected to {} at head {}", config.getUrl(), head.orElse(null));
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
        return client;
    }

    /**
     * Connects to the store at the given URL with default settings.
     *
     * @throws ValidationException if the URL is not a valid http or https URL
     */
    public static DcbClient connect(String url) {
        return connect(ClientConfig.builder().url(url).build());
    }

    /**
     * Connects to the store using an existing Vert.x instance, which the
     * client does not close. No request is made until the first call, so this
     * may be used from an event loop thread.
     *
     * @param vertx the Vert.x instance
     * @param config the client configuration
     * @return a new client instance
     */
    public static DcbClient connect(Vertx vertx, ClientConfig config) {
        return new DcbClient(HttpDcbTransport.create(vertx, config), config, null);
    }

    /**
     * Creates a client over an arbitrary transport.
     *
     * @param transport the transport, closed together with the client
     * @param config the client configuration, of which batch size and timeout are used
     * @return a new client instance
     */
    public static DcbClient create(DcbTransport transport, ClientConfig config) {
        return new DcbClient(transport, config, null);
    }

    // ========================================================================
    // Store Operations
    // ========================================================================

    @Override
    public ReadResponse read(ReadOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        ensureOpen();
        logger.debug("Reading with {}", options);
        if (options.isSubscribe()) {
            return new LiveReadResponse(transport, options, config.getBatchSize(), config.getTimeout());
        }
        return new BatchedReadResponse(transport, options, config.getBatchSize(), config.getTimeout());
    }

    @Override
    public Optional<Long> head() {
        ensureOpen();
        return Await.result(transport.head(), config.getTimeout());
    }

    @Override
    public long append(List<Event> events, AppendCondition condition) {
        ensureOpen();
        if (events == null || events.isEmpty()) {
            throw new ValidationException(DcbErrorCodes.VALIDATION_EMPTY_APPEND, "Cannot append an empty batch");
        }
        for (Event event : events) {
            if (event == null) {
                throw new ValidationException("Cannot append a null event");
            }
        }
        long position = Await.result(transport.append(events, condition), config.getTimeout());
        logger.debug("Appended {} events at position {}", events.size(), position);
        return position;
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /** Returns the configuration this client was created with */
    public ClientConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        transport.close();
        if (ownedVertx != null) {
            ownedVertx.close();
        }
        logger.info("DCB client closed");
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("DCB client is closed");
        }
    }
}
