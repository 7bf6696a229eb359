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

import dev.mars.dcb.api.Event;
import dev.mars.dcb.api.ReadOptions;
import dev.mars.dcb.api.ReadResponse;
import dev.mars.dcb.api.SequencedEvent;
import dev.mars.dcb.api.error.DcbErrorCodes;
import dev.mars.dcb.api.exception.CorruptionException;
import dev.mars.dcb.api.exception.DcbIoException;
import dev.mars.dcb.api.exception.TransportException;
import dev.mars.dcb.api.exception.ValidationException;
import dev.mars.dcb.client.config.ClientConfig;
import dev.mars.dcb.client.support.MockDcbServer;
import dev.mars.dcb.client.support.MockDcbServer.CannedResponse;
import dev.mars.dcb.test.categories.TestCategories;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for error handling in DcbClient.
 * Tests error classification, corrupt payloads, timeouts, and network errors.
 */
@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ErrorHandlingTest {

    private static final Logger logger = LoggerFactory.getLogger(ErrorHandlingTest.class);

    private Vertx vertx;
    private MockDcbServer server;
    private DcbClient client;
    private int port;

    @BeforeAll
    void setupMockServer(Vertx vertx, VertxTestContext testContext) {
        this.vertx = vertx;
        server = new MockDcbServer(vertx);
        server.start()
            .onSuccess(actualPort -> {
                port = actualPort;
                client = DcbClient.connect(vertx, config("http://localhost:" + port).build());
                testContext.completeNow();
            })
            .onFailure(testContext::failNow);
    }

    @BeforeEach
    void resetStore() {
        server.reset();
    }

    @AfterAll
    void tearDown(VertxTestContext testContext) {
        if (client != null) {
            client.close();
            logger.info("Client closed");
        }
        server.stop().onComplete(ar -> testContext.completeNow());
    }

    // ========================================================================
    // Error responses
    // ========================================================================

    @Test
    @DisplayName("400 without error body - throws ValidationException")
    void badRequest_throwsValidationException() {
        server.respondWith(MockDcbServer.APPEND_PATH, CannedResponse.json(400, ""));

        ValidationException ex = assertThrows(ValidationException.class,
            () -> client.append(List.of(Event.of("Created", new byte[0]))));

        assertEquals(DcbErrorCodes.VALIDATION_INVALID_ARGUMENT, ex.getErrorCode());
    }

    @Test
    @DisplayName("500 with unknown code - throws TransportException")
    void serverError_throwsTransportException() {
        server.respondWith(MockDcbServer.HEAD_PATH, CannedResponse.json(500,
            "{\"code\":\"DCBERR0001\",\"message\":\"disk full\"}"));

        TransportException ex = assertThrows(TransportException.class, () -> client.head());

        assertEquals(DcbErrorCodes.TRANSPORT_UNEXPECTED_STATUS, ex.getErrorCode());
        assertTrue(ex.getMessage().contains("disk full"));
        logger.info("500 error correctly thrown: {}", ex.getMessage());
    }

    @Test
    @DisplayName("corruption code - throws CorruptionException")
    void corruptionCode_throwsCorruptionException() {
        server.respondWith(MockDcbServer.READ_PATH, CannedResponse.json(500,
            "{\"code\":\"DCBERR0150\",\"message\":\"checksum mismatch\"}"));

        assertThrows(CorruptionException.class, () -> client.readAll(ReadOptions.defaults()));
    }

    @Test
    void invalidArgumentFromStore_throwsValidationException() {
        server.respondWith(MockDcbServer.READ_PATH, CannedResponse.json(422,
            "{\"code\":\"DCBERR0250\",\"message\":\"bad query\"}"));

        ValidationException ex = assertThrows(ValidationException.class,
            () -> client.readAll(ReadOptions.defaults()));

        assertEquals("bad query", ex.getMessage());
    }

    // ========================================================================
    // Corrupt success payloads
    // ========================================================================

    @Test
    void unparseableBody_throwsCorruptionException() {
        server.respondWith(MockDcbServer.HEAD_PATH, CannedResponse.json(200, "position=3"));

        assertThrows(CorruptionException.class, () -> client.head());
    }

    @Test
    void emptyBody_throwsCorruptionException() {
        server.respondWith(MockDcbServer.APPEND_PATH, CannedResponse.json(200, ""));

        assertThrows(CorruptionException.class, () -> client.append(List.of(Event.of("Created", new byte[0]))));
    }

    @Test
    void appendWithoutPosition_throwsCorruptionException() {
        server.respondWith(MockDcbServer.APPEND_PATH, CannedResponse.json(200, "{\"position\":null}"));

        assertThrows(CorruptionException.class, () -> client.append(List.of(Event.of("Created", new byte[0]))));
    }

    @Test
    void eventWithInvalidUuid_throwsCorruptionException() {
        server.respondWith(MockDcbServer.READ_PATH, CannedResponse.json(200,
            "{\"events\":[{\"position\":1,\"event\":{\"eventType\":\"Created\",\"data\":\"\","
                + "\"tags\":[],\"uuid\":\"nope\"}}],\"head\":1}"));

        CorruptionException ex = assertThrows(CorruptionException.class,
            () -> client.readAll(ReadOptions.defaults()));

        assertEquals(DcbErrorCodes.CORRUPTION_INVALID_EVENT, ex.getErrorCode());
    }

    @Test
    void outOfOrderBatch_abortsAfterValidEvents() {
        // Given a store answer whose second event goes backwards
        String first = server.encodeEvent(new SequencedEvent(Event.of("A", new byte[0]), 2));
        String second = server.encodeEvent(new SequencedEvent(Event.of("B", new byte[0]), 1));
        server.respondWith(MockDcbServer.READ_PATH, CannedResponse.json(200,
            "{\"events\":[" + first + "," + second + "],\"head\":2}"));
        List<Long> yielded = new ArrayList<>();

        // When
        try (ReadResponse response = client.read(ReadOptions.defaults())) {
            CorruptionException ex = assertThrows(CorruptionException.class,
                () -> response.forEachRemaining(event -> yielded.add(event.getPosition())));

            // Then
            assertEquals(DcbErrorCodes.CORRUPTION_OUT_OF_ORDER, ex.getErrorCode());
            assertTrue(yielded.isEmpty());
            assertFalse(response.hasNext());
        }
    }

    // ========================================================================
    // Network errors
    // ========================================================================

    @Test
    @DisplayName("Connection refused - throws TransportException")
    void connectionRefused_throwsTransportException() throws Exception {
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }

        try (DcbClient unreachable = DcbClient.connect(vertx, config("http://localhost:" + unusedPort).build())) {
            TransportException ex = assertThrows(TransportException.class, unreachable::head);

            assertFalse(ex.isTimeout());
            logger.info("Connection refused correctly reported: {}", ex.getMessage());
        }
    }

    @Test
    @DisplayName("Owned client to unreachable store - connect throws TransportException")
    void connect_toUnreachableStore_failsImmediately() throws Exception {
        // Given
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }

        // When / Then
        TransportException ex = assertThrows(TransportException.class,
            () -> DcbClient.connect(config("http://localhost:" + unusedPort).build()));
        assertFalse(ex.isTimeout());
    }

    @Test
    @DisplayName("Owned client to failing store - connect throws the store error")
    void connect_toFailingStore_throwsBeforeReturning() {
        server.respondWith(MockDcbServer.HEAD_PATH, CannedResponse.json(500,
            "{\"code\":\"DCBERR0001\",\"message\":\"disk full\"}"));

        TransportException ex = assertThrows(TransportException.class,
            () -> DcbClient.connect("http://localhost:" + port));

        assertTrue(ex.getMessage().contains("disk full"));
    }

    @Test
    @DisplayName("Slow store - throws timeout TransportException")
    void slowStore_throwsTimeout() {
        server.respondWith(MockDcbServer.HEAD_PATH, CannedResponse.delayed(3000));

        try (DcbClient impatient = DcbClient.connect(vertx, config("http://localhost:" + port)
                .timeout(Duration.ofMillis(300))
                .build())) {
            TransportException ex = assertThrows(TransportException.class, impatient::head);

            assertTrue(ex.isTimeout());
            assertEquals(DcbErrorCodes.TRANSPORT_TIMEOUT, ex.getErrorCode());
        }
    }

    @Test
    void unreadableCaCertificate_throwsIoException() {
        ClientConfig config = config("https://localhost:" + port)
            .caPath("/nonexistent/dcb/ca.pem")
            .build();

        DcbIoException ex = assertThrows(DcbIoException.class, () -> DcbClient.connect(vertx, config));

        assertEquals(DcbErrorCodes.IO_CA_CERTIFICATE_UNREADABLE, ex.getErrorCode());
        assertInstanceOf(java.io.IOException.class, ex.getCause());
    }

    // ========================================================================
    // Client-side checks
    // ========================================================================

    @Test
    void emptyAppend_isRejectedBeforeAnyRequest() {
        ValidationException ex = assertThrows(ValidationException.class, () -> client.append(List.of()));

        assertEquals(DcbErrorCodes.VALIDATION_EMPTY_APPEND, ex.getErrorCode());
        assertEquals(0, server.appendRequestCount());
    }

    @Test
    void nullEvent_isRejected() {
        List<Event> events = new ArrayList<>();
        events.add(null);

        assertThrows(ValidationException.class, () -> client.append(events));
        assertEquals(0, server.appendRequestCount());
    }

    @Test
    void readAllWithSubscribe_isRejected() {
        assertThrows(ValidationException.class,
            () -> client.readAll(ReadOptions.builder().subscribe(true).build()));
    }

    @Test
    void closedClient_rejectsCalls() {
        DcbClient closing = DcbClient.connect(vertx, config("http://localhost:" + port).build());

        closing.close();
        closing.close();

        assertThrows(IllegalStateException.class, closing::head);
        assertThrows(IllegalStateException.class, () -> closing.read(ReadOptions.defaults()));
    }

    @Test
    void blockingCallOnEventLoop_isRejected() throws Exception {
        CompletableFuture<Throwable> outcome = new CompletableFuture<>();

        vertx.runOnContext(v -> {
            try {
                client.head();
                outcome.complete(null);
            } catch (Throwable t) {
                outcome.complete(t);
            }
        });

        assertInstanceOf(IllegalStateException.class, outcome.get(5, TimeUnit.SECONDS));
    }

    @Test
    void ownedVertx_isClosedWithClient() {
        try (DcbClient owning = DcbClient.connect("http://localhost:" + port)) {
            assertTrue(owning.head().isEmpty());
        }
    }

    private static ClientConfig.Builder config(String url) {
        return ClientConfig.builder()
            .url(url)
            .timeout(Duration.ofSeconds(2));
    }
}
