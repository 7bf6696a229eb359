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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.dcb.api.AppendCondition;
import dev.mars.dcb.api.Event;
import dev.mars.dcb.api.Query;
import dev.mars.dcb.api.SequencedEvent;
import dev.mars.dcb.api.error.DcbErrorCodes;
import dev.mars.dcb.api.exception.CorruptionException;
import dev.mars.dcb.api.exception.DcbIoException;
import dev.mars.dcb.api.exception.TransportException;
import dev.mars.dcb.client.config.ClientConfig;
import dev.mars.dcb.client.dto.AppendRequest;
import dev.mars.dcb.client.dto.PositionResponse;
import dev.mars.dcb.client.dto.ReadBatchResponse;
import dev.mars.dcb.client.dto.ReadRequest;
import dev.mars.dcb.client.dto.SequencedEventDto;
import dev.mars.dcb.client.dto.SubscribeRequest;
import dev.mars.dcb.client.dto.WireMapper;
import dev.mars.dcb.client.sse.EventStreamReadStream;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.PoolOptions;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.net.PemTrustOptions;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * HTTP/JSON implementation of {@link DcbTransport} using the Vert.x WebClient.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET  /api/v1/head} - current head position</li>
 *   <li>{@code POST /api/v1/append} - conditional batch append</li>
 *   <li>{@code POST /api/v1/read} - one chunk of a read</li>
 *   <li>{@code POST /api/v1/subscribe} - live event stream as Server-Sent Events</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * Vertx vertx = Vertx.vertx();
 * DcbTransport transport = HttpDcbTransport.create(vertx, ClientConfig.builder()
 *     .url("http://localhost:50051")
 *     .build());
 *
 * transport.head()
 *     .onSuccess(head -> System.out.println("Head: " + head.orElse(null)))
 *     .onFailure(err -> System.err.println("Failed: " + err.getMessage()));
 * }</pre>
 */
public class HttpDcbTransport implements DcbTransport {

    private static final Logger logger = LoggerFactory.getLogger(HttpDcbTransport.class);

    static final String HEAD_PATH = "/api/v1/head";
    static final String APPEND_PATH = "/api/v1/append";
    static final String READ_PATH = "/api/v1/read";
    static final String SUBSCRIBE_PATH = "/api/v1/subscribe";

    private final Vertx vertx;
    private final ClientConfig config;
    private final HttpClientOptions httpClientOptions;
    private final HttpClient httpClient;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final StoreErrorTranslator errorTranslator;
    private final String host;
    private final int port;
    private final boolean ssl;

    private HttpDcbTransport(Vertx vertx, ClientConfig config) {
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.host = config.getHost();
        this.port = config.getPort();
        // A CA certificate only makes sense over TLS, so it switches TLS on
        this.ssl = config.isSsl() || config.getCaPath().isPresent();

        this.httpClientOptions = new HttpClientOptions()
            .setDefaultHost(host)
            .setDefaultPort(port)
            .setSsl(ssl)
            .setConnectTimeout((int) config.getTimeout().toMillis());
        config.getCaPath().ifPresent(caPath ->
            httpClientOptions.setTrustOptions(new PemTrustOptions().addCertValue(readCertificate(caPath))));

        PoolOptions poolOptions = new PoolOptions()
            .setHttp1MaxSize(config.getPoolSize());

        this.httpClient = vertx.createHttpClient(httpClientOptions, poolOptions);
        this.webClient = WebClient.wrap(httpClient);

        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.errorTranslator = new StoreErrorTranslator(objectMapper, host, port);

        logger.info("DCB transport created for {}:{} (SSL: {}, poolSize: {})", host, port, ssl, config.getPoolSize());
    }

    /**
     * Creates a new HTTP transport.
     *
     * @param vertx the Vert.x instance
     * @param config the client configuration
     * @return a new transport instance
     * @throws DcbIoException if the configured CA certificate cannot be read
     */
    public static HttpDcbTransport create(Vertx vertx, ClientConfig config) {
        return new HttpDcbTransport(vertx, config);
    }

    // ========================================================================
    // Store Operations
    // ========================================================================

    @Override
    public Future<Optional<Long>> head() {
        return get(HEAD_PATH)
            .map(response -> Optional.ofNullable(parseResponse(response, PositionResponse.class).position()));
    }

    @Override
    public Future<Long> append(List<Event> events, AppendCondition condition) {
        AppendRequest request = new AppendRequest(WireMapper.toDtos(events), WireMapper.toDto(condition));
        return post(APPEND_PATH, request)
            .map(response -> {
                Long position = parseResponse(response, PositionResponse.class).position();
                if (position == null || position < 1) {
                    throw new CorruptionException("Append response has invalid position " + position);
                }
                return position;
            });
    }

    @Override
    public Future<ReadBatch> read(Query query, Long start, boolean backwards, int limit) {
        ReadRequest request = new ReadRequest(WireMapper.toDto(query), start, backwards, limit);
        return post(READ_PATH, request)
            .map(response -> {
                ReadBatchResponse body = parseResponse(response, ReadBatchResponse.class);
                return new ReadBatch(WireMapper.toSequencedEvents(body.events()), body.head());
            });
    }

    @Override
    public SubscriptionStream<SequencedEvent> subscribe(Query query, Long start) {
        Buffer body = Buffer.buffer(serialize(new SubscribeRequest(WireMapper.toDto(query), start)));

        RequestOptions requestOptions = new RequestOptions()
            .setMethod(HttpMethod.POST)
            .setHost(host)
            .setPort(port)
            .setURI(SUBSCRIBE_PATH)
            .putHeader("Content-Type", "application/json")
            .putHeader("Accept", "text/event-stream")
            .putHeader("Cache-Control", "no-cache");

        // Live streams hold their connection indefinitely, so each gets its own client
        HttpClient streamClient = vertx.createHttpClient(new HttpClientOptions(httpClientOptions));

        logger.debug("Opening live stream from position {} for {}", start, query);
        return new EventStreamReadStream<>(vertx, streamClient, requestOptions, body,
            data -> WireMapper.toSequencedEvent(parseJson(data, SequencedEventDto.class)),
            errorTranslator::fromErrorFrame,
            (status, responseBody) -> errorTranslator.fromResponse(status, responseBody, SUBSCRIBE_PATH));
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Override
    public void close() {
        webClient.close();
        httpClient.close();
        logger.info("DCB transport closed");
    }

    // ========================================================================
    // HTTP Helper Methods
    // ========================================================================

    private Future<HttpResponse<Buffer>> get(String path) {
        return executeRequest(HttpMethod.GET, path, null);
    }

    private Future<HttpResponse<Buffer>> post(String path, Object body) {
        return executeRequest(HttpMethod.POST, path, body);
    }

    private Future<HttpResponse<Buffer>> executeRequest(HttpMethod method, String path, Object body) {
        HttpRequest<Buffer> request = webClient.request(method, port, host, path)
            .ssl(ssl)
            .timeout(config.getTimeout().toMillis())
            .putHeader("Content-Type", "application/json")
            .putHeader("Accept", "application/json");

        Future<HttpResponse<Buffer>> responseFuture;
        if (body != null) {
            responseFuture = request.sendBuffer(Buffer.buffer(serialize(body)));
        } else {
            responseFuture = request.send();
        }

        logger.debug("{} {}", method, path);
        return responseFuture
            .recover(this::handleNetworkError)
            .compose(response -> handleResponse(response, path));
    }

    private Future<HttpResponse<Buffer>> handleResponse(HttpResponse<Buffer> response, String path) {
        int statusCode = response.statusCode();
        if (statusCode >= 200 && statusCode < 300) {
            return Future.succeededFuture(response);
        }
        logger.debug("{} failed with status {}", path, statusCode);
        return Future.failedFuture(errorTranslator.fromResponse(statusCode, response.bodyAsString(), path));
    }

    private Future<HttpResponse<Buffer>> handleNetworkError(Throwable error) {
        return Future.failedFuture(errorTranslator.fromNetworkError(error));
    }

    // ========================================================================
    // JSON Helper Methods
    // ========================================================================

    private String serialize(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TransportException(DcbErrorCodes.INTERNAL_ERROR, "Failed to serialize request body", e);
        }
    }

    private <T> T parseResponse(HttpResponse<Buffer> response, Class<T> type) {
        String body = response.bodyAsString();
        if (body == null || body.isBlank()) {
            throw new CorruptionException("Empty response body where " + type.getSimpleName() + " was expected");
        }
        return parseJson(body, type);
    }

    private <T> T parseJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CorruptionException("Failed to parse " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private static Buffer readCertificate(String caPath) {
        try {
            return Buffer.buffer(Files.readAllBytes(Path.of(caPath)));
        } catch (IOException e) {
            throw new DcbIoException(DcbErrorCodes.IO_CA_CERTIFICATE_UNREADABLE,
                "Cannot read CA certificate " + caPath + ": " + e.getMessage(), e);
        }
    }
}
