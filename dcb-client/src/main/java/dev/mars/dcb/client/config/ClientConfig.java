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

package dev.mars.dcb.client.config;

import dev.mars.dcb.api.error.DcbErrorCodes;
import dev.mars.dcb.api.exception.ValidationException;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration for the DCB event store client.
 * 
 * <p>Use the {@link Builder} to create instances. The store URL is required;
 * every other setting has a default.
 * 
 * <p>Example usage:
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder()
 *     .url("https://events.example.com:50051")
 *     .caPath("/etc/dcb/ca.pem")
 *     .batchSize(500)
 *     .build();
 * }</pre>
 */
public final class ClientConfig {

    /** Store URL used by {@link #fromSystemProperties()} when none is set */
    public static final String DEFAULT_URL = "http://localhost:50051";

    /** Default number of events fetched per read round trip */
    public static final int DEFAULT_BATCH_SIZE = 100;

    /** Default timeout of a single round trip */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** Default connection pool size */
    public static final int DEFAULT_POOL_SIZE = 4;

    /** System property holding the store URL */
    public static final String URL_PROPERTY = "dcb.client.url";
    /** System property holding the CA certificate path */
    public static final String CA_PATH_PROPERTY = "dcb.client.ca-path";
    /** System property holding the read batch size */
    public static final String BATCH_SIZE_PROPERTY = "dcb.client.batch-size";
    /** System property holding the round trip timeout in milliseconds */
    public static final String TIMEOUT_PROPERTY = "dcb.client.timeout-ms";
    /** System property holding the connection pool size */
    public static final String POOL_SIZE_PROPERTY = "dcb.client.pool-size";

    private final String url;
    private final String caPath;
    private final int batchSize;
    private final Duration timeout;
    private final int poolSize;
    private final String host;
    private final int port;
    private final boolean ssl;

    private ClientConfig(Builder builder) {
        if (builder.url == null || builder.url.isBlank()) {
            throw invalid("url must not be empty");
        }
        this.url = builder.url;
        this.caPath = builder.caPath;
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout must not be null");
        this.batchSize = builder.batchSize;
        this.poolSize = builder.poolSize;

        if (batchSize < 1) {
            throw invalid("batchSize must be >= 1");
        }
        if (poolSize < 1) {
            throw invalid("poolSize must be >= 1");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw invalid("timeout must be positive");
        }

        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(DcbErrorCodes.VALIDATION_INVALID_CONFIG, "Invalid url: " + url, e);
        }
        String scheme = uri.getScheme();
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw invalid("url scheme must be http or https: " + url);
        }
        if (uri.getHost() == null) {
            throw invalid("url has no host: " + url);
        }
        this.host = uri.getHost();
        this.ssl = "https".equals(scheme);
        this.port = uri.getPort() > 0 ? uri.getPort() : (ssl ? 443 : 80);
    }

    /** Returns the store URL */
    public String getUrl() { return url; }

    /** Returns the CA certificate path used to verify the server, if configured */
    public Optional<String> getCaPath() { return Optional.ofNullable(caPath); }

    /** Returns the number of events fetched per read round trip */
    public int getBatchSize() { return batchSize; }

    /** Returns the timeout of a single round trip */
    public Duration getTimeout() { return timeout; }

    /** Returns the connection pool size */
    public int getPoolSize() { return poolSize; }

    /** Returns the host parsed from the URL */
    public String getHost() { return host; }

    /** Returns the port parsed from the URL, defaulting by scheme */
    public int getPort() { return port; }

    /** Returns whether TLS is used, true for https URLs */
    public boolean isSsl() { return ssl; }

    /** Creates a new builder; {@link Builder#url(String)} must be set before building */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a configuration from {@code dcb.client.*} system properties,
     * falling back to the defaults, and to {@link #DEFAULT_URL}, for properties
     * that are not set.
     */
    public static ClientConfig fromSystemProperties() {
        Builder builder = builder()
            .url(System.getProperty(URL_PROPERTY, DEFAULT_URL))
            .caPath(System.getProperty(CA_PATH_PROPERTY));
        String batchSize = System.getProperty(BATCH_SIZE_PROPERTY);
        if (batchSize != null) {
            builder.batchSize(parseInt(BATCH_SIZE_PROPERTY, batchSize));
        }
        String timeoutMs = System.getProperty(TIMEOUT_PROPERTY);
        if (timeoutMs != null) {
            builder.timeout(Duration.ofMillis(parseInt(TIMEOUT_PROPERTY, timeoutMs)));
        }
        String poolSize = System.getProperty(POOL_SIZE_PROPERTY);
        if (poolSize != null) {
            builder.poolSize(parseInt(POOL_SIZE_PROPERTY, poolSize));
        }
        return builder.build();
    }

    private static int parseInt(String property, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(DcbErrorCodes.VALIDATION_INVALID_CONFIG,
                "Property " + property + " is not a number: " + value, e);
        }
    }

    private static ValidationException invalid(String message) {
        return new ValidationException(DcbErrorCodes.VALIDATION_INVALID_CONFIG, message);
    }

    /** Builder for creating ClientConfig instances */
    public static final class Builder {
        private String url;
        private String caPath;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int poolSize = DEFAULT_POOL_SIZE;

        private Builder() {}

        /** Sets the store URL, http or https */
        public Builder url(String url) {
            this.url = url;
            return this;
        }

        /** Sets the PEM CA certificate used to verify the server */
        public Builder caPath(String caPath) {
            this.caPath = caPath;
            return this;
        }

        /** Sets the number of events fetched per read round trip */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /** Sets the timeout of a single round trip */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /** Sets the connection pool size */
        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        /** Builds the ClientConfig instance */
        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }

    @Override
    public String toString() {
        return "ClientConfig{" +
                "url='" + url + '\'' +
                ", caPath='" + caPath + '\'' +
                ", batchSize=" + batchSize +
                ", timeout=" + timeout +
                ", poolSize=" + poolSize +
                '}';
    }
}
