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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.dcb.api.error.DcbErrorCodes;
import dev.mars.dcb.api.exception.CorruptionException;
import dev.mars.dcb.api.exception.DcbException;
import dev.mars.dcb.api.exception.IntegrityException;
import dev.mars.dcb.api.exception.TransportException;
import dev.mars.dcb.api.exception.ValidationException;
import dev.mars.dcb.client.dto.ErrorResponse;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies store failures into the client's error taxonomy.
 *
 * <p>Mapping for error responses:
 * <ul>
 *   <li>integrity code or HTTP 409 - {@link IntegrityException}</li>
 *   <li>corruption code - {@link CorruptionException}</li>
 *   <li>validation code or HTTP 400 - {@link ValidationException}</li>
 *   <li>anything else - {@link TransportException}</li>
 * </ul>
 */
public final class StoreErrorTranslator {

    private final ObjectMapper objectMapper;
    private final String host;
    private final int port;

    public StoreErrorTranslator(ObjectMapper objectMapper, String host, int port) {
        this.objectMapper = objectMapper;
        this.host = host;
        this.port = port;
    }

    /**
     * Translates a non-2xx response.
     *
     * @param statusCode the HTTP status code
     * @param body the response body, may be null or not JSON
     * @param path the request path
     */
    public DcbException fromResponse(int statusCode, String body, String path) {
        ErrorResponse error = parseError(body);
        String code = error != null ? error.code() : null;
        String message = error != null && error.message() != null
            ? error.message()
            : (body != null && !body.isBlank() ? body : "HTTP " + statusCode);

        if (DcbErrorCodes.isIntegrity(code) || (code == null && statusCode == 409)) {
            return new IntegrityException(code != null ? code : DcbErrorCodes.INTEGRITY_CONDITION_FAILED, message);
        }
        if (DcbErrorCodes.isCorruption(code)) {
            return new CorruptionException(code, message);
        }
        if (DcbErrorCodes.isValidation(code) || (code == null && statusCode == 400)) {
            return new ValidationException(code != null ? code : DcbErrorCodes.VALIDATION_INVALID_ARGUMENT, message);
        }
        return new TransportException(DcbErrorCodes.TRANSPORT_UNEXPECTED_STATUS,
            "HTTP " + statusCode + " from " + host + ":" + port + path + (code != null ? " (" + code + ")" : "") + ": " + message,
            null);
    }

    /**
     * Translates an error frame received on a live stream.
     */
    public DcbException fromErrorFrame(String data) {
        ErrorResponse error = parseError(data);
        if (error == null) {
            return new CorruptionException("Malformed error frame on live stream: " + data);
        }
        // Error frames have no status code; 500 routes unknown codes to TransportException
        return fromResponse(500, data, "/api/v1/subscribe");
    }

    /**
     * Translates a failure to reach the store. Errors already in the taxonomy pass through.
     */
    public DcbException fromNetworkError(Throwable error) {
        if (error instanceof DcbException) {
            return (DcbException) error;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        boolean isTimeout = error instanceof TimeoutException
            || message.toLowerCase().contains("timeout")
            || message.toLowerCase().contains("timed out");
        if (error instanceof ConnectException || error instanceof UnknownHostException) {
            message = "Connection failed: " + message;
        }
        return new TransportException(message, host, port, isTimeout, error);
    }

    private ErrorResponse parseError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, ErrorResponse.class);
        } catch (Exception e) {
            return null;
        }
    }
}
