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

package dev.mars.dcb.api.exception;

import dev.mars.dcb.api.error.DcbErrorCodes;

/**
 * Exception thrown when communication with the event store fails.
 * 
 * <p>This exception is thrown for:
 * <ul>
 *   <li>Connection failures</li>
 *   <li>Timeouts</li>
 *   <li>Unexpected HTTP status codes</li>
 *   <li>Live streams closed by the remote side</li>
 * </ul>
 *
 * <p>The failure may be transient. The client never retries on its own.
 */
public class TransportException extends DcbException {

    private final String host;
    private final int port;
    private final boolean isTimeout;

    /**
     * Creates a new transport exception.
     *
     * @param message the error message
     * @param host the target host (may be null)
     * @param port the target port (0 if unknown)
     * @param isTimeout true if this was a timeout error
     */
    public TransportException(String message, String host, int port, boolean isTimeout) {
        super(codeFor(isTimeout), formatMessage(message, host, port, isTimeout));
        this.host = host;
        this.port = port;
        this.isTimeout = isTimeout;
    }

    /**
     * Creates a new transport exception with a cause.
     *
     * @param message the error message
     * @param host the target host (may be null)
     * @param port the target port (0 if unknown)
     * @param isTimeout true if this was a timeout error
     * @param cause the underlying cause
     */
    public TransportException(String message, String host, int port, boolean isTimeout, Throwable cause) {
        super(codeFor(isTimeout), formatMessage(message, host, port, isTimeout), cause);
        this.host = host;
        this.port = port;
        this.isTimeout = isTimeout;
    }

    /**
     * Creates a transport exception with an explicit error code.
     */
    public TransportException(String errorCode, String message, Throwable cause) {
        super(errorCode, formatMessage(message, null, 0, false), cause);
        this.host = null;
        this.port = 0;
        this.isTimeout = false;
    }

    /** Returns the target host, or null if unknown */
    public String getHost() { return host; }

    /** Returns the target port, or 0 if unknown */
    public int getPort() { return port; }

    /** Returns true if this was a timeout error */
    public boolean isTimeout() { return isTimeout; }

    private static String codeFor(boolean isTimeout) {
        return isTimeout ? DcbErrorCodes.TRANSPORT_TIMEOUT : DcbErrorCodes.TRANSPORT_CONNECTION_FAILED;
    }

    private static String formatMessage(String message, String host, int port, boolean isTimeout) {
        StringBuilder sb = new StringBuilder();
        sb.append("Transport Error");
        if (isTimeout) {
            sb.append(" (Timeout)");
        }
        if (host != null) {
            sb.append(" connecting to ").append(host);
            if (port > 0) {
                sb.append(":").append(port);
            }
        }
        sb.append(": ").append(message);
        return sb.toString();
    }
}
