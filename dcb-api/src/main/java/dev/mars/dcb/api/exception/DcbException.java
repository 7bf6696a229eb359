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

import dev.mars.dcb.api.error.DcbError;

/**
 * Base exception for all DCB event store errors.
 *
 * <p>Callers only ever see subclasses of this type:
 * <ul>
 *   <li>{@link IntegrityException} - an append condition matched an existing event</li>
 *   <li>{@link TransportException} - the store could not be reached or answered unexpectedly</li>
 *   <li>{@link CorruptionException} - the store returned a structurally invalid payload</li>
 *   <li>{@link DcbIoException} - a local I/O failure</li>
 *   <li>{@link ValidationException} - malformed client-supplied input</li>
 * </ul>
 */
public class DcbException extends RuntimeException {

    private final String errorCode;

    /**
     * Creates a new exception.
     *
     * @param errorCode the error code from {@link dev.mars.dcb.api.error.DcbErrorCodes} (may be null)
     * @param message the error message
     */
    public DcbException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Creates a new exception with a cause.
     *
     * @param errorCode the error code (may be null)
     * @param message the error message
     * @param cause the underlying cause
     */
    public DcbException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /** Returns the error code, or null if not provided */
    public String getErrorCode() { return errorCode; }

    /** Returns this exception as an error record */
    public DcbError toError() {
        return DcbError.of(errorCode, getMessage());
    }
}
