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
import dev.mars.dcb.api.error.DcbErrorCodes;
import dev.mars.dcb.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for exception classes and error codes.
 */
@Tag(TestCategories.CORE)
class ExceptionTest {

    // ========================================================================
    // Taxonomy
    // ========================================================================

    @Test
    void allExceptions_shareBaseType() {
        assertInstanceOf(DcbException.class, new IntegrityException("x"));
        assertInstanceOf(DcbException.class, new CorruptionException("x"));
        assertInstanceOf(DcbException.class, new ValidationException("x"));
        assertInstanceOf(DcbException.class, new DcbIoException(DcbErrorCodes.IO_CA_CERTIFICATE_UNREADABLE, "x", null));
        assertInstanceOf(DcbException.class, new TransportException("x", null, 0, false));
    }

    @Test
    void integrityException_defaultsToConditionFailedCode() {
        IntegrityException ex = new IntegrityException("condition failed");

        assertEquals(DcbErrorCodes.INTEGRITY_CONDITION_FAILED, ex.getErrorCode());
        assertEquals("condition failed", ex.getMessage());
    }

    @Test
    void toError_carriesCodeAndMessage() {
        DcbError error = new CorruptionException("bad envelope").toError();

        assertEquals(DcbErrorCodes.CORRUPTION_MALFORMED_PAYLOAD, error.code());
        assertEquals("bad envelope", error.message());
    }

    // ========================================================================
    // TransportException
    // ========================================================================

    @Test
    void transportException_formatsHostAndTimeout() {
        TransportException ex = new TransportException("read timed out", "store.local", 50051, true);

        assertTrue(ex.isTimeout());
        assertEquals(DcbErrorCodes.TRANSPORT_TIMEOUT, ex.getErrorCode());
        assertTrue(ex.getMessage().contains("(Timeout)"));
        assertTrue(ex.getMessage().contains("store.local:50051"));
        assertEquals("store.local", ex.getHost());
        assertEquals(50051, ex.getPort());
    }

    @Test
    void transportException_withoutHost_omitsLocation() {
        TransportException ex = new TransportException("refused", null, 0, false);

        assertFalse(ex.isTimeout());
        assertEquals(DcbErrorCodes.TRANSPORT_CONNECTION_FAILED, ex.getErrorCode());
        assertEquals("Transport Error: refused", ex.getMessage());
    }

    // ========================================================================
    // Error code ranges
    // ========================================================================

    @Test
    void errorCodeRanges_classifyCodes() {
        assertTrue(DcbErrorCodes.isIntegrity(DcbErrorCodes.INTEGRITY_DUPLICATE_UUID));
        assertTrue(DcbErrorCodes.isCorruption(DcbErrorCodes.CORRUPTION_OUT_OF_ORDER));
        assertTrue(DcbErrorCodes.isValidation(DcbErrorCodes.VALIDATION_EMPTY_APPEND));
        assertFalse(DcbErrorCodes.isIntegrity(DcbErrorCodes.TRANSPORT_TIMEOUT));
    }

    @Test
    void errorCodeRanges_rejectForeignCodes() {
        assertFalse(DcbErrorCodes.isIntegrity(null));
        assertFalse(DcbErrorCodes.isIntegrity("PGQERR0050"));
        assertFalse(DcbErrorCodes.isCorruption("DCBERRxxxx"));
    }
}
