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
import dev.mars.dcb.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StoreErrorTranslator.
 */
@Tag(TestCategories.CORE)
class StoreErrorTranslatorTest {

    private final StoreErrorTranslator translator = new StoreErrorTranslator(new ObjectMapper(), "store", 50051);

    @Test
    void integrityCode_mapsToIntegrityException_whateverTheStatus() {
        DcbException error = translator.fromResponse(500,
            "{\"code\":\"DCBERR0051\",\"message\":\"duplicate uuid\"}", "/api/v1/append");

        assertInstanceOf(IntegrityException.class, error);
        assertEquals(DcbErrorCodes.INTEGRITY_DUPLICATE_UUID, error.getErrorCode());
        assertEquals("duplicate uuid", error.getMessage());
    }

    @Test
    void conflictWithoutCode_mapsToIntegrityException() {
        DcbException error = translator.fromResponse(409, "condition failed", "/api/v1/append");

        assertInstanceOf(IntegrityException.class, error);
        assertEquals(DcbErrorCodes.INTEGRITY_CONDITION_FAILED, error.getErrorCode());
        assertEquals("condition failed", error.getMessage());
    }

    @Test
    void corruptionCode_mapsToCorruptionException() {
        DcbException error = translator.fromResponse(500,
            "{\"code\":\"DCBERR0150\",\"message\":\"bad page\"}", "/api/v1/read");

        assertInstanceOf(CorruptionException.class, error);
    }

    @Test
    void badRequest_mapsToValidationException() {
        DcbException error = translator.fromResponse(400, null, "/api/v1/read");

        assertInstanceOf(ValidationException.class, error);
        assertEquals(DcbErrorCodes.VALIDATION_INVALID_ARGUMENT, error.getErrorCode());
        assertEquals("HTTP 400", error.getMessage());
    }

    @Test
    void otherStatus_mapsToTransportException() {
        DcbException error = translator.fromResponse(503,
            "{\"code\":\"DCBERR0001\",\"message\":\"overloaded\"}", "/api/v1/head");

        assertInstanceOf(TransportException.class, error);
        assertEquals(DcbErrorCodes.TRANSPORT_UNEXPECTED_STATUS, error.getErrorCode());
        assertTrue(error.getMessage().contains("503"));
        assertTrue(error.getMessage().contains("store:50051/api/v1/head"));
        assertTrue(error.getMessage().contains("overloaded"));
    }

    @Test
    void errorFrame_isClassifiedByCode() {
        assertInstanceOf(IntegrityException.class,
            translator.fromErrorFrame("{\"code\":\"DCBERR0050\",\"message\":\"x\"}"));
        assertInstanceOf(TransportException.class,
            translator.fromErrorFrame("{\"code\":\"DCBERR0001\",\"message\":\"x\"}"));
    }

    @Test
    void unparseableErrorFrame_isCorruption() {
        assertInstanceOf(CorruptionException.class, translator.fromErrorFrame("<html>"));
    }

    @Test
    void networkErrors_becomeTransportExceptions() {
        TransportException refused = (TransportException) translator.fromNetworkError(
            new ConnectException("Connection refused"));
        TransportException timedOut = (TransportException) translator.fromNetworkError(
            new TimeoutException("no answer"));

        assertFalse(refused.isTimeout());
        assertTrue(refused.getMessage().contains("Connection failed"));
        assertEquals("store", refused.getHost());
        assertTrue(timedOut.isTimeout());
        assertEquals(DcbErrorCodes.TRANSPORT_TIMEOUT, timedOut.getErrorCode());
    }

    @Test
    void taxonomyErrors_passThrough() {
        CorruptionException original = new CorruptionException("bad");

        assertSame(original, translator.fromNetworkError(original));
    }
}
