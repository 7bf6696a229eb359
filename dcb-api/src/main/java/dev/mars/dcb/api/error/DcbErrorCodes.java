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

package dev.mars.dcb.api.error;

/**
 * Standard error codes for DCB event store failures.
 * 
 * Error code ranges:
 * - DCBERR0001-0049: General/System errors
 * - DCBERR0050-0099: Integrity errors
 * - DCBERR0100-0149: Transport errors
 * - DCBERR0150-0199: Corruption errors
 * - DCBERR0200-0249: Local I/O errors
 * - DCBERR0250-0299: Validation errors
 */
public final class DcbErrorCodes {

    private DcbErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "DCBERR0001";

    // ========================================================================
    // Integrity Errors (0050-0099)
    // ========================================================================
    public static final String INTEGRITY_CONDITION_FAILED = "DCBERR0050";
    public static final String INTEGRITY_DUPLICATE_UUID = "DCBERR0051";

    // ========================================================================
    // Transport Errors (0100-0149)
    // ========================================================================
    public static final String TRANSPORT_CONNECTION_FAILED = "DCBERR0100";
    public static final String TRANSPORT_TIMEOUT = "DCBERR0101";
    public static final String TRANSPORT_UNEXPECTED_STATUS = "DCBERR0102";
    public static final String TRANSPORT_STREAM_CLOSED = "DCBERR0103";
    public static final String TRANSPORT_INTERRUPTED = "DCBERR0104";

    // ========================================================================
    // Corruption Errors (0150-0199)
    // ========================================================================
    public static final String CORRUPTION_MALFORMED_PAYLOAD = "DCBERR0150";
    public static final String CORRUPTION_INVALID_EVENT = "DCBERR0151";
    public static final String CORRUPTION_OUT_OF_ORDER = "DCBERR0152";

    // ========================================================================
    // Local I/O Errors (0200-0249)
    // ========================================================================
    public static final String IO_CA_CERTIFICATE_UNREADABLE = "DCBERR0200";

    // ========================================================================
    // Validation Errors (0250-0299)
    // ========================================================================
    public static final String VALIDATION_INVALID_ARGUMENT = "DCBERR0250";
    public static final String VALIDATION_INVALID_UUID = "DCBERR0251";
    public static final String VALIDATION_EMPTY_APPEND = "DCBERR0252";
    public static final String VALIDATION_INVALID_CONFIG = "DCBERR0253";

    /**
     * Returns true if the code belongs to the integrity range.
     */
    public static boolean isIntegrity(String code) {
        return inRange(code, 50, 99);
    }

    /**
     * Returns true if the code belongs to the corruption range.
     */
    public static boolean isCorruption(String code) {
        return inRange(code, 150, 199);
    }

    /**
     * Returns true if the code belongs to the validation range.
     */
    public static boolean isValidation(String code) {
        return inRange(code, 250, 299);
    }

    private static boolean inRange(String code, int low, int high) {
        if (code == null || !code.startsWith("DCBERR") || code.length() != 10) {
            return false;
        }
        try {
            int value = Integer.parseInt(code.substring(6));
            return value >= low && value <= high;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
