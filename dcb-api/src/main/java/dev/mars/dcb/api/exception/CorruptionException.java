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
 * Thrown when the store or a wire payload is structurally invalid, for example
 * a malformed event envelope or positions that break the requested order.
 * Not retryable.
 */
public class CorruptionException extends DcbException {

    public CorruptionException(String message) {
        super(DcbErrorCodes.CORRUPTION_MALFORMED_PAYLOAD, message);
    }

    public CorruptionException(String errorCode, String message) {
        super(errorCode, message);
    }

    public CorruptionException(String message, Throwable cause) {
        super(DcbErrorCodes.CORRUPTION_MALFORMED_PAYLOAD, message, cause);
    }
}
