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
 * Thrown when an append is rejected because its condition matched an event
 * appended after the condition's position, or because the store refused a
 * duplicate idempotency identifier.
 *
 * <p>The failure is deterministic. Re-read the consistency boundary and re-run
 * the decision instead of retrying the same append.
 */
public class IntegrityException extends DcbException {

    public IntegrityException(String message) {
        super(DcbErrorCodes.INTEGRITY_CONDITION_FAILED, message);
    }

    public IntegrityException(String errorCode, String message) {
        super(errorCode, message);
    }
}
