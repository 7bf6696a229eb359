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
 * Immutable error record as reported by a DCB event store.
 *
 * @param code    The standard error code (e.g., DCBERR0050)
 * @param message Human-readable error message
 */
public record DcbError(
    String code,
    String message
) {
    /**
     * Creates an error with code and message.
     */
    public static DcbError of(String code, String message) {
        return new DcbError(code, message);
    }
}
