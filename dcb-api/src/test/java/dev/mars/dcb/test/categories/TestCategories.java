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

package dev.mars.dcb.test.categories;

/**
 * Test category tags used with JUnit 5 {@code @Tag}.
 *
 * <p>Run one category with {@code mvn test -Dgroups=core}.
 */
public final class TestCategories {

    private TestCategories() {
        // Utility class - no instantiation
    }

    /**
     * Core tests - Fast unit tests for daily development.
     * 
     * <p>These tests should:</p>
     * <ul>
     *   <li>Each test completes in under 1 second</li>
     *   <li>Use in-memory stores or local mock servers only</li>
     *   <li>Not require external infrastructure</li>
     * </ul>
     */
    public static final String CORE = "core";

    /**
     * Integration tests - Client and mock store over real HTTP connections,
     * including live streams that involve more than one thread.
     */
    public static final String INTEGRATION = "integration";
}
