package dev.mars.eventline.test.categories;

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

/**
 * Test category constants used with JUnit 5 {@code @Tag} annotations to select test
 * subsets through Maven profiles.
 *
 * <h3>Test Categories:</h3>
 * <ul>
 *   <li><strong>CORE</strong> - Fast unit tests against the in-memory store and broker</li>
 *   <li><strong>INTEGRATION</strong> - Tests with TestContainers and a real PostgreSQL</li>
 *   <li><strong>FLAKY</strong> - Unstable tests needing investigation</li>
 * </ul>
 *
 * <h3>Maven Profile Usage:</h3>
 * <pre>{@code
 * # Daily development (core tests only)
 * mvn test
 *
 * # PostgreSQL integration suite
 * mvn test -Pintegration-tests
 *
 * # Everything except flaky tests
 * mvn test -Pall-tests
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-26
 * @version 1.0
 * @see org.junit.jupiter.api.Tag
 */
public final class TestCategories {

    /**
     * Core tests - no external infrastructure, each test well under a second.
     */
    public static final String CORE = "core";

    /**
     * Integration tests - Testcontainers PostgreSQL, schema applied per test class.
     */
    public static final String INTEGRATION = "integration";

    /**
     * Flaky tests - excluded from every profile until fixed.
     */
    public static final String FLAKY = "flaky";

    private TestCategories() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
