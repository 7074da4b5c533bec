package dev.mars.eventline.db;

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

import dev.mars.eventline.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class EventlineManagerTest {

    @Test
    @DisplayName("Consumer loops are capped one below the pool size")
    void consumerLoopLimitLeavesOneConnectionFree() {
        // Given the default pool and the smallest accepted pool
        // Then each leaves exactly one connection for handler units of work
        assertEquals(15, EventlineManager.maxConsumerLoops(16));
        assertEquals(1, EventlineManager.maxConsumerLoops(2));
    }
}
