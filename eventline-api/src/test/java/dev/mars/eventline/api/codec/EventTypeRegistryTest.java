package dev.mars.eventline.api.codec;

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

import dev.mars.eventline.api.domain.CounterFixtures;
import dev.mars.eventline.api.error.ConfigurationException;
import dev.mars.eventline.api.error.EventlineErrorCodes;
import dev.mars.eventline.api.error.UnknownEventTypeException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class EventTypeRegistryTest {

    @Test
    void resolvesRegisteredTypes() {
        EventTypeRegistry registry = CounterFixtures.registry();

        assertTrue(registry.contains(CounterFixtures.INCREMENTED));
        assertNotNull(registry.resolve(CounterFixtures.RESET));
        assertEquals(List.of(CounterFixtures.INCREMENTED, CounterFixtures.RESET),
            List.copyOf(registry.eventTypes()));
    }

    @Test
    void unknownTypeFailsToResolve() {
        EventTypeRegistry registry = CounterFixtures.registry();

        assertTrue(registry.find("counter.renamed").isEmpty());
        UnknownEventTypeException error = assertThrows(UnknownEventTypeException.class,
            () -> registry.resolve("counter.renamed"));
        assertEquals(EventlineErrorCodes.UNKNOWN_EVENT_TYPE, error.getCode());
    }

    @Test
    void duplicateRegistrationIsRejected() {
        EventTypeRegistry.Builder builder = EventTypeRegistry.builder()
            .register(CounterFixtures.INCREMENTED, CounterFixtures.Incremented.class);

        assertThrows(ConfigurationException.class,
            () -> builder.register(CounterFixtures.INCREMENTED, CounterFixtures.Reset.class));
    }

    @Test
    void validateCoversNamesEveryMissingType() {
        EventTypeRegistry registry = CounterFixtures.registry();

        assertDoesNotThrow(() -> registry.validateCovers(List.of(CounterFixtures.INCREMENTED)));
        ConfigurationException error = assertThrows(ConfigurationException.class,
            () -> registry.validateCovers(List.of("b.missing", CounterFixtures.RESET, "a.missing")));
        assertEquals(EventlineErrorCodes.EVENT_TYPES_MISSING, error.getCode());
        assertTrue(error.getMessage().contains("a.missing, b.missing"));
    }

    @Test
    void blankTypeIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> EventTypeRegistry.builder().register(" ", CounterFixtures.Reset.class));
    }
}
