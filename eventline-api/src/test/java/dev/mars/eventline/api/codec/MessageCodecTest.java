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
import dev.mars.eventline.api.domain.CounterFixtures.Incremented;
import dev.mars.eventline.api.domain.Event;
import dev.mars.eventline.api.error.MessageCodecException;
import dev.mars.eventline.api.error.UnknownEventTypeException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec(CounterFixtures.registry());

    @Test
    void encodesIdTypeAndIsoTimestamps() {
        Incremented event = Incremented.of("c-1", 4);

        EncodedMessage encoded = codec.encode(event);

        assertEquals(event.messageId(), encoded.id());
        assertEquals(CounterFixtures.INCREMENTED, encoded.type());
        assertTrue(encoded.data().contains("\"amount\":4"));
        assertTrue(encoded.data().contains("\"createdAt\":\"" + event.createdAt() + "\""),
            "timestamps should be written as ISO-8601: " + encoded.data());
    }

    @Test
    void decodesByRegisteredType() {
        Incremented event = Incremented.of("c-1", 4);

        Event decoded = codec.decode(CounterFixtures.INCREMENTED, codec.encode(event).data());

        assertEquals(event, decoded);
    }

    @Test
    void ignoresUnknownProperties() {
        String json = "{\"messageId\":\"m-1\",\"createdAt\":\"2025-01-01T00:00:00Z\","
            + "\"aggregateId\":\"c-1\",\"amount\":2,\"addedLater\":true}";

        Incremented decoded = (Incremented) codec.decode(CounterFixtures.INCREMENTED, json);

        assertEquals(2, decoded.amount());
    }

    @Test
    void unknownTypeFails() {
        assertThrows(UnknownEventTypeException.class, () -> codec.decode("counter.renamed", "{}"));
    }

    @Test
    void malformedPayloadFails() {
        MessageCodecException error = assertThrows(MessageCodecException.class,
            () -> codec.decode(CounterFixtures.INCREMENTED, "{not json"));
        assertNotNull(error.getCause());
    }
}
