package dev.mars.eventline.core.metrics;

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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class EventlineMetricsTest {

    private SimpleMeterRegistry registry;
    private EventlineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EventlineMetrics("metrics-test");
        metrics.bindTo(registry);
    }

    @Test
    void countersCarryInstanceTag() {
        metrics.recordEventsAppended(3);
        metrics.recordOutboxMessages(2);
        metrics.recordPublishFailure();

        assertEquals(3.0, registry.get("eventline.events.appended").tag("instance", "metrics-test").counter().count());
        assertEquals(2.0, registry.get("eventline.outbox.written").counter().count());
        assertEquals(1.0, registry.get("eventline.publish.failures").counter().count());
    }

    @Test
    void handledMessagesAreAlsoCountedPerType() {
        metrics.recordMessageHandled("order.created");
        metrics.recordMessageHandled("order.created");
        metrics.recordMessageHandled("order.confirmed");

        assertEquals(3.0, registry.get("eventline.messages.handled").counter().count());
        assertEquals(2.0, registry.get("eventline.messages.handled.by.type")
            .tag("type", "order.created").counter().count());
    }

    @Test
    void handlerFailuresAreCountedPerHandler() {
        metrics.recordHandlerFailure("send-confirmation");

        assertEquals(1.0, registry.get("eventline.handler.failures").counter().count());
        assertEquals(1.0, registry.get("eventline.handler.failures.by.handler")
            .tag("handler", "send-confirmation").counter().count());
    }

    @Test
    void consumerRecordsAreCountedPerConsumer() {
        metrics.recordConsumerRecords("label-printer", 4);
        metrics.recordConsumerFailure("consumer-id");

        assertEquals(4.0, registry.get("eventline.consumer.records.processed").counter().count());
        assertEquals(4.0, registry.get("eventline.consumer.records.processed.by.consumer")
            .tag("consumer", "label-printer").counter().count());
        assertEquals(1.0, registry.get("eventline.consumer.iterations.failed").counter().count());
    }

    @Test
    void unitOfWorkDurationIsTaggedByOutcome() {
        metrics.recordUnitOfWork(Duration.ofMillis(5), true);
        metrics.recordUnitOfWork(Duration.ofMillis(7), false);
        metrics.recordUnitOfWork(Duration.ofMillis(9), false);

        assertEquals(1, registry.get("eventline.uow.duration").tag("outcome", "committed").timer().count());
        assertEquals(2, registry.get("eventline.uow.duration").tag("outcome", "rolled_back").timer().count());
    }

    @Test
    void unboundMetricsIgnoreRecords() {
        EventlineMetrics noop = EventlineMetrics.noop();

        assertDoesNotThrow(() -> {
            noop.recordMessageHandled("order.created");
            noop.recordHandlerFailure("h");
            noop.recordEventsAppended(1);
            noop.recordConsumerRecords("c", 1);
            noop.recordUnitOfWork(Duration.ofMillis(1), true);
        });
        assertEquals("noop", noop.getInstanceId());
    }
}
