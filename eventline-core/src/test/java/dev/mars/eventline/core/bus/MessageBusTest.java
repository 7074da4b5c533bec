package dev.mars.eventline.core.bus;

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

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import dev.mars.eventline.api.codec.MessageCodec;
import dev.mars.eventline.api.error.HandlerException;
import dev.mars.eventline.core.InMemoryUnitOfWorks;
import dev.mars.eventline.core.metrics.EventlineMetrics;
import dev.mars.eventline.core.uow.UnitOfWorkFactory;
import dev.mars.eventline.test.categories.TestCategories;
import dev.mars.eventline.test.domain.AddOrderItem;
import dev.mars.eventline.test.domain.Order;
import dev.mars.eventline.test.domain.OrderCreated;
import dev.mars.eventline.test.domain.OrderFixtures;
import dev.mars.eventline.test.domain.OrderItemAdded;
import dev.mars.eventline.test.domain.PlaceOrder;
import dev.mars.eventline.test.domain.ShipmentRequested;
import dev.mars.eventline.test.memory.InMemoryDatabase;
import dev.mars.eventline.test.memory.InMemoryStreamBroker;
import dev.mars.eventline.test.memory.InMemoryTransaction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.mars.eventline.core.InMemoryUnitOfWorks.await;
import static dev.mars.eventline.core.InMemoryUnitOfWorks.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class MessageBusTest {

    private InMemoryDatabase database;
    private MessageCodec codec;
    private UnitOfWorkFactory<InMemoryTransaction> factory;
    private HandlerRegistry handlers;
    private SimpleMeterRegistry meterRegistry;
    private EventlineMetrics metrics;
    private final List<String> seen = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        database = new InMemoryDatabase();
        codec = OrderFixtures.codec();
        meterRegistry = new SimpleMeterRegistry();
        metrics = new EventlineMetrics("bus-test");
        metrics.bindTo(meterRegistry);
        factory = InMemoryUnitOfWorks.factory(database, codec, metrics);
        handlers = new HandlerRegistry();
        seen.clear();
    }

    private MessageBus bus(EventPublisher publisher) {
        return new MessageBus("order", factory, handlers, publisher, metrics);
    }

    @Test
    @DisplayName("Events caused by a handler are handled after the event that caused them")
    void causalOrdering() throws Exception {
        // Given an order that already exists
        OrderCreated created = (OrderCreated) await(factory.execute(uow -> {
            uow.repository().add(Order.create("order-1", "customer-1"));
            return Future.succeededFuture();
        })).events().get(0);

        // And a handler of A that raises B
        handlers.onEvent(OrderCreated.STREAM, "add-welcome-item", (uow, event) -> {
            seen.add("A");
            return uow.repository().get(((OrderCreated) event).aggregateId(), OrderFixtures.ORDER_FACTORY)
                .map(order -> {
                    order.addItem("welcome-pack", 1, 0);
                    return null;
                });
        });
        handlers.onEvent(OrderItemAdded.STREAM, "audit", (uow, event) -> {
            seen.add("B");
            return Future.succeededFuture();
        });

        // When A is handled
        List<String> handled = await(bus(null).handle(created));

        // Then A is processed before B and both ids are reported in order
        assertEquals(List.of("A", "B"), seen);
        assertEquals(2, handled.size());
        assertEquals(created.messageId(), handled.get(0));
        assertEquals(database.committedEvents("order-1").get(1).id(), handled.get(1));
    }

    @Test
    void commandEventsAreDispatchedBreadthFirst() throws Exception {
        handlers.onCommand(PlaceOrder.class, "place-order", (uow, command) -> {
            Order order = uow.repository().add(Order.create(command.orderId(), command.customerId()));
            order.addItem("sku-1", 1, 100);
            return Future.succeededFuture();
        });
        handlers.onEvent(OrderCreated.STREAM, "first", (uow, event) -> {
            seen.add("created");
            return Future.succeededFuture();
        });
        handlers.onEvent(OrderItemAdded.STREAM, "second", (uow, event) -> {
            seen.add("item");
            return Future.succeededFuture();
        });
        PlaceOrder command = PlaceOrder.of("client-1", "order-1", "customer-1");

        List<String> handled = await(bus(null).handle(command));

        assertEquals(3, handled.size());
        assertEquals(command.messageId(), handled.get(0));
        assertEquals(List.of("created", "item"), seen);
        assertEquals(3.0, meterRegistry.get("eventline.messages.handled").counter().count());
    }

    @Test
    void failingEventHandlerDoesNotStopSiblings() throws Exception {
        handlers.onEvent(ShipmentRequested.STREAM, "broken", (uow, event) ->
            Future.failedFuture(new IllegalStateException("carrier offline")));
        handlers.onEvent(ShipmentRequested.STREAM, "healthy", (uow, event) -> {
            seen.add("healthy");
            return Future.succeededFuture();
        });

        List<String> handled = await(bus(null).handle(ShipmentRequested.of("order-1", "dhl")));

        assertEquals(1, handled.size());
        assertEquals(List.of("healthy"), seen);
        assertEquals(1.0, meterRegistry.get("eventline.handler.failures").counter().count());
        assertEquals(1, database.rollbackCount());
    }

    @Test
    void throwingEventHandlerIsIsolatedToo() throws Exception {
        handlers.onEvent(ShipmentRequested.STREAM, "throws", (uow, event) -> {
            throw new IllegalArgumentException("bad payload");
        });
        handlers.onEvent(ShipmentRequested.STREAM, "after", (uow, event) -> {
            seen.add("after");
            return Future.succeededFuture();
        });

        await(bus(null).handle(ShipmentRequested.of("order-1", "dhl")));

        assertEquals(List.of("after"), seen);
    }

    @Test
    void commandFailurePropagatesAsHandlerException() throws Exception {
        handlers.onCommand(AddOrderItem.class, "add-item", (uow, command) ->
            uow.repository().get(command.orderId(), OrderFixtures.ORDER_FACTORY).mapEmpty());
        AddOrderItem command = AddOrderItem.of("client-1", "missing-order", "sku", 1, 10);

        Throwable failure = awaitFailure(bus(null).handle(command));

        assertTrue(failure instanceof HandlerException);
        HandlerException handlerException = (HandlerException) failure;
        assertEquals("add-item", handlerException.getHandlerName());
        assertEquals(command.messageId(), handlerException.getMessageId());
        assertNotNull(handlerException.getCause());
    }

    @Test
    void missingCommandHandlerIsLoggedNotThrown() throws Exception {
        PlaceOrder command = PlaceOrder.of("client-1", "order-1", "customer-1");

        List<String> handled = await(bus(null).handle(command));

        assertEquals(List.of(command.messageId()), handled);
        assertEquals(0, database.commitCount());
    }

    @Test
    void onlyEventsOfOwnDomainArePublished() throws Exception {
        InMemoryStreamBroker broker = new InMemoryStreamBroker();
        MessageBus bus = bus(new BrokerEventPublisher(broker, codec));
        OrderCreated own = OrderCreated.of("order-1", "customer-1");

        await(bus.handle(own));
        await(bus.handle(ShipmentRequested.of("order-1", "dhl")));

        assertEquals(1, broker.records(OrderCreated.STREAM).size());
        assertTrue(broker.records(ShipmentRequested.STREAM).isEmpty());
        assertEquals(own, codec.decode(OrderCreated.STREAM, broker.records(OrderCreated.STREAM).get(0).data()));
    }

    @Test
    void publishFailureDoesNotBlockHandlers() throws Exception {
        handlers.onEvent(OrderCreated.STREAM, "projector", (uow, event) -> {
            seen.add("projected");
            return Future.succeededFuture();
        });
        MessageBus bus = bus(event -> Future.failedFuture(new IllegalStateException("broker down")));

        await(bus.handle(OrderCreated.of("order-1", "customer-1")));

        assertEquals(List.of("projected"), seen);
        assertEquals(1.0, meterRegistry.get("eventline.publish.failures").counter().count());
    }

    @Test
    @DisplayName("A command raising ten thousand events is handled without exhausting the stack")
    void largeCascadeIsDrainedIteratively() throws Exception {
        // Given a command handler that raises one creation plus ten thousand item events
        int items = 10_000;
        AtomicInteger itemsHandled = new AtomicInteger();
        handlers.onCommand(PlaceOrder.class, "bulk-order", (uow, command) -> {
            Order order = uow.repository().add(Order.create(command.orderId(), command.customerId()));
            for (int i = 0; i < items; i++) {
                order.addItem("sku-" + i, 1, 1);
            }
            return Future.succeededFuture();
        });
        handlers.onEvent(OrderItemAdded.STREAM, "count-items", (uow, event) -> {
            itemsHandled.incrementAndGet();
            return Future.succeededFuture();
        });

        // When the command is handled over a store that completes synchronously
        List<String> handled = await(bus(null).handle(PlaceOrder.of("client-1", "order-bulk", "customer-1")));

        // Then every queued message is processed in order
        assertEquals(items + 2, handled.size());
        assertEquals(items, itemsHandled.get());
        assertEquals(items + 1, database.committedEvents("order-bulk").size());
    }

    @Test
    @DisplayName("Handler failures completing after dispatch are still logged with message context")
    void lateHandlerFailureKeepsMessageContext() throws Exception {
        // Given a handler whose result completes after dispatch has returned
        Promise<Void> pending = Promise.promise();
        handlers.onEvent(ShipmentRequested.STREAM, "slow-carrier", (uow, event) -> pending.future());
        List<Map<String, String>> failureContexts = new CopyOnWriteArrayList<>();
        Logger busLogger = (Logger) LoggerFactory.getLogger(MessageBus.class);
        AppenderBase<ILoggingEvent> appender = new AppenderBase<>() {
            @Override
            protected void append(ILoggingEvent event) {
                if (event.getFormattedMessage().startsWith("Event handler failed")) {
                    failureContexts.add(new HashMap<>(event.getMDCPropertyMap()));
                }
            }
        };
        appender.start();
        busLogger.addAppender(appender);
        try {
            ShipmentRequested event = ShipmentRequested.of("order-1", "dhl");
            Future<List<String>> handling = bus(null).handle(event);
            assertFalse(handling.isComplete());

            // When the handler fails from outside the dispatching call
            pending.fail(new IllegalStateException("carrier timeout"));
            await(handling);

            // Then the failure log carries the message id and type
            assertEquals(1, failureContexts.size());
            assertEquals(event.messageId(), failureContexts.get(0).get(MessageBus.MDC_MESSAGE_ID));
            assertEquals(event.messageType(), failureContexts.get(0).get(MessageBus.MDC_MESSAGE_TYPE));
            assertNull(MDC.get(MessageBus.MDC_MESSAGE_ID));
        } finally {
            busLogger.detachAppender(appender);
            appender.stop();
        }
    }

    @Test
    void nullMessageIsRejected() throws Exception {
        assertTrue(awaitFailure(bus(null).handle(null)) instanceof IllegalArgumentException);
    }
}
