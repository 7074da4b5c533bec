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

import dev.mars.eventline.api.domain.Command;
import dev.mars.eventline.api.domain.Event;
import dev.mars.eventline.api.domain.Message;
import dev.mars.eventline.api.error.HandlerException;
import dev.mars.eventline.core.metrics.EventlineMetrics;
import dev.mars.eventline.core.uow.UnitOfWorkFactory;
import dev.mars.eventline.core.uow.UnitOfWorkResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Dispatches a message and every event it causes, breadth first.
 *
 * <p>{@link #handle(Message)} seeds a FIFO queue with the inbound message. For each item
 * taken off the queue:</p>
 * <ul>
 *   <li>an event of this bus's domain is first handed to the {@link EventPublisher}, if one
 *       is configured; a publish failure is logged and dispatch continues</li>
 *   <li>every event handler registered for the event's type runs in its own unit of work;
 *       a failing handler is logged and its siblings still run</li>
 *   <li>a command runs through its single handler in its own unit of work; a failure is
 *       returned to the caller as a {@link HandlerException}</li>
 * </ul>
 * <p>Events committed by those units of work are appended to the queue once all handlers
 * of the current item have finished, so causally earlier events are always handled first.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class MessageBus {
    private static final Logger logger = LoggerFactory.getLogger(MessageBus.class);

    static final String MDC_MESSAGE_ID = "messageId";
    static final String MDC_MESSAGE_TYPE = "messageType";

    private final String domain;
    private final UnitOfWorkFactory<?> unitOfWorkFactory;
    private final HandlerRegistry registry;
    private final EventPublisher publisher;
    private final EventlineMetrics metrics;

    public MessageBus(String domain, UnitOfWorkFactory<?> unitOfWorkFactory, HandlerRegistry registry,
                      EventPublisher publisher, EventlineMetrics metrics) {
        this.domain = Objects.requireNonNull(domain, "Domain cannot be null");
        this.unitOfWorkFactory = Objects.requireNonNull(unitOfWorkFactory, "UnitOfWorkFactory cannot be null");
        this.registry = Objects.requireNonNull(registry, "HandlerRegistry cannot be null");
        this.publisher = publisher;
        this.metrics = metrics != null ? metrics : EventlineMetrics.noop();
    }

    /**
     * Handles {@code message} and everything it causes.
     *
     * @return ids of every handled message in processing order
     */
    public Future<List<String>> handle(Message message) {
        if (message == null) {
            return Future.failedFuture(new IllegalArgumentException("Message cannot be null"));
        }
        Deque<Message> queue = new ArrayDeque<>();
        queue.add(message);
        List<String> handled = new ArrayList<>();
        return drain(queue, handled).map(v -> List.copyOf(handled));
    }

    public String getDomain() {
        return domain;
    }

    public HandlerRegistry getRegistry() {
        return registry;
    }

    /**
     * Works through the queue in a loop while dispatch completes synchronously, and resumes
     * from the completion callback only when a dispatch is still pending.
     */
    private Future<Void> drain(Deque<Message> queue, List<String> handled) {
        Promise<Void> drained = Promise.promise();
        drainFrom(queue, handled, drained);
        return drained.future();
    }

    private void drainFrom(Deque<Message> queue, List<String> handled, Promise<Void> drained) {
        Message next;
        while ((next = queue.poll()) != null) {
            handled.add(next.messageId());
            metrics.recordMessageHandled(next.messageType());
            Future<List<Event>> dispatched = dispatch(next);
            if (!dispatched.isComplete()) {
                dispatched.onComplete(ar -> {
                    if (ar.failed()) {
                        drained.fail(ar.cause());
                        return;
                    }
                    queue.addAll(ar.result());
                    drainFrom(queue, handled, drained);
                });
                return;
            }
            if (dispatched.failed()) {
                drained.fail(dispatched.cause());
                return;
            }
            queue.addAll(dispatched.result());
        }
        drained.complete();
    }

    private Future<List<Event>> dispatch(Message message) {
        return inMessageContext(message, () -> {
            if (message instanceof Event) {
                return handleEvent((Event) message);
            }
            if (message instanceof Command) {
                return handleCommand((Command) message);
            }
            return Future.failedFuture(new IllegalArgumentException(
                "Unsupported message kind: " + message.getClass().getName()));
        });
    }

    /**
     * Runs {@code action} with the message id and type in the MDC, then restores the previous context.
     * Completion callbacks may run on another thread or after dispatch returned, so they call this too.
     */
    private static <T> T inMessageContext(Message message, Supplier<T> action) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        MDC.put(MDC_MESSAGE_ID, message.messageId());
        MDC.put(MDC_MESSAGE_TYPE, message.messageType());
        try {
            return action.get();
        } finally {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }

    private Future<List<Event>> handleEvent(Event event) {
        List<Event> produced = new ArrayList<>();
        Future<Void> chain = publishIfOwned(event);
        for (RegisteredHandler<EventHandler<Event>> handler : registry.eventHandlers(event.eventType())) {
            chain = chain.compose(v -> runEventHandler(handler, event)
                .map(result -> {
                    produced.addAll(result.events());
                    return (Void) null;
                })
                .recover(error -> inMessageContext(event, () -> {
                    logger.error("Event handler failed: handler={}, eventId={}, eventType={}, error={}",
                        handler.name(), event.messageId(), event.eventType(), error.getMessage(), error);
                    metrics.recordHandlerFailure(handler.name());
                    return Future.<Void>succeededFuture();
                })));
        }
        return chain.map(v -> produced);
    }

    private Future<UnitOfWorkResult<Void>> runEventHandler(RegisteredHandler<EventHandler<Event>> handler, Event event) {
        return inMessageContext(event, () -> {
            logger.debug("Dispatching event: handler={}, eventId={}, eventType={}",
                handler.name(), event.messageId(), event.eventType());
            return unitOfWorkFactory.<Void>execute(uow -> handler.handler().handle(uow, event));
        });
    }

    private Future<Void> publishIfOwned(Event event) {
        if (publisher == null || !domain.equals(event.domain())) {
            return Future.succeededFuture();
        }
        Future<Void> published;
        try {
            published = publisher.publish(event);
        } catch (RuntimeException e) {
            published = Future.failedFuture(e);
        }
        if (published == null) {
            published = Future.failedFuture(new IllegalStateException("Publisher returned a null future"));
        }
        return published.recover(error -> inMessageContext(event, () -> {
            logger.error("Failed to publish event: eventId={}, stream={}, error={}",
                event.messageId(), event.stream(), error.getMessage(), error);
            metrics.recordPublishFailure();
            return Future.<Void>succeededFuture();
        }));
    }

    private Future<List<Event>> handleCommand(Command command) {
        Optional<RegisteredHandler<CommandHandler<Command>>> registered = registry.commandHandler(command.getClass());
        if (registered.isEmpty()) {
            logger.error("No handler registered for command: commandId={}, commandType={}",
                command.messageId(), command.messageType());
            return Future.succeededFuture(List.of());
        }
        RegisteredHandler<CommandHandler<Command>> handler = registered.get();
        logger.debug("Dispatching command: handler={}, commandId={}, clientId={}",
            handler.name(), command.messageId(), command.clientId());
        return unitOfWorkFactory.<Void>execute(uow -> handler.handler().handle(uow, command))
            .<List<Event>>map(result -> new ArrayList<>(result.events()))
            .recover(error -> inMessageContext(command, () -> {
                logger.error("Command handler failed: handler={}, commandId={}, error={}",
                    handler.name(), command.messageId(), error.getMessage());
                metrics.recordHandlerFailure(handler.name());
                return Future.<List<Event>>failedFuture(
                    new HandlerException(handler.name(), command.messageId(), error));
            }));
    }
}
