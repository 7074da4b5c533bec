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

import dev.mars.eventline.api.domain.Event;
import dev.mars.eventline.core.uow.UnitOfWork;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Makes a redelivered event a no-op for one handler. The ledger key combines the handler
 * name with the event id, so several handlers of the same event stay independent.
 *
 * @param <E> the event type
 */
public class IdempotentEventHandler<E extends Event> implements EventHandler<E> {
    private static final Logger logger = LoggerFactory.getLogger(IdempotentEventHandler.class);

    private final String handlerName;
    private final EventHandler<E> delegate;

    private IdempotentEventHandler(String handlerName, EventHandler<E> delegate) {
        this.handlerName = Objects.requireNonNull(handlerName, "Handler name cannot be null");
        this.delegate = Objects.requireNonNull(delegate, "Delegate handler cannot be null");
    }

    public static <E extends Event> IdempotentEventHandler<E> wrap(String handlerName, EventHandler<E> delegate) {
        return new IdempotentEventHandler<>(handlerName, delegate);
    }

    public static String ledgerKey(String handlerName, String eventId) {
        return handlerName + ":" + eventId;
    }

    @Override
    public Future<Void> handle(UnitOfWork uow, E event) {
        String key = ledgerKey(handlerName, event.messageId());
        return uow.ledger().isProcessed(key).compose(processed -> {
            if (processed) {
                logger.info("Event already handled, skipping: handler={}, eventId={}", handlerName, event.messageId());
                return Future.succeededFuture();
            }
            return delegate.handle(uow, event).compose(v -> uow.ledger().markProcessed(key));
        });
    }
}
