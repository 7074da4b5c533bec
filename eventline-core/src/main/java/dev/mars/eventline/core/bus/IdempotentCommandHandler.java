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
import dev.mars.eventline.api.domain.CommandCompleted;
import dev.mars.eventline.core.uow.UnitOfWork;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs a command handler at most once per command id.
 *
 * <p>Inside the unit of work the bus opened: if the ledger already holds the command id the
 * handler is skipped; otherwise the handler runs, the id is recorded and, when enabled, a
 * {@link CommandCompleted} event is written to the outbox. All of it commits together.</p>
 *
 * @param <C> the command type
 */
public class IdempotentCommandHandler<C extends Command> implements CommandHandler<C> {
    private static final Logger logger = LoggerFactory.getLogger(IdempotentCommandHandler.class);

    private final CommandHandler<C> delegate;
    private final boolean emitCompletion;

    private IdempotentCommandHandler(CommandHandler<C> delegate, boolean emitCompletion) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate handler cannot be null");
        this.emitCompletion = emitCompletion;
    }

    public static <C extends Command> IdempotentCommandHandler<C> wrap(CommandHandler<C> delegate) {
        return new IdempotentCommandHandler<>(delegate, false);
    }

    /**
     * Like {@link #wrap(CommandHandler)}, also writing a {@link CommandCompleted} event to the outbox.
     */
    public static <C extends Command> IdempotentCommandHandler<C> withCompletionEvent(CommandHandler<C> delegate) {
        return new IdempotentCommandHandler<>(delegate, true);
    }

    @Override
    public Future<Void> handle(UnitOfWork uow, C command) {
        return uow.ledger().isProcessed(command.messageId()).compose(processed -> {
            if (processed) {
                logger.info("Command already processed, skipping: commandId={}, commandType={}",
                    command.messageId(), command.messageType());
                return Future.succeededFuture();
            }
            return delegate.handle(uow, command)
                .compose(v -> uow.ledger().markProcessed(command.messageId()))
                .compose(v -> emitCompletion
                    ? uow.outbox().send(List.of(CommandCompleted.success(command)))
                    : Future.<Void>succeededFuture());
        });
    }
}
