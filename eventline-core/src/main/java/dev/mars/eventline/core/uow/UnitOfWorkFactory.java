package dev.mars.eventline.core.uow;

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

import dev.mars.eventline.api.consumer.ConsumerRepository;
import dev.mars.eventline.api.ledger.ProcessedMessageLedger;
import dev.mars.eventline.api.outbox.Outbox;
import dev.mars.eventline.api.store.EventStore;
import dev.mars.eventline.api.tx.TransactionRunner;
import dev.mars.eventline.core.metrics.EventlineMetrics;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Opens a fresh unit of work per call, each on its own transaction.
 *
 * <pre>{@code
 * factory.execute(uow -> uow.repository().get(orderId, Order::new)
 *         .map(order -> { order.confirm(); return order.getId(); }))
 *     .onSuccess(result -> logger.info("Committed {} events", result.events().size()));
 * }</pre>
 *
 * <p>When the work succeeds, pending events are flushed and the transaction commits. When
 * the work fails, nothing is drained and the transaction rolls back. A failure while
 * flushing or committing also rolls back and fails the returned future.</p>
 *
 * @param <C> transaction handle type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class UnitOfWorkFactory<C> {
    private static final Logger logger = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    private final TransactionRunner<C> transactionRunner;
    private final EventStore<C> eventStore;
    private final Outbox<C> outbox;
    private final ProcessedMessageLedger<C> ledger;
    private final ConsumerRepository<C> consumerRepository;
    private final EventlineMetrics metrics;

    public UnitOfWorkFactory(TransactionRunner<C> transactionRunner, EventStore<C> eventStore, Outbox<C> outbox,
                             ProcessedMessageLedger<C> ledger, ConsumerRepository<C> consumerRepository,
                             EventlineMetrics metrics) {
        this.transactionRunner = Objects.requireNonNull(transactionRunner, "TransactionRunner cannot be null");
        this.eventStore = Objects.requireNonNull(eventStore, "EventStore cannot be null");
        this.outbox = Objects.requireNonNull(outbox, "Outbox cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "ProcessedMessageLedger cannot be null");
        this.consumerRepository = consumerRepository;
        this.metrics = metrics != null ? metrics : EventlineMetrics.noop();
    }

    public <T> Future<UnitOfWorkResult<T>> execute(Function<UnitOfWork, Future<T>> work) {
        Objects.requireNonNull(work, "Work cannot be null");
        long started = System.nanoTime();
        AtomicReference<TransactionalUnitOfWork<C>> current = new AtomicReference<>();

        Future<UnitOfWorkResult<T>> outcome = transactionRunner.withTransaction(tx -> {
            TransactionalUnitOfWork<C> uow = new TransactionalUnitOfWork<>(tx, eventStore, outbox, ledger,
                consumerRepository, metrics);
            current.set(uow);
            try {
                uow.begin();
            } catch (RuntimeException e) {
                return Future.failedFuture(e);
            }

            Future<T> result;
            try {
                result = work.apply(uow);
            } catch (RuntimeException e) {
                result = Future.failedFuture(e);
            }
            if (result == null) {
                result = Future.failedFuture(new IllegalStateException("Unit of work returned a null future"));
            }
            return result
                .compose(value -> uow.flush().map(events -> new UnitOfWorkResult<>(value, events)))
                .onFailure(error -> uow.markRollingBack());
        });

        return outcome.onComplete(ar -> {
            TransactionalUnitOfWork<C> uow = current.get();
            if (uow != null) {
                if (ar.failed()) {
                    uow.markRollingBack();
                }
                uow.close();
            }
            metrics.recordUnitOfWork(Duration.ofNanos(System.nanoTime() - started), ar.succeeded());
            if (ar.failed()) {
                logger.debug("Unit of work rolled back: {}", ar.cause().getMessage());
            }
        });
    }
}
